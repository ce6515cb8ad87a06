package radish.cfradial;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import radish.CfRadialFixture;
import radish.model.MomentData;
import radish.model.SweepData;
import radish.model.SweepMetadata;
import radish.model.VolumeData;
import radish.model.VolumeMetadata;
import radish.system.DecodeException;
import radish.system.NotFoundException;
import radish.system.SchemaException;
import ucar.ma2.DataType;

public class CfRadial1ReaderTest
{
	@TempDir
	Path m_oDir;


	private static CfRadial1Reader parallelReader(int nThreads)
	{
		ConventionMapper oMapper = new ConventionMapper();
		return new CfRadial1Reader(oMapper, new MetadataExtractor(), new VolumeMaterializer(oMapper, nThreads));
	}


	@Test
	public void describesItself()
	{
		CfRadial1Reader oReader = new CfRadial1Reader();
		assertEquals("cfradial1", oReader.getName());
		assertFalse(oReader.getDescription().isEmpty());
	}


	@Test
	public void decodesTwoSweepVolume()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().dbz().write(m_oDir, "volume.nc");
		VolumeData oVolume = new CfRadial1Reader().read(oPath);
		assertEquals(2, oVolume.getNumSweeps());

		SweepData oFirst = oVolume.getSweep(0);
		assertEquals(100, oFirst.getNumRays());
		assertEquals(500, oFirst.getNumGates());
		assertEquals(100, oFirst.getAzimuth().length);
		assertEquals(100, oFirst.getElevation().length);
		assertEquals(100, oFirst.getTime().length);
		assertEquals(Arrays.asList("DBZ"), oFirst.getMomentNames());
		assertTrue(oFirst.hasMoment("DBZ"));
		assertFalse(oFirst.hasMoment("dbz"));

		MomentData oDbz = oFirst.getMoment("DBZ");
		assertEquals("DBZ", oDbz.getName());
		assertEquals("dBZ", oDbz.getUnits());
		assertArrayEquals(new int[]{100, 500}, oDbz.getShape());
		assertTrue(oDbz.isNoData(0, 0));
		assertTrue(Float.isNaN(oDbz.getValue(0, 0)));
		assertEquals(5.0f, oDbz.getValue(0, 1), 1e-4f);
		assertEquals(1, oDbz.countNoData());

		SweepData oSecond = oVolume.getSweep(1);
		assertEquals(80, oSecond.getNumRays());
		assertEquals(100, oSecond.getStartRay());
		assertEquals(179, oSecond.getEndRay());
		assertEquals(200.0f, oSecond.getAzimuth()[0], 1e-4f);
		MomentData oSecondDbz = oSecond.getMoment("DBZ");
		assertArrayEquals(new int[]{80, 500}, oSecondDbz.getShape());
		assertEquals((float)(CfRadialFixture.dbzRaw(100, 7) * 0.01), oSecondDbz.getValue(0, 7), 1e-4f);
		assertEquals(0, oSecondDbz.countNoData());
		assertNull(oSecond.getMoment("dbz"));
	}


	@Test
	public void scanAgreesWithRead()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().dbz().write(m_oDir, "volume.nc");
		CfRadial1Reader oReader = new CfRadial1Reader();
		VolumeMetadata oScan = oReader.scan(oPath);
		VolumeData oVolume = oReader.read(oPath);
		assertEquals(oScan.getNumSweeps(), oVolume.getNumSweeps());
		assertArrayEquals(oScan.getFixedAngles(), oVolume.getMetadata().getFixedAngles(), 0.0);
		for (SweepData oSweep : oVolume.getSweeps())
			assertEquals(oScan.getFixedAngles()[oSweep.getIndex()], oSweep.getFixedAngle(), 0.0);
		assertEquals(oScan.getInstrumentName(), oVolume.getMetadata().getInstrumentName());
		assertEquals(oScan.getTimeCoverageStart(), oVolume.getMetadata().getTimeCoverageStart());
	}


	@Test
	public void repeatedReadsAreIdentical()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().dbz().write(m_oDir, "volume.nc");
		CfRadial1Reader oReader = new CfRadial1Reader();
		VolumeData oFirst = oReader.read(oPath);
		VolumeData oSecond = oReader.read(oPath);
		for (int nIndex = 0; nIndex < oFirst.getNumSweeps(); nIndex++)
		{
			assertArrayEquals(oFirst.getSweep(nIndex).getMoment("DBZ").copyData(), oSecond.getSweep(nIndex).getMoment("DBZ").copyData());
			assertArrayEquals(oFirst.getSweep(nIndex).getAzimuth(), oSecond.getSweep(nIndex).getAzimuth());
		}
		assertEquals(oFirst.getMetadata().getAttributes(), oSecond.getMetadata().getAttributes());
	}


	@Test
	public void sweepLookupOutOfRangeIsNull()
	   throws Exception
	{
		VolumeData oVolume = new CfRadial1Reader().read(new CfRadialFixture().dbz().write(m_oDir, "volume.nc"));
		assertNull(oVolume.getSweep(2));
		assertNull(oVolume.getSweep(-1));
		assertNotNull(oVolume.getSweep(1));
	}


	@Test
	public void missingEndIndexFailsRead()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().withoutEndIndex().dbz().write(m_oDir, "volume.nc");
		SchemaException oEx = assertThrows(SchemaException.class, () -> new CfRadial1Reader().read(oPath));
		assertEquals("sweep_end_ray_index", oEx.getVariable());
		assertThrows(SchemaException.class, () -> new CfRadial1Reader().scan(oPath));
	}


	@Test
	public void missingAzimuthFailsReadNotScan()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().withoutAzimuth().dbz().write(m_oDir, "volume.nc");
		CfRadial1Reader oReader = new CfRadial1Reader();
		assertEquals(2, oReader.scan(oPath).getNumSweeps());
		SchemaException oEx = assertThrows(SchemaException.class, () -> oReader.read(oPath));
		assertEquals("azimuth", oEx.getVariable());
	}


	@Test
	public void missingFileIsNotFound()
	{
		assertThrows(NotFoundException.class, () -> new CfRadial1Reader().read(m_oDir.resolve("nothing.nc")));
		assertThrows(NotFoundException.class, () -> new CfRadial1Reader().scan(m_oDir.resolve("nothing.nc")));
	}


	@Test
	public void endIndexBeyondRaysIsDecodeError()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().sweeps(new int[]{0, 100}, new int[]{99, 200}, new float[]{0.5f, 1.5f})
		   .dbz().write(m_oDir, "volume.nc");
		DecodeException oEx = assertThrows(DecodeException.class, () -> new CfRadial1Reader().read(oPath));
		assertEquals(1, oEx.getSweepIndex());
		assertEquals("sweep_end_ray_index", oEx.getVariable());

		DecodeException oParallel = assertThrows(DecodeException.class, () -> parallelReader(4).read(oPath));
		assertEquals(1, oParallel.getSweepIndex());
	}


	@Test
	public void parallelReadMatchesSequential()
	   throws Exception
	{
		Path oPath = new CfRadialFixture()
		   .sweeps(new int[]{0, 40, 90, 130}, new int[]{39, 89, 129, 179}, new float[]{0.5f, 1.5f, 2.5f, 3.5f})
		   .dbz()
		   .moment("VEL", DataType.FLOAT, (nRay, nGate) -> nRay - nGate * 0.5, "units", "m/s")
		   .write(m_oDir, "volume.nc");
		VolumeData oSequential = new CfRadial1Reader().read(oPath);
		VolumeData oParallel = parallelReader(3).read(oPath);
		assertEquals(oSequential.getNumSweeps(), oParallel.getNumSweeps());
		for (int nIndex = 0; nIndex < oSequential.getNumSweeps(); nIndex++)
		{
			SweepData oSeq = oSequential.getSweep(nIndex);
			SweepData oPar = oParallel.getSweep(nIndex);
			assertEquals(nIndex, oPar.getIndex());
			assertEquals(oSeq.getMomentNames(), oPar.getMomentNames());
			for (String sMoment : oSeq.getMomentNames())
				assertArrayEquals(oSeq.getMoment(sMoment).copyData(), oPar.getMoment(sMoment).copyData());
			assertArrayEquals(oSeq.getElevation(), oPar.getElevation());
		}
	}


	@Test
	public void readsMomentSubset()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().dbz()
		   .moment("VEL", DataType.FLOAT, (nRay, nGate) -> 1.0, "units", "m/s")
		   .write(m_oDir, "volume.nc");
		VolumeData oVolume = new CfRadial1Reader().read(oPath, "VEL", "NOT_IN_FILE");
		assertEquals(Arrays.asList("VEL"), oVolume.getMomentNames());
		assertEquals(Arrays.asList("DBZ", "VEL"), new CfRadial1Reader().read(oPath).getMomentNames());
		assertTrue(new CfRadial1Reader().read(oPath, new String[0]).getMomentNames().isEmpty());
	}


	@Test
	public void readsSingleSweep()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().dbz().write(m_oDir, "volume.nc");
		CfRadial1Reader oReader = new CfRadial1Reader();
		SweepData oSweep = oReader.readSweep(oPath, 1);
		assertEquals(1, oSweep.getIndex());
		assertEquals(80, oSweep.getNumRays());
		assertArrayEquals(oReader.read(oPath).getSweep(1).getMoment("DBZ").copyData(), oSweep.getMoment("DBZ").copyData());

		DecodeException oEx = assertThrows(DecodeException.class, () -> oReader.readSweep(oPath, 2));
		assertEquals(2, oEx.getSweepIndex());
		DecodeException oNegative = assertThrows(DecodeException.class, () -> oReader.readSweep(oPath, -1));
		assertTrue(oNegative.getMessage().contains("Sweep index -1 out of range"));
	}


	@Test
	public void raggedLayoutIsRejected()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().ragged().dbz().write(m_oDir, "volume.nc");
		DecodeException oEx = assertThrows(DecodeException.class, () -> new CfRadial1Reader().read(oPath));
		assertEquals("n_points", oEx.getVariable());
	}


	@Test
	public void decreasingRangeIsDecodeError()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().range(100f, 200f, 150f, 300f).write(m_oDir, "volume.nc");
		DecodeException oEx = assertThrows(DecodeException.class, () -> new CfRadial1Reader().read(oPath));
		assertEquals("range", oEx.getVariable());
	}


	@Test
	public void timeIsOptional()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().withoutTime().dbz().write(m_oDir, "volume.nc");
		SweepData oSweep = new CfRadial1Reader().read(oPath).getSweep(0);
		assertFalse(oSweep.hasTime());
		assertEquals(0, oSweep.getTime().length);
		assertEquals(100, oSweep.getNumRays());
	}


	@Test
	public void carriesValidRangeAndAttributes()
	   throws Exception
	{
		Path oPath = new CfRadialFixture()
		   .moment("ZDR", DataType.SHORT, (nRay, nGate) -> nGate - 100,
		      "units", "dB", "scale_factor", 0.1f, "add_offset", 0.0f, "_FillValue", (short)-32768,
		      "valid_min", (short)-80, "valid_max", (short)200, "coordinates", "elevation azimuth range",
		      "long_name", "differential_reflectivity")
		   .moment("VEL", DataType.FLOAT, (nRay, nGate) -> 1.0, "units", "m/s")
		   .write(m_oDir, "volume.nc");
		SweepData oSweep = new CfRadial1Reader().read(oPath).getSweep(0);

		MomentData oZdr = oSweep.getMoment("ZDR");
		assertEquals(-8.0, oZdr.getValidMin(), 1e-5);
		assertEquals(20.0, oZdr.getValidMax(), 1e-5);
		assertEquals("elevation azimuth range", oZdr.getCoordinates());
		assertEquals("differential_reflectivity", oZdr.getAttributes().get("long_name"));
		assertEquals("dB", oZdr.getAttributes().get("units"));
		assertTrue(oZdr.getAttributes().containsKey("scale_factor"));
		assertThrows(UnsupportedOperationException.class, () -> oZdr.getAttributes().put("units", "dBZ"));

		// raw gate - 100: gates below 20 fall under -8 dB, gates above 300 over 20 dB
		assertEquals(0, oZdr.countNoData());
		MomentData oMasked = oZdr.maskInvalid();
		assertTrue(oMasked.isNoData(0, 19));
		assertEquals(-8.0f, oMasked.getValue(0, 20), 1e-4f);
		assertEquals(20.0f, oMasked.getValue(0, 300), 1e-4f);
		assertTrue(oMasked.isNoData(0, 301));
		assertEquals(100 * (20 + 199), oMasked.countNoData());
		assertFalse(oZdr.isNoData(0, 19));

		MomentData oVel = oSweep.getMoment("VEL");
		assertTrue(Double.isNaN(oVel.getValidMin()));
		assertTrue(Double.isNaN(oVel.getValidMax()));
		assertEquals("", oVel.getCoordinates());
		assertSame(oVel, oVel.maskInvalid());
	}


	@Test
	public void readsInstrumentParametersAtFirstRayOfSweep()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().dbz()
		   .rayVariable("prt", DataType.FLOAT, (nRay, nGate) -> nRay < 100 ? 0.001 : 0.0025)
		   .rayVariable("nyquist_velocity", DataType.FLOAT, (nRay, nGate) -> nRay < 100 ? 8.0 : 20.0)
		   .rayVariable("unambiguous_range", DataType.DOUBLE, (nRay, nGate) -> nRay == 100 ? 60000.0 : 150000.0)
		   .write(m_oDir, "volume.nc");
		VolumeData oVolume = new CfRadial1Reader().read(oPath);

		SweepMetadata oFirst = oVolume.getSweep(0).getMetadata();
		assertEquals(1000.0, oFirst.getPrf(), 1e-2);
		assertEquals(8.0, oFirst.getNyquistVelocity(), 1e-5);
		assertEquals(150000.0, oFirst.getUnambiguousRange(), 0.0);

		SweepMetadata oSecond = oVolume.getSweep(1).getMetadata();
		assertEquals(400.0, oSecond.getPrf(), 1e-2);
		assertEquals(20.0, oSecond.getNyquistVelocity(), 1e-5);
		assertEquals(60000.0, oSecond.getUnambiguousRange(), 0.0);

		SweepMetadata oBare = new CfRadial1Reader().read(new CfRadialFixture().dbz().write(m_oDir, "bare.nc"))
		   .getSweep(0).getMetadata();
		assertTrue(Double.isNaN(oBare.getPrf()));
		assertTrue(Double.isNaN(oBare.getNyquistVelocity()));
		assertTrue(Double.isNaN(oBare.getUnambiguousRange()));
	}
}
