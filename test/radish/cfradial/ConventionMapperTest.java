package radish.cfradial;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import radish.CfRadialFixture;
import radish.model.SweepMetadata;
import radish.model.SweepMode;
import radish.store.NcfContainer;
import radish.system.SchemaException;
import ucar.ma2.DataType;

public class ConventionMapperTest
{
	@TempDir
	Path m_oDir;


	@Test
	public void buildsSweepTableAndCatalog()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().dbz()
		   .moment("VEL", DataType.BYTE, (nRay, nGate) -> nGate % 100, "units", "m/s")
		   .moment("ray_gate_spacing", DataType.FLOAT, (nRay, nGate) -> 250.0)
		   .write(m_oDir, "volume.nc");
		try (NcfContainer oNc = NcfContainer.open(oPath))
		{
			ConventionMap oMap = new ConventionMapper().map(oNc);
			assertEquals(2, oMap.getSweepCount());
			assertEquals(0, oMap.getSweep(0).getStartRay());
			assertEquals(99, oMap.getSweep(0).getEndRay());
			assertEquals(100, oMap.getSweep(0).getNumRays());
			assertEquals(100, oMap.getSweep(1).getStartRay());
			assertEquals(80, oMap.getSweep(1).getNumRays());
			assertArrayEquals(new double[]{0.5, 1.5}, oMap.getFixedAngles(), 1e-6);
			assertEquals("time", oMap.getRayDimension());
			assertEquals(180, oMap.getRayCount());
			assertEquals("range", oMap.getGateDimension());
			assertEquals(500, oMap.getGateCount());
			assertEquals(Arrays.asList("DBZ", "VEL"), oMap.getFields());
		}
	}


	@Test
	public void configuredAuxiliaryNamesAreNotMoments()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().dbz()
		   .moment("QC_FLAG", DataType.INT, (nRay, nGate) -> 0)
		   .write(m_oDir, "volume.nc");
		try (NcfContainer oNc = NcfContainer.open(oPath))
		{
			List<String> oFields = new ConventionMapper("time", "QC_FLAG").map(oNc).getFields();
			assertEquals(Arrays.asList("DBZ"), oFields);
			assertTrue(new ConventionMapper("time").map(oNc).getFields().contains("QC_FLAG"));
		}
	}


	@Test
	public void missingEndIndexIsSchemaError()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().withoutEndIndex().write(m_oDir, "volume.nc");
		try (NcfContainer oNc = NcfContainer.open(oPath))
		{
			SchemaException oEx = assertThrows(SchemaException.class, () -> new ConventionMapper().map(oNc));
			assertEquals("sweep_end_ray_index", oEx.getVariable());
			assertTrue(oEx.getMessage().contains("sweep_end_ray_index"));
		}
	}


	@Test
	public void rayDimensionFallsBackWithoutTime()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().withoutTime().dbz().write(m_oDir, "volume.nc");
		try (NcfContainer oNc = NcfContainer.open(oPath))
		{
			ConventionMap oMap = new ConventionMapper().map(oNc);
			assertEquals("time", oMap.getRayDimension());
			assertEquals(180, oMap.getRayCount());
			assertEquals(Arrays.asList("DBZ"), oMap.getFields());

			assertThrows(SchemaException.class, () -> new ConventionMapper("rays").map(oNc));
		}
	}


	@Test
	public void readsSweepSettings()
	   throws Exception
	{
		Path oPath = new CfRadialFixture().modes("azimuth_surveillance", "rhi").write(m_oDir, "volume.nc");
		try (NcfContainer oNc = NcfContainer.open(oPath))
		{
			ConventionMapper oMapper = new ConventionMapper();
			List<SweepMetadata> oSweeps = oMapper.mapSweepMetadata(oNc, oMapper.map(oNc));
			assertEquals(2, oSweeps.size());
			assertEquals(SweepMode.AZIMUTH_SURVEILLANCE, oSweeps.get(0).getMode());
			assertEquals(SweepMode.ELEVATION_SURVEILLANCE, oSweeps.get(1).getMode());
			assertEquals(1, oSweeps.get(1).getSweepNumber());
			assertEquals(1.5, oSweeps.get(1).getFixedAngle(), 1e-6);
			assertEquals("", oSweeps.get(0).getPolarizationMode());
			assertTrue(Double.isNaN(oSweeps.get(0).getTargetScanRate()));
			assertFalse(oSweeps.get(0).isRaysAreIndexed());
		}
	}
}
