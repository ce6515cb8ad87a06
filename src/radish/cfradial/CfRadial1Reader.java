package radish.cfradial;

import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import radish.model.SweepData;
import radish.model.VolumeData;
import radish.model.VolumeMetadata;
import radish.store.NcfContainer;
import radish.system.DecodeException;
import radish.system.FormatException;
import radish.system.NotFoundException;
import radish.system.RadarFileException;
import radish.system.SchemaException;

/**
 * {@link RadarReader} for CfRadial1 NetCDF files. Ties together the
 * container, the convention mapper, the metadata extractor and the volume
 * materializer; each call is one open, interpret, decode, close session.
 *
 * @author Federal Highway Administration
 */
public class CfRadial1Reader implements RadarReader
{
	/**
	 * Log4j Logger
	 */
	protected Logger m_oLogger = LogManager.getLogger(getClass());


	private final ConventionMapper m_oMapper;


	private final MetadataExtractor m_oExtractor;


	private final VolumeMaterializer m_oMaterializer;


	/**
	 * Constructs a CfRadial1Reader configured by the configuration files of
	 * its components.
	 */
	public CfRadial1Reader()
	{
		this(new ConventionMapper());
	}


	private CfRadial1Reader(ConventionMapper oMapper)
	{
		this(oMapper, new MetadataExtractor(), new VolumeMaterializer(oMapper));
	}


	/**
	 * Constructs a CfRadial1Reader with the given components.
	 */
	public CfRadial1Reader(ConventionMapper oMapper, MetadataExtractor oExtractor, VolumeMaterializer oMaterializer)
	{
		m_oMapper = oMapper;
		m_oExtractor = oExtractor;
		m_oMaterializer = oMaterializer;
	}


	@Override
	public String getName()
	{
		return "cfradial1";
	}


	@Override
	public String getDescription()
	{
		return "CfRadial 1.x polar radar volumes stored in NetCDF files";
	}


	@Override
	public VolumeMetadata scan(Path oPath)
	   throws NotFoundException, FormatException, SchemaException
	{
		try (NcfContainer oNc = NcfContainer.open(oPath))
		{
			ConventionMap oMap = m_oMapper.map(oNc);
			VolumeMetadata oMetadata = m_oExtractor.extract(oNc, oMap);
			m_oLogger.info(String.format("Scanned %s: %d sweeps, fields %s", oPath, oMetadata.getNumSweeps(), oMap.getFields()));
			return oMetadata;
		}
		catch (DecodeException oEx)
		{
			// a scan only reads small variables, a failed read means the container is damaged
			m_oLogger.error(oEx, oEx);
			throw new FormatException(oPath.toString(), "Failed to read volume metadata", oEx);
		}
		catch (RadarFileException oEx)
		{
			m_oLogger.error(oEx, oEx);
			throw oEx;
		}
	}


	@Override
	public VolumeData read(Path oPath)
	   throws NotFoundException, FormatException, SchemaException, DecodeException
	{
		return read(oPath, (String[])null);
	}


	@Override
	public VolumeData read(Path oPath, String... sMoments)
	   throws NotFoundException, FormatException, SchemaException, DecodeException
	{
		try (NcfContainer oNc = NcfContainer.open(oPath))
		{
			ConventionMap oMap = m_oMapper.map(oNc);
			VolumeMetadata oMetadata = m_oExtractor.extract(oNc, oMap);
			VolumeData oVolume = m_oMaterializer.readVolume(oPath, oNc, oMap, oMetadata, sMoments);
			m_oLogger.info(String.format("Read %s: %d sweeps, moments %s", oPath, oVolume.getNumSweeps(), oVolume.getMomentNames()));
			return oVolume;
		}
		catch (RadarFileException oEx)
		{
			m_oLogger.error(oEx, oEx);
			throw oEx;
		}
	}


	@Override
	public SweepData readSweep(Path oPath, int nIndex)
	   throws NotFoundException, FormatException, SchemaException, DecodeException
	{
		try (NcfContainer oNc = NcfContainer.open(oPath))
		{
			return m_oMaterializer.readSweep(oNc, m_oMapper.map(oNc), nIndex, (String[])null);
		}
		catch (RadarFileException oEx)
		{
			m_oLogger.error(oEx, oEx);
			throw oEx;
		}
	}
}
