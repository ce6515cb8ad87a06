package radish.cfradial;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import radish.model.PlatformType;
import radish.model.VolumeMetadata;
import radish.store.NcfContainer;
import radish.system.DecodeException;
import ucar.ma2.Array;
import ucar.ma2.DataType;

/**
 * Builds the {@link VolumeMetadata} of a CfRadial1 file from its global
 * attributes, its scalar variables and the sweep table of a
 * {@link ConventionMap}. Ray and gate sized variables are never read so a scan
 * costs the same whatever the size of the moments.
 *
 * @author Federal Highway Administration
 */
public class MetadataExtractor
{
	/**
	 * Log4j Logger
	 */
	protected Logger m_oLogger = LogManager.getLogger(getClass());


	/**
	 * Extracts the volume summary of the given container.
	 *
	 * @param oNc open container
	 * @param oMap interpretation of the container
	 * @return the summary, with defaults for every value the file does not
	 * provide
	 * @throws DecodeException if a small variable that is present cannot be
	 * read
	 */
	public VolumeMetadata extract(NcfContainer oNc, ConventionMap oMap)
	   throws DecodeException
	{
		LinkedHashMap<String, String> oAttrs = new LinkedHashMap();
		for (Map.Entry<String, Object> oEntry : oNc.getGlobalAttributes().entrySet())
			oAttrs.put(oEntry.getKey(), oEntry.getValue().toString());

		String sPlatform = oNc.getGlobalString(CfRadial.PLATFORM_TYPE);
		if (sPlatform == null)
			sPlatform = readText(oNc, CfRadial.PLATFORM_TYPE);

		double dVolumeNumber = readFirst(oNc, CfRadial.VOLUME_NUMBER, 0.0);

		return new VolumeMetadata(oNc.getGlobalString(CfRadial.INSTRUMENT_NAME),
		   oNc.getGlobalString(CfRadial.INSTITUTION),
		   oNc.getGlobalString(CfRadial.SITE_NAME),
		   oNc.getGlobalString(CfRadial.CONVENTIONS),
		   (int)dVolumeNumber,
		   PlatformType.parse(sPlatform),
		   readFirst(oNc, CfRadial.LATITUDE, VolumeMetadata.DEFAULT_COORD),
		   readFirst(oNc, CfRadial.LONGITUDE, VolumeMetadata.DEFAULT_COORD),
		   readFirst(oNc, CfRadial.ALTITUDE, VolumeMetadata.DEFAULT_COORD),
		   readFirst(oNc, CfRadial.ALTITUDE_AGL, Double.NaN),
		   readFirst(oNc, CfRadial.FREQUENCY, Double.NaN),
		   readTime(oNc, CfRadial.TIME_COVERAGE_START),
		   readTime(oNc, CfRadial.TIME_COVERAGE_END),
		   oMap.getFixedAngles(), oAttrs);
	}


	/**
	 * Reads the first element of a small numeric variable. Moving platforms
	 * store latitude, longitude and altitude per ray, only the first value is
	 * read for those.
	 *
	 * @param oNc open container
	 * @param sName variable name
	 * @param dDefault value used when the variable is missing, not numeric
	 * or empty
	 * @return the first value of the variable
	 * @throws DecodeException if the read fails
	 */
	private double readFirst(NcfContainer oNc, String sName, double dDefault)
	   throws DecodeException
	{
		int[] nShape = oNc.getShape(sName);
		if (nShape == null || !ConventionMapper.isNumeric(oNc.getDataType(sName)))
			return dDefault;

		Array oArray;
		if (nShape.length == 0)
			oArray = oNc.read(sName);
		else if (nShape[0] == 0)
			return dDefault;
		else
			oArray = oNc.readRows(sName, 0, 1, DecodeException.NO_SWEEP);

		if (oArray.getSize() == 0)
			return dDefault;
		return oArray.getDouble(0);
	}


	/**
	 * Gets a time coverage bound from the global attribute, or from the CHAR
	 * variable of the same name that older files use.
	 *
	 * @return milliseconds since Epoch or {@link VolumeMetadata#DEFAULT_TIME}
	 * if the value is missing or cannot be parsed
	 */
	private long readTime(NcfContainer oNc, String sName)
	   throws DecodeException
	{
		String sTime = oNc.getGlobalString(sName);
		if (sTime == null)
			sTime = readText(oNc, sName);
		if (sTime == null || sTime.isEmpty())
			return VolumeMetadata.DEFAULT_TIME;

		try
		{
			return OffsetDateTime.parse(sTime.trim()).toInstant().toEpochMilli();
		}
		catch (DateTimeParseException oEx)
		{
			m_oLogger.warn(String.format("%s: cannot parse %s \"%s\"", oNc.getPath(), sName, sTime));
			return VolumeMetadata.DEFAULT_TIME;
		}
	}


	private static String readText(NcfContainer oNc, String sName)
	   throws DecodeException
	{
		if (oNc.getDataType(sName) != DataType.CHAR)
			return null;
		String[] sValues = oNc.readStrings(sName);
		return sValues.length == 0 ? null : sValues[0];
	}
}
