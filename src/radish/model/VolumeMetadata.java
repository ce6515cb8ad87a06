package radish.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of a radar volume built from the global attributes and the small
 * variables of a file, without reading any moment data. The same summary is
 * produced by a scan and by a full read of the same file.
 * <p>
 * Values the file does not provide are replaced by documented defaults:
 * <ul>
 * <li>text values (instrument name, institution, site name, conventions):
 * {@link #DEFAULT_STRING}</li>
 * <li>latitude, longitude and altitude: {@link #DEFAULT_COORD}</li>
 * <li>altitude above ground level and frequency: NaN</li>
 * <li>volume number: 0</li>
 * <li>time coverage start and end: {@link #DEFAULT_TIME}</li>
 * <li>platform type: null</li>
 * </ul>
 *
 * @author Federal Highway Administration
 */
public class VolumeMetadata
{
	/**
	 * Value of text fields the file does not declare
	 */
	public static final String DEFAULT_STRING = "";


	/**
	 * Value of latitude, longitude and altitude when the file does not declare
	 * them
	 */
	public static final double DEFAULT_COORD = 0.0;


	/**
	 * Value of the time coverage bounds when the file does not declare them
	 * or they cannot be parsed
	 */
	public static final long DEFAULT_TIME = Long.MIN_VALUE;


	private final String m_sInstrumentName;


	private final String m_sInstitution;


	private final String m_sSiteName;


	/**
	 * Conventions global attribute, for example "CF/Radial"
	 */
	private final String m_sConventions;


	private final int m_nVolumeNumber;


	private final PlatformType m_oPlatformType;


	/**
	 * Latitude of the radar in decimal degrees
	 */
	private final double m_dLatitude;


	/**
	 * Longitude of the radar in decimal degrees
	 */
	private final double m_dLongitude;


	/**
	 * Altitude of the radar above mean sea level in meters
	 */
	private final double m_dAltitude;


	/**
	 * Altitude of the radar above ground level in meters
	 */
	private final double m_dAltitudeAgl;


	/**
	 * Radar frequency in Hz
	 */
	private final double m_dFrequency;


	/**
	 * Start of the time coverage in milliseconds since Epoch
	 */
	private final long m_lTimeStart;


	/**
	 * End of the time coverage in milliseconds since Epoch
	 */
	private final long m_lTimeEnd;


	/**
	 * Fixed angle of each sweep in degrees
	 */
	private final double[] m_dFixedAngles;


	/**
	 * Every global attribute of the file as text
	 */
	private final Map<String, String> m_oAttributes;


	/**
	 * Constructs a VolumeMetadata with only the required values, every other
	 * value is set to its default.
	 *
	 * @param sInstrumentName instrument name
	 * @param dLatitude latitude in decimal degrees
	 * @param dLongitude longitude in decimal degrees
	 * @param dAltitude altitude in meters
	 * @param dFixedAngles fixed angle of each sweep, copied
	 */
	public VolumeMetadata(String sInstrumentName, double dLatitude, double dLongitude, double dAltitude, double[] dFixedAngles)
	{
		this(sInstrumentName, DEFAULT_STRING, DEFAULT_STRING, DEFAULT_STRING, 0, null, dLatitude, dLongitude, dAltitude,
		   Double.NaN, Double.NaN, DEFAULT_TIME, DEFAULT_TIME, dFixedAngles, Collections.emptyMap());
	}


	/**
	 * Constructs a new VolumeMetadata with the given parameters. Null text
	 * values are replaced by {@link #DEFAULT_STRING}.
	 *
	 * @param sInstrumentName instrument name
	 * @param sInstitution institution operating the radar
	 * @param sSiteName site name
	 * @param sConventions Conventions attribute
	 * @param nVolumeNumber volume number
	 * @param oPlatformType platform type, can be null
	 * @param dLatitude latitude in decimal degrees
	 * @param dLongitude longitude in decimal degrees
	 * @param dAltitude altitude above mean sea level in meters
	 * @param dAltitudeAgl altitude above ground level in meters or NaN
	 * @param dFrequency radar frequency in Hz or NaN
	 * @param lTimeStart start of the time coverage in milliseconds since Epoch
	 * @param lTimeEnd end of the time coverage in milliseconds since Epoch
	 * @param dFixedAngles fixed angle of each sweep, copied
	 * @param oAttributes global attributes as text, copied
	 */
	public VolumeMetadata(String sInstrumentName, String sInstitution, String sSiteName, String sConventions,
	   int nVolumeNumber, PlatformType oPlatformType, double dLatitude, double dLongitude, double dAltitude,
	   double dAltitudeAgl, double dFrequency, long lTimeStart, long lTimeEnd, double[] dFixedAngles,
	   Map<String, String> oAttributes)
	{
		m_sInstrumentName = sInstrumentName == null ? DEFAULT_STRING : sInstrumentName;
		m_sInstitution = sInstitution == null ? DEFAULT_STRING : sInstitution;
		m_sSiteName = sSiteName == null ? DEFAULT_STRING : sSiteName;
		m_sConventions = sConventions == null ? DEFAULT_STRING : sConventions;
		m_nVolumeNumber = nVolumeNumber;
		m_oPlatformType = oPlatformType;
		m_dLatitude = dLatitude;
		m_dLongitude = dLongitude;
		m_dAltitude = dAltitude;
		m_dAltitudeAgl = dAltitudeAgl;
		m_dFrequency = dFrequency;
		m_lTimeStart = lTimeStart;
		m_lTimeEnd = lTimeEnd;
		m_dFixedAngles = dFixedAngles.clone();
		m_oAttributes = Collections.unmodifiableMap(new LinkedHashMap(oAttributes));
	}


	public String getInstrumentName()
	{
		return m_sInstrumentName;
	}


	public String getInstitution()
	{
		return m_sInstitution;
	}


	public String getSiteName()
	{
		return m_sSiteName;
	}


	public String getConventions()
	{
		return m_sConventions;
	}


	public int getVolumeNumber()
	{
		return m_nVolumeNumber;
	}


	/**
	 * @return the platform type or null if the file does not declare one
	 */
	public PlatformType getPlatformType()
	{
		return m_oPlatformType;
	}


	public double getLatitude()
	{
		return m_dLatitude;
	}


	public double getLongitude()
	{
		return m_dLongitude;
	}


	public double getAltitude()
	{
		return m_dAltitude;
	}


	public double getAltitudeAgl()
	{
		return m_dAltitudeAgl;
	}


	public double getFrequency()
	{
		return m_dFrequency;
	}


	public long getTimeCoverageStart()
	{
		return m_lTimeStart;
	}


	public long getTimeCoverageEnd()
	{
		return m_lTimeEnd;
	}


	public int getNumSweeps()
	{
		return m_dFixedAngles.length;
	}


	/**
	 * @return a copy of the fixed angle of each sweep in sweep order
	 */
	public double[] getFixedAngles()
	{
		return m_dFixedAngles.clone();
	}


	/**
	 * @return sweep_0 ... sweep_n-1, the names used for sweep groups by
	 * hierarchical radar formats
	 */
	public List<String> getSweepGroupNames()
	{
		ArrayList<String> oNames = new ArrayList(m_dFixedAngles.length);
		for (int nIndex = 0; nIndex < m_dFixedAngles.length; nIndex++)
			oNames.add("sweep_" + nIndex);
		return oNames;
	}


	/**
	 * @return unmodifiable view of the global attributes as text in file order
	 */
	public Map<String, String> getAttributes()
	{
		return m_oAttributes;
	}
}
