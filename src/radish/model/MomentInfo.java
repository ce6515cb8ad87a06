package radish.model;

/**
 * Reference metadata for the standard radar moments. Each entry lists the
 * names a moment is commonly stored under in files along with its CF
 * standard name, a description and the expected units.
 * <p>
 * The catalog is informational. Moment lookups on {@link SweepData} are exact
 * and case-sensitive, callers that accept several spellings of a moment can
 * use {@link #getAliases()} to try each of them.
 *
 * @author Federal Highway Administration
 */
public class MomentInfo
{
	public static final MomentInfo DBZH = new MomentInfo("DBZH", "equivalent_reflectivity_factor", "Equivalent reflectivity factor (horizontal channel)", "dBZ", "DBZH", "DBZ", "reflectivity");
	public static final MomentInfo VRADH = new MomentInfo("VRADH", "radial_velocity_of_scatterers_away_from_instrument", "Radial velocity (horizontal channel)", "m/s", "VRADH", "VEL", "velocity");
	public static final MomentInfo WRADH = new MomentInfo("WRADH", "doppler_spectrum_width", "Doppler spectrum width (horizontal channel)", "m/s", "WRADH", "WIDTH", "spectrum_width");
	public static final MomentInfo ZDR = new MomentInfo("ZDR", "differential_reflectivity_hv", "Differential reflectivity", "dB", "ZDR");
	public static final MomentInfo PHIDP = new MomentInfo("PHIDP", "differential_phase_hv", "Differential propagation phase", "degrees", "PHIDP");
	public static final MomentInfo KDP = new MomentInfo("KDP", "specific_differential_phase_hv", "Specific differential phase", "degrees/km", "KDP");
	public static final MomentInfo RHOHV = new MomentInfo("RHOHV", "cross_correlation_ratio_hv", "Cross-correlation coefficient", "", "RHOHV");
	public static final MomentInfo NCP = new MomentInfo("NCP", "normalized_coherent_power", "Normalized coherent power", "", "NCP");
	public static final MomentInfo SNRH = new MomentInfo("SNRH", "signal_to_noise_ratio", "Signal-to-noise ratio (horizontal channel)", "dB", "SNRH", "SNR");


	/**
	 * All entries of the catalog
	 */
	private static final MomentInfo[] CATALOG = {DBZH, VRADH, WRADH, ZDR, PHIDP, KDP, RHOHV, NCP, SNRH};


	/**
	 * Canonical short name
	 */
	private final String m_sName;


	/**
	 * CF standard name
	 */
	private final String m_sStandardName;


	/**
	 * Long descriptive name
	 */
	private final String m_sLongName;


	/**
	 * Expected units
	 */
	private final String m_sUnits;


	/**
	 * Names the moment is found under in files, canonical name first
	 */
	private final String[] m_sAliases;


	private MomentInfo(String sName, String sStandardName, String sLongName, String sUnits, String... sAliases)
	{
		m_sName = sName;
		m_sStandardName = sStandardName;
		m_sLongName = sLongName;
		m_sUnits = sUnits;
		m_sAliases = sAliases;
	}


	/**
	 * Finds the catalog entry for the given moment name. The comparison is
	 * exact against every alias of every entry.
	 *
	 * @param sName moment name as stored in a file
	 * @return the matching entry or null if the name is not a standard moment
	 */
	public static MomentInfo lookup(String sName)
	{
		for (MomentInfo oInfo : CATALOG)
		{
			for (String sAlias : oInfo.m_sAliases)
			{
				if (sAlias.equals(sName))
					return oInfo;
			}
		}
		return null;
	}


	public String getName()
	{
		return m_sName;
	}


	public String getStandardName()
	{
		return m_sStandardName;
	}


	public String getLongName()
	{
		return m_sLongName;
	}


	public String getUnits()
	{
		return m_sUnits;
	}


	/**
	 * @return a copy of the names the moment is stored under, canonical name
	 * first
	 */
	public String[] getAliases()
	{
		return m_sAliases.clone();
	}
}
