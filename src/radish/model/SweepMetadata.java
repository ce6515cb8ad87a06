package radish.model;

/**
 * Sweep level settings read from the sweep dimensioned variables of a
 * CfRadial file. Optional text settings are empty when the file does not
 * declare them and optional numbers are NaN.
 *
 * @author Federal Highway Administration
 */
public class SweepMetadata
{
	/**
	 * sweep_number of the sweep, defaults to the sweep index
	 */
	private final int m_nSweepNumber;


	private final SweepMode m_oMode;


	/**
	 * Target angle of the sweep in degrees, elevation for PPI scans and
	 * azimuth for RHI scans
	 */
	private final double m_dFixedAngle;


	private final String m_sFollowMode;


	private final String m_sPrtMode;


	private final String m_sPolarizationMode;


	/**
	 * Target scan rate in degrees per second
	 */
	private final double m_dTargetScanRate;


	/**
	 * Angular spacing of indexed rays in degrees
	 */
	private final double m_dRayAngleResolution;


	private final boolean m_bRaysAreIndexed;


	/**
	 * Pulse repetition frequency in hertz, the inverse of prt at the first ray
	 * of the sweep
	 */
	private final double m_dPrf;


	/**
	 * Nyquist velocity in meters per second at the first ray of the sweep
	 */
	private final double m_dNyquistVelocity;


	/**
	 * Unambiguous range in meters at the first ray of the sweep
	 */
	private final double m_dUnambiguousRange;


	/**
	 * Constructs a SweepMetadata with only the required settings.
	 *
	 * @param nSweepNumber sweep number
	 * @param oMode sweep mode
	 * @param dFixedAngle fixed angle in degrees
	 */
	public SweepMetadata(int nSweepNumber, SweepMode oMode, double dFixedAngle)
	{
		this(nSweepNumber, oMode, dFixedAngle, "", "", "", Double.NaN, Double.NaN, false,
		   Double.NaN, Double.NaN, Double.NaN);
	}


	public SweepMetadata(int nSweepNumber, SweepMode oMode, double dFixedAngle,
	   String sFollowMode, String sPrtMode, String sPolarizationMode,
	   double dTargetScanRate, double dRayAngleResolution, boolean bRaysAreIndexed,
	   double dPrf, double dNyquistVelocity, double dUnambiguousRange)
	{
		m_nSweepNumber = nSweepNumber;
		m_oMode = oMode == null ? SweepMode.AZIMUTH_SURVEILLANCE : oMode;
		m_dFixedAngle = dFixedAngle;
		m_sFollowMode = sFollowMode == null ? "" : sFollowMode;
		m_sPrtMode = sPrtMode == null ? "" : sPrtMode;
		m_sPolarizationMode = sPolarizationMode == null ? "" : sPolarizationMode;
		m_dTargetScanRate = dTargetScanRate;
		m_dRayAngleResolution = dRayAngleResolution;
		m_bRaysAreIndexed = bRaysAreIndexed;
		m_dPrf = dPrf;
		m_dNyquistVelocity = dNyquistVelocity;
		m_dUnambiguousRange = dUnambiguousRange;
	}


	public int getSweepNumber()
	{
		return m_nSweepNumber;
	}


	public SweepMode getMode()
	{
		return m_oMode;
	}


	public double getFixedAngle()
	{
		return m_dFixedAngle;
	}


	public String getFollowMode()
	{
		return m_sFollowMode;
	}


	public String getPrtMode()
	{
		return m_sPrtMode;
	}


	public String getPolarizationMode()
	{
		return m_sPolarizationMode;
	}


	public double getTargetScanRate()
	{
		return m_dTargetScanRate;
	}


	public double getRayAngleResolution()
	{
		return m_dRayAngleResolution;
	}


	public boolean isRaysAreIndexed()
	{
		return m_bRaysAreIndexed;
	}


	public double getPrf()
	{
		return m_dPrf;
	}


	public double getNyquistVelocity()
	{
		return m_dNyquistVelocity;
	}


	public double getUnambiguousRange()
	{
		return m_dUnambiguousRange;
	}
}
