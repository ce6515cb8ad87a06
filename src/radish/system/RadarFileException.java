package radish.system;

/**
 * Base class of the failures raised while scanning or reading a radar file.
 * Every failure carries the path of the file and, when they apply, the index
 * of the sweep and the name of the variable being decoded so the message is
 * enough to locate the problem in the file.
 *
 * @author Federal Highway Administration
 */
public abstract class RadarFileException extends Exception
{
	/**
	 * Sweep index used when the failure is not tied to a sweep
	 */
	public static final int NO_SWEEP = -1;


	/**
	 * Path of the file that failed
	 */
	private final String m_sPath;


	/**
	 * Index of the sweep being decoded or {@link #NO_SWEEP}
	 */
	private final int m_nSweep;


	/**
	 * Name of the variable or dimension being decoded, null if not applicable
	 */
	private final String m_sVariable;


	/**
	 * Constructs a new RadarFileException.
	 * @param sPath path of the file
	 * @param nSweep sweep index or {@link #NO_SWEEP}
	 * @param sVariable variable name or null
	 * @param sReason description of what went wrong
	 * @param oCause underlying exception, can be null
	 */
	protected RadarFileException(String sPath, int nSweep, String sVariable, String sReason, Throwable oCause)
	{
		super(format(sPath, nSweep, sVariable, sReason), oCause);
		m_sPath = sPath;
		m_nSweep = nSweep;
		m_sVariable = sVariable;
	}


	private static String format(String sPath, int nSweep, String sVariable, String sReason)
	{
		StringBuilder sMsg = new StringBuilder(sReason);
		sMsg.append(" [file=").append(sPath);
		if (nSweep != NO_SWEEP)
			sMsg.append(", sweep=").append(nSweep);
		if (sVariable != null)
			sMsg.append(", variable=").append(sVariable);
		return sMsg.append(']').toString();
	}


	public String getPath()
	{
		return m_sPath;
	}


	/**
	 * @return the sweep index or {@link #NO_SWEEP} when the failure is not
	 * tied to a sweep
	 */
	public int getSweepIndex()
	{
		return m_nSweep;
	}


	/**
	 * @return the variable name or null when the failure is not tied to a
	 * variable
	 */
	public String getVariable()
	{
		return m_sVariable;
	}
}
