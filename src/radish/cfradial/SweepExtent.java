package radish.cfradial;

/**
 * One row of the sweep table: the inclusive range of rays a sweep occupies in
 * the ray dimension of the file and its fixed angle.
 *
 * @author Federal Highway Administration
 */
public class SweepExtent
{
	private final int m_nIndex;


	/**
	 * First ray of the sweep, inclusive
	 */
	private final int m_nStartRay;


	/**
	 * Last ray of the sweep, inclusive
	 */
	private final int m_nEndRay;


	/**
	 * Fixed angle in degrees
	 */
	private final double m_dFixedAngle;


	public SweepExtent(int nIndex, int nStartRay, int nEndRay, double dFixedAngle)
	{
		m_nIndex = nIndex;
		m_nStartRay = nStartRay;
		m_nEndRay = nEndRay;
		m_dFixedAngle = dFixedAngle;
	}


	public int getIndex()
	{
		return m_nIndex;
	}


	public int getStartRay()
	{
		return m_nStartRay;
	}


	public int getEndRay()
	{
		return m_nEndRay;
	}


	/**
	 * @return end - start + 1, zero or negative if the indices are inverted
	 */
	public int getNumRays()
	{
		return m_nEndRay - m_nStartRay + 1;
	}


	public double getFixedAngle()
	{
		return m_dFixedAngle;
	}


	/**
	 * Checks that the extent is a non-empty range inside of a ray dimension of
	 * the given length.
	 *
	 * @param nRayCount length of the ray dimension
	 * @return true if 0 &lt;= start &lt;= end &lt; nRayCount
	 */
	public boolean isWithin(int nRayCount)
	{
		return m_nStartRay >= 0 && m_nStartRay <= m_nEndRay && m_nEndRay < nRayCount;
	}


	@Override
	public String toString()
	{
		return String.format("sweep %d rays [%d, %d] fixed angle %.2f", m_nIndex, m_nStartRay, m_nEndRay, m_dFixedAngle);
	}
}
