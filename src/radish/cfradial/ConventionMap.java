package radish.cfradial;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of interpreting a file with the CfRadial1 convention: the sweep
 * table, the ray and gate dimensions, and the catalog of moment variables.
 *
 * @author Federal Highway Administration
 */
public class ConventionMap
{
	/**
	 * Sweep table ordered by sweep index
	 */
	private final List<SweepExtent> m_oSweeps;


	/**
	 * Names of the moment variables in file order
	 */
	private final List<String> m_oFields;


	private final String m_sRayDim;


	private final int m_nRayCount;


	private final String m_sGateDim;


	private final int m_nGateCount;


	public ConventionMap(List<SweepExtent> oSweeps, List<String> oFields, String sRayDim, int nRayCount, String sGateDim, int nGateCount)
	{
		m_oSweeps = Collections.unmodifiableList(new ArrayList(oSweeps));
		m_oFields = Collections.unmodifiableList(new ArrayList(oFields));
		m_sRayDim = sRayDim;
		m_nRayCount = nRayCount;
		m_sGateDim = sGateDim;
		m_nGateCount = nGateCount;
	}


	public int getSweepCount()
	{
		return m_oSweeps.size();
	}


	public SweepExtent getSweep(int nIndex)
	{
		return m_oSweeps.get(nIndex);
	}


	public List<SweepExtent> getSweeps()
	{
		return m_oSweeps;
	}


	/**
	 * @return the fixed angle of each sweep in sweep order
	 */
	public double[] getFixedAngles()
	{
		double[] dAngles = new double[m_oSweeps.size()];
		for (int nIndex = 0; nIndex < dAngles.length; nIndex++)
			dAngles[nIndex] = m_oSweeps.get(nIndex).getFixedAngle();
		return dAngles;
	}


	/**
	 * @return names of the moment variables in file order
	 */
	public List<String> getFields()
	{
		return m_oFields;
	}


	public String getRayDimension()
	{
		return m_sRayDim;
	}


	/**
	 * @return length of the ray dimension, the total number of rays of the
	 * volume
	 */
	public int getRayCount()
	{
		return m_nRayCount;
	}


	public String getGateDimension()
	{
		return m_sGateDim;
	}


	public int getGateCount()
	{
		return m_nGateCount;
	}
}
