package radish.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A fully decoded radar volume: the volume summary and every sweep in sweep
 * order. The number of sweeps always equals
 * {@link VolumeMetadata#getNumSweeps()}.
 *
 * @author Federal Highway Administration
 */
public class VolumeData
{
	private final VolumeMetadata m_oMetadata;


	/**
	 * Sweeps ordered by sweep index
	 */
	private final List<SweepData> m_oSweeps;


	/**
	 * Constructs a new VolumeData.
	 *
	 * @param oMetadata volume summary
	 * @param oSweeps sweeps in index order, copied
	 * @throws IllegalArgumentException if the number of sweeps does not match
	 * the summary or a sweep is out of order
	 */
	public VolumeData(VolumeMetadata oMetadata, List<SweepData> oSweeps)
	{
		if (oSweeps.size() != oMetadata.getNumSweeps())
			throw new IllegalArgumentException(String.format("Volume has %d sweeps, metadata declares %d", oSweeps.size(), oMetadata.getNumSweeps()));
		for (int nIndex = 0; nIndex < oSweeps.size(); nIndex++)
		{
			if (oSweeps.get(nIndex).getIndex() != nIndex)
				throw new IllegalArgumentException(String.format("Sweep at position %d has index %d", nIndex, oSweeps.get(nIndex).getIndex()));
		}
		m_oMetadata = oMetadata;
		m_oSweeps = Collections.unmodifiableList(new ArrayList(oSweeps));
	}


	public VolumeMetadata getMetadata()
	{
		return m_oMetadata;
	}


	public int getNumSweeps()
	{
		return m_oSweeps.size();
	}


	/**
	 * Gets the sweep at the given index.
	 *
	 * @param nIndex sweep index
	 * @return the sweep or null if the index is negative or not less than the
	 * number of sweeps
	 */
	public SweepData getSweep(int nIndex)
	{
		if (nIndex < 0 || nIndex >= m_oSweeps.size())
			return null;
		return m_oSweeps.get(nIndex);
	}


	/**
	 * @return unmodifiable list of the sweeps in index order
	 */
	public List<SweepData> getSweeps()
	{
		return m_oSweeps;
	}


	/**
	 * @return the names of the moments found in any sweep, in the order they
	 * are first seen
	 */
	public List<String> getMomentNames()
	{
		LinkedHashSet<String> oNames = new LinkedHashSet();
		for (SweepData oSweep : m_oSweeps)
			oNames.addAll(oSweep.getMomentNames());
		return new ArrayList(oNames);
	}
}
