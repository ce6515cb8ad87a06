package radish.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One decoded sweep of a radar volume: the ray coordinates (azimuth,
 * elevation, time), the gate coordinate (range) and the moments sampled over
 * (ray, gate). Every moment has exactly the shape (rays, gates) of the sweep.
 * <p>
 * Instances are immutable. Coordinate accessors return copies.
 *
 * @author Federal Highway Administration
 */
public class SweepData
{
	/**
	 * Position of the sweep in its volume
	 */
	private final int m_nIndex;


	private final SweepMetadata m_oMetadata;


	/**
	 * Index of the first ray of the sweep in the ray dimension of the file
	 */
	private final int m_nStartRay;


	/**
	 * Azimuth of each ray in degrees
	 */
	private final float[] m_fAzimuth;


	/**
	 * Elevation of each ray in degrees
	 */
	private final float[] m_fElevation;


	/**
	 * Distance from the radar to the center of each gate in meters
	 */
	private final float[] m_fRange;


	/**
	 * Time of each ray in seconds relative to the time reference of the file,
	 * empty if the file has no time variable
	 */
	private final double[] m_dTime;


	/**
	 * Moments by name in file order
	 */
	private final Map<String, MomentData> m_oMoments;


	/**
	 * Constructs a new SweepData with the given parameters
	 *
	 * @param nIndex position of the sweep in the volume
	 * @param oMetadata sweep settings
	 * @param nStartRay index of the first ray in the ray dimension of the file
	 * @param fAzimuth azimuth of each ray, kept not copied
	 * @param fElevation elevation of each ray, kept not copied
	 * @param fRange range of each gate, kept not copied
	 * @param dTime time of each ray or an empty array, kept not copied
	 * @param oMoments moments in the order they should be listed
	 * @throws IllegalArgumentException if a coordinate or a moment does not
	 * match the ray and gate counts of the sweep
	 */
	public SweepData(int nIndex, SweepMetadata oMetadata, int nStartRay, float[] fAzimuth, float[] fElevation,
	   float[] fRange, double[] dTime, Map<String, MomentData> oMoments)
	{
		int nRays = fAzimuth.length;
		if (fElevation.length != nRays)
			throw new IllegalArgumentException(String.format("Sweep %d has %d elevations for %d rays", nIndex, fElevation.length, nRays));
		if (dTime.length != 0 && dTime.length != nRays)
			throw new IllegalArgumentException(String.format("Sweep %d has %d times for %d rays", nIndex, dTime.length, nRays));

		LinkedHashMap<String, MomentData> oCopy = new LinkedHashMap();
		for (Map.Entry<String, MomentData> oEntry : oMoments.entrySet())
		{
			MomentData oMoment = oEntry.getValue();
			if (oMoment.getNumRays() != nRays || oMoment.getNumGates() != fRange.length)
				throw new IllegalArgumentException(String.format("Sweep %d moment %s has shape (%d, %d), expected (%d, %d)",
				   nIndex, oEntry.getKey(), oMoment.getNumRays(), oMoment.getNumGates(), nRays, fRange.length));
			oCopy.put(oEntry.getKey(), oMoment);
		}

		m_nIndex = nIndex;
		m_oMetadata = oMetadata;
		m_nStartRay = nStartRay;
		m_fAzimuth = fAzimuth;
		m_fElevation = fElevation;
		m_fRange = fRange;
		m_dTime = dTime;
		m_oMoments = Collections.unmodifiableMap(oCopy);
	}


	public int getIndex()
	{
		return m_nIndex;
	}


	public SweepMetadata getMetadata()
	{
		return m_oMetadata;
	}


	public int getSweepNumber()
	{
		return m_oMetadata.getSweepNumber();
	}


	public SweepMode getMode()
	{
		return m_oMetadata.getMode();
	}


	public double getFixedAngle()
	{
		return m_oMetadata.getFixedAngle();
	}


	public int getNumRays()
	{
		return m_fAzimuth.length;
	}


	public int getNumGates()
	{
		return m_fRange.length;
	}


	/**
	 * @return index of the first ray of the sweep in the file
	 */
	public int getStartRay()
	{
		return m_nStartRay;
	}


	/**
	 * @return index of the last ray of the sweep in the file, inclusive
	 */
	public int getEndRay()
	{
		return m_nStartRay + m_fAzimuth.length - 1;
	}


	public float[] getAzimuth()
	{
		return m_fAzimuth.clone();
	}


	public float[] getElevation()
	{
		return m_fElevation.clone();
	}


	public float[] getRange()
	{
		return m_fRange.clone();
	}


	/**
	 * @return a copy of the ray times, empty if the file has no time variable
	 */
	public double[] getTime()
	{
		return m_dTime.clone();
	}


	public boolean hasTime()
	{
		return m_dTime.length > 0;
	}


	/**
	 * @return the moment names in file order
	 */
	public List<String> getMomentNames()
	{
		return Collections.unmodifiableList(new ArrayList(m_oMoments.keySet()));
	}


	/**
	 * Looks up a moment by its exact, case-sensitive name.
	 *
	 * @param sName moment name as stored in the file
	 * @return the moment or null if the sweep has no moment with that name
	 */
	public MomentData getMoment(String sName)
	{
		return m_oMoments.get(sName);
	}


	public boolean hasMoment(String sName)
	{
		return m_oMoments.containsKey(sName);
	}


	/**
	 * @return unmodifiable view of the moments by name in file order
	 */
	public Map<String, MomentData> getMoments()
	{
		return m_oMoments;
	}
}
