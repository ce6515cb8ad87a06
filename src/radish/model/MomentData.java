package radish.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One decoded radar moment (reflectivity, velocity, ...) of a sweep. Values
 * are physical values stored row-major over (ray, gate). Samples that were
 * stored as the fill or missing value of the variable hold {@link #NO_DATA}.
 * <p>
 * Instances are immutable and belong to exactly one {@link SweepData}.
 *
 * @author Federal Highway Administration
 */
public class MomentData
{
	/**
	 * Reserved value of samples without data. Test samples with
	 * {@link #isNoData(int, int)} or {@link Float#isNaN(float)}, never with ==.
	 */
	public static final float NO_DATA = Float.NaN;


	/**
	 * Name of the variable the moment was decoded from
	 */
	private final String m_sName;


	/**
	 * Units attribute of the variable, empty if not specified
	 */
	private final String m_sUnits;


	/**
	 * CF standard_name attribute, empty if not specified
	 */
	private final String m_sStandardName;


	/**
	 * long_name attribute, empty if not specified
	 */
	private final String m_sLongName;


	/**
	 * Number of rays (rows)
	 */
	private final int m_nRays;


	/**
	 * Number of gates (columns)
	 */
	private final int m_nGates;


	/**
	 * Decoded values, row-major
	 */
	private final float[] m_fData;


	/**
	 * scale_factor attribute of the source variable, NaN if absent
	 */
	private final double m_dScale;


	/**
	 * add_offset attribute of the source variable, NaN if absent
	 */
	private final double m_dOffset;


	/**
	 * _FillValue attribute of the source variable, NaN if absent
	 */
	private final double m_dFill;


	/**
	 * missing_value attribute of the source variable, NaN if absent
	 */
	private final double m_dMissing;


	/**
	 * Smallest valid physical value, NaN if the variable does not declare one
	 */
	private final double m_dValidMin;


	/**
	 * Largest valid physical value, NaN if the variable does not declare one
	 */
	private final double m_dValidMax;


	/**
	 * coordinates attribute, empty if not specified
	 */
	private final String m_sCoordinates;


	/**
	 * Every attribute of the source variable as text in file order
	 */
	private final Map<String, String> m_oAttributes;


	/**
	 * Constructs a MomentData without encoding information.
	 *
	 * @param sName moment name
	 * @param sUnits units, null is stored as an empty String
	 * @param nRays number of rays
	 * @param nGates number of gates
	 * @param fData row-major values, the array is kept, not copied
	 */
	public MomentData(String sName, String sUnits, int nRays, int nGates, float[] fData)
	{
		this(sName, sUnits, "", "", nRays, nGates, fData, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
		   Double.NaN, Double.NaN, "", Collections.emptyMap());
	}


	/**
	 * Constructs a MomentData with the given parameters
	 *
	 * @param sName moment name
	 * @param sUnits units, null is stored as an empty String
	 * @param sStandardName CF standard name, null is stored as an empty String
	 * @param sLongName long name, null is stored as an empty String
	 * @param nRays number of rays
	 * @param nGates number of gates
	 * @param fData row-major values, the array is kept, not copied
	 * @param dScale scale_factor of the source variable or NaN
	 * @param dOffset add_offset of the source variable or NaN
	 * @param dFill _FillValue of the source variable or NaN
	 * @param dMissing missing_value of the source variable or NaN
	 * @param dValidMin smallest valid physical value or NaN
	 * @param dValidMax largest valid physical value or NaN
	 * @param sCoordinates coordinates attribute, null is stored as an empty
	 * String
	 * @param oAttributes attributes of the source variable as text, copied
	 * @throws IllegalArgumentException if the length of the data does not
	 * equal nRays * nGates
	 */
	public MomentData(String sName, String sUnits, String sStandardName, String sLongName,
	   int nRays, int nGates, float[] fData, double dScale, double dOffset, double dFill, double dMissing,
	   double dValidMin, double dValidMax, String sCoordinates, Map<String, String> oAttributes)
	{
		if (nRays < 0 || nGates < 0 || fData.length != nRays * nGates)
			throw new IllegalArgumentException(String.format("Moment %s has %d values, expected %d x %d", sName, fData.length, nRays, nGates));

		m_sName = sName;
		m_sUnits = sUnits == null ? "" : sUnits;
		m_sStandardName = sStandardName == null ? "" : sStandardName;
		m_sLongName = sLongName == null ? "" : sLongName;
		m_nRays = nRays;
		m_nGates = nGates;
		m_fData = fData;
		m_dScale = dScale;
		m_dOffset = dOffset;
		m_dFill = dFill;
		m_dMissing = dMissing;
		m_dValidMin = dValidMin;
		m_dValidMax = dValidMax;
		m_sCoordinates = sCoordinates == null ? "" : sCoordinates;
		m_oAttributes = Collections.unmodifiableMap(new LinkedHashMap(oAttributes));
	}


	public String getName()
	{
		return m_sName;
	}


	public String getUnits()
	{
		return m_sUnits;
	}


	public String getStandardName()
	{
		return m_sStandardName;
	}


	public String getLongName()
	{
		return m_sLongName;
	}


	public int getNumRays()
	{
		return m_nRays;
	}


	public int getNumGates()
	{
		return m_nGates;
	}


	/**
	 * @return a new array {rays, gates}
	 */
	public int[] getShape()
	{
		return new int[]{m_nRays, m_nGates};
	}


	/**
	 * Gets the value at the given position.
	 *
	 * @param nRay ray index within the sweep
	 * @param nGate gate index
	 * @return the physical value or {@link #NO_DATA}
	 * @throws IndexOutOfBoundsException if the position is outside of the
	 * shape of the moment
	 */
	public float getValue(int nRay, int nGate)
	{
		return m_fData[index(nRay, nGate)];
	}


	/**
	 * @param nRay ray index within the sweep
	 * @param nGate gate index
	 * @return true if the sample at the given position has no data
	 */
	public boolean isNoData(int nRay, int nGate)
	{
		return Float.isNaN(m_fData[index(nRay, nGate)]);
	}


	/**
	 * @return the number of samples that hold {@link #NO_DATA}
	 */
	public int countNoData()
	{
		int nCount = 0;
		for (float fVal : m_fData)
		{
			if (Float.isNaN(fVal))
				++nCount;
		}
		return nCount;
	}


	/**
	 * @param nRay ray index within the sweep
	 * @return a copy of the values of the given ray
	 */
	public float[] copyRow(int nRay)
	{
		if (nRay < 0 || nRay >= m_nRays)
			throw new IndexOutOfBoundsException("Ray " + nRay + " outside of [0, " + m_nRays + ")");
		int nStart = nRay * m_nGates;
		return Arrays.copyOfRange(m_fData, nStart, nStart + m_nGates);
	}


	/**
	 * @return a copy of the values as a [rays][gates] array
	 */
	public float[][] toArray()
	{
		float[][] fRet = new float[m_nRays][];
		for (int nRay = 0; nRay < m_nRays; nRay++)
			fRet[nRay] = copyRow(nRay);
		return fRet;
	}


	/**
	 * @return a copy of the row-major values
	 */
	public float[] copyData()
	{
		return m_fData.clone();
	}


	public double getScaleFactor()
	{
		return m_dScale;
	}


	public double getAddOffset()
	{
		return m_dOffset;
	}


	public double getFillValue()
	{
		return m_dFill;
	}


	public double getMissingValue()
	{
		return m_dMissing;
	}


	public double getValidMin()
	{
		return m_dValidMin;
	}


	public double getValidMax()
	{
		return m_dValidMax;
	}


	public String getCoordinates()
	{
		return m_sCoordinates;
	}


	/**
	 * @return unmodifiable view of the attributes of the source variable as
	 * text in file order
	 */
	public Map<String, String> getAttributes()
	{
		return m_oAttributes;
	}


	/**
	 * Creates a copy of the moment where every value below the valid minimum
	 * or above the valid maximum is replaced by {@link #NO_DATA}. Bounds are
	 * compared at float precision, a bound that is NaN is not applied.
	 *
	 * @return the masked copy, or this moment if it declares no valid bound
	 */
	public MomentData maskInvalid()
	{
		if (Double.isNaN(m_dValidMin) && Double.isNaN(m_dValidMax))
			return this;

		float fMin = Double.isNaN(m_dValidMin) ? Float.NEGATIVE_INFINITY : (float)m_dValidMin;
		float fMax = Double.isNaN(m_dValidMax) ? Float.POSITIVE_INFINITY : (float)m_dValidMax;
		float[] fMasked = m_fData.clone();
		for (int nIndex = 0; nIndex < fMasked.length; nIndex++)
		{
			float fVal = fMasked[nIndex];
			if (fVal < fMin || fVal > fMax)
				fMasked[nIndex] = NO_DATA;
		}
		return new MomentData(m_sName, m_sUnits, m_sStandardName, m_sLongName, m_nRays, m_nGates, fMasked,
		   m_dScale, m_dOffset, m_dFill, m_dMissing, m_dValidMin, m_dValidMax, m_sCoordinates, m_oAttributes);
	}


	private int index(int nRay, int nGate)
	{
		if (nRay < 0 || nRay >= m_nRays || nGate < 0 || nGate >= m_nGates)
			throw new IndexOutOfBoundsException(String.format("(%d, %d) outside of shape (%d, %d)", nRay, nGate, m_nRays, m_nGates));
		return nRay * m_nGates + nGate;
	}
}
