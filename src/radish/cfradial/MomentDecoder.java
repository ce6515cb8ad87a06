package radish.cfradial;

import java.util.LinkedHashMap;
import java.util.Map;
import radish.model.MomentData;
import radish.system.DecodeException;
import ucar.ma2.Array;
import ucar.ma2.DataType;
import ucar.ma2.IndexIterator;

/**
 * Converts the stored values of a moment variable into physical values using
 * the packing attributes of the variable. A stored value equal to _FillValue
 * or missing_value decodes to {@link MomentData#NO_DATA}; every other value
 * decodes to raw * scale_factor + add_offset.
 * <p>
 * Fill values are compared with the stored value in the storage type of the
 * variable, so no tolerance is involved. Integer storage marked with
 * _Unsigned = "true" is widened as unsigned before scaling.
 * <p>
 * valid_min and valid_max are carried to the moment as physical values so
 * callers can mask out of range data with {@link MomentData#maskInvalid()}.
 *
 * @author Federal Highway Administration
 */
public class MomentDecoder
{
	private final String m_sName;


	private final String m_sPath;


	private final DataType m_oType;


	private final String m_sUnits;


	private final String m_sStandardName;


	private final String m_sLongName;


	private final boolean m_bUnsigned;


	private final double m_dScale;


	private final double m_dOffset;


	/**
	 * True if either scale_factor or add_offset is present
	 */
	private final boolean m_bPacked;


	/**
	 * _FillValue as given in the file, NaN if absent
	 */
	private final double m_dFill;


	/**
	 * missing_value as given in the file, NaN if absent
	 */
	private final double m_dMissing;


	private final boolean m_bHasFill;


	private final boolean m_bHasMissing;


	/**
	 * Fill and missing values converted to the storage type. Only the field
	 * matching the storage type is used.
	 */
	private final long m_lFill;
	private final long m_lMissing;


	/**
	 * valid_min and valid_max as physical values, NaN if absent or not numeric
	 */
	private final double m_dValidMin;
	private final double m_dValidMax;


	private final String m_sCoordinates;


	/**
	 * Attributes of the variable as text
	 */
	private final LinkedHashMap<String, String> m_oAttributes = new LinkedHashMap();


	/**
	 * Constructs a decoder for the given variable.
	 *
	 * @param sPath path of the file, used in error messages
	 * @param sName variable name
	 * @param oType storage type of the variable
	 * @param bUnsigned true if the variable has _Unsigned = "true"
	 * @param oAttrs attributes of the variable
	 * @throws DecodeException if the storage type is not numeric, a packing
	 * attribute is not a number, or a fill value cannot be stored in the
	 * storage type
	 */
	public MomentDecoder(String sPath, String sName, DataType oType, boolean bUnsigned, Map<String, Object> oAttrs)
	   throws DecodeException
	{
		m_sPath = sPath;
		m_sName = sName;
		m_oType = oType;
		if (!ConventionMapper.isNumeric(oType))
			throw new DecodeException(sPath, DecodeException.NO_SWEEP, sName, "Unsupported storage type " + oType);
		m_sUnits = getText(oAttrs, CfRadial.UNITS);
		m_sStandardName = getText(oAttrs, CfRadial.STANDARD_NAME);
		m_sLongName = getText(oAttrs, CfRadial.LONG_NAME);
		m_bUnsigned = bUnsigned && oType != DataType.FLOAT && oType != DataType.DOUBLE && oType != DataType.LONG;

		Number oScale = getNumber(oAttrs, CfRadial.SCALE_FACTOR);
		Number oOffset = getNumber(oAttrs, CfRadial.ADD_OFFSET);
		Number oFill = getNumber(oAttrs, CfRadial.FILL_VALUE);
		Number oMissing = getNumber(oAttrs, CfRadial.MISSING_VALUE);

		m_bPacked = oScale != null || oOffset != null;
		m_dScale = oScale == null ? 1.0 : oScale.doubleValue();
		m_dOffset = oOffset == null ? 0.0 : oOffset.doubleValue();
		m_bHasFill = oFill != null;
		m_bHasMissing = oMissing != null;
		m_dFill = oFill == null ? Double.NaN : oFill.doubleValue();
		m_dMissing = oMissing == null ? Double.NaN : oMissing.doubleValue();
		m_lFill = oFill == null ? 0 : toStorage(oFill, CfRadial.FILL_VALUE);
		m_lMissing = oMissing == null ? 0 : toStorage(oMissing, CfRadial.MISSING_VALUE);
		m_dValidMin = getBound(oAttrs, CfRadial.VALID_MIN);
		m_dValidMax = getBound(oAttrs, CfRadial.VALID_MAX);
		m_sCoordinates = getText(oAttrs, CfRadial.COORDINATES);
		for (Map.Entry<String, Object> oEntry : oAttrs.entrySet())
			m_oAttributes.put(oEntry.getKey(), oEntry.getValue().toString());
	}


	/**
	 * Decodes every value of the given array in canonical order.
	 *
	 * @param oRaw values read from the variable
	 * @return physical values, {@link MomentData#NO_DATA} where the raw value
	 * equals a fill value
	 */
	public float[] decode(Array oRaw)
	{
		float[] fValues = new float[(int)oRaw.getSize()];
		IndexIterator oIt = oRaw.getIndexIterator();
		int nIndex = 0;
		if (m_oType == DataType.FLOAT || m_oType == DataType.DOUBLE)
		{
			boolean bFloat = m_oType == DataType.FLOAT;
			while (oIt.hasNext())
			{
				double dRaw = bFloat ? oIt.getFloatNext() : oIt.getDoubleNext();
				if (m_bHasFill && sameFloating(dRaw, m_dFill, bFloat) || m_bHasMissing && sameFloating(dRaw, m_dMissing, bFloat))
					fValues[nIndex++] = MomentData.NO_DATA;
				else
					fValues[nIndex++] = scale(dRaw);
			}
			return fValues;
		}

		while (oIt.hasNext())
		{
			long lStored;
			double dRaw;
			switch (m_oType)
			{
				case BYTE:
				{
					byte yVal = oIt.getByteNext();
					lStored = yVal;
					dRaw = m_bUnsigned ? yVal & 0xFF : yVal;
					break;
				}
				case SHORT:
				{
					short nVal = oIt.getShortNext();
					lStored = nVal;
					dRaw = m_bUnsigned ? nVal & 0xFFFF : nVal;
					break;
				}
				case INT:
				{
					int nVal = oIt.getIntNext();
					lStored = nVal;
					dRaw = m_bUnsigned ? nVal & 0xFFFFFFFFL : nVal;
					break;
				}
				default:
				{
					lStored = oIt.getLongNext();
					dRaw = lStored;
				}
			}
			if (m_bHasFill && lStored == m_lFill || m_bHasMissing && lStored == m_lMissing)
				fValues[nIndex++] = MomentData.NO_DATA;
			else
				fValues[nIndex++] = scale(dRaw);
		}
		return fValues;
	}


	/**
	 * Wraps decoded values with the metadata of the variable.
	 *
	 * @param fValues values returned by {@link #decode(ucar.ma2.Array)}
	 * @param nRays number of rays
	 * @param nGates number of gates
	 * @return the moment
	 */
	public MomentData toMoment(float[] fValues, int nRays, int nGates)
	{
		return new MomentData(m_sName, m_sUnits, m_sStandardName, m_sLongName, nRays, nGates, fValues,
		   m_bPacked ? m_dScale : Double.NaN, m_bPacked ? m_dOffset : Double.NaN, m_dFill, m_dMissing,
		   m_dValidMin, m_dValidMax, m_sCoordinates, m_oAttributes);
	}


	private float scale(double dRaw)
	{
		if (!m_bPacked)
			return (float)dRaw;
		return (float)(dRaw * m_dScale + m_dOffset);
	}


	/**
	 * Compares a raw floating value with a fill value at the precision of the
	 * storage type. A NaN fill matches NaN raw values.
	 */
	private static boolean sameFloating(double dRaw, double dFill, boolean bFloat)
	{
		if (Double.isNaN(dFill))
			return Double.isNaN(dRaw);
		if (bFloat)
			return (float)dRaw == (float)dFill;
		return dRaw == dFill;
	}


	/**
	 * Converts a fill value to the bits stored by an integer variable.
	 * Unsigned variables accept fills up to the unsigned maximum of the type,
	 * those are stored with the same bits as their negative counterpart.
	 *
	 * @throws DecodeException if the value is not an integer in the range of
	 * the storage type
	 */
	private long toStorage(Number oValue, String sAttr)
	   throws DecodeException
	{
		if (m_oType == DataType.FLOAT || m_oType == DataType.DOUBLE)
			return 0;

		double dValue = oValue.doubleValue();
		long lValue = oValue.longValue();
		if (Double.isNaN(dValue) || Double.isInfinite(dValue) || (!(oValue instanceof Long) && lValue != dValue))
			throw new DecodeException(m_sPath, DecodeException.NO_SWEEP, m_sName, String.format("%s %s is not an integer", sAttr, oValue));

		int nBits;
		switch (m_oType)
		{
			case BYTE:
				nBits = 8;
				break;
			case SHORT:
				nBits = 16;
				break;
			case INT:
				nBits = 32;
				break;
			default:
				return lValue;
		}
		long lMin = -(1L << (nBits - 1));
		long lMax = m_bUnsigned ? (1L << nBits) - 1 : (1L << (nBits - 1)) - 1;
		if (lValue < lMin || lValue > lMax)
			throw new DecodeException(m_sPath, DecodeException.NO_SWEEP, m_sName, String.format("%s %s does not fit in %s storage", sAttr, oValue, m_oType));

		switch (m_oType)
		{
			case BYTE:
				return (byte)lValue;
			case SHORT:
				return (short)lValue;
			default:
				return (int)lValue;
		}
	}


	private Number getNumber(Map<String, Object> oAttrs, String sAttr)
	   throws DecodeException
	{
		Object oValue = oAttrs.get(sAttr);
		if (oValue == null)
			return null;
		if (!(oValue instanceof Number))
			throw new DecodeException(m_sPath, DecodeException.NO_SWEEP, m_sName, String.format("Invalid numeric encoding, %s is \"%s\"", sAttr, oValue));
		return (Number)oValue;
	}


	/**
	 * Reads a valid range bound. Bounds of packed integer variables are given
	 * in the storage type and are unpacked like the data.
	 *
	 * @return the physical bound, NaN if the attribute is absent or not a
	 * number
	 */
	private double getBound(Map<String, Object> oAttrs, String sAttr)
	{
		Object oValue = oAttrs.get(sAttr);
		if (!(oValue instanceof Number))
			return Double.NaN;
		double dBound = ((Number)oValue).doubleValue();
		if (m_bPacked && m_oType != DataType.FLOAT && m_oType != DataType.DOUBLE)
			return dBound * m_dScale + m_dOffset;
		return dBound;
	}


	private static String getText(Map<String, Object> oAttrs, String sAttr)
	{
		Object oValue = oAttrs.get(sAttr);
		return oValue == null ? "" : oValue.toString();
	}
}
