package radish.cfradial;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import radish.model.SweepMetadata;
import radish.model.SweepMode;
import radish.store.NcfContainer;
import radish.system.Config;
import radish.system.DecodeException;
import radish.system.JSONUtil;
import radish.system.SchemaException;
import ucar.ma2.Array;
import ucar.ma2.DataType;

/**
 * Interprets the dimensions and variables of a NetCDF container with the
 * CfRadial1 convention. Produces the sweep table from the sweep start and end
 * ray indices, finds the ray and gate dimensions, and catalogs the moment
 * variables: the numeric variables declared over exactly (ray, gate) that are
 * not coordinates or configured auxiliary variables.
 * <p>
 * Sweep dimensioned variables are read whole. Of the ray dimensioned
 * instrument parameters only the first ray of each sweep is read, gate sized
 * data is never read.
 *
 * @author Federal Highway Administration
 */
public class ConventionMapper
{
	/**
	 * Auxiliary variables that are never moments when no configuration is
	 * provided
	 */
	public static final String[] DEFAULT_AUXILIARY = {"ray_n_gates", "ray_start_index", "ray_start_range", "ray_gate_spacing"};


	/**
	 * Log4j Logger
	 */
	protected Logger m_oLogger = LogManager.getLogger(getClass());


	/**
	 * Name of the ray dimension used when the file has no time variable
	 */
	private final String m_sRayDim;


	/**
	 * Coordinate and auxiliary names excluded from the field catalog
	 */
	private final HashSet<String> m_oReserved = new HashSet();


	/**
	 * Constructs a ConventionMapper configured by the "raydim" and
	 * "auxiliary" keys of its configuration.
	 */
	public ConventionMapper()
	{
		this(Config.getInstance().getConfig(ConventionMapper.class.getName()));
	}


	private ConventionMapper(JSONObject oConfig)
	{
		this(oConfig.optString("raydim", CfRadial.TIME), JSONUtil.optStringArray(oConfig, "auxiliary", DEFAULT_AUXILIARY));
	}


	/**
	 * Constructs a ConventionMapper with the given parameters.
	 *
	 * @param sRayDim name of the ray dimension used when the file has no time
	 * variable
	 * @param sAuxiliary names of variables never treated as moments, in
	 * addition to the coordinates
	 */
	public ConventionMapper(String sRayDim, String... sAuxiliary)
	{
		m_sRayDim = sRayDim;
		m_oReserved.addAll(Arrays.asList(CfRadial.COORDINATE_VARIABLES));
		m_oReserved.addAll(Arrays.asList(sAuxiliary));
	}


	/**
	 * Builds the sweep table, the dimension information and the field
	 * catalog of the given container.
	 *
	 * @param oNc open container
	 * @return the interpretation of the container
	 * @throws SchemaException if sweep_start_ray_index, sweep_end_ray_index,
	 * range or fixed_angle is missing, range is not one-dimensional, the ray
	 * dimension is missing, or the sweep variables disagree in length
	 * @throws DecodeException if a sweep variable cannot be read
	 */
	public ConventionMap map(NcfContainer oNc)
	   throws SchemaException, DecodeException
	{
		String sPath = oNc.getPath();
		for (String sRequired : new String[]{CfRadial.SWEEP_START_RAY_INDEX, CfRadial.SWEEP_END_RAY_INDEX, CfRadial.RANGE, CfRadial.FIXED_ANGLE})
		{
			if (!oNc.hasVariable(sRequired))
				throw new SchemaException(sPath, sRequired, "Required CfRadial1 variable is missing");
		}

		List<String> oRangeDims = oNc.getVariableDimensions(CfRadial.RANGE);
		if (oRangeDims.size() != 1)
			throw new SchemaException(sPath, CfRadial.RANGE, "Range coordinate must be one-dimensional but has " + oRangeDims.size() + " dimensions");
		String sGateDim = oRangeDims.get(0);
		int nGateCount = oNc.getDimensionLength(sGateDim);

		String sRayDim = m_sRayDim;
		List<String> oTimeDims = oNc.getVariableDimensions(CfRadial.TIME);
		if (oTimeDims.size() == 1)
			sRayDim = oTimeDims.get(0);
		int nRayCount = oNc.getDimensionLength(sRayDim);
		if (nRayCount < 0)
			throw new SchemaException(sPath, sRayDim, "Ray dimension is missing");

		Array oStarts = oNc.read(CfRadial.SWEEP_START_RAY_INDEX);
		Array oEnds = oNc.read(CfRadial.SWEEP_END_RAY_INDEX);
		Array oAngles = oNc.read(CfRadial.FIXED_ANGLE);
		int nSweeps = (int)oAngles.getSize();
		if (oStarts.getSize() != nSweeps)
			throw new SchemaException(sPath, CfRadial.SWEEP_START_RAY_INDEX, String.format("Has %d entries but fixed_angle has %d", oStarts.getSize(), nSweeps));
		if (oEnds.getSize() != nSweeps)
			throw new SchemaException(sPath, CfRadial.SWEEP_END_RAY_INDEX, String.format("Has %d entries but fixed_angle has %d", oEnds.getSize(), nSweeps));

		ArrayList<SweepExtent> oSweeps = new ArrayList(nSweeps);
		for (int nIndex = 0; nIndex < nSweeps; nIndex++)
			oSweeps.add(new SweepExtent(nIndex, oStarts.getInt(nIndex), oEnds.getInt(nIndex), oAngles.getDouble(nIndex)));

		ArrayList<String> oFields = new ArrayList();
		for (String sName : oNc.getVariableNames())
		{
			if (m_oReserved.contains(sName)) // coordinates win over moments
				continue;
			List<String> oDims = oNc.getVariableDimensions(sName);
			if (oDims.size() == 2 && oDims.get(0).equals(sRayDim) && oDims.get(1).equals(sGateDim)
			   && isNumeric(oNc.getDataType(sName)))
				oFields.add(sName);
		}

		m_oLogger.debug(String.format("%s: %d sweeps, %d rays, %d gates, fields %s", sPath, nSweeps, nRayCount, nGateCount, oFields));
		return new ConventionMap(oSweeps, oFields, sRayDim, nRayCount, sGateDim, nGateCount);
	}


	/**
	 * Reads the optional sweep settings: sweep_number, sweep_mode,
	 * follow_mode, prt_mode, polarization_mode, target_scan_rate,
	 * ray_angle_res and rays_are_indexed. Settings that are missing, or whose
	 * length does not match the number of sweeps, take their defaults. The
	 * instrument parameters prt, nyquist_velocity and unambiguous_range are
	 * read at the first ray of each sweep; they are NaN when the variable is
	 * missing, is not a numeric ray variable, or the sweep has no valid ray.
	 *
	 * @param oNc open container
	 * @param oMap interpretation of the container
	 * @return the settings of each sweep in sweep order
	 * @throws DecodeException if a present setting cannot be read
	 */
	public List<SweepMetadata> mapSweepMetadata(NcfContainer oNc, ConventionMap oMap)
	   throws DecodeException
	{
		int nSweeps = oMap.getSweepCount();
		int[] nNumbers = readInts(oNc, CfRadial.SWEEP_NUMBER, nSweeps);
		String[] sModes = readStrings(oNc, CfRadial.SWEEP_MODE, nSweeps);
		String[] sFollow = readStrings(oNc, CfRadial.FOLLOW_MODE, nSweeps);
		String[] sPrt = readStrings(oNc, CfRadial.PRT_MODE, nSweeps);
		String[] sPolarization = readStrings(oNc, CfRadial.POLARIZATION_MODE, nSweeps);
		String[] sIndexed = readStrings(oNc, CfRadial.RAYS_ARE_INDEXED, nSweeps);
		double[] dScanRate = readDoubles(oNc, CfRadial.TARGET_SCAN_RATE, nSweeps);
		double[] dAngleRes = readDoubles(oNc, CfRadial.RAY_ANGLE_RES, nSweeps);

		ArrayList<SweepMetadata> oMetadata = new ArrayList(nSweeps);
		for (int nIndex = 0; nIndex < nSweeps; nIndex++)
		{
			double dPrt = readFirstRay(oNc, oMap, CfRadial.PRT, nIndex);
			oMetadata.add(new SweepMetadata(nNumbers == null ? nIndex : nNumbers[nIndex],
			   SweepMode.parse(sModes == null ? null : sModes[nIndex]),
			   oMap.getSweep(nIndex).getFixedAngle(),
			   sFollow == null ? "" : sFollow[nIndex],
			   sPrt == null ? "" : sPrt[nIndex],
			   sPolarization == null ? "" : sPolarization[nIndex],
			   dScanRate == null ? Double.NaN : dScanRate[nIndex],
			   dAngleRes == null ? Double.NaN : dAngleRes[nIndex],
			   sIndexed != null && "true".equalsIgnoreCase(sIndexed[nIndex]),
			   dPrt > 0.0 ? 1.0 / dPrt : Double.NaN,
			   readFirstRay(oNc, oMap, CfRadial.NYQUIST_VELOCITY, nIndex),
			   readFirstRay(oNc, oMap, CfRadial.UNAMBIGUOUS_RANGE, nIndex)));
		}
		return oMetadata;
	}


	/**
	 * Checks that the given storage type holds numbers.
	 *
	 * @param oType storage type, can be null
	 * @return true for the integer and floating point types
	 */
	static boolean isNumeric(DataType oType)
	{
		return oType == DataType.BYTE || oType == DataType.SHORT || oType == DataType.INT
		   || oType == DataType.LONG || oType == DataType.FLOAT || oType == DataType.DOUBLE;
	}


	private int[] readInts(NcfContainer oNc, String sName, int nSweeps)
	   throws DecodeException
	{
		if (!isSweepSized(oNc, sName, nSweeps) || !isNumeric(oNc.getDataType(sName)))
			return null;
		Array oArray = oNc.read(sName);
		int[] nValues = new int[nSweeps];
		for (int nIndex = 0; nIndex < nSweeps; nIndex++)
			nValues[nIndex] = oArray.getInt(nIndex);
		return nValues;
	}


	private double[] readDoubles(NcfContainer oNc, String sName, int nSweeps)
	   throws DecodeException
	{
		if (!isSweepSized(oNc, sName, nSweeps) || !isNumeric(oNc.getDataType(sName)))
			return null;
		Array oArray = oNc.read(sName);
		double[] dValues = new double[nSweeps];
		for (int nIndex = 0; nIndex < nSweeps; nIndex++)
			dValues[nIndex] = oArray.getDouble(nIndex);
		return dValues;
	}


	/**
	 * Reads the value of a ray dimensioned variable at the first ray of a
	 * sweep.
	 *
	 * @return the value, NaN if it is not available
	 */
	private double readFirstRay(NcfContainer oNc, ConventionMap oMap, String sName, int nSweep)
	   throws DecodeException
	{
		List<String> oDims = oNc.getVariableDimensions(sName);
		SweepExtent oSweep = oMap.getSweep(nSweep);
		if (oDims.size() != 1 || !oDims.get(0).equals(oMap.getRayDimension())
		   || !isNumeric(oNc.getDataType(sName)) || !oSweep.isWithin(oMap.getRayCount()))
			return Double.NaN;
		return oNc.readRows(sName, oSweep.getStartRay(), 1, nSweep).getDouble(0);
	}


	private String[] readStrings(NcfContainer oNc, String sName, int nSweeps)
	   throws DecodeException
	{
		if (!isSweepSized(oNc, sName, nSweeps) || oNc.getDataType(sName) != DataType.CHAR)
			return null;
		String[] sValues = oNc.readStrings(sName);
		if (sValues.length != nSweeps)
			return null;
		return sValues;
	}


	/**
	 * @return true if the variable exists and its first dimension has one
	 * entry per sweep
	 */
	private boolean isSweepSized(NcfContainer oNc, String sName, int nSweeps)
	{
		int[] nShape = oNc.getShape(sName);
		if (nShape == null)
			return false;
		if (nShape.length == 0 || nShape[0] != nSweeps)
		{
			m_oLogger.warn(String.format("%s: ignoring %s, expected %d entries", oNc.getPath(), sName, nSweeps));
			return false;
		}
		return true;
	}
}
