package radish;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import ucar.ma2.Array;
import ucar.ma2.ArrayChar;
import ucar.ma2.DataType;
import ucar.ma2.Index;
import ucar.ma2.InvalidRangeException;
import ucar.nc2.Attribute;
import ucar.nc2.NetcdfFileWriter;
import ucar.nc2.Variable;

/**
 * Writes small CfRadial1 NetCDF-3 files for tests. Defaults describe a two
 * sweep PPI volume of 180 rays and 500 gates without any moment; each setter
 * changes one aspect of the file.
 */
public class CfRadialFixture
{
	/**
	 * Raw value of a moment at a position
	 */
	public interface RawValue
	{
		double get(int nRay, int nGate);
	}


	private static class Moment
	{
		String m_sName;
		DataType m_oType;
		RawValue m_oValues;
		LinkedHashMap<String, Attribute> m_oAttrs = new LinkedHashMap();
	}


	private int m_nRays = 180;
	private int m_nGates = 500;
	private int[] m_nStarts = {0, 100};
	private int[] m_nEnds = {99, 179};
	private float[] m_fFixedAngles = {0.5f, 1.5f};
	private String[] m_sModes = {"azimuth_surveillance", "azimuth_surveillance"};
	private boolean m_bEndIndex = true;
	private boolean m_bTime = true;
	private boolean m_bAzimuth = true;
	private boolean m_bLocation = true;
	private boolean m_bRagged = false;
	private float[] m_fRange;
	private final LinkedHashMap<String, Attribute> m_oGlobals = new LinkedHashMap();
	private final ArrayList<Moment> m_oMoments = new ArrayList();
	private final ArrayList<Moment> m_oRayVars = new ArrayList();


	public CfRadialFixture()
	{
		global("Conventions", "CF/Radial instrument_parameters");
		global("instrument_name", "KTLX");
		global("institution", "NOAA");
		global("site_name", "Oklahoma City");
		global("time_coverage_start", "2020-05-01T12:00:00Z");
		global("time_coverage_end", "2020-05-01T12:04:30Z");
		global("platform_type", "fixed");
	}


	public CfRadialFixture rays(int nRays)
	{
		m_nRays = nRays;
		return this;
	}


	public CfRadialFixture gates(int nGates)
	{
		m_nGates = nGates;
		return this;
	}


	public CfRadialFixture sweeps(int[] nStarts, int[] nEnds, float[] fFixedAngles)
	{
		m_nStarts = nStarts;
		m_nEnds = nEnds;
		m_fFixedAngles = fFixedAngles;
		m_sModes = new String[nStarts.length];
		for (int nIndex = 0; nIndex < m_sModes.length; nIndex++)
			m_sModes[nIndex] = "azimuth_surveillance";
		return this;
	}


	public CfRadialFixture modes(String... sModes)
	{
		m_sModes = sModes;
		return this;
	}


	public CfRadialFixture withoutEndIndex()
	{
		m_bEndIndex = false;
		return this;
	}


	public CfRadialFixture withoutTime()
	{
		m_bTime = false;
		return this;
	}


	public CfRadialFixture withoutAzimuth()
	{
		m_bAzimuth = false;
		return this;
	}


	/**
	 * Leaves out latitude, longitude, altitude and every global attribute
	 */
	public CfRadialFixture bare()
	{
		m_bLocation = false;
		m_oGlobals.clear();
		return this;
	}


	public CfRadialFixture ragged()
	{
		m_bRagged = true;
		return this;
	}


	public CfRadialFixture range(float... fRange)
	{
		m_fRange = fRange;
		m_nGates = fRange.length;
		return this;
	}


	public CfRadialFixture global(String sName, String sValue)
	{
		m_oGlobals.put(sName, new Attribute(sName, sValue));
		return this;
	}


	/**
	 * Adds a moment over (time, range).
	 *
	 * @param sName variable name
	 * @param oType storage type
	 * @param oValues raw values
	 * @param oAttrs attribute name, value pairs: String or Number values
	 */
	public CfRadialFixture moment(String sName, DataType oType, RawValue oValues, Object... oAttrs)
	{
		Moment oMoment = new Moment();
		oMoment.m_sName = sName;
		oMoment.m_oType = oType;
		oMoment.m_oValues = oValues;
		for (int nIndex = 0; nIndex < oAttrs.length; nIndex += 2)
		{
			String sAttr = (String)oAttrs[nIndex];
			Object oValue = oAttrs[nIndex + 1];
			if (oValue instanceof String)
				oMoment.m_oAttrs.put(sAttr, new Attribute(sAttr, (String)oValue));
			else
				oMoment.m_oAttrs.put(sAttr, new Attribute(sAttr, (Number)oValue));
		}
		m_oMoments.add(oMoment);
		return this;
	}


	/**
	 * Adds a variable over time only, such as an instrument parameter.
	 *
	 * @param sName variable name
	 * @param oType storage type
	 * @param oValues raw values, called with gate 0
	 */
	public CfRadialFixture rayVariable(String sName, DataType oType, RawValue oValues)
	{
		Moment oVar = new Moment();
		oVar.m_sName = sName;
		oVar.m_oType = oType;
		oVar.m_oValues = oValues;
		m_oRayVars.add(oVar);
		return this;
	}


	/**
	 * Adds the DBZ moment of the two sweep scenario: SHORT storage, scale
	 * 0.01, fill -32768. Raw values are -32768 at (0, 0), 500 at (0, 1) and
	 * (ray + gate) % 1000 elsewhere.
	 */
	public CfRadialFixture dbz()
	{
		return moment("DBZ", DataType.SHORT, CfRadialFixture::dbzRaw,
		   "units", "dBZ", "standard_name", "equivalent_reflectivity_factor",
		   "scale_factor", 0.01f, "add_offset", 0.0f, "_FillValue", (short)-32768);
	}


	public static double dbzRaw(int nRay, int nGate)
	{
		if (nRay == 0 && nGate == 0)
			return -32768;
		if (nRay == 0 && nGate == 1)
			return 500;
		return (nRay + nGate) % 1000;
	}


	public Path write(Path oDir, String sFilename)
	   throws IOException, InvalidRangeException
	{
		Path oPath = oDir.resolve(sFilename);
		int nSweeps = m_fFixedAngles.length;
		NetcdfFileWriter oWriter = NetcdfFileWriter.createNew(NetcdfFileWriter.Version.netcdf3, oPath.toString());
		oWriter.addDimension(null, "time", m_nRays);
		oWriter.addDimension(null, "range", m_nGates);
		oWriter.addDimension(null, "sweep", nSweeps);
		oWriter.addDimension(null, "string_length", 32);
		if (m_bRagged)
			oWriter.addDimension(null, "n_points", m_nRays * m_nGates);

		for (Attribute oAttr : m_oGlobals.values())
			oWriter.addGroupAttribute(null, oAttr);

		LinkedHashMap<Variable, Array> oData = new LinkedHashMap();
		if (m_bTime)
			oData.put(oWriter.addVariable(null, "time", DataType.DOUBLE, "time"), rayArray(DataType.DOUBLE, 0.0, 1.5));
		Variable oRange = oWriter.addVariable(null, "range", DataType.FLOAT, "range");
		oWriter.addVariableAttribute(oRange, new Attribute("units", "meters"));
		oData.put(oRange, rangeArray());
		if (m_bAzimuth)
			oData.put(oWriter.addVariable(null, "azimuth", DataType.FLOAT, "time"), rayArray(DataType.FLOAT, 0.0, 2.0));
		oData.put(oWriter.addVariable(null, "elevation", DataType.FLOAT, "time"), rayArray(DataType.FLOAT, 0.5, 0.0));

		oData.put(oWriter.addVariable(null, "sweep_number", DataType.INT, "sweep"), sweepInts(null));
		oData.put(oWriter.addVariable(null, "sweep_start_ray_index", DataType.INT, "sweep"), sweepInts(m_nStarts));
		if (m_bEndIndex)
			oData.put(oWriter.addVariable(null, "sweep_end_ray_index", DataType.INT, "sweep"), sweepInts(m_nEnds));
		oData.put(oWriter.addVariable(null, "fixed_angle", DataType.FLOAT, "sweep"), Array.factory(DataType.FLOAT, new int[]{nSweeps}, m_fFixedAngles.clone()));
		ArrayChar oModes = new ArrayChar.D2(nSweeps, 32);
		for (int nIndex = 0; nIndex < nSweeps; nIndex++)
			oModes.setString(nIndex, m_sModes[nIndex]);
		oData.put(oWriter.addVariable(null, "sweep_mode", DataType.CHAR, "sweep string_length"), oModes);

		if (m_bLocation)
		{
			oData.put(oWriter.addVariable(null, "latitude", DataType.DOUBLE, ""), Array.factory(DataType.DOUBLE, new int[0], new double[]{35.333}));
			oData.put(oWriter.addVariable(null, "longitude", DataType.DOUBLE, ""), Array.factory(DataType.DOUBLE, new int[0], new double[]{-97.278}));
			oData.put(oWriter.addVariable(null, "altitude", DataType.DOUBLE, ""), Array.factory(DataType.DOUBLE, new int[0], new double[]{370.0}));
			oData.put(oWriter.addVariable(null, "volume_number", DataType.INT, ""), Array.factory(DataType.INT, new int[0], new int[]{42}));
		}

		for (Moment oRayVar : m_oRayVars)
		{
			Array oArray = Array.factory(oRayVar.m_oType, new int[]{m_nRays});
			for (int nRay = 0; nRay < m_nRays; nRay++)
				oArray.setDouble(nRay, oRayVar.m_oValues.get(nRay, 0));
			oData.put(oWriter.addVariable(null, oRayVar.m_sName, oRayVar.m_oType, "time"), oArray);
		}

		for (Moment oMoment : m_oMoments)
		{
			Variable oVar = oWriter.addVariable(null, oMoment.m_sName, oMoment.m_oType, "time range");
			for (Attribute oAttr : oMoment.m_oAttrs.values())
				oWriter.addVariableAttribute(oVar, oAttr);
			Array oArray = Array.factory(oMoment.m_oType, new int[]{m_nRays, m_nGates});
			Index oIndex = oArray.getIndex();
			for (int nRay = 0; nRay < m_nRays; nRay++)
			{
				for (int nGate = 0; nGate < m_nGates; nGate++)
					oArray.setDouble(oIndex.set(nRay, nGate), oMoment.m_oValues.get(nRay, nGate));
			}
			oData.put(oVar, oArray);
		}

		oWriter.create();
		for (Map.Entry<Variable, Array> oEntry : oData.entrySet())
			oWriter.write(oEntry.getKey(), oEntry.getValue());
		oWriter.close();
		return oPath;
	}


	private Array rayArray(DataType oType, double dStart, double dStep)
	{
		Array oArray = Array.factory(oType, new int[]{m_nRays});
		for (int nRay = 0; nRay < m_nRays; nRay++)
			oArray.setDouble(nRay, dStart + nRay * dStep);
		return oArray;
	}


	private Array rangeArray()
	{
		Array oArray = Array.factory(DataType.FLOAT, new int[]{m_nGates});
		for (int nGate = 0; nGate < m_nGates; nGate++)
			oArray.setFloat(nGate, m_fRange == null ? 125f + nGate * 250f : m_fRange[nGate]);
		return oArray;
	}


	private Array sweepInts(int[] nValues)
	{
		int nSweeps = m_fFixedAngles.length;
		int[] nData = new int[nSweeps];
		for (int nIndex = 0; nIndex < nSweeps; nIndex++)
			nData[nIndex] = nValues == null ? nIndex : nValues[nIndex];
		return Array.factory(DataType.INT, new int[]{nSweeps}, nData);
	}
}
