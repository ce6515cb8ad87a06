package radish.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import radish.system.DecodeException;
import radish.system.FormatException;
import radish.system.NotFoundException;
import radish.system.RadarFileException;
import ucar.ma2.Array;
import ucar.ma2.ArrayChar;
import ucar.ma2.DataType;
import ucar.ma2.InvalidRangeException;
import ucar.nc2.Attribute;
import ucar.nc2.Dimension;
import ucar.nc2.NetcdfFile;
import ucar.nc2.Variable;

/**
 * Read session on a NetCDF container. Wraps a {@link ucar.nc2.NetcdfFile}
 * opened with UCAR's NetCDF library and gives typed access to the global
 * attributes, the dimensions and the variables of the root group. Variable
 * payloads can be read whole or as a block of rows of their first dimension
 * so a sweep only touches its own rays.
 * <p>
 * Instances hold an open file handle and must be closed, use them in a
 * try-with-resources block.
 *
 * @see ucar.nc2.NetcdfFile#open(java.lang.String)
 * @author Federal Highway Administration
 */
public class NcfContainer implements AutoCloseable
{
	/**
	 * Attribute that marks integer storage as unsigned in NetCDF-3 files
	 */
	public static final String UNSIGNED = "_Unsigned";


	/**
	 * Log4j Logger
	 */
	private static final Logger m_oLogger = LogManager.getLogger(NcfContainer.class);


	/**
	 * Original file loaded by the NetCDF library
	 */
	private final NetcdfFile m_oNcFile;


	/**
	 * Path of the file
	 */
	private final String m_sPath;


	/**
	 * Constructs a container around an already opened file.
	 * @param oNcFile file opened by the NetCDF library
	 * @param sPath path of the file used in error messages
	 */
	private NcfContainer(NetcdfFile oNcFile, String sPath)
	{
		m_oNcFile = oNcFile;
		m_sPath = sPath;
	}


	/**
	 * Opens the NetCDF container at the given path.
	 *
	 * @param oPath path of the file
	 * @return an open container, the caller is responsible for closing it
	 * @throws NotFoundException if the path does not exist or is not a
	 * readable regular file
	 * @throws FormatException if the file is not a valid NetCDF container
	 */
	public static NcfContainer open(Path oPath)
	   throws NotFoundException, FormatException
	{
		String sPath = oPath.toString();
		if (!Files.exists(oPath))
			throw new NotFoundException(sPath, "File does not exist");
		if (!Files.isRegularFile(oPath) || !Files.isReadable(oPath))
			throw new NotFoundException(sPath, "File is not a readable regular file");

		NetcdfFile oNcFile;
		try
		{
			oNcFile = NetcdfFile.open(sPath);
		}
		catch (IOException oEx)
		{
			throw new FormatException(sPath, "Not a valid NetCDF container", oEx);
		}
		m_oLogger.debug("Opened " + sPath);
		return new NcfContainer(oNcFile, sPath);
	}


	public String getPath()
	{
		return m_sPath;
	}


	/**
	 * Gets the global attributes in file order. Values are the first element
	 * of the attribute, a String for text attributes and a Number otherwise.
	 *
	 * @return ordered map of attribute name to value
	 */
	public Map<String, Object> getGlobalAttributes()
	{
		return toMap(m_oNcFile.getGlobalAttributes());
	}


	/**
	 * Gets the String value of a global attribute.
	 *
	 * @param sName attribute name
	 * @return the text of the attribute, the decimal representation of a
	 * numeric attribute, or null if the attribute does not exist
	 */
	public String getGlobalString(String sName)
	{
		Attribute oAttr = m_oNcFile.findGlobalAttribute(sName);
		if (oAttr == null)
			return null;
		if (oAttr.isString())
			return oAttr.getStringValue();
		Number oNum = oAttr.getNumericValue();
		return oNum == null ? null : oNum.toString();
	}


	/**
	 * Gets the dimensions of the container in file order.
	 *
	 * @return ordered map of dimension name to length
	 */
	public Map<String, Integer> getDimensions()
	{
		LinkedHashMap<String, Integer> oDims = new LinkedHashMap();
		for (Dimension oDim : m_oNcFile.getDimensions())
			oDims.put(oDim.getShortName(), oDim.getLength());
		return oDims;
	}


	/**
	 * @param sName dimension name
	 * @return length of the dimension or -1 if it does not exist
	 */
	public int getDimensionLength(String sName)
	{
		Dimension oDim = m_oNcFile.findDimension(sName);
		if (oDim == null)
			return -1;
		return oDim.getLength();
	}


	/**
	 * @return names of the variables of the root group in file order
	 */
	public List<String> getVariableNames()
	{
		ArrayList<String> oNames = new ArrayList();
		for (Variable oVar : m_oNcFile.getVariables())
			oNames.add(oVar.getShortName());
		return oNames;
	}


	public boolean hasVariable(String sName)
	{
		return findVariable(sName) != null;
	}


	/**
	 * Gets the names of the dimensions the given variable is declared over.
	 *
	 * @param sName variable name
	 * @return ordered dimension names, empty for scalars and for variables
	 * that do not exist
	 */
	public List<String> getVariableDimensions(String sName)
	{
		Variable oVar = findVariable(sName);
		if (oVar == null)
			return Collections.emptyList();

		ArrayList<String> oNames = new ArrayList();
		for (Dimension oDim : oVar.getDimensions())
			oNames.add(oDim.getShortName());
		return oNames;
	}


	/**
	 * @param sName variable name
	 * @return declared shape of the variable, null if it does not exist
	 */
	public int[] getShape(String sName)
	{
		Variable oVar = findVariable(sName);
		if (oVar == null)
			return null;
		return oVar.getShape();
	}


	/**
	 * @param sName variable name
	 * @return storage type of the variable, null if it does not exist
	 */
	public DataType getDataType(String sName)
	{
		Variable oVar = findVariable(sName);
		if (oVar == null)
			return null;
		return oVar.getDataType();
	}


	/**
	 * Checks the {@link #UNSIGNED} attribute of the given variable.
	 *
	 * @param sName variable name
	 * @return true if the integer storage of the variable is unsigned
	 */
	public boolean isUnsigned(String sName)
	{
		Variable oVar = findVariable(sName);
		if (oVar == null)
			return false;
		Attribute oAttr = oVar.findAttribute(UNSIGNED);
		return oAttr != null && oAttr.isString() && "true".equalsIgnoreCase(oAttr.getStringValue().trim());
	}


	/**
	 * Gets the attributes of the given variable in file order. Values are the
	 * first element of the attribute, a String for text attributes and a
	 * Number otherwise.
	 *
	 * @param sName variable name
	 * @return ordered map of attribute name to value, empty if the variable
	 * does not exist
	 */
	public Map<String, Object> getVariableAttributes(String sName)
	{
		Variable oVar = findVariable(sName);
		if (oVar == null)
			return Collections.emptyMap();
		return toMap(oVar.getAttributes());
	}


	/**
	 * Reads the whole payload of a variable.
	 *
	 * @param sName variable name
	 * @return the data read from the file
	 * @throws DecodeException if the variable does not exist or the read fails
	 */
	public Array read(String sName)
	   throws DecodeException
	{
		Variable oVar = requireVariable(sName);
		try
		{
			return oVar.read();
		}
		catch (IOException oEx)
		{
			throw new DecodeException(m_sPath, RadarFileException.NO_SWEEP, sName, "Failed to read variable", oEx);
		}
	}


	/**
	 * Reads a block of rows of a variable: the rows [nStart, nStart + nCount)
	 * of the first dimension and every element of the remaining dimensions.
	 * Rows outside of the block are not read from the file.
	 *
	 * @param sName variable name
	 * @param nStart first row to read
	 * @param nCount number of rows to read
	 * @param nSweep sweep index the rows belong to, used in error messages
	 * @return the data read from the file with shape [nCount, ...]
	 * @throws DecodeException if the variable does not exist, is a scalar,
	 * or the requested rows are outside of its first dimension
	 */
	public Array readRows(String sName, int nStart, int nCount, int nSweep)
	   throws DecodeException
	{
		Variable oVar = requireVariable(sName);
		int[] nShape = oVar.getShape();
		if (nShape.length == 0)
			throw new DecodeException(m_sPath, nSweep, sName, "Cannot read rows of a scalar variable");
		if (nStart < 0 || nCount < 0 || nStart + nCount > nShape[0])
			throw new DecodeException(m_sPath, nSweep, sName, String.format("Rows [%d, %d) outside of declared length %d", nStart, nStart + nCount, nShape[0]));

		int[] nOrigin = new int[nShape.length];
		nOrigin[0] = nStart;
		nShape[0] = nCount;
		try
		{
			return oVar.read(nOrigin, nShape);
		}
		catch (IOException | InvalidRangeException oEx)
		{
			throw new DecodeException(m_sPath, nSweep, sName, "Failed to read rows", oEx);
		}
	}


	/**
	 * Reads a CHAR variable shaped (n, string_length) as n trimmed Strings.
	 * A 1-D CHAR variable is read as a single String.
	 *
	 * @param sName variable name
	 * @return the Strings stored in the variable
	 * @throws DecodeException if the variable does not exist, is not a CHAR
	 * variable or the read fails
	 */
	public String[] readStrings(String sName)
	   throws DecodeException
	{
		Variable oVar = requireVariable(sName);
		if (oVar.getDataType() != DataType.CHAR)
			throw new DecodeException(m_sPath, RadarFileException.NO_SWEEP, sName, "Expected a CHAR variable but found " + oVar.getDataType());

		ArrayChar oChars = (ArrayChar)read(sName);
		if (oVar.getRank() <= 1)
			return new String[]{oChars.getString().trim()};

		String[] sValues = new String[oVar.getShape()[0]];
		for (int nIndex = 0; nIndex < sValues.length; nIndex++)
			sValues[nIndex] = oChars.getString(nIndex).trim();
		return sValues;
	}


	/**
	 * Closes the file handle. Failures are logged since nothing useful can
	 * be done with them once the data has been read.
	 */
	@Override
	public void close()
	{
		try
		{
			m_oNcFile.close();
			m_oLogger.debug("Closed " + m_sPath);
		}
		catch (IOException oEx)
		{
			m_oLogger.error(oEx, oEx);
		}
	}


	private Variable findVariable(String sName)
	{
		return m_oNcFile.getRootGroup().findVariable(sName);
	}


	private Variable requireVariable(String sName)
	   throws DecodeException
	{
		Variable oVar = findVariable(sName);
		if (oVar == null)
			throw new DecodeException(m_sPath, RadarFileException.NO_SWEEP, sName, "Variable does not exist");
		return oVar;
	}


	private static Map<String, Object> toMap(List<Attribute> oAttrs)
	{
		LinkedHashMap<String, Object> oMap = new LinkedHashMap();
		for (Attribute oAttr : oAttrs)
		{
			Object oValue;
			if (oAttr.isString())
				oValue = oAttr.getStringValue();
			else
				oValue = oAttr.getNumericValue();
			if (oValue != null)
				oMap.put(oAttr.getShortName(), oValue);
		}
		return oMap;
	}
}
