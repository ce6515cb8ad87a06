package radish.tree;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Array with named dimensions and attributes, the variable type of a
 * {@link DatasetNode}. The values are referenced, not copied.
 *
 * @author Federal Highway Administration
 */
public class LabeledArray
{
	private final String m_sName;


	private final String[] m_sDims;


	private final int[] m_nShape;


	/**
	 * float[], double[] or row-major float[] for two dimensional arrays
	 */
	private final Object m_oValues;


	private final Map<String, Object> m_oAttrs = new LinkedHashMap();


	/**
	 * Constructs a new LabeledArray.
	 *
	 * @param sName variable name
	 * @param sDims dimension names, one per entry of nShape
	 * @param nShape length of each dimension
	 * @param oValues values
	 * @throws IllegalArgumentException if the dimension names and the shape
	 * differ in length
	 */
	public LabeledArray(String sName, String[] sDims, int[] nShape, Object oValues)
	{
		if (sDims.length != nShape.length)
			throw new IllegalArgumentException(String.format("%s has %d dimension names for rank %d", sName, sDims.length, nShape.length));
		m_sName = sName;
		m_sDims = sDims.clone();
		m_nShape = nShape.clone();
		m_oValues = oValues;
	}


	public LabeledArray setAttribute(String sName, Object oValue)
	{
		m_oAttrs.put(sName, oValue);
		return this;
	}


	public String getName()
	{
		return m_sName;
	}


	public String[] getDimensions()
	{
		return m_sDims.clone();
	}


	public int[] getShape()
	{
		return m_nShape.clone();
	}


	public Object getValues()
	{
		return m_oValues;
	}


	public Object getAttribute(String sName)
	{
		return m_oAttrs.get(sName);
	}


	public Map<String, Object> getAttributes()
	{
		return Collections.unmodifiableMap(m_oAttrs);
	}


	/**
	 * @return name, dimensions, shape and attributes, no values
	 */
	public JSONObject toJSON()
	{
		JSONObject oJson = new JSONObject();
		oJson.put("name", m_sName);
		oJson.put("dims", new JSONArray(Arrays.asList(m_sDims)));
		JSONArray oShape = new JSONArray();
		for (int nLen : m_nShape)
			oShape.put(nLen);
		oJson.put("shape", oShape);
		oJson.put("attrs", new JSONObject(m_oAttrs));
		return oJson;
	}
}
