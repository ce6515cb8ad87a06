package radish.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Node of a hierarchical dataset: attributes, coordinate variables, data
 * variables and child nodes, all kept in insertion order.
 *
 * @author Federal Highway Administration
 */
public class DatasetNode
{
	private final String m_sName;


	private final Map<String, Object> m_oAttrs = new LinkedHashMap();


	private final Map<String, LabeledArray> m_oCoords = new LinkedHashMap();


	private final Map<String, LabeledArray> m_oDataVars = new LinkedHashMap();


	private final List<DatasetNode> m_oChildren = new ArrayList();


	public DatasetNode(String sName)
	{
		m_sName = sName;
	}


	public String getName()
	{
		return m_sName;
	}


	public void setAttribute(String sName, Object oValue)
	{
		m_oAttrs.put(sName, oValue);
	}


	public Object getAttribute(String sName)
	{
		return m_oAttrs.get(sName);
	}


	public Map<String, Object> getAttributes()
	{
		return Collections.unmodifiableMap(m_oAttrs);
	}


	public void addCoordinate(LabeledArray oArray)
	{
		m_oCoords.put(oArray.getName(), oArray);
	}


	public LabeledArray getCoordinate(String sName)
	{
		return m_oCoords.get(sName);
	}


	public Map<String, LabeledArray> getCoordinates()
	{
		return Collections.unmodifiableMap(m_oCoords);
	}


	public void addDataVariable(LabeledArray oArray)
	{
		m_oDataVars.put(oArray.getName(), oArray);
	}


	public LabeledArray getDataVariable(String sName)
	{
		return m_oDataVars.get(sName);
	}


	public Map<String, LabeledArray> getDataVariables()
	{
		return Collections.unmodifiableMap(m_oDataVars);
	}


	public void addChild(DatasetNode oChild)
	{
		m_oChildren.add(oChild);
	}


	/**
	 * @param sName child name
	 * @return the child with the given name or null
	 */
	public DatasetNode getChild(String sName)
	{
		for (DatasetNode oChild : m_oChildren)
		{
			if (oChild.m_sName.equals(sName))
				return oChild;
		}
		return null;
	}


	public List<DatasetNode> getChildren()
	{
		return Collections.unmodifiableList(m_oChildren);
	}


	/**
	 * Renders the structure of the node and its descendants. Sample values
	 * are left out.
	 *
	 * @return JSON description of the node
	 */
	public JSONObject toJSON()
	{
		JSONObject oJson = new JSONObject();
		oJson.put("name", m_sName);
		oJson.put("attrs", new JSONObject(m_oAttrs));

		JSONArray oCoords = new JSONArray();
		for (LabeledArray oArray : m_oCoords.values())
			oCoords.put(oArray.toJSON());
		oJson.put("coords", oCoords);

		JSONArray oVars = new JSONArray();
		for (LabeledArray oArray : m_oDataVars.values())
			oVars.put(oArray.toJSON());
		oJson.put("data_vars", oVars);

		JSONArray oChildren = new JSONArray();
		for (DatasetNode oChild : m_oChildren)
			oChildren.put(oChild.toJSON());
		oJson.put("children", oChildren);
		return oJson;
	}
}
