package radish.system;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Typed accessors for arrays stored in configuration objects.
 *
 * @author Federal Highway Administration
 */
public abstract class JSONUtil
{
	private JSONUtil()
	{
	}


	public static JSONArray optJSONArray(JSONObject oObj, String sKey)
	{
		JSONArray oRet = oObj.optJSONArray(sKey);
		if (oRet == null)
		{
			oRet = new JSONArray();
		}
		return oRet;
	}


	public static String[] getStringArray(JSONObject oObj, String sKey)
	{
		JSONArray oArr = optJSONArray(oObj, sKey);
		String[] sRet = new String[oArr.length()];
		for (int nIndex = 0; nIndex < sRet.length; nIndex++)
			sRet[nIndex] = oArr.getString(nIndex);

		return sRet;
	}


	/**
	 * Gets the String array stored at the given key. The default is only
	 * used when the key is not present at all, an empty array in the
	 * configuration stays empty.
	 *
	 * @param oObj configuration object
	 * @param sKey key of the array
	 * @param sDefault values returned if the key does not exist
	 * @return the configured values or the default
	 */
	public static String[] optStringArray(JSONObject oObj, String sKey, String... sDefault)
	{
		String[] sRet = getStringArray(oObj, sKey);
		if (sRet.length == 0 && !oObj.has(sKey))
			sRet = sDefault;

		return sRet;
	}
}
