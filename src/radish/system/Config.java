package radish.system;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Singleton that manages the configurable parameters of the decoder. Each
 * configuration name maps to a JSON file named after the name with '.'
 * replaced by '_'. Files are first looked up on the classpath in the config
 * resource folder and then in the directory given by the
 * {@link #CONFIG_DIR_PROPERTY} system property, so files on disk override
 * the packaged defaults key by key.
 *
 * @author Federal Highway Administration
 */
public class Config
{
	/**
	 * System property that names the directory containing override
	 * configuration files
	 */
	public static final String CONFIG_DIR_PROPERTY = "radish.config.dir";


	/**
	 * Classpath folder that contains the default configuration files
	 */
	private static final String RESOURCE_DIR = "/config/";


	/**
	 * Singleton instance
	 */
	private static final Config g_oConfig = new Config();


	/**
	 * Log4j Logger
	 */
	private final Logger m_oLogger = LogManager.getLogger(Config.class);


	/**
	 * Default constructor. Does nothing.
	 */
	private Config()
	{
	}


	/**
	 * Gets the singleton instance
	 * @return The singleton instance
	 */
	public static Config getInstance()
	{
		return g_oConfig;
	}


	/**
	 * Creates a JSONObject that contains the merged configuration of all the
	 * given names. Names later in the list override keys from names earlier
	 * in the list.
	 *
	 * @param sConfigNames configuration names, usually fully qualified class
	 * names
	 * @return JSONObject with the merged configuration, empty if no file was
	 * found for any of the names
	 */
	public JSONObject getConfig(String... sConfigNames)
	{
		JSONObject oConfig = new JSONObject();
		getConfig(oConfig, sConfigNames);
		return oConfig;
	}


	/**
	 * Merges the configuration files for the given names into the given
	 * JSONObject.
	 *
	 * @param oConfigObj object that receives the configuration keys
	 * @param sConfigNames configuration names, usually fully qualified class
	 * names
	 */
	public void getConfig(JSONObject oConfigObj, String... sConfigNames)
	{
		String sDir = System.getProperty(CONFIG_DIR_PROPERTY);
		for (String sConfig : sConfigNames)
		{
			String sFilename = sConfig.replace('.', '_') + ".json";
			try (InputStream oIn = Config.class.getResourceAsStream(RESOURCE_DIR + sFilename))
			{
				if (oIn != null)
					merge(oConfigObj, new InputStreamReader(oIn, StandardCharsets.UTF_8));
			}
			catch (IOException | JSONException oEx)
			{
				m_oLogger.error(String.format("Failed to load default configuration for %s", sConfig));
				m_oLogger.error(oEx, oEx);
			}

			if (sDir == null || sDir.isEmpty())
				continue;

			Path oFile = Paths.get(sDir, sFilename);
			if (!Files.exists(oFile))
				continue;

			try (BufferedReader oIn = Files.newBufferedReader(oFile, StandardCharsets.UTF_8))
			{
				merge(oConfigObj, oIn);
			}
			catch (IOException | JSONException oEx)
			{
				m_oLogger.error(String.format("Failed to load configuration for %s from %s", sConfig, oFile));
				m_oLogger.error(oEx, oEx);
			}
		}
	}


	/**
	 * Copies every key of the JSON document read from the given Reader into
	 * the given JSONObject, replacing existing keys.
	 *
	 * @param oConfigObj object that receives the keys
	 * @param oIn source of the JSON document
	 */
	private static void merge(JSONObject oConfigObj, Reader oIn)
	{
		JSONObject oOverWrite = new JSONObject(new JSONTokener(oIn));
		for (String sKey : oOverWrite.keySet())
			oConfigObj.put(sKey, oOverWrite.get(sKey));
	}
}
