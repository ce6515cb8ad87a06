package radish.model;

import java.util.Locale;

/**
 * Kind of platform the radar is mounted on, from the platform_type global
 * attribute.
 *
 * @author Federal Highway Administration
 */
public enum PlatformType
{
	FIXED,
	VEHICLE,
	SHIP,
	AIRCRAFT,
	SATELLITE;


	/**
	 * Parses the platform_type text of a file. The aircraft mount variants
	 * (aircraft_fore, aircraft_belly, ...) all map to {@link #AIRCRAFT}.
	 *
	 * @param sType text of the attribute, can be null
	 * @return the matching PlatformType or null if the text is null or not
	 * recognized
	 */
	public static PlatformType parse(String sType)
	{
		if (sType == null)
			return null;

		String sLower = sType.trim().toLowerCase(Locale.ROOT);
		if (sLower.startsWith("aircraft"))
			return AIRCRAFT;

		switch (sLower)
		{
			case "fixed":
				return FIXED;
			case "vehicle":
				return VEHICLE;
			case "ship":
				return SHIP;
			case "satellite":
				return SATELLITE;
			default:
				return null;
		}
	}
}
