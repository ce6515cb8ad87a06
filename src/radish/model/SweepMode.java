package radish.model;

import java.util.Locale;

/**
 * Scan strategy of a sweep as declared by the sweep_mode variable of a
 * CfRadial file.
 *
 * @author Federal Highway Administration
 */
public enum SweepMode
{
	AZIMUTH_SURVEILLANCE,
	ELEVATION_SURVEILLANCE,
	SECTOR,
	COPLANE,
	POINTING,
	MANUAL_PPI,
	MANUAL_RHI,
	IDLE,
	CALIBRATION,
	VERTICAL_POINTING;


	/**
	 * Parses the sweep mode text stored in a file. Both the CfRadial names and
	 * the common short forms are accepted, case is ignored.
	 *
	 * @param sMode text of the sweep mode, can be null
	 * @return the matching SweepMode, {@link #AZIMUTH_SURVEILLANCE} if the text
	 * is null or not recognized
	 */
	public static SweepMode parse(String sMode)
	{
		if (sMode == null)
			return AZIMUTH_SURVEILLANCE;

		switch (sMode.trim().toLowerCase(Locale.ROOT))
		{
			case "elevation_surveillance":
			case "rhi":
				return ELEVATION_SURVEILLANCE;
			case "sector":
			case "sec":
				return SECTOR;
			case "coplane":
				return COPLANE;
			case "pointing":
			case "pnt":
				return POINTING;
			case "manual_ppi":
				return MANUAL_PPI;
			case "manual_rhi":
				return MANUAL_RHI;
			case "idle":
				return IDLE;
			case "calibration":
			case "cal":
				return CALIBRATION;
			case "vertical_pointing":
			case "vert":
				return VERTICAL_POINTING;
			default: // azimuth_surveillance, ppi, sur and anything unknown
				return AZIMUTH_SURVEILLANCE;
		}
	}


	/**
	 * @return the CfRadial name of the mode, for example "azimuth_surveillance"
	 */
	public String getCfName()
	{
		return name().toLowerCase(Locale.ROOT);
	}
}
