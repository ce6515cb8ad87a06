package radish.cfradial;

/**
 * Names of the dimensions, variables and attributes defined by the CfRadial1
 * convention that the decoder relies on.
 *
 * @author Federal Highway Administration
 */
public abstract class CfRadial
{
	public static final String TIME = "time";
	public static final String RANGE = "range";
	public static final String AZIMUTH = "azimuth";
	public static final String ELEVATION = "elevation";
	public static final String SWEEP = "sweep";

	public static final String SWEEP_START_RAY_INDEX = "sweep_start_ray_index";
	public static final String SWEEP_END_RAY_INDEX = "sweep_end_ray_index";
	public static final String FIXED_ANGLE = "fixed_angle";
	public static final String SWEEP_NUMBER = "sweep_number";
	public static final String SWEEP_MODE = "sweep_mode";
	public static final String FOLLOW_MODE = "follow_mode";
	public static final String PRT_MODE = "prt_mode";
	public static final String POLARIZATION_MODE = "polarization_mode";
	public static final String TARGET_SCAN_RATE = "target_scan_rate";
	public static final String RAY_ANGLE_RES = "ray_angle_res";
	public static final String RAYS_ARE_INDEXED = "rays_are_indexed";

	/**
	 * Instrument parameters stored per ray, summarized by the first ray of
	 * each sweep
	 */
	public static final String PRT = "prt";
	public static final String NYQUIST_VELOCITY = "nyquist_velocity";
	public static final String UNAMBIGUOUS_RANGE = "unambiguous_range";

	public static final String LATITUDE = "latitude";
	public static final String LONGITUDE = "longitude";
	public static final String ALTITUDE = "altitude";
	public static final String ALTITUDE_AGL = "altitude_agl";
	public static final String VOLUME_NUMBER = "volume_number";
	public static final String FREQUENCY = "frequency";
	public static final String PLATFORM_TYPE = "platform_type";
	public static final String TIME_COVERAGE_START = "time_coverage_start";
	public static final String TIME_COVERAGE_END = "time_coverage_end";

	/**
	 * Dimension of the gate storage used by ragged files
	 */
	public static final String N_POINTS = "n_points";

	public static final String INSTRUMENT_NAME = "instrument_name";
	public static final String INSTITUTION = "institution";
	public static final String SITE_NAME = "site_name";
	public static final String CONVENTIONS = "Conventions";

	public static final String UNITS = "units";
	public static final String STANDARD_NAME = "standard_name";
	public static final String LONG_NAME = "long_name";
	public static final String SCALE_FACTOR = "scale_factor";
	public static final String ADD_OFFSET = "add_offset";
	public static final String FILL_VALUE = "_FillValue";
	public static final String MISSING_VALUE = "missing_value";
	public static final String VALID_MIN = "valid_min";
	public static final String VALID_MAX = "valid_max";
	public static final String COORDINATES = "coordinates";

	/**
	 * Coordinate variables, never treated as moments
	 */
	public static final String[] COORDINATE_VARIABLES = {TIME, RANGE, AZIMUTH, ELEVATION};


	private CfRadial()
	{
	}
}
