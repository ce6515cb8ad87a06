package radish.system;

/**
 * Thrown when a file exists but is not a valid NetCDF container.
 *
 * @author Federal Highway Administration
 */
public class FormatException extends RadarFileException
{
	public FormatException(String sPath, String sReason, Throwable oCause)
	{
		super(sPath, NO_SWEEP, null, sReason, oCause);
	}
}
