package radish.system;

/**
 * Thrown when the path of a radar file does not exist or cannot be read.
 *
 * @author Federal Highway Administration
 */
public class NotFoundException extends RadarFileException
{
	public NotFoundException(String sPath, String sReason)
	{
		super(sPath, NO_SWEEP, null, sReason, null);
	}


	public NotFoundException(String sPath, String sReason, Throwable oCause)
	{
		super(sPath, NO_SWEEP, null, sReason, oCause);
	}
}
