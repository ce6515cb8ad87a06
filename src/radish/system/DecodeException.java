package radish.system;

/**
 * Thrown when the payload of a variable cannot be decoded for a sweep: a
 * declared shape that does not match the sweep extents, a ray range outside
 * of the ray dimension, or an invalid numeric encoding attribute.
 *
 * @author Federal Highway Administration
 */
public class DecodeException extends RadarFileException
{
	public DecodeException(String sPath, int nSweep, String sVariable, String sReason)
	{
		super(sPath, nSweep, sVariable, sReason, null);
	}


	public DecodeException(String sPath, int nSweep, String sVariable, String sReason, Throwable oCause)
	{
		super(sPath, nSweep, sVariable, sReason, oCause);
	}
}
