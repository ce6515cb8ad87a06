package radish.system;

/**
 * Thrown when an element required by the CfRadial1 convention is missing or
 * has an unusable layout. The variable name identifies the missing element.
 *
 * @author Federal Highway Administration
 */
public class SchemaException extends RadarFileException
{
	public SchemaException(String sPath, String sVariable, String sReason)
	{
		super(sPath, NO_SWEEP, sVariable, sReason, null);
	}
}
