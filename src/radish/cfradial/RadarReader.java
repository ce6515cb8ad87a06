package radish.cfradial;

import java.nio.file.Path;
import radish.model.SweepData;
import radish.model.VolumeData;
import radish.model.VolumeMetadata;
import radish.system.DecodeException;
import radish.system.FormatException;
import radish.system.NotFoundException;
import radish.system.SchemaException;

/**
 * Decoder of one radar file format. A scan reads only the summary of a
 * volume, a read decodes every sweep. Every call opens and closes its own
 * file handle so implementations hold no state between calls.
 *
 * @author Federal Highway Administration
 */
public interface RadarReader
{
	/**
	 * @return short identifier of the format
	 */
	String getName();


	/**
	 * @return human readable description of the format
	 */
	String getDescription();


	/**
	 * Reads the summary of the volume stored in the given file without
	 * decoding any moment.
	 *
	 * @param oPath path of the file
	 * @return the volume summary
	 * @throws NotFoundException if the file does not exist or is not readable
	 * @throws FormatException if the file is not a valid container
	 * @throws SchemaException if a required element of the format is missing
	 */
	VolumeMetadata scan(Path oPath)
	   throws NotFoundException, FormatException, SchemaException;


	/**
	 * Decodes every sweep and every moment of the given file.
	 *
	 * @param oPath path of the file
	 * @return the decoded volume
	 * @throws NotFoundException if the file does not exist or is not readable
	 * @throws FormatException if the file is not a valid container
	 * @throws SchemaException if a required element of the format is missing
	 * @throws DecodeException if the data of a sweep cannot be decoded
	 */
	VolumeData read(Path oPath)
	   throws NotFoundException, FormatException, SchemaException, DecodeException;


	/**
	 * Decodes every sweep of the given file, keeping only the named moments.
	 * Names the file does not contain are ignored.
	 */
	VolumeData read(Path oPath, String... sMoments)
	   throws NotFoundException, FormatException, SchemaException, DecodeException;


	/**
	 * Decodes a single sweep of the given file.
	 *
	 * @param oPath path of the file
	 * @param nIndex sweep index
	 * @return the decoded sweep
	 * @throws DecodeException if the index is not in [0, number of sweeps) or
	 * the sweep cannot be decoded
	 */
	SweepData readSweep(Path oPath, int nIndex)
	   throws NotFoundException, FormatException, SchemaException, DecodeException;
}
