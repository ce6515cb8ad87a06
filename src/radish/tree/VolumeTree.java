package radish.tree;

import radish.model.MomentData;
import radish.model.SweepData;
import radish.model.VolumeData;
import radish.model.VolumeMetadata;

/**
 * Translates a decoded {@link VolumeData} into a {@link DatasetNode} tree
 * laid out like the CfRadial2 / FM301 group structure: a root node with the
 * station attributes and one sweep_i child per sweep. Nothing is read from
 * disk, the arrays are copies of the values already held by the volume.
 *
 * @author Federal Highway Administration
 */
public abstract class VolumeTree
{
	public static final String CONVENTIONS = "CF/Radial";


	private VolumeTree()
	{
	}


	public static DatasetNode fromVolume(VolumeData oVolume)
	{
		VolumeMetadata oMetadata = oVolume.getMetadata();
		DatasetNode oRoot = new DatasetNode("/");
		oRoot.setAttribute("instrument_name", oMetadata.getInstrumentName());
		oRoot.setAttribute("Conventions", CONVENTIONS);
		oRoot.setAttribute("institution", oMetadata.getInstitution());
		oRoot.addCoordinate(scalar("latitude", oMetadata.getLatitude()));
		oRoot.addCoordinate(scalar("longitude", oMetadata.getLongitude()));
		oRoot.addCoordinate(scalar("altitude", oMetadata.getAltitude()));
		double[] dAngles = oMetadata.getFixedAngles();
		oRoot.addDataVariable(new LabeledArray("sweep_fixed_angle", new String[]{"sweep"}, new int[]{dAngles.length}, dAngles));

		for (SweepData oSweep : oVolume.getSweeps())
		{
			int nRays = oSweep.getNumRays();
			int nGates = oSweep.getNumGates();
			DatasetNode oNode = new DatasetNode("sweep_" + oSweep.getIndex());
			oNode.setAttribute("sweep_number", oSweep.getSweepNumber());
			oNode.setAttribute("fixed_angle", oSweep.getFixedAngle());
			oNode.setAttribute("sweep_mode", oSweep.getMode().getCfName());
			oNode.setAttribute("instrument_name", oMetadata.getInstrumentName());

			oNode.addCoordinate(new LabeledArray("azimuth", new String[]{"time"}, new int[]{nRays}, oSweep.getAzimuth()));
			oNode.addCoordinate(new LabeledArray("elevation", new String[]{"time"}, new int[]{nRays}, oSweep.getElevation()));
			oNode.addCoordinate(new LabeledArray("range", new String[]{"range"}, new int[]{nGates}, oSweep.getRange()));
			if (oSweep.hasTime())
				oNode.addCoordinate(new LabeledArray("time", new String[]{"time"}, new int[]{nRays}, oSweep.getTime()));

			for (MomentData oMoment : oSweep.getMoments().values())
			{
				oNode.addDataVariable(new LabeledArray(oMoment.getName(), new String[]{"time", "range"}, oMoment.getShape(), oMoment.copyData())
				   .setAttribute("units", oMoment.getUnits()));
			}
			oRoot.addChild(oNode);
		}
		return oRoot;
	}


	private static LabeledArray scalar(String sName, double dValue)
	{
		return new LabeledArray(sName, new String[0], new int[0], new double[]{dValue});
	}
}
