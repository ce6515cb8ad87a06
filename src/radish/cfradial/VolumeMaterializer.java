package radish.cfradial;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import radish.model.MomentData;
import radish.model.SweepData;
import radish.model.SweepMetadata;
import radish.model.VolumeData;
import radish.model.VolumeMetadata;
import radish.store.NcfContainer;
import radish.system.Config;
import radish.system.DecodeException;
import radish.system.SchemaException;
import ucar.ma2.Array;
import ucar.ma2.IndexIterator;

/**
 * Decodes the sweeps of a CfRadial1 file into {@link SweepData} objects. For
 * each sweep the ray coordinates and the moments are read only over the rays
 * of the sweep; range is read once per volume.
 * <p>
 * With more than one configured thread, sweeps are decoded concurrently. Each
 * sweep task opens its own {@link NcfContainer} since NetCDF file handles are
 * not safe to share between threads. Results are assembled in sweep order and
 * the failure of the lowest sweep index is the one reported.
 *
 * @author Federal Highway Administration
 */
public class VolumeMaterializer
{
	/**
	 * Log4j Logger
	 */
	protected Logger m_oLogger = LogManager.getLogger(getClass());


	/**
	 * Number of threads used to decode the sweeps of a volume
	 */
	private final int m_nThreads;


	/**
	 * Reads the sweep settings
	 */
	private final ConventionMapper m_oMapper;


	/**
	 * Constructs a VolumeMaterializer using the "threads" key of its
	 * configuration, 1 by default.
	 *
	 * @param oMapper mapper used to read the sweep settings
	 */
	public VolumeMaterializer(ConventionMapper oMapper)
	{
		this(oMapper, Config.getInstance().getConfig(VolumeMaterializer.class.getName()).optInt("threads", 1));
	}


	/**
	 * Constructs a VolumeMaterializer with the given parameters.
	 *
	 * @param oMapper mapper used to read the sweep settings
	 * @param nThreads number of threads, values less than 1 are treated as 1
	 */
	public VolumeMaterializer(ConventionMapper oMapper, int nThreads)
	{
		m_oMapper = oMapper;
		m_nThreads = Math.max(1, nThreads);
	}


	public int getThreads()
	{
		return m_nThreads;
	}


	/**
	 * Decodes every sweep of a volume.
	 *
	 * @param oPath path of the file, reopened by the workers of a parallel
	 * decode
	 * @param oNc open container of the file
	 * @param oMap interpretation of the container
	 * @param oMetadata summary of the volume
	 * @param sMoments names of the moments to decode, null to decode every
	 * moment of the field catalog. Names that are not in the catalog are
	 * ignored.
	 * @return the decoded volume
	 * @throws SchemaException if azimuth or elevation is missing
	 * @throws DecodeException if a sweep extent, a coordinate or a moment is
	 * invalid or cannot be read
	 */
	public VolumeData readVolume(Path oPath, NcfContainer oNc, ConventionMap oMap, VolumeMetadata oMetadata, String... sMoments)
	   throws SchemaException, DecodeException
	{
		Context oCtx = prepare(oNc, oMap, sMoments);
		int nSweeps = oMap.getSweepCount();
		ArrayList<SweepData> oSweeps = new ArrayList(nSweeps);
		if (m_nThreads == 1 || nSweeps < 2)
		{
			for (int nIndex = 0; nIndex < nSweeps; nIndex++)
				oSweeps.add(decodeSweep(oNc, oCtx, nIndex));
		}
		else
			oSweeps.addAll(decodeParallel(oPath, oCtx));

		return new VolumeData(oMetadata, oSweeps);
	}


	/**
	 * Decodes one sweep.
	 *
	 * @param oNc open container
	 * @param oMap interpretation of the container
	 * @param nIndex sweep index
	 * @param sMoments names of the moments to decode, null for every moment
	 * of the field catalog
	 * @return the decoded sweep
	 * @throws SchemaException if azimuth or elevation is missing
	 * @throws DecodeException if the index is not a sweep of the file, or the
	 * sweep cannot be decoded
	 */
	public SweepData readSweep(NcfContainer oNc, ConventionMap oMap, int nIndex, String... sMoments)
	   throws SchemaException, DecodeException
	{
		if (nIndex < 0 || nIndex >= oMap.getSweepCount())
			throw new DecodeException(oNc.getPath(), nIndex, null, String.format("Sweep index %d out of range, the file has %d sweeps", nIndex, oMap.getSweepCount()));
		return decodeSweep(oNc, prepare(oNc, oMap, sMoments), nIndex);
	}


	/**
	 * Validates the layout of the file and reads everything the sweeps share:
	 * the range coordinate, the sweep settings and the moment decoders.
	 */
	private Context prepare(NcfContainer oNc, ConventionMap oMap, String[] sMoments)
	   throws SchemaException, DecodeException
	{
		String sPath = oNc.getPath();
		if (oNc.getDimensionLength(CfRadial.N_POINTS) >= 0)
			throw new DecodeException(sPath, DecodeException.NO_SWEEP, CfRadial.N_POINTS, "Ragged CfRadial1 files with varying gate counts are not supported");
		for (String sCoord : new String[]{CfRadial.AZIMUTH, CfRadial.ELEVATION})
		{
			if (!oNc.hasVariable(sCoord))
				throw new SchemaException(sPath, sCoord, "Required ray coordinate is missing");
			checkRayShape(oNc, oMap, sCoord);
		}
		boolean bTime = oNc.hasVariable(CfRadial.TIME);
		if (bTime)
			checkRayShape(oNc, oMap, CfRadial.TIME);

		int[] nRangeShape = oNc.getShape(CfRadial.RANGE);
		if (nRangeShape[0] != oMap.getGateCount())
			throw new DecodeException(sPath, DecodeException.NO_SWEEP, CfRadial.RANGE, String.format("Declared length %d does not match gate count %d", nRangeShape[0], oMap.getGateCount()));
		float[] fRange = toFloats(oNc.read(CfRadial.RANGE));
		for (int nGate = 1; nGate < fRange.length; nGate++)
		{
			if (fRange[nGate] < fRange[nGate - 1])
				throw new DecodeException(sPath, DecodeException.NO_SWEEP, CfRadial.RANGE, String.format("Range decreases at gate %d", nGate));
		}

		HashSet<String> oWanted = sMoments == null ? null : new HashSet(Arrays.asList(sMoments));
		LinkedHashMap<String, MomentDecoder> oDecoders = new LinkedHashMap();
		for (String sField : oMap.getFields())
		{
			if (oWanted != null && !oWanted.contains(sField))
				continue;
			int[] nShape = oNc.getShape(sField);
			if (nShape[0] != oMap.getRayCount() || nShape[1] != oMap.getGateCount())
				throw new DecodeException(sPath, DecodeException.NO_SWEEP, sField, String.format("Declared shape %s does not match (%d, %d)", Arrays.toString(nShape), oMap.getRayCount(), oMap.getGateCount()));
			oDecoders.put(sField, new MomentDecoder(sPath, sField, oNc.getDataType(sField), oNc.isUnsigned(sField), oNc.getVariableAttributes(sField)));
		}

		return new Context(oMap, m_oMapper.mapSweepMetadata(oNc, oMap), fRange, bTime, oDecoders);
	}


	private void checkRayShape(NcfContainer oNc, ConventionMap oMap, String sName)
	   throws DecodeException
	{
		int[] nShape = oNc.getShape(sName);
		if (nShape.length != 1 || nShape[0] != oMap.getRayCount())
			throw new DecodeException(oNc.getPath(), DecodeException.NO_SWEEP, sName, String.format("Declared shape %s does not match ray count %d", Arrays.toString(nShape), oMap.getRayCount()));
	}


	/**
	 * Reads the coordinates and moments of one sweep over its rays.
	 */
	private SweepData decodeSweep(NcfContainer oNc, Context oCtx, int nIndex)
	   throws DecodeException
	{
		String sPath = oNc.getPath();
		SweepExtent oExtent = oCtx.m_oMap.getSweep(nIndex);
		if (!oExtent.isWithin(oCtx.m_oMap.getRayCount()))
		{
			String sVariable = oExtent.getStartRay() < 0 || oExtent.getStartRay() > oExtent.getEndRay() ? CfRadial.SWEEP_START_RAY_INDEX : CfRadial.SWEEP_END_RAY_INDEX;
			throw new DecodeException(sPath, nIndex, sVariable, String.format("Rays [%d, %d] are not within the %d rays of the file", oExtent.getStartRay(), oExtent.getEndRay(), oCtx.m_oMap.getRayCount()));
		}

		int nStart = oExtent.getStartRay();
		int nRays = oExtent.getNumRays();
		int nGates = oCtx.m_fRange.length;
		float[] fAzimuth = toFloats(oNc.readRows(CfRadial.AZIMUTH, nStart, nRays, nIndex));
		float[] fElevation = toFloats(oNc.readRows(CfRadial.ELEVATION, nStart, nRays, nIndex));
		double[] dTime = oCtx.m_bTime ? toDoubles(oNc.readRows(CfRadial.TIME, nStart, nRays, nIndex)) : new double[0];

		LinkedHashMap<String, MomentData> oMoments = new LinkedHashMap();
		for (Map.Entry<String, MomentDecoder> oEntry : oCtx.m_oDecoders.entrySet())
		{
			Array oRaw = oNc.readRows(oEntry.getKey(), nStart, nRays, nIndex);
			float[] fValues = oEntry.getValue().decode(oRaw);
			if (fValues.length != nRays * nGates)
				throw new DecodeException(sPath, nIndex, oEntry.getKey(), String.format("Read %d values, expected %d x %d", fValues.length, nRays, nGates));
			oMoments.put(oEntry.getKey(), oEntry.getValue().toMoment(fValues, nRays, nGates));
		}

		m_oLogger.debug(String.format("%s: decoded %s, %d moments", sPath, oExtent, oMoments.size()));
		return new SweepData(nIndex, oCtx.m_oSweepMetadata.get(nIndex), nStart, fAzimuth, fElevation,
		   oCtx.m_fRange.clone(), dTime, oMoments);
	}


	/**
	 * Decodes every sweep on a thread pool. Each task opens its own
	 * container. Waits on the tasks in sweep order, so the first failure
	 * found is the failure of the lowest sweep index; the remaining tasks are
	 * cancelled.
	 */
	private List<SweepData> decodeParallel(Path oPath, Context oCtx)
	   throws SchemaException, DecodeException
	{
		int nSweeps = oCtx.m_oMap.getSweepCount();
		ThreadPoolExecutor oTP = (ThreadPoolExecutor)Executors.newFixedThreadPool(Math.min(m_nThreads, nSweeps), new NameableThreadFactory(oPath.getFileName().toString()));
		ArrayList<Future<SweepData>> oTasks = new ArrayList(nSweeps);
		ArrayList<SweepData> oSweeps = new ArrayList(nSweeps);
		try
		{
			for (int nIndex = 0; nIndex < nSweeps; nIndex++)
			{
				final int nSweep = nIndex;
				oTasks.add(oTP.submit(() ->
				{
					try (NcfContainer oNc = NcfContainer.open(oPath))
					{
						return decodeSweep(oNc, oCtx, nSweep);
					}
				}));
			}

			for (int nIndex = 0; nIndex < nSweeps; nIndex++)
			{
				try
				{
					oSweeps.add(oTasks.get(nIndex).get());
				}
				catch (ExecutionException oEx)
				{
					for (Future oTask : oTasks)
						oTask.cancel(true);
					Throwable oCause = oEx.getCause();
					if (oCause instanceof DecodeException)
						throw (DecodeException)oCause;
					if (oCause instanceof SchemaException)
						throw (SchemaException)oCause;
					throw new DecodeException(oPath.toString(), nIndex, null, "Sweep decode failed", oCause);
				}
				catch (InterruptedException oEx)
				{
					for (Future oTask : oTasks)
						oTask.cancel(true);
					Thread.currentThread().interrupt();
					throw new DecodeException(oPath.toString(), nIndex, null, "Interrupted while decoding", oEx);
				}
			}
		}
		finally
		{
			oTP.shutdownNow();
		}
		return oSweeps;
	}


	private static float[] toFloats(Array oArray)
	{
		float[] fValues = new float[(int)oArray.getSize()];
		IndexIterator oIt = oArray.getIndexIterator();
		for (int nIndex = 0; oIt.hasNext(); nIndex++)
			fValues[nIndex] = oIt.getFloatNext();
		return fValues;
	}


	private static double[] toDoubles(Array oArray)
	{
		double[] dValues = new double[(int)oArray.getSize()];
		IndexIterator oIt = oArray.getIndexIterator();
		for (int nIndex = 0; oIt.hasNext(); nIndex++)
			dValues[nIndex] = oIt.getDoubleNext();
		return dValues;
	}


	/**
	 * Values shared by the sweeps of one volume. Immutable once built so it
	 * can be read by every worker of a parallel decode.
	 */
	private static class Context
	{
		private final ConventionMap m_oMap;
		private final List<SweepMetadata> m_oSweepMetadata;
		private final float[] m_fRange;
		private final boolean m_bTime;
		private final Map<String, MomentDecoder> m_oDecoders;


		Context(ConventionMap oMap, List<SweepMetadata> oSweepMetadata, float[] fRange, boolean bTime, Map<String, MomentDecoder> oDecoders)
		{
			m_oMap = oMap;
			m_oSweepMetadata = oSweepMetadata;
			m_fRange = fRange;
			m_bTime = bTime;
			m_oDecoders = oDecoders;
		}
	}


	/**
	 * Names decode threads after the file they work on
	 */
	private static class NameableThreadFactory implements ThreadFactory
	{
		private final String m_sName;


		NameableThreadFactory(String sName)
		{
			m_sName = sName;
		}


		@Override
		public Thread newThread(Runnable oRunnable)
		{
			Thread oThread = new Thread(oRunnable, String.format("radish-%s-%d", m_sName, System.nanoTime()));
			oThread.setDaemon(true);
			return oThread;
		}
	}
}
