package org.janelia.codex.ops;

import java.io.Serializable;

import org.janelia.codex.ExperimentConfig;
import org.janelia.codex.TileIndices;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;

/**
 * Base class for operations applied to every tile of an experiment.
 *
 * An operation is initialized once, then run on any number of tiles (possibly concurrently,
 * so {@link #run} must not mutate shared state), and closed when the pipeline finishes.
 */
public abstract class TileOp implements Serializable, AutoCloseable
{
	private static final long serialVersionUID = 3546355803511705943L;

	protected final ExperimentConfig config;

	public TileOp( final ExperimentConfig config )
	{
		this.config = config;
	}

	public ExperimentConfig getConfig()
	{
		return config;
	}

	public TileOp initialize() throws PipelineExecutionException
	{
		return this;
	}

	/**
	 * @param tile
	 * 			5D tile indexed as {@code [x, y, channel, z, cycle]}
	 * @param tileIndices
	 * 			position of the tile within the acquisition grid
	 * @return processed tile, never the same instance as the input
	 */
	public abstract < T extends NativeType< T > & RealType< T > > RandomAccessibleInterval< T > run(
			final RandomAccessibleInterval< T > tile,
			final TileIndices tileIndices ) throws PipelineExecutionException;

	@Override
	public void close() {}
}
