package org.janelia.codex.ops;

import java.io.IOException;
import java.io.Serializable;

import org.janelia.codex.CodexPaths;
import org.janelia.codex.TileImageIO;
import org.janelia.codex.TileIndices;
import org.janelia.dataaccess.DataProvider;
import org.janelia.dataaccess.PathResolver;
import org.janelia.illumination.IlluminationCorrection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;

/**
 * Runs the per-tile operations on one processor tile: optional deconvolution followed by
 * illumination correction. The corrected tile replaces the input tile on disk.
 */
public class TileProcessor implements Serializable, AutoCloseable
{
	private static final long serialVersionUID = -2481009713460651245L;

	private static final Logger LOG = LoggerFactory.getLogger( TileProcessor.class );

	private final Deconvolver deconvolver;
	private final IlluminationCorrection illuminationCorrection;

	public TileProcessor( final IlluminationCorrection illuminationCorrection )
	{
		this( null, illuminationCorrection );
	}

	public TileProcessor( final Deconvolver deconvolver, final IlluminationCorrection illuminationCorrection )
	{
		if ( illuminationCorrection == null )
			throw new IllegalArgumentException( "Illumination correction operation is required" );
		this.deconvolver = deconvolver;
		this.illuminationCorrection = illuminationCorrection;
	}

	public TileProcessor initialize() throws PipelineExecutionException
	{
		if ( deconvolver != null )
			deconvolver.initialize();
		illuminationCorrection.initialize();
		return this;
	}

	/**
	 * @return path of the saved tile relative to the data directory
	 */
	public < T extends NativeType< T > & RealType< T > > String process(
			final DataProvider dataProvider,
			final String dataDirectory,
			final TileIndices tileIndices ) throws IOException, PipelineExecutionException
	{
		final String tilePath = PathResolver.get( dataDirectory, CodexPaths.getProcessorImagePath( tileIndices ) );
		RandomAccessibleInterval< T > tile = TileImageIO.loadTile( dataProvider, tilePath );

		if ( deconvolver != null )
		{
			LOG.debug( "Running deconvolution for tile {}", tileIndices );
			tile = deconvolver.run( tile );
		}

		LOG.debug( "Running illumination correction for tile {}", tileIndices );
		final RandomAccessibleInterval< T > corrected = illuminationCorrection.run( tile, tileIndices );
		return illuminationCorrection.save( dataProvider, tileIndices, dataDirectory, corrected );
	}

	@Override
	public void close()
	{
		illuminationCorrection.close();
	}
}
