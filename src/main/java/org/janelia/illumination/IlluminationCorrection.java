package org.janelia.illumination;

import java.io.IOException;
import java.util.Map.Entry;

import org.janelia.codex.CodexPaths;
import org.janelia.codex.ExperimentConfig;
import org.janelia.codex.IlluminationCorrectionParams;
import org.janelia.codex.TileImageIO;
import org.janelia.codex.TileIndices;
import org.janelia.codex.ops.TileOp;
import org.janelia.cytometry.CytometryData;
import org.janelia.cytometry.CytometryDataLoader;
import org.janelia.dataaccess.DataProvider;
import org.janelia.dataaccess.PathResolver;
import org.janelia.illumination.ChannelTarget.SpecificChannel;
import org.janelia.illumination.model.GradientBoostingRegressor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.util.Util;
import net.imglib2.view.Views;

/**
 * Corrects uneven illumination of processor tiles using spatial intensity models learned from
 * cytometry data.
 *
 * Each tile is divided by the window of its region illumination image that the tile covers.
 * A source channel either corrects every channel of the tile or a single (cycle, channel) volume,
 * as configured by the channel mapping. The result is clipped to the range of the tile pixel type.
 *
 * Region data has to be prepared with {@link #prepareRegionData} on the driver before the operator
 * is distributed to workers.
 */
public class IlluminationCorrection extends TileOp
{
	private static final long serialVersionUID = -4618032367436598829L;

	private static final Logger LOG = LoggerFactory.getLogger( IlluminationCorrection.class );

	private final ChannelMapping channelMapping;
	private final RegionDataCache cache;

	public IlluminationCorrection( final ExperimentConfig config )
	{
		super( config );

		final IlluminationCorrectionParams params = config.getIlluminationCorrectionParams();
		final FilterRange filterRange = FilterRange.of( params.getFilterRange() );
		channelMapping = ChannelMapping.resolve( params.getChannelMapping(), config );

		final IlluminationModelFitter fitter = new IlluminationModelFitter(
				channelMapping,
				new QuantileFilter( filterRange ),
				params.getFilterFeatures(),
				params.getMaxCells(),
				params.getMeanTolerance(),
				new GradientBoostingRegressor( params.getNEstimators() ) );
		final IlluminationImageRenderer renderer = new IlluminationImageRenderer( config.getRegionHeightPixels(), config.getRegionWidthPixels() );
		cache = new RegionDataCache( fitter, renderer );

		LOG.info( "Illumination correction channel mapping: {}, filter range: {}", channelMapping, filterRange );
	}

	IlluminationCorrection( final ExperimentConfig config, final ChannelMapping channelMapping, final RegionDataCache cache )
	{
		super( config );
		this.channelMapping = channelMapping;
		this.cache = cache;
	}

	public ChannelMapping getChannelMapping()
	{
		return channelMapping;
	}

	public RegionDataCache getRegionDataCache()
	{
		return cache;
	}

	/**
	 * Loads cytometry records from the experiment data directory and prepares the region data.
	 */
	public IlluminationCorrection prepareRegionData( final DataProvider dataProvider, final String dataDirectory ) throws IOException, IlluminationCorrectionException
	{
		if ( cache.isPrepared() )
			return this;
		return prepareRegionData( CytometryDataLoader.load( dataProvider, PathResolver.get( dataDirectory, CodexPaths.CYTOMETRY_DATA_PATH ) ) );
	}

	public IlluminationCorrection prepareRegionData( final CytometryData records ) throws IlluminationCorrectionException
	{
		cache.prepare( records );
		return this;
	}

	/**
	 * @return directory of the saved illumination images, or {@code null} if they were saved before
	 */
	public String saveRegionData( final DataProvider dataProvider, final String outputDirectory ) throws IOException, NotPreparedException
	{
		return cache.persist( dataProvider, outputDirectory );
	}

	@Override
	public < T extends NativeType< T > & RealType< T > > RandomAccessibleInterval< T > run(
			final RandomAccessibleInterval< T > tile,
			final TileIndices tileIndices ) throws NotPreparedException, UnpreparedRegionException
	{
		if ( tile.numDimensions() != TileImageIO.NUM_TILE_DIMENSIONS )
			throw new IllegalArgumentException( "Expected " + TileImageIO.NUM_TILE_DIMENSIONS + "D tile, got " + tile.numDimensions() + "D" );

		final RegionIlluminationData regionData = cache.getRegionData( tileIndices.getRegionIndex() );

		final long width = tile.dimension( TileImageIO.X_DIM ), height = tile.dimension( TileImageIO.Y_DIM );
		final long[] windowOffset = new long[] {
				( long ) tileIndices.getTileX() * config.getTileWidth(),
				( long ) tileIndices.getTileY() * config.getTileHeight() };

		final ArrayImg< FloatType, FloatArray > corrected = ArrayImgs.floats( Intervals.dimensionsAsLongArray( tile ) );
		copy( Views.zeroMin( tile ), corrected );

		for ( final Entry< String, ChannelTarget > entry : channelMapping.entrySet() )
		{
			final IlluminationImage image = regionData.getImage( entry.getKey() );
			if ( windowOffset[ 0 ] + width > image.getWidth() || windowOffset[ 1 ] + height > image.getHeight() )
				throw new IllegalArgumentException( "Tile " + tileIndices + " of size " + width + "x" + height +
						" does not fit into illumination image of size " + image.getWidth() + "x" + image.getHeight() );

			final RandomAccessibleInterval< FloatType > surface = Views.offsetInterval( image.getImg(), windowOffset, new long[] { width, height } );
			divide( getTargetVolume( corrected, entry.getValue() ), surface );
			LOG.debug( "Corrected tile {} by illumination of channel {} ({})", tileIndices, entry.getKey(), entry.getValue() );
		}

		final RandomAccessibleInterval< T > output = clipToType( corrected, Util.getTypeFromInterval( tile ) );
		return Views.isZeroMin( tile ) ? output : Views.translate( output, Intervals.minAsLongArray( tile ) );
	}

	/**
	 * Saves the tile under the processor output layout of the given directory.
	 *
	 * @return path of the saved tile relative to the output directory
	 */
	public < T extends NativeType< T > & RealType< T > > String save(
			final DataProvider dataProvider,
			final TileIndices tileIndices,
			final String outputDirectory,
			final RandomAccessibleInterval< T > tile ) throws IOException
	{
		final String relativePath = CodexPaths.getProcessorImagePath( tileIndices );
		TileImageIO.saveTile( dataProvider, tile, PathResolver.get( outputDirectory, relativePath ) );
		return relativePath;
	}

	private static RandomAccessibleInterval< FloatType > getTargetVolume( final RandomAccessibleInterval< FloatType > tile, final ChannelTarget target )
	{
		if ( target.isAllChannels() )
			return tile;

		final SpecificChannel channelTarget = ( SpecificChannel ) target;
		if ( channelTarget.cycle >= tile.dimension( TileImageIO.CYCLE_DIM ) || channelTarget.channel >= tile.dimension( TileImageIO.CHANNEL_DIM ) )
			throw new IllegalArgumentException( "Target channel (" + channelTarget + ") is outside of the tile " + Util.printInterval( tile ) );

		// cycle dimension is the last one so removing it first keeps the channel dimension index
		return Views.hyperSlice( Views.hyperSlice( tile, TileImageIO.CYCLE_DIM, channelTarget.cycle ), TileImageIO.CHANNEL_DIM, channelTarget.channel );
	}

	/**
	 * Divides every value of the target volume by the surface value at the same (x, y) position.
	 */
	private static void divide( final RandomAccessibleInterval< FloatType > target, final RandomAccessibleInterval< FloatType > surface )
	{
		final Cursor< FloatType > cursor = Views.iterable( target ).localizingCursor();
		final RandomAccess< FloatType > surfaceRandomAccess = surface.randomAccess();
		while ( cursor.hasNext() )
		{
			final FloatType value = cursor.next();
			surfaceRandomAccess.setPosition( cursor.getLongPosition( TileImageIO.X_DIM ), 0 );
			surfaceRandomAccess.setPosition( cursor.getLongPosition( TileImageIO.Y_DIM ), 1 );
			value.set( value.get() / surfaceRandomAccess.get().get() );
		}
	}

	private static < T extends RealType< T > > void copy( final RandomAccessibleInterval< T > src, final RandomAccessibleInterval< FloatType > dst )
	{
		final Cursor< T > srcCursor = Views.flatIterable( src ).cursor();
		final Cursor< FloatType > dstCursor = Views.flatIterable( dst ).cursor();
		while ( srcCursor.hasNext() )
			dstCursor.next().setReal( srcCursor.next().getRealDouble() );
	}

	/**
	 * Converts corrected values back to the tile type. Values are clipped to the type range, and
	 * truncated toward zero for integer types where NaN becomes zero.
	 */
	static < T extends NativeType< T > & RealType< T > > ArrayImg< T, ? > clipToType( final RandomAccessibleInterval< FloatType > values, final T type )
	{
		final double min = type.getMinValue(), max = type.getMaxValue();
		final boolean integerType = type instanceof IntegerType;

		final ArrayImg< T, ? > output = new ArrayImgFactory<>( type ).create( values );
		final Cursor< FloatType > srcCursor = Views.flatIterable( values ).cursor();
		final Cursor< T > dstCursor = output.cursor();
		while ( srcCursor.hasNext() )
		{
			double value = Math.max( min, Math.min( max, srcCursor.next().getRealDouble() ) );
			if ( integerType )
				value = Double.isNaN( value ) ? 0 : ( long ) value;
			dstCursor.next().setReal( value );
		}
		return output;
	}
}
