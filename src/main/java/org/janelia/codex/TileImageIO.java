package org.janelia.codex;

import java.io.IOException;

import org.janelia.dataaccess.DataProvider;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Util;

/**
 * Converts 5D tiles between imglib2 images and ImageJ hyperstacks.
 *
 * Tiles are indexed as {@code [x, y, channel, z, cycle]} which maps directly onto the
 * channel/slice/frame order of an ImageJ hyperstack.
 */
public class TileImageIO
{
	public static final int NUM_TILE_DIMENSIONS = 5;

	public static final int X_DIM = 0, Y_DIM = 1, CHANNEL_DIM = 2, Z_DIM = 3, CYCLE_DIM = 4;

	public static < T extends NativeType< T > & RealType< T > > ArrayImg< T, ? > loadTile( final DataProvider dataProvider, final String link ) throws IOException
	{
		return fromImagePlus( dataProvider.loadImage( link ) );
	}

	public static < T extends NativeType< T > & RealType< T > > void saveTile( final DataProvider dataProvider, final RandomAccessibleInterval< T > tile, final String link ) throws IOException
	{
		dataProvider.saveImage( toImagePlus( tile, link ), link );
	}

	public static < T extends NativeType< T > & RealType< T > > ArrayImg< T, ? > fromImagePlus( final ImagePlus imp )
	{
		final T type = createType( imp.getBitDepth() );
		final long[] dimensions = new long[] { imp.getWidth(), imp.getHeight(), imp.getNChannels(), imp.getNSlices(), imp.getNFrames() };
		final ArrayImg< T, ? > img = new ArrayImgFactory<>( type ).create( dimensions );

		final ImageStack stack = imp.getStack();
		final RandomAccess< T > randomAccess = img.randomAccess();
		for ( int cycle = 0; cycle < imp.getNFrames(); ++cycle )
		{
			randomAccess.setPosition( cycle, CYCLE_DIM );
			for ( int z = 0; z < imp.getNSlices(); ++z )
			{
				randomAccess.setPosition( z, Z_DIM );
				for ( int channel = 0; channel < imp.getNChannels(); ++channel )
				{
					randomAccess.setPosition( channel, CHANNEL_DIM );
					final ImageProcessor ip = stack.getProcessor( imp.getStackIndex( channel + 1, z + 1, cycle + 1 ) );
					for ( int y = 0; y < imp.getHeight(); ++y )
					{
						randomAccess.setPosition( y, Y_DIM );
						for ( int x = 0; x < imp.getWidth(); ++x )
						{
							randomAccess.setPosition( x, X_DIM );
							randomAccess.get().setReal( ip.getf( x, y ) );
						}
					}
				}
			}
		}
		return img;
	}

	public static < T extends NativeType< T > & RealType< T > > ImagePlus toImagePlus( final RandomAccessibleInterval< T > tile, final String title )
	{
		if ( tile.numDimensions() != NUM_TILE_DIMENSIONS )
			throw new IllegalArgumentException( "Expected " + NUM_TILE_DIMENSIONS + "D tile, got " + tile.numDimensions() + "D" );

		final int width = ( int ) tile.dimension( X_DIM ), height = ( int ) tile.dimension( Y_DIM );
		final int channels = ( int ) tile.dimension( CHANNEL_DIM ), slices = ( int ) tile.dimension( Z_DIM ), frames = ( int ) tile.dimension( CYCLE_DIM );
		final T type = Util.getTypeFromInterval( tile );

		// hyperstack order: channels vary fastest, then slices, then frames
		final ImageStack stack = new ImageStack( width, height );
		final RandomAccess< T > randomAccess = tile.randomAccess();
		for ( int cycle = 0; cycle < frames; ++cycle )
		{
			randomAccess.setPosition( tile.min( CYCLE_DIM ) + cycle, CYCLE_DIM );
			for ( int z = 0; z < slices; ++z )
			{
				randomAccess.setPosition( tile.min( Z_DIM ) + z, Z_DIM );
				for ( int channel = 0; channel < channels; ++channel )
				{
					randomAccess.setPosition( tile.min( CHANNEL_DIM ) + channel, CHANNEL_DIM );
					final ImageProcessor ip = createProcessor( type, width, height );
					for ( int y = 0; y < height; ++y )
					{
						randomAccess.setPosition( tile.min( Y_DIM ) + y, Y_DIM );
						for ( int x = 0; x < width; ++x )
						{
							randomAccess.setPosition( tile.min( X_DIM ) + x, X_DIM );
							ip.setf( x, y, ( float ) randomAccess.get().getRealDouble() );
						}
					}
					stack.addSlice( ip );
				}
			}
		}

		final ImagePlus imp = new ImagePlus( title, stack );
		imp.setDimensions( channels, slices, frames );
		if ( stack.getSize() > 1 )
			imp.setOpenAsHyperStack( true );
		return imp;
	}

	@SuppressWarnings( "unchecked" )
	private static < T extends NativeType< T > & RealType< T > > T createType( final int bitDepth )
	{
		switch ( bitDepth )
		{
		case 8:
			return ( T ) new UnsignedByteType();
		case 16:
			return ( T ) new UnsignedShortType();
		case 32:
			return ( T ) new FloatType();
		default:
			throw new IllegalArgumentException( "Tiles of bit depth " + bitDepth + " are not supported" );
		}
	}

	private static ImageProcessor createProcessor( final RealType< ? > type, final int width, final int height )
	{
		if ( type instanceof UnsignedByteType )
			return new ByteProcessor( width, height );
		else if ( type instanceof UnsignedShortType )
			return new ShortProcessor( width, height );
		else if ( type instanceof FloatType )
			return new FloatProcessor( width, height );
		else
			throw new IllegalArgumentException( "Tiles of type " + type.getClass().getSimpleName() + " are not supported" );
	}
}
