package org.janelia.codex;

import org.janelia.dataaccess.DataProvider;
import org.janelia.dataaccess.DataProviderFactory;
import org.janelia.dataaccess.PathResolver;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ij.ImagePlus;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.ShortArray;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.util.Util;

public class TileImageIOTest
{
	@Rule
	public TemporaryFolder tempFolder = new TemporaryFolder();

	private static ArrayImg< UnsignedShortType, ShortArray > createTile()
	{
		// [x, y, channel, z, cycle]
		final ArrayImg< UnsignedShortType, ShortArray > tile = ArrayImgs.unsignedShorts( 3, 2, 2, 4, 3 );
		final RandomAccess< UnsignedShortType > randomAccess = tile.randomAccess();
		for ( int cycle = 0; cycle < 3; ++cycle )
			for ( int z = 0; z < 4; ++z )
				for ( int channel = 0; channel < 2; ++channel )
					for ( int y = 0; y < 2; ++y )
						for ( int x = 0; x < 3; ++x )
						{
							randomAccess.setPosition( new int[] { x, y, channel, z, cycle } );
							randomAccess.get().set( cycle * 10000 + z * 1000 + channel * 100 + y * 10 + x );
						}
		return tile;
	}

	@Test
	public void testHyperstackLayout()
	{
		final ImagePlus imp = TileImageIO.toImagePlus( createTile(), "tile" );
		Assert.assertEquals( 3, imp.getWidth() );
		Assert.assertEquals( 2, imp.getHeight() );
		Assert.assertEquals( 2, imp.getNChannels() );
		Assert.assertEquals( 4, imp.getNSlices() );
		Assert.assertEquals( 3, imp.getNFrames() );
		Assert.assertEquals( 16, imp.getBitDepth() );

		// channel 2, slice 3, frame 2 (1-based)
		final int stackIndex = imp.getStackIndex( 2, 3, 2 );
		Assert.assertEquals( 10000 + 2000 + 100 + 10 + 2, ( int ) imp.getStack().getProcessor( stackIndex ).getf( 2, 1 ) );

		final RandomAccessibleInterval< UnsignedShortType > tile = TileImageIO.fromImagePlus( imp );
		Assert.assertArrayEquals( new long[] { 3, 2, 2, 4, 3 }, Intervals.dimensionsAsLongArray( tile ) );
		final RandomAccess< UnsignedShortType > randomAccess = tile.randomAccess();
		randomAccess.setPosition( new int[] { 1, 0, 1, 3, 2 } );
		Assert.assertEquals( 20000 + 3000 + 100 + 1, randomAccess.get().get() );
	}

	@Test
	public void testSaveAndLoad() throws Exception
	{
		final DataProvider dataProvider = DataProviderFactory.createFSDataProvider();
		final String path = PathResolver.get( tempFolder.getRoot().getAbsolutePath(), CodexPaths.getProcessorImagePath( 0, 0, 0 ) );

		final ArrayImg< UnsignedShortType, ShortArray > tile = createTile();
		TileImageIO.saveTile( dataProvider, tile, path );
		Assert.assertTrue( dataProvider.exists( path ) );

		final RandomAccessibleInterval< UnsignedShortType > loaded = TileImageIO.loadTile( dataProvider, path );
		Assert.assertTrue( Util.getTypeFromInterval( loaded ) instanceof UnsignedShortType );
		Assert.assertArrayEquals( Intervals.dimensionsAsLongArray( tile ), Intervals.dimensionsAsLongArray( loaded ) );

		final RandomAccess< UnsignedShortType > expected = tile.randomAccess(), actual = loaded.randomAccess();
		for ( final int[] position : new int[][] { { 0, 0, 0, 0, 0 }, { 2, 1, 1, 3, 2 }, { 1, 1, 0, 2, 1 } } )
		{
			expected.setPosition( position );
			actual.setPosition( position );
			Assert.assertEquals( expected.get().get(), actual.get().get() );
		}
	}

	@Test
	public void testSingleImageTile()
	{
		final ArrayImg< FloatType, ? > tile = ArrayImgs.floats( new float[] { 0.5f, 1.5f, 2.5f, 3.5f }, 2, 2, 1, 1, 1 );
		final ImagePlus imp = TileImageIO.toImagePlus( tile, "tile" );
		Assert.assertEquals( 32, imp.getBitDepth() );
		Assert.assertEquals( 1, imp.getStackSize() );

		final RandomAccessibleInterval< FloatType > converted = TileImageIO.fromImagePlus( imp );
		Assert.assertArrayEquals( new long[] { 2, 2, 1, 1, 1 }, Intervals.dimensionsAsLongArray( converted ) );
		final RandomAccess< FloatType > randomAccess = converted.randomAccess();
		randomAccess.setPosition( new int[] { 1, 1, 0, 0, 0 } );
		Assert.assertEquals( 3.5f, randomAccess.get().get(), 0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testWrongDimensionality()
	{
		TileImageIO.toImagePlus( ArrayImgs.floats( 2, 2 ), "image" );
	}
}
