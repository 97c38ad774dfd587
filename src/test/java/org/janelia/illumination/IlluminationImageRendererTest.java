package org.janelia.illumination;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.illumination.model.IlluminationModel;
import org.junit.Assert;
import org.junit.Test;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;

public class IlluminationImageRendererTest
{
	@Test
	public void testRenderGrid()
	{
		final IlluminationModel model = ( ry, rx ) -> ry * 10 + rx;
		final IlluminationImage image = new IlluminationImageRenderer( 2, 3 ).render( model );

		Assert.assertEquals( 2, image.getHeight() );
		Assert.assertEquals( 3, image.getWidth() );
		Assert.assertArrayEquals( new float[] { 0, 1, 2, 10, 11, 12 }, image.toArray(), 0 );
		Assert.assertEquals( 12, image.get( 1, 2 ), 0 );

		final RandomAccessibleInterval< FloatType > img = image.getImg();
		Assert.assertArrayEquals( new long[] { 3, 2 }, new long[] { img.dimension( 0 ), img.dimension( 1 ) } );
		final RandomAccess< FloatType > randomAccess = img.randomAccess();
		randomAccess.setPosition( new long[] { 2, 1 } );
		Assert.assertEquals( 12, randomAccess.get().get(), 0 );
	}

	@Test
	public void testRenderKeepsChannelOrder()
	{
		final Map< String, IlluminationModel > models = new LinkedHashMap<>();
		models.put( "CD4", ( ry, rx ) -> 2 );
		models.put( "DAPI", ( ry, rx ) -> 1 );

		final Map< String, IlluminationImage > images = new IlluminationImageRenderer( 4, 4 ).render( models );
		Assert.assertEquals( Arrays.asList( "CD4", "DAPI" ), new ArrayList<>( images.keySet() ) );
		for ( final float value : images.get( "CD4" ).toArray() )
			Assert.assertEquals( 2, value, 0 );
		Assert.assertTrue( new IlluminationImageRenderer( 4, 4 ).render( new LinkedHashMap<>() ).isEmpty() );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidRegionSize()
	{
		new IlluminationImageRenderer( 0, 10 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testImageSizeMismatch()
	{
		new IlluminationImage( 2, 2, new float[ 3 ] );
	}
}
