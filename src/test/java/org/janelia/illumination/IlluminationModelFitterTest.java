package org.janelia.illumination;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.janelia.cytometry.CytometryData;
import org.janelia.illumination.model.GradientBoostedTrees;
import org.janelia.illumination.model.GradientBoostingRegressor;
import org.janelia.illumination.model.IlluminationModel;
import org.junit.Assert;
import org.junit.Test;

public class IlluminationModelFitterTest
{
	private static final ChannelMapping DAPI_TO_ALL = new ChannelMapping( Collections.singletonMap( "DAPI", ChannelTarget.ALL ) );

	static CytometryData createCells( final double[] ry, final double[] rx, final double[] intensity )
	{
		final double[] diameter = new double[ intensity.length ];
		Arrays.fill( diameter, 10 );

		final Map< String, double[] > columns = new LinkedHashMap<>();
		columns.put( CytometryData.REGION_INDEX_COLUMN, new double[ intensity.length ] );
		columns.put( CytometryData.REGION_Y_COLUMN, ry );
		columns.put( CytometryData.REGION_X_COLUMN, rx );
		columns.put( "ni:DAPI", intensity );
		columns.put( "cell_diameter", diameter );
		return new CytometryData( columns );
	}

	static CytometryData createRandomCells( final int count, final long seed, final double scale )
	{
		final Random rnd = new Random( seed );
		final double[] ry = new double[ count ], rx = new double[ count ], intensity = new double[ count ];
		for ( int i = 0; i < count; ++i )
		{
			ry[ i ] = rnd.nextInt( 20 );
			rx[ i ] = rnd.nextInt( 30 );
			intensity[ i ] = ( 50 + rx[ i ] * 2 + rnd.nextDouble() * 20 ) * scale;
		}
		return createCells( ry, rx, intensity );
	}

	private static IlluminationModelFitter createFitter( final int maxCells, final GradientBoostingRegressor regressor )
	{
		return new IlluminationModelFitter(
				DAPI_TO_ALL,
				new QuantileFilter( FilterRange.of( 0.1, 0.9 ) ),
				Arrays.asList( "cell_diameter" ),
				maxCells,
				1e-8,
				regressor );
	}

	@Test
	public void testConstantIntensity() throws Exception
	{
		final double[] intensity = new double[ 9 ];
		Arrays.fill( intensity, 100 );
		final CytometryData cells = createCells(
				new double[] { 0, 0, 0, 2, 2, 2, 5, 5, 5 },
				new double[] { 0, 2, 5, 0, 2, 5, 0, 2, 5 },
				intensity );

		final Map< String, IlluminationModel > models = createFitter( 100000, new GradientBoostingRegressor( 25 ) ).fit( 0, cells );
		Assert.assertEquals( Arrays.asList( "DAPI" ), new ArrayList<>( models.keySet() ) );
		for ( int y = 0; y < 6; ++y )
			for ( int x = 0; x < 6; ++x )
				Assert.assertEquals( 1.0, models.get( "DAPI" ).predict( y, x ), 0 );
	}

	@Test
	public void testNormalizationInvariance() throws Exception
	{
		final IlluminationModelFitter fitter = createFitter( 100000, new GradientBoostingRegressor( 25 ) );
		final IlluminationModel model = fitter.fit( 0, createRandomCells( 200, 1, 1 ) ).get( "DAPI" );
		final IlluminationModel scaledModel = fitter.fit( 0, createRandomCells( 200, 1, 4 ) ).get( "DAPI" );

		for ( int y = 0; y < 20; ++y )
			for ( int x = 0; x < 30; ++x )
				Assert.assertEquals( model.predict( y, x ), scaledModel.predict( y, x ), 0 );

		// normalized intensities increase along x
		Assert.assertTrue( model.predict( 10, 29 ) > model.predict( 10, 0 ) );
	}

	@Test
	public void testDownsampling() throws Exception
	{
		final List< Integer > fittedSizes = new ArrayList<>();
		final GradientBoostingRegressor recordingRegressor = new GradientBoostingRegressor( 1 )
		{
			private static final long serialVersionUID = 1L;

			@Override
			public GradientBoostedTrees fit( final double[] ry, final double[] rx, final double[] target )
			{
				fittedSizes.add( target.length );
				return super.fit( ry, rx, target );
			}
		};

		createFitter( 50, recordingRegressor ).fit( 0, createRandomCells( 1000, 2, 1 ) );
		createFitter( 100000, recordingRegressor ).fit( 0, createRandomCells( 1000, 2, 1 ) );

		Assert.assertEquals( 50, fittedSizes.get( 0 ).intValue() );
		// 10% of the cells are cut off at each end of the intensity distribution
		Assert.assertEquals( 800, fittedSizes.get( 1 ).intValue() );
	}

	@Test
	public void testDownsampleIndices()
	{
		final int[] selected = IlluminationModelFitter.downsample( 100, 10, IlluminationModelFitter.SEED );
		Assert.assertEquals( 10, selected.length );
		for ( int i = 0; i < selected.length; ++i )
		{
			Assert.assertTrue( selected[ i ] >= 0 && selected[ i ] < 100 );
			if ( i > 0 )
				Assert.assertTrue( selected[ i ] > selected[ i - 1 ] );
		}
		Assert.assertArrayEquals( selected, IlluminationModelFitter.downsample( 100, 10, IlluminationModelFitter.SEED ) );
		Assert.assertArrayEquals( new int[] { 0, 1, 2 }, IlluminationModelFitter.downsample( 3, 5, IlluminationModelFitter.SEED ) );
	}

	@Test( expected = EmptyFilterResultException.class )
	public void testMissingIntensities() throws Exception
	{
		final double[] intensity = new double[ 4 ];
		Arrays.fill( intensity, Double.NaN );
		createFitter( 100000, new GradientBoostingRegressor( 5 ) ).fit( 0, createCells( new double[ 4 ], new double[ 4 ], intensity ) );
	}

	@Test( expected = DegenerateSignalException.class )
	public void testZeroIntensities() throws Exception
	{
		createFitter( 100000, new GradientBoostingRegressor( 5 ) ).fit( 0, createCells( new double[ 4 ], new double[ 4 ], new double[ 4 ] ) );
	}

	@Test( expected = DegenerateSignalException.class )
	public void testNearZeroMean() throws Exception
	{
		final double[] intensity = new double[] { 1e-9, 1e-9, 1e-9, 1e-9 };
		createFitter( 100000, new GradientBoostingRegressor( 5 ) ).fit( 0, createCells( new double[ 4 ], new double[ 4 ], intensity ) );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidMaxCells()
	{
		createFitter( 0, new GradientBoostingRegressor( 5 ) );
	}
}
