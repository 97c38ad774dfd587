package org.janelia.illumination;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.cytometry.CytometryData;
import org.junit.Assert;
import org.junit.Test;

import net.imglib2.util.Pair;

public class QuantileFilterTest
{
	private static CytometryData createData( final String name, final double[] values )
	{
		final Map< String, double[] > columns = new LinkedHashMap<>();
		columns.put( name, values );
		return new CytometryData( columns );
	}

	@Test
	public void testQuantile()
	{
		Assert.assertEquals( 2.0, QuantileFilter.getQuantile( new double[] { 3, 1, 2 }, 0.5 ), 0 );
		Assert.assertEquals( 2.5, QuantileFilter.getQuantile( new double[] { 4, 1, 3, 2 }, 0.5 ), 0 );
		Assert.assertEquals( 1.0, QuantileFilter.getQuantile( new double[] { 4, 1, 3, 2 }, 0 ), 0 );
		Assert.assertEquals( 4.0, QuantileFilter.getQuantile( new double[] { 4, 1, 3, 2 }, 1 ), 0 );
		Assert.assertEquals( 2.5, QuantileFilter.getQuantile( new double[] { Double.NaN, 4, 1, Double.NaN, 3, 2 }, 0.5 ), 0 );
		Assert.assertTrue( Double.isNaN( QuantileFilter.getQuantile( new double[ 0 ], 0.5 ) ) );
		Assert.assertTrue( Double.isNaN( QuantileFilter.getQuantile( new double[] { Double.NaN }, 0.5 ) ) );
	}

	@Test
	public void testThresholds()
	{
		final QuantileFilter filter = new QuantileFilter( FilterRange.of( 0.1, 0.9 ) );
		final Pair< Double, Double > thresholds = filter.getThresholds( new double[] { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 } );
		Assert.assertEquals( 1.9, thresholds.getA(), 1e-12 );
		Assert.assertEquals( 9.1, thresholds.getB(), 1e-12 );
	}

	@Test
	public void testMaskIsExact()
	{
		final QuantileFilter filter = new QuantileFilter( FilterRange.of( 0.1, 0.9 ) );
		final CytometryData data = createData( "a", new double[] { 5, 10, 1, 2, 3, 4, 6, 7, 8, 9 } );
		final boolean[] mask = filter.getFilterMasks( data, Arrays.asList( "a" ) ).get( "a" );
		Assert.assertArrayEquals( new boolean[] { true, false, false, true, true, true, true, true, true, true }, mask );
	}

	@Test
	public void testBoundsAreInclusive()
	{
		final QuantileFilter filter = new QuantileFilter( FilterRange.of( 0, 1 ) );
		final CytometryData data = createData( "a", new double[] { 3, 1, 2 } );
		Assert.assertArrayEquals( new boolean[] { true, true, true }, filter.getFilterMask( data, Arrays.asList( "a" ) ) );
	}

	@Test
	public void testIdenticalValuesWithDegenerateRange()
	{
		final QuantileFilter filter = new QuantileFilter( FilterRange.of( 0.5, 0.5 ) );
		final CytometryData data = createData( "a", new double[] { 7, 7, 7, 7 } );
		Assert.assertArrayEquals( new boolean[] { true, true, true, true }, filter.getFilterMask( data, Arrays.asList( "a" ) ) );
	}

	@Test
	public void testNaNIsExcluded()
	{
		final QuantileFilter filter = new QuantileFilter( FilterRange.of( 0, 1 ) );
		final CytometryData data = createData( "a", new double[] { Double.NaN, 1, 2, 3 } );
		Assert.assertArrayEquals( new boolean[] { false, true, true, true }, filter.getFilterMask( data, Arrays.asList( "a" ) ) );

		final CytometryData allNaN = createData( "a", new double[] { Double.NaN, Double.NaN } );
		Assert.assertArrayEquals( new boolean[] { false, false }, filter.getFilterMask( allNaN, Arrays.asList( "a" ) ) );
	}

	@Test
	public void testMasksAreCombined()
	{
		final Map< String, double[] > columns = new LinkedHashMap<>();
		columns.put( "a", new double[] { 1, 2, 3, 4, 5 } );
		columns.put( "b", new double[] { 5, 4, 3, 2, 1 } );
		final CytometryData data = new CytometryData( columns );

		final QuantileFilter filter = new QuantileFilter( FilterRange.of( 0.25, 1 ) );
		final Map< String, boolean[] > masks = filter.getFilterMasks( data, Arrays.asList( "a", "b" ) );
		Assert.assertArrayEquals( new boolean[] { false, true, true, true, true }, masks.get( "a" ) );
		Assert.assertArrayEquals( new boolean[] { true, true, true, true, false }, masks.get( "b" ) );
		Assert.assertArrayEquals( new boolean[] { false, true, true, true, false }, filter.getFilterMask( data, Arrays.asList( "a", "b" ) ) );
	}

	@Test
	public void testNoFeaturesSelectsAll()
	{
		final QuantileFilter filter = new QuantileFilter( FilterRange.of( 0.1, 0.9 ) );
		final CytometryData data = createData( "a", new double[] { 1, 100 } );
		Assert.assertArrayEquals( new boolean[] { true, true }, filter.getFilterMask( data, Collections.emptyList() ) );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testMissingFeature()
	{
		new QuantileFilter( FilterRange.of( 0.1, 0.9 ) ).getFilterMask( createData( "a", new double[] { 1 } ), Arrays.asList( "b" ) );
	}

	@Test
	public void testInvalidRanges()
	{
		assertInvalid( () -> FilterRange.of( 0.9, 0.1 ) );
		assertInvalid( () -> FilterRange.of( -0.1, 0.5 ) );
		assertInvalid( () -> FilterRange.of( 0.5, 1.1 ) );
		assertInvalid( () -> FilterRange.of( Double.NaN, 0.5 ) );
		assertInvalid( () -> FilterRange.of( Arrays.asList( 0.1 ) ) );
		assertInvalid( () -> FilterRange.of( Arrays.asList( 0.1, 0.5, 0.9 ) ) );
		assertInvalid( () -> FilterRange.of( Arrays.asList( 0.1, null ) ) );
		assertInvalid( () -> FilterRange.of( null ) );

		final FilterRange range = FilterRange.of( Arrays.asList( 0.2, 0.8 ) );
		Assert.assertEquals( 0.2, range.low, 0 );
		Assert.assertEquals( 0.8, range.high, 0 );
	}

	private static void assertInvalid( final Runnable rangeFactory )
	{
		try
		{
			rangeFactory.run();
			Assert.fail( "Filter range should have been rejected" );
		}
		catch ( final InvalidFilterRangeException e )
		{
			Assert.assertNotNull( e.getMessage() );
		}
	}
}
