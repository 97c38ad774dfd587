package org.janelia.illumination;

import java.io.Serializable;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.janelia.cytometry.CytometryData;

import net.imglib2.util.Pair;
import net.imglib2.util.ValuePair;

/**
 * Selects cytometry records whose feature values lie between the low and high quantiles
 * of the {@link FilterRange}. Bounds are inclusive and NaN values are never selected.
 */
public class QuantileFilter implements Serializable
{
	private static final long serialVersionUID = -1380718911946283924L;

	private final FilterRange filterRange;

	public QuantileFilter( final FilterRange filterRange )
	{
		this.filterRange = filterRange;
	}

	public FilterRange getFilterRange()
	{
		return filterRange;
	}

	/**
	 * Computes an inclusion mask for each of the given features.
	 *
	 * @param data
	 * 			cytometry records
	 * @param features
	 * 			features to perform percentile filtering on
	 * @return feature name mapped to a mask where {@code true} means that the record is within the desired range
	 */
	public Map< String, boolean[] > getFilterMasks( final CytometryData data, final List< String > features )
	{
		final Map< String, boolean[] > masks = new LinkedHashMap<>();
		for ( final String feature : features )
		{
			final double[] values = data.getColumn( feature );
			final Pair< Double, Double > thresholds = getThresholds( values );
			final double low = thresholds.getA(), high = thresholds.getB();

			final boolean[] mask = new boolean[ values.length ];
			for ( int i = 0; i < values.length; ++i )
				mask[ i ] = values[ i ] >= low && values[ i ] <= high;
			masks.put( feature, mask );
		}
		return masks;
	}

	/**
	 * Combines the per-feature masks so that a record is included only if it passes every feature filter.
	 */
	public boolean[] getFilterMask( final CytometryData data, final List< String > features )
	{
		final boolean[] combinedMask = new boolean[ data.size() ];
		Arrays.fill( combinedMask, true );
		for ( final boolean[] mask : getFilterMasks( data, features ).values() )
			for ( int i = 0; i < combinedMask.length; ++i )
				combinedMask[ i ] &= mask[ i ];
		return combinedMask;
	}

	public Pair< Double, Double > getThresholds( final double[] values )
	{
		final double[] sorted = sortedFiniteValues( values );
		return new ValuePair<>( getSortedQuantile( sorted, filterRange.low ), getSortedQuantile( sorted, filterRange.high ) );
	}

	/**
	 * Linear interpolation quantile: for {@code n} sorted values the quantile {@code q} lies at the
	 * fractional position {@code (n-1)*q}. NaN values are ignored.
	 *
	 * @return quantile value, or NaN if there are no values
	 */
	public static double getQuantile( final double[] values, final double q )
	{
		return getSortedQuantile( sortedFiniteValues( values ), q );
	}

	private static double getSortedQuantile( final double[] sorted, final double q )
	{
		if ( sorted.length == 0 )
			return Double.NaN;

		final double position = ( sorted.length - 1 ) * q;
		final int lower = ( int ) Math.floor( position );
		final int upper = Math.min( lower + 1, sorted.length - 1 );
		final double fraction = position - lower;
		if ( fraction == 0 || sorted[ lower ] == sorted[ upper ] )
			return sorted[ lower ];
		return sorted[ lower ] + ( sorted[ upper ] - sorted[ lower ] ) * fraction;
	}

	private static double[] sortedFiniteValues( final double[] values )
	{
		final double[] sorted = Arrays.stream( values ).filter( v -> !Double.isNaN( v ) ).toArray();
		Arrays.sort( sorted );
		return sorted;
	}
}
