package org.janelia.illumination;

import java.io.Serializable;
import java.util.List;

/**
 * Lower and upper quantile (both in [0, 1]) bounding the feature values of the records
 * used to fit illumination models.
 */
public class FilterRange implements Serializable
{
	private static final long serialVersionUID = 4380285227185911478L;

	public final double low, high;

	private FilterRange( final double low, final double high )
	{
		this.low = low;
		this.high = high;
	}

	public static FilterRange of( final double low, final double high )
	{
		validateBound( low );
		validateBound( high );
		if ( low > high )
			throw new InvalidFilterRangeException( String.format( "Filter range must be ascending (given = [%s, %s])", low, high ) );
		return new FilterRange( low, high );
	}

	public static FilterRange of( final List< Double > range )
	{
		if ( range == null || range.size() != 2 )
			throw new InvalidFilterRangeException( "Must provide filter range as 2 item list (given = " + range + ")" );
		if ( range.get( 0 ) == null || range.get( 1 ) == null )
			throw new InvalidFilterRangeException( "Filter range values cannot be null (given = " + range + ")" );
		return of( range.get( 0 ), range.get( 1 ) );
	}

	private static void validateBound( final double value )
	{
		if ( !( value >= 0 && value <= 1 ) )
			throw new InvalidFilterRangeException( "Filter range percentile values must be in [0, 1] (given = " + value + ")" );
	}

	@Override
	public String toString()
	{
		return "[" + low + ", " + high + "]";
	}
}
