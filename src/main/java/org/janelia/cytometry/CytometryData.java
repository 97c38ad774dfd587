package org.janelia.cytometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.TreeMap;

/**
 * Column-oriented table of single-cell measurements produced by the cytometry stage.
 * Every column holds one value per cell; the table is never modified after construction.
 */
public class CytometryData
{
	public static final String REGION_INDEX_COLUMN = "region_index";
	public static final String REGION_Y_COLUMN = "ry";
	public static final String REGION_X_COLUMN = "rx";

	/**
	 * Prefix of the per-channel intensity columns, e.g. {@code ni:DAPI}.
	 */
	public static final String CHANNEL_PREFIX = "ni:";

	private final Map< String, double[] > columns;
	private final int size;

	public CytometryData( final Map< String, double[] > columns )
	{
		int size = -1;
		for ( final Entry< String, double[] > column : columns.entrySet() )
		{
			if ( size == -1 )
				size = column.getValue().length;
			else if ( size != column.getValue().length )
				throw new IllegalArgumentException( "Column '" + column.getKey() + "' has " + column.getValue().length + " values, expected " + size );
		}
		this.columns = Collections.unmodifiableMap( new LinkedHashMap<>( columns ) );
		this.size = Math.max( size, 0 );
	}

	public static String getChannelFeature( final String channel )
	{
		return CHANNEL_PREFIX + channel;
	}

	public int size()
	{
		return size;
	}

	public boolean isEmpty()
	{
		return size == 0;
	}

	public Set< String > getColumnNames()
	{
		return columns.keySet();
	}

	public boolean hasColumn( final String name )
	{
		return columns.containsKey( name );
	}

	/**
	 * Returns the values of the given column. The returned array must not be modified.
	 */
	public double[] getColumn( final String name )
	{
		final double[] column = columns.get( name );
		if ( column == null )
			throw new IllegalArgumentException( "Cytometry data does not contain column '" + name + "' (available columns: " + columns.keySet() + ")" );
		return column;
	}

	public CytometryData select( final int[] rows )
	{
		final Map< String, double[] > selected = new LinkedHashMap<>();
		for ( final Entry< String, double[] > column : columns.entrySet() )
		{
			final double[] values = column.getValue();
			final double[] selectedValues = new double[ rows.length ];
			for ( int i = 0; i < rows.length; ++i )
				selectedValues[ i ] = values[ rows[ i ] ];
			selected.put( column.getKey(), selectedValues );
		}
		return new CytometryData( selected );
	}

	public CytometryData select( final boolean[] mask )
	{
		if ( mask.length != size )
			throw new IllegalArgumentException( "Mask length " + mask.length + " does not match the number of records " + size );

		int count = 0;
		for ( final boolean included : mask )
			if ( included )
				++count;

		final int[] rows = new int[ count ];
		for ( int i = 0, j = 0; i < mask.length; ++i )
			if ( mask[ i ] )
				rows[ j++ ] = i;
		return select( rows );
	}

	/**
	 * Splits the records by their region index.
	 *
	 * @return region index mapped to the records of that region, in ascending region order
	 */
	public TreeMap< Integer, CytometryData > groupByRegion()
	{
		final double[] regionIndexes = getColumn( REGION_INDEX_COLUMN );
		final TreeMap< Integer, List< Integer > > regionRows = new TreeMap<>();
		for ( int row = 0; row < size; ++row )
		{
			if ( Double.isNaN( regionIndexes[ row ] ) )
				throw new IllegalArgumentException( "Record " + row + " has no region index" );
			regionRows.computeIfAbsent( ( int ) regionIndexes[ row ], k -> new ArrayList<>() ).add( row );
		}

		final TreeMap< Integer, CytometryData > regions = new TreeMap<>();
		for ( final Entry< Integer, List< Integer > > entry : regionRows.entrySet() )
			regions.put( entry.getKey(), select( entry.getValue().stream().mapToInt( Integer::intValue ).toArray() ) );
		return regions;
	}
}
