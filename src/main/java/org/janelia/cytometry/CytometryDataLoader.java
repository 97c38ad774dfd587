package org.janelia.cytometry;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.janelia.dataaccess.DataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import au.com.bytecode.opencsv.CSVReader;

/**
 * Reads cytometry tables stored as CSV with a header row.
 * Every column is parsed as a number; empty or non-numeric cells become NaN.
 */
public class CytometryDataLoader
{
	private static final Logger LOG = LoggerFactory.getLogger( CytometryDataLoader.class );

	public static CytometryData load( final DataProvider dataProvider, final String link ) throws IOException
	{
		if ( !dataProvider.exists( link ) )
			throw new IOException( "Cytometry data does not exist: " + link );

		final CytometryData data = load( dataProvider.getReader( link ) );
		LOG.info( "Loaded {} cytometry records with {} features from {}", data.size(), data.getColumnNames().size(), link );
		return data;
	}

	public static CytometryData load( final Reader reader ) throws IOException
	{
		try ( final CSVReader csvReader = new CSVReader( reader ) )
		{
			final String[] header = csvReader.readNext();
			if ( header == null )
				throw new IOException( "Cytometry data has no header" );

			final List< double[] > rows = new ArrayList<>();
			String[] values;
			while ( ( values = csvReader.readNext() ) != null )
			{
				// skip blank lines
				if ( values.length == 1 && values[ 0 ].trim().isEmpty() )
					continue;

				if ( values.length != header.length )
					throw new IOException( "Cytometry record " + ( rows.size() + 1 ) + " has " + values.length + " values, expected " + header.length );

				final double[] row = new double[ values.length ];
				for ( int i = 0; i < values.length; ++i )
					row[ i ] = parseValue( values[ i ] );
				rows.add( row );
			}

			final Map< String, double[] > columns = new LinkedHashMap<>();
			for ( int col = 0; col < header.length; ++col )
			{
				final double[] column = new double[ rows.size() ];
				for ( int row = 0; row < column.length; ++row )
					column[ row ] = rows.get( row )[ col ];
				columns.put( header[ col ].trim(), column );
			}
			return new CytometryData( columns );
		}
	}

	private static double parseValue( final String value )
	{
		final String trimmed = value.trim();
		if ( trimmed.isEmpty() )
			return Double.NaN;
		try
		{
			return Double.parseDouble( trimmed );
		}
		catch ( final NumberFormatException e )
		{
			return Double.NaN;
		}
	}
}
