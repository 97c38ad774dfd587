package org.janelia.dataaccess;

import org.janelia.dataaccess.fs.FSDataProvider;

public abstract class DataProviderFactory
{
	/**
	 * Constructs a filesystem-based {@link DataProvider}.
	 *
	 * @return
	 */
	public static DataProvider createFSDataProvider()
	{
		return new FSDataProvider();
	}

	/**
	 * Constructs a {@link DataProvider} of the given {@link DataProviderType}.
	 *
	 * @return
	 */
	public static DataProvider create( final DataProviderType type )
	{
		switch ( type )
		{
		case FILESYSTEM:
			return createFSDataProvider();
		default:
			throw new UnsupportedOperationException( "Data provider of type " + type + " is not implemented" );
		}
	}

	public static DataProviderType detectType( final String link )
	{
		final int schemeSeparator = link.indexOf( "://" );
		if ( schemeSeparator == -1 || link.startsWith( "file://" ) )
			return DataProviderType.FILESYSTEM;
		throw new UnsupportedOperationException( "Storage scheme is not supported: " + link.substring( 0, schemeSeparator ) );
	}
}
