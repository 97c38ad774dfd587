package org.janelia.dataaccess;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;

public class PathResolver
{
	/**
	 * Combines base and relative paths.
	 *
	 * @param basePath
	 * @param relativePaths
	 * @return
	 */
	public static String get( final String basePath, final String... relativePaths )
	{
		return toPath( basePath ).resolve( Paths.get( "", relativePaths ) ).toString();
	}

	public static String getParent( final String path )
	{
		final Path parent = toPath( path ).getParent();
		return parent != null ? parent.toString() : "";
	}

	public static String getFileName( final String path )
	{
		return toPath( path ).getFileName().toString();
	}

	private static Path toPath( final String path )
	{
		// file:// links are accepted as well as plain filesystem paths
		return path.startsWith( "file:" ) ? Paths.get( URI.create( path ) ) : Paths.get( path );
	}
}
