package org.janelia.dataaccess.fs;

import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.janelia.dataaccess.DataProvider;
import org.janelia.dataaccess.DataProviderType;

import ij.IJ;
import ij.ImagePlus;

/**
 * Provides filesystem-based access to data stored on a local or network drive.
 *
 * @author Igor Pisarev
 */
public class FSDataProvider implements DataProvider
{
	@Override
	public DataProviderType getType()
	{
		return DataProviderType.FILESYSTEM;
	}

	@Override
	public boolean exists( final String link )
	{
		return Files.exists( getPath( link ) );
	}

	@Override
	public void createFolder( final String link ) throws IOException
	{
		Files.createDirectories( getPath( link ) );
	}

	@Override
	public void deleteFile( final String link ) throws IOException
	{
		Files.delete( getPath( link ) );
	}

	@Override
	public InputStream getInputStream( final String link ) throws IOException
	{
		return new FileInputStream( getPath( link ).toFile() );
	}

	@Override
	public OutputStream getOutputStream( final String link ) throws IOException
	{
		createParentDirs( getPath( link ) );
		return new FileOutputStream( getPath( link ).toFile() );
	}

	@Override
	public Reader getReader( final String link ) throws IOException
	{
		return new InputStreamReader( getInputStream( link ), StandardCharsets.UTF_8 );
	}

	@Override
	public Writer getWriter( final String link ) throws IOException
	{
		return new OutputStreamWriter( getOutputStream( link ), StandardCharsets.UTF_8 );
	}

	@Override
	public ImagePlus loadImage( final String link ) throws IOException
	{
		final String path = getCanonicalPathString( link );
		if ( !Files.exists( Paths.get( path ) ) )
			throw new IOException( "Image does not exist: " + path );

		final ImagePlus imp = IJ.openImage( path );
		if ( imp == null )
			throw new IOException( "Cannot open image: " + path );
		return imp;
	}

	@Override
	public void saveImage( final ImagePlus imp, final String link ) throws IOException
	{
		createParentDirs( getPath( link ) );
		if ( !IJ.saveAsTiff( imp, getCanonicalPathString( link ) ) )
			throw new IOException( "Cannot save image: " + link );
	}

	private static Path getPath( final String link )
	{
		return link.startsWith( "file:" ) ? Paths.get( URI.create( link ) ) : Paths.get( link );
	}

	private static void createParentDirs( final Path path ) throws IOException
	{
		final Path parent = path.toAbsolutePath().getParent();
		if ( parent != null )
			Files.createDirectories( parent );
	}

	private static String getCanonicalPathString( final String link ) throws IOException
	{
		return getPath( link ).toFile().getCanonicalPath();
	}
}
