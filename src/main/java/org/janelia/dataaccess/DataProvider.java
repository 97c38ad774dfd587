package org.janelia.dataaccess;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;

import ij.ImagePlus;

/**
 * Provides access to data on the used storage system.
 * Pipeline artifacts (cytometry tables, experiment configurations, illumination images and tiles)
 * are addressed by string links that are resolved by the concrete backend.
 *
 * @author Igor Pisarev
 */
public interface DataProvider
{
	public DataProviderType getType();

	public boolean exists( final String link ) throws IOException;
	public void createFolder( final String link ) throws IOException;

	public void deleteFile( final String link ) throws IOException;

	public InputStream getInputStream( final String link ) throws IOException;
	public OutputStream getOutputStream( final String link ) throws IOException;

	public Reader getReader( final String link ) throws IOException;
	public Writer getWriter( final String link ) throws IOException;

	public ImagePlus loadImage( final String link ) throws IOException;
	public void saveImage( final ImagePlus imp, final String link ) throws IOException;
}
