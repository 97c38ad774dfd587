package org.janelia.illumination;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;

import org.janelia.illumination.model.IlluminationModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Renders illumination models into dense surfaces by predicting every pixel of a region.
 */
public class IlluminationImageRenderer implements Serializable
{
	private static final long serialVersionUID = -1943129187567011536L;

	private static final Logger LOG = LoggerFactory.getLogger( IlluminationImageRenderer.class );

	private final int regionHeight, regionWidth;

	/**
	 * @param regionHeight
	 * 			region height in pixels
	 * @param regionWidth
	 * 			region width in pixels
	 */
	public IlluminationImageRenderer( final int regionHeight, final int regionWidth )
	{
		if ( regionHeight < 1 || regionWidth < 1 )
			throw new IllegalArgumentException( "Region size must be positive (given = " + regionHeight + "x" + regionWidth + ")" );
		this.regionHeight = regionHeight;
		this.regionWidth = regionWidth;
	}

	public Map< String, IlluminationImage > render( final Map< String, IlluminationModel > models )
	{
		final Map< String, IlluminationImage > images = new LinkedHashMap<>();
		for ( final Entry< String, IlluminationModel > entry : models.entrySet() )
			images.put( entry.getKey(), render( entry.getValue() ) );

		if ( !images.isEmpty() )
			LOG.debug( "Resulting illumination image shape = [{}, {}] (float32) for channels {}", regionHeight, regionWidth, images.keySet() );

		return images;
	}

	public IlluminationImage render( final IlluminationModel model )
	{
		final ArrayImg< FloatType, FloatArray > img = ArrayImgs.floats( regionWidth, regionHeight );
		final Cursor< FloatType > cursor = img.localizingCursor();
		while ( cursor.hasNext() )
		{
			final FloatType value = cursor.next();
			value.set( ( float ) model.predict( cursor.getDoublePosition( 1 ), cursor.getDoublePosition( 0 ) ) );
		}
		return new IlluminationImage( regionHeight, regionWidth, img.update( null ).getCurrentStorageArray() );
	}
}
