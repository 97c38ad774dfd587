package org.janelia.illumination;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.illumination.model.IlluminationModel;

/**
 * Illumination models of one region together with their rendered surfaces, both keyed by source channel.
 */
public class RegionIlluminationData implements Serializable
{
	private static final long serialVersionUID = 2410733413700553162L;

	private final Map< String, IlluminationImage > images;
	private final Map< String, IlluminationModel > models;

	public RegionIlluminationData( final Map< String, IlluminationImage > images, final Map< String, IlluminationModel > models )
	{
		this.images = Collections.unmodifiableMap( new LinkedHashMap<>( images ) );
		this.models = Collections.unmodifiableMap( new LinkedHashMap<>( models ) );
	}

	public Map< String, IlluminationImage > getImages() { return images; }
	public Map< String, IlluminationModel > getModels() { return models; }

	public IlluminationImage getImage( final String channel )
	{
		final IlluminationImage image = images.get( channel );
		if ( image == null )
			throw new IllegalArgumentException( "No illumination image for channel '" + channel + "'" );
		return image;
	}
}
