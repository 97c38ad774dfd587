package org.janelia.illumination;

/**
 * A tile references a region that has no illumination data.
 */
public class UnpreparedRegionException extends IlluminationCorrectionException
{
	private static final long serialVersionUID = -2786551349811430226L;

	public UnpreparedRegionException( final String message )
	{
		super( message );
	}
}
