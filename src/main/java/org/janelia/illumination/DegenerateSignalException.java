package org.janelia.illumination;

/**
 * Mean intensity of a channel is too close to zero to normalize by.
 */
public class DegenerateSignalException extends IlluminationCorrectionException
{
	private static final long serialVersionUID = -6119820143218563310L;

	public DegenerateSignalException( final String message )
	{
		super( message );
	}
}
