package org.janelia.illumination;

/**
 * No records remain for a channel after percentile and feature filtering.
 */
public class EmptyFilterResultException extends IlluminationCorrectionException
{
	private static final long serialVersionUID = 3387146420739264721L;

	public EmptyFilterResultException( final String message )
	{
		super( message );
	}
}
