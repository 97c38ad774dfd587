package org.janelia.illumination;

/**
 * No records are available to model a region.
 */
public class EmptyInputException extends IlluminationCorrectionException
{
	private static final long serialVersionUID = -4457392040213847103L;

	public EmptyInputException( final String message )
	{
		super( message );
	}
}
