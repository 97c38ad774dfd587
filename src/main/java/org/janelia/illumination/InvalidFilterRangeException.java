package org.janelia.illumination;

public class InvalidFilterRangeException extends IllegalArgumentException
{
	private static final long serialVersionUID = 1526640253119374830L;

	public InvalidFilterRangeException( final String message )
	{
		super( message );
	}
}
