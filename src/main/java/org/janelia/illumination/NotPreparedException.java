package org.janelia.illumination;

/**
 * Region data was requested before it has been built.
 */
public class NotPreparedException extends IlluminationCorrectionException
{
	private static final long serialVersionUID = 8240566390129118474L;

	public NotPreparedException( final String message )
	{
		super( message );
	}
}
