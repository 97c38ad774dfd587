package org.janelia.illumination;

import org.janelia.codex.ops.PipelineExecutionException;

/**
 * Raised when illumination correction cannot proceed because of the input data
 * or because operations were called out of order. These failures are not transient.
 */
public class IlluminationCorrectionException extends PipelineExecutionException
{
	private static final long serialVersionUID = 7341690127731452884L;

	public IlluminationCorrectionException( final String message )
	{
		super( message );
	}

	public IlluminationCorrectionException( final String message, final Throwable cause )
	{
		super( message, cause );
	}
}
