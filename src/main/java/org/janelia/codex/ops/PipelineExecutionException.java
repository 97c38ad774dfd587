package org.janelia.codex.ops;

/**
 * Failure of a tile operation. Subclasses describe failures that require caller intervention
 * (different configuration, more data or a different call order) and are never retried.
 */
public class PipelineExecutionException extends Exception
{
	private static final long serialVersionUID = -2015347403889233169L;

	public PipelineExecutionException( final String message )
	{
		super( message );
	}

	public PipelineExecutionException( final String message, final Throwable cause )
	{
		super( message, cause );
	}
}
