package org.janelia.codex.ops;

import java.io.Serializable;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;

/**
 * Restores a 5D tile with an external 3D deconvolution routine. Implementations are provided
 * by the deployment; the pipeline only initializes them and feeds tiles through.
 */
public interface Deconvolver extends Serializable
{
	public Deconvolver initialize() throws PipelineExecutionException;

	public < T extends NativeType< T > & RealType< T > > RandomAccessibleInterval< T > run( final RandomAccessibleInterval< T > tile ) throws PipelineExecutionException;
}
