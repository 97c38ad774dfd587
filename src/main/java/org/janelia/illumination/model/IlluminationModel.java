package org.janelia.illumination.model;

import java.io.Serializable;

/**
 * Spatial model of the illumination of one channel over a region: maps a pixel position
 * (region-relative row and column) to the mean-normalized intensity expected there.
 */
public interface IlluminationModel extends Serializable
{
	public double predict( final double ry, final double rx );
}
