package org.janelia.codex;

import org.janelia.dataaccess.PathResolver;

/**
 * Locations of the pipeline artifacts relative to the experiment output directory.
 * Region and tile numbers in file names are 1-based.
 */
public class CodexPaths
{
	public static final String CYTOMETRY_DATA_PATH = PathResolver.get( "cytometry", "data.csv" );

	private static final String ILLUMINATION_FOLDER = "illumination";
	private static final String PROCESSOR_TILE_FOLDER = PathResolver.get( "processor", "tile" );

	private static final String ILLUMINATION_IMAGE_FORMAT = "R%03d.tif";
	private static final String PROCESSOR_IMAGE_FORMAT = "R%03d_X%03d_Y%03d.tif";

	public static String getIlluminationImagePath( final int regionIndex )
	{
		return PathResolver.get( ILLUMINATION_FOLDER, String.format( ILLUMINATION_IMAGE_FORMAT, regionIndex + 1 ) );
	}

	public static String getProcessorImagePath( final int regionIndex, final int tileX, final int tileY )
	{
		return PathResolver.get( PROCESSOR_TILE_FOLDER, String.format( PROCESSOR_IMAGE_FORMAT, regionIndex + 1, tileX + 1, tileY + 1 ) );
	}

	public static String getProcessorImagePath( final TileIndices tileIndices )
	{
		return getProcessorImagePath( tileIndices.getRegionIndex(), tileIndices.getTileX(), tileIndices.getTileY() );
	}
}
