package org.janelia.codex;

import org.janelia.dataaccess.PathResolver;
import org.junit.Assert;
import org.junit.Test;

public class CodexPathsTest
{
	@Test
	public void testPathsAreOneBased()
	{
		Assert.assertEquals( PathResolver.get( "illumination", "R001.tif" ), CodexPaths.getIlluminationImagePath( 0 ) );
		Assert.assertEquals( PathResolver.get( "illumination", "R012.tif" ), CodexPaths.getIlluminationImagePath( 11 ) );
		Assert.assertEquals( PathResolver.get( "processor", "tile", "R002_X001_Y004.tif" ), CodexPaths.getProcessorImagePath( new TileIndices( 1, 0, 3 ) ) );
		Assert.assertEquals( PathResolver.get( "cytometry", "data.csv" ), CodexPaths.CYTOMETRY_DATA_PATH );
	}
}
