package org.janelia.codex;

import java.io.Serializable;

/**
 * Position of a tile within the acquisition grid: the region it belongs to and its
 * column ({@code tileX}) and row ({@code tileY}) within that region. All indices are 0-based.
 */
public class TileIndices implements Serializable
{
	private static final long serialVersionUID = 5016362722961582871L;

	private final int regionIndex;
	private final int tileX;
	private final int tileY;

	public TileIndices( final int regionIndex, final int tileX, final int tileY )
	{
		this.regionIndex = regionIndex;
		this.tileX = tileX;
		this.tileY = tileY;
	}

	public int getRegionIndex() { return regionIndex; }
	public int getTileX() { return tileX; }
	public int getTileY() { return tileY; }

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof TileIndices ) )
			return false;
		final TileIndices other = ( TileIndices ) obj;
		return regionIndex == other.regionIndex && tileX == other.tileX && tileY == other.tileY;
	}

	@Override
	public int hashCode()
	{
		return ( regionIndex * 31 + tileX ) * 31 + tileY;
	}

	@Override
	public String toString()
	{
		return String.format( "[region=%d, x=%d, y=%d]", regionIndex, tileX, tileY );
	}
}
