package org.janelia.codex;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Acquisition layout of a multi-cycle experiment together with the processor parameters
 * consumed by illumination correction.
 *
 * Channels are laid out cycle by cycle: {@code channel_names} lists every channel of every cycle,
 * and the channels of one cycle occupy {@code per_cycle_channel_names.size()} consecutive entries.
 */
public class ExperimentConfig implements Serializable
{
	private static final long serialVersionUID = 7702964924651306627L;

	private int numCycles = 1;
	private int numZPlanes = 1;

	private int tileHeight;
	private int tileWidth;

	// region size is given in tiles
	private int regionHeight;
	private int regionWidth;

	private List< String > regionNames = new ArrayList<>();
	private List< String > perCycleChannelNames = new ArrayList<>();
	private List< String > channelNames = new ArrayList<>();

	private IlluminationCorrectionParams illuminationCorrection;

	ExperimentConfig() {}

	public ExperimentConfig(
			final int numCycles,
			final int numZPlanes,
			final int tileHeight,
			final int tileWidth,
			final int regionHeight,
			final int regionWidth,
			final List< String > regionNames,
			final List< String > perCycleChannelNames,
			final List< String > channelNames,
			final IlluminationCorrectionParams illuminationCorrection )
	{
		this.numCycles = numCycles;
		this.numZPlanes = numZPlanes;
		this.tileHeight = tileHeight;
		this.tileWidth = tileWidth;
		this.regionHeight = regionHeight;
		this.regionWidth = regionWidth;
		this.regionNames = new ArrayList<>( regionNames );
		this.perCycleChannelNames = new ArrayList<>( perCycleChannelNames );
		this.channelNames = new ArrayList<>( channelNames );
		this.illuminationCorrection = illuminationCorrection;
	}

	public int getNumCycles() { return numCycles; }
	public int getNumZPlanes() { return numZPlanes; }
	public int getTileHeight() { return tileHeight; }
	public int getTileWidth() { return tileWidth; }
	public int getRegionHeight() { return regionHeight; }
	public int getRegionWidth() { return regionWidth; }
	public List< String > getRegionNames() { return Collections.unmodifiableList( regionNames ); }
	public List< String > getPerCycleChannelNames() { return Collections.unmodifiableList( perCycleChannelNames ); }
	public List< String > getChannelNames() { return Collections.unmodifiableList( channelNames ); }

	public int getNumRegions()
	{
		return Math.max( regionNames.size(), 1 );
	}

	public int getNumChannelsPerCycle()
	{
		return perCycleChannelNames.size();
	}

	/**
	 * @return region height in pixels
	 */
	public int getRegionHeightPixels()
	{
		return regionHeight * tileHeight;
	}

	/**
	 * @return region width in pixels
	 */
	public int getRegionWidthPixels()
	{
		return regionWidth * tileWidth;
	}

	/**
	 * Returns illumination correction parameters, or defaults when the block is absent.
	 */
	public IlluminationCorrectionParams getIlluminationCorrectionParams()
	{
		return illuminationCorrection != null ? illuminationCorrection : new IlluminationCorrectionParams();
	}

	/**
	 * Resolves a channel name into its position within a tile.
	 *
	 * @param channelName
	 * @return {@code [cycle index, channel index within the cycle]}
	 */
	public int[] getChannelCoordinates( final String channelName )
	{
		final int index = channelNames.indexOf( channelName );
		if ( index == -1 )
			throw new IllegalArgumentException( "Channel '" + channelName + "' is not one of the configured channels " + channelNames );

		final int channelsPerCycle = getNumChannelsPerCycle();
		if ( channelsPerCycle == 0 )
			throw new IllegalArgumentException( "Per-cycle channel names are not configured" );

		return new int[] { index / channelsPerCycle, index % channelsPerCycle };
	}

	public List< Integer > getRegionIndexes()
	{
		final List< Integer > regionIndexes = new ArrayList<>();
		for ( int region = 0; region < getNumRegions(); ++region )
			regionIndexes.add( region );
		return regionIndexes;
	}

	/**
	 * Enumerates every tile of every region, regions first, then rows, then columns.
	 */
	public List< TileIndices > getTileIndices()
	{
		final List< TileIndices > tileIndices = new ArrayList<>();
		for ( final int region : getRegionIndexes() )
			for ( int tileY = 0; tileY < regionHeight; ++tileY )
				for ( int tileX = 0; tileX < regionWidth; ++tileX )
					tileIndices.add( new TileIndices( region, tileX, tileY ) );
		return tileIndices;
	}
}
