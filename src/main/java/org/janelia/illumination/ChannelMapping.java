package org.janelia.illumination;

import java.io.Serializable;
import java.util.Collections;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.TreeMap;

import org.janelia.codex.ExperimentConfig;

/**
 * Routes the illumination model of each source channel to the tile channels it corrects.
 * Target names are resolved into {@link ChannelTarget}s once, when the mapping is created.
 * Iteration follows the sort order of source channel names.
 */
public class ChannelMapping implements Serializable
{
	private static final long serialVersionUID = 2638722093813315305L;

	private final TreeMap< String, ChannelTarget > targets;

	public ChannelMapping( final Map< String, ChannelTarget > targets )
	{
		this.targets = new TreeMap<>( targets );
	}

	public static ChannelMapping resolve( final Map< String, String > channelMapping, final ExperimentConfig config )
	{
		if ( channelMapping == null || channelMapping.isEmpty() )
			throw new IllegalArgumentException( "Channel mapping for illumination correction must not be empty" );

		final Map< String, ChannelTarget > targets = new TreeMap<>();
		for ( final Entry< String, String > entry : channelMapping.entrySet() )
		{
			final String targetName = entry.getValue();
			if ( targetName == null )
				throw new IllegalArgumentException( "Target channel of source channel '" + entry.getKey() + "' is not specified" );

			if ( targetName.equals( ChannelTarget.ALL_CHANNELS_NAME ) )
			{
				targets.put( entry.getKey(), ChannelTarget.ALL );
			}
			else
			{
				final int[] coordinates = config.getChannelCoordinates( targetName );
				targets.put( entry.getKey(), ChannelTarget.specificChannel( coordinates[ 0 ], coordinates[ 1 ] ) );
			}
		}
		return new ChannelMapping( targets );
	}

	public Set< String > getSourceChannels()
	{
		return Collections.unmodifiableSet( targets.keySet() );
	}

	public Set< Entry< String, ChannelTarget > > entrySet()
	{
		return Collections.unmodifiableMap( targets ).entrySet();
	}

	public ChannelTarget getTarget( final String sourceChannel )
	{
		return targets.get( sourceChannel );
	}

	public int size()
	{
		return targets.size();
	}

	@Override
	public String toString()
	{
		return targets.toString();
	}
}
