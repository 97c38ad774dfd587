package org.janelia.illumination;

import java.io.Serializable;

/**
 * Destination of the correction computed from a source channel: either every channel of a tile
 * or one channel at a fixed (cycle, channel) position.
 */
public abstract class ChannelTarget implements Serializable
{
	private static final long serialVersionUID = -5305837047618848235L;

	/**
	 * Name that designates all channels in a channel mapping.
	 */
	public static final String ALL_CHANNELS_NAME = "all";

	public static final ChannelTarget ALL = new AllChannels();

	private ChannelTarget() {}

	public abstract boolean isAllChannels();

	public static ChannelTarget specificChannel( final int cycle, final int channel )
	{
		return new SpecificChannel( cycle, channel );
	}

	public static final class AllChannels extends ChannelTarget
	{
		private static final long serialVersionUID = 2171566870941577016L;

		private AllChannels() {}

		@Override
		public boolean isAllChannels()
		{
			return true;
		}

		@Override
		public boolean equals( final Object obj )
		{
			return obj instanceof AllChannels;
		}

		@Override
		public int hashCode()
		{
			return AllChannels.class.hashCode();
		}

		@Override
		public String toString()
		{
			return ALL_CHANNELS_NAME;
		}

		private Object readResolve()
		{
			return ALL;
		}
	}

	public static final class SpecificChannel extends ChannelTarget
	{
		private static final long serialVersionUID = -1176096618407046315L;

		public final int cycle, channel;

		private SpecificChannel( final int cycle, final int channel )
		{
			this.cycle = cycle;
			this.channel = channel;
		}

		@Override
		public boolean isAllChannels()
		{
			return false;
		}

		@Override
		public boolean equals( final Object obj )
		{
			if ( !( obj instanceof SpecificChannel ) )
				return false;
			final SpecificChannel other = ( SpecificChannel ) obj;
			return cycle == other.cycle && channel == other.channel;
		}

		@Override
		public int hashCode()
		{
			return cycle * 31 + channel;
		}

		@Override
		public String toString()
		{
			return "cycle=" + cycle + ", channel=" + channel;
		}
	}
}
