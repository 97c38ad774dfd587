package org.janelia.illumination;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;

import org.janelia.cytometry.CytometryData;
import org.janelia.illumination.model.GradientBoostingRegressor;
import org.janelia.illumination.model.IlluminationModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits one {@link IlluminationModel} per source channel from the cytometry records of a region.
 *
 * Records are restricted to the quantile range of the channel intensity and of the extra filter
 * features, downsampled to at most {@code maxCells} records, and the intensities are normalized by
 * their mean before fitting the spatial regression model.
 */
public class IlluminationModelFitter implements Serializable
{
	private static final long serialVersionUID = 8851446327016419230L;

	private static final Logger LOG = LoggerFactory.getLogger( IlluminationModelFitter.class );

	public static final long SEED = 5512;

	private final ChannelMapping channelMapping;
	private final QuantileFilter quantileFilter;
	private final List< String > filterFeatures;
	private final int maxCells;
	private final double meanTolerance;
	private final GradientBoostingRegressor regressor;

	public IlluminationModelFitter(
			final ChannelMapping channelMapping,
			final QuantileFilter quantileFilter,
			final List< String > filterFeatures,
			final int maxCells,
			final double meanTolerance,
			final GradientBoostingRegressor regressor )
	{
		if ( maxCells < 1 )
			throw new IllegalArgumentException( "Max cells must be positive (given = " + maxCells + ")" );
		if ( !( meanTolerance >= 0 ) )
			throw new IllegalArgumentException( "Mean tolerance must be non-negative (given = " + meanTolerance + ")" );

		this.channelMapping = channelMapping;
		this.quantileFilter = quantileFilter;
		this.filterFeatures = new ArrayList<>( filterFeatures );
		this.maxCells = maxCells;
		this.meanTolerance = meanTolerance;
		this.regressor = regressor;
	}

	/**
	 * @param regionIndex
	 * 			region the records belong to (used in messages only)
	 * @param data
	 * 			cytometry records of the region
	 * @return source channel mapped to its fitted model, in channel mapping order
	 */
	public Map< String, IlluminationModel > fit( final int regionIndex, final CytometryData data ) throws EmptyFilterResultException, DegenerateSignalException
	{
		final Map< String, IlluminationModel > models = new LinkedHashMap<>();
		for ( final String channel : channelMapping.getSourceChannels() )
		{
			final String feature = CytometryData.getChannelFeature( channel );
			final List< String > features = new ArrayList<>();
			features.add( feature );
			features.addAll( filterFeatures );

			CytometryData selected = data.select( quantileFilter.getFilterMask( data, features ) );

			if ( selected.size() > maxCells )
				selected = selected.select( downsample( selected.size(), maxCells, SEED ) );

			if ( selected.isEmpty() )
				throw new EmptyFilterResultException( "Cytometry data empty after application of feature filters for channel " + channel + " in region " + regionIndex );

			LOG.debug( "Building illumination model for region {}, channel \"{}\" using {} cells ({} originally)", regionIndex, channel, selected.size(), data.size() );

			final double[] intensity = selected.getColumn( feature );
			final double mean = Arrays.stream( intensity ).average().getAsDouble();
			if ( Math.abs( mean ) <= meanTolerance )
				throw new DegenerateSignalException( String.format(
						"Average %s channel intensity for region %d (across %d cells) is ~0, making illumination correction impossible",
						channel, regionIndex, selected.size() ) );

			final double[] normalized = new double[ intensity.length ];
			for ( int i = 0; i < intensity.length; ++i )
				normalized[ i ] = intensity[ i ] / mean;

			models.put( channel, regressor.fit(
					selected.getColumn( CytometryData.REGION_Y_COLUMN ),
					selected.getColumn( CytometryData.REGION_X_COLUMN ),
					normalized ) );
		}
		return models;
	}

	/**
	 * Uniform sampling without replacement: the first {@code count} steps of a Fisher-Yates shuffle
	 * driven by {@link Random} with the given seed.
	 *
	 * @return ascending indices of the selected records
	 */
	public static int[] downsample( final int size, final int count, final long seed )
	{
		if ( count >= size )
			return IntStream.range( 0, size ).toArray();

		final int[] indices = new int[ size ];
		for ( int i = 0; i < size; ++i )
			indices[ i ] = i;

		final Random random = new Random( seed );
		for ( int i = 0; i < count; ++i )
		{
			final int j = i + random.nextInt( size - i );
			final int tmp = indices[ i ];
			indices[ i ] = indices[ j ];
			indices[ j ] = tmp;
		}

		final int[] selected = Arrays.copyOf( indices, count );
		Arrays.sort( selected );
		return selected;
	}
}
