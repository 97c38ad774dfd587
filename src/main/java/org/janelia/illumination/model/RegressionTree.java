package org.janelia.illumination.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary regression tree fitted by least squares.
 *
 * Splits are searched exhaustively over all features using Friedman's improvement
 * {@code nL*nR/(nL+nR) * (meanL-meanR)^2}. A sample goes to the left child when its feature value
 * is less than or equal to the split threshold. Leaves predict the mean target of their samples.
 */
public class RegressionTree implements Serializable
{
	private static final long serialVersionUID = -8167419407373216340L;

	private static final int LEAF = -1;

	private final int[] feature;
	private final double[] threshold;
	private final int[] left, right;
	private final double[] value;

	private RegressionTree( final int[] feature, final double[] threshold, final int[] left, final int[] right, final double[] value )
	{
		this.feature = feature;
		this.threshold = threshold;
		this.left = left;
		this.right = right;
		this.value = value;
	}

	public double predict( final double[] x )
	{
		int node = 0;
		while ( feature[ node ] != LEAF )
			node = x[ feature[ node ] ] <= threshold[ node ] ? left[ node ] : right[ node ];
		return value[ node ];
	}

	public int getNumNodes()
	{
		return feature.length;
	}

	public int getNumLeaves()
	{
		int leaves = 0;
		for ( final int f : feature )
			if ( f == LEAF )
				++leaves;
		return leaves;
	}

	/**
	 * Fits a tree to the given samples.
	 *
	 * @param x
	 * 			feature values indexed as {@code [feature][sample]}
	 * @param target
	 * 			target value of every sample
	 * @param sortedSamples
	 * 			for each feature, the sample indices sorted by ascending feature value
	 * @param maxDepth
	 * @param minSamplesSplit
	 * @param minSamplesLeaf
	 */
	public static RegressionTree fit(
			final double[][] x,
			final double[] target,
			final int[][] sortedSamples,
			final int maxDepth,
			final int minSamplesSplit,
			final int minSamplesLeaf )
	{
		final Builder builder = new Builder( x, target, maxDepth, minSamplesSplit, minSamplesLeaf );
		builder.build( sortedSamples, 0 );
		return builder.create();
	}

	private static class Builder
	{
		private final double[][] x;
		private final double[] target;
		private final int maxDepth, minSamplesSplit, minSamplesLeaf;

		// split side of every sample for the node being partitioned
		private final boolean[] goesLeft;

		private final List< Integer > feature = new ArrayList<>();
		private final List< Double > threshold = new ArrayList<>();
		private final List< Integer > left = new ArrayList<>(), right = new ArrayList<>();
		private final List< Double > value = new ArrayList<>();

		Builder( final double[][] x, final double[] target, final int maxDepth, final int minSamplesSplit, final int minSamplesLeaf )
		{
			this.x = x;
			this.target = target;
			this.maxDepth = maxDepth;
			this.minSamplesSplit = Math.max( minSamplesSplit, 2 );
			this.minSamplesLeaf = Math.max( minSamplesLeaf, 1 );
			goesLeft = new boolean[ target.length ];
		}

		int build( final int[][] sortedSamples, final int depth )
		{
			final int[] samples = sortedSamples[ 0 ];
			final int n = samples.length;

			double sum = 0;
			for ( final int sample : samples )
				sum += target[ sample ];

			final int node = addNode( sum / n );
			if ( depth >= maxDepth || n < minSamplesSplit || n < 2 * minSamplesLeaf )
				return node;

			int bestFeature = LEAF;
			double bestThreshold = 0, bestImprovement = 0;
			for ( int f = 0; f < x.length; ++f )
			{
				final double[] values = x[ f ];
				final int[] order = sortedSamples[ f ];
				double leftSum = 0;
				for ( int i = 0; i < n - 1; ++i )
				{
					leftSum += target[ order[ i ] ];

					final double current = values[ order[ i ] ], next = values[ order[ i + 1 ] ];
					if ( current == next )
						continue;

					final int nLeft = i + 1, nRight = n - nLeft;
					if ( nLeft < minSamplesLeaf || nRight < minSamplesLeaf )
						continue;

					final double diff = leftSum / nLeft - ( sum - leftSum ) / nRight;
					final double improvement = ( ( double ) nLeft * nRight / n ) * diff * diff;
					if ( improvement > bestImprovement )
					{
						bestImprovement = improvement;
						bestFeature = f;
						bestThreshold = current + ( next - current ) / 2;
						// midpoint of adjacent doubles may round up to the next value
						if ( bestThreshold >= next )
							bestThreshold = current;
					}
				}
			}

			if ( bestFeature == LEAF )
				return node;

			int nLeft = 0;
			for ( final int sample : samples )
			{
				goesLeft[ sample ] = x[ bestFeature ][ sample ] <= bestThreshold;
				if ( goesLeft[ sample ] )
					++nLeft;
			}

			final int[][] leftSamples = new int[ x.length ][ nLeft ];
			final int[][] rightSamples = new int[ x.length ][ n - nLeft ];
			for ( int f = 0; f < x.length; ++f )
			{
				int l = 0, r = 0;
				for ( final int sample : sortedSamples[ f ] )
				{
					if ( goesLeft[ sample ] )
						leftSamples[ f ][ l++ ] = sample;
					else
						rightSamples[ f ][ r++ ] = sample;
				}
			}

			feature.set( node, bestFeature );
			threshold.set( node, bestThreshold );
			left.set( node, build( leftSamples, depth + 1 ) );
			right.set( node, build( rightSamples, depth + 1 ) );
			return node;
		}

		private int addNode( final double nodeValue )
		{
			feature.add( LEAF );
			threshold.add( Double.NaN );
			left.add( LEAF );
			right.add( LEAF );
			value.add( nodeValue );
			return value.size() - 1;
		}

		RegressionTree create()
		{
			final int numNodes = value.size();
			final int[] featureArr = new int[ numNodes ], leftArr = new int[ numNodes ], rightArr = new int[ numNodes ];
			final double[] thresholdArr = new double[ numNodes ], valueArr = new double[ numNodes ];
			for ( int i = 0; i < numNodes; ++i )
			{
				featureArr[ i ] = feature.get( i );
				thresholdArr[ i ] = threshold.get( i );
				leftArr[ i ] = left.get( i );
				rightArr[ i ] = right.get( i );
				valueArr[ i ] = value.get( i );
			}
			return new RegressionTree( featureArr, thresholdArr, leftArr, rightArr, valueArr );
		}
	}
}
