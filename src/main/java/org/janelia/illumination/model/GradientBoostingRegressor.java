package org.janelia.illumination.model;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Least-squares gradient boosting of {@link RegressionTree}s.
 *
 * The ensemble starts from the mean of the target and every stage fits a tree to the
 * current residuals, adding its prediction scaled by the learning rate.
 * Fitting uses all samples in every stage and is fully deterministic.
 */
public class GradientBoostingRegressor implements Serializable
{
	private static final long serialVersionUID = 6479263522016417093L;

	public static final double DEFAULT_LEARNING_RATE = 0.1;
	public static final int DEFAULT_MAX_DEPTH = 3;
	public static final int DEFAULT_MIN_SAMPLES_SPLIT = 2;
	public static final int DEFAULT_MIN_SAMPLES_LEAF = 1;

	private final int nEstimators;
	private final double learningRate;
	private final int maxDepth;
	private final int minSamplesSplit;
	private final int minSamplesLeaf;

	public GradientBoostingRegressor( final int nEstimators )
	{
		this( nEstimators, DEFAULT_LEARNING_RATE, DEFAULT_MAX_DEPTH, DEFAULT_MIN_SAMPLES_SPLIT, DEFAULT_MIN_SAMPLES_LEAF );
	}

	public GradientBoostingRegressor(
			final int nEstimators,
			final double learningRate,
			final int maxDepth,
			final int minSamplesSplit,
			final int minSamplesLeaf )
	{
		if ( nEstimators < 1 )
			throw new IllegalArgumentException( "Number of estimators must be positive (given = " + nEstimators + ")" );
		if ( !( learningRate > 0 ) )
			throw new IllegalArgumentException( "Learning rate must be positive (given = " + learningRate + ")" );
		if ( maxDepth < 1 )
			throw new IllegalArgumentException( "Max depth must be positive (given = " + maxDepth + ")" );

		this.nEstimators = nEstimators;
		this.learningRate = learningRate;
		this.maxDepth = maxDepth;
		this.minSamplesSplit = minSamplesSplit;
		this.minSamplesLeaf = minSamplesLeaf;
	}

	public int getNEstimators() { return nEstimators; }
	public double getLearningRate() { return learningRate; }
	public int getMaxDepth() { return maxDepth; }

	/**
	 * Fits a boosted ensemble mapping (ry, rx) to the target.
	 */
	public GradientBoostedTrees fit( final double[] ry, final double[] rx, final double[] target )
	{
		return fit( new double[][] { ry, rx }, target );
	}

	/**
	 * @param x
	 * 			feature values indexed as {@code [feature][sample]}
	 * @param target
	 * 			target value of every sample
	 */
	public GradientBoostedTrees fit( final double[][] x, final double[] target )
	{
		final int n = target.length;
		if ( n == 0 )
			throw new IllegalArgumentException( "Cannot fit a model without samples" );
		for ( final double[] featureValues : x )
		{
			if ( featureValues.length != n )
				throw new IllegalArgumentException( "Feature and target sizes do not match: " + featureValues.length + " != " + n );
			for ( final double v : featureValues )
				if ( !Double.isFinite( v ) )
					throw new IllegalArgumentException( "Feature values must be finite" );
		}

		double sum = 0;
		for ( final double v : target )
		{
			if ( !Double.isFinite( v ) )
				throw new IllegalArgumentException( "Target values must be finite" );
			sum += v;
		}
		final double initialPrediction = sum / n;

		final int[][] sortedSamples = new int[ x.length ][];
		for ( int f = 0; f < x.length; ++f )
		{
			final double[] featureValues = x[ f ];
			sortedSamples[ f ] = IntStream.range( 0, n ).boxed()
					.sorted( Comparator.comparingDouble( i -> featureValues[ i ] ) )
					.mapToInt( Integer::intValue )
					.toArray();
		}

		final double[] prediction = new double[ n ];
		final double[] residual = new double[ n ];
		Arrays.fill( prediction, initialPrediction );

		final RegressionTree[] trees = new RegressionTree[ nEstimators ];
		final double[] sample = new double[ x.length ];
		for ( int stage = 0; stage < nEstimators; ++stage )
		{
			for ( int i = 0; i < n; ++i )
				residual[ i ] = target[ i ] - prediction[ i ];

			trees[ stage ] = RegressionTree.fit( x, residual, sortedSamples, maxDepth, minSamplesSplit, minSamplesLeaf );

			for ( int i = 0; i < n; ++i )
			{
				for ( int f = 0; f < x.length; ++f )
					sample[ f ] = x[ f ][ i ];
				prediction[ i ] += learningRate * trees[ stage ].predict( sample );
			}
		}

		return new GradientBoostedTrees( initialPrediction, learningRate, trees );
	}
}
