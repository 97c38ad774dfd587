package org.janelia.illumination.model;

/**
 * Fitted ensemble produced by {@link GradientBoostingRegressor}. Immutable.
 */
public class GradientBoostedTrees implements IlluminationModel
{
	private static final long serialVersionUID = -3297340931960390436L;

	private final double initialPrediction;
	private final double learningRate;
	private final RegressionTree[] trees;

	GradientBoostedTrees( final double initialPrediction, final double learningRate, final RegressionTree[] trees )
	{
		this.initialPrediction = initialPrediction;
		this.learningRate = learningRate;
		this.trees = trees.clone();
	}

	public int getNumTrees()
	{
		return trees.length;
	}

	public double getInitialPrediction()
	{
		return initialPrediction;
	}

	public double predict( final double[] x )
	{
		double prediction = initialPrediction;
		for ( final RegressionTree tree : trees )
			prediction += learningRate * tree.predict( x );
		return prediction;
	}

	@Override
	public double predict( final double ry, final double rx )
	{
		return predict( new double[] { ry, rx } );
	}
}
