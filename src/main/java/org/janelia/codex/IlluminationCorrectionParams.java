package org.janelia.codex;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters of the {@code illumination_correction} block of an experiment configuration.
 * Fields omitted in the configuration file keep their default values.
 */
public class IlluminationCorrectionParams implements Serializable
{
	private static final long serialVersionUID = -3862166386373213512L;

	public static final List< Double > DEFAULT_FILTER_RANGE = Arrays.asList( 0.1, 0.9 );
	public static final List< String > DEFAULT_FILTER_FEATURES = Arrays.asList( "cell_diameter" );
	public static final int DEFAULT_MAX_CELLS = 100000;
	public static final int DEFAULT_N_ESTIMATORS = 25;
	public static final double DEFAULT_MEAN_TOLERANCE = 1e-8;

	private Map< String, String > channelMapping = new LinkedHashMap<>();
	private List< Double > filterRange = new ArrayList<>( DEFAULT_FILTER_RANGE );
	private int maxCells = DEFAULT_MAX_CELLS;
	private int nEstimators = DEFAULT_N_ESTIMATORS;
	private List< String > filterFeatures = new ArrayList<>( DEFAULT_FILTER_FEATURES );
	private double meanTolerance = DEFAULT_MEAN_TOLERANCE;

	public IlluminationCorrectionParams() {}

	public IlluminationCorrectionParams( final Map< String, String > channelMapping )
	{
		this.channelMapping = new LinkedHashMap<>( channelMapping );
	}

	public Map< String, String > getChannelMapping() { return channelMapping; }
	public List< Double > getFilterRange() { return filterRange; }
	public int getMaxCells() { return maxCells; }
	public int getNEstimators() { return nEstimators; }
	public List< String > getFilterFeatures() { return filterFeatures; }
	public double getMeanTolerance() { return meanTolerance; }

	public IlluminationCorrectionParams setFilterRange( final List< Double > filterRange )
	{
		this.filterRange = filterRange;
		return this;
	}

	public IlluminationCorrectionParams setMaxCells( final int maxCells )
	{
		this.maxCells = maxCells;
		return this;
	}

	public IlluminationCorrectionParams setNEstimators( final int nEstimators )
	{
		this.nEstimators = nEstimators;
		return this;
	}

	public IlluminationCorrectionParams setFilterFeatures( final List< String > filterFeatures )
	{
		this.filterFeatures = filterFeatures;
		return this;
	}

	public IlluminationCorrectionParams setMeanTolerance( final double meanTolerance )
	{
		this.meanTolerance = meanTolerance;
		return this;
	}
}
