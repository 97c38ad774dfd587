package org.janelia.codex;

import java.util.List;

import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.broadcast.Broadcast;
import org.janelia.codex.ops.TileProcessor;
import org.janelia.dataaccess.DataProvider;
import org.janelia.dataaccess.DataProviderFactory;
import org.janelia.dataaccess.PathResolver;
import org.janelia.illumination.IlluminationCorrection;

import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;

/**
 * Corrects uneven illumination of every processor tile of an experiment.
 *
 * Region models are fitted once on the driver from the cytometry table of the data directory,
 * their illumination images are saved next to the tiles, and the tiles are then corrected in place
 * in parallel.
 *
 * Usage: {@code IlluminationCorrectionSpark <experiment config path> <data directory>}
 */
public class IlluminationCorrectionSpark
{
	public static < T extends NativeType< T > & RealType< T > > void main( final String[] args ) throws Exception
	{
		if ( args.length != 2 )
			throw new IllegalArgumentException( "Usage: IlluminationCorrectionSpark <experiment config path> <data directory>" );

		final String experimentConfigPath = args[ 0 ], dataDirectory = args[ 1 ];
		final DataProvider dataProvider = DataProviderFactory.create( DataProviderFactory.detectType( dataDirectory ) );
		final ExperimentConfig config = ExperimentConfigJSONProvider.loadExperimentConfig( dataProvider, experimentConfigPath );

		final IlluminationCorrection illuminationCorrection = new IlluminationCorrection( config );
		System.out.println( "Preparing illumination data for " + config.getNumRegions() + " region(s)..." );
		illuminationCorrection.prepareRegionData( dataProvider, dataDirectory );

		final String illuminationDirectory = illuminationCorrection.saveRegionData( dataProvider, dataDirectory );
		if ( illuminationDirectory != null )
			System.out.println( "Saved illumination images to " + illuminationDirectory );

		final List< TileIndices > tileIndices = config.getTileIndices();
		try ( final JavaSparkContext sparkContext = new JavaSparkContext( new SparkConf()
				.setAppName( "IlluminationCorrectionSpark" )
				.set( "spark.serializer", "org.apache.spark.serializer.KryoSerializer" )
			) )
		{
			final Broadcast< TileProcessor > broadcastedTileProcessor = sparkContext.broadcast( new TileProcessor( illuminationCorrection ) );

			System.out.println( "Correcting " + tileIndices.size() + " tiles..." );
			final List< String > correctedTilePaths = sparkContext
					.parallelize( tileIndices, tileIndices.size() )
					.map( tile ->
						{
							final DataProvider localDataProvider = DataProviderFactory.create( DataProviderFactory.detectType( dataDirectory ) );
							try ( final TileProcessor tileProcessor = broadcastedTileProcessor.value().initialize() )
							{
								return tileProcessor.< T >process( localDataProvider, dataDirectory, tile );
							}
						}
					)
					.collect();

			broadcastedTileProcessor.destroy();
			if ( correctedTilePaths.isEmpty() )
				System.out.println( "Done: no tiles to correct" );
			else
				System.out.println( "Done: corrected " + correctedTilePaths.size() + " tiles in " + PathResolver.get( dataDirectory, PathResolver.getParent( correctedTilePaths.get( 0 ) ) ) );
		}
	}
}
