package org.janelia.codex;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

import org.janelia.dataaccess.DataProvider;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Loads and stores experiment configurations in JSON format.
 * Keys use the snake_case naming of the experiment files, e.g. {@code tile_height} or {@code channel_mapping}.
 */
public class ExperimentConfigJSONProvider
{
	public static ExperimentConfig loadExperimentConfig( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			final ExperimentConfig config = createGson().fromJson( closeableReader, ExperimentConfig.class );
			if ( config == null )
				throw new IOException( "Experiment configuration is empty" );
			return config;
		}
		catch ( final JsonParseException e )
		{
			throw new IOException( "Malformed experiment configuration: " + e.getMessage(), e );
		}
	}

	public static ExperimentConfig loadExperimentConfig( final DataProvider dataProvider, final String link ) throws IOException
	{
		return loadExperimentConfig( dataProvider.getReader( link ) );
	}

	public static void saveExperimentConfig( final ExperimentConfig config, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( createGson().toJson( config ) );
		}
	}

	private static Gson createGson()
	{
		return new GsonBuilder()
				.setFieldNamingPolicy( FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES )
				.setPrettyPrinting()
				.create();
	}
}
