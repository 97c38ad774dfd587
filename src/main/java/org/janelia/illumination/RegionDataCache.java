package org.janelia.illumination;

import java.io.IOException;
import java.io.Serializable;
import java.util.Collections;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.TreeMap;

import org.janelia.codex.CodexPaths;
import org.janelia.cytometry.CytometryData;
import org.janelia.dataaccess.DataProvider;
import org.janelia.dataaccess.PathResolver;
import org.janelia.illumination.model.IlluminationModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.FloatProcessor;

/**
 * Builds the illumination models and surfaces of every region once and keeps them for the lifetime
 * of the correction operator.
 *
 * {@link #prepare(CytometryData)} and {@link #persist(DataProvider, String)} are both idempotent.
 * They must be called from a single thread before tiles are corrected; afterwards the cache is only
 * read and may be shared by concurrent tile corrections.
 */
public class RegionDataCache implements Serializable
{
	private static final long serialVersionUID = -6914787339325104573L;

	private static final Logger LOG = LoggerFactory.getLogger( RegionDataCache.class );

	private final IlluminationModelFitter fitter;
	private final IlluminationImageRenderer renderer;

	private TreeMap< Integer, RegionIlluminationData > data;
	private boolean persisted;

	public RegionDataCache( final IlluminationModelFitter fitter, final IlluminationImageRenderer renderer )
	{
		this.fitter = fitter;
		this.renderer = renderer;
	}

	/**
	 * Creates a cache populated with already computed region data.
	 */
	RegionDataCache( final IlluminationModelFitter fitter, final IlluminationImageRenderer renderer, final Map< Integer, RegionIlluminationData > data )
	{
		this( fitter, renderer );
		this.data = new TreeMap<>( data );
	}

	public boolean isPrepared()
	{
		return data != null;
	}

	public boolean isPersisted()
	{
		return persisted;
	}

	/**
	 * Fits models and renders illumination images for every region present in the records.
	 * Does nothing if the cache has already been populated.
	 */
	public void prepare( final CytometryData records ) throws EmptyInputException, EmptyFilterResultException, DegenerateSignalException
	{
		if ( data != null )
			return;

		if ( records == null || records.isEmpty() )
			throw new EmptyInputException( "Cytometry data cannot be empty in order to use it for illumination correction" );

		final TreeMap< Integer, RegionIlluminationData > regionData = new TreeMap<>();
		for ( final Entry< Integer, CytometryData > region : records.groupByRegion().entrySet() )
		{
			LOG.info( "Preparing illumination data for region {} from {} cells", region.getKey(), region.getValue().size() );
			final Map< String, IlluminationModel > models = fitter.fit( region.getKey(), region.getValue() );
			final Map< String, IlluminationImage > images = renderer.render( models );
			regionData.put( region.getKey(), new RegionIlluminationData( images, models ) );
		}

		// published only when every region succeeded
		data = regionData;
	}

	public Set< Integer > getRegionIndexes() throws NotPreparedException
	{
		ensurePrepared( "list regions" );
		return Collections.unmodifiableSet( data.keySet() );
	}

	public RegionIlluminationData getRegionData( final int regionIndex ) throws NotPreparedException, UnpreparedRegionException
	{
		ensurePrepared( "access region data" );
		final RegionIlluminationData regionData = data.get( regionIndex );
		if ( regionData == null )
			throw new UnpreparedRegionException( "No illumination data for region " + regionIndex + " (prepared regions: " + data.keySet() + ")" );
		return regionData;
	}

	/**
	 * Writes one {@code (channel, height, width)} float32 image per region.
	 *
	 * @return directory containing the illumination images, or {@code null} if they have already been saved
	 */
	public String persist( final DataProvider dataProvider, final String outputDirectory ) throws NotPreparedException, IOException
	{
		ensurePrepared( "save region data" );
		if ( persisted )
			return null;

		String path = null;
		for ( final Entry< Integer, RegionIlluminationData > entry : data.entrySet() )
		{
			path = PathResolver.get( outputDirectory, CodexPaths.getIlluminationImagePath( entry.getKey() ) );
			dataProvider.saveImage( toImagePlus( entry.getValue(), PathResolver.getFileName( path ) ), path );
			LOG.debug( "Saved illumination image for region {} to {}", entry.getKey(), path );
		}

		persisted = true;
		return path != null ? PathResolver.getParent( path ) : outputDirectory;
	}

	private void ensurePrepared( final String operation ) throws NotPreparedException
	{
		if ( data == null )
			throw new NotPreparedException( "Cannot " + operation + " before region data is prepared" );
	}

	private static ImagePlus toImagePlus( final RegionIlluminationData regionData, final String title )
	{
		ImageStack stack = null;
		for ( final IlluminationImage image : regionData.getImages().values() )
		{
			if ( stack == null )
				stack = new ImageStack( image.getWidth(), image.getHeight() );
			stack.addSlice( new FloatProcessor( image.getWidth(), image.getHeight(), image.toArray() ) );
		}
		if ( stack == null )
			throw new IllegalStateException( "Region has no illumination images" );

		final ImagePlus imp = new ImagePlus( title, stack );
		imp.setDimensions( stack.getSize(), 1, 1 );
		return imp;
	}
}
