package org.janelia.illumination;

import java.io.Serializable;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Dense float32 illumination surface over a whole region, stored row by row.
 * The wrapped array is never modified after construction.
 */
public class IlluminationImage implements Serializable
{
	private static final long serialVersionUID = -7415095734180513016L;

	private final int height, width;
	private final float[] data;

	public IlluminationImage( final int height, final int width, final float[] data )
	{
		if ( data.length != ( long ) height * width )
			throw new IllegalArgumentException( "Expected " + ( ( long ) height * width ) + " values for " + height + "x" + width + " image, got " + data.length );
		this.height = height;
		this.width = width;
		this.data = data;
	}

	public int getHeight() { return height; }
	public int getWidth() { return width; }

	public float get( final int ry, final int rx )
	{
		return data[ ry * width + rx ];
	}

	/**
	 * @return a copy of the row-major pixel values
	 */
	public float[] toArray()
	{
		return data.clone();
	}

	/**
	 * Wraps the surface as an imglib2 image with dimensions {@code [width, height]} without copying.
	 * The returned image must only be read.
	 */
	public RandomAccessibleInterval< FloatType > getImg()
	{
		return ArrayImgs.floats( data, width, height );
	}
}
