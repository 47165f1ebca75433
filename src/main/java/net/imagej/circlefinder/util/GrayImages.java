/*-
 * #%L
 * A library for the detection of circular objects in images with a phase-coded circular Hough transform.
 * %%
 * Copyright (C) 2016 - 2022 My Company, Inc.
 * %%
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 * 
 * 1. Redistributions of source code must retain the above copyright notice,
 *    this list of conditions and the following disclaimer.
 * 2. Redistributions in binary form must reproduce the above copyright notice,
 *    this list of conditions and the following disclaimer in the documentation
 *    and/or other materials provided with the distribution.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT HOLDERS OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
 * POSSIBILITY OF SUCH DAMAGE.
 * #L%
 */
package net.imagej.circlefinder.util;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Util;
import net.imglib2.view.Views;

/**
 * Conversion of 2D input images to the floating-point gray images the circle
 * detection works on. The returned images always start at (0, 0).
 */
public class GrayImages
{

	private static final double RED_WEIGHT = 0.298936021293775;

	private static final double GREEN_WEIGHT = 0.587043074451121;

	private static final double BLUE_WEIGHT = 0.114020904255103;

	private GrayImages()
	{}

	/**
	 * Copies a real-valued image to a double image. Integer-typed pixels are
	 * rescaled from the range of their type to [0, 1]; other pixels are copied
	 * as they are.
	 */
	public static < T extends RealType< T > > Img< DoubleType > toDouble( final RandomAccessibleInterval< T > image )
	{
		check2D( image );
		final T type = Util.getTypeFromInterval( image );
		final boolean rescale = type instanceof IntegerType;
		final double min = type.getMinValue();
		final double range = type.getMaxValue() - min;

		final Img< DoubleType > gray = ArrayImgs.doubles( image.dimension( 0 ), image.dimension( 1 ) );
		final Cursor< T > in = Views.flatIterable( image ).cursor();
		final Cursor< DoubleType > out = gray.cursor();
		while ( in.hasNext() )
		{
			final double v = in.next().getRealDouble();
			out.next().set( rescale ? ( v - min ) / range : v );
		}
		return gray;
	}

	/**
	 * Converts a color image to its luminance, in [0, 1]. Alpha is ignored.
	 */
	public static Img< DoubleType > fromARGB( final RandomAccessibleInterval< ARGBType > image )
	{
		check2D( image );
		final Img< DoubleType > gray = ArrayImgs.doubles( image.dimension( 0 ), image.dimension( 1 ) );
		final Cursor< ARGBType > in = Views.flatIterable( image ).cursor();
		final Cursor< DoubleType > out = gray.cursor();
		while ( in.hasNext() )
		{
			final int argb = in.next().get();
			final double luminance = RED_WEIGHT * ARGBType.red( argb )
					+ GREEN_WEIGHT * ARGBType.green( argb )
					+ BLUE_WEIGHT * ARGBType.blue( argb );
			out.next().set( luminance / 255. );
		}
		return gray;
	}

	private static void check2D( final RandomAccessibleInterval< ? > image )
	{
		final int numDimensions = image.numDimensions();
		if ( numDimensions != 2 ) { throw new IllegalArgumentException(
				"Cannot detect circles in non-2D images. Got " + numDimensions + "D image." ); }
	}
}
