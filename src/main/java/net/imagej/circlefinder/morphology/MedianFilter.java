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
package net.imagej.circlefinder.morphology;

import org.apache.commons.math3.stat.descriptive.rank.Median;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.algorithm.neighborhood.Neighborhood;
import net.imglib2.algorithm.neighborhood.RectangleShape;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * Square median filter for 2D images. Pixels outside the image are taken as
 * 0.
 */
public class MedianFilter
{

	private MedianFilter()
	{}

	/**
	 * @param input
	 *            the image to filter.
	 * @param windowSize
	 *            the side of the square window, odd.
	 * @return a new image.
	 */
	public static Img< DoubleType > apply( final Img< DoubleType > input, final int windowSize )
	{
		if ( windowSize < 1 || windowSize % 2 == 0 )
			throw new IllegalArgumentException( "Median window size must be odd and positive. Got " + windowSize + "." );

		final Img< DoubleType > output = ArrayImgs.doubles( input.dimension( 0 ), input.dimension( 1 ) );
		final RectangleShape shape = new RectangleShape( windowSize / 2, false );
		final RandomAccess< Neighborhood< DoubleType > > nra = shape.neighborhoodsRandomAccessible( Views.extendZero( input ) ).randomAccess();

		final Median median = new Median();
		final double[] values = new double[ windowSize * windowSize ];
		final Cursor< DoubleType > cursor = output.localizingCursor();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			nra.setPosition( cursor );
			int i = 0;
			for ( final DoubleType v : nra.get() )
				values[ i++ ] = v.get();
			cursor.get().set( median.evaluate( values, 0, i ) );
		}
		return output;
	}
}
