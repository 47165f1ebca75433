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
package net.imagej.circlefinder.edge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import net.imagej.circlefinder.gradient.GradientField;
import net.imglib2.Cursor;
import net.imglib2.Point;
import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Selects the voting pixels of a gradient field: the pixels whose gradient
 * magnitude is strictly above a fraction of the maximal magnitude.
 */
public class EdgeExtractor
{

	/**
	 * Value of the edge threshold that requests an automatic (Otsu) threshold.
	 */
	public static final double AUTOMATIC = Double.NaN;

	private EdgeExtractor()
	{}

	/**
	 * Returns the edge pixels of the specified gradient field, in column-major
	 * order (X outer, Y inner).
	 *
	 * @param gradient
	 *            the gradient field.
	 * @param edgeThreshold
	 *            the threshold as a fraction of the maximal magnitude, in [0,
	 *            1], or {@link #AUTOMATIC}.
	 * @return a new list, empty if no pixel is above threshold.
	 */
	public static List< Point > extract( final GradientField gradient, final double edgeThreshold )
	{
		if ( !Double.isNaN( edgeThreshold ) && ( edgeThreshold < 0. || edgeThreshold > 1. ) )
			throw new IllegalArgumentException( "Edge threshold must be in [0, 1]. Got " + edgeThreshold + "." );

		final Img< DoubleType > magnitude = gradient.getMagnitude();
		final double gMax = max( magnitude );
		if ( gMax <= 0. )
			return Collections.emptyList();

		final double fraction = Double.isNaN( edgeThreshold )
				? OtsuThreshold.level( normalize( magnitude, gMax ) )
				: edgeThreshold;
		final double t = gMax * fraction;

		final long width = gradient.width();
		final long height = gradient.height();
		final List< Point > edges = new ArrayList<>();
		final RandomAccess< DoubleType > ra = magnitude.randomAccess();
		for ( long x = 0; x < width; x++ )
		{
			ra.setPosition( x, 0 );
			for ( long y = 0; y < height; y++ )
			{
				ra.setPosition( y, 1 );
				if ( ra.get().get() > t )
					edges.add( new Point( x, y ) );
			}
		}
		return edges;
	}

	private static final double max( final Img< DoubleType > img )
	{
		double max = 0.;
		for ( final DoubleType p : img )
			if ( p.get() > max )
				max = p.get();
		return max;
	}

	private static final Img< DoubleType > normalize( final Img< DoubleType > img, final double max )
	{
		final Img< DoubleType > normalized = ArrayImgs.doubles( img.dimension( 0 ), img.dimension( 1 ) );
		final Cursor< DoubleType > in = img.cursor();
		final Cursor< DoubleType > out = normalized.cursor();
		while ( in.hasNext() )
			out.next().set( in.next().get() / max );
		return normalized;
	}
}
