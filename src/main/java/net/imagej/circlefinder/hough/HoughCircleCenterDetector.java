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
package net.imagej.circlefinder.hough;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import net.imagej.circlefinder.morphology.GrayscaleReconstruction;
import net.imagej.circlefinder.morphology.MedianFilter;
import net.imagej.circlefinder.morphology.RegionalMaxima;
import net.imglib2.Cursor;
import net.imglib2.Point;
import net.imglib2.RandomAccess;
import net.imglib2.RealPoint;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Finds circle center candidates in a phase-coded Hough accumulator.
 * <p>
 * The accumulator magnitude is median-filtered, maxima less prominent than
 * the suppression threshold are flattened (h-maxima), and each remaining
 * regional maximum yields one candidate at its centroid weighted by the
 * unfiltered magnitude. The metric of a candidate is the suppressed magnitude
 * at its rounded position.
 */
public class HoughCircleCenterDetector
{

	public static final int MEDIAN_FILTER_SIZE = 5;

	private final double suppressionThreshold;

	/**
	 * @param suppressionThreshold
	 *            min prominence of a maximum, in [0, 1]. Fewer centers are
	 *            found as it increases.
	 */
	public HoughCircleCenterDetector( final double suppressionThreshold )
	{
		if ( Double.isNaN( suppressionThreshold ) || suppressionThreshold < 0. || suppressionThreshold > 1. )
			throw new IllegalArgumentException( "Suppression threshold must be in [0, 1]. Got " + suppressionThreshold + "." );
		this.suppressionThreshold = suppressionThreshold;
	}

	/**
	 * Detects the center candidates in the specified accumulator.
	 *
	 * @param accumulator
	 *            the 2D complex accumulator.
	 * @return a new list of candidates with <code>NaN</code> radius, sorted by
	 *         decreasing metric.
	 */
	public List< HoughCircle > detect( final Img< ComplexDoubleType > accumulator )
	{
		final long width = accumulator.dimension( 0 );
		final long height = accumulator.dimension( 1 );

		final Img< DoubleType > magnitude = ArrayImgs.doubles( width, height );
		final Cursor< ComplexDoubleType > cin = accumulator.cursor();
		final Cursor< DoubleType > cout = magnitude.cursor();
		while ( cin.hasNext() )
			cout.next().set( cin.next().getPowerDouble() );

		final Img< DoubleType > smoothed = ( Math.min( width, height ) > MEDIAN_FILTER_SIZE )
				? MedianFilter.apply( magnitude, MEDIAN_FILTER_SIZE )
				: magnitude;

		final double h = Math.max( suppressionThreshold - Math.ulp( suppressionThreshold ), 0. );
		final Img< DoubleType > suppressed = GrayscaleReconstruction.hMaxima( smoothed, h );

		final List< List< Point > > regions = RegionalMaxima.find( suppressed );

		final RandomAccess< DoubleType > raMag = magnitude.randomAccess();
		final RandomAccess< DoubleType > raSup = suppressed.randomAccess();
		final List< HoughCircle > centers = new ArrayList<>( regions.size() );
		for ( final List< Point > region : regions )
		{
			double sw = 0.;
			double swx = 0.;
			double swy = 0.;
			for ( final Point p : region )
			{
				raMag.setPosition( p );
				final double w = raMag.get().get();
				sw += w;
				swx += w * p.getDoublePosition( 0 );
				swy += w * p.getDoublePosition( 1 );
			}
			final double cx = swx / sw;
			final double cy = swy / sw;
			// Zero-weight regions.
			if ( Double.isNaN( cx ) || Double.isNaN( cy ) )
				continue;

			raSup.setPosition( Math.round( cx ), 0 );
			raSup.setPosition( Math.round( cy ), 1 );
			final double metric = raSup.get().get();
			centers.add( new HoughCircle( new RealPoint( cx, cy ), metric ) );
		}

		Collections.sort( centers, HoughCircle.DECREASING_METRIC );
		return centers;
	}

	public double getSuppressionThreshold()
	{
		return suppressionThreshold;
	}
}
