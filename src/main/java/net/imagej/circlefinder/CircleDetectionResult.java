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
package net.imagej.circlefinder;

import java.util.Collections;
import java.util.List;

import net.imagej.circlefinder.hough.HoughCircle;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.complex.ComplexDoubleType;

/**
 * The circles found in one image, sorted by decreasing metric, with the
 * warnings emitted while finding them.
 */
public class CircleDetectionResult
{

	private final List< HoughCircle > circles;

	private final boolean withRadii;

	private final Img< ComplexDoubleType > accumulator;

	private final List< String > warnings;

	public CircleDetectionResult( final List< HoughCircle > circles, final boolean withRadii, final Img< ComplexDoubleType > accumulator, final List< String > warnings )
	{
		this.circles = Collections.unmodifiableList( circles );
		this.withRadii = withRadii;
		this.accumulator = accumulator;
		this.warnings = Collections.unmodifiableList( warnings );
	}

	public List< HoughCircle > getCircles()
	{
		return circles;
	}

	/**
	 * Returns the circle centers as a <code>n x 2</code> array of
	 * <code>(x, y)</code> pixel coordinates.
	 */
	public double[][] getCenters()
	{
		final double[][] centers = new double[ circles.size() ][];
		for ( int i = 0; i < centers.length; i++ )
			centers[ i ] = new double[] { circles.get( i ).getX(), circles.get( i ).getY() };
		return centers;
	}

	public double[] getMetric()
	{
		final double[] metric = new double[ circles.size() ];
		for ( int i = 0; i < metric.length; i++ )
			metric[ i ] = circles.get( i ).getMetric();
		return metric;
	}

	/**
	 * Returns the circle radii, or <code>null</code> if radii were not
	 * requested.
	 */
	public double[] getRadii()
	{
		if ( !withRadii )
			return null;
		final double[] radii = new double[ circles.size() ];
		for ( int i = 0; i < radii.length; i++ )
			radii[ i ] = circles.get( i ).getRadius();
		return radii;
	}

	/**
	 * Returns the Hough accumulator the circles were found in, or
	 * <code>null</code> if detection stopped before it was built.
	 */
	public Img< ComplexDoubleType > getAccumulator()
	{
		return accumulator;
	}

	public List< String > getWarnings()
	{
		return warnings;
	}

	public int size()
	{
		return circles.size();
	}

	public boolean isEmpty()
	{
		return circles.isEmpty();
	}

	@Override
	public String toString()
	{
		final StringBuilder sb = new StringBuilder();
		sb.append( circles.size() ).append( " circle(s)" );
		for ( final HoughCircle circle : circles )
			sb.append( "\n  " ).append( circle );
		return sb.toString();
	}
}
