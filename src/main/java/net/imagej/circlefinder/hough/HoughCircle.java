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

import java.util.Comparator;

import net.imglib2.RealLocalizable;
import net.imglib2.RealPoint;

public class HoughCircle extends RealPoint
{

	/**
	 * Orders circles by decreasing metric. Stable sorts with this comparator
	 * keep discovery order among circles of equal metric.
	 */
	public static final Comparator< HoughCircle > DECREASING_METRIC = ( c1, c2 ) -> Double.compare( c2.metric, c1.metric );

	private final double metric;

	private final double radius;

	public HoughCircle( final RealLocalizable pos, final double metric )
	{
		this( pos, metric, Double.NaN );
	}

	public HoughCircle( final RealLocalizable pos, final double metric, final double radius )
	{
		super( pos );
		this.metric = metric;
		this.radius = radius;
	}

	@Override
	public String toString()
	{
		final StringBuilder sb = new StringBuilder();
		char c = '(';
		for ( int i = 0; i < numDimensions(); i++ )
		{
			sb.append( c );
			sb.append( String.format( "%.1f", position[ i ] ) );
			c = ',';
		}
		sb.append( ")" );
		return String.format( "%s\tR=%.1f\tMetric=%.3f", sb.toString(), radius, metric );
	}

	/**
	 * Returns a copy of this circle with the specified radius.
	 */
	public HoughCircle withRadius( final double r )
	{
		return new HoughCircle( this, metric, r );
	}

	public double getRadius()
	{
		return radius;
	}

	public boolean hasRadius()
	{
		return !Double.isNaN( radius );
	}

	public double getMetric()
	{
		return metric;
	}

	public double getX()
	{
		return position[ 0 ];
	}

	public double getY()
	{
		return position[ 1 ];
	}
}
