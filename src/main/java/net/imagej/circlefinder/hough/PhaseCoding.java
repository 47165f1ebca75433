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

import net.imglib2.type.numeric.complex.ComplexDoubleType;

/**
 * Log-linear phase coding of the radius.
 * <p>
 * The radius range is sampled every {@value #RADIUS_STEP} pixel. Each sample
 * <code>r</code> gets the complex vote weight
 * <code>exp( i &phi;( r ) ) / ( 2 &pi; r )</code>, where the phase
 * <code>&phi;</code> grows linearly with <code>ln( r )</code> from
 * <code>-&pi;</code> at the first sample to <code>+&pi;</code> at the last
 * one. The phase of an accumulator value can then be decoded back into a
 * radius.
 */
public class PhaseCoding
{

	public static final double RADIUS_STEP = 0.5;

	private final double minRadius;

	private final double maxRadius;

	private final double[] radii;

	private final ComplexDoubleType[] weights;

	private final double lnMin;

	private final double lnMax;

	public PhaseCoding( final double minRadius, final double maxRadius )
	{
		checkRadiusRange( minRadius, maxRadius );
		this.minRadius = minRadius;
		this.maxRadius = maxRadius;

		final int nRadii = ( int ) Math.floor( ( maxRadius - minRadius ) / RADIUS_STEP + 1e-10 ) + 1;
		this.radii = new double[ nRadii ];
		for ( int i = 0; i < nRadii; i++ )
			radii[ i ] = minRadius + i * RADIUS_STEP;

		this.lnMin = Math.log( radii[ 0 ] );
		this.lnMax = Math.log( radii[ nRadii - 1 ] );

		this.weights = new ComplexDoubleType[ nRadii ];
		for ( int i = 0; i < nRadii; i++ )
		{
			final double phi = phase( radii[ i ] );
			final double norm = 2. * Math.PI * radii[ i ];
			weights[ i ] = new ComplexDoubleType( Math.cos( phi ) / norm, Math.sin( phi ) / norm );
		}
	}

	/**
	 * Validates a radius range.
	 *
	 * @throws IllegalArgumentException
	 *             if the min radius is not strictly positive or if the max
	 *             radius is smaller than the min radius.
	 */
	public static void checkRadiusRange( final double minRadius, final double maxRadius )
	{
		if ( Double.isNaN( minRadius ) || Double.isNaN( maxRadius ) )
			throw new IllegalArgumentException( "Radius range bounds cannot be NaN. Got [" + minRadius + ", " + maxRadius + "]." );
		if ( minRadius <= 0. )
			throw new IllegalArgumentException( "Min radius must be strictly positive. Got " + minRadius + "." );
		if ( maxRadius < minRadius )
			throw new IllegalArgumentException( "Max radius must not be smaller than min radius. Got [" + minRadius + ", " + maxRadius + "]." );
	}

	/**
	 * Returns the phase coding the specified radius, in [-&pi;, &pi;] over the
	 * sampled range. A single-sample range codes every radius as -&pi;.
	 */
	public double phase( final double radius )
	{
		final double normalized = isSingleRadius() ? 0. : ( Math.log( radius ) - lnMin ) / ( lnMax - lnMin );
		return normalized * 2. * Math.PI - Math.PI;
	}

	/**
	 * Inverts {@link #phase(double)}.
	 *
	 * @param phase
	 *            a phase in (-&pi;, &pi;].
	 * @return the radius coded by this phase.
	 */
	public double decode( final double phase )
	{
		if ( minRadius == maxRadius )
			return minRadius;
		final double normalized = ( phase + Math.PI ) / ( 2. * Math.PI );
		return Math.exp( lnMin + normalized * ( lnMax - lnMin ) );
	}

	public boolean isSingleRadius()
	{
		return radii.length == 1;
	}

	public int numRadii()
	{
		return radii.length;
	}

	public double radius( final int i )
	{
		return radii[ i ];
	}

	/**
	 * Returns the vote weight of the i-th radius sample. The instance is shared
	 * and must not be modified.
	 */
	public ComplexDoubleType weight( final int i )
	{
		return weights[ i ];
	}

	public double getMinRadius()
	{
		return minRadius;
	}

	public double getMaxRadius()
	{
		return maxRadius;
	}
}
