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
import java.util.List;

import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.complex.ComplexDoubleType;

/**
 * Estimates circle radii by decoding the phase of the accumulator at their
 * centers.
 */
public class RadiusEstimator
{

	private final PhaseCoding phaseCoding;

	public RadiusEstimator( final PhaseCoding phaseCoding )
	{
		this.phaseCoding = phaseCoding;
	}

	/**
	 * @param centers
	 *            the circle centers.
	 * @param accumulator
	 *            the accumulator the centers were found in, built with the
	 *            same {@link PhaseCoding}.
	 * @return a new list of circles, in the same order as the centers, with
	 *         their radius set.
	 */
	public List< HoughCircle > estimate( final List< HoughCircle > centers, final Img< ComplexDoubleType > accumulator )
	{
		final List< HoughCircle > circles = new ArrayList<>( centers.size() );
		if ( phaseCoding.getMinRadius() == phaseCoding.getMaxRadius() )
		{
			for ( final HoughCircle center : centers )
				circles.add( center.withRadius( phaseCoding.getMinRadius() ) );
			return circles;
		}

		final RandomAccess< ComplexDoubleType > ra = accumulator.randomAccess();
		for ( final HoughCircle center : centers )
		{
			ra.setPosition( Math.round( center.getX() ), 0 );
			ra.setPosition( Math.round( center.getY() ), 1 );
			final double phase = ra.get().getPhaseDouble();
			circles.add( center.withRadius( phaseCoding.decode( phase ) ) );
		}
		return circles;
	}
}
