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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import net.imglib2.Point;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;

public class RegionalMaximaTest
{

	@Test
	public void testPeaksAndPlateaus()
	{
		final double[] data = new double[] {
				0, 0, 0, 0, 0, 0,
				0, 0, 0, 0, 3, 0,
				0, 2, 2, 0, 0, 0,
				0, 0, 1, 0, 0, 0,
				0, 0, 0, 0, 0, 0 };
		final Img< DoubleType > img = ArrayImgs.doubles( data, 6, 5 );

		final List< List< Point > > maxima = RegionalMaxima.find( img );
		assertEquals( 2, maxima.size() );

		// Column-major discovery: the plateau at x = 1 comes first.
		final List< Point > plateau = maxima.get( 0 );
		assertEquals( 2, plateau.size() );
		for ( final Point p : plateau )
			assertEquals( 2, p.getLongPosition( 1 ) );

		final List< Point > peak = maxima.get( 1 );
		assertEquals( 1, peak.size() );
		assertEquals( 4, peak.get( 0 ).getLongPosition( 0 ) );
		assertEquals( 1, peak.get( 0 ).getLongPosition( 1 ) );
	}

	@Test
	public void testPlateauWithHigherNeighborIsNotAMaximum()
	{
		final double[] data = new double[] {
				1, 1, 1, 0,
				1, 1, 2, 0,
				0, 0, 0, 0 };
		final List< List< Point > > maxima = RegionalMaxima.find( ArrayImgs.doubles( data, 4, 3 ) );
		assertEquals( 1, maxima.size() );
		assertEquals( 2, maxima.get( 0 ).get( 0 ).getLongPosition( 0 ) );
	}

	@Test
	public void testDiagonalPixelsAreConnected()
	{
		final double[] data = new double[] {
				1, 0, 0,
				0, 1, 0,
				0, 0, 0 };
		final List< List< Point > > maxima = RegionalMaxima.find( ArrayImgs.doubles( data, 3, 3 ) );
		assertEquals( 1, maxima.size() );
		assertEquals( 2, maxima.get( 0 ).size() );
	}

	@Test
	public void testConstantImageHasNoMaximum()
	{
		final Img< DoubleType > img = ArrayImgs.doubles( 8, 8 );
		for ( final DoubleType p : img )
			p.set( 0.7 );
		assertTrue( RegionalMaxima.find( img ).isEmpty() );
	}
}
