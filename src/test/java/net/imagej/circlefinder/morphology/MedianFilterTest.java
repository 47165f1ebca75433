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

import org.junit.Test;

import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;

public class MedianFilterTest
{

	private static double get( final Img< DoubleType > img, final int x, final int y )
	{
		final RandomAccess< DoubleType > ra = img.randomAccess();
		ra.setPosition( new int[] { x, y } );
		return ra.get().get();
	}

	@Test
	public void testSpikeIsRemoved()
	{
		final Img< DoubleType > img = ArrayImgs.doubles( 7, 7 );
		final RandomAccess< DoubleType > ra = img.randomAccess();
		ra.setPosition( new int[] { 3, 3 } );
		ra.get().set( 100. );

		for ( final DoubleType p : MedianFilter.apply( img, 5 ) )
			assertEquals( 0., p.get(), 0. );
	}

	@Test
	public void testZeroPadding()
	{
		final Img< DoubleType > img = ArrayImgs.doubles( 7, 7 );
		for ( final DoubleType p : img )
			p.set( 5. );

		final Img< DoubleType > filtered = MedianFilter.apply( img, 5 );
		// 25 pixels of the window inside.
		assertEquals( 5., get( filtered, 3, 3 ), 0. );
		// 15 inside.
		assertEquals( 5., get( filtered, 0, 3 ), 0. );
		// 12 inside.
		assertEquals( 0., get( filtered, 1, 0 ), 0. );
		// 9 inside.
		assertEquals( 0., get( filtered, 0, 0 ), 0. );
		assertEquals( 5., get( filtered, 1, 1 ), 0. );
	}

	@Test
	public void testInputIsUntouched()
	{
		final Img< DoubleType > img = ArrayImgs.doubles( new double[] { 1, 2, 3, 4, 5, 6, 7, 8, 9 }, 3, 3 );
		final Img< DoubleType > filtered = MedianFilter.apply( img, 3 );
		assertEquals( 5., get( img, 1, 1 ), 0. );
		assertEquals( 5., get( filtered, 1, 1 ), 0. );
		assertEquals( 0., get( filtered, 0, 0 ), 0. );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testRejectsEvenWindow()
	{
		MedianFilter.apply( ArrayImgs.doubles( 5, 5 ), 4 );
	}
}
