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
package net.imagej.circlefinder.gradient;

import static org.junit.Assert.assertEquals;

import java.util.Random;

import org.junit.Test;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;

public class SobelGradientTest
{

	@Test
	public void testVerticalStepEdge()
	{
		// Bright left half.
		final Img< DoubleType > img = ArrayImgs.doubles( 8, 6 );
		final Cursor< DoubleType > cursor = img.localizingCursor();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			cursor.get().set( cursor.getLongPosition( 0 ) < 4 ? 1. : 0. );
		}

		final GradientField gradient = SobelGradient.compute( img );
		assertEquals( 8, gradient.width() );
		assertEquals( 6, gradient.height() );

		final RandomAccess< DoubleType > gx = gradient.getGx().randomAccess();
		final RandomAccess< DoubleType > gy = gradient.getGy().randomAccess();
		for ( int y = 0; y < 6; y++ )
		{
			for ( int x = 0; x < 8; x++ )
			{
				gx.setPosition( new int[] { x, y } );
				gy.setPosition( new int[] { x, y } );
				final double expected = ( x == 3 || x == 4 ) ? 4. : 0.;
				assertEquals( "gx at " + x + ", " + y, expected, gx.get().get(), 0. );
				assertEquals( "gy at " + x + ", " + y, 0., gy.get().get(), 0. );
			}
		}
	}

	@Test
	public void testHorizontalStepEdge()
	{
		// Bright bottom half.
		final Img< DoubleType > img = ArrayImgs.doubles( 5, 6 );
		final Cursor< DoubleType > cursor = img.localizingCursor();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			cursor.get().set( cursor.getLongPosition( 1 ) >= 3 ? 2. : 0. );
		}

		final GradientField gradient = SobelGradient.compute( img );
		final RandomAccess< DoubleType > gy = gradient.getGy().randomAccess();
		gy.setPosition( new int[] { 0, 2 } );
		assertEquals( -8., gy.get().get(), 0. );
		gy.setPosition( new int[] { 4, 3 } );
		assertEquals( -8., gy.get().get(), 0. );
		gy.setPosition( new int[] { 2, 0 } );
		assertEquals( 0., gy.get().get(), 0. );
	}

	@Test
	public void testMagnitudeIsNormOfComponents()
	{
		final Random ran = new Random( 1l );
		final Img< DoubleType > img = ArrayImgs.doubles( 13, 9 );
		for ( final DoubleType p : img )
			p.set( ran.nextDouble() );

		final GradientField gradient = SobelGradient.compute( img );
		final Cursor< DoubleType > cx = gradient.getGx().cursor();
		final Cursor< DoubleType > cy = gradient.getGy().cursor();
		final Cursor< DoubleType > cm = gradient.getMagnitude().cursor();
		while ( cm.hasNext() )
			assertEquals( Math.hypot( cx.next().get(), cy.next().get() ), cm.next().get(), 1e-12 );
	}

	@Test
	public void testMatchesSobelSumsWithReplicatedBorders()
	{
		final int width = 9;
		final int height = 7;
		final double[] data = new double[ width * height ];
		final Random ran = new Random( 3l );
		for ( int i = 0; i < data.length; i++ )
			data[ i ] = ran.nextDouble();

		final GradientField gradient = SobelGradient.compute( ArrayImgs.doubles( data, width, height ) );
		final RandomAccess< DoubleType > gx = gradient.getGx().randomAccess();
		final RandomAccess< DoubleType > gy = gradient.getGy().randomAccess();
		final double[] s = new double[] { 1., 2., 1. };
		for ( int y = 0; y < height; y++ )
		{
			for ( int x = 0; x < width; x++ )
			{
				double ex = 0.;
				double ey = 0.;
				for ( int k = -1; k <= 1; k++ )
				{
					ex += s[ k + 1 ] * ( pixel( data, width, height, x - 1, y + k ) - pixel( data, width, height, x + 1, y + k ) );
					ey += s[ k + 1 ] * ( pixel( data, width, height, x + k, y - 1 ) - pixel( data, width, height, x + k, y + 1 ) );
				}
				gx.setPosition( new int[] { x, y } );
				gy.setPosition( new int[] { x, y } );
				assertEquals( "gx at " + x + ", " + y, ex, gx.get().get(), 1e-12 );
				assertEquals( "gy at " + x + ", " + y, ey, gy.get().get(), 1e-12 );
			}
		}
	}

	private static double pixel( final double[] data, final int width, final int height, final int x, final int y )
	{
		final int xc = Math.min( Math.max( x, 0 ), width - 1 );
		final int yc = Math.min( Math.max( y, 0 ), height - 1 );
		return data[ xc + yc * width ];
	}

	@Test
	public void testConstantImageHasNoGradient()
	{
		final Img< DoubleType > img = ArrayImgs.doubles( 7, 7 );
		for ( final DoubleType p : img )
			p.set( 0.3 );

		for ( final DoubleType p : SobelGradient.compute( img ).getMagnitude() )
			assertEquals( 0., p.get(), 1e-15 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testRejects3DImages()
	{
		SobelGradient.compute( ArrayImgs.doubles( 5, 5, 2 ) );
	}
}
