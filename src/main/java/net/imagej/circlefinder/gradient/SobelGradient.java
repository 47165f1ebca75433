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

import net.imglib2.Cursor;
import net.imglib2.RandomAccessible;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.algorithm.convolution.kernel.Kernel1D;
import net.imglib2.algorithm.convolution.kernel.SeparableKernelConvolution;
import net.imglib2.algorithm.gradient.PartialDerivative;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * Sobel gradient of a 2D image, with replicate boundary handling.
 * <p>
 * The kernels are applied as a convolution, which orients the components
 * towards decreasing intensity:
 *
 * <pre>
 * gx( x, y ) = sum_dy s( dy ) * ( I( x - 1, y + dy ) - I( x + 1, y + dy ) )
 * gy( x, y ) = sum_dx s( dx ) * ( I( x + dx, y - 1 ) - I( x + dx, y + 1 ) )
 * </pre>
 *
 * with {@code s = ( 1, 2, 1 )}. Each component is computed as the image
 * smoothed with {@code s} across the derivative direction, followed by a
 * central difference along it.
 */
public class SobelGradient
{

	private static final Kernel1D SMOOTHING = Kernel1D.symmetric( new double[] { 2., 1. } );

	private static final Kernel1D IDENTITY = Kernel1D.symmetric( new double[] { 1. } );

	private SobelGradient()
	{}

	public static < T extends RealType< T > > GradientField compute( final RandomAccessibleInterval< T > image )
	{
		final int numDimensions = image.numDimensions();
		if ( numDimensions != 2 ) { throw new IllegalArgumentException(
				"Cannot compute gradient of non-2D images. Got " + numDimensions + "D image." ); }

		final long width = image.dimension( 0 );
		final long height = image.dimension( 1 );
		final RandomAccessible< T > source = Views.extendBorder( Views.zeroMin( image ) );
		final Img< DoubleType > gx = derivative( source, width, height, 0 );
		final Img< DoubleType > gy = derivative( source, width, height, 1 );

		final Img< DoubleType > magnitude = ArrayImgs.doubles( width, height );
		final Cursor< DoubleType > cx = gx.cursor();
		final Cursor< DoubleType > cy = gy.cursor();
		final Cursor< DoubleType > cm = magnitude.cursor();
		while ( cm.hasNext() )
			cm.next().set( Math.hypot( cx.next().get(), cy.next().get() ) );

		return new GradientField( gx, gy, magnitude );
	}

	/**
	 * Smoothed derivative along dimension <code>d</code>, oriented towards
	 * decreasing intensity.
	 */
	private static < T extends RealType< T > > Img< DoubleType > derivative( final RandomAccessible< T > source, final long width, final long height, final int d )
	{
		final Kernel1D[] kernels = new Kernel1D[ 2 ];
		kernels[ d ] = IDENTITY;
		kernels[ 1 - d ] = SMOOTHING;
		final Img< DoubleType > smoothed = ArrayImgs.doubles( width, height );
		SeparableKernelConvolution.convolve( kernels, source, smoothed );

		// Border replication of the smoothed image equals smoothing the
		// replicated source, so the Sobel borders are preserved.
		final Img< DoubleType > derivative = ArrayImgs.doubles( width, height );
		PartialDerivative.gradientCentralDifference( Views.extendBorder( smoothed ), derivative, d );

		// ( f( x + 1 ) - f( x - 1 ) ) / 2 to f( x - 1 ) - f( x + 1 ).
		for ( final DoubleType p : derivative )
			p.mul( -2. );
		return derivative;
	}
}
