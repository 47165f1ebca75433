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

import java.util.ArrayDeque;

import net.imglib2.Cursor;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Grayscale morphological reconstruction by dilation and the h-maxima
 * transform built on it, for 2D images with 8-connectivity.
 * <p>
 * Reconstruction uses the hybrid algorithm of L. Vincent, <i>Morphological
 * grayscale reconstruction in image analysis: applications and efficient
 * algorithms</i>, IEEE Trans. Image Process. 2(2), 1993: one raster scan, one
 * anti-raster scan, then FIFO propagation.
 */
public class GrayscaleReconstruction
{

	private GrayscaleReconstruction()
	{}

	/**
	 * Suppresses all the maxima of the image whose height above their
	 * surrounding is smaller than <code>h</code>. This is the reconstruction
	 * by dilation of <code>input - h</code> under <code>input</code>.
	 *
	 * @param input
	 *            the image.
	 * @param h
	 *            the height, non-negative.
	 * @return a new image.
	 */
	public static Img< DoubleType > hMaxima( final Img< DoubleType > input, final double h )
	{
		if ( !( h >= 0. ) )
			throw new IllegalArgumentException( "H-maxima height must be non-negative. Got " + h + "." );

		final double[] mask = toArray( input );
		final double[] marker = new double[ mask.length ];
		for ( int i = 0; i < mask.length; i++ )
			marker[ i ] = mask[ i ] - h;

		final int width = ( int ) input.dimension( 0 );
		final int height = ( int ) input.dimension( 1 );
		reconstruct( marker, mask, width, height );
		return ArrayImgs.doubles( marker, width, height );
	}

	/**
	 * Reconstruction by dilation of the marker under the mask, in place. The
	 * marker must be smaller than or equal to the mask everywhere. Arrays are
	 * indexed by <code>x + y * width</code>.
	 */
	public static void reconstruct( final double[] marker, final double[] mask, final int width, final int height )
	{
		// Raster scan.
		for ( int y = 0; y < height; y++ )
		{
			for ( int x = 0; x < width; x++ )
			{
				final int p = x + y * width;
				double max = marker[ p ];
				if ( x > 0 )
					max = Math.max( max, marker[ p - 1 ] );
				if ( y > 0 )
				{
					final int up = p - width;
					max = Math.max( max, marker[ up ] );
					if ( x > 0 )
						max = Math.max( max, marker[ up - 1 ] );
					if ( x < width - 1 )
						max = Math.max( max, marker[ up + 1 ] );
				}
				marker[ p ] = Math.min( max, mask[ p ] );
			}
		}

		// Anti-raster scan.
		final ArrayDeque< Integer > fifo = new ArrayDeque<>();
		final int[] neighbors = new int[ 4 ];
		for ( int y = height - 1; y >= 0; y-- )
		{
			for ( int x = width - 1; x >= 0; x-- )
			{
				final int p = x + y * width;
				int n = 0;
				if ( x < width - 1 )
					neighbors[ n++ ] = p + 1;
				if ( y < height - 1 )
				{
					final int down = p + width;
					neighbors[ n++ ] = down;
					if ( x < width - 1 )
						neighbors[ n++ ] = down + 1;
					if ( x > 0 )
						neighbors[ n++ ] = down - 1;
				}

				double max = marker[ p ];
				for ( int k = 0; k < n; k++ )
					max = Math.max( max, marker[ neighbors[ k ] ] );
				marker[ p ] = Math.min( max, mask[ p ] );

				for ( int k = 0; k < n; k++ )
				{
					final int q = neighbors[ k ];
					if ( marker[ q ] < marker[ p ] && marker[ q ] < mask[ q ] )
					{
						fifo.add( Integer.valueOf( p ) );
						break;
					}
				}
			}
		}

		// Propagation.
		while ( !fifo.isEmpty() )
		{
			final int p = fifo.poll().intValue();
			final int x = p % width;
			final int y = p / width;
			for ( int dy = -1; dy <= 1; dy++ )
			{
				final int yq = y + dy;
				if ( yq < 0 || yq >= height )
					continue;
				for ( int dx = -1; dx <= 1; dx++ )
				{
					final int xq = x + dx;
					if ( ( dx == 0 && dy == 0 ) || xq < 0 || xq >= width )
						continue;
					final int q = xq + yq * width;
					if ( marker[ q ] < marker[ p ] && mask[ q ] != marker[ q ] )
					{
						marker[ q ] = Math.min( marker[ p ], mask[ q ] );
						fifo.add( Integer.valueOf( q ) );
					}
				}
			}
		}
	}

	static double[] toArray( final Img< DoubleType > img )
	{
		final double[] arr = new double[ ( int ) ( img.dimension( 0 ) * img.dimension( 1 ) ) ];
		final Cursor< DoubleType > cursor = img.localizingCursor();
		final long width = img.dimension( 0 );
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			arr[ ( int ) ( cursor.getLongPosition( 0 ) + cursor.getLongPosition( 1 ) * width ) ] = cursor.get().get();
		}
		return arr;
	}
}
