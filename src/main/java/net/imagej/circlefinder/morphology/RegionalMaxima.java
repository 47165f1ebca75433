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
import java.util.ArrayList;
import java.util.List;

import net.imglib2.Point;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Regional maxima of a 2D image, with 8-connectivity.
 * <p>
 * A regional maximum is a connected plateau of constant value whose adjacent
 * pixels all have a strictly smaller value. A plateau that covers the whole
 * image has no adjacent pixel and is not a regional maximum.
 */
public class RegionalMaxima
{

	private RegionalMaxima()
	{}

	/**
	 * Finds the regional maxima of the specified image.
	 *
	 * @param input
	 *            the image.
	 * @return the list of regional maxima, each given as the list of its
	 *         pixels. Regions are ordered by their first pixel in column-major
	 *         order (X outer, Y inner).
	 */
	public static List< List< Point > > find( final Img< DoubleType > input )
	{
		final int width = ( int ) input.dimension( 0 );
		final int height = ( int ) input.dimension( 1 );
		final double[] values = GrayscaleReconstruction.toArray( input );
		final boolean[] visited = new boolean[ values.length ];

		final List< List< Point > > maxima = new ArrayList<>();
		final ArrayDeque< Integer > queue = new ArrayDeque<>();
		for ( int x0 = 0; x0 < width; x0++ )
		{
			for ( int y0 = 0; y0 < height; y0++ )
			{
				final int p0 = x0 + y0 * width;
				if ( visited[ p0 ] )
					continue;

				final double v = values[ p0 ];
				final List< Point > plateau = new ArrayList<>();
				boolean isMax = true;
				boolean hasBorder = false;

				visited[ p0 ] = true;
				queue.add( Integer.valueOf( p0 ) );
				while ( !queue.isEmpty() )
				{
					final int p = queue.poll().intValue();
					final int x = p % width;
					final int y = p / width;
					plateau.add( new Point( x, y ) );

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
							final double vq = values[ q ];
							if ( vq == v )
							{
								if ( !visited[ q ] )
								{
									visited[ q ] = true;
									queue.add( Integer.valueOf( q ) );
								}
							}
							else
							{
								hasBorder = true;
								if ( vq > v )
									isMax = false;
							}
						}
					}
				}

				if ( isMax && hasBorder )
					maxima.add( plateau );
			}
		}
		return maxima;
	}
}
