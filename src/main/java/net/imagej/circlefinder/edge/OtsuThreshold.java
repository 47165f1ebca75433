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
package net.imagej.circlefinder.edge;

import net.imglib2.histogram.Histogram1d;
import net.imglib2.histogram.Real1dBinMapper;
import net.imglib2.type.numeric.RealType;

/**
 * Otsu's global threshold for values normalized to [0, 1].
 * <p>
 * The histogram has {@value #N_BINS} bins, bin <code>k</code> being centered
 * on <code>k / 255</code>. The returned level is itself in [0, 1]. When
 * several bins maximize the between-class variance, the level is their mean.
 */
public class OtsuThreshold
{

	public static final int N_BINS = 256;

	private OtsuThreshold()
	{}

	public static < T extends RealType< T > > double level( final Iterable< T > normalized )
	{
		final double halfBin = 0.5 / ( N_BINS - 1 );
		final Real1dBinMapper< T > mapper = new Real1dBinMapper<>( -halfBin, 1. + halfBin, N_BINS, false );
		final Histogram1d< T > histogram = new Histogram1d<>( normalized, mapper );
		return level( histogram.toLongArray() );
	}

	/**
	 * Computes the Otsu level from raw bin counts.
	 *
	 * @param counts
	 *            the histogram counts.
	 * @return the level in [0, 1], or 0 if the between-class variance is
	 *         nowhere defined.
	 */
	public static double level( final long[] counts )
	{
		final int nBins = counts.length;
		double total = 0.;
		for ( final long c : counts )
			total += c;
		if ( total <= 0. || nBins < 2 )
			return 0.;

		double muT = 0.;
		for ( int k = 0; k < nBins; k++ )
			muT += ( k + 1 ) * ( counts[ k ] / total );

		double omega = 0.;
		double mu = 0.;
		double maxVal = Double.NEGATIVE_INFINITY;
		double sumIdx = 0.;
		int nMax = 0;
		for ( int k = 0; k < nBins; k++ )
		{
			final double p = counts[ k ] / total;
			omega += p;
			mu += ( k + 1 ) * p;
			final double denom = omega * ( 1. - omega );
			if ( denom <= 0. )
				continue;

			final double diff = muT * omega - mu;
			final double sigmaB2 = diff * diff / denom;
			if ( Double.isNaN( sigmaB2 ) || Double.isInfinite( sigmaB2 ) )
				continue;

			if ( sigmaB2 > maxVal )
			{
				maxVal = sigmaB2;
				sumIdx = k;
				nMax = 1;
			}
			else if ( sigmaB2 == maxVal )
			{
				sumIdx += k;
				nMax++;
			}
		}

		if ( nMax == 0 )
			return 0.;

		return ( sumIdx / nMax ) / ( nBins - 1 );
	}
}
