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
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import net.imagej.circlefinder.gradient.GradientField;
import net.imglib2.Point;
import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Circular Hough transform that collapses the radius dimension into the
 * phase of a 2D complex accumulator.
 * <p>
 * Every edge pixel votes, for every radius sample <code>r</code>, at the
 * candidate center found <code>r</code> pixels away along its gradient
 * direction. The vote is the phase-coded weight of <code>r</code>
 * ({@link PhaseCoding}). Votes whose rounded center falls outside
 * <code>[0, width-1] x [0, height-2]</code> are discarded.
 * <p>
 * Edge pixels are processed in chunks so that the pixel &times; radius vote
 * matrix of a chunk never exceeds a fixed number of elements. Chunk votes may
 * be computed in parallel, but they are always summed into the accumulator in
 * chunk order on the calling thread, so the result does not depend on
 * chunking nor on threading.
 */
public class PhaseCodedHoughTransform
{

	public static final int DEFAULT_MAX_VOTES_PER_CHUNK = 1000000;

	private final PhaseCoding phaseCoding;

	private final ObjectPolarity polarity;

	private final int maxVotesPerChunk;

	private final ExecutorService executorService;

	public PhaseCodedHoughTransform( final PhaseCoding phaseCoding, final ObjectPolarity polarity )
	{
		this( phaseCoding, polarity, DEFAULT_MAX_VOTES_PER_CHUNK, null );
	}

	/**
	 * @param phaseCoding
	 *            the radius samples and their vote weights.
	 * @param polarity
	 *            the polarity of the objects to detect.
	 * @param maxVotesPerChunk
	 *            max number of elements of the vote matrix of one chunk.
	 * @param executorService
	 *            workers used to compute chunk votes in parallel. If
	 *            <code>null</code>, chunks are processed sequentially. The
	 *            service is managed by the caller.
	 */
	public PhaseCodedHoughTransform( final PhaseCoding phaseCoding, final ObjectPolarity polarity, final int maxVotesPerChunk, final ExecutorService executorService )
	{
		if ( maxVotesPerChunk < 1 )
			throw new IllegalArgumentException( "Max number of votes per chunk must be at least 1. Got " + maxVotesPerChunk + "." );
		this.phaseCoding = phaseCoding;
		this.polarity = polarity;
		this.maxVotesPerChunk = maxVotesPerChunk;
		this.executorService = executorService;
	}

	/**
	 * Number of edge pixels processed together.
	 */
	public int chunkSize()
	{
		return Math.max( 1, maxVotesPerChunk / phaseCoding.numRadii() );
	}

	public Img< ComplexDoubleType > compute( final GradientField gradient, final List< Point > edges )
	{
		final long width = gradient.width();
		final long height = gradient.height();
		final Img< ComplexDoubleType > accumulator = ArrayImgs.complexDoubles( width, height );

		final int chunkSize = chunkSize();
		final int nEdges = edges.size();
		if ( null == executorService )
		{
			for ( int from = 0; from < nEdges; from += chunkSize )
			{
				final List< Point > chunk = edges.subList( from, Math.min( from + chunkSize, nEdges ) );
				castVotes( chunk, gradient ).addTo( accumulator, phaseCoding );
			}
			return accumulator;
		}

		final List< Future< Votes > > futures = new ArrayList<>();
		for ( int from = 0; from < nEdges; from += chunkSize )
		{
			final List< Point > chunk = edges.subList( from, Math.min( from + chunkSize, nEdges ) );
			futures.add( executorService.submit( new Callable< Votes >()
			{
				@Override
				public Votes call()
				{
					return castVotes( chunk, gradient );
				}
			} ) );
		}

		try
		{
			for ( final Future< Votes > future : futures )
				future.get().addTo( accumulator, phaseCoding );
		}
		catch ( final InterruptedException e )
		{
			Thread.currentThread().interrupt();
			throw new RuntimeException( "Interrupted while building the Hough accumulator.", e );
		}
		catch ( final ExecutionException e )
		{
			throw new RuntimeException( "Could not build the Hough accumulator.", e.getCause() );
		}
		return accumulator;
	}

	/**
	 * Computes the votes of a chunk of edge pixels. Does not touch the
	 * accumulator.
	 */
	private Votes castVotes( final List< Point > chunk, final GradientField gradient )
	{
		final long width = gradient.width();
		final long height = gradient.height();
		final int nRadii = phaseCoding.numRadii();
		final double sign = polarity.sign();

		final RandomAccess< DoubleType > raGx = gradient.getGx().randomAccess();
		final RandomAccess< DoubleType > raGy = gradient.getGy().randomAccess();
		final RandomAccess< DoubleType > raMag = gradient.getMagnitude().randomAccess();

		final Votes votes = new Votes( chunk.size() * nRadii );
		for ( final Point edge : chunk )
		{
			raGx.setPosition( edge );
			raGy.setPosition( edge );
			raMag.setPosition( edge );
			final double g = raMag.get().get();
			if ( g <= 0. )
				continue;

			final double ux = raGx.get().get() / g;
			final double uy = raGy.get().get() / g;
			final long x = edge.getLongPosition( 0 );
			final long y = edge.getLongPosition( 1 );
			for ( int i = 0; i < nRadii; i++ )
			{
				final double r = phaseCoding.radius( i );
				final long xc = Math.round( x + sign * r * ux );
				final long yc = Math.round( y + sign * r * uy );
				if ( xc < 0 || xc >= width || yc < 0 || yc >= height - 1 )
					continue;
				votes.add( xc, yc, i );
			}
		}
		return votes;
	}

	/**
	 * Votes of one chunk: candidate center and radius index per vote.
	 */
	private static final class Votes
	{

		private final long[] xs;

		private final long[] ys;

		private final int[] radiusIndices;

		private int size = 0;

		private Votes( final int capacity )
		{
			this.xs = new long[ capacity ];
			this.ys = new long[ capacity ];
			this.radiusIndices = new int[ capacity ];
		}

		private void add( final long x, final long y, final int radiusIndex )
		{
			xs[ size ] = x;
			ys[ size ] = y;
			radiusIndices[ size ] = radiusIndex;
			size++;
		}

		private void addTo( final Img< ComplexDoubleType > accumulator, final PhaseCoding phaseCoding )
		{
			final RandomAccess< ComplexDoubleType > ra = accumulator.randomAccess();
			for ( int i = 0; i < size; i++ )
			{
				ra.setPosition( xs[ i ], 0 );
				ra.setPosition( ys[ i ], 1 );
				ra.get().add( phaseCoding.weight( radiusIndices[ i ] ) );
			}
		}
	}

	/**
	 * Returns <code>true</code> if every value of the accumulator is 0.
	 */
	public static boolean isZero( final Img< ComplexDoubleType > accumulator )
	{
		for ( final ComplexDoubleType c : accumulator )
			if ( c.getRealDouble() != 0. || c.getImaginaryDouble() != 0. )
				return false;
		return true;
	}
}
