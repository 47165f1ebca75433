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
package net.imagej.circlefinder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;

import org.scijava.log.LogService;
import org.scijava.log.StderrLogService;

import net.imagej.circlefinder.edge.EdgeExtractor;
import net.imagej.circlefinder.gradient.GradientField;
import net.imagej.circlefinder.gradient.SobelGradient;
import net.imagej.circlefinder.hough.HoughCircle;
import net.imagej.circlefinder.hough.HoughCircleCenterDetector;
import net.imagej.circlefinder.hough.ObjectPolarity;
import net.imagej.circlefinder.hough.PhaseCodedHoughTransform;
import net.imagej.circlefinder.hough.PhaseCoding;
import net.imagej.circlefinder.hough.RadiusEstimator;
import net.imagej.circlefinder.util.GrayImages;
import net.imglib2.Point;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Finds circles with a radius in a given range in 2D gray images, using a
 * phase-coded circular Hough transform.
 * <p>
 * Circles are accepted when their strength in the accumulator is at least
 * <code>1 - sensitivity</code>. Higher sensitivities find more circles,
 * including weak or partially occluded ones, at the cost of more false
 * detections.
 *
 * <pre>
 * final CircleDetectionResult result = new CircleFinder( 15, 30 )
 * 		.sensitivity( 0.9 )
 * 		.find( img );
 * </pre>
 */
public class CircleFinder
{

	public static final double DEFAULT_SENSITIVITY = 0.85;

	/**
	 * Min radii up to this value give inaccurate results.
	 */
	public static final double SMALL_RADIUS_WARNING_BOUND = 5.;

	/*
	 * PARAMETERS.
	 */

	private final double minRadius;

	private final double maxRadius;

	private double sensitivity = DEFAULT_SENSITIVITY;

	private double edgeThreshold = EdgeExtractor.AUTOMATIC;

	private ObjectPolarity objectPolarity = ObjectPolarity.BRIGHT;

	private boolean computeRadii = true;

	private int maxVotesPerChunk = PhaseCodedHoughTransform.DEFAULT_MAX_VOTES_PER_CHUNK;

	private ExecutorService executorService = null;

	private LogService log = new StderrLogService();

	/**
	 * @param minRadius
	 *            min circle radius in pixels, strictly positive.
	 * @param maxRadius
	 *            max circle radius in pixels, not smaller than the min radius.
	 */
	public CircleFinder( final double minRadius, final double maxRadius )
	{
		PhaseCoding.checkRadiusRange( minRadius, maxRadius );
		this.minRadius = minRadius;
		this.maxRadius = maxRadius;
	}

	/*
	 * SETTERS.
	 */

	/**
	 * Sets the detection sensitivity, in [0, 1]. Default is
	 * {@value #DEFAULT_SENSITIVITY}.
	 */
	public CircleFinder sensitivity( final double sensitivity )
	{
		if ( Double.isNaN( sensitivity ) || sensitivity < 0. || sensitivity > 1. )
			throw new IllegalArgumentException( "Sensitivity must be in [0, 1]. Got " + sensitivity + "." );
		this.sensitivity = sensitivity;
		return this;
	}

	/**
	 * Sets the gradient threshold selecting edge pixels, as a fraction in [0,
	 * 1] of the max gradient magnitude. By default it is determined with
	 * Otsu's method.
	 */
	public CircleFinder edgeThreshold( final double edgeThreshold )
	{
		if ( Double.isNaN( edgeThreshold ) || edgeThreshold < 0. || edgeThreshold > 1. )
			throw new IllegalArgumentException( "Edge threshold must be in [0, 1]. Got " + edgeThreshold + "." );
		this.edgeThreshold = edgeThreshold;
		return this;
	}

	/**
	 * Reverts to the automatic edge threshold.
	 */
	public CircleFinder automaticEdgeThreshold()
	{
		this.edgeThreshold = EdgeExtractor.AUTOMATIC;
		return this;
	}

	public CircleFinder objectPolarity( final ObjectPolarity objectPolarity )
	{
		if ( null == objectPolarity )
			throw new IllegalArgumentException( "Object polarity cannot be null." );
		this.objectPolarity = objectPolarity;
		return this;
	}

	/**
	 * Sets whether radii are estimated. If not, the circles of the result have
	 * a <code>NaN</code> radius.
	 */
	public CircleFinder computeRadii( final boolean computeRadii )
	{
		this.computeRadii = computeRadii;
		return this;
	}

	/**
	 * Sets the max number of elements of the edge pixel &times; radius vote
	 * matrix built at once.
	 */
	public CircleFinder maxVotesPerChunk( final int maxVotesPerChunk )
	{
		if ( maxVotesPerChunk < 1 )
			throw new IllegalArgumentException( "Max number of votes per chunk must be at least 1. Got " + maxVotesPerChunk + "." );
		this.maxVotesPerChunk = maxVotesPerChunk;
		return this;
	}

	/**
	 * Sets the workers used to build the accumulator. The service is managed
	 * by the caller. If <code>null</code>, the accumulator is built on the
	 * calling thread.
	 */
	public CircleFinder executorService( final ExecutorService executorService )
	{
		this.executorService = executorService;
		return this;
	}

	public CircleFinder logService( final LogService log )
	{
		if ( null == log )
			throw new IllegalArgumentException( "Log service cannot be null." );
		this.log = log;
		return this;
	}

	/*
	 * METHODS.
	 */

	/**
	 * Finds circles in a gray image. Integer-typed images are rescaled to [0,
	 * 1] first.
	 *
	 * @param image
	 *            the 2D image.
	 * @return the detection result.
	 */
	public < T extends RealType< T > > CircleDetectionResult find( final RandomAccessibleInterval< T > image )
	{
		return process( GrayImages.toDouble( image ) );
	}

	/**
	 * Finds circles in the luminance of a color image.
	 *
	 * @param image
	 *            the 2D image.
	 * @return the detection result.
	 */
	public CircleDetectionResult findInColor( final RandomAccessibleInterval< ARGBType > image )
	{
		return process( GrayImages.fromARGB( image ) );
	}

	private CircleDetectionResult process( final Img< DoubleType > gray )
	{
		final List< String > warnings = new ArrayList<>();
		if ( minRadius <= SMALL_RADIUS_WARNING_BOUND )
		{
			final String msg = "Min radius " + minRadius + " is small (<= " + SMALL_RADIUS_WARNING_BOUND
					+ " pixels). Circle centers and radii may be inaccurate.";
			log.warn( msg );
			warnings.add( msg );
		}

		/*
		 * Gradient and edges.
		 */

		log.debug( "Computing gradient..." );
		final GradientField gradient = SobelGradient.compute( gray );
		final List< Point > edges = EdgeExtractor.extract( gradient, edgeThreshold );
		log.debug( "Found " + edges.size() + " edge pixels." );
		if ( edges.isEmpty() )
			return new CircleDetectionResult( Collections.emptyList(), computeRadii, null, warnings );

		/*
		 * Hough transform.
		 */

		log.debug( "Building accumulator..." );
		final PhaseCoding phaseCoding = new PhaseCoding( minRadius, maxRadius );
		final PhaseCodedHoughTransform transform = new PhaseCodedHoughTransform( phaseCoding, objectPolarity, maxVotesPerChunk, executorService );
		final Img< ComplexDoubleType > accumulator = transform.compute( gradient, edges );
		if ( PhaseCodedHoughTransform.isZero( accumulator ) )
			return new CircleDetectionResult( Collections.emptyList(), computeRadii, accumulator, warnings );

		/*
		 * Circle centers.
		 */

		log.debug( "Detecting circle centers..." );
		final double acceptanceThreshold = 1. - sensitivity;
		final List< HoughCircle > candidates = new HoughCircleCenterDetector( acceptanceThreshold ).detect( accumulator );
		final List< HoughCircle > accepted = new ArrayList<>( candidates.size() );
		for ( final HoughCircle candidate : candidates )
			if ( candidate.getMetric() >= acceptanceThreshold )
				accepted.add( candidate );

		log.debug( "Accepted " + accepted.size() + " out of " + candidates.size() + " candidate centers." );
		if ( accepted.isEmpty() || !computeRadii )
			return new CircleDetectionResult( accepted, computeRadii, accumulator, warnings );

		/*
		 * Radii.
		 */

		log.debug( "Estimating radii..." );
		final List< HoughCircle > circles = new RadiusEstimator( phaseCoding ).estimate( accepted, accumulator );
		return new CircleDetectionResult( circles, true, accumulator, warnings );
	}

	public double getMinRadius()
	{
		return minRadius;
	}

	public double getMaxRadius()
	{
		return maxRadius;
	}

	public double getSensitivity()
	{
		return sensitivity;
	}

	public double getEdgeThreshold()
	{
		return edgeThreshold;
	}

	public ObjectPolarity getObjectPolarity()
	{
		return objectPolarity;
	}
}
