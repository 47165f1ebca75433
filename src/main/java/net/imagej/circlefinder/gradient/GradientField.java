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

import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.DoubleType;

public class GradientField
{

	private final Img< DoubleType > gx;

	private final Img< DoubleType > gy;

	private final Img< DoubleType > magnitude;

	public GradientField( final Img< DoubleType > gx, final Img< DoubleType > gy, final Img< DoubleType > magnitude )
	{
		this.gx = gx;
		this.gy = gy;
		this.magnitude = magnitude;
	}

	public Img< DoubleType > getGx()
	{
		return gx;
	}

	public Img< DoubleType > getGy()
	{
		return gy;
	}

	public Img< DoubleType > getMagnitude()
	{
		return magnitude;
	}

	public long width()
	{
		return magnitude.dimension( 0 );
	}

	public long height()
	{
		return magnitude.dimension( 1 );
	}
}
