/*
    SolarDerotate sub-pixel derotation of solar image sequences
    Copyright (C) 2025  Peter D. Ringel

    This program is free software: you can redistribute it and/or modify
    it under the terms of the GNU Affero General Public License as published by
    the Free Software Foundation, either version 3 of the License, or
    (at your option) any later version.

    This program is distributed in the hope that it will be useful,
    but WITHOUT ANY WARRANTY; without even the implied warranty of
    MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
    GNU Affero General Public License for more details.

    You should have received a copy of the GNU Affero General Public License
    along with this program.  If not, see <https://www.gnu.org/licenses/>.
*/

package ch.unibas.biozentrum.solarderotate.util;

import java.time.Instant;
import java.util.Objects;

import net.imglib2.Cursor;
import net.imglib2.IterableInterval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * One 2-D solar image plus the four pieces of metadata the derotation reads:
 * observation time, pixel scale, reference pixel and an opaque coordinate
 * frame handle that is passed through untouched.
 * <p>
 * The pixel data is stored row-major (x = column = imglib2 dimension 0,
 * y = row = dimension 1) and never handed out without copying, so a Frame is
 * immutable.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public final class Frame {
    /** Marks a pixel that has no valid sample, e.g. borders exposed by shifting. */
    public static final double MISSING = Double.NaN;

    private final double[] data;
    private final int width;
    private final int height;
    private final Instant timestamp;
    private final double scaleX;
    private final double scaleY;
    private final double referencePixelX;
    private final double referencePixelY;
    private final Object coordinateFrame;

    /**
     * @param data row-major samples, copied
     * @param scaleX angular units per pixel along x
     * @param scaleY angular units per pixel along y
     * @param referencePixelX pixel x coordinate of the reference point
     * @param referencePixelY pixel y coordinate of the reference point
     * @param coordinateFrame opaque handle of the observer's coordinate frame, may be null
     */
    public Frame(final double[] data, final int width, final int height, final Instant timestamp,
            final double scaleX, final double scaleY, final double referencePixelX, final double referencePixelY,
            final Object coordinateFrame)
    {
        this(data.clone(), width, height, timestamp, scaleX, scaleY, referencePixelX, referencePixelY, coordinateFrame, false);
    }

    private Frame(final double[] data, final int width, final int height, final Instant timestamp,
            final double scaleX, final double scaleY, final double referencePixelX, final double referencePixelY,
            final Object coordinateFrame, final boolean owned)
    {
        if(width <= 0 || height <= 0)
        {
            throw new IllegalArgumentException("Frame dimensions must be positive, got " + width + "x" + height);
        }
        if((long)width * (long)height != data.length)
        {
            throw new IllegalArgumentException("Frame data holds " + data.length + " samples but " + width + "x" + height + " were declared.");
        }
        this.data = data;
        this.width = width;
        this.height = height;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.scaleX = scaleX;
        this.scaleY = scaleY;
        this.referencePixelX = referencePixelX;
        this.referencePixelY = referencePixelY;
        this.coordinateFrame = coordinateFrame;
    }

    /**
     * Copies a 2-D imglib2 image into a new frame.
     */
    public static Frame fromImg(final RandomAccessibleInterval<? extends RealType<?>> img, final Instant timestamp,
            final double scaleX, final double scaleY, final double referencePixelX, final double referencePixelY,
            final Object coordinateFrame)
    {
        if(img.numDimensions() != 2)
        {
            throw new IllegalArgumentException("Only 2-D images can be used as frames, got " + img.numDimensions() + " dimensions.");
        }
        long w = img.dimension(0);
        long h = img.dimension(1);
        if(w * h > Integer.MAX_VALUE)
        {
            throw new IllegalArgumentException("Cannot allocate more than " + Integer.MAX_VALUE + " samples.");
        }
        double[] samples = new double[(int)(w * h)];
        IterableInterval<? extends RealType<?>> flat = Views.flatIterable(img);
        Cursor<? extends RealType<?>> cursor = flat.cursor();
        int i = 0;
        while(cursor.hasNext())
        {
            samples[i++] = cursor.next().getRealDouble();
        }
        return new Frame(samples, (int)w, (int)h, timestamp, scaleX, scaleY, referencePixelX, referencePixelY, coordinateFrame, true);
    }

    /**
     * @return a fresh image holding a copy of the samples
     */
    public Img<DoubleType> toImg()
    {
        return ArrayImgs.doubles(data.clone(), width, height);
    }

    /**
     * Derives a frame with new pixel data and reference pixel, all other
     * metadata unchanged. The array is taken over without copying.
     */
    Frame withData(final double[] newData, final int newWidth, final int newHeight, final double newReferencePixelX, final double newReferencePixelY)
    {
        return new Frame(newData, newWidth, newHeight, timestamp, scaleX, scaleY, newReferencePixelX, newReferencePixelY, coordinateFrame, true);
    }

    /**
     * Cuts the given rectangle out of this frame. The reference pixel is moved
     * by the crop origin so that it still denotes the same physical point.
     */
    public Frame crop(final ClipBounds bounds)
    {
        if(bounds.getLeft() < 0 || bounds.getTop() < 0 || bounds.getRight() > width || bounds.getBottom() > height
                || bounds.getWidth() <= 0 || bounds.getHeight() <= 0)
        {
            throw new IllegalArgumentException(bounds + " does not lie inside a " + width + "x" + height + " frame.");
        }
        double[] cropped = new double[bounds.getWidth() * bounds.getHeight()];
        Cursor<DoubleType> cursor = Views.flatIterable(Views.interval(ArrayImgs.doubles(data, width, height), bounds.toInterval())).cursor();
        int i = 0;
        while(cursor.hasNext())
        {
            cropped[i++] = cursor.next().get();
        }
        return withData(cropped, bounds.getWidth(), bounds.getHeight(),
                referencePixelX - bounds.getLeft(), referencePixelY - bounds.getTop());
    }

    /**
     * {@link #MISSING} marks an empty sample. Infinite samples carry no usable
     * value either and count as missing.
     */
    public static boolean isMissing(final double value)
    {
        return !Double.isFinite(value);
    }

    public boolean sameShape(final Frame other)
    {
        return width == other.width && height == other.height;
    }

    // Internal, read only access for the algorithms in this package
    double[] data()
    {
        return data;
    }

    public double[] getData()
    {
        return data.clone();
    }

    public double getValue(final int x, final int y)
    {
        return data[y * width + x];
    }

    public int getWidth()
    {
        return width;
    }

    public int getHeight()
    {
        return height;
    }

    public Instant getTimestamp()
    {
        return timestamp;
    }

    public double getScaleX()
    {
        return scaleX;
    }

    public double getScaleY()
    {
        return scaleY;
    }

    public double getReferencePixelX()
    {
        return referencePixelX;
    }

    public double getReferencePixelY()
    {
        return referencePixelY;
    }

    public Object getCoordinateFrame()
    {
        return coordinateFrame;
    }

    @Override
    public String toString()
    {
        return "Frame[" + width + "x" + height + " at " + timestamp + "]";
    }
}
