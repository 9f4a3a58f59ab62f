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

import org.jtransforms.fft.DoubleFFT_2D;

import ch.unibas.biozentrum.solarderotate.exceptions.AlignmentFailureException;
import ch.unibas.biozentrum.solarderotate.exceptions.ShapeMismatchException;

/**
 * Estimates the sub-pixel translation between two images of the same shape
 * from the peak of their normalized cross-correlation.
 * <p>
 * Every lag is normalized over its own overlap: mean and variance of both
 * images are taken from the valid samples that actually overlap at that lag,
 * so content crossing the frame edge does not pull the peak. The six sums this
 * needs per lag are linear correlations of the images, their squares and their
 * validity masks, computed with {@link DoubleFFT_2D} on copies zero padded to at
 * least 2n-1 per axis (no wrap-around). Lags whose overlap holds fewer than
 * {@link #MIN_OVERLAP_FRACTION} of the largest overlap are not searched.
 * <p>
 * The integer peak is refined with a Gaussian fit through the three samples
 * around it on each axis, falling back to a parabola when a sample is not
 * positive.
 * <p>
 * The returned shift is the correction for the target: resampling the target
 * at {@code p - shift} lays it onto the reference. A target that is the
 * reference displaced by +D therefore yields -D.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public class CrossCorrelationEstimator {
    public static final double DEFAULT_AMBIGUITY_TOLERANCE = 1.0e-3;
    public static final int MIN_SIZE = 3;
    public static final double MIN_OVERLAP_FRACTION = 0.3;
    // Secondary maxima closer than this (Chebyshev distance) belong to the main peak
    static final int EXCLUSION_RADIUS = 2;
    // Overlap variance below this fraction of the whole image variance counts as flat
    private static final double VARIANCE_FLOOR = 1.0e-12;

    private final double ambiguityTolerance;

    public CrossCorrelationEstimator()
    {
        this(DEFAULT_AMBIGUITY_TOLERANCE);
    }

    /**
     * @param ambiguityTolerance a secondary local maximum reaching
     * (1 - ambiguityTolerance) of the main peak makes the estimate fail
     */
    public CrossCorrelationEstimator(final double ambiguityTolerance)
    {
        if(!(ambiguityTolerance >= 0.0 && ambiguityTolerance < 1.0))
        {
            throw new IllegalArgumentException("The ambiguity tolerance must lie in [0, 1), got " + ambiguityTolerance);
        }
        this.ambiguityTolerance = ambiguityTolerance;
    }

    public PixelShift estimateShift(final Frame reference, final Frame target)
    {
        if(!reference.sameShape(target))
        {
            throw new ShapeMismatchException("Cannot correlate a " + target.getWidth() + "x" + target.getHeight()
                    + " frame with a " + reference.getWidth() + "x" + reference.getHeight() + " reference.");
        }
        return estimateShift(reference.data(), target.data(), reference.getWidth(), reference.getHeight());
    }

    /**
     * @param reference row-major reference samples
     * @param target row-major target samples, same shape as the reference
     */
    public PixelShift estimateShift(final double[] reference, final double[] target, final int width, final int height)
    {
        if(reference.length != width * height || target.length != width * height)
        {
            throw new ShapeMismatchException("The images passed to the estimator are not " + width + "x" + height + ".");
        }
        if(width < MIN_SIZE || height < MIN_SIZE)
        {
            throw new AlignmentFailureException("Images of " + width + "x" + height + " pixels are too small to register.");
        }
        final int size = width * height;
        double[] refValues = new double[size];
        double[] refMask = new double[size];
        double[] tgtValues = new double[size];
        double[] tgtMask = new double[size];
        double refEnergy = center(reference, refValues, refMask);
        double tgtEnergy = center(target, tgtValues, tgtMask);
        if(!(refEnergy > 0.0) || !(tgtEnergy > 0.0))
        {
            throw new AlignmentFailureException("Cannot register a flat image, the correlation surface has no peak.");
        }

        final int paddedWidth = paddedSize(width);
        final int paddedHeight = paddedSize(height);
        final DoubleFFT_2D fft = new DoubleFFT_2D(paddedHeight, paddedWidth);
        double[] refSpectrum = spectrum(fft, refValues, width, height, paddedWidth, paddedHeight);
        double[] refSquareSpectrum = spectrum(fft, square(refValues), width, height, paddedWidth, paddedHeight);
        double[] refMaskSpectrum = spectrum(fft, refMask, width, height, paddedWidth, paddedHeight);
        double[] tgtSpectrum = spectrum(fft, tgtValues, width, height, paddedWidth, paddedHeight);
        double[] tgtSquareSpectrum = spectrum(fft, square(tgtValues), width, height, paddedWidth, paddedHeight);
        double[] tgtMaskSpectrum = spectrum(fft, tgtMask, width, height, paddedWidth, paddedHeight);

        double[] overlap = correlate(fft, refMaskSpectrum, tgtMaskSpectrum);
        double[] refSum = correlate(fft, refSpectrum, tgtMaskSpectrum);
        double[] refSquareSum = correlate(fft, refSquareSpectrum, tgtMaskSpectrum);
        double[] tgtSum = correlate(fft, refMaskSpectrum, tgtSpectrum);
        double[] tgtSquareSum = correlate(fft, refMaskSpectrum, tgtSquareSpectrum);
        double[] crossSum = correlate(fft, refSpectrum, tgtSpectrum);

        double maxOverlap = 0.0;
        for(int i = 0; i < overlap.length; i++)
        {
            overlap[i] = Math.round(overlap[i]);
            maxOverlap = Math.max(maxOverlap, overlap[i]);
        }
        final double minOverlap = Math.max(2.0, Math.ceil(MIN_OVERLAP_FRACTION * maxOverlap));
        final double refFloor = VARIANCE_FLOOR * refEnergy;
        final double tgtFloor = VARIANCE_FLOOR * tgtEnergy;

        // Unwrap the lags into a dense (2w-1) x (2h-1) surface, lag 0 at (width-1, height-1)
        final int surfaceWidth = 2 * width - 1;
        final int surfaceHeight = 2 * height - 1;
        double[] surface = new double[surfaceWidth * surfaceHeight];
        int peakIndex = -1;
        for(int sy = 0; sy < surfaceHeight; sy++)
        {
            int dy = sy - (height - 1);
            int py = dy < 0 ? dy + paddedHeight : dy;
            for(int sx = 0; sx < surfaceWidth; sx++)
            {
                int dx = sx - (width - 1);
                int px = dx < 0 ? dx + paddedWidth : dx;
                int lag = py * paddedWidth + px;
                int index = sy * surfaceWidth + sx;
                surface[index] = Double.NEGATIVE_INFINITY;
                double n = overlap[lag];
                if(n < minOverlap)
                {
                    continue;
                }
                double refVariance = refSquareSum[lag] - refSum[lag] * refSum[lag] / n;
                double tgtVariance = tgtSquareSum[lag] - tgtSum[lag] * tgtSum[lag] / n;
                if(!(refVariance > refFloor) || !(tgtVariance > tgtFloor))
                {
                    continue;
                }
                surface[index] = (crossSum[lag] - refSum[lag] * tgtSum[lag] / n) / Math.sqrt(refVariance * tgtVariance);
                if(peakIndex < 0 || surface[index] > surface[peakIndex])
                {
                    peakIndex = index;
                }
            }
        }
        if(peakIndex < 0)
        {
            throw new AlignmentFailureException("The images do not overlap with enough valid samples at any lag.");
        }
        final int peakX = peakIndex % surfaceWidth;
        final int peakY = peakIndex / surfaceWidth;
        final double peak = surface[peakIndex];
        if(!(peak > 0.0))
        {
            throw new AlignmentFailureException("The correlation peak is not positive.");
        }
        if(!isInterior(surface, surfaceWidth, surfaceHeight, peakX, peakY))
        {
            throw new AlignmentFailureException("The correlation peak lies on the border of the search range.");
        }
        checkUnimodal(surface, surfaceWidth, surfaceHeight, peakX, peakY);

        double deltaX = refinePeak(surface[peakIndex - 1], peak, surface[peakIndex + 1]);
        double deltaY = refinePeak(surface[peakIndex - surfaceWidth], peak, surface[peakIndex + surfaceWidth]);
        return new PixelShift(peakX - (width - 1) + deltaX, peakY - (height - 1) + deltaY);
    }

    /**
     * Removes the mean of the valid samples. Missing samples become 0 and get
     * a 0 in the mask, valid ones a 1.
     *
     * @return the sum of squares of the centered samples
     */
    private static double center(final double[] image, final double[] centered, final double[] mask)
    {
        double sum = 0.0;
        int count = 0;
        for(int i = 0; i < image.length; i++)
        {
            if(!Frame.isMissing(image[i]))
            {
                sum += image[i];
                mask[i] = 1.0;
                count++;
            }
        }
        if(count < MIN_SIZE * MIN_SIZE)
        {
            return 0.0;
        }
        final double mean = sum / count;
        double energy = 0.0;
        for(int i = 0; i < image.length; i++)
        {
            centered[i] = mask[i] > 0.0 ? image[i] - mean : 0.0;
            energy += centered[i] * centered[i];
        }
        return energy;
    }

    private static double[] square(final double[] values)
    {
        double[] squares = new double[values.length];
        for(int i = 0; i < values.length; i++)
        {
            squares[i] = values[i] * values[i];
        }
        return squares;
    }

    private static int paddedSize(final int n)
    {
        int size = 1;
        while(size < 2 * n - 1)
        {
            size <<= 1;
        }
        return size;
    }

    /**
     * Forward transform of the image placed in the top left corner of a zero
     * padded plane.
     *
     * @return interleaved complex spectrum, paddedHeight rows of 2*paddedWidth
     */
    private static double[] spectrum(final DoubleFFT_2D fft, final double[] image, final int width, final int height,
            final int paddedWidth, final int paddedHeight)
    {
        // realForwardFull takes the real input in the first rows*columns elements
        double[] buffer = new double[2 * paddedWidth * paddedHeight];
        for(int y = 0; y < height; y++)
        {
            System.arraycopy(image, y * width, buffer, y * paddedWidth, width);
        }
        fft.realForwardFull(buffer);
        return buffer;
    }

    /**
     * Linear correlation of two padded images from their spectra.
     *
     * @return the real part per lag, lag (dx, dy) at index dy*paddedWidth + dx
     * with negative lags wrapped to the far end of each axis
     */
    private static double[] correlate(final DoubleFFT_2D fft, final double[] a, final double[] b)
    {
        // a * conj(b)
        double[] product = new double[a.length];
        for(int i = 0; i < a.length; i += 2)
        {
            product[i] = a[i] * b[i] + a[i + 1] * b[i + 1];
            product[i + 1] = a[i + 1] * b[i] - a[i] * b[i + 1];
        }
        fft.complexInverse(product, true);
        double[] real = new double[a.length / 2];
        for(int i = 0; i < real.length; i++)
        {
            real[i] = product[2 * i];
        }
        return real;
    }

    private static boolean isInterior(final double[] surface, final int surfaceWidth, final int surfaceHeight, final int x, final int y)
    {
        if(x == 0 || y == 0 || x == surfaceWidth - 1 || y == surfaceHeight - 1)
        {
            return false;
        }
        for(int ny = y - 1; ny <= y + 1; ny++)
        {
            for(int nx = x - 1; nx <= x + 1; nx++)
            {
                if(surface[ny * surfaceWidth + nx] == Double.NEGATIVE_INFINITY)
                {
                    return false;
                }
            }
        }
        return true;
    }

    private void checkUnimodal(final double[] surface, final int surfaceWidth, final int surfaceHeight, final int peakX, final int peakY)
    {
        final double threshold = surface[peakY * surfaceWidth + peakX] * (1.0 - ambiguityTolerance);
        for(int y = 0; y < surfaceHeight; y++)
        {
            for(int x = 0; x < surfaceWidth; x++)
            {
                if(Math.max(Math.abs(x - peakX), Math.abs(y - peakY)) <= EXCLUSION_RADIUS)
                {
                    continue;
                }
                double v = surface[y * surfaceWidth + x];
                if(v >= threshold && isLocalMaximum(surface, surfaceWidth, surfaceHeight, x, y))
                {
                    throw new AlignmentFailureException("The correlation surface is multi-modal, a second peak at lag ("
                            + (x - (surfaceWidth - 1) / 2) + ", " + (y - (surfaceHeight - 1) / 2) + ") is as high as the main peak.");
                }
            }
        }
    }
    private static boolean isLocalMaximum(final double[] surface, final int surfaceWidth, final int surfaceHeight, final int x, final int y)
    {
        final double v = surface[y * surfaceWidth + x];
        for(int ny = Math.max(0, y - 1); ny <= Math.min(surfaceHeight - 1, y + 1); ny++)
        {
            for(int nx = Math.max(0, x - 1); nx <= Math.min(surfaceWidth - 1, x + 1); nx++)
            {
                if(surface[ny * surfaceWidth + nx] > v)
                {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Sub-pixel offset of the maximum of the curve through (-1, left),
     * (0, center), (1, right).
     */
    static double refinePeak(final double left, final double center, final double right)
    {
        double numerator;
        double denominator;
        if(left > 0.0 && right > 0.0)
        {
            // Gaussian fit, i.e. a parabola through the logarithms
            double ll = Math.log(left);
            double lc = Math.log(center);
            double lr = Math.log(right);
            numerator = ll - lr;
            denominator = 2.0 * (ll - 2.0 * lc + lr);
        }
        else
        {
            numerator = left - right;
            denominator = 2.0 * (left - 2.0 * center + right);
        }
        if(!(denominator < 0.0))
        {
            throw new AlignmentFailureException("The correlation peak is flat, its position is not defined.");
        }
        double delta = numerator / denominator;
        if(!(Math.abs(delta) <= 1.0))
        {
            throw new AlignmentFailureException("The sub-pixel peak position is not consistent with the integer peak.");
        }
        return delta;
    }
}
