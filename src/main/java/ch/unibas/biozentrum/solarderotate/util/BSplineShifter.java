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

/**
 * Translates a frame by an arbitrary real-valued pixel shift with cubic
 * B-spline interpolation. Integer shifts reproduce the samples exactly.
 * <p>
 * Output pixel p is the input interpolated at p - shift. Output pixels whose
 * source position lies outside the input, or whose nearest source sample is
 * missing, are set to {@link Frame#MISSING}.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public final class BSplineShifter {
    public static final double POLE = -0.26794919243112270647255365849413;

    private BSplineShifter() { }

    /**
     * @return a new frame with the shifted samples and the reference pixel
     * moved by the shift
     */
    public static Frame shiftFrame(final Frame frame, final PixelShift shift)
    {
        final int width = frame.getWidth();
        final int height = frame.getHeight();
        final double[] source = frame.data();
        final double[] coefficients = new double[source.length];
        for(int i = 0; i < source.length; i++)
        {
            coefficients[i] = Frame.isMissing(source[i]) ? 0.0 : source[i];
        }
        cubicBSplinePrefilter2DX(coefficients, width, height);
        cubicBSplinePrefilter2DY(coefficients, width, height);
        double[] shifted = new double[source.length];
        translateWithBsplineInterpolation(source, coefficients, shifted, width, height, -shift.getX(), -shift.getY());
        return frame.withData(shifted, width, height,
                frame.getReferencePixelX() + shift.getX(), frame.getReferencePixelY() + shift.getY());
    }

    /*
     * The prefilters turn samples into B-spline coefficients in place, with
     * the gain of 6 folded in. Mirror-off-bounds boundary conditions.
     */
    static void cubicBSplinePrefilter2DX(final double target[], final int width, final int height)
    {
        if(width < 2)
        {
            return;
        }
        for(int i = 0; i < height; i++)
        {
            for(int n = 0; n < width; n++)
            {
                target[i*width + n] *= 6.0;
            }
            // causal initialization
            double z1 = POLE;
            double zn = Math.pow(z1, (double)width);
            double sum = (1.0 + POLE) * (target[i*width] + zn * target[i*width + (width - 1)]);
            zn *= zn;
            for(int n = 1; n < width - 1; n++)
            {
                z1 *= POLE;
                zn /= POLE;
                sum += (z1 + zn) * target[i*width + n];
            }
            target[i*width] = (sum / (1.0 - Math.pow(POLE, (double)(2*width))));
            // causal recursion
            for(int n = 1; n < width; n++)
            {
                target[i*width + n] += POLE * target[i*width + n - 1];
            }
            // anticausal initialization
            target[i*width + (width - 1)] = (POLE * target[i*width + (width - 1)] / (POLE - 1.0));
            // anticausal recursion
            for(int n = width - 2; n >= 0; n--)
            {
                target[i*width + n] = POLE * (target[i*width + n + 1] - target[i*width + n]);
            }
        }
    }

    static void cubicBSplinePrefilter2DY(final double target[], final int width, final int height)
    {
        if(height < 2)
        {
            return;
        }
        for(int i = 0; i < width; i++)
        {
            for(int n = 0; n < height; n++)
            {
                target[n*width + i] *= 6.0;
            }
            // causal initialization
            double z1 = POLE;
            double zn = Math.pow(z1, (double)height);
            double sum = (1.0 + POLE) * (target[i] + zn * target[(height - 1)*width + i]);
            zn *= zn;
            for(int n = 1; n < height - 1; n++)
            {
                z1 *= POLE;
                zn /= POLE;
                sum += (z1 + zn) * target[n*width + i];
            }
            target[i] = (sum / (1.0 - Math.pow(POLE, (double)(2*height))));
            // causal recursion
            for(int n = 1; n < height; n++)
            {
                target[n*width + i] += POLE * target[(n - 1)*width + i];
            }
            // anticausal initialization
            target[(height - 1)*width + i] = (POLE * target[(height - 1)*width + i] / (POLE - 1.0));
            // anticausal recursion
            for(int n = height - 2; n >= 0; n--)
            {
                target[n*width + i] = POLE * (target[(n + 1)*width + i] - target[n*width + i]);
            }
        }
    }

    private static void translateWithBsplineInterpolation(final double[] source, final double[] coefficients, final double[] output,
            final int width, final int height, final double offsetx, final double offsety)
    {
        final int doubleWidth = width * 2;
        final int doubleHeight = height * 2;
        final int[] xInterpolationIndices = new int[4];
        final int[] yInterpolationIndices = new int[4];
        final double[] xWeights = new double[4];
        final double[] yWeights = new double[4];
        final double maxx = (width - 1) + ClipCalculator.EDGE_TOLERANCE;
        final double maxy = (height - 1) + ClipCalculator.EDGE_TOLERANCE;
        int nIndex = 0;
        int p;
        int q;
        int tmpindex;
        double s;
        double coordx;
        double rescoordx;
        double coordy;
        double rescoordy;
        for(int i = 0; i < height; i++)
        {
            coordy = offsety + ((double)i);
            for(int n = 0; n < width; n++, nIndex++)
            {
                coordx = offsetx + ((double)n);
                if(coordx < -ClipCalculator.EDGE_TOLERANCE || coordx > maxx || coordy < -ClipCalculator.EDGE_TOLERANCE || coordy > maxy)
                {
                    output[nIndex] = Frame.MISSING;
                    continue;
                }
                int nearestx = Math.min(width - 1, Math.max(0, (int)Math.round(coordx)));
                int nearesty = Math.min(height - 1, Math.max(0, (int)Math.round(coordy)));
                if(Frame.isMissing(source[nearesty * width + nearestx]))
                {
                    output[nIndex] = Frame.MISSING;
                    continue;
                }
                // Calculate X-interpolation indices
                p = (coordx >= 0) ? (((int)coordx) + 2) : (((int)coordx) + 1);
                for(int c = 0; c < 4; c++, p--)
                {
                    q = (p < 0) ? (-1 - p) : p;
                    if(q >= doubleWidth)
                    {
                        q -= doubleWidth * (q / doubleWidth); // integer division
                    }
                    xInterpolationIndices[c] = q >= width ? (doubleWidth - 1 - q) : q;
                }
                // calculate Y-interpolation indices
                p = (coordy >= 0) ? (((int)coordy) + 2) : (((int)coordy) + 1);
                for(int c = 0; c < 4; c++, p--)
                {
                    q = (p < 0) ? (-1 - p) : p;
                    if(q >= doubleHeight)
                    {
                        q -= doubleHeight * (q / doubleHeight);
                    }
                    yInterpolationIndices[c] = q >= height ? (doubleHeight - 1 - q) * width : q * width; // linearized row offset
                }
                // get the residuals of the coordinates
                rescoordx = coordx - (coordx >= 0.0 ? ((double)((int)coordx)) : ((double)(((int)coordx) - 1)));
                rescoordy = coordy - (coordy >= 0.0 ? ((double)((int)coordy)) : ((double)(((int)coordy) - 1)));
                // calculate the X-weights
                s = 1.0 - rescoordx;
                xWeights[3] = s * s * s / 6.0;
                s = rescoordx * rescoordx;
                xWeights[2] = (2.0 / 3.0) - 0.5 * s * (2.0 - rescoordx);
                xWeights[0] = s * rescoordx / 6.0;
                xWeights[1] = 1.0 - xWeights[0] - xWeights[2] - xWeights[3];
                // calculate the Y-weights
                s = 1.0 - rescoordy;
                yWeights[3] = s * s * s / 6.0;
                s = rescoordy * rescoordy;
                yWeights[2] = (2.0 / 3.0) - 0.5 * s * (2.0 - rescoordy);
                yWeights[0] = s * rescoordy / 6.0;
                yWeights[1] = 1.0 - yWeights[0] - yWeights[2] - yWeights[3];

                s = 0.0;
                for(int y = 0; y < 4; y++)
                {
                    double row = 0.0;
                    tmpindex = yInterpolationIndices[y];
                    for(int x = 0; x < 4; x++)
                    {
                        row += xWeights[x] * coefficients[tmpindex + xInterpolationIndices[x]];
                    }
                    s += yWeights[y] * row;
                }
                output[nIndex] = s;
            }
        }
    }
}
