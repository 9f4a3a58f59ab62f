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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import ch.unibas.biozentrum.solarderotate.exceptions.AlignmentFailureException;
import ch.unibas.biozentrum.solarderotate.exceptions.ShapeMismatchException;

public class CrossCorrelationEstimatorTest {
    private static final int SIZE = 40;
    private static final double SIGMA = 3.0;

    private final CrossCorrelationEstimator estimator = new CrossCorrelationEstimator();

    private static double[] blobAt(final double cx, final double cy)
    {
        return SyntheticFrames.blob(SIZE, SIZE, cx, cy, SIGMA);
    }

    @Test
    public void testIdenticalImagesGiveZeroShift()
    {
        double[] image = blobAt(19.0, 20.0);
        PixelShift shift = estimator.estimateShift(image, image.clone(), SIZE, SIZE);
        assertEquals(0.0, shift.getX(), 1e-9);
        assertEquals(0.0, shift.getY(), 1e-9);
    }

    @Test
    public void testIntegerShiftIsUndone()
    {
        // Target displaced by (+3, -3), the correction is the opposite
        PixelShift shift = estimator.estimateShift(blobAt(19.0, 20.0), blobAt(22.0, 17.0), SIZE, SIZE);
        assertEquals(-3.0, shift.getX(), 0.05);
        assertEquals(3.0, shift.getY(), 0.05);
    }

    @Test
    public void testSubPixelShift()
    {
        PixelShift shift = estimator.estimateShift(blobAt(19.0, 20.0), blobAt(21.3, 18.6), SIZE, SIZE);
        assertEquals(-2.3, shift.getX(), 0.05);
        assertEquals(1.4, shift.getY(), 0.05);
    }

    @Test
    public void testDisplacedAndCroppedSceneIsMeasuredWithoutBias()
    {
        // Textured content crossing every frame edge, so the overlap changes with the lag
        final int width = 64;
        final int height = 48;
        double[] reference = SyntheticFrames.field(width, height, 7L, 0.0, 0.0);
        double[][] drifts = {{0.3, -0.15}, {1.0, -0.5}, {5.0, -2.5}, {8.7, -4.35}};
        for(double[] drift : drifts)
        {
            double[] target = SyntheticFrames.field(width, height, 7L, drift[0], drift[1]);
            PixelShift shift = estimator.estimateShift(reference, target, width, height);
            assertEquals(-drift[0], shift.getX(), 0.05, "x for drift " + drift[0]);
            assertEquals(-drift[1], shift.getY(), 0.05, "y for drift " + drift[1]);
        }
    }

    @Test
    public void testFrameOverload()
    {
        Frame reference = SyntheticFrames.frame(blobAt(19.0, 20.0), SIZE, SIZE);
        Frame target = SyntheticFrames.frame(blobAt(18.5, 20.0), SIZE, SIZE);
        PixelShift shift = estimator.estimateShift(reference, target);
        assertEquals(0.5, shift.getX(), 0.05);
        assertEquals(0.0, shift.getY(), 1e-6);
    }

    @Test
    public void testMissingSamplesAreTolerated()
    {
        double[] target = blobAt(21.0, 20.0);
        target[0] = Frame.MISSING;
        target[SIZE * SIZE - 1] = Double.POSITIVE_INFINITY;
        PixelShift shift = estimator.estimateShift(blobAt(19.0, 20.0), target, SIZE, SIZE);
        assertEquals(-2.0, shift.getX(), 0.1);
        assertEquals(0.0, shift.getY(), 0.1);
    }

    @Test
    public void testLargelyMissingTargetIsMeasuredOnItsValidPart()
    {
        // Right half of the target is gone, as after shifting content out of the frame
        final int width = 64;
        final int height = 48;
        double[] reference = SyntheticFrames.field(width, height, 7L, 0.0, 0.0);
        double[] target = SyntheticFrames.field(width, height, 7L, 1.0, -0.5);
        for(int y = 0; y < height; y++)
        {
            for(int x = width / 2; x < width; x++)
            {
                target[y * width + x] = Frame.MISSING;
            }
        }
        PixelShift shift = estimator.estimateShift(reference, target, width, height);
        assertEquals(-1.0, shift.getX(), 0.05);
        assertEquals(0.5, shift.getY(), 0.05);
    }

    @Test
    public void testFlatImageFails()
    {
        double[] flat = new double[SIZE * SIZE];
        Arrays.fill(flat, 5.0);
        assertThrows(AlignmentFailureException.class, () -> estimator.estimateShift(blobAt(19.0, 20.0), flat, SIZE, SIZE));
        assertThrows(AlignmentFailureException.class, () -> estimator.estimateShift(flat, blobAt(19.0, 20.0), SIZE, SIZE));
    }

    @Test
    public void testTooSmallImageFails()
    {
        assertThrows(AlignmentFailureException.class,
                () -> estimator.estimateShift(new double[] {0, 1, 2, 3}, new double[] {3, 2, 1, 0}, 2, 2));
    }

    @Test
    public void testShapeMismatch()
    {
        Frame a = SyntheticFrames.frame(blobAt(19.0, 20.0), SIZE, SIZE);
        Frame b = SyntheticFrames.frame(SyntheticFrames.blob(SIZE, SIZE / 2, 19.0, 16.0, SIGMA), SIZE, SIZE / 2);
        assertThrows(ShapeMismatchException.class, () -> estimator.estimateShift(a, b));
        assertThrows(ShapeMismatchException.class, () -> estimator.estimateShift(new double[10], new double[12], 3, 4));
    }

    @Test
    public void testMultiModalSurfaceFails()
    {
        // Two copies of the feature at equal distance, both are equally good matches
        final int width = 65;
        final int height = 17;
        double[] reference = SyntheticFrames.blob(width, height, 32.0, 8.0, SIGMA);
        double[] target = SyntheticFrames.add(SyntheticFrames.blob(width, height, 22.0, 8.0, SIGMA),
                SyntheticFrames.blob(width, height, 42.0, 8.0, SIGMA), 1.0);
        assertThrows(AlignmentFailureException.class, () -> estimator.estimateShift(reference, target, width, height));
    }

    @Test
    public void testRefinePeak()
    {
        assertEquals(0.0, CrossCorrelationEstimator.refinePeak(0.5, 1.0, 0.5), 1e-15);
        // Samples of a Gaussian centered at 0.3 are fitted exactly
        double left = Math.exp(-1.3 * 1.3 / 2.0);
        double center = Math.exp(-0.3 * 0.3 / 2.0);
        double right = Math.exp(-0.7 * 0.7 / 2.0);
        assertEquals(0.3, CrossCorrelationEstimator.refinePeak(left, center, right), 1e-12);
        // Parabola when a neighbor is not positive
        assertEquals(-0.4 / -3.6, CrossCorrelationEstimator.refinePeak(-0.1, 1.0, 0.3), 1e-12);
        assertThrows(AlignmentFailureException.class, () -> CrossCorrelationEstimator.refinePeak(1.0, 1.0, 1.0));
    }

    @Test
    public void testInvalidTolerance()
    {
        assertThrows(IllegalArgumentException.class, () -> new CrossCorrelationEstimator(1.0));
        assertThrows(IllegalArgumentException.class, () -> new CrossCorrelationEstimator(-0.1));
    }
}
