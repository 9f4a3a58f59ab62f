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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class BSplineShifterTest {

    @Test
    public void testIntegerShiftReproducesSamples()
    {
        final int width = 9;
        final int height = 7;
        double[] data = SyntheticFrames.noise(width, height, 42L);
        Frame shifted = BSplineShifter.shiftFrame(SyntheticFrames.frame(data, width, height), new PixelShift(2.0, -1.0));
        for(int y = 0; y < height; y++)
        {
            for(int x = 0; x < width; x++)
            {
                int sx = x - 2;
                int sy = y + 1;
                double v = shifted.getValue(x, y);
                if(sx >= 0 && sx < width && sy >= 0 && sy < height)
                {
                    assertEquals(data[sy * width + sx], v, 1e-12, "pixel " + x + "," + y);
                }
                else
                {
                    assertTrue(Frame.isMissing(v), "pixel " + x + "," + y + " has no source sample");
                }
            }
        }
    }

    @Test
    public void testZeroShiftIsIdentity()
    {
        double[] data = SyntheticFrames.noise(8, 5, 1L);
        Frame shifted = BSplineShifter.shiftFrame(SyntheticFrames.frame(data, 8, 5), PixelShift.ZERO);
        double[] out = shifted.getData();
        for(int i = 0; i < data.length; i++)
        {
            assertEquals(data[i], out[i], 1e-12);
        }
    }

    @Test
    public void testSubPixelShiftOfSmoothImage()
    {
        final int size = 32;
        Frame frame = SyntheticFrames.frame(SyntheticFrames.blob(size, size, 15.0, 16.0, 3.0), size, size);
        Frame shifted = BSplineShifter.shiftFrame(frame, new PixelShift(0.4, -0.3));
        double[] expected = SyntheticFrames.blob(size, size, 15.4, 15.7, 3.0);
        int valid = 0;
        for(int y = 0; y < size; y++)
        {
            for(int x = 0; x < size; x++)
            {
                double v = shifted.getValue(x, y);
                if(!Frame.isMissing(v))
                {
                    assertEquals(expected[y * size + x], v, 1e-3);
                    valid++;
                }
            }
        }
        // Column 0 and the last row have no source sample
        assertEquals((size - 1) * (size - 1), valid);
        assertTrue(Frame.isMissing(shifted.getValue(0, 10)));
        assertTrue(Frame.isMissing(shifted.getValue(10, size - 1)));
    }

    @Test
    public void testReferencePixelFollowsShift()
    {
        Frame frame = new Frame(SyntheticFrames.noise(10, 10, 5L), 10, 10, SyntheticFrames.T0, 0.6, 0.6, 4.0, 5.0, "hpc");
        Frame shifted = BSplineShifter.shiftFrame(frame, new PixelShift(0.4, -2.25));
        assertEquals(4.4, shifted.getReferencePixelX(), 1e-12);
        assertEquals(2.75, shifted.getReferencePixelY(), 1e-12);
        assertEquals(frame.getTimestamp(), shifted.getTimestamp());
        assertEquals(0.6, shifted.getScaleX(), 0.0);
        assertSame(frame.getCoordinateFrame(), shifted.getCoordinateFrame());
    }

    @Test
    public void testMissingInputStaysMissing()
    {
        double[] data = SyntheticFrames.noise(8, 6, 9L);
        data[3 * 8 + 4] = Frame.MISSING;
        Frame shifted = BSplineShifter.shiftFrame(SyntheticFrames.frame(data, 8, 6), PixelShift.ZERO);
        assertTrue(Frame.isMissing(shifted.getValue(4, 3)));
        assertFalse(Frame.isMissing(shifted.getValue(0, 0)));
    }

    @Test
    public void testInfiniteInputIsMissingInOutput()
    {
        double[] data = SyntheticFrames.noise(8, 6, 9L);
        data[2 * 8 + 5] = Double.NEGATIVE_INFINITY;
        Frame shifted = BSplineShifter.shiftFrame(SyntheticFrames.frame(data, 8, 6), new PixelShift(1.0, 0.0));
        assertTrue(Frame.isMissing(shifted.getValue(6, 2)));
        for(double v : shifted.getData())
        {
            assertFalse(v == Double.NEGATIVE_INFINITY || v == Double.POSITIVE_INFINITY);
        }
    }
}
