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

import java.util.List;

import ch.unibas.biozentrum.solarderotate.exceptions.DegenerateClipRegionException;

/**
 * Finds the rectangle that holds a real sample in every frame of a shifted
 * sequence. A positive shift exposes the leading rows (or columns) of a
 * frame, a negative one the trailing rows, each by the shift rounded up.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public final class ClipCalculator {
    /**
     * Shifts within this distance of an integer count as that integer. The
     * shifter uses the same tolerance when deciding which output pixels have
     * a source sample, so the two always agree.
     */
    public static final double EDGE_TOLERANCE = 1.0e-9;

    private ClipCalculator() { }

    public static ClipBounds computeClipBounds(final List<PixelShift> shifts, final int width, final int height)
    {
        int top = 0;
        int bottom = 0;
        int left = 0;
        int right = 0;
        for(PixelShift s : shifts)
        {
            if(!Double.isFinite(s.getX()) || !Double.isFinite(s.getY()))
            {
                throw new DegenerateClipRegionException("Cannot clip with a non-finite shift " + s);
            }
            if(s.getY() > 0.0)
            {
                top = Math.max(top, roundUp(s.getY(), height));
            }
            else if(s.getY() < 0.0)
            {
                bottom = Math.max(bottom, roundUp(-s.getY(), height));
            }
            if(s.getX() > 0.0)
            {
                left = Math.max(left, roundUp(s.getX(), width));
            }
            else if(s.getX() < 0.0)
            {
                right = Math.max(right, roundUp(-s.getX(), width));
            }
        }
        if(top + bottom >= height || left + right >= width)
        {
            throw new DegenerateClipRegionException("The shifts leave no common valid region: " + top + " + " + bottom
                    + " rows of " + height + " and " + left + " + " + right + " columns of " + width + " are clipped.");
        }
        return new ClipBounds(top, height - bottom, left, width - right);
    }

    // Rounds up, capped at the frame size so that huge shifts cannot overflow
    private static int roundUp(final double magnitude, final int size)
    {
        double r = Math.ceil(magnitude - EDGE_TOLERANCE);
        return r >= size ? size : (int)r;
    }
}
