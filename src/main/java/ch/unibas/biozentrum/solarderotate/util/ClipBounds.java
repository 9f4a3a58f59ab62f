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

import net.imglib2.FinalInterval;
import net.imglib2.Interval;

/**
 * The rectangle kept when cropping a derotated sequence: rows
 * [top, bottom) and columns [left, right).
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public final class ClipBounds {
    private final int top;
    private final int bottom;
    private final int left;
    private final int right;

    public ClipBounds(final int top, final int bottom, final int left, final int right)
    {
        this.top = top;
        this.bottom = bottom;
        this.left = left;
        this.right = right;
    }

    public int getTop()
    {
        return top;
    }

    public int getBottom()
    {
        return bottom;
    }

    public int getLeft()
    {
        return left;
    }

    public int getRight()
    {
        return right;
    }

    public int getWidth()
    {
        return right - left;
    }

    public int getHeight()
    {
        return bottom - top;
    }

    /**
     * @return the kept rectangle with inclusive maxima, dimension 0 = x
     */
    public Interval toInterval()
    {
        return new FinalInterval(new long[]{left, top}, new long[]{right - 1, bottom - 1});
    }

    @Override
    public boolean equals(final Object o)
    {
        if(this == o)
        {
            return true;
        }
        if(!(o instanceof ClipBounds))
        {
            return false;
        }
        ClipBounds other = (ClipBounds)o;
        return top == other.top && bottom == other.bottom && left == other.left && right == other.right;
    }

    @Override
    public int hashCode()
    {
        return ((top * 31 + bottom) * 31 + left) * 31 + right;
    }

    @Override
    public String toString()
    {
        return "ClipBounds[top=" + top + ", bottom=" + bottom + ", left=" + left + ", right=" + right + "]";
    }
}
