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
 * A translation in pixel units. x runs along the columns, y along the rows.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public final class PixelShift {
    public static final PixelShift ZERO = new PixelShift(0.0, 0.0);

    private final double x;
    private final double y;

    public PixelShift(final double x, final double y)
    {
        this.x = x;
        this.y = y;
    }

    public double getX()
    {
        return x;
    }

    public double getY()
    {
        return y;
    }

    @Override
    public boolean equals(final Object o)
    {
        if(this == o)
        {
            return true;
        }
        if(!(o instanceof PixelShift))
        {
            return false;
        }
        PixelShift other = (PixelShift)o;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
    }

    @Override
    public int hashCode()
    {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString()
    {
        return "PixelShift[x=" + x + ", y=" + y + "]";
    }
}
