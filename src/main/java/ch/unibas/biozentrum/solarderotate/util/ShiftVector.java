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

import org.json.JSONObject;

/**
 * Angular translation of one frame relative to the reference frame, in the
 * same angular units as the frame scale (usually arcseconds).
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public final class ShiftVector {
    public static final ShiftVector ZERO = new ShiftVector(0.0, 0.0);

    private final double x;
    private final double y;

    public ShiftVector(final double x, final double y)
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

    /**
     * Combining two translations is simply adding them.
     */
    public ShiftVector plus(final ShiftVector other)
    {
        return new ShiftVector(x + other.x, y + other.y);
    }

    public ShiftVector minus(final ShiftVector other)
    {
        return new ShiftVector(x - other.x, y - other.y);
    }

    public JSONObject serialize()
    {
        JSONObject retval = new JSONObject();
        JSONObject translation = new JSONObject();
        // Save doubles as string, because JSON does not officially support double precision
        translation.put("OffsetX", Double.toString(x));
        translation.put("OffsetY", Double.toString(y));
        retval.put("Translation", translation);
        return retval;
    }

    public static ShiftVector deserialize(final JSONObject json)
    {
        JSONObject translation = json.getJSONObject("Translation");
        return new ShiftVector(Double.parseDouble(translation.getString("OffsetX")), Double.parseDouble(translation.getString("OffsetY")));
    }

    @Override
    public boolean equals(final Object o)
    {
        if(this == o)
        {
            return true;
        }
        if(!(o instanceof ShiftVector))
        {
            return false;
        }
        ShiftVector other = (ShiftVector)o;
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
        return "ShiftVector[x=" + x + ", y=" + y + "]";
    }
}
