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

import ch.unibas.biozentrum.solarderotate.exceptions.InvalidScaleException;

/**
 * Converts offsets between pixel and angular units with a per-axis scale
 * given in angular units per pixel.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public final class UnitConverter {
    private UnitConverter() { }

    public static ShiftVector toAngular(final PixelShift shift, final double scaleX, final double scaleY)
    {
        checkScale(scaleX, "x");
        checkScale(scaleY, "y");
        return new ShiftVector(shift.getX() * scaleX, shift.getY() * scaleY);
    }

    public static PixelShift toPixels(final ShiftVector shift, final double scaleX, final double scaleY)
    {
        checkScale(scaleX, "x");
        checkScale(scaleY, "y");
        return new PixelShift(shift.getX() / scaleX, shift.getY() / scaleY);
    }

    public static ShiftVector toAngular(final PixelShift shift, final Frame frame)
    {
        return toAngular(shift, frame.getScaleX(), frame.getScaleY());
    }

    public static PixelShift toPixels(final ShiftVector shift, final Frame frame)
    {
        return toPixels(shift, frame.getScaleX(), frame.getScaleY());
    }

    public static void checkScale(final Frame frame)
    {
        checkScale(frame.getScaleX(), "x");
        checkScale(frame.getScaleY(), "y");
    }

    private static void checkScale(final double scale, final String axis)
    {
        if(!Double.isFinite(scale) || scale <= 0.0)
        {
            throw new InvalidScaleException("The " + axis + " scale must be positive and finite, got " + scale);
        }
    }
}
