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

import java.time.Duration;

import ch.unibas.biozentrum.solarderotate.abstracts.RotationModel;

/**
 * Rotation model with a fixed apparent drift of the field of view, given in
 * angular units per second along x and y. A rate of zero leaves the shifts to
 * the cross-correlation alone.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public class ConstantRateRotationModel implements RotationModel {
    public static final ConstantRateRotationModel NONE = new ConstantRateRotationModel(0.0, 0.0);

    private final double rateX;
    private final double rateY;

    public ConstantRateRotationModel(final double rateX, final double rateY)
    {
        if(!Double.isFinite(rateX) || !Double.isFinite(rateY))
        {
            throw new IllegalArgumentException("Rotation rates must be finite.");
        }
        this.rateX = rateX;
        this.rateY = rateY;
    }

    @Override
    public ShiftVector rotationShift(final Frame frame, final Frame reference)
    {
        Duration elapsed = Duration.between(reference.getTimestamp(), frame.getTimestamp());
        double seconds = elapsed.getSeconds() + elapsed.getNano() / 1.0e9;
        if(seconds == 0.0 || (rateX == 0.0 && rateY == 0.0))
        {
            return ShiftVector.ZERO;
        }
        // The content drifted by rate * t, undo it
        return new ShiftVector(-rateX * seconds, -rateY * seconds);
    }
}
