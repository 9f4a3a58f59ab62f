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

package ch.unibas.biozentrum.solarderotate.abstracts;

import ch.unibas.biozentrum.solarderotate.util.Frame;
import ch.unibas.biozentrum.solarderotate.util.ShiftVector;

/**
 * Supplies the apparent displacement caused by solar rotation between the
 * observation of a frame and that of the reference frame. The rotation rate
 * itself is looked up by the implementation, usually from the frame metadata
 * (timestamp and coordinate frame).
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public interface RotationModel {
    /**
     * @return the angular correction that moves the content of frame back to
     * where it was at the reference time; zero when both times are equal
     */
    ShiftVector rotationShift(Frame frame, Frame reference);
}
