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

package ch.unibas.biozentrum.solarderotate.implementations;

import ch.unibas.biozentrum.solarderotate.util.ClipBounds;
import ch.unibas.biozentrum.solarderotate.util.Frame;
import ch.unibas.biozentrum.solarderotate.util.PixelShift;

/**
 * The unit of work handed to a worker. Filled in by the shared context under
 * its lock, read by the worker outside of it.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
class SharedContextAlignmentTarget
{
    int index = -1;
    Frame frame;
    Frame reference;
    PixelShift pixelShift;
    ClipBounds clipBounds; // null when not clipping
}
