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

package ch.unibas.biozentrum.solarderotate.exceptions;

/**
 * The cross-correlation surface between a frame and the reference has no
 * single well-defined peak, so the frame cannot be registered.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public class AlignmentFailureException extends DerotationException {
    private static final long serialVersionUID = 1L;

    public AlignmentFailureException(final String message)
    {
        super(message);
    }
}
