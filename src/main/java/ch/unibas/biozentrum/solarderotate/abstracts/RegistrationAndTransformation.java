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

import ch.unibas.biozentrum.solarderotate.implementations.AbstractSharedContext;

/**
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public abstract class RegistrationAndTransformation {
    protected final AbstractSharedContext sharedContext;

    protected RegistrationAndTransformation(final AbstractSharedContext sharedContext)
    {
        this.sharedContext = sharedContext;
    }

    /**
     * Must be called once the results have been collected, nothing may be
     * called on the instance afterwards.
     */
    public abstract void release();

    /**
     * Starts the shift estimation and, if requested by the shared context,
     * the transformation of the frames.
     * <p>
     * Usually this will start worker threads processing separate frames, the
     * results end up in the shared context.
     */
    public abstract void register();

    /**
     * Blocks until every worker is done. When interrupted the workers are
     * told to stop and the interruption is passed on.
     *
     * @throws InterruptedException
     */
    public abstract void waitForFinish() throws InterruptedException;
}
