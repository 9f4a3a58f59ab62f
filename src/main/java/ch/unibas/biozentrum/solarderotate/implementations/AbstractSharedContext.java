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

import java.io.PrintWriter;
import java.util.concurrent.CyclicBarrier;

import org.scijava.log.LogService;

import ch.unibas.biozentrum.solarderotate.util.Frame;
import ch.unibas.biozentrum.solarderotate.util.ShiftTableBuilder;
import ch.unibas.biozentrum.solarderotate.util.ShiftVector;

/*
 * Must be in this package, because methods cannot be internal to another package
 */

/**
 * State shared by the workers of one derotation run. Hands out frames one at
 * a time and collects the per-frame results by index.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public abstract class AbstractSharedContext
{
    ShiftTableBuilder builder;
    LogService logService;
    CyclicBarrier workerSynchronizationBarrier = null;

    public abstract int getNrOfFrames();
    abstract void addParties(int participants);
    abstract boolean getNextAlignmentTarget(final SharedContextAlignmentTarget target);
    abstract boolean getNextTransformationTarget(final SharedContextAlignmentTarget target);
    abstract void setShift(final int index, final ShiftVector shift);
    abstract void setOutputFrame(final int index, final Frame frame);
    abstract void reportFailure(final RuntimeException ex, final int index);
    abstract void reportFailure(final Error error, final int index);
    /**
     * Makes every worker stop taking new frames.
     */
    public abstract void abort(final RuntimeException reason);
    /**
     * Rethrows the first failure of any worker, unchanged. This may be an
     * {@link Error}.
     */
    public abstract void throwIfFailed();
    public abstract void serializeTransformations(final PrintWriter out);
}
