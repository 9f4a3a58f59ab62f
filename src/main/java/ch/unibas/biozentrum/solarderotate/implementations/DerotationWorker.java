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

import java.util.concurrent.BrokenBarrierException;

import ch.unibas.biozentrum.solarderotate.abstracts.FrameWorker;
import ch.unibas.biozentrum.solarderotate.exceptions.DerotationException;
import ch.unibas.biozentrum.solarderotate.util.BSplineShifter;
import ch.unibas.biozentrum.solarderotate.util.Frame;

/**
 * Estimates frame shifts until none are left, waits for the other workers,
 * then shifts and crops frames until none are left.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public class DerotationWorker extends FrameWorker
{
    private final SharedContextAlignmentTarget scat = new SharedContextAlignmentTarget();

    DerotationWorker(final AbstractSharedContext sharedContext)
    {
        super(sharedContext);
    }

    @Override
    public void run()
    {
        try
        {
            while(!sharedContext.getNextAlignmentTarget(scat))
            {
                sharedContext.setShift(scat.index, sharedContext.builder.estimateFrameShift(scat.reference, scat.frame));
            }
        }
        catch(RuntimeException ex)
        {
            sharedContext.reportFailure(ex, scat.index);
        }
        catch(Error err)
        {
            // Recorded for the caller, the barrier below must still be reached
            sharedContext.reportFailure(err, scat.index);
        }
        // Every worker must reach the barrier, even after a failure, otherwise the others wait forever
        try
        {
            sharedContext.workerSynchronizationBarrier.await();
        }
        catch(InterruptedException ex)
        {
            sharedContext.reportFailure(new DerotationException("Interrupted while waiting for the other workers.", ex), -1);
            Thread.currentThread().interrupt();
            return;
        }
        catch(BrokenBarrierException ex)
        {
            sharedContext.reportFailure(new DerotationException("The worker synchronization barrier was broken.", ex), -1);
            return;
        }
        try
        {
            while(!sharedContext.getNextTransformationTarget(scat))
            {
                Frame shifted = BSplineShifter.shiftFrame(scat.frame, scat.pixelShift);
                if(scat.clipBounds != null)
                {
                    shifted = shifted.crop(scat.clipBounds);
                }
                sharedContext.setOutputFrame(scat.index, shifted);
            }
        }
        catch(RuntimeException ex)
        {
            sharedContext.reportFailure(ex, scat.index);
        }
        catch(Error err)
        {
            sharedContext.reportFailure(err, scat.index);
        }
    }
}
