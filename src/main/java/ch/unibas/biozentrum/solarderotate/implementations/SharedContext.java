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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CyclicBarrier;

import org.scijava.log.LogService;

import ch.unibas.biozentrum.solarderotate.util.ClipBounds;
import ch.unibas.biozentrum.solarderotate.util.ClipCalculator;
import ch.unibas.biozentrum.solarderotate.util.Frame;
import ch.unibas.biozentrum.solarderotate.util.PixelShift;
import ch.unibas.biozentrum.solarderotate.util.ShiftTable;
import ch.unibas.biozentrum.solarderotate.util.ShiftTableBuilder;
import ch.unibas.biozentrum.solarderotate.util.ShiftVector;
import ch.unibas.biozentrum.solarderotate.util.UnitConverter;

/**
 * Shared context of a derotation run over one sequence.
 * <p>
 * Phase one estimates the shift of every frame except the reference. Once all
 * workers reach the barrier, the barrier action converts the shifts to pixels
 * and computes the clip bounds. Phase two shifts (and crops) every frame.
 * When the shifts are supplied by the caller phase one has nothing to do.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public class SharedContext extends AbstractSharedContext {
    final List<Frame> sequence;
    final int referenceIndex;
    final boolean clip;
    final boolean transformFrames;
    final boolean shiftsSupplied;
    final ShiftVector[] shifts;
    final Frame[] outputFrames;
    PixelShift[] pixelShifts;
    ClipBounds clipBounds;
    int currentAlignmentCount = 0;
    int currentTransformationCount = 0;
    // Either a RuntimeException or an Error
    private Throwable failure = null;

    /**
     * @param transformFrames false to stop after the shift estimation
     * @param suppliedShifts precomputed shifts, or null to estimate them
     */
    public SharedContext(final List<Frame> sequence, final int referenceIndex, final boolean clip, final boolean transformFrames,
            final ShiftTableBuilder builder, final ShiftTable suppliedShifts, final LogService logService)
    {
        ShiftTableBuilder.validate(sequence, referenceIndex);
        this.sequence = Collections.unmodifiableList(new ArrayList<Frame>(sequence));
        this.referenceIndex = referenceIndex;
        this.clip = clip;
        this.transformFrames = transformFrames;
        this.builder = builder;
        this.logService = logService;
        this.shifts = new ShiftVector[sequence.size()];
        this.outputFrames = new Frame[sequence.size()];
        if(suppliedShifts != null)
        {
            if(suppliedShifts.size() != sequence.size())
            {
                throw new IllegalArgumentException("The shift table has " + suppliedShifts.size() + " entries but the sequence has "
                        + sequence.size() + " frames.");
            }
            for(int i = 0; i < shifts.length; i++)
            {
                shifts[i] = suppliedShifts.get(i);
            }
            shiftsSupplied = true;
        }
        else
        {
            // The reference is never correlated with itself
            shifts[referenceIndex] = ShiftVector.ZERO;
            shiftsSupplied = false;
        }
    }

    private class ShiftCombinerWorker implements Runnable
    {
        @Override
        public void run()
        {
            if(hasFailed())
            {
                return;
            }
            try
            {
                PixelShift[] converted = new PixelShift[shifts.length];
                for(int i = 0; i < shifts.length; i++)
                {
                    converted[i] = UnitConverter.toPixels(shifts[i], sequence.get(i));
                }
                pixelShifts = converted;
                if(transformFrames && clip)
                {
                    Frame reference = sequence.get(referenceIndex);
                    clipBounds = ClipCalculator.computeClipBounds(Arrays.asList(converted), reference.getWidth(), reference.getHeight());
                    logService.info("Clipping the derotated frames to " + clipBounds);
                }
            }
            catch(RuntimeException ex)
            {
                reportFailure(ex, -1);
            }
            catch(Error err)
            {
                reportFailure(err, -1);
            }
        }
    }

    @Override
    public int getNrOfFrames()
    {
        return sequence.size();
    }

    @Override
    void addParties(final int participants)
    {
        // WARNING: THIS MUST BE CALLED !!!BEFORE!!! any threads are actually run
        if(workerSynchronizationBarrier == null)
        {
            workerSynchronizationBarrier = new CyclicBarrier(participants, new ShiftCombinerWorker());
        }
        else
        {
            workerSynchronizationBarrier = new CyclicBarrier(participants + workerSynchronizationBarrier.getParties(), new ShiftCombinerWorker());
        }
    }

    @Override
    synchronized boolean getNextAlignmentTarget(final SharedContextAlignmentTarget target)
    {
        // Returns true when done
        if(shiftsSupplied || failure != null)
        {
            return true;
        }
        if(currentAlignmentCount == referenceIndex)
        {
            currentAlignmentCount++;
        }
        if(currentAlignmentCount >= sequence.size())
        {
            return true;
        }
        target.index = currentAlignmentCount++;
        target.frame = sequence.get(target.index);
        target.reference = sequence.get(referenceIndex);
        target.pixelShift = null;
        target.clipBounds = null;
        return false;
    }

    @Override
    synchronized boolean getNextTransformationTarget(final SharedContextAlignmentTarget target)
    {
        // Returns true when done
        if(!transformFrames || failure != null)
        {
            return true;
        }
        if(currentTransformationCount >= sequence.size())
        {
            return true;
        }
        target.index = currentTransformationCount++;
        target.frame = sequence.get(target.index);
        target.reference = sequence.get(referenceIndex);
        target.pixelShift = pixelShifts[target.index];
        target.clipBounds = clip ? clipBounds : null;
        return false;
    }

    @Override
    void setShift(final int index, final ShiftVector shift)
    {
        shifts[index] = shift;
        if(logService.isDebug())
        {
            logService.debug("Frame " + index + " shift " + shift);
        }
    }

    @Override
    void setOutputFrame(final int index, final Frame frame)
    {
        outputFrames[index] = frame;
    }

    @Override
    void reportFailure(final RuntimeException ex, final int index)
    {
        recordFailure(ex, index);
    }

    @Override
    void reportFailure(final Error error, final int index)
    {
        recordFailure(error, index);
    }

    private synchronized void recordFailure(final Throwable ex, final int index)
    {
        if(failure == null)
        {
            failure = ex;
            if(index >= 0)
            {
                logService.error("Frame " + index + " failed: " + ex.getMessage());
            }
            else
            {
                logService.error(ex.getMessage());
            }
        }
    }

    @Override
    public synchronized void abort(final RuntimeException reason)
    {
        if(failure == null)
        {
            failure = reason;
        }
    }

    synchronized boolean hasFailed()
    {
        return failure != null;
    }

    @Override
    public synchronized void throwIfFailed()
    {
        if(failure instanceof Error)
        {
            throw (Error)failure;
        }
        if(failure != null)
        {
            throw (RuntimeException)failure;
        }
    }

    /**
     * Only valid after the workers finished without failure.
     */
    public ShiftTable getShiftTable()
    {
        return new ShiftTable(Arrays.asList(shifts), referenceIndex);
    }

    /**
     * @return the clip bounds, null when not clipping
     */
    public ClipBounds getClipBounds()
    {
        return clipBounds;
    }

    /**
     * Only valid after the workers finished without failure.
     */
    public List<Frame> getOutputFrames()
    {
        return Collections.unmodifiableList(new ArrayList<Frame>(Arrays.asList(outputFrames)));
    }

    @Override
    public void serializeTransformations(final PrintWriter out)
    {
        getShiftTable().serialize(out);
    }
}
