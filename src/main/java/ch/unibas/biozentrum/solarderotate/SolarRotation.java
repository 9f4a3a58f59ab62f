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

package ch.unibas.biozentrum.solarderotate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.scijava.log.LogService;
import org.scijava.log.StderrLogService;

import ch.unibas.biozentrum.solarderotate.implementations.MTDerotation;
import ch.unibas.biozentrum.solarderotate.implementations.SharedContext;
import ch.unibas.biozentrum.solarderotate.util.CrossCorrelationEstimator;
import ch.unibas.biozentrum.solarderotate.util.Frame;
import ch.unibas.biozentrum.solarderotate.util.PixelShift;
import ch.unibas.biozentrum.solarderotate.util.ShiftTable;
import ch.unibas.biozentrum.solarderotate.util.ShiftTableBuilder;
import ch.unibas.biozentrum.solarderotate.util.UnitConverter;

/**
 * Entry point: computes the shifts that align a sequence of solar images to
 * a reference frame and applies them.
 * <p>
 * Every call either returns a complete result or throws the exception of the
 * first frame that failed, unchanged.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public class SolarRotation {
    public static final int MIN_SIZE = 4;

    private final DerotationSettings settings;
    private final LogService logService;
    private final ShiftTableBuilder builder;

    public SolarRotation()
    {
        this(new DerotationSettings());
    }

    public SolarRotation(final DerotationSettings settings)
    {
        this(settings, new StderrLogService());
    }

    public SolarRotation(final DerotationSettings settings, final LogService logService)
    {
        this.settings = settings;
        this.logService = logService;
        this.builder = new ShiftTableBuilder(new CrossCorrelationEstimator(settings.getAmbiguityTolerance()), settings.getRotationModel(),
                settings.isMeasureResidual());
    }

    public ShiftTable calculateSolarRotateShift(final List<Frame> sequence) throws InterruptedException
    {
        return calculateSolarRotateShift(sequence, 0);
    }

    /**
     * @return the angular shift of every frame relative to the frame at referenceIndex
     */
    public ShiftTable calculateSolarRotateShift(final List<Frame> sequence, final int referenceIndex) throws InterruptedException
    {
        logService.info("Calculating the shifts of " + sequence.size() + " frames relative to frame " + referenceIndex);
        try
        {
            if(settings.getWorkerCount() <= 1)
            {
                ShiftTable table = builder.buildShiftTable(sequence, referenceIndex);
                if(logService.isDebug())
                {
                    for(int i = 0; i < table.size(); i++)
                    {
                        logService.debug("Frame " + i + " shift " + table.get(i));
                    }
                }
                return table;
            }
            SharedContext sharedContext = new SharedContext(sequence, referenceIndex, false, false, builder, null, logService);
            run(sharedContext);
            return sharedContext.getShiftTable();
        }
        catch(RuntimeException ex)
        {
            logService.error("Shift calculation failed: " + ex.getMessage());
            throw ex;
        }
    }

    public List<Frame> mapcubeSolarDerotate(final List<Frame> sequence) throws InterruptedException
    {
        return mapcubeSolarDerotate(sequence, 0, true);
    }

    public List<Frame> mapcubeSolarDerotate(final List<Frame> sequence, final int referenceIndex, final boolean clip) throws InterruptedException
    {
        return mapcubeSolarDerotate(sequence, referenceIndex, clip, null);
    }

    /**
     * Derotates the sequence.
     *
     * @param sequence time ordered frames of one shape
     * @param referenceIndex index of the frame the others are aligned to
     * @param clip crop every output frame to the region valid in all of them
     * @param shifts precomputed shifts with one entry per frame, or null to calculate them
     * @return the derotated frames, in input order
     * @throws InterruptedException
     */
    public List<Frame> mapcubeSolarDerotate(final List<Frame> sequence, final int referenceIndex, final boolean clip, final ShiftTable shifts)
            throws InterruptedException
    {
        logService.info("Derotating " + sequence.size() + " frames relative to frame " + referenceIndex
                + (clip ? " with clipping" : "") + (shifts != null ? " using precomputed shifts" : ""));
        try
        {
            SharedContext sharedContext = new SharedContext(sequence, referenceIndex, clip, true, builder, shifts, logService);
            run(sharedContext);
            return sharedContext.getOutputFrames();
        }
        catch(RuntimeException ex)
        {
            logService.error("Derotation failed: " + ex.getMessage());
            throw ex;
        }
    }

    /**
     * The pixel shift each frame is resampled with, converted with the frame's own scale.
     */
    public List<PixelShift> pixelShifts(final List<Frame> sequence, final ShiftTable shifts)
    {
        if(sequence.size() != shifts.size())
        {
            throw new IllegalArgumentException("The shift table has " + shifts.size() + " entries but the sequence has "
                    + sequence.size() + " frames.");
        }
        List<PixelShift> result = new ArrayList<PixelShift>(sequence.size());
        for(int i = 0; i < sequence.size(); i++)
        {
            result.add(UnitConverter.toPixels(shifts.get(i), sequence.get(i)));
        }
        return Collections.unmodifiableList(result);
    }

    public DerotationSettings getSettings()
    {
        return settings;
    }

    private void run(final SharedContext sharedContext) throws InterruptedException
    {
        MTDerotation derotation = new MTDerotation(sharedContext, settings.getWorkerCount());
        logService.debug("Using " + derotation.getNrOfWorkers() + " worker threads");
        try
        {
            derotation.register();
            derotation.waitForFinish();
        }
        finally
        {
            derotation.release();
        }
        sharedContext.throwIfFailed();
    }
}
