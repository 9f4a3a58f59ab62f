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

import java.util.ArrayList;
import java.util.List;

import ch.unibas.biozentrum.solarderotate.SolarRotation;
import ch.unibas.biozentrum.solarderotate.abstracts.RotationModel;
import ch.unibas.biozentrum.solarderotate.exceptions.ReferenceIndexOutOfRangeException;
import ch.unibas.biozentrum.solarderotate.exceptions.ShapeMismatchException;

/**
 * Computes the angular shift of every frame relative to a reference frame.
 * The externally supplied rotation correction is applied to the frame first,
 * the cross-correlation then measures only what the model did not predict,
 * and the shift is the sum of both. With residual measurement switched off the
 * rotation correction alone is the shift.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public class ShiftTableBuilder {
    private final CrossCorrelationEstimator estimator;
    private final RotationModel rotationModel;
    private final boolean measureResidual;

    public ShiftTableBuilder(final CrossCorrelationEstimator estimator, final RotationModel rotationModel)
    {
        this(estimator, rotationModel, true);
    }

    /**
     * @param measureResidual false skips the cross-correlation and uses the
     * rotation model alone
     */
    public ShiftTableBuilder(final CrossCorrelationEstimator estimator, final RotationModel rotationModel, final boolean measureResidual)
    {
        this.estimator = estimator;
        this.rotationModel = rotationModel;
        this.measureResidual = measureResidual;
    }

    /**
     * Checks everything that can be checked before any estimate runs: the
     * reference index, the frame shapes and the frame scales.
     */
    public static void validate(final List<Frame> sequence, final int referenceIndex)
    {
        if(referenceIndex < 0 || referenceIndex >= sequence.size())
        {
            throw new ReferenceIndexOutOfRangeException(referenceIndex, sequence.size());
        }
        Frame reference = sequence.get(referenceIndex);
        if(reference.getWidth() < SolarRotation.MIN_SIZE || reference.getHeight() < SolarRotation.MIN_SIZE)
        {
            throw new ShapeMismatchException("The frame width and height must be at least " + SolarRotation.MIN_SIZE
                    + ", got " + reference.getWidth() + "x" + reference.getHeight());
        }
        for(int i = 0; i < sequence.size(); i++)
        {
            Frame f = sequence.get(i);
            if(!f.sameShape(reference))
            {
                throw new ShapeMismatchException("Frame " + i + " is " + f.getWidth() + "x" + f.getHeight()
                        + " but the reference frame is " + reference.getWidth() + "x" + reference.getHeight());
            }
            UnitConverter.checkScale(f);
        }
    }

    /**
     * Shift of one frame relative to the reference. Only reads the two
     * frames, so it may run concurrently for different frames.
     */
    public ShiftVector estimateFrameShift(final Frame reference, final Frame frame)
    {
        ShiftVector predicted = rotationModel.rotationShift(frame, reference);
        if(!measureResidual)
        {
            return predicted;
        }
        Frame compensated = frame;
        if(predicted.getX() != 0.0 || predicted.getY() != 0.0)
        {
            compensated = BSplineShifter.shiftFrame(frame, UnitConverter.toPixels(predicted, frame));
        }
        PixelShift residual = estimator.estimateShift(reference, compensated);
        return predicted.plus(UnitConverter.toAngular(residual, frame));
    }

    public ShiftTable buildShiftTable(final List<Frame> sequence, final int referenceIndex)
    {
        validate(sequence, referenceIndex);
        Frame reference = sequence.get(referenceIndex);
        List<ShiftVector> shifts = new ArrayList<ShiftVector>(sequence.size());
        for(int i = 0; i < sequence.size(); i++)
        {
            if(i == referenceIndex)
            {
                shifts.add(ShiftVector.ZERO);
            }
            else
            {
                shifts.add(estimateFrameShift(reference, sequence.get(i)));
            }
        }
        return new ShiftTable(shifts, referenceIndex);
    }
}
