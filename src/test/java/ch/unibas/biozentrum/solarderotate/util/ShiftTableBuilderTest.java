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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import ch.unibas.biozentrum.solarderotate.exceptions.InvalidScaleException;
import ch.unibas.biozentrum.solarderotate.exceptions.ReferenceIndexOutOfRangeException;
import ch.unibas.biozentrum.solarderotate.exceptions.ShapeMismatchException;

public class ShiftTableBuilderTest {
    private static final int SIZE = 48;
    private static final double SCALE = 0.5;

    private final ShiftTableBuilder builder = new ShiftTableBuilder(new CrossCorrelationEstimator(), ConstantRateRotationModel.NONE);

    private static Frame blobFrame(final double cx, final double cy, final int minutes)
    {
        return SyntheticFrames.frame(SyntheticFrames.blob(SIZE, SIZE, cx, cy, 3.0), SIZE, SIZE,
                SyntheticFrames.T0.plus(Duration.ofMinutes(minutes)), SCALE);
    }

    private static List<Frame> movingSequence()
    {
        return Arrays.asList(blobFrame(23.0, 24.0, 0), blobFrame(24.5, 23.2, 10), blobFrame(21.3, 25.0, 20), blobFrame(23.0, 22.0, 30));
    }

    @Test
    public void testReferenceEntryIsZero()
    {
        ShiftTable table = builder.buildShiftTable(movingSequence(), 2);
        assertEquals(4, table.size());
        assertSame(ShiftVector.ZERO, table.get(2));
        assertEquals(0.0, table.getX()[2], 0.0);
        assertEquals(0.0, table.getY()[2], 0.0);
    }

    @Test
    public void testShiftsAreAngularCorrections()
    {
        ShiftTable table = builder.buildShiftTable(movingSequence(), 0);
        // Frame 1 moved by (+1.5, -0.8) px, the correction is the opposite in arcsec
        assertEquals(-1.5 * SCALE, table.get(1).getX(), 0.05);
        assertEquals(0.8 * SCALE, table.get(1).getY(), 0.05);
        assertEquals(2.0 * SCALE, table.get(3).getY(), 0.05);
    }

    @Test
    public void testCompositionAcrossReferences()
    {
        List<Frame> sequence = movingSequence();
        ShiftTable fromFirst = builder.buildShiftTable(sequence, 0);
        ShiftTable fromThird = builder.buildShiftTable(sequence, 2);
        for(int i = 0; i < sequence.size(); i++)
        {
            ShiftVector composed = fromFirst.get(i).minus(fromFirst.get(2));
            assertEquals(composed.getX(), fromThird.get(i).getX(), 0.05, "frame " + i);
            assertEquals(composed.getY(), fromThird.get(i).getY(), 0.05, "frame " + i);
        }
    }

    @Test
    public void testRepeatedRunsAreIdentical()
    {
        List<Frame> sequence = movingSequence();
        ShiftTable first = builder.buildShiftTable(sequence, 1);
        ShiftTable second = builder.buildShiftTable(sequence, 1);
        assertArrayEquals(first.getX(), second.getX());
        assertArrayEquals(first.getY(), second.getY());
    }

    private static List<Frame> driftingSequence()
    {
        // Content drifts by (+3, -1) px per hour at 0.6"/px
        List<Frame> sequence = new ArrayList<Frame>();
        for(int i = 0; i < 3; i++)
        {
            sequence.add(SyntheticFrames.frame(SyntheticFrames.field(64, 48, 7L, 3.0 * i, -1.0 * i), 64, 48,
                    SyntheticFrames.T0.plus(Duration.ofHours(i)), 0.6));
        }
        return sequence;
    }

    @Test
    public void testDriftPredictedByTheModelIsCountedOnce()
    {
        ShiftTableBuilder rotating = new ShiftTableBuilder(new CrossCorrelationEstimator(),
                new ConstantRateRotationModel(1.8 / 3600.0, -0.6 / 3600.0));
        ShiftTable table = rotating.buildShiftTable(driftingSequence(), 0);
        assertArrayEquals(new double[] {0.0, -1.8, -3.6}, table.getX(), 0.03);
        assertArrayEquals(new double[] {0.0, 0.6, 1.2}, table.getY(), 0.03);
    }

    @Test
    public void testDriftIsMeasuredWithoutModel()
    {
        ShiftTable table = builder.buildShiftTable(driftingSequence(), 0);
        assertArrayEquals(new double[] {0.0, -1.8, -3.6}, table.getX(), 0.03);
        assertArrayEquals(new double[] {0.0, 0.6, 1.2}, table.getY(), 0.03);
    }

    @Test
    public void testResidualIsAddedToThePrediction()
    {
        // The model predicts only two thirds of the drift, the rest is measured
        ShiftTableBuilder rotating = new ShiftTableBuilder(new CrossCorrelationEstimator(),
                new ConstantRateRotationModel(1.2 / 3600.0, -0.4 / 3600.0));
        ShiftTable table = rotating.buildShiftTable(driftingSequence(), 0);
        assertArrayEquals(new double[] {0.0, -1.8, -3.6}, table.getX(), 0.03);
        assertArrayEquals(new double[] {0.0, 0.6, 1.2}, table.getY(), 0.03);
    }

    @Test
    public void testRotationOnlyModeIgnoresContent()
    {
        double[] scene = SyntheticFrames.scene(51, 25);
        List<Frame> sequence = new ArrayList<Frame>();
        for(int i = 0; i < 3; i++)
        {
            sequence.add(SyntheticFrames.frame(scene, 51, 25, SyntheticFrames.T0.plus(Duration.ofHours(i)), 0.6));
        }
        ShiftTableBuilder rotating = new ShiftTableBuilder(new CrossCorrelationEstimator(),
                new ConstantRateRotationModel(9.1 / 3600.0, -0.2068 / 3600.0), false);
        ShiftTable table = rotating.buildShiftTable(sequence, 0);
        assertArrayEquals(new double[] {0.0, -9.1, -18.2}, table.getX(), 1e-6);
        assertArrayEquals(new double[] {0.0, 0.2068, 0.4136}, table.getY(), 1e-6);
    }

    @Test
    public void testIdenticalFramesNeedNoCorrectionWhenMeasured()
    {
        double[] scene = SyntheticFrames.scene(51, 25);
        List<Frame> sequence = new ArrayList<Frame>();
        for(int i = 0; i < 2; i++)
        {
            sequence.add(SyntheticFrames.frame(scene, 51, 25, SyntheticFrames.T0.plus(Duration.ofHours(i)), 0.6));
        }
        ShiftTable table = builder.buildShiftTable(sequence, 0);
        assertEquals(0.0, table.get(1).getX(), 1e-6);
        assertEquals(0.0, table.get(1).getY(), 1e-6);
    }

    @Test
    public void testReferenceIndexOutOfRange()
    {
        List<Frame> sequence = movingSequence();
        ReferenceIndexOutOfRangeException ex = assertThrows(ReferenceIndexOutOfRangeException.class,
                () -> builder.buildShiftTable(sequence, 4));
        assertEquals(4, ex.getReferenceIndex());
        assertEquals(4, ex.getSequenceLength());
        assertThrows(ReferenceIndexOutOfRangeException.class, () -> builder.buildShiftTable(sequence, -1));
        assertThrows(ReferenceIndexOutOfRangeException.class, () -> builder.buildShiftTable(Collections.<Frame>emptyList(), 0));
    }

    @Test
    public void testShapeMismatch()
    {
        List<Frame> sequence = new ArrayList<Frame>(movingSequence());
        sequence.add(SyntheticFrames.frame(SyntheticFrames.blob(SIZE, SIZE - 1, 23.0, 23.0, 3.0), SIZE, SIZE - 1));
        assertThrows(ShapeMismatchException.class, () -> builder.buildShiftTable(sequence, 0));
        Frame tiny = SyntheticFrames.frame(SyntheticFrames.noise(3, 3, 1L), 3, 3);
        assertThrows(ShapeMismatchException.class, () -> builder.buildShiftTable(Arrays.asList(tiny, tiny), 0));
    }

    @Test
    public void testInvalidScaleIsRejectedBeforeEstimation()
    {
        List<Frame> sequence = new ArrayList<Frame>(movingSequence());
        sequence.add(new Frame(new double[SIZE * SIZE], SIZE, SIZE, SyntheticFrames.T0, 0.0, SCALE, 0.0, 0.0, null));
        // The flat last frame would fail the estimate, the scale check comes first
        assertThrows(InvalidScaleException.class, () -> builder.buildShiftTable(sequence, 0));
    }
}
