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

import ch.unibas.biozentrum.solarderotate.abstracts.RotationModel;
import ch.unibas.biozentrum.solarderotate.util.ConstantRateRotationModel;
import ch.unibas.biozentrum.solarderotate.util.CrossCorrelationEstimator;

/**
 * Run settings that stay the same across calls of one {@link SolarRotation}.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public class DerotationSettings {
    private int workerCount = Runtime.getRuntime().availableProcessors();
    private RotationModel rotationModel = ConstantRateRotationModel.NONE;
    private double ambiguityTolerance = CrossCorrelationEstimator.DEFAULT_AMBIGUITY_TOLERANCE;
    private boolean measureResidual = true;

    public int getWorkerCount()
    {
        return workerCount;
    }

    /**
     * @param workerCount number of worker threads, 1 runs everything on the calling thread
     */
    public DerotationSettings setWorkerCount(final int workerCount)
    {
        if(workerCount < 1)
        {
            throw new IllegalArgumentException("The worker count must be at least 1, got " + workerCount);
        }
        this.workerCount = workerCount;
        return this;
    }

    public RotationModel getRotationModel()
    {
        return rotationModel;
    }

    public DerotationSettings setRotationModel(final RotationModel rotationModel)
    {
        if(rotationModel == null)
        {
            throw new IllegalArgumentException("The rotation model must not be null.");
        }
        this.rotationModel = rotationModel;
        return this;
    }

    public double getAmbiguityTolerance()
    {
        return ambiguityTolerance;
    }

    public DerotationSettings setAmbiguityTolerance(final double ambiguityTolerance)
    {
        if(!(ambiguityTolerance >= 0.0 && ambiguityTolerance < 1.0))
        {
            throw new IllegalArgumentException("The ambiguity tolerance must be in [0, 1), got " + ambiguityTolerance);
        }
        this.ambiguityTolerance = ambiguityTolerance;
        return this;
    }

    public boolean isMeasureResidual()
    {
        return measureResidual;
    }

    /**
     * @param measureResidual true (the default) registers every frame against
     * the reference after applying the rotation model, false takes the rotation
     * model's shift as is without looking at the image content
     */
    public DerotationSettings setMeasureResidual(final boolean measureResidual)
    {
        this.measureResidual = measureResidual;
        return this;
    }
}
