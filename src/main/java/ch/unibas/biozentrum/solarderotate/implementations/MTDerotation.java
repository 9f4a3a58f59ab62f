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

import ch.unibas.biozentrum.solarderotate.abstracts.FrameWorker;
import ch.unibas.biozentrum.solarderotate.abstracts.RegistrationAndTransformation;
import ch.unibas.biozentrum.solarderotate.exceptions.DerotationException;

/**
 * Multithreaded derotation: one {@link DerotationWorker} per processor, but
 * never more workers than frames.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public class MTDerotation extends RegistrationAndTransformation {
    private final int nrOfProcessors;

    private FrameWorker[] workers;

    public MTDerotation(final AbstractSharedContext sharedContext, final int requestedWorkers)
    {
        super(sharedContext);
        nrOfProcessors = Math.max(1, Math.min(requestedWorkers, sharedContext.getNrOfFrames()));
        sharedContext.addParties(nrOfProcessors);
    }

    public int getNrOfWorkers()
    {
        return nrOfProcessors;
    }

    @Override
    public void register()
    {
        workers = new FrameWorker[nrOfProcessors];
        for(int i = 0; i < nrOfProcessors; i++)
        {
            workers[i] = new DerotationWorker(sharedContext);
        }
        for(int i = 0; i < nrOfProcessors; i++)
        {
            workers[i].start();
        }
    }

    @Override
    public void waitForFinish() throws InterruptedException
    {
        if(workers != null)
        {
            try
            {
                for(int i = 0; i < nrOfProcessors; i++)
                {
                    if(workers[i] != null && workers[i].getThread() != null)
                    {
                        workers[i].getThread().join();
                    }
                }
            }
            catch(InterruptedException ex)
            {
                sharedContext.abort(new DerotationException("The derotation was interrupted.", ex));
                for(int i = 0; i < nrOfProcessors; i++)
                {
                    if(workers[i] != null && workers[i].getThread() != null)
                    {
                        workers[i].getThread().interrupt();
                    }
                }
                throw ex;
            }
        }
    }

    @Override
    public void release()
    {
        if(workers != null)
        {
            for(int i = 0; i < nrOfProcessors; i++)
            {
                if(workers[i] != null)
                {
                    workers[i].release(); // Nothing must be called on these instances again
                }
            }
            workers = null;
        }
    }
}
