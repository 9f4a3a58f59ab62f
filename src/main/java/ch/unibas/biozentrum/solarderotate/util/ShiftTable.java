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

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * The angular shift of every frame of a sequence relative to one reference
 * frame, in sequence order.
 *
 * @author Peter D. Ringel
 * @version 1.0.0
 *
 */
public final class ShiftTable {
    private final ShiftVector[] shifts;
    private final int referenceIndex;

    public ShiftTable(final List<ShiftVector> shifts, final int referenceIndex)
    {
        this.shifts = shifts.toArray(new ShiftVector[0]);
        for(int i = 0; i < this.shifts.length; i++)
        {
            if(this.shifts[i] == null)
            {
                throw new IllegalArgumentException("Missing shift for frame " + i);
            }
        }
        if(referenceIndex < 0 || (this.shifts.length > 0 && referenceIndex >= this.shifts.length))
        {
            throw new IllegalArgumentException("Reference index " + referenceIndex + " is outside the table of " + this.shifts.length + " shifts.");
        }
        this.referenceIndex = referenceIndex;
    }

    public int size()
    {
        return shifts.length;
    }

    public ShiftVector get(final int index)
    {
        return shifts[index];
    }

    public int getReferenceIndex()
    {
        return referenceIndex;
    }

    public List<ShiftVector> asList()
    {
        return Collections.unmodifiableList(Arrays.asList(shifts));
    }

    /**
     * @return the x shifts, one per frame
     */
    public double[] getX()
    {
        double[] retval = new double[shifts.length];
        for(int i = 0; i < shifts.length; i++)
        {
            retval[i] = shifts[i].getX();
        }
        return retval;
    }

    /**
     * @return the y shifts, one per frame
     */
    public double[] getY()
    {
        double[] retval = new double[shifts.length];
        for(int i = 0; i < shifts.length; i++)
        {
            retval[i] = shifts[i].getY();
        }
        return retval;
    }

    public JSONObject toJson()
    {
        JSONObject root = new JSONObject();
        JSONArray transformationArray = new JSONArray();
        for(ShiftVector s : shifts)
        {
            transformationArray.put(s.serialize());
        }
        root.put("ReferenceIndex", referenceIndex);
        root.put("Transformations", transformationArray);
        return root;
    }

    public void serialize(final PrintWriter out)
    {
        out.print(toJson().toString(4));
        out.flush();
    }

    public static ShiftTable parse(final String json)
    {
        JSONObject root = new JSONObject(json);
        JSONArray transformationArray = root.getJSONArray("Transformations");
        List<ShiftVector> shifts = new ArrayList<ShiftVector>(transformationArray.length());
        for(int i = 0; i < transformationArray.length(); i++)
        {
            shifts.add(ShiftVector.deserialize(transformationArray.getJSONObject(i)));
        }
        return new ShiftTable(shifts, root.getInt("ReferenceIndex"));
    }

    @Override
    public String toString()
    {
        return "ShiftTable[reference=" + referenceIndex + ", x=" + Arrays.toString(getX()) + ", y=" + Arrays.toString(getY()) + "]";
    }
}
