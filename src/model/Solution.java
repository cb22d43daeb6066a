package jermyn;
/*

    Jermyn
    Copyright (C) 2024-2026 The Jermyn authors
    
    This file is part of Jermyn.
    
    Jermyn is free software: you can redistribute it and/or modify
    it under the terms of the GNU General Public License as published by
    the Free Software Foundation, either version 3 of the License, or
    (at your option) any later version.
    
    Jermyn is distributed in the hope that it will be useful,
    but WITHOUT ANY WARRANTY; without even the implied warranty of
    MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
    GNU General Public License for more details.
    
    You should have received a copy of the GNU General Public License
    along with Jermyn.  If not, see <http://www.gnu.org/licenses/>.

*/

import java.util.*;

import gnu.trove.map.hash.TIntLongHashMap;

//  An assignment of values to variables, keyed by variable identity.
//  Used for checking models and reformulations against each other.

public class Solution {
    private final TIntLongHashMap values=new TIntLongHashMap();

    public Solution() {}

    public Solution(Solution other) {
        values.putAll(other.values);
    }

    public void setValue(Variable v, long val) {
        values.put(v.getId(), val);
    }

    public boolean hasValue(Variable v) {
        return values.containsKey(v.getId());
    }

    public long getValue(Variable v) {
        if(!values.containsKey(v.getId())) {
            throw new NoSuchElementException("No value for variable "+v);
        }
        return values.get(v.getId());
    }

    public void clear(Variable v) {
        values.remove(v.getId());
    }

    public int size() {
        return values.size();
    }

    //  True if every constraint evaluates to true. Variables without a value
    //  make this throw.
    public boolean satisfies(List<ASTNode> constraints) {
        for(ASTNode c : constraints) {
            Long v=c.evaluate(this);
            if(v==null || v!=1L) {
                return false;
            }
        }
        return true;
    }

    public String toString() {
        int[] keys=values.keys();
        Arrays.sort(keys);
        StringBuilder b=new StringBuilder("{");
        for(int i=0; i<keys.length; i++) {
            if(i>0) {
                b.append(", ");
            }
            b.append(keys[i]);
            b.append("=");
            b.append(values.get(keys[i]));
        }
        b.append("}");
        return b.toString();
    }
}
