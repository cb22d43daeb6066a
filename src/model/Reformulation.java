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

//  Result of a run: the flat model, and the linear or clausal form when
//  the target asks for one.

public final class Reformulation {
    private final Model flat;
    private final Capabilities caps;
    private final LinearForm linear;
    private final ClausalForm clausal;
    private final LinkedHashMap<String, Integer> stats;

    Reformulation(Model flat, Capabilities caps, LinearForm linear, ClausalForm clausal, Map<String, Integer> stats) {
        this.flat=flat;
        this.caps=caps;
        this.linear=linear;
        this.clausal=clausal;
        this.stats=new LinkedHashMap<String, Integer>(stats);
    }

    public Model getFlatModel() {
        return flat;
    }

    public Capabilities getCapabilities() {
        return caps;
    }

    public boolean hasLinearForm() {
        return linear!=null;
    }

    public LinearForm getLinearForm() {
        return linear;
    }

    public boolean hasClausalForm() {
        return clausal!=null;
    }

    public ClausalForm getClausalForm() {
        return clausal;
    }

    public Map<String, Integer> getStats() {
        return Collections.unmodifiableMap(stats);
    }

    public String toString() {
        if(linear!=null) {
            return linear.toString();
        }
        if(clausal!=null) {
            return clausal.toString();
        }
        return flat.toString();
    }
}
