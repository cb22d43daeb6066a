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

//  What a target solving engine accepts. Decides which globals are kept,
//  whether reification is left to the target, and which terminal form the
//  pipeline produces.

public final class Capabilities {
    public enum Terminal {FLAT, LINEAR, CLAUSAL}

    private final Set<String> globals;
    private final boolean reification;
    private final boolean integerDomains;
    private final boolean nonLinear;
    private final Terminal terminal;

    public Capabilities(Collection<String> globals, boolean reification, boolean integerDomains, boolean nonLinear, Terminal terminal) {
        this.globals=Collections.unmodifiableSet(new TreeSet<String>(globals));
        this.reification=reification;
        this.integerDomains=integerDomains;
        this.nonLinear=nonLinear;
        this.terminal=terminal;
    }

    //  Constraint programming target: the given globals, native reification,
    //  integer domains and nonlinear arithmetic. Output is the flat model.
    public static Capabilities cp(String... tags) {
        return new Capabilities(Arrays.asList(tags), true, true, true, Terminal.FLAT);
    }

    //  Mixed integer programming target: linear constraints only.
    public static Capabilities mip() {
        return new Capabilities(Collections.<String>emptySet(), false, true, false, Terminal.LINEAR);
    }

    //  SAT target: boolean variables and clauses only.
    public static Capabilities sat() {
        return new Capabilities(Collections.<String>emptySet(), false, false, false, Terminal.CLAUSAL);
    }

    public boolean supportsGlobal(String tag) {
        return globals.contains(tag);
    }

    public Set<String> getGlobals() {
        return globals;
    }

    public boolean hasNativeReification() {
        return reification;
    }

    public boolean hasIntegerDomains() {
        return integerDomains;
    }

    public boolean hasNonLinear() {
        return nonLinear;
    }

    public Terminal getTerminal() {
        return terminal;
    }

    public String toString() {
        return "Capabilities(globals="+globals+", reification="+reification+", integers="+integerDomains
            +", nonlinear="+nonLinear+", terminal="+terminal+")";
    }
}
