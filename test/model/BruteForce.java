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

import static com.google.common.truth.Truth.assertWithMessage;

//  Exhaustive search over small domains, for comparing a model with its
//  reformulation.

final class BruteForce {
    private BruteForce() {}

    //  Something that can be checked once all the variables in its scope have values.
    interface Check {
        Collection<Variable> scope();
        boolean holds(Solution s);
    }

    static Check of(final ASTNode c) {
        return new Check() {
            public Collection<Variable> scope() {
                return c.getVariables();
            }
            public boolean holds(Solution s) {
                Long v=c.evaluate(s);
                return v!=null && v==1L;
            }
            public String toString() {
                return c.toString();
            }
        };
    }

    static Check of(final LinearConstraint c) {
        return new Check() {
            public Collection<Variable> scope() {
                return c.getCoefficients().keySet();
            }
            public boolean holds(Solution s) {
                return c.satisfiedBy(s);
            }
            public String toString() {
                return c.toString();
            }
        };
    }

    static List<Check> checks(List<ASTNode> cons) {
        ArrayList<Check> out=new ArrayList<Check>();
        for(ASTNode c : cons) {
            out.add(of(c));
        }
        return out;
    }

    static List<Check> linearChecks(LinearForm lf) {
        ArrayList<Check> out=new ArrayList<Check>();
        for(LinearConstraint c : lf.getConstraints()) {
            out.add(of(c));
        }
        return out;
    }

    //  Every assignment of values within the bounds of the variables.
    static List<Solution> assignments(List<Variable> vars) {
        ArrayList<Solution> out=new ArrayList<Solution>();
        enumerate(vars, 0, new Solution(), out);
        return out;
    }

    private static void enumerate(List<Variable> vars, int k, Solution cur, List<Solution> out) {
        if(k==vars.size()) {
            out.add(new Solution(cur));
            return;
        }
        Variable v=vars.get(k);
        for(long val=v.getLower(); val<=v.getUpper(); val++) {
            cur.setValue(v, val);
            enumerate(vars, k+1, cur, out);
        }
        cur.clear(v);
    }

    //  Values for the free variables such that every check holds, or null.
    //  Each check is tested as soon as its scope is assigned.
    static Solution extend(Solution partial, List<Variable> free, List<Check> checks) {
        HashMap<Variable, Integer> pos=new HashMap<Variable, Integer>();
        for(int i=0; i<free.size(); i++) {
            pos.put(free.get(i), i);
        }
        ArrayList<ArrayList<Check>> at=new ArrayList<ArrayList<Check>>();
        for(int i=0; i<=free.size(); i++) {
            at.add(new ArrayList<Check>());
        }
        for(Check c : checks) {
            int last=-1;
            for(Variable v : c.scope()) {
                Integer p=pos.get(v);
                if(p!=null) {
                    last=Math.max(last, p);
                }
                else if(!partial.hasValue(v)) {
                    throw new IllegalStateException("No value for "+v+" in "+c);
                }
            }
            at.get(last+1).add(c);
        }
        Solution s=new Solution(partial);
        for(Check c : at.get(0)) {
            if(!c.holds(s)) {
                return null;
            }
        }
        return search(s, free, at, 0) ? s : null;
    }

    private static boolean search(Solution s, List<Variable> free, List<ArrayList<Check>> at, int k) {
        if(k==free.size()) {
            return true;
        }
        Variable v=free.get(k);
        for(long val=v.getLower(); val<=v.getUpper(); val++) {
            s.setValue(v, val);
            boolean ok=true;
            for(Check c : at.get(k+1)) {
                if(!c.holds(s)) {
                    ok=false;
                    break;
                }
            }
            if(ok && search(s, free, at, k+1)) {
                return true;
            }
        }
        s.clear(v);
        return false;
    }

    //  Decision variables of a model. Passes add auxiliaries to a shared
    //  symbol table, so these are told apart by the auxiliary flag.
    static List<Variable> decisionVariables(Model original) {
        ArrayList<Variable> out=new ArrayList<Variable>();
        for(Variable v : original.global_symbols.getVariables()) {
            if(!v.isAuxiliary()) {
                out.add(v);
            }
        }
        return out;
    }

    //  Variables of the reformulation that the original model does not have,
    //  in order of creation.
    static List<Variable> newVariables(Model original, Collection<Variable> reformulated) {
        HashSet<Variable> orig=new HashSet<Variable>(decisionVariables(original));
        ArrayList<Variable> out=new ArrayList<Variable>();
        for(Variable v : reformulated) {
            if(!orig.contains(v)) {
                out.add(v);
            }
        }
        Collections.sort(out, new Comparator<Variable>() {
            public int compare(Variable a, Variable b) {
                return Integer.compare(a.getId(), b.getId());
            }
        });
        return out;
    }

    //  For every assignment to the original variables, the original model is
    //  satisfied exactly when the checks can be satisfied by some values of
    //  the new variables.
    static void assertEquisatisfiable(Model original, List<Check> checks, Collection<Variable> reformulatedVars) {
        List<Variable> free=newVariables(original, reformulatedVars);
        for(Solution s : assignments(decisionVariables(original))) {
            boolean expected=original.satisfiedBy(s);
            boolean got=extend(s, free, checks)!=null;
            assertWithMessage("assignment "+s+" of\n"+original+"reformulated as "+checks).that(got).isEqualTo(expected);
        }
    }

    static void assertEquisatisfiable(Model original, Model flat) {
        assertEquisatisfiable(original, checks(flat.getConstraints()), flat.getVariables());
    }

    static void assertEquisatisfiable(Model original, LinearForm lf) {
        assertEquisatisfiable(original, linearChecks(lf), lf.getVariables());
    }
}
