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

import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.map.hash.TIntObjectHashMap;

//  Output of clausal encoding: clauses over numbered propositional variables
//  in DIMACS convention (variables from 1, a negative number is a negated
//  literal). Each boolean model variable has one propositional variable.
//  Further variables are introduced by the encoder and have no model
//  counterpart.

public final class ClausalForm {
    private final ArrayList<int[]> clauses=new ArrayList<int[]>();

    //  Model variable id to propositional variable. 0 is the no-entry value.
    private final TIntIntHashMap varToLit=new TIntIntHashMap();

    private final TIntObjectHashMap<Variable> litToVar=new TIntObjectHashMap<Variable>();

    private int numVars=0;

    private int trueLit=0;

    public ClausalForm() {}

    //  Propositional variable for a boolean model variable, allocated on first use.
    public int getLiteral(Variable v) {
        int lit=varToLit.get(v.getId());
        if(lit==0) {
            lit=newVariable();
            varToLit.put(v.getId(), lit);
            litToVar.put(lit, v);
        }
        return lit;
    }

    public boolean hasLiteral(Variable v) {
        return varToLit.containsKey(v.getId());
    }

    //  Model variable for a literal of either sign, or null for an encoder variable.
    public Variable getVariable(int lit) {
        return litToVar.get(Math.abs(lit));
    }

    int newVariable() {
        numVars++;
        return numVars;
    }

    //  A literal fixed to true by a unit clause.
    int getTrue() {
        if(trueLit==0) {
            trueLit=newVariable();
            addClause(trueLit);
        }
        return trueLit;
    }

    void addClause(int... lits) {
        clauses.add(lits.clone());
    }

    void addClause(List<Integer> lits) {
        int[] c=new int[lits.size()];
        for(int i=0; i<c.length; i++) {
            c[i]=lits.get(i);
        }
        clauses.add(c);
    }

    public int numVariables() {
        return numVars;
    }

    public int numClauses() {
        return clauses.size();
    }

    public List<int[]> getClauses() {
        return Collections.unmodifiableList(clauses);
    }

    //  Read back the model variables from a satisfying assignment, given as
    //  the signed literals a SAT solver reports. Encoder variables are ignored.
    public Solution decode(int[] model) {
        Solution s=new Solution();
        for(int lit : model) {
            Variable v=getVariable(lit);
            if(lit!=0 && v!=null) {
                s.setValue(v, lit>0 ? 1 : 0);
            }
        }
        return s;
    }

    //  Every clause has a literal that is true in the assignment. Variables
    //  missing from the assignment are false.
    public boolean satisfiedBy(int[] model) {
        boolean[] val=new boolean[numVars+1];
        for(int lit : model) {
            if(lit>0 && lit<=numVars) {
                val[lit]=true;
            }
        }
        for(int[] c : clauses) {
            boolean sat=false;
            for(int lit : c) {
                if((lit>0) == val[Math.abs(lit)]) {
                    sat=true;
                    break;
                }
            }
            if(!sat) {
                return false;
            }
        }
        return true;
    }

    public String toString() {
        StringBuilder b=new StringBuilder();
        b.append("p cnf ");
        b.append(numVars);
        b.append(" ");
        b.append(clauses.size());
        b.append("\n");
        for(int[] c : clauses) {
            for(int lit : c) {
                b.append(lit);
                b.append(" ");
            }
            b.append("0\n");
        }
        return b.toString();
    }
}
