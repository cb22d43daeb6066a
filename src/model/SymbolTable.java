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
import java.util.concurrent.atomic.AtomicInteger;

import gnu.trove.map.hash.TIntObjectHashMap;

//  Per-model table of variables and source of fresh variable identities.
//  Append-only: variables are added but never removed or changed.

public class SymbolTable {
    //  Shared between a table and its copies so that identities stay unique
    //  across every working copy of one model.
    private final AtomicInteger counter;

    private final ArrayList<Variable> variables;
    private final TIntObjectHashMap<Variable> byId;

    //  For each auxiliary variable id, the expression it stands for (for output only).
    private final TIntObjectHashMap<String> represents;

    public SymbolTable() {
        counter=new AtomicInteger(0);
        variables=new ArrayList<Variable>();
        byId=new TIntObjectHashMap<Variable>();
        represents=new TIntObjectHashMap<String>();
    }

    private SymbolTable(SymbolTable st) {
        counter=st.counter;
        variables=new ArrayList<Variable>(st.variables);
        byId=new TIntObjectHashMap<Variable>(st.byId);
        represents=new TIntObjectHashMap<String>(st.represents);
    }

    //  New table sharing the existing variables and the identity counter.
    public SymbolTable copy() {
        return new SymbolTable(this);
    }

    public Identifier newIntegerVariable(String name, long lb, long ub) {
        if(lb>ub) {
            throw ModelException.typeError("empty domain "+lb+".."+ub, "model", name);
        }
        return add(name, lb, ub, false, false);
    }

    public Identifier newBooleanVariable(String name) {
        return add(name, 0, 1, true, false);
    }

    public Identifier newAuxiliaryVariable(long lb, long ub) {
        assert lb<=ub;
        return add(null, lb, ub, false, true);
    }

    public Identifier newAuxiliaryBoolean() {
        return add(null, 0, 1, true, true);
    }

    //  Make an auxiliary variable for an expression, with a domain taken from
    //  the bounds of the expression.
    public Identifier newAuxHelper(ASTNode exp) {
        Identifier aux;
        if(exp.isRelation()) {
            aux=newAuxiliaryBoolean();
        }
        else {
            Intpair b=exp.getBounds();
            aux=newAuxiliaryVariable(b.lower, b.upper);
        }
        auxVarRepresents(aux.getVariable(), exp);
        return aux;
    }

    public void auxVarRepresents(Variable aux, ASTNode exp) {
        represents.put(aux.getId(), exp.toString());
    }

    public String getRepresents(Variable aux) {
        return represents.get(aux.getId());
    }

    private Identifier add(String name, long lb, long ub, boolean bool, boolean aux) {
        int id=counter.getAndIncrement();
        if(name==null) {
            name=(bool ? "aux_b" : "aux")+id;
        }
        Variable v=new Variable(id, name, lb, ub, bool, aux);
        synchronized(this) {
            variables.add(v);
            byId.put(id, v);
        }
        return new Identifier(v);
    }

    public synchronized Variable getVariable(int id) {
        return byId.get(id);
    }

    public synchronized boolean hasVariable(int id) {
        return byId.containsKey(id);
    }

    public synchronized ArrayList<Variable> getVariables() {
        return new ArrayList<Variable>(variables);
    }

    public synchronized int numAuxiliaries() {
        int n=0;
        for(Variable v : variables) {
            if(v.isAuxiliary()) {
                n++;
            }
        }
        return n;
    }

    public synchronized String toString() {
        StringBuilder b=new StringBuilder();
        for(Variable v : variables) {
            b.append("find ");
            b.append(v.declaration());
            if(v.isAuxiliary() && represents.containsKey(v.getId())) {
                b.append("  $ ");
                b.append(represents.get(v.getId()));
            }
            b.append("\n");
        }
        return b.toString();
    }
}
