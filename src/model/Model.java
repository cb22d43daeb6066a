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

//  A constraint model: an ordered list of constraints and at most one
//  objective, over the variables of a symbol table. Passes never change a
//  model in place; they build a new Model that shares the symbol table.

public class Model {
    public final SymbolTable global_symbols;

    private final ArrayList<ASTNode> constraints;
    private ASTNode objective;
    private boolean minimising;

    public Model() {
        this(new SymbolTable());
    }

    public Model(SymbolTable st) {
        global_symbols=st;
        constraints=new ArrayList<ASTNode>();
    }

    public Model(SymbolTable st, List<ASTNode> cons, ASTNode obj, boolean min) {
        global_symbols=st;
        constraints=new ArrayList<ASTNode>(cons);
        objective=obj;
        minimising=min;
    }

    public Identifier newIntVar(String name, long lb, long ub) {
        return global_symbols.newIntegerVariable(name, lb, ub);
    }

    public Identifier newBoolVar(String name) {
        return global_symbols.newBooleanVariable(name);
    }

    //  Appends constraints. Each must be boolean-valued.
    public Model add(ASTNode... cons) {
        for(ASTNode c : cons) {
            if(!c.isRelation()) {
                throw ModelException.typeError("non-boolean constraint", "model", c);
            }
            constraints.add(c);
        }
        return this;
    }

    public Model add(List<ASTNode> cons) {
        return add(cons.toArray(new ASTNode[cons.size()]));
    }

    public void minimize(ASTNode e) {
        objective=e;
        minimising=true;
    }

    public void maximize(ASTNode e) {
        objective=e;
        minimising=false;
    }

    public boolean hasObjective() {
        return objective!=null;
    }

    public ASTNode getObjective() {
        return objective;
    }

    public boolean isMinimising() {
        return minimising;
    }

    public List<ASTNode> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public int numConstraints() {
        return constraints.size();
    }

    //  Shares expressions and variables but has its own constraint list and
    //  its own symbol table, so new auxiliaries do not appear in this model.
    public Model copy() {
        return new Model(global_symbols.copy(), constraints, objective, minimising);
    }

    //  Variables used by the constraints and the objective, in order of first use.
    public ArrayList<Variable> getVariables() {
        LinkedHashSet<Variable> vars=new LinkedHashSet<Variable>();
        for(ASTNode c : constraints) {
            c.getVariables(vars);
        }
        if(objective!=null) {
            objective.getVariables(vars);
        }
        return new ArrayList<Variable>(vars);
    }

    //  True when every constraint holds (and the objective is defined).
    public boolean satisfiedBy(Solution s) {
        return s.satisfies(constraints) && (objective==null || objective.evaluate(s)!=null);
    }

    public String toString() {
        StringBuilder b=new StringBuilder("Constraints:\n");
        for(ASTNode c : constraints) {
            b.append("    ");
            b.append(c);
            b.append("\n");
        }
        if(objective!=null) {
            b.append("Objective: ");
            b.append(minimising ? "minimize " : "maximize ");
            b.append(objective);
            b.append("\n");
        }
        return b.toString();
    }
}
