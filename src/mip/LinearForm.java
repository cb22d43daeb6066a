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

//  Output of linearization: linear constraints over integer variables with
//  bounds, and an optional linear objective.

public final class LinearForm {
    private final ArrayList<LinearConstraint> constraints;
    private final LinearExpr objective;
    private final boolean minimising;

    public LinearForm(List<LinearConstraint> cons, LinearExpr obj, boolean min) {
        constraints=new ArrayList<LinearConstraint>(cons);
        objective=obj;
        minimising=min;
    }

    public List<LinearConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public LinearExpr getObjective() {
        return objective;
    }

    public boolean hasObjective() {
        return objective!=null;
    }

    public boolean isMinimising() {
        return minimising;
    }

    //  Variables in order of first use, objective last.
    public ArrayList<Variable> getVariables() {
        LinkedHashSet<Variable> vars=new LinkedHashSet<Variable>();
        for(LinearConstraint c : constraints) {
            vars.addAll(c.getCoefficients().keySet());
        }
        if(objective!=null) {
            vars.addAll(objective.getCoefficients().keySet());
        }
        return new ArrayList<Variable>(vars);
    }

    //  Every constraint holds and every variable is within its bounds.
    public boolean satisfiedBy(Solution s) {
        for(Variable v : getVariables()) {
            if(!v.getBounds().contains(s.getValue(v))) {
                return false;
            }
        }
        for(LinearConstraint c : constraints) {
            if(!c.satisfiedBy(s)) {
                return false;
            }
        }
        return true;
    }

    public long objectiveValue(Solution s) {
        return objective.evaluate(s);
    }

    public String toString() {
        StringBuilder b=new StringBuilder();
        if(objective!=null) {
            b.append(minimising ? "Minimize\n" : "Maximize\n");
            b.append("    ");
            b.append(objective);
            b.append("\n");
        }
        b.append("Subject To\n");
        for(LinearConstraint c : constraints) {
            b.append("    ");
            b.append(c);
            b.append("\n");
        }
        b.append("Bounds\n");
        for(Variable v : getVariables()) {
            b.append("    ");
            b.append(v.getLower());
            b.append(" <= ");
            b.append(v.getName());
            b.append(" <= ");
            b.append(v.getUpper());
            b.append("\n");
        }
        b.append("End\n");
        return b.toString();
    }
}
