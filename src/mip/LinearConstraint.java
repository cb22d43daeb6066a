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

//  sum coeff*var  op  rhs

public final class LinearConstraint {
    public enum Op {
        LE("<="), GE(">="), EQ("==");

        private final String symbol;

        Op(String s) {
            symbol=s;
        }

        public String toString() {
            return symbol;
        }
    }

    private final LinkedHashMap<Variable, Long> coeffs;
    private final Op op;
    private final long rhs;

    //  expr op 0, with the constant of expr moved to the right.
    public LinearConstraint(LinearExpr expr, Op op) {
        coeffs=new LinkedHashMap<Variable, Long>(expr.getCoefficients());
        this.op=op;
        rhs=-expr.getConstant();
    }

    public Map<Variable, Long> getCoefficients() {
        return Collections.unmodifiableMap(coeffs);
    }

    public Op getOp() {
        return op;
    }

    public long getRhs() {
        return rhs;
    }

    public boolean satisfiedBy(Solution s) {
        long lhs=0;
        for(Map.Entry<Variable, Long> t : coeffs.entrySet()) {
            lhs+=t.getValue()*s.getValue(t.getKey());
        }
        switch(op) {
            case LE:
                return lhs<=rhs;
            case GE:
                return lhs>=rhs;
            default:
                return lhs==rhs;
        }
    }

    public String toString() {
        return LinearExpr.termsToString(coeffs)+" "+op+" "+rhs;
    }
}
