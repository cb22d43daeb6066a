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

//  Sum of coefficient times variable, plus a constant.

public final class LinearExpr {
    private final LinkedHashMap<Variable, Long> coeffs=new LinkedHashMap<Variable, Long>();
    private long constant;

    public LinearExpr() {}

    public static LinearExpr constant(long c) {
        LinearExpr e=new LinearExpr();
        e.constant=c;
        return e;
    }

    public static LinearExpr var(Variable v) {
        LinearExpr e=new LinearExpr();
        e.addTerm(v, 1);
        return e;
    }

    public LinearExpr copy() {
        LinearExpr e=new LinearExpr();
        e.coeffs.putAll(coeffs);
        e.constant=constant;
        return e;
    }

    //  Adds coeff*v. A zero coefficient removes the term.
    public LinearExpr addTerm(Variable v, long coeff) {
        Long prev=coeffs.get(v);
        long c=(prev==null) ? coeff : prev+coeff;
        if(c==0) {
            coeffs.remove(v);
        }
        else {
            coeffs.put(v, c);
        }
        return this;
    }

    public LinearExpr addConstant(long c) {
        constant+=c;
        return this;
    }

    //  this += mult*other
    public LinearExpr add(LinearExpr other, long mult) {
        for(Map.Entry<Variable, Long> t : other.coeffs.entrySet()) {
            addTerm(t.getKey(), t.getValue()*mult);
        }
        constant+=other.constant*mult;
        return this;
    }

    public LinearExpr times(long mult) {
        LinearExpr e=new LinearExpr();
        return e.add(this, mult);
    }

    public long getConstant() {
        return constant;
    }

    public Map<Variable, Long> getCoefficients() {
        return Collections.unmodifiableMap(coeffs);
    }

    public boolean isConstant() {
        return coeffs.isEmpty();
    }

    public Intpair getBounds() {
        Intpair b=new Intpair(constant, constant);
        for(Map.Entry<Variable, Long> t : coeffs.entrySet()) {
            b=b.add(t.getKey().getBounds().multiply(t.getValue()));
        }
        return b;
    }

    public long evaluate(Solution s) {
        long total=constant;
        for(Map.Entry<Variable, Long> t : coeffs.entrySet()) {
            total+=t.getValue()*s.getValue(t.getKey());
        }
        return total;
    }

    public static String termsToString(Map<Variable, Long> terms) {
        StringBuilder b=new StringBuilder("{");
        boolean first=true;
        for(Map.Entry<Variable, Long> t : terms.entrySet()) {
            if(!first) {
                b.append(", ");
            }
            first=false;
            b.append(t.getKey().getName());
            b.append(":");
            b.append(t.getValue());
        }
        b.append("}");
        return b.toString();
    }

    public String toString() {
        if(constant==0) {
            return termsToString(coeffs);
        }
        return termsToString(coeffs)+(constant<0 ? " - "+(-constant) : " + "+constant);
    }
}
