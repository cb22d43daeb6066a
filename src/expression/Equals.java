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

//  Equality of two numerical or two boolean expressions. A boolean variable
//  on one side and a relation on the other is a full reification.

public class Equals extends BinOp {
    public Equals(ASTNode l, ASTNode r) {
        super(l, r);
    }

    public ASTNode copy(ASTNode[] ch) {
        return new Equals(ch[0], ch[1]);
    }

    public boolean isRelation() {
        return true;
    }

    public ASTNode simplify() {
        ASTNode a=getChild(0);
        ASTNode b=getChild(1);

        if(a.isConstant() && b.isConstant()) {
            return new BooleanConstant(a.getValue()==b.getValue());
        }

        // boolexpr = 1 is boolexpr, boolexpr = 0 is its negation.
        for(int side=0; side<2; side++) {
            ASTNode r=getChild(side);
            ASTNode c=getChild(1-side);
            if(r.isRelation() && c.isConstant()) {
                if(c.getValue()==1) {
                    return r;
                }
                if(c.getValue()==0) {
                    return new Negate(r);
                }
                return new BooleanConstant(false);
            }
        }

        if(operandsTotal()) {
            if(a.equals(b)) {
                return new BooleanConstant(true);
            }
            Intpair p=a.getBounds();
            Intpair q=b.getBounds();
            if(p.upper<q.lower || q.upper<p.lower) {
                return new BooleanConstant(false);
            }
        }

        ASTNode[] sh=shiftConstant();
        if(sh!=null) {
            return new Equals(sh[0], sh[1]);
        }
        return null;
    }

    @Override
    public boolean isNegatable() {
        return true;
    }
    @Override
    public ASTNode negation() {
        return new NotEqual(getChild(0), getChild(1));
    }

    @Override
    public boolean childrenAreSymmetric() {
        return true;
    }

    public Long evaluate(Solution s) {
        long[] v=evaluateChildren(s);
        if(v==null) {
            return 0L;
        }
        return bool(v[0]==v[1]);
    }

    public String toString() {
        return "("+getChild(0)+" = "+getChild(1)+")";
    }
}
