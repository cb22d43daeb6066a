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

public class Implies extends BinOp {
    public Implies(ASTNode l, ASTNode r) {
        super(l, r);
    }

    public ASTNode copy(ASTNode[] ch) {
        return new Implies(ch[0], ch[1]);
    }

    public boolean isRelation() {
        return true;
    }
    public boolean typecheck() {
        return childrenAreRelations();
    }

    public ASTNode simplify() {
        ASTNode a=getChild(0);
        ASTNode b=getChild(1);
        if(a.isConstant()) {
            return (a.getValue()==1) ? b : new BooleanConstant(true);
        }
        if(b.isConstant()) {
            return (b.getValue()==1) ? new BooleanConstant(true) : new Negate(a);
        }
        if(a.equals(b)) {
            return new BooleanConstant(true);
        }
        return null;
    }

    //  not (a -> b)  is  a /\ not b
    @Override
    public boolean isNegatable() {
        return true;
    }
    @Override
    public ASTNode negation() {
        return new And(getChild(0), new Negate(getChild(1)));
    }

    @Override
    public int polarity(int child, int pol) {
        return (child==0) ? -pol : pol;
    }

    public Long evaluate(Solution s) {
        if(getChild(0).evaluate(s)==0L) {
            return 1L;
        }
        return getChild(1).evaluate(s);
    }

    public String toString() {
        return "("+getChild(0)+" -> "+getChild(1)+")";
    }
}
