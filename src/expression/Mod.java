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

//  Remainder of truncating division, with the sign of the dividend.
//  Undefined when the divisor is 0.

public class Mod extends BinOp {
    public Mod(ASTNode l, ASTNode r) {
        super(l, r);
    }

    public ASTNode copy(ASTNode[] ch) {
        return new Mod(ch[0], ch[1]);
    }

    public boolean isTotal() {
        return !getChild(1).getBounds().contains(0) && super.isTotal();
    }

    public Intpair getBounds() {
        Intpair a=getChild(0).getBounds();
        Intpair b=getChild(1).getBounds();
        long m=Math.max(Math.abs(b.lower), Math.abs(b.upper))-1;
        if(m<0) {
            return new Intpair(0, 0);
        }
        if(a.lower>=0) {
            return new Intpair(0, Math.min(a.upper, m));
        }
        if(a.upper<=0) {
            return new Intpair(Math.max(a.lower, -m), 0);
        }
        return new Intpair(Math.max(a.lower, -m), Math.min(a.upper, m));
    }

    public ASTNode simplify() {
        ASTNode a=getChild(0);
        ASTNode b=getChild(1);
        if(b.isConstant()) {
            long d=b.getValue();
            if((d==1 || d==-1) && a.isTotal()) {
                return NumberConstant.make(0);
            }
            if(d!=0 && a.isConstant()) {
                return NumberConstant.make(a.getValue()%d);
            }
        }
        return null;
    }

    public Long evaluate(Solution s) {
        long[] v=evaluateChildren(s);
        if(v==null || v[1]==0) {
            return null;
        }
        return v[0]%v[1];
    }

    public String toString() {
        return "("+getChild(0)+" % "+getChild(1)+")";
    }
}
