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

//  Integer division, truncating toward zero. Undefined when the divisor is 0.

public class Divide extends BinOp {
    public Divide(ASTNode l, ASTNode r) {
        super(l, r);
    }

    public ASTNode copy(ASTNode[] ch) {
        return new Divide(ch[0], ch[1]);
    }

    public boolean isTotal() {
        return !getChild(1).getBounds().contains(0) && super.isTotal();
    }

    public Intpair getBounds() {
        Intpair a=getChild(0).getBounds();
        Intpair b=getChild(1).getBounds();
        long lo=Long.MAX_VALUE;
        long hi=Long.MIN_VALUE;
        // For a fixed dividend the quotient is monotone on each side of 0,
        // so the extremes are at the ends of the positive and negative parts.
        long[] divs=new long[4];
        int n=0;
        if(b.upper>=1) {
            divs[n++]=Math.max(1, b.lower);
            divs[n++]=b.upper;
        }
        if(b.lower<=-1) {
            divs[n++]=b.lower;
            divs[n++]=Math.min(-1, b.upper);
        }
        if(n==0) {
            return new Intpair(0, 0);
        }
        for(int i=0; i<n; i++) {
            long d=divs[i];
            long x=div(a.lower, d);
            long y=div(a.upper, d);
            lo=Math.min(lo, Math.min(x, y));
            hi=Math.max(hi, Math.max(x, y));
        }
        return new Intpair(lo, hi);
    }

    //  Truncating division that saturates instead of overflowing.
    public static long div(long a, long b) {
        if(a==Long.MIN_VALUE && b==-1) {
            return Long.MAX_VALUE;
        }
        return a/b;
    }

    public ASTNode simplify() {
        ASTNode a=getChild(0);
        ASTNode b=getChild(1);
        if(b.isConstant()) {
            long d=b.getValue();
            if(d==1) {
                return a;
            }
            if(d==-1) {
                return WeightedSum.negative(a);
            }
            if(d!=0 && a.isConstant()) {
                return NumberConstant.make(div(a.getValue(), d));
            }
        }
        return null;
    }

    public Long evaluate(Solution s) {
        long[] v=evaluateChildren(s);
        if(v==null || v[1]==0) {
            return null;
        }
        return div(v[0], v[1]);
    }

    public String toString() {
        return "("+getChild(0)+" // "+getChild(1)+")";
    }
}
