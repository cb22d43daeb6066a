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

//  Product of two or more expressions.

public class Times extends ASTNode {
    public Times(ArrayList<ASTNode> ch) {
        super(ch);
    }

    public Times(ASTNode[] ch) {
        super(ch);
    }

    public Times(ASTNode l, ASTNode r) {
        super(l, r);
    }

    public ASTNode copy(ASTNode[] ch) {
        return new Times(ch);
    }

    public Intpair getBounds() {
        Intpair b=getChild(0).getBounds();
        for(int i=1; i<numChildren(); i++) {
            b=multiplyBounds(b, getChild(i).getBounds());
        }
        return b;
    }

    public static Intpair multiplyBounds(Intpair a, Intpair b) {
        long w=Intpair.safeMul(a.lower, b.lower);
        long x=Intpair.safeMul(a.lower, b.upper);
        long y=Intpair.safeMul(a.upper, b.lower);
        long z=Intpair.safeMul(a.upper, b.upper);
        return new Intpair(Math.min(Math.min(w, x), Math.min(y, z)), Math.max(Math.max(w, x), Math.max(y, z)));
    }

    public ASTNode simplify() {
        boolean changed=false;
        ArrayList<ASTNode> ch=getChildren();
        for(int i=0; i<ch.size(); i++) {
            if(ch.get(i) instanceof Times) {
                changed=true;
                ASTNode curnode=ch.remove(i);
                i--;
                ch.addAll(curnode.getChildren());
            }
        }

        long constant=1;
        int numConstants=0;
        for(int i=0; i<ch.size(); i++) {
            if(ch.get(i).isConstant()) {
                constant=constant*ch.get(i).getValue();
                numConstants++;
                ch.remove(i);
                i--;
            }
        }

        if(constant==0) {
            boolean total=true;
            for(ASTNode c : ch) {
                total=total && c.isTotal();
            }
            if(total) {
                return NumberConstant.make(0);
            }
        }

        if(numConstants>0) {
            if(ch.size()==0) {
                return NumberConstant.make(constant);
            }
            ASTNode rest=(ch.size()==1) ? ch.get(0) : new Times(ch);
            if(constant==1) {
                return rest;
            }
            // Constant factor becomes a weight.
            return new WeightedSum(rest, constant);
        }

        if(ch.size()==1) {
            return ch.get(0);
        }
        if(changed) {
            return new Times(ch);
        }
        return null;
    }

    @Override
    public boolean childrenAreSymmetric() {
        return true;
    }

    public Long evaluate(Solution s) {
        long[] v=evaluateChildren(s);
        if(v==null) {
            return null;
        }
        long p=1;
        for(int i=0; i<v.length; i++) {
            p=p*v[i];
        }
        return p;
    }

    public String toString() {
        return infix("*");
    }
}
