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

//  N-ary exclusive or: true when an odd number of children are true.

public class Xor extends ASTNode {
    public Xor(ArrayList<ASTNode> ch) {
        super(ch);
    }

    public Xor(ASTNode[] ch) {
        super(ch);
    }

    public Xor(ASTNode l, ASTNode r) {
        super(l, r);
    }

    public ASTNode copy(ASTNode[] ch) {
        return new Xor(ch);
    }

    public boolean isRelation() {
        return true;
    }
    public boolean typecheck() {
        return childrenAreRelations();
    }

    public ASTNode simplify() {
        boolean changed=false;
        ArrayList<ASTNode> ch=getChildren();
        for(int i=0; i<ch.size(); i++) {
            if(ch.get(i) instanceof Xor) {
                changed=true;
                ASTNode curnode=ch.remove(i);
                i--;
                ch.addAll(curnode.getChildren());
            }
        }

        //  Constants fold into the parity.
        boolean parity=false;
        for(int i=0; i<ch.size(); i++) {
            if(ch.get(i).isConstant()) {
                parity=parity ^ (ch.get(i).getValue()==1);
                ch.remove(i);
                i--;
                changed=true;
            }
        }

        if(!changed) {
            return null;
        }

        ASTNode rest;
        if(ch.size()==0) {
            rest=new BooleanConstant(false);
        }
        else if(ch.size()==1) {
            rest=ch.get(0);
        }
        else {
            rest=new Xor(ch);
        }

        if(parity) {
            return new Negate(rest);
        }
        return rest;
    }

    //  Negate one operand.
    @Override
    public boolean isNegatable() {
        return true;
    }
    @Override
    public ASTNode negation() {
        ArrayList<ASTNode> ch=getChildren();
        ch.set(0, new Negate(ch.get(0)));
        return new Xor(ch);
    }

    @Override
    public boolean childrenAreSymmetric() {
        return true;
    }

    public Long evaluate(Solution s) {
        long count=0;
        for(int i=0; i<numChildren(); i++) {
            count+=getChild(i).evaluate(s);
        }
        return count%2;
    }

    public String toString() {
        return prefix("xor");
    }
}
