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

public class Or extends ASTNode {
    public Or(ArrayList<ASTNode> ch) {
        super(ch);
    }

    public Or(ASTNode[] ch) {
        super(ch);
    }

    public Or(ASTNode l, ASTNode r) {
        super(l, r);
    }

    public ASTNode copy(ASTNode[] ch) {
        return new Or(ch);
    }

    public boolean isRelation() {
        return true;
    }
    public boolean typecheck() {
        return childrenAreRelations();
    }

    public ASTNode simplify() {
        boolean changed = false;

        ArrayList<ASTNode> ch = getChildren();
        for (int i =0; i < ch.size(); i++) {
            if (ch.get(i) instanceof Or) {
                changed = true;
                ASTNode curnode = ch.remove(i);
                i--;
                ch.addAll(curnode.getChildren());
            }
        }

        for (int i =0; i < ch.size(); i++) {
            if (ch.get(i).isConstant()) {
                if (ch.get(i).getValue() == 0) {
                    changed = true;
                    ch.remove(i);
                    i--;
                } else {
                    // Found a True in the disjunction.
                    return new BooleanConstant(true);
                }
            }
        }

        LinkedHashSet<ASTNode> a = new LinkedHashSet<ASTNode>(ch);
        if (a.size() < ch.size()) {
            changed = true;
            ch.clear();
            ch.addAll(a);
        }

        if (ch.size() == 0) {
            return new BooleanConstant(false);
        }
        if (ch.size() == 1) {
            return ch.get(0);
        }
        if (changed) {
            return new Or(ch);
        }
        return null;
    }

    @Override
    public boolean isNegatable() {
        return true;
    }
    @Override
    public ASTNode negation() {
        ArrayList<ASTNode> newchildren = new ArrayList<ASTNode>();
        for (int i =0; i < numChildren(); i++) {
            newchildren.add(new Negate(getChild(i)));
        }
        return new And(newchildren);
    }

    @Override
    public int polarity(int child, int pol) {
        return pol;
    }

    @Override
    public boolean childrenAreSymmetric() {
        return true;
    }

    public Long evaluate(Solution s) {
        for(int i=0; i<numChildren(); i++) {
            if(getChild(i).evaluate(s)==1L) {
                return 1L;
            }
        }
        return 0L;
    }

    public String toString() {
        return infix("\\/");
    }
}
