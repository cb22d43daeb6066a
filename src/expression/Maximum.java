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

public class Maximum extends GlobalConstraint {
    public Maximum(ASTNode... ch) {
        super(ch);
    }

    public Maximum(ArrayList<ASTNode> ch) {
        super(ch);
    }

    public ASTNode copy(ASTNode[] ch) {
        return new Maximum(ch);
    }

    public String getTag() {
        return "max";
    }

    public Intpair getBounds() {
        Intpair b=getChild(0).getBounds();
        for(int i=1; i<numChildren(); i++) {
            Intpair c=getChild(i).getBounds();
            b=new Intpair(Math.max(b.lower, c.lower), Math.max(b.upper, c.upper));
        }
        return b;
    }

    public ASTNode simplify() {
        if(numChildren()==1) {
            return getChild(0);
        }
        ArrayList<ASTNode> ch=getChildren();
        int numConst=0;
        long best=Long.MIN_VALUE;
        for(int i=0; i<ch.size(); i++) {
            if(ch.get(i).isConstant()) {
                numConst++;
                best=Math.max(best, ch.get(i).getValue());
                ch.remove(i);
                i--;
            }
        }
        if(numConst==0 || (numConst==1 && getChild(numChildren()-1).isConstant() && getChild(numChildren()-1) instanceof NumberConstant)) {
            return null;
        }
        ch.add(NumberConstant.make(best));
        if(ch.size()==1) {
            return ch.get(0);
        }
        return new Maximum(ch);
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
        long m=v[0];
        for(int i=1; i<v.length; i++) {
            m=Math.max(m, v[i]);
        }
        return m;
    }

    public String toString() {
        return prefix("max");
    }
}
