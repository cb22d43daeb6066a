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

public class AllDifferent extends GlobalConstraint {
    public AllDifferent(ASTNode... ch) {
        super(ch);
    }

    public AllDifferent(ArrayList<ASTNode> ch) {
        super(ch);
    }

    public ASTNode copy(ASTNode[] ch) {
        return new AllDifferent(ch);
    }

    public String getTag() {
        return "alldifferent";
    }

    public boolean isRelation() {
        return true;
    }

    public ASTNode simplify() {
        if(numChildren()<2) {
            return new BooleanConstant(true);
        }
        // Two equal total children can never differ.
        HashSet<ASTNode> seen=new HashSet<ASTNode>();
        boolean allConst=true;
        for(int i=0; i<numChildren(); i++) {
            ASTNode c=getChild(i);
            if(!seen.add(c) && c.isTotal()) {
                return new BooleanConstant(false);
            }
            allConst=allConst && c.isConstant();
        }
        if(allConst) {
            return new BooleanConstant(evaluate(new Solution())==1L);
        }
        return null;
    }

    @Override
    public boolean childrenAreSymmetric() {
        return true;
    }

    public Long evaluate(Solution s) {
        long[] v=evaluateChildren(s);
        if(undefined(v)) {
            return 0L;
        }
        for(int i=0; i<v.length; i++) {
            for(int j=i+1; j<v.length; j++) {
                if(v[i]==v[j]) {
                    return 0L;
                }
            }
        }
        return 1L;
    }

    public String toString() {
        return prefix("alldifferent");
    }
}
