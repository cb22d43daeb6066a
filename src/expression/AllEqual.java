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

public class AllEqual extends GlobalConstraint {
    public AllEqual(ASTNode... ch) {
        super(ch);
    }

    public AllEqual(ArrayList<ASTNode> ch) {
        super(ch);
    }

    public ASTNode copy(ASTNode[] ch) {
        return new AllEqual(ch);
    }

    public String getTag() {
        return "allequal";
    }

    public boolean isRelation() {
        return true;
    }

    public ASTNode simplify() {
        if(numChildren()<2) {
            return new BooleanConstant(true);
        }
        boolean allConst=true;
        for(int i=0; i<numChildren(); i++) {
            allConst=allConst && getChild(i).isConstant();
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
        for(int i=1; i<v.length; i++) {
            if(v[i]!=v[0]) {
                return 0L;
            }
        }
        return 1L;
    }

    public String toString() {
        return prefix("allequal");
    }
}
