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

//  The children take the values of one of the tuples.

public class Table extends GlobalConstraint {
    private final long[][] tuples;

    public Table(ASTNode[] vars, long[][] tuples) {
        super(vars);
        for(long[] t : tuples) {
            if(t.length!=vars.length) {
                throw ModelException.typeError("table tuple of length "+t.length+" for "+vars.length+" variables", "model", Arrays.toString(t));
            }
        }
        this.tuples=new long[tuples.length][];
        for(int i=0; i<tuples.length; i++) {
            this.tuples[i]=tuples[i].clone();
        }
    }

    public ASTNode copy(ASTNode[] ch) {
        return new Table(ch, tuples);
    }

    public String getTag() {
        return "table";
    }

    public boolean isRelation() {
        return true;
    }

    public int numTuples() {
        return tuples.length;
    }

    public long[] getTuple(int i) {
        return tuples[i].clone();
    }

    public ASTNode simplify() {
        if(tuples.length==0) {
            return new BooleanConstant(false);
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

    public Long evaluate(Solution s) {
        long[] v=evaluateChildren(s);
        if(undefined(v)) {
            return 0L;
        }
        for(long[] t : tuples) {
            if(Arrays.equals(t, v)) {
                return 1L;
            }
        }
        return 0L;
    }

    @Override
    protected boolean attributesEqual(ASTNode other) {
        return Arrays.deepEquals(tuples, ((Table) other).tuples);
    }
    @Override
    protected int attributesHash() {
        return Arrays.deepHashCode(tuples);
    }
    @Override
    protected int compareAttributes(ASTNode other) {
        long[][] o=((Table) other).tuples;
        if(tuples.length!=o.length) {
            return Integer.compare(tuples.length, o.length);
        }
        for(int i=0; i<tuples.length; i++) {
            if(tuples[i].length!=o[i].length) {
                return Integer.compare(tuples[i].length, o[i].length);
            }
            for(int j=0; j<tuples[i].length; j++) {
                int r=Long.compare(tuples[i][j], o[i][j]);
                if(r!=0) {
                    return r;
                }
            }
        }
        return 0;
    }

    public String toString() {
        StringBuilder b=new StringBuilder("table([");
        for(int i=0; i<numChildren(); i++) {
            if(i>0) {
                b.append(", ");
            }
            b.append(getChild(i));
        }
        b.append("], [");
        for(int i=0; i<tuples.length; i++) {
            if(i>0) {
                b.append(", ");
            }
            b.append(Arrays.toString(tuples[i]));
        }
        b.append("])");
        return b.toString();
    }
}
