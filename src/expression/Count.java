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

//  Number of array elements equal to the value. The children are the array
//  elements followed by the value.

public class Count extends GlobalConstraint {
    public Count(ASTNode[] arr, ASTNode value) {
        super(concat(arr, value));
    }

    private Count(ASTNode[] ch) {
        super(ch);
    }

    private static ASTNode[] concat(ASTNode[] arr, ASTNode value) {
        ASTNode[] ch=Arrays.copyOf(arr, arr.length+1);
        ch[arr.length]=value;
        return ch;
    }

    public ASTNode copy(ASTNode[] ch) {
        return new Count(ch);
    }

    public String getTag() {
        return "count";
    }

    public int arrayLength() {
        return numChildren()-1;
    }
    public ASTNode getValueExpr() {
        return getChild(numChildren()-1);
    }

    public Intpair getBounds() {
        return new Intpair(0, arrayLength());
    }

    public ASTNode simplify() {
        if(arrayLength()==0) {
            return NumberConstant.make(0);
        }
        return null;
    }

    public Long evaluate(Solution s) {
        long[] v=evaluateChildren(s);
        if(v==null) {
            return null;
        }
        long target=v[v.length-1];
        long c=0;
        for(int i=0; i<v.length-1; i++) {
            if(v[i]==target) {
                c++;
            }
        }
        return c;
    }

    public String toString() {
        StringBuilder b=new StringBuilder("count([");
        for(int i=0; i<arrayLength(); i++) {
            if(i>0) {
                b.append(", ");
            }
            b.append(getChild(i));
        }
        b.append("], ");
        b.append(getValueExpr());
        b.append(")");
        return b.toString();
    }
}
