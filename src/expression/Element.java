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

//  arr[idx] with 0-based indexing. The children are the array elements
//  followed by the index. Undefined when the index is out of range or any
//  element is undefined.

public class Element extends GlobalConstraint {
    public Element(ASTNode[] arr, ASTNode idx) {
        super(concat(arr, idx));
    }

    private Element(ASTNode[] ch) {
        super(ch);
    }

    private static ASTNode[] concat(ASTNode[] arr, ASTNode idx) {
        ASTNode[] ch=Arrays.copyOf(arr, arr.length+1);
        ch[arr.length]=idx;
        return ch;
    }

    public ASTNode copy(ASTNode[] ch) {
        return new Element(ch);
    }

    public String getTag() {
        return "element";
    }

    public int arrayLength() {
        return numChildren()-1;
    }
    public ASTNode getElement(int i) {
        return getChild(i);
    }
    public ASTNode getIndex() {
        return getChild(numChildren()-1);
    }

    public boolean isTotal() {
        Intpair p=getIndex().getBounds();
        if(p.lower<0 || p.upper>arrayLength()-1) {
            return false;
        }
        for(int i=0; i<numChildren(); i++) {
            if(!getChild(i).isTotal()) {
                return false;
            }
        }
        return true;
    }

    public Intpair getBounds() {
        Intpair p=getIndex().getBounds();
        long lo=Math.max(0, p.lower);
        long hi=Math.min(arrayLength()-1, p.upper);
        if(lo>hi) {
            return new Intpair(0, 0);
        }
        Intpair b=getChild((int) lo).getBounds();
        for(long i=lo+1; i<=hi; i++) {
            b=b.union(getChild((int) i).getBounds());
        }
        return b;
    }

    public ASTNode simplify() {
        if(getIndex().isConstant()) {
            long i=getIndex().getValue();
            if(i>=0 && i<arrayLength()) {
                for(int j=0; j<arrayLength(); j++) {
                    if(j!=i && !getChild(j).isTotal()) {
                        return null;
                    }
                }
                return getChild((int) i);
            }
        }
        return null;
    }

    //  Strict in every element, not only the selected one.
    public Long evaluate(Solution s) {
        long[] v=evaluateChildren(s);
        if(v==null) {
            return null;
        }
        long i=v[v.length-1];
        if(i<0 || i>=arrayLength()) {
            return null;
        }
        return v[(int) i];
    }

    public String toString() {
        StringBuilder b=new StringBuilder("[");
        for(int i=0; i<arrayLength(); i++) {
            if(i>0) {
                b.append(", ");
            }
            b.append(getChild(i));
        }
        b.append("][");
        b.append(getIndex());
        b.append("]");
        return b.toString();
    }
}
