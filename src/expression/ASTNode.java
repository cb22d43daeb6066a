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

//  Base class of all expressions. Nodes are immutable: children are fixed
//  at construction, so a node may be shared by any number of parents and
//  passes build new nodes instead of editing old ones.
//
//  equals and hashCode are structural, which is what the flattening memo
//  table and duplicate removal rely on.

public abstract class ASTNode {
    private static final ASTNode[] NO_CHILDREN=new ASTNode[0];

    private final ASTNode[] children;
    private int hashCache=Integer.MIN_VALUE;

    protected ASTNode() {
        children=NO_CHILDREN;
    }

    protected ASTNode(ASTNode... ch) {
        children=ch.clone();
        for(ASTNode c : children) {
            if(c==null) {
                throw new NullPointerException("null child in "+getClass().getSimpleName());
            }
        }
    }

    protected ASTNode(List<ASTNode> ch) {
        this(ch.toArray(new ASTNode[ch.size()]));
    }

    public final int numChildren() {
        return children.length;
    }

    public final ASTNode getChild(int i) {
        return children[i];
    }

    public final ArrayList<ASTNode> getChildren() {
        return new ArrayList<ASTNode>(Arrays.asList(children));
    }

    public final ASTNode[] getChildrenArray() {
        return children.clone();
    }

    //  A node of the same kind, with the same attributes (weights, tuples)
    //  but the given children.
    public abstract ASTNode copy(ASTNode[] ch);

    public final ASTNode copy(List<ASTNode> ch) {
        return copy(ch.toArray(new ASTNode[ch.size()]));
    }

    ////////////////////////////////////////////////////////////////////////////
    //  Type information

    //  Boolean-valued.
    public boolean isRelation() {
        return false;
    }

    public boolean isConstant() {
        return false;
    }

    public long getValue() {
        throw new UnsupportedOperationException("getValue on non-constant "+this);
    }

    //  Variable, constant, or negated boolean variable.
    public boolean isSimple() {
        return false;
    }

    //  Boolean variable or its negation.
    public boolean isLiteral() {
        return false;
    }

    //  Sound bounds of the value. Relations are 0/1.
    public Intpair getBounds() {
        if(isRelation()) {
            return new Intpair(0, 1);
        }
        throw new UnsupportedOperationException("getBounds not implemented for "+getClass().getSimpleName());
    }

    //  Defined for every assignment to the variables within their domains.
    //  Relations are always defined (an undefined operand makes them false).
    public boolean isTotal() {
        if(isRelation()) {
            return true;
        }
        for(ASTNode c : children) {
            if(!c.isTotal()) {
                return false;
            }
        }
        return true;
    }

    //  False if an operand has the wrong type for this operator.
    public boolean typecheck() {
        return true;
    }

    protected final boolean childrenAreRelations() {
        for(ASTNode c : children) {
            if(!c.isRelation()) {
                return false;
            }
        }
        return true;
    }

    ////////////////////////////////////////////////////////////////////////////
    //  Negation

    //  Is there a negation that can be expressed without wrapping in Negate.
    public boolean isNegatable() {
        return false;
    }

    public ASTNode negation() {
        return null;
    }

    //  Polarity of child i, given the polarity of this node.
    //  1 positive, -1 negative, 0 both.
    public int polarity(int child, int pol) {
        return 0;
    }

    ////////////////////////////////////////////////////////////////////////////
    //  Normalisation

    //  Order of the children does not matter.
    public boolean childrenAreSymmetric() {
        return false;
    }

    //  Returns a simpler equivalent node, or null when no rule applies.
    public ASTNode simplify() {
        return null;
    }

    ////////////////////////////////////////////////////////////////////////////
    //  Evaluation

    //  Value under the assignment, or null when a partial function is
    //  undefined. Relations are never undefined: they are false instead.
    public abstract Long evaluate(Solution s);

    protected static Long bool(boolean b) {
        return b ? 1L : 0L;
    }

    //  Evaluates the children, returns null if any is undefined.
    protected final long[] evaluateChildren(Solution s) {
        long[] vals=new long[children.length];
        for(int i=0; i<children.length; i++) {
            Long v=children[i].evaluate(s);
            if(v==null) {
                return null;
            }
            vals[i]=v;
        }
        return vals;
    }

    ////////////////////////////////////////////////////////////////////////////
    //  Structure

    public void getVariables(Collection<Variable> into) {
        for(ASTNode c : children) {
            c.getVariables(into);
        }
    }

    public ArrayList<Variable> getVariables() {
        LinkedHashSet<Variable> s=new LinkedHashSet<Variable>();
        getVariables(s);
        return new ArrayList<Variable>(s);
    }

    //  Number of operator levels below this node. Simple nodes have depth 0.
    public int operatorDepth() {
        if(isSimple()) {
            return 0;
        }
        int d=0;
        for(ASTNode c : children) {
            d=Math.max(d, c.operatorDepth());
        }
        return d+1;
    }

    public boolean contains(Class<? extends ASTNode> cls) {
        if(cls.isInstance(this)) {
            return true;
        }
        for(ASTNode c : children) {
            if(c.contains(cls)) {
                return true;
            }
        }
        return false;
    }

    ////////////////////////////////////////////////////////////////////////////
    //  Structural equality

    @Override
    public final boolean equals(Object other) {
        if(this==other) {
            return true;
        }
        if(other==null || other.getClass()!=getClass()) {
            return false;
        }
        ASTNode o=(ASTNode) other;
        if(o.hashCode()!=hashCode()) {
            return false;
        }
        return attributesEqual(o) && Arrays.equals(children, o.children);
    }

    @Override
    public final int hashCode() {
        if(hashCache==Integer.MIN_VALUE) {
            int hash=getClass().getName().hashCode();
            hash=hash*13+attributesHash();
            hash=hash*31+Arrays.hashCode(children);
            if(hash==Integer.MIN_VALUE) {
                hash=0;
            }
            hashCache=hash;
        }
        return hashCache;
    }

    //  Subclasses with fields other than the children override these three.
    protected boolean attributesEqual(ASTNode other) {
        return true;
    }
    protected int attributesHash() {
        return 0;
    }
    protected int compareAttributes(ASTNode other) {
        return 0;
    }

    ////////////////////////////////////////////////////////////////////////////
    //  Canonical order: compound expressions, then negated variables, then
    //  variables by identity, then constants by value. Consistent with equals.

    protected int rank() {
        return 0;
    }

    public static final Comparator<ASTNode> canonicalOrder=new Comparator<ASTNode>() {
        public int compare(ASTNode a, ASTNode b) {
            return compareStructure(a, b);
        }
    };

    public static int compareStructure(ASTNode a, ASTNode b) {
        if(a==b) {
            return 0;
        }
        int r=Integer.compare(a.rank(), b.rank());
        if(r!=0) {
            return r;
        }
        if(a.isConstant() && b.isConstant()) {
            r=Long.compare(a.getValue(), b.getValue());
            if(r!=0) {
                return r;
            }
        }
        r=a.getClass().getName().compareTo(b.getClass().getName());
        if(r!=0) {
            return r;
        }
        r=a.compareAttributes(b);
        if(r!=0) {
            return r;
        }
        r=Integer.compare(a.numChildren(), b.numChildren());
        if(r!=0) {
            return r;
        }
        for(int i=0; i<a.numChildren(); i++) {
            r=compareStructure(a.getChild(i), b.getChild(i));
            if(r!=0) {
                return r;
            }
        }
        return 0;
    }

    public abstract String toString();

    //  Helper for n-ary infix printing.
    protected final String infix(String op) {
        StringBuilder b=new StringBuilder("(");
        for(int i=0; i<children.length; i++) {
            if(i>0) {
                b.append(" ");
                b.append(op);
                b.append(" ");
            }
            b.append(children[i]);
        }
        b.append(")");
        return b.toString();
    }

    //  Helper for function-style printing.
    protected final String prefix(String name) {
        StringBuilder b=new StringBuilder(name);
        b.append("(");
        for(int i=0; i<children.length; i++) {
            if(i>0) {
                b.append(", ");
            }
            b.append(children[i]);
        }
        b.append(")");
        return b.toString();
    }
}
