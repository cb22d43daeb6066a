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

//  Where a node sits in the tree being transformed. Results are memoised
//  per node and context, so a node shared between two contexts is
//  processed once in each.

public final class TransformContext {
    //  1 positive, -1 negative, 0 both.
    public final int polarity;

    //  The node is a top-level constraint or a conjunct of one.
    public final boolean topAnd;

    //  The nearest enclosing relation (the node itself for a relation) is
    //  a top-level conjunct, so a relation conjoined there may be posted at
    //  the top level instead.
    public final boolean guardAtTop;

    //  The parent is a Negate.
    public final boolean negated;

    //  How many operator levels the node may keep (flattening only).
    public final int allowance;

    private TransformContext(int polarity, boolean topAnd, boolean guardAtTop, boolean negated, int allowance) {
        this.polarity=polarity;
        this.topAnd=topAnd;
        this.guardAtTop=guardAtTop;
        this.negated=negated;
        this.allowance=allowance;
    }

    public static TransformContext constraint(int allowance) {
        return new TransformContext(1, true, true, false, allowance);
    }

    public static TransformContext objective(int allowance) {
        return new TransformContext(0, false, true, false, allowance);
    }

    public TransformContext child(ASTNode parent, int i, int childAllowance) {
        boolean childTopAnd=topAnd && (parent instanceof And);
        boolean childGuardAtTop=parent.isRelation() ? topAnd : guardAtTop;
        return new TransformContext(parent.polarity(i, polarity), childTopAnd, childGuardAtTop, parent instanceof Negate, childAllowance);
    }

    public int code() {
        return (polarity+1) | (topAnd ? 4 : 0) | (guardAtTop ? 8 : 0) | (negated ? 16 : 0) | (allowance << 5);
    }

    public String toString() {
        return "[pol "+polarity+(topAnd ? ", topAnd" : "")+(guardAtTop ? ", guardAtTop" : "")+(negated ? ", negated" : "")+", allowance "+allowance+"]";
    }
}
