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

//  Only exists until normalisation, which turns it round into a Less.

public class Greater extends BinOp {
    public Greater(ASTNode l, ASTNode r) {
        super(l, r);
    }

    public ASTNode copy(ASTNode[] ch) {
        return new Greater(ch[0], ch[1]);
    }

    public boolean isRelation() {
        return true;
    }

    public ASTNode simplify() {
        return new Less(getChild(1), getChild(0));
    }

    @Override
    public boolean isNegatable() {
        return true;
    }
    @Override
    public ASTNode negation() {
        return new LessEqual(getChild(0), getChild(1));
    }

    public Long evaluate(Solution s) {
        long[] v=evaluateChildren(s);
        if(v==null) {
            return 0L;
        }
        return bool(v[0]>v[1]);
    }

    public String toString() {
        return "("+getChild(0)+" > "+getChild(1)+")";
    }
}
