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

//  Logical not.

public class Negate extends ASTNode {
    public Negate(ASTNode a) {
        super(a);
    }

    public ASTNode copy(ASTNode[] ch) {
        return new Negate(ch[0]);
    }

    public boolean isRelation() {
        return true;
    }
    public boolean typecheck() {
        return childrenAreRelations();
    }

    public boolean isSimple() {
        return getChild(0) instanceof Identifier;
    }
    public boolean isLiteral() {
        return getChild(0).isLiteral() && getChild(0) instanceof Identifier;
    }

    public ASTNode simplify() {
        if(getChild(0).isConstant()) {
            return new BooleanConstant(getChild(0).getValue()==0);
        }
        if(getChild(0) instanceof Negate) {
            return getChild(0).getChild(0);
        }
        return null;
    }

    @Override
    public boolean isNegatable() {
        return true;
    }
    @Override
    public ASTNode negation() {
        return getChild(0);
    }

    @Override
    public int polarity(int child, int pol) {
        return -pol;
    }

    @Override
    protected int rank() {
        return (getChild(0) instanceof Identifier) ? 1 : 0;
    }

    public Long evaluate(Solution s) {
        return 1L-getChild(0).evaluate(s);
    }

    public String toString() {
        return "!"+getChild(0);
    }
}
