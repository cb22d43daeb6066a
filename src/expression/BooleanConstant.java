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

public class BooleanConstant extends ASTNode {
    private final boolean val;

    public BooleanConstant(boolean v) {
        super();
        val=v;
    }

    public ASTNode copy(ASTNode[] ch) {
        return this;
    }

    public boolean isRelation() {
        return true;
    }
    public boolean isConstant() {
        return true;
    }
    public boolean isSimple() {
        return true;
    }
    public long getValue() {
        return val ? 1 : 0;
    }
    public boolean getBoolValue() {
        return val;
    }

    public boolean isNegatable() {
        return true;
    }
    public ASTNode negation() {
        return new BooleanConstant(!val);
    }

    public Intpair getBounds() {
        return new Intpair(getValue(), getValue());
    }

    public Long evaluate(Solution s) {
        return getValue();
    }

    @Override
    protected boolean attributesEqual(ASTNode other) {
        return ((BooleanConstant) other).val==val;
    }
    @Override
    protected int attributesHash() {
        return val ? 1 : 0;
    }
    @Override
    protected int rank() {
        return 3;
    }

    public String toString() {
        return val ? "true" : "false";
    }
}
