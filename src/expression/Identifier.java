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

//  Reference to a variable.

public class Identifier extends ASTNode {
    private final Variable var;

    public Identifier(Variable v) {
        super();
        var=v;
    }

    public ASTNode copy(ASTNode[] ch) {
        assert ch.length==0;
        return this;
    }

    public Variable getVariable() {
        return var;
    }

    public String getName() {
        return var.getName();
    }

    public boolean isRelation() {
        return var.isBool();
    }
    public boolean isSimple() {
        return true;
    }
    public boolean isLiteral() {
        return var.isBool();
    }

    public Intpair getBounds() {
        return var.getBounds();
    }

    public ASTNode simplify() {
        //  Singleton domain.
        if(var.getLower()==var.getUpper() && !var.isBool()) {
            return NumberConstant.make(var.getLower());
        }
        return null;
    }

    public Long evaluate(Solution s) {
        return s.getValue(var);
    }

    public void getVariables(Collection<Variable> into) {
        into.add(var);
    }

    @Override
    protected boolean attributesEqual(ASTNode other) {
        return ((Identifier) other).var.getId()==var.getId();
    }
    @Override
    protected int attributesHash() {
        return var.getId();
    }
    @Override
    protected int compareAttributes(ASTNode other) {
        return Integer.compare(var.getId(), ((Identifier) other).var.getId());
    }
    @Override
    protected int rank() {
        return 2;
    }

    public String toString() {
        return var.getName();
    }
}
