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

public class Abs extends GlobalConstraint {
    public Abs(ASTNode a) {
        super(a);
    }

    public ASTNode copy(ASTNode[] ch) {
        return new Abs(ch[0]);
    }

    public String getTag() {
        return "abs";
    }

    public Intpair getBounds() {
        Intpair a=getChild(0).getBounds();
        if(a.lower>=0) {
            return a;
        }
        if(a.upper<=0) {
            return a.multiply(-1);
        }
        return new Intpair(0, Math.max(Intpair.safeMul(a.lower, -1), a.upper));
    }

    public ASTNode simplify() {
        ASTNode a=getChild(0);
        if(a.isConstant()) {
            return NumberConstant.make(Math.abs(a.getValue()));
        }
        if(a instanceof Abs) {
            return a;
        }
        return null;
    }

    public Long evaluate(Solution s) {
        Long v=getChild(0).evaluate(s);
        if(v==null) {
            return null;
        }
        return Math.abs(v);
    }

    public String toString() {
        return prefix("abs");
    }
}
