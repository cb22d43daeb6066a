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

//  A decision or auxiliary variable. Created only by SymbolTable, never
//  copied, and its domain never changes after creation.

public final class Variable {
    private final int id;
    private final String name;
    private final long lower;
    private final long upper;
    private final boolean bool;
    private final boolean aux;

    Variable(int id, String name, long lower, long upper, boolean bool, boolean aux) {
        assert lower<=upper;
        assert !bool || (lower==0 && upper==1);
        this.id=id;
        this.name=name;
        this.lower=lower;
        this.upper=upper;
        this.bool=bool;
        this.aux=aux;
    }

    public int getId() {
        return id;
    }
    public String getName() {
        return name;
    }
    public long getLower() {
        return lower;
    }
    public long getUpper() {
        return upper;
    }
    public Intpair getBounds() {
        return new Intpair(lower, upper);
    }
    public boolean isBool() {
        return bool;
    }
    public boolean isAuxiliary() {
        return aux;
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof Variable) && ((Variable) o).id==id;
    }

    @Override
    public int hashCode() {
        return id;
    }

    public String toString() {
        return name;
    }

    public String declaration() {
        if(bool) {
            return name+" : bool";
        }
        return name+" : int("+lower+".."+upper+")";
    }
}
