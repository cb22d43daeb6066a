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

//  Integer constant.

public class NumberConstant extends ASTNode {
    private final long num;

    private NumberConstant(long n) {
        super();
        num=n;
    }

    public static NumberConstant make(long n) {
        return new NumberConstant(n);
    }

    public ASTNode copy(ASTNode[] ch) {
        return this;
    }

    public boolean isConstant() {
        return true;
    }
    public boolean isSimple() {
        return true;
    }
    public long getValue() {
        return num;
    }

    public Intpair getBounds() {
        return new Intpair(num, num);
    }

    public Long evaluate(Solution s) {
        return num;
    }

    @Override
    protected boolean attributesEqual(ASTNode other) {
        return ((NumberConstant) other).num==num;
    }
    @Override
    protected int attributesHash() {
        return Long.hashCode(num);
    }
    @Override
    protected int rank() {
        return 3;
    }

    public String toString() {
        return String.valueOf(num);
    }
}
