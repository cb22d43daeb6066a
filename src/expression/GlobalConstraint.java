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

//  Named high-level constraint or function. The tag is what a target's
//  capabilities list. A negated global stays wrapped in Negate.

public abstract class GlobalConstraint extends ASTNode {
    protected GlobalConstraint(ASTNode... ch) {
        super(ch);
    }

    protected GlobalConstraint(List<ASTNode> ch) {
        super(ch);
    }

    public abstract String getTag();

    //  True for numeric global functions (element, min, max, abs, count).
    public boolean isFunction() {
        return !isRelation();
    }

    //  Some child is undefined, so a relational global is false.
    protected static boolean undefined(long[] vals) {
        return vals==null;
    }
}
