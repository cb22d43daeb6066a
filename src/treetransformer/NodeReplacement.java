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

//  Returned by TreeTransformerBottomUp.processNode.
//  current_node replaces the node being processed (null to keep it).
//  new_relation is conjoined at the nearest enclosing relation.
//  new_constraint is added to the model at the top level.

public class NodeReplacement {
    public final ASTNode current_node;
    public final ASTNode new_relation;
    public final ASTNode new_constraint;

    public NodeReplacement(ASTNode c) {
        this(c, null, null);
    }

    public NodeReplacement(ASTNode c, ASTNode r, ASTNode con) {
        current_node=c;
        new_relation=r;
        new_constraint=con;
    }
}
