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

//  Flattening. A top-level constraint may keep two operator levels (the
//  constraint and one operator below it, as in x + y = 5 or b = (x < 3)),
//  the objective one level. Any other compound expression is replaced by an
//  auxiliary variable with the top-level definition aux = expr. Equal
//  expressions share one auxiliary variable.

public class TransformToFlat extends TreeTransformerBottomUp {
    private final HashMap<ASTNode, Identifier> auxFor=new HashMap<ASTNode, Identifier>();

    public TransformToFlat(Model _m) {
        super(_m, "flattening");
    }

    @Override
    protected int rootAllowance() {
        return 2;
    }

    @Override
    protected int objectiveAllowance() {
        return 1;
    }

    @Override
    protected int childAllowance(ASTNode parent, int i, TransformContext ctx) {
        if(ctx.allowance<2) {
            return 0;
        }
        if(parent instanceof And && ctx.topAnd) {
            // Conjuncts are split into top-level constraints.
            return 2;
        }
        if(isComparison(parent)) {
            boolean simple0=parent.getChild(0).isSimple();
            if(i==0) {
                return simple0 ? 0 : 1;
            }
            // The right side keeps its operator only when the left is simple.
            return (simple0 && !parent.getChild(1).isSimple()) ? 1 : 0;
        }
        if(parent instanceof Implies) {
            return (i==0) ? 0 : 1;
        }
        if(parent instanceof Negate) {
            return 1;
        }
        return 0;
    }

    protected NodeReplacement processNode(ASTNode curnode, TransformContext ctx) {
        if(ctx.allowance>0 || curnode.isSimple()) {
            return null;
        }
        Identifier aux=auxFor.get(curnode);
        if(aux!=null) {
            return new NodeReplacement(aux);
        }
        aux=m.global_symbols.newAuxHelper(curnode);
        auxFor.put(curnode, aux);
        return new NodeReplacement(aux, null, new Equals(aux, curnode));
    }

    private static boolean isComparison(ASTNode n) {
        return n instanceof Equals || n instanceof NotEqual || n instanceof Less || n instanceof LessEqual;
    }

    //  A flat top-level constraint: a literal or constant, or one operator
    //  over operands that are each simple or one operator over simple
    //  operands, where only comparisons, implication and negation may have
    //  a compound operand, and at most one.
    public static boolean isFlat(ASTNode con) {
        if(con.isSimple()) {
            return true;
        }
        int compound=0;
        for(int i=0; i<con.numChildren(); i++) {
            ASTNode c=con.getChild(i);
            if(c.isSimple()) {
                continue;
            }
            compound++;
            if(!isComparison(con) && !(con instanceof Implies && i==1) && !(con instanceof Negate)) {
                return false;
            }
            for(int j=0; j<c.numChildren(); j++) {
                if(!c.getChild(j).isSimple()) {
                    return false;
                }
            }
        }
        return compound<=1;
    }

    //  The objective is simple or one operator over simple operands.
    public static boolean isFlatObjective(ASTNode obj) {
        if(obj.isSimple()) {
            return true;
        }
        for(int i=0; i<obj.numChildren(); i++) {
            if(!obj.getChild(i).isSimple()) {
                return false;
            }
        }
        return true;
    }
}
