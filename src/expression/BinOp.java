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

//  Superclass of the binary operators. makeBinOp builds the node for an
//  infix operator symbol.

public abstract class BinOp extends ASTNode {
    public BinOp(ASTNode l, ASTNode r) {
        super(l, r);
    }

    public static ASTNode makeBinOp(String op, ASTNode l, ASTNode r) {
        if(op.equals("/\\")) {
            return new And(l, r);
        }
        if(op.equals("\\/")) {
            return new Or(l, r);
        }
        if(op.equals("->")) {
            return new Implies(l, r);
        }
        if(op.equals("=")) {
            return new Equals(l, r);
        }
        if(op.equals("!=")) {
            return new NotEqual(l, r);
        }
        if(op.equals("<=")) {
            return new LessEqual(l, r);
        }
        if(op.equals("<")) {
            return new Less(l, r);
        }
        if(op.equals(">=")) {
            return new GreaterEqual(l, r);
        }
        if(op.equals(">")) {
            return new Greater(l, r);
        }
        if(op.equals("+")) {
            return new WeightedSum(l, r);
        }
        if(op.equals("-")) {
            return new WeightedSum(new ASTNode[]{l, r}, new long[]{1, -1});
        }
        if(op.equals("*")) {
            return new Times(l, r);
        }
        if(op.equals("//")) {
            return new Divide(l, r);
        }
        if(op.equals("%")) {
            return new Mod(l, r);
        }
        throw new IllegalArgumentException("Unknown binary operator: "+op);
    }

    //  Both operands are defined everywhere, so the relation can be decided
    //  from their bounds or their structure.
    protected final boolean operandsTotal() {
        return getChild(0).isTotal() && getChild(1).isTotal();
    }

    //  For a comparison with a sum on one side and a constant on the other,
    //  move the sum's constant term across. Returns {sum, constant} or null.
    protected final ASTNode[] shiftConstant() {
        for(int side=0; side<2; side++) {
            ASTNode a=getChild(side);
            ASTNode b=getChild(1-side);
            if(a instanceof WeightedSum && b.isConstant()) {
                WeightedSum w=(WeightedSum) a;
                long c=w.constantTerm();
                if(c!=0) {
                    ASTNode[] res=new ASTNode[2];
                    res[side]=w.withoutConstant();
                    res[1-side]=NumberConstant.make(b.getValue()-c);
                    return res;
                }
            }
        }
        return null;
    }
}
