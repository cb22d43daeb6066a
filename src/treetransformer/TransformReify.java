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

//  Puts reified top-level constraints into the shape b = C (full) or
//  l -> C (half), where b is a boolean variable and l a literal. Without
//  native reification a full reification becomes the pair of half
//  reifications b -> C and not b -> not C.

public class TransformReify extends TreeTransformerBottomUp {
    private final Capabilities caps;

    public TransformReify(Model _m, Capabilities _caps) {
        super(_m, "reification");
        caps=_caps;
    }

    protected NodeReplacement processNode(ASTNode curnode, TransformContext ctx) {
        if(!ctx.topAnd) {
            return null;
        }
        if(curnode instanceof Negate && curnode.getChild(0) instanceof GlobalConstraint && !caps.hasNativeReification()) {
            throw new ModelException(ModelException.Kind.UNREIFIABLE, "no negation available", getName(), curnode);
        }
        if(curnode instanceof Equals && curnode.getChild(0).isRelation() && curnode.getChild(1).isRelation()) {
            return reifyEquals(curnode.getChild(0), curnode.getChild(1));
        }
        if(curnode instanceof NotEqual && curnode.getChild(0).isRelation() && curnode.getChild(1).isRelation()) {
            if(isLiteral(curnode.getChild(0)) && isLiteral(curnode.getChild(1))) {
                return null;
            }
            // A != B  is  A = not B
            ASTNode a=curnode.getChild(0);
            ASTNode b=curnode.getChild(1);
            if(isLiteral(b)) {
                ASTNode tmp=a;
                a=b;
                b=tmp;
            }
            NodeReplacement r=reifyEquals(a, TransformPushNegation.negate(b));
            return (r==null) ? new NodeReplacement(new Equals(a, TransformPushNegation.negate(b))) : r;
        }
        if(curnode instanceof Implies && isLiteral(curnode.getChild(0))) {
            if(!caps.hasNativeReification() && containsGlobalRelation(curnode.getChild(1))) {
                throw new ModelException(ModelException.Kind.UNREIFIABLE, "global constraint in a half reification", getName(), curnode);
            }
            return null;
        }
        if(curnode instanceof Implies) {
            ASTNode a=curnode.getChild(0);
            ASTNode c=curnode.getChild(1);
            Identifier aux=m.global_symbols.newAuxHelper(a);
            ASTNode c1=new Implies(aux, c);
            ASTNode c2=new Implies(new Negate(aux), TransformPushNegation.negate(a));
            return new NodeReplacement(new BooleanConstant(true), null, new And(c1, c2));
        }
        return null;
    }

    //  a = b, both boolean. Returns null to keep the constraint as it is.
    private NodeReplacement reifyEquals(ASTNode a, ASTNode b) {
        if(isLiteral(a) && isLiteral(b)) {
            return null;
        }
        if(!isLiteral(a) && !isLiteral(b)) {
            Identifier aux=m.global_symbols.newAuxHelper(a);
            return new NodeReplacement(new BooleanConstant(true), null, new And(new Equals(aux, a), new Equals(aux, b)));
        }
        if(isLiteral(b)) {
            ASTNode tmp=a;
            a=b;
            b=tmp;
        }
        // Negated literal: move the negation onto the other side.
        if(a instanceof Negate) {
            a=a.getChild(0);
            b=TransformPushNegation.negate(b);
        }

        if(caps.hasNativeReification()) {
            ASTNode eq=new Equals(a, b);
            return new NodeReplacement(eq);
        }

        if(containsGlobalRelation(b)) {
            throw new ModelException(ModelException.Kind.UNREIFIABLE, "global constraint in a reification", getName(), new Equals(a, b));
        }
        ASTNode notb=TransformPushNegation.negate(b);
        ASTNode c1=new Implies(a, b);
        ASTNode c2=new Implies(new Negate(a), notb);
        return new NodeReplacement(new BooleanConstant(true), null, new And(c1, c2));
    }

    private static boolean isLiteral(ASTNode n) {
        return n.isLiteral() || n.isConstant();
    }

    //  A global relation reached through boolean connectives only.
    private static boolean containsGlobalRelation(ASTNode n) {
        if(n instanceof GlobalConstraint && n.isRelation()) {
            return true;
        }
        for(int i=0; i<n.numChildren(); i++) {
            if(n.getChild(i).isRelation() && containsGlobalRelation(n.getChild(i))) {
                return true;
            }
        }
        return false;
    }
}
