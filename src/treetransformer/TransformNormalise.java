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

//  Puts every node into normal form by applying simplify() to a fixed point
//  and sorting the children of symmetric operators into canonical order.
//  Also the type checker: a constraint must be boolean and the operands of
//  boolean connectives must be boolean.

public class TransformNormalise extends TreeTransformerBottomUp {
    //  Nodes already known to be in normal form, mapped to their normal form.
    private final IdentityHashMap<ASTNode, ASTNode> normalForm=new IdentityHashMap<ASTNode, ASTNode>();

    public TransformNormalise(Model _m) {
        super(_m, "normalise");
    }

    @Override
    protected ASTNode preprocessConstraint(ASTNode con) {
        if(!con.isRelation()) {
            throw ModelException.typeError("non-boolean constraint", getName(), con);
        }
        return null;
    }

    protected NodeReplacement processNode(ASTNode curnode, TransformContext ctx) {
        ASTNode n=normaliseNode(curnode);
        if(n!=curnode) {
            return new NodeReplacement(n);
        }
        return null;
    }

    @Override
    protected ASTNode transformObjective(ASTNode obj) {
        if(obj.isConstant()) {
            CmdFlags.warning("Objective is the constant "+obj.getValue());
        }
        return obj;
    }

    //  Normalises a node whose children are already in normal form.
    private ASTNode normaliseNode(ASTNode curnode) {
        ASTNode done=normalForm.get(curnode);
        if(done!=null) {
            return done;
        }
        if(!curnode.typecheck()) {
            throw ModelException.typeError("non-boolean operand", getName(), curnode);
        }

        ASTNode n=curnode;
        while(true) {
            n=sortChildren(n);
            ASTNode s=n.simplify();
            if(s==null) {
                break;
            }
            n=normaliseTree(s);
        }
        normalForm.put(curnode, n);
        normalForm.put(n, n);
        return n;
    }

    //  Normalises a whole subtree produced by simplify().
    private ASTNode normaliseTree(ASTNode node) {
        ASTNode done=normalForm.get(node);
        if(done!=null) {
            return done;
        }
        ASTNode[] ch=node.getChildrenArray();
        boolean changed=false;
        for(int i=0; i<ch.length; i++) {
            ASTNode c=normaliseTree(ch[i]);
            if(c!=ch[i]) {
                ch[i]=c;
                changed=true;
            }
        }
        return normaliseNode(changed ? node.copy(ch) : node);
    }

    private static ASTNode sortChildren(ASTNode n) {
        if(!n.childrenAreSymmetric() || n.numChildren()<2) {
            return n;
        }
        ASTNode[] ch=n.getChildrenArray();
        ASTNode[] sorted=ch.clone();
        Arrays.sort(sorted, ASTNode.canonicalOrder);
        for(int i=0; i<ch.length; i++) {
            if(!sorted[i].equals(ch[i])) {
                return n.copy(sorted);
            }
        }
        return n;
    }

    //  Normal form of a single expression, for use outside a model.
    public static ASTNode normalise(ASTNode e) {
        TransformNormalise t=new TransformNormalise(new Model());
        return t.normaliseTree(e);
    }
}
