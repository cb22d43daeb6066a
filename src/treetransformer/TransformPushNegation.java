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

//  Pushes negations down to the leaves, top down. Afterwards every Negate
//  has a boolean variable or a global relation as its child.
//
//  A comparison over partial operands is false where they are undefined,
//  so its negation is the inverted comparison or'ed with the negated
//  definedness condition.

public class TransformPushNegation {
    private final Model m;

    private final IdentityHashMap<ASTNode, ASTNode> positive=new IdentityHashMap<ASTNode, ASTNode>();
    private final IdentityHashMap<ASTNode, ASTNode> negative=new IdentityHashMap<ASTNode, ASTNode>();

    public TransformPushNegation(Model _m) {
        m=_m;
    }

    public String getName() {
        return "negation pushdown";
    }

    public Model transform() {
        ArrayList<ASTNode> out=new ArrayList<ASTNode>();
        for(ASTNode c : m.getConstraints()) {
            out.add(push(c, false));
        }
        ASTNode obj=m.hasObjective() ? push(m.getObjective(), false) : null;
        return new Model(m.global_symbols, out, obj, m.isMinimising());
    }

    //  Negation of a relation with the negation pushed down.
    public static ASTNode negate(ASTNode e) {
        return new TransformPushNegation(new Model()).push(e, true);
    }

    //  Push negation into every part of an expression.
    public static ASTNode pushDown(ASTNode e) {
        return new TransformPushNegation(new Model()).push(e, false);
    }

    private ASTNode push(ASTNode node, boolean neg) {
        IdentityHashMap<ASTNode, ASTNode> memo=neg ? negative : positive;
        ASTNode done=memo.get(node);
        if(done!=null) {
            return done;
        }
        ASTNode res;
        if(!neg) {
            if(node instanceof Negate) {
                res=push(node.getChild(0), true);
            }
            else {
                res=pushChildren(node);
            }
        }
        else if(isComparison(node) && !(node.getChild(0).isTotal() && node.getChild(1).isTotal())) {
            ASTNode inverted=push(node.negation(), false);
            ASTNode undefined=push(TransformSafen.definedness(node), true);
            res=new Or(inverted, undefined);
        }
        else if(node.isNegatable()) {
            res=push(node.negation(), false);
        }
        else {
            // Variables and global relations keep the wrapper.
            res=new Negate(pushChildren(node));
        }
        memo.put(node, res);
        return res;
    }

    private ASTNode pushChildren(ASTNode node) {
        if(node.numChildren()==0) {
            return node;
        }
        ASTNode[] ch=node.getChildrenArray();
        boolean changed=false;
        for(int i=0; i<ch.length; i++) {
            ASTNode c=push(ch[i], false);
            if(c!=ch[i]) {
                ch[i]=c;
                changed=true;
            }
        }
        return changed ? node.copy(ch) : node;
    }

    private static boolean isComparison(ASTNode n) {
        return n instanceof Equals || n instanceof NotEqual || n instanceof Less || n instanceof LessEqual
            || n instanceof Greater || n instanceof GreaterEqual;
    }
}
