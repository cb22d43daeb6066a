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

//  Makes partial functions total. For x // d and x % d where d may be 0, and
//  for element where the index may be out of range, the condition for the
//  function to be defined is conjoined at the nearest enclosing relation.
//  Where that relation is a top-level constraint the condition is posted as
//  a constraint and the function is left alone. Otherwise the argument is
//  replaced by an auxiliary variable that always takes a safe value, in the
//  manner of SafeElementOne.

public class TransformSafen extends TreeTransformerBottomUp {
    public TransformSafen(Model _m) {
        super(_m, "safening");
    }

    protected NodeReplacement processNode(ASTNode curnode, TransformContext ctx) {
        ASTNode g=guard(curnode);
        if(g==null) {
            return null;
        }

        if(ctx.guardAtTop) {
            return new NodeReplacement(null, null, g);
        }

        if(curnode instanceof Divide || curnode instanceof Mod) {
            ASTNode d=curnode.getChild(1);
            Intpair b=d.getBounds();
            ArrayList<ASTNode> cons=new ArrayList<ASTNode>();
            Identifier aux;
            if(b.lower==0 && b.upper==0) {
                aux=m.global_symbols.newAuxiliaryVariable(1, 1);
            }
            else if(b.lower==0) {
                aux=m.global_symbols.newAuxiliaryVariable(1, b.upper);
            }
            else if(b.upper==0) {
                aux=m.global_symbols.newAuxiliaryVariable(b.lower, -1);
            }
            else {
                aux=m.global_symbols.newAuxiliaryVariable(b.lower, b.upper);
                cons.add(new NotEqual(aux, NumberConstant.make(0)));
            }
            m.global_symbols.auxVarRepresents(aux.getVariable(), d);

            //  If non-zero, aux = d.
            cons.add(new Implies(g, new Equals(aux, d)));
            //  Otherwise aux = 1.
            cons.add(new Implies(TransformPushNegation.negate(g), new Equals(aux, NumberConstant.make(1))));

            return new NodeReplacement(curnode.copy(new ASTNode[]{curnode.getChild(0), aux}), g, new And(cons));
        }

        Element e=(Element) curnode;
        int n=e.arrayLength();
        if(n==0) {
            // No safe value exists.
            return new NodeReplacement(null, new BooleanConstant(false), null);
        }
        Intpair p=e.getIndex().getBounds();
        long lo=Math.max(0, p.lower);
        long hi=Math.min(n-1, p.upper);
        if(lo>hi) {
            lo=0;
            hi=0;
        }
        Identifier aux=m.global_symbols.newAuxiliaryVariable(lo, hi);
        m.global_symbols.auxVarRepresents(aux.getVariable(), e.getIndex());

        //  If within bounds, aux = index.
        ASTNode c1=new Implies(g, new Equals(aux, e.getIndex()));
        //  Otherwise aux = lowest index.
        ASTNode c2=new Implies(TransformPushNegation.negate(g), new Equals(aux, NumberConstant.make(lo)));

        ASTNode[] ch=e.getChildrenArray();
        ch[n]=aux;
        return new NodeReplacement(e.copy(ch), g, new And(c1, c2));
    }

    //  The condition for this single operator to be defined, or null when it
    //  is always defined given its operands.
    public static ASTNode guard(ASTNode node) {
        if(node instanceof Divide || node instanceof Mod) {
            ASTNode d=node.getChild(1);
            if(d.getBounds().contains(0)) {
                return new NotEqual(d, NumberConstant.make(0));
            }
            return null;
        }
        if(node instanceof Element) {
            Element e=(Element) node;
            Intpair p=e.getIndex().getBounds();
            int n=e.arrayLength();
            ArrayList<ASTNode> g=new ArrayList<ASTNode>();
            if(p.lower<0) {
                g.add(new LessEqual(NumberConstant.make(0), e.getIndex()));
            }
            if(p.upper>n-1) {
                g.add(new LessEqual(e.getIndex(), NumberConstant.make(n-1)));
            }
            if(g.size()==0) {
                return null;
            }
            return g.size()==1 ? g.get(0) : new And(g);
        }
        return null;
    }

    //  The condition for every numerical part of a relation (or of a numerical
    //  expression) to be defined. Nested relations are always defined so the
    //  search stops at them.
    public static ASTNode definedness(ASTNode e) {
        ArrayList<ASTNode> guards=new ArrayList<ASTNode>();
        collectGuards(e, guards, true);
        if(guards.size()==0) {
            return new BooleanConstant(true);
        }
        return guards.size()==1 ? guards.get(0) : new And(guards);
    }

    private static void collectGuards(ASTNode node, ArrayList<ASTNode> guards, boolean root) {
        if(!root && node.isRelation()) {
            return;
        }
        for(int i=0; i<node.numChildren(); i++) {
            collectGuards(node.getChild(i), guards, false);
        }
        ASTNode g=guard(node);
        if(g!=null) {
            guards.add(g);
        }
    }
}
