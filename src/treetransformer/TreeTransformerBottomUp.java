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

//  Base class of the rewriting passes. Children are processed before their
//  parent; processNode then sees the node with its new children and may
//  replace it, attach a relation to the nearest enclosing relation, or post
//  a new top-level constraint. New top-level constraints are processed by
//  the same pass.
//
//  The input model is never modified. transform() returns a new model with
//  the same symbol table.

public abstract class TreeTransformerBottomUp {
    protected final Model m;
    private final String name;

    private final IdentityHashMap<ASTNode, HashMap<Integer, Result>> memo=new IdentityHashMap<ASTNode, HashMap<Integer, Result>>();
    private final ArrayDeque<ASTNode> newConstraints=new ArrayDeque<ASTNode>();

    private static final class Result {
        final ASTNode node;
        final ArrayList<ASTNode> pending;   // relations not yet conjoined
        Result(ASTNode n, ArrayList<ASTNode> p) {
            node=n;
            pending=p;
        }
    }

    protected TreeTransformerBottomUp(Model _m, String _name) {
        m=_m;
        name=_name;
    }

    //  Name of the pass, used in error messages.
    public String getName() {
        return name;
    }

    protected abstract NodeReplacement processNode(ASTNode curnode, TransformContext ctx);

    //  Allowance passed to child i of parent. Only flattening uses it.
    protected int childAllowance(ASTNode parent, int i, TransformContext ctx) {
        return 0;
    }

    protected int rootAllowance() {
        return 0;
    }

    protected int objectiveAllowance() {
        return 0;
    }

    //  Called once on each top-level constraint before it is processed.
    //  Returning null keeps it.
    protected ASTNode preprocessConstraint(ASTNode con) {
        return null;
    }

    public Model transform() {
        ArrayList<ASTNode> out=new ArrayList<ASTNode>();
        ASTNode obj=null;

        if(m.hasObjective()) {
            Result r=process(m.getObjective(), TransformContext.objective(objectiveAllowance()));
            obj=r.node;
            // Conditions for the objective to be defined.
            for(ASTNode p : r.pending) {
                addConstraint(out, p);
            }
            obj=transformObjective(obj);
        }

        for(ASTNode c : m.getConstraints()) {
            processConstraint(out, c);
            while(!newConstraints.isEmpty()) {
                processConstraint(out, newConstraints.poll());
            }
        }
        // Constraints posted while processing the objective when there are no others.
        while(!newConstraints.isEmpty()) {
            processConstraint(out, newConstraints.poll());
        }

        return new Model(m.global_symbols, out, obj, m.isMinimising());
    }

    //  Hook for a last rewrite of the transformed objective.
    protected ASTNode transformObjective(ASTNode obj) {
        return obj;
    }

    private void processConstraint(ArrayList<ASTNode> out, ASTNode c) {
        ASTNode pre=preprocessConstraint(c);
        if(pre!=null) {
            c=pre;
        }
        Result r=process(c, TransformContext.constraint(rootAllowance()));
        addConstraint(out, r.node);
        for(ASTNode p : r.pending) {
            addConstraint(out, p);
        }
    }

    //  Splits a top-level conjunction and drops true.
    private static void addConstraint(ArrayList<ASTNode> out, ASTNode c) {
        if(c instanceof And) {
            for(int i=0; i<c.numChildren(); i++) {
                addConstraint(out, c.getChild(i));
            }
        }
        else if(!(c instanceof BooleanConstant && ((BooleanConstant) c).getBoolValue())) {
            out.add(c);
        }
    }

    private Result process(ASTNode node, TransformContext ctx) {
        HashMap<Integer, Result> byCtx=memo.get(node);
        if(byCtx!=null) {
            Result r=byCtx.get(ctx.code());
            if(r!=null) {
                return r;
            }
        }
        else {
            byCtx=new HashMap<Integer, Result>();
            memo.put(node, byCtx);
        }

        ArrayList<ASTNode> pending=new ArrayList<ASTNode>();
        ASTNode[] ch=node.getChildrenArray();
        boolean changed=false;
        for(int i=0; i<ch.length; i++) {
            TransformContext cctx=ctx.child(node, i, childAllowance(node, i, ctx));
            Result r=process(ch[i], cctx);
            if(r.node!=ch[i]) {
                ch[i]=r.node;
                changed=true;
            }
            pending.addAll(r.pending);
        }

        ASTNode cur=changed ? node.copy(ch) : node;

        NodeReplacement rep=processNode(cur, ctx);
        if(rep!=null) {
            if(rep.current_node!=null) {
                cur=rep.current_node;
            }
            if(rep.new_relation!=null) {
                pending.add(rep.new_relation);
            }
            if(rep.new_constraint!=null) {
                newConstraints.add(rep.new_constraint);
            }
        }

        if(cur.isRelation() && !pending.isEmpty()) {
            ArrayList<ASTNode> conj=new ArrayList<ASTNode>();
            conj.add(cur);
            conj.addAll(pending);
            cur=new And(conj);
            pending=new ArrayList<ASTNode>();
        }

        Result res=new Result(cur, pending);
        byCtx.put(ctx.code(), res);
        return res;
    }
}
