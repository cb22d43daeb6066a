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

//  Replaces each global the target cannot take with its decomposition.
//  A supported global relation is kept where it is a top-level conjunct, or
//  anywhere when the target reifies natively. Supported global functions
//  are kept anywhere. A supported global with no decomposition is kept in
//  a reified position too, where reification handling rejects it.

public class TransformDecomposeGlobals extends TreeTransformerBottomUp {
    private final Capabilities caps;

    public TransformDecomposeGlobals(Model _m, Capabilities _caps) {
        super(_m, "decomposition");
        caps=_caps;
    }

    @Override
    public Model transform() {
        Model out=super.transform();
        checkDomains(out);
        return out;
    }

    protected NodeReplacement processNode(ASTNode curnode, TransformContext ctx) {
        if(curnode instanceof Negate) {
            // The child was a global and has been decomposed.
            ASTNode c=curnode.getChild(0);
            if(!(c instanceof Identifier) && !(c instanceof GlobalConstraint)) {
                return new NodeReplacement(TransformPushNegation.negate(c));
            }
            return null;
        }
        if(!(curnode instanceof GlobalConstraint)) {
            return null;
        }
        GlobalConstraint g=(GlobalConstraint) curnode;
        if(keep(g, ctx)) {
            return null;
        }

        if(g instanceof AllDifferent) {
            ArrayList<ASTNode> ct=new ArrayList<ASTNode>();
            for(int i=0; i<g.numChildren(); i++) {
                for(int j=i+1; j<g.numChildren(); j++) {
                    ct.add(new NotEqual(g.getChild(i), g.getChild(j)));
                }
            }
            return new NodeReplacement(new And(ct));
        }
        if(g instanceof AllEqual) {
            ArrayList<ASTNode> ct=new ArrayList<ASTNode>();
            for(int i=1; i<g.numChildren(); i++) {
                ct.add(new Equals(g.getChild(0), g.getChild(i)));
            }
            return new NodeReplacement(new And(ct));
        }
        if(g instanceof Table) {
            return new NodeReplacement(decomposeTable((Table) g));
        }
        if(g instanceof Cumulative) {
            return new NodeReplacement(taskDecomp((Cumulative) g));
        }
        if(g instanceof Element) {
            return decomposeElement((Element) g);
        }
        if(g instanceof Minimum || g instanceof Maximum) {
            return decomposeMinMax(g, g instanceof Minimum);
        }
        if(g instanceof Abs) {
            return decomposeAbs((Abs) g);
        }
        if(g instanceof Count) {
            Count c=(Count) g;
            ArrayList<ASTNode> terms=new ArrayList<ASTNode>();
            for(int i=0; i<c.arrayLength(); i++) {
                terms.add(new Equals(c.getChild(i), c.getValueExpr()));
            }
            return new NodeReplacement(new WeightedSum(terms));
        }

        if(ctx.negated) {
            throw ModelException.notSupported("no negation available", getName(), new Negate(g));
        }
        throw ModelException.notSupported("constraint '"+g.getTag()+"' not supported by target", getName(), g);
    }

    private boolean keep(GlobalConstraint g, TransformContext ctx) {
        if(!caps.supportsGlobal(g.getTag())) {
            return false;
        }
        if(g.isFunction() || ctx.topAnd || caps.hasNativeReification()) {
            return true;
        }
        // Without a decomposition it is left for reification to reject.
        return g instanceof Circuit;
    }

    private static ASTNode decomposeTable(Table t) {
        ArrayList<ASTNode> disj=new ArrayList<ASTNode>();
        for(int i=0; i<t.numTuples(); i++) {
            long[] tup=t.getTuple(i);
            ArrayList<ASTNode> conj=new ArrayList<ASTNode>();
            for(int j=0; j<tup.length; j++) {
                conj.add(new Equals(t.getChild(j), NumberConstant.make(tup[j])));
            }
            disj.add(new And(conj));
        }
        return new Or(disj);
    }

    ////////////////////////////////////////////////////////////////////////////
    //
    //   Task decomposition of cumulative

    public static ASTNode taskDecomp(Cumulative c) {
        ArrayList<ASTNode> ct=new ArrayList<ASTNode>();

        ASTNode zero=NumberConstant.make(0);
        ASTNode bound=c.getCapacity();

        ct.add(new LessEqual(zero, bound));

        for (int i = 0; i < c.numTasks(); i++) {
            ct.add(new LessEqual(zero, c.getDuration(i)));
            ct.add(new LessEqual(zero, c.getDemand(i)));

            ct.add(new LessEqual(usage(i, c), bound));
        }

        return new And(ct);
    }

    //  Resource usage at the start time of task i.
    private static ASTNode usage(int i, Cumulative c) {
        ArrayList<ASTNode> sumTerms=new ArrayList<ASTNode>();

        for (int j = 0; j < c.numTasks(); j++) {
            sumTerms.add(
                new Times(
                    new And(
                        new LessEqual(c.getStart(j), c.getStart(i)),
                        new Less(c.getStart(i), new WeightedSum(c.getStart(j), c.getDuration(j)))
                    ),
                    c.getDemand(j)
                )
            );
        }

        return new WeightedSum(sumTerms);
    }

    ////////////////////////////////////////////////////////////////////////////
    //
    //   Global functions become an auxiliary variable defined by top-level
    //   constraints.

    private NodeReplacement decomposeElement(Element e) {
        Identifier r=m.global_symbols.newAuxHelper(e);
        Intpair p=e.getIndex().getBounds();
        long lo=Math.max(0, p.lower);
        long hi=Math.min(e.arrayLength()-1, p.upper);
        ArrayList<ASTNode> ct=new ArrayList<ASTNode>();
        for(long i=lo; i<=hi; i++) {
            ct.add(new Implies(new Equals(e.getIndex(), NumberConstant.make(i)), new Equals(r, e.getElement((int) i))));
        }
        return new NodeReplacement(r, null, new And(ct));
    }

    private NodeReplacement decomposeMinMax(GlobalConstraint g, boolean min) {
        Identifier r=m.global_symbols.newAuxHelper(g);
        ArrayList<ASTNode> ct=new ArrayList<ASTNode>();
        ArrayList<ASTNode> disj=new ArrayList<ASTNode>();
        for(int i=0; i<g.numChildren(); i++) {
            if(min) {
                ct.add(new LessEqual(r, g.getChild(i)));
            }
            else {
                ct.add(new LessEqual(g.getChild(i), r));
            }
            disj.add(new Equals(r, g.getChild(i)));
        }
        ct.add(new Or(disj));
        return new NodeReplacement(r, null, new And(ct));
    }

    private NodeReplacement decomposeAbs(Abs a) {
        ASTNode x=a.getChild(0);
        Intpair p=x.getBounds();
        if(p.lower>=0) {
            return new NodeReplacement(x);
        }
        if(p.upper<=0) {
            return new NodeReplacement(WeightedSum.negative(x));
        }
        Identifier r=m.global_symbols.newAuxHelper(a);
        ASTNode c1=new Implies(new LessEqual(NumberConstant.make(0), x), new Equals(r, x));
        ASTNode c2=new Implies(new Less(x, NumberConstant.make(0)), new Equals(r, WeightedSum.negative(x)));
        return new NodeReplacement(r, null, new And(c1, c2));
    }

    ////////////////////////////////////////////////////////////////////////////
    //  Domain restrictions of the target, checked on the rewritten model.

    private void checkDomains(Model out) {
        ArrayList<ASTNode> all=new ArrayList<ASTNode>(out.getConstraints());
        if(out.hasObjective()) {
            all.add(out.getObjective());
        }
        IdentityHashMap<ASTNode, Boolean> seen=new IdentityHashMap<ASTNode, Boolean>();
        for(ASTNode c : all) {
            checkNode(c, seen);
        }
    }

    private void checkNode(ASTNode node, IdentityHashMap<ASTNode, Boolean> seen) {
        if(seen.put(node, Boolean.TRUE)!=null) {
            return;
        }
        if(!caps.hasIntegerDomains()) {
            if(node instanceof Identifier && !((Identifier) node).getVariable().isBool()) {
                throw ModelException.notSupported("integer variable not supported by target", getName(), node);
            }
            if(!node.isRelation() && !node.isConstant() && !(node instanceof Identifier)) {
                throw ModelException.notSupported("integer expression not supported by target", getName(), node);
            }
        }
        if(!caps.hasNonLinear() && (node instanceof Divide || node instanceof Mod) && !node.getChild(1).isConstant()) {
            throw ModelException.notSupported("division by a variable not supported by target", getName(), node);
        }
        for(int i=0; i<node.numChildren(); i++) {
            checkNode(node.getChild(i), seen);
        }
    }
}
