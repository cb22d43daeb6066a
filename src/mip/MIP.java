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

//  Linearization of a flat model. Boolean variables are 0/1 integers, a
//  negated literal not b is 1-b. Implications are encoded with big-M, where
//  M is taken from the bounds of the expression being made conditional.
//  Products and division by a constant are replaced by auxiliary variables
//  with linear defining constraints.

public class MIP
{
    private final Model m;
    private final SymbolTable gs;

    private final ArrayList<LinearConstraint> out=new ArrayList<LinearConstraint>();

    //  One auxiliary variable per distinct nonlinear expression.
    private final HashMap<ASTNode, LinearExpr> linCache=new HashMap<ASTNode, LinearExpr>();

    //  Quotient and remainder for each (dividend, divisor) pair.
    private final HashMap<ASTNode, LinearExpr[]> divModCache=new HashMap<ASTNode, LinearExpr[]>();

    public MIP(Model _m) {
        m=_m;
        gs=_m.global_symbols;
    }

    public LinearForm process() {
        for(ASTNode c : m.getConstraints()) {
            linearizeConstraint(c);
        }
        LinearExpr obj=null;
        if(m.hasObjective()) {
            obj=linObjective(m.getObjective());
        }
        CmdFlags.printlnIfVerbose("Linearization produced "+out.size()+" linear constraints");
        return new LinearForm(out, obj, m.isMinimising());
    }

    //  A boolean objective that is not a literal is replaced by a 0/1
    //  auxiliary reified to it.
    private LinearExpr linObjective(ASTNode obj) {
        if(!obj.isRelation() || isLiteral(obj)) {
            return lin(obj);
        }
        Identifier b=gs.newAuxHelper(obj);
        reified(b, obj);
        return LinearExpr.var(b.getVariable());
    }

    /////////////////////////////////////////////////////////////////////////
    //
    //   Top-level constraints

    private void linearizeConstraint(ASTNode c) {
        List<LinearExpr> none=Collections.<LinearExpr>emptyList();
        if(c instanceof Implies && isLiteral(c.getChild(0))) {
            ArrayList<LinearExpr> conds=new ArrayList<LinearExpr>();
            conds.add(lin(c.getChild(0)));
            implied(conds, c.getChild(1));
        }
        else if(c instanceof Equals && c.getChild(0).isRelation() && isLiteral(c.getChild(0)) && !isLiteral(c.getChild(1))) {
            reified(c.getChild(0), c.getChild(1));
        }
        else if(c instanceof Equals && c.getChild(1).isRelation() && isLiteral(c.getChild(1)) && !isLiteral(c.getChild(0))) {
            reified(c.getChild(1), c.getChild(0));
        }
        else {
            implied(none, c);
        }
    }

    //  b = R for a literal b and a relation R: b -> R and not b -> not R.
    private void reified(ASTNode b, ASTNode r) {
        ArrayList<LinearExpr> pos=new ArrayList<LinearExpr>();
        pos.add(lin(b));
        implied(pos, r);
        ArrayList<LinearExpr> neg=new ArrayList<LinearExpr>();
        neg.add(negate(lin(b)));
        implied(neg, TransformPushNegation.negate(r));
    }

    //  Post r conditional on every expression in conds being 1. With no
    //  conditions r is posted unconditionally.
    private void implied(List<LinearExpr> conds, ASTNode r) {
        if(r instanceof BooleanConstant) {
            if(!((BooleanConstant) r).getBoolValue()) {
                // Not all conditions hold: sum(conds) <= n-1
                LinearExpr e=LinearExpr.constant(0);
                for(LinearExpr cond : conds) {
                    e.add(cond, 1);
                }
                post(e.addConstant(-(conds.size()-1L)), LinearConstraint.Op.LE);
            }
            return;
        }
        if(isLiteral(r)) {
            implyLe(conds, lin(r).times(-1), -1);
            return;
        }
        if(r instanceof And) {
            for(int i=0; i<r.numChildren(); i++) {
                implied(conds, r.getChild(i));
            }
            return;
        }
        if(r instanceof Or) {
            LinearExpr sum=LinearExpr.constant(0);
            for(int i=0; i<r.numChildren(); i++) {
                sum.add(literal(r.getChild(i), r), 1);
            }
            implyLe(conds, sum.times(-1), -1);
            return;
        }
        if(r instanceof Implies) {
            // p -> q  is  (1-p) + q >= 1
            LinearExpr sum=negate(literal(r.getChild(0), r));
            sum.add(literal(r.getChild(1), r), 1);
            implyLe(conds, sum.times(-1), -1);
            return;
        }
        if(r instanceof Xor) {
            parity(conds, r, 1);
            return;
        }
        if(r instanceof Equals || r instanceof NotEqual || r instanceof Less || r instanceof LessEqual) {
            ASTNode a=r.getChild(0);
            ASTNode b=r.getChild(1);
            LinearExpr d=lin(a).add(lin(b), -1);
            if(r instanceof Equals && conds.isEmpty()) {
                post(d, LinearConstraint.Op.EQ);
            }
            else if(r instanceof Equals) {
                implyLe(conds, d, 0);
                implyLe(conds, d.times(-1), 0);
            }
            else if(r instanceof LessEqual) {
                implyLe(conds, d, 0);
            }
            else if(r instanceof Less) {
                implyLe(conds, d, -1);
            }
            else if(conds.isEmpty() && a.isRelation() && b.isRelation()) {
                // Two 0/1 values that differ sum to one.
                post(lin(a).add(lin(b), 1).addConstant(-1), LinearConstraint.Op.EQ);
            }
            else {
                diseq(conds, d);
            }
            return;
        }
        throw new InvariantViolationException("unexpected constraint", "linearization", r);
    }

    //  Sum of the literals in x, minus 2k, equals p, for a fresh integer k.
    private void parity(List<LinearExpr> conds, ASTNode x, long p) {
        LinearExpr e=LinearExpr.constant(-p);
        for(int i=0; i<x.numChildren(); i++) {
            e.add(literal(x.getChild(i), x), 1);
        }
        if(x.numChildren()<p) {
            implied(conds, new BooleanConstant(false));
            return;
        }
        long kmax=(x.numChildren()-p)/2;
        if(kmax>0) {
            Identifier k=gs.newAuxiliaryVariable(0, kmax);
            gs.auxVarRepresents(k.getVariable(), x);
            e.add(LinearExpr.var(k.getVariable()), -2);
        }
        implyLe(conds, e, 0);
        implyLe(conds, e.times(-1), 0);
    }

    /////////////////////////////////////////////////////////////////////////
    //
    //   Utilities

    //  expr <= k whenever every condition is 1, by big-M.
    private void implyLe(List<LinearExpr> conds, LinearExpr expr, long k) {
        LinearExpr e=expr.copy().addConstant(-k);
        if(conds.isEmpty()) {
            post(e, LinearConstraint.Op.LE);
            return;
        }
        Intpair p=expr.getBounds();
        if(p.upper<=k) {
            return;
        }
        long M=p.upper-k;
        for(LinearExpr cond : conds) {
            e.add(cond, M);
        }
        e.addConstant(-M*conds.size());
        post(e, LinearConstraint.Op.LE);
    }

    //  d != 0 under the conditions, as the disjunction d <= -1 or -d <= -1
    //  with one 0/1 variable choosing the side.
    private void diseq(List<LinearExpr> conds, LinearExpr d) {
        Identifier aux=gs.newAuxiliaryBoolean();
        LinearExpr sel=LinearExpr.var(aux.getVariable());
        ArrayList<LinearExpr> c1=new ArrayList<LinearExpr>(conds);
        c1.add(sel);
        implyLe(c1, d, -1);
        ArrayList<LinearExpr> c2=new ArrayList<LinearExpr>(conds);
        c2.add(negate(sel));
        implyLe(c2, d.times(-1), -1);
    }

    //  Negate a 0/1
    private static LinearExpr negate(LinearExpr a) {
        return a.times(-1).addConstant(1);
    }

    private void post(LinearExpr e, LinearConstraint.Op op) {
        out.add(new LinearConstraint(e, op));
    }

    private static boolean isLiteral(ASTNode n) {
        return n.isLiteral() || (n.isConstant() && n.isRelation());
    }

    private LinearExpr literal(ASTNode n, ASTNode parent) {
        if(!isLiteral(n)) {
            throw new InvariantViolationException("operand is not a literal", "linearization", parent);
        }
        return lin(n);
    }

    /////////////////////////////////////////////////////////////////////////
    //
    //   Expressions

    LinearExpr lin(ASTNode e) {
        if(e.isConstant()) {
            return LinearExpr.constant(e.getValue());
        }
        if(e instanceof Identifier) {
            return LinearExpr.var(((Identifier) e).getVariable());
        }
        if(e instanceof Negate && e.isLiteral()) {
            return negate(lin(e.getChild(0)));
        }
        if(e instanceof WeightedSum) {
            WeightedSum ws=(WeightedSum) e;
            LinearExpr sum=LinearExpr.constant(0);
            for(int i=0; i<ws.numChildren(); i++) {
                sum.add(lin(ws.getChild(i)), ws.getWeight(i));
            }
            return sum;
        }
        LinearExpr cached=linCache.get(e);
        if(cached!=null) {
            return cached.copy();
        }
        LinearExpr res;
        if(e instanceof Times) {
            res=lin(e.getChild(0));
            for(int i=1; i<e.numChildren(); i++) {
                res=product(res, lin(e.getChild(i)), e);
            }
        }
        else if((e instanceof Divide || e instanceof Mod) && e.getChild(1).isConstant()) {
            LinearExpr[] qr=divMod(e.getChild(0), e.getChild(1).getValue());
            res=(e instanceof Divide) ? qr[0] : qr[1];
        }
        else {
            throw new InvariantViolationException("cannot linearize", "linearization", e);
        }
        linCache.put(e, res);
        return res.copy();
    }

    private LinearExpr product(LinearExpr x, LinearExpr y, ASTNode e) {
        if(x.isConstant()) {
            return y.times(x.getConstant());
        }
        if(y.isConstant()) {
            return x.times(y.getConstant());
        }
        if(is01(y)) {
            return mcCormick(y, x, e);
        }
        if(is01(x)) {
            return mcCormick(x, y, e);
        }
        // Binary expansion of the narrower factor: x = lo + sum 2^i bit_i
        if(x.getBounds().size()>y.getBounds().size()) {
            LinearExpr t=x;
            x=y;
            y=t;
        }
        Intpair xb=x.getBounds();
        long range=xb.upper-xb.lower;
        LinearExpr def=x.copy().addConstant(-xb.lower);
        LinearExpr res=y.times(xb.lower);
        for(int i=0; i<64-Long.numberOfLeadingZeros(range); i++) {
            Identifier bit=gs.newAuxiliaryBoolean();
            LinearExpr b=LinearExpr.var(bit.getVariable());
            def.add(b, -(1L<<i));
            res.add(mcCormick(b, y, e), 1L<<i);
        }
        post(def, LinearConstraint.Op.EQ);
        return res;
    }

    //  z = b*y for 0/1 b.
    private LinearExpr mcCormick(LinearExpr b, LinearExpr y, ASTNode e) {
        Intpair yb=y.getBounds();
        long L=yb.lower;
        long U=yb.upper;
        Identifier zid=gs.newAuxiliaryVariable(Math.min(0, L), Math.max(0, U));
        gs.auxVarRepresents(zid.getVariable(), e);
        LinearExpr z=LinearExpr.var(zid.getVariable());
        // z <= U*b
        post(z.copy().add(b, -U), LinearConstraint.Op.LE);
        // z >= L*b
        post(b.times(L).add(z, -1), LinearConstraint.Op.LE);
        // z <= y - L*(1-b)
        post(z.copy().add(y, -1).addConstant(L).add(b, -L), LinearConstraint.Op.LE);
        // z >= y - U*(1-b)
        post(y.copy().addConstant(-U).add(b, U).add(z, -1), LinearConstraint.Op.LE);
        return z;
    }

    private static boolean is01(LinearExpr x) {
        Intpair b=x.getBounds();
        return b.lower>=0 && b.upper<=1;
    }

    //  Truncating quotient and remainder of a by the nonzero constant k:
    //  a = k*q + r, |r| < |k|, r zero or of the sign of a.
    private LinearExpr[] divMod(ASTNode a, long k) {
        if(k==0) {
            throw new InvariantViolationException("division by zero constant", "linearization", a);
        }
        ASTNode key=new Divide(a, NumberConstant.make(k));
        LinearExpr[] cached=divModCache.get(key);
        if(cached!=null) {
            return new LinearExpr[]{cached[0].copy(), cached[1].copy()};
        }
        LinearExpr la=lin(a);
        Intpair ab=la.getBounds();
        long rmax=Math.abs(k)-1;

        Intpair qb=key.getBounds();
        Identifier q=gs.newAuxiliaryVariable(qb.lower, qb.upper);
        gs.auxVarRepresents(q.getVariable(), key);
        long rlo=(ab.lower>=0) ? 0 : -rmax;
        long rhi=(ab.upper<=0) ? 0 : rmax;
        Identifier r=gs.newAuxiliaryVariable(rlo, rhi);
        gs.auxVarRepresents(r.getVariable(), new Mod(a, NumberConstant.make(k)));
        LinearExpr lq=LinearExpr.var(q.getVariable());
        LinearExpr lr=LinearExpr.var(r.getVariable());

        // a - k*q - r = 0
        post(la.copy().add(lq, -k).add(lr, -1), LinearConstraint.Op.EQ);

        if(ab.lower<0 && ab.upper>0) {
            // s=1: a >= 0 and r >= 0.  s=0: a <= -1 and r <= 0.
            Identifier s=gs.newAuxiliaryBoolean();
            List<LinearExpr> pos=Collections.singletonList(LinearExpr.var(s.getVariable()));
            List<LinearExpr> neg=Collections.singletonList(negate(LinearExpr.var(s.getVariable())));
            implyLe(pos, la.times(-1), 0);
            implyLe(pos, lr.times(-1), 0);
            implyLe(neg, la, -1);
            implyLe(neg, lr, 0);
        }
        LinearExpr[] res=new LinearExpr[]{lq, lr};
        divModCache.put(key, res);
        return new LinearExpr[]{lq.copy(), lr.copy()};
    }
}
