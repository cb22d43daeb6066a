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

//  Clausal encoding of a flat boolean model. Literals map directly to
//  propositional literals. A compound boolean subexpression gets a fresh
//  propositional variable with the clauses of its full definition, shared
//  between equal subexpressions.

public class CNFEncoder {
    private final Model m;
    private final ClausalForm cnf=new ClausalForm();

    private final HashMap<ASTNode, Integer> defined=new HashMap<ASTNode, Integer>();

    public CNFEncoder(Model _m) {
        m=_m;
    }

    public ClausalForm process() {
        if(m.hasObjective()) {
            throw ModelException.notSupported("objective not supported by target", "cnf conversion", m.getObjective());
        }
        // Every decision variable is present in the output, used or not.
        for(Variable v : m.global_symbols.getVariables()) {
            if(!v.isAuxiliary() && v.isBool()) {
                cnf.getLiteral(v);
            }
        }
        List<Integer> none=Collections.<Integer>emptyList();
        for(ASTNode c : m.getConstraints()) {
            encode(none, c);
        }
        CmdFlags.printlnIfVerbose("Clausal encoding: "+cnf.numVariables()+" variables, "+cnf.numClauses()+" clauses");
        return cnf;
    }

    //  Post clauses for r, each extended with the literals in prefix.
    private void encode(List<Integer> prefix, ASTNode r) {
        if(r instanceof BooleanConstant) {
            if(!((BooleanConstant) r).getBoolValue()) {
                clause(prefix, -cnf.getTrue());
            }
            return;
        }
        if(r instanceof And) {
            for(int i=0; i<r.numChildren(); i++) {
                encode(prefix, r.getChild(i));
            }
            return;
        }
        if(r instanceof Or) {
            ArrayList<Integer> c=new ArrayList<Integer>(prefix);
            for(int i=0; i<r.numChildren(); i++) {
                c.add(lit(r.getChild(i)));
            }
            cnf.addClause(c);
            return;
        }
        if(r instanceof Implies || r instanceof LessEqual) {
            checkBoolean(r);
            ArrayList<Integer> p=new ArrayList<Integer>(prefix);
            p.add(-lit(r.getChild(0)));
            encode(p, r.getChild(1));
            return;
        }
        if(r instanceof Less) {
            // a < b for booleans: a false, b true
            checkBoolean(r);
            clause(prefix, -lit(r.getChild(0)));
            clause(prefix, lit(r.getChild(1)));
            return;
        }
        if(r instanceof Equals || r instanceof NotEqual) {
            checkBoolean(r);
            int a=lit(r.getChild(0));
            int b=lit(r.getChild(1));
            if(r instanceof NotEqual) {
                b=-b;
            }
            clause(prefix, -a, b);
            clause(prefix, a, -b);
            return;
        }
        clause(prefix, lit(r));
    }

    private void clause(List<Integer> prefix, int... lits) {
        ArrayList<Integer> c=new ArrayList<Integer>(prefix);
        for(int l : lits) {
            c.add(l);
        }
        cnf.addClause(c);
    }

    private void checkBoolean(ASTNode r) {
        for(int i=0; i<r.numChildren(); i++) {
            if(!r.getChild(i).isRelation()) {
                throw new InvariantViolationException("integer expression in clausal encoding", "cnf conversion", r);
            }
        }
    }

    //  Propositional literal equivalent to the boolean expression e.
    private int lit(ASTNode e) {
        if(e instanceof BooleanConstant) {
            return ((BooleanConstant) e).getBoolValue() ? cnf.getTrue() : -cnf.getTrue();
        }
        if(e instanceof Identifier) {
            Variable v=((Identifier) e).getVariable();
            if(!v.isBool()) {
                throw new InvariantViolationException("integer variable in clausal encoding", "cnf conversion", e);
            }
            return cnf.getLiteral(v);
        }
        if(e instanceof Negate) {
            return -lit(e.getChild(0));
        }
        Integer z=defined.get(e);
        if(z!=null) {
            return z;
        }
        int res;
        if(e instanceof GlobalConstraint || !e.isRelation()) {
            throw new InvariantViolationException("cannot encode as clauses", "cnf conversion", e);
        }
        else if(e instanceof Xor) {
            res=(e.numChildren()==0) ? -cnf.getTrue() : lit(e.getChild(0));
            for(int i=1; i<e.numChildren(); i++) {
                res=xor(res, lit(e.getChild(i)));
            }
        }
        else if(e instanceof NotEqual) {
            checkBoolean(e);
            res=xor(lit(e.getChild(0)), lit(e.getChild(1)));
        }
        else if(e instanceof Equals) {
            checkBoolean(e);
            res=-xor(lit(e.getChild(0)), lit(e.getChild(1)));
        }
        else {
            res=define(e);
        }
        defined.put(e, res);
        return res;
    }

    //  z <-> e for a conjunction, disjunction or implication.
    private int define(ASTNode e) {
        int[] ch;
        boolean conj;
        if(e instanceof And || e instanceof Or) {
            ch=new int[e.numChildren()];
            for(int i=0; i<ch.length; i++) {
                ch[i]=lit(e.getChild(i));
            }
            conj=(e instanceof And);
        }
        else if(e instanceof Implies || e instanceof LessEqual) {
            checkBoolean(e);
            ch=new int[]{-lit(e.getChild(0)), lit(e.getChild(1))};
            conj=false;
        }
        else if(e instanceof Less) {
            checkBoolean(e);
            ch=new int[]{-lit(e.getChild(0)), lit(e.getChild(1))};
            conj=true;
        }
        else {
            throw new InvariantViolationException("cannot encode as clauses", "cnf conversion", e);
        }
        int z=cnf.newVariable();
        int[] big=new int[ch.length+1];
        big[0]=conj ? z : -z;
        for(int i=0; i<ch.length; i++) {
            if(conj) {
                cnf.addClause(-z, ch[i]);
                big[i+1]=-ch[i];
            }
            else {
                cnf.addClause(z, -ch[i]);
                big[i+1]=ch[i];
            }
        }
        cnf.addClause(big);
        return z;
    }

    private int xor(int a, int b) {
        int z=cnf.newVariable();
        cnf.addClause(-z, a, b);
        cnf.addClause(-z, -a, -b);
        cnf.addClause(z, -a, b);
        cnf.addClause(z, a, -b);
        return z;
    }
}
