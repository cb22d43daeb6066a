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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CNFEncoderTest {
    private Model m;
    private Identifier a;
    private Identifier b;
    private Identifier c;

    @BeforeEach
    public void setUp() {
        m=new Model();
        a=m.newBoolVar("a");
        b=m.newBoolVar("b");
        c=m.newBoolVar("c");
    }

    private ClausalForm encode() {
        return new ModelContainer(m, Capabilities.sat()).satOutput();
    }

    //  Random propositional formulas over a, b and c.
    private ASTNode formula(Random rnd, int depth) {
        Identifier[] vars={a, b, c};
        if(depth<=0 || rnd.nextInt(5)==0) {
            Identifier v=vars[rnd.nextInt(vars.length)];
            return rnd.nextBoolean() ? v : new Negate(v);
        }
        switch(rnd.nextInt(8)) {
            case 0:
                return new And(formula(rnd, depth-1), formula(rnd, depth-1));
            case 1:
                return new Or(new ASTNode[]{formula(rnd, depth-1), formula(rnd, depth-1), formula(rnd, depth-1)});
            case 2:
                return new Implies(formula(rnd, depth-1), formula(rnd, depth-1));
            case 3:
                return new Negate(formula(rnd, depth-1));
            case 4:
                return new Xor(formula(rnd, depth-1), formula(rnd, depth-1));
            case 5:
                return new Equals(formula(rnd, depth-1), formula(rnd, depth-1));
            case 6:
                return new NotEqual(formula(rnd, depth-1), formula(rnd, depth-1));
            default:
                return new Or(formula(rnd, depth-1), formula(rnd, depth-1));
        }
    }

    //  Extends the fixed literals to a model of the clauses, or returns null.
    private static int[] solve(ClausalForm cf, Map<Integer, Boolean> fixed) {
        int n=cf.numVariables();
        int[] val=new int[n+1];  // 0 unassigned, 1 true, -1 false
        for(Map.Entry<Integer, Boolean> e : fixed.entrySet()) {
            val[e.getKey()]=e.getValue() ? 1 : -1;
        }
        if(!search(cf, val, 1)) {
            return null;
        }
        int[] model=new int[n];
        for(int v=1; v<=n; v++) {
            model[v-1]=(val[v]>0) ? v : -v;
        }
        return model;
    }

    private static boolean search(ClausalForm cf, int[] val, int v) {
        if(falsified(cf, val)) {
            return false;
        }
        while(v<val.length && val[v]!=0) {
            v++;
        }
        if(v==val.length) {
            return true;
        }
        for(int s=1; s>=-1; s-=2) {
            val[v]=s;
            if(search(cf, val, v+1)) {
                return true;
            }
        }
        val[v]=0;
        return false;
    }

    private static boolean falsified(ClausalForm cf, int[] val) {
        for(int[] cl : cf.getClauses()) {
            boolean open=false;
            for(int lit : cl) {
                int s=val[Math.abs(lit)];
                if(s==0 || (s>0)==(lit>0)) {
                    open=true;
                    break;
                }
            }
            if(!open) {
                return true;
            }
        }
        return false;
    }

    private void assertEquisatisfiable(ClausalForm cf) {
        List<Variable> decision=BruteForce.decisionVariables(m);
        for(Variable v : decision) {
            assertThat(cf.hasLiteral(v)).isTrue();
        }
        for(Solution s : BruteForce.assignments(decision)) {
            HashMap<Integer, Boolean> fixed=new HashMap<Integer, Boolean>();
            for(Variable v : decision) {
                fixed.put(cf.getLiteral(v), s.getValue(v)==1);
            }
            int[] model=solve(cf, fixed);
            assertWithMessage("assignment "+s+" of\n"+m+"encoded as\n"+cf).that(model!=null).isEqualTo(m.satisfiedBy(s));
            if(model!=null) {
                assertThat(cf.satisfiedBy(model)).isTrue();
                Solution back=cf.decode(model);
                for(Variable v : decision) {
                    assertThat(back.getValue(v)).isEqualTo(s.getValue(v));
                }
            }
        }
    }

    @Test
    public void clauseInDimacs() {
        m.add(new Or(a, new Negate(b)));
        ClausalForm cf=encode();
        assertThat(cf.numVariables()).isEqualTo(3);
        assertThat(cf.numClauses()).isEqualTo(1);
        assertThat(cf.toString()).isEqualTo("p cnf 3 1\n-2 1 0\n");
        assertThat(cf.getVariable(-2)).isEqualTo(b.getVariable());
        assertThat(cf.getVariable(3)).isEqualTo(c.getVariable());
    }

    @Test
    public void unusedVariablesAreKept() {
        m.add(a);
        ClausalForm cf=encode();
        assertThat(cf.hasLiteral(c.getVariable())).isTrue();
        assertEquisatisfiable(cf);
    }

    @Test
    public void falseConstraintIsUnsatisfiable() {
        m.add(new BooleanConstant(false));
        ClausalForm cf=encode();
        assertThat(solve(cf, new HashMap<Integer, Boolean>())).isNull();
        assertEquisatisfiable(cf);
    }

    @Test
    public void decodeIgnoresEncoderVariables() {
        m.add(new Equals(a, new And(b, c)));
        ClausalForm cf=encode();
        int[] model=solve(cf, Collections.singletonMap(cf.getLiteral(a.getVariable()), Boolean.TRUE));
        assertThat(model).isNotNull();
        Solution s=cf.decode(model);
        assertThat(s.getValue(a.getVariable())).isEqualTo(1L);
        assertThat(s.getValue(b.getVariable())).isEqualTo(1L);
        assertThat(s.getValue(c.getVariable())).isEqualTo(1L);
    }

    @Test
    public void reificationAndParity() {
        m.add(new Equals(a, new Or(b, c)));
        m.add(new Xor(new ASTNode[]{a, b, c}));
        assertEquisatisfiable(encode());
    }

    @Test
    public void objectiveIsRejected() {
        m.add(new Or(a, b));
        m.minimize(new WeightedSum(a, b));
        ModelException e=assertThrows(ModelException.class, () -> encode());
        assertThat(e.getKind()).isEqualTo(ModelException.Kind.NOT_SUPPORTED);
        assertThat(e.getPass()).isEqualTo("cnf conversion");

        ModelException direct=assertThrows(ModelException.class, () -> new CNFEncoder(m).process());
        assertThat(direct.getKind()).isEqualTo(ModelException.Kind.NOT_SUPPORTED);
    }

    @Test
    public void randomFormulasAreEquisatisfiable() {
        for(long seed=0; seed<150; seed++) {
            setUp();
            Random rnd=new Random(seed);
            m.add(formula(rnd, 1+(int) (seed%4)));
            if(seed%3==0) {
                m.add(formula(rnd, 2));
            }
            assertEquisatisfiable(encode());
        }
    }
}
