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
import java.util.concurrent.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ModelContainerTest {
    private Model m;
    private Identifier x;
    private Identifier y;
    private Identifier a;
    private Identifier b;

    @BeforeEach
    public void setUp() {
        m=new Model();
        x=m.newIntVar("x", -2, 2);
        y=m.newIntVar("y", -2, 2);
        a=m.newBoolVar("a");
        b=m.newBoolVar("b");
    }

    @AfterEach
    public void tearDown() {
        CmdFlags.setAudit(false);
    }

    private static List<String> strings(Model out) {
        ArrayList<String> s=new ArrayList<String>();
        for(ASTNode c : out.getConstraints()) {
            s.add(c.toString());
        }
        return s;
    }

    @Test
    public void reificationWithoutNativeSupport() {
        Model rm=new Model();
        Identifier rx=rm.newIntVar("x", 0, 10);
        Identifier rb=rm.newBoolVar("b");
        rm.add(new Equals(rb, new Greater(rx, NumberConstant.make(3))));
        Capabilities caps=new Capabilities(Collections.<String>emptySet(), false, true, true, Capabilities.Terminal.FLAT);
        Model flat=new ModelContainer(rm, caps).instanceFlattening();
        assertThat(strings(flat)).containsExactly("(b -> (3 < x))", "(!b -> (x <= 3))").inOrder();
    }

    @Test
    public void inputModelIsNotModified() {
        m.add(new Equals(a, new Less(new Times(x, y), NumberConstant.make(1))));
        String before=m.toString();
        List<ASTNode> cons=new ArrayList<ASTNode>(m.getConstraints());
        new ModelContainer(m, Capabilities.mip()).process();
        assertThat(m.toString()).isEqualTo(before);
        assertThat(m.getConstraints()).isEqualTo(cons);
        assertThat(m.global_symbols.numAuxiliaries()).isEqualTo(0);
    }

    @Test
    public void flatteningRunsOnce() {
        m.add(new Or(a, new Less(new WeightedSum(x, y), NumberConstant.make(1))));
        ModelContainer mc=new ModelContainer(m, Capabilities.cp());
        Model first=mc.instanceFlattening();
        assertThat(mc.instanceFlattening()).isSameInstanceAs(first);
    }

    @Test
    public void statisticsPerPass() {
        m.add(new AllDifferent(x, y, new WeightedSum(x, NumberConstant.make(1))));
        m.add(new Equals(a, new Less(x, y)));
        ModelContainer mc=new ModelContainer(m, Capabilities.mip());
        Reformulation r=mc.process();
        Map<String, Integer> stats=r.getStats();
        assertThat(stats).containsKey("constraints after normalise");
        assertThat(stats).containsKey("constraints after negation pushdown");
        assertThat(stats).containsKey("constraints after safening");
        assertThat(stats).containsKey("constraints after decomposition");
        assertThat(stats).containsKey("constraints after reification");
        assertThat(stats).containsKey("constraints after flattening");
        assertThat(stats).containsKey("constraints after reification (2)");
        assertThat(stats.get("linear constraints")).isEqualTo(r.getLinearForm().getConstraints().size());
        assertThat(stats).containsKey("auxiliary variables");
        assertThat(mc.getStats()).isEqualTo(stats);
    }

    @Test
    public void nativeReificationSkipsSecondPass() {
        m.add(new Equals(a, new Less(x, y)));
        ModelContainer mc=new ModelContainer(m, Capabilities.cp());
        mc.instanceFlattening();
        assertThat(mc.getStats()).doesNotContainKey("constraints after reification (2)");
        assertThat(mc.getStats()).containsEntry("auxiliary variables", 0);
    }

    @Test
    public void reformulationForEachTarget() {
        m.add(new Or(a, b));
        Reformulation cp=new ModelContainer(m, Capabilities.cp()).process();
        assertThat(cp.hasLinearForm()).isFalse();
        assertThat(cp.hasClausalForm()).isFalse();
        assertThat(cp.toString()).isEqualTo(cp.getFlatModel().toString());

        Reformulation mip=new ModelContainer(m, Capabilities.mip()).process();
        assertThat(mip.hasLinearForm()).isTrue();
        assertThat(mip.getCapabilities().getTerminal()).isEqualTo(Capabilities.Terminal.LINEAR);
        assertThat(mip.toString()).isEqualTo(mip.getLinearForm().toString());

        Reformulation sat=new ModelContainer(m, Capabilities.sat()).process();
        assertThat(sat.hasClausalForm()).isTrue();
        assertThat(sat.hasLinearForm()).isFalse();
        assertThat(sat.toString()).startsWith("p cnf ");
        assertThat(sat.getClausalForm().numClauses()).isEqualTo(1);
    }

    @Test
    public void outputMustMatchTarget() {
        m.add(new Or(a, b));
        ModelContainer mc=new ModelContainer(m, Capabilities.cp());
        ModelException e=assertThrows(ModelException.class, () -> mc.mipOutput());
        assertThat(e.getKind()).isEqualTo(ModelException.Kind.CONFIGURATION);
        assertThat(e.getPass()).isEqualTo("output");
        assertThrows(ModelException.class, () -> mc.satOutput());
    }

    @Test
    public void objectiveWithClausalTarget() {
        m.add(new Or(a, b));
        m.maximize(new WeightedSum(a, b));
        ModelException e=assertThrows(ModelException.class, () -> new ModelContainer(m, Capabilities.sat()).instanceFlattening());
        assertThat(e.getKind()).isEqualTo(ModelException.Kind.NOT_SUPPORTED);
        assertThat(e.getExpression()).isEqualTo(m.getObjective().toString());
    }

    @Test
    public void auditedPipelinesAgree() {
        CmdFlags.setAudit(true);
        Capabilities noReif=new Capabilities(Collections.<String>emptySet(), false, true, true, Capabilities.Terminal.FLAT);
        for(long seed=0; seed<60; seed++) {
            setUp();
            RandomExpressions gen=new RandomExpressions(seed, new Identifier[]{x, y}, new Identifier[]{a, b}, false);
            m.add(gen.relation(1+(int) (seed%3)));

            Model flat=new ModelContainer(m, Capabilities.cp()).instanceFlattening();
            BruteForce.assertEquisatisfiable(m, flat);

            Model flat2=new ModelContainer(m, noReif).instanceFlattening();
            BruteForce.assertEquisatisfiable(m, flat2);

            if(seed%3!=2) {
                LinearForm lf=new ModelContainer(m, Capabilities.mip()).mipOutput();
                BruteForce.assertEquisatisfiable(m, lf);
            }
        }
    }

    private static Long better(Long best, long v, boolean min) {
        if(best==null || (min ? v<best : v>best)) {
            return v;
        }
        return best;
    }

    private Long bestOriginal() {
        Long best=null;
        for(Solution s : BruteForce.assignments(BruteForce.decisionVariables(m))) {
            //  Assignments where the objective is undefined are excluded.
            Long v=m.getObjective().evaluate(s);
            if(v!=null && m.satisfiedBy(s)) {
                best=better(best, v, m.isMinimising());
            }
        }
        return best;
    }

    private Long bestFlat(Model flat) {
        List<BruteForce.Check> checks=BruteForce.checks(flat.getConstraints());
        List<Variable> free=BruteForce.newVariables(m, flat.getVariables());
        Long best=null;
        for(Solution s : BruteForce.assignments(BruteForce.decisionVariables(m))) {
            Solution ext=BruteForce.extend(s, free, checks);
            if(ext!=null) {
                best=better(best, flat.getObjective().evaluate(ext), flat.isMinimising());
            }
        }
        return best;
    }

    private Long bestLinear(LinearForm lf) {
        List<BruteForce.Check> checks=BruteForce.linearChecks(lf);
        List<Variable> free=BruteForce.newVariables(m, lf.getVariables());
        Long best=null;
        for(Solution s : BruteForce.assignments(BruteForce.decisionVariables(m))) {
            Solution ext=BruteForce.extend(s, free, checks);
            if(ext!=null) {
                best=better(best, lf.objectiveValue(ext), lf.isMinimising());
            }
        }
        return best;
    }

    @Test
    public void objectivesArePreserved() {
        Capabilities noReif=new Capabilities(Collections.<String>emptySet(), false, true, true, Capabilities.Terminal.FLAT);
        for(long seed=0; seed<40; seed++) {
            setUp();
            RandomExpressions gen=new RandomExpressions(seed, new Identifier[]{x, y}, new Identifier[]{a, b}, false);
            m.add(gen.relation(1));
            ASTNode obj=(seed%2==0) ? gen.numeric(1+(int) (seed%4)/2) : gen.relation(1);
            if(seed%3==0) {
                m.maximize(obj);
            }
            else {
                m.minimize(obj);
            }
            Long best=bestOriginal();
            String msg="seed "+seed+": "+m;

            Model flat=new ModelContainer(m, Capabilities.cp()).instanceFlattening();
            assertWithMessage(msg).that(bestFlat(flat)).isEqualTo(best);

            Model flat2=new ModelContainer(m, noReif).instanceFlattening();
            assertWithMessage(msg).that(bestFlat(flat2)).isEqualTo(best);

            LinearForm lf=new ModelContainer(m, Capabilities.mip()).mipOutput();
            assertWithMessage(msg).that(bestLinear(lf)).isEqualTo(best);
        }
    }

    @Test
    public void auditCoversGlobalsInObjective() {
        CmdFlags.setAudit(true);
        m.add(new LessEqual(x, y));
        m.minimize(new WeightedSum(new Minimum(x, y), new Maximum(x, NumberConstant.make(0))));
        Long best=bestOriginal();
        assertThat(best).isEqualTo(-2L);

        Model flat=new ModelContainer(m, Capabilities.cp("min")).instanceFlattening();
        assertThat(flat.getObjective().toString()).doesNotContain("max(");
        assertThat(bestFlat(flat)).isEqualTo(best);

        LinearForm lf=new ModelContainer(m, Capabilities.mip()).mipOutput();
        assertThat(bestLinear(lf)).isEqualTo(best);
    }

    @Test
    public void containersRunIndependently() throws Exception {
        m.add(new AllDifferent(x, y, NumberConstant.make(0)));
        m.add(new Equals(b, new LessEqual(new Times(x, y), NumberConstant.make(0))));
        ExecutorService pool=Executors.newFixedThreadPool(4);
        try {
            ArrayList<Future<Reformulation>> runs=new ArrayList<Future<Reformulation>>();
            for(int i=0; i<8; i++) {
                final Capabilities caps=(i%2==0) ? Capabilities.cp() : Capabilities.mip();
                runs.add(pool.submit(new Callable<Reformulation>() {
                    public Reformulation call() {
                        return new ModelContainer(m, caps).process();
                    }
                }));
            }
            for(int i=0; i<runs.size(); i++) {
                Reformulation r=runs.get(i).get(30, TimeUnit.SECONDS);
                assertWithMessage("run "+i).that(r.hasLinearForm()).isEqualTo(i%2==1);
                if(r.hasLinearForm()) {
                    BruteForce.assertEquisatisfiable(m, r.getLinearForm());
                }
                else {
                    BruteForce.assertEquisatisfiable(m, r.getFlatModel());
                }
            }
        }
        finally {
            pool.shutdown();
        }
    }
}
