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

public class TransformToFlatTest {
    private Model m;
    private Identifier x;
    private Identifier y;
    private Identifier z;
    private Identifier a;
    private Identifier b;

    @BeforeEach
    public void setUp() {
        m=new Model();
        x=m.newIntVar("x", -2, 2);
        y=m.newIntVar("y", -2, 2);
        z=m.newIntVar("z", 0, 3);
        a=m.newBoolVar("a");
        b=m.newBoolVar("b");
    }

    private RandomExpressions random(long seed) {
        return new RandomExpressions(seed, new Identifier[]{x, y, z}, new Identifier[]{a, b}, true);
    }

    @Test
    public void alreadyFlatConstraintIsUnchanged() {
        m.add(new Equals(new WeightedSum(x, y), NumberConstant.make(1)));
        Model in=new TransformNormalise(m).transform();
        Model out=new TransformToFlat(in).transform();
        assertThat(out.getConstraints()).isEqualTo(in.getConstraints());
        assertThat(out.global_symbols.numAuxiliaries()).isEqualTo(0);
    }

    @Test
    public void nestedOperatorGetsAuxiliary() {
        m.add(new LessEqual(new WeightedSum(new Times(x, y), z), NumberConstant.make(3)));
        Model out=new TransformToFlat(new TransformNormalise(m).transform()).transform();
        assertThat(out.global_symbols.numAuxiliaries()).isEqualTo(1);
        assertThat(out.numConstraints()).isEqualTo(2);
        for(ASTNode c : out.getConstraints()) {
            assertThat(TransformToFlat.isFlat(c)).isTrue();
        }
        BruteForce.assertEquisatisfiable(m, out);
    }

    @Test
    public void equalSubexpressionsShareOneAuxiliary() {
        Identifier[] zs=new Identifier[4];
        for(int i=0; i<zs.length; i++) {
            zs[i]=m.newIntVar("z"+i, 0, 1);
            m.add(new LessEqual(new WeightedSum(new Times(x, y), zs[i]), NumberConstant.make(3)));
        }
        Model out=new TransformToFlat(new TransformNormalise(m).transform()).transform();
        assertThat(out.global_symbols.numAuxiliaries()).isEqualTo(1);
        int definitions=0;
        for(ASTNode c : out.getConstraints()) {
            if(c instanceof Equals && c.getChild(1) instanceof Times) {
                definitions++;
            }
        }
        assertThat(definitions).isEqualTo(1);
        assertThat(out.numConstraints()).isEqualTo(5);
    }

    @Test
    public void objectiveKeepsOneLevel() {
        m.add(new LessEqual(x, y));
        m.minimize(new WeightedSum(new Times(x, y), z));
        Model out=new TransformToFlat(new TransformNormalise(m).transform()).transform();
        assertThat(TransformToFlat.isFlatObjective(out.getObjective())).isTrue();
        assertThat(out.getObjective()).isInstanceOf(WeightedSum.class);
        assertThat(out.global_symbols.numAuxiliaries()).isEqualTo(1);
    }

    @Test
    public void reifiedComparisonIsFlat() {
        m.add(new Equals(b, new Less(x, y)));
        assertThat(TransformToFlat.isFlat(m.getConstraints().get(0))).isTrue();
        assertThat(TransformToFlat.isFlat(new Equals(b, new Less(new WeightedSum(x, y), z)))).isFalse();
        assertThat(TransformToFlat.isFlat(new Or(a, new Less(x, y)))).isFalse();
        assertThat(TransformToFlat.isFlat(new Implies(a, new Less(x, y)))).isTrue();
    }

    @Test
    public void pipelineOutputIsFlat() {
        for(long seed=0; seed<200; seed++) {
            setUp();
            RandomExpressions gen=random(seed);
            m.add(gen.relation(1+(int) (seed%6)));
            Model flat=new ModelContainer(m, Capabilities.cp()).instanceFlattening();
            for(ASTNode c : flat.getConstraints()) {
                assertWithMessage("seed "+seed+": "+c).that(TransformToFlat.isFlat(c)).isTrue();
            }
        }
    }

    @Test
    public void pipelineOutputIsFlatWithoutReification() {
        Capabilities caps=new Capabilities(Collections.<String>emptySet(), false, true, true, Capabilities.Terminal.FLAT);
        for(long seed=0; seed<200; seed++) {
            setUp();
            RandomExpressions gen=random(seed);
            m.add(gen.relation(1+(int) (seed%5)));
            Model flat=new ModelContainer(m, caps).instanceFlattening();
            for(ASTNode c : flat.getConstraints()) {
                assertWithMessage("seed "+seed+": "+c).that(TransformToFlat.isFlat(c)).isTrue();
            }
        }
    }

    @Test
    public void flatteningIsEquisatisfiable() {
        for(long seed=0; seed<60; seed++) {
            setUp();
            RandomExpressions gen=random(seed);
            m.add(gen.relation(2));
            Model flat=new ModelContainer(m, Capabilities.cp()).instanceFlattening();
            BruteForce.assertEquisatisfiable(m, flat);
        }
    }
}
