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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;

public class TransformSafenTest {
    private Model m;
    private Identifier x;
    private Identifier y;
    private Identifier z;
    private Identifier b;

    @BeforeEach
    public void setUp() {
        m=new Model();
        x=m.newIntVar("x", -10, 10);
        y=m.newIntVar("y", -5, 5);
        z=m.newIntVar("z", -10, 10);
        b=m.newBoolVar("b");
    }

    private static boolean containsString(Model out, String s) {
        for(ASTNode c : out.getConstraints()) {
            if(c.toString().equals(s)) {
                return true;
            }
        }
        return false;
    }

    @Test
    public void topLevelDivisionPostsDivisorCondition() {
        m.add(new Equals(z, new Divide(x, y)));
        Model out=new TransformSafen(m).transform();
        assertThat(out.numConstraints()).isEqualTo(2);
        assertThat(out.getConstraints().get(0).toString()).isEqualTo("(z = (x // y))");
        assertThat(containsString(out, "(y != 0)")).isTrue();
    }

    @Test
    public void divisionUnderDisjunctionGetsSafeDivisor() {
        m.add(new Or(b, new Equals(z, new Divide(x, y))));
        Model out=new TransformSafen(m).transform();
        // The original divisor is gone from the division.
        boolean found=false;
        for(ASTNode c : out.getConstraints()) {
            if(c.contains(Divide.class)) {
                found=true;
                assertThat(c.toString()).contains("(y != 0)");
                assertThat(c.toString()).doesNotContain("// y)");
            }
        }
        assertThat(found).isTrue();
        assertThat(out.global_symbols.numAuxiliaries()).isEqualTo(1);
        BruteForce.assertEquisatisfiable(m, out);
    }

    @Test
    public void divisorWithZeroAtEndExcludesIt() {
        Identifier d=m.newIntVar("d", 0, 3);
        m.add(new Or(b, new Equals(z, new Divide(x, d))));
        Model out=new TransformSafen(m).transform();
        Variable aux=out.global_symbols.getVariables().get(out.global_symbols.getVariables().size()-1);
        assertThat(aux.isAuxiliary()).isTrue();
        assertThat(aux.getBounds()).isEqualTo(new Intpair(1, 3));
    }

    @Test
    public void elementIndexUnderImplication() {
        Identifier i=m.newIntVar("i", -1, 3);
        ASTNode e=new Element(new ASTNode[]{x, z}, i);
        m.add(new Implies(b, new Less(e, NumberConstant.make(0))));
        Model out=new TransformSafen(m).transform();
        assertThat(out.global_symbols.numAuxiliaries()).isEqualTo(1);
        Variable aux=out.global_symbols.getVariables().get(out.global_symbols.getVariables().size()-1);
        assertThat(aux.getBounds()).isEqualTo(new Intpair(0, 1));
    }

    @Test
    public void totalDivisionIsUntouched() {
        m.add(new Or(b, new Equals(z, new Divide(x, NumberConstant.make(3)))));
        Model out=new TransformSafen(m).transform();
        assertThat(out.getConstraints()).containsExactlyElementsIn(m.getConstraints());
        assertThat(out.global_symbols.numAuxiliaries()).isEqualTo(0);
    }

    @Test
    public void definedness() {
        ASTNode e=new LessEqual(new Divide(x, y), new Mod(z, NumberConstant.make(2)));
        assertThat(TransformSafen.definedness(e).toString()).isEqualTo("(y != 0)");
        assertThat(TransformSafen.definedness(new Less(x, z))).isEqualTo(new BooleanConstant(true));
    }
}
