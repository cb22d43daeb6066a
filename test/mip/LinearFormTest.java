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

import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;

public class LinearFormTest {
    @Test
    public void termsCombineAndCancel() {
        Model m=new Model();
        Variable x=m.newIntVar("x", 0, 4).getVariable();
        Variable y=m.newIntVar("y", -1, 1).getVariable();
        LinearExpr e=LinearExpr.var(x).addTerm(y, 3).addConstant(-2);
        assertThat(e.toString()).isEqualTo("{x:1, y:3} - 2");
        assertThat(e.getBounds()).isEqualTo(new Intpair(-5, 5));
        e.add(LinearExpr.var(x), -1);
        assertThat(e.getCoefficients()).doesNotContainKey(x);
        assertThat(e.times(2).toString()).isEqualTo("{y:6} - 4");
        assertThat(LinearExpr.constant(7).isConstant()).isTrue();
    }

    @Test
    public void constantMovesToRightHandSide() {
        Model m=new Model();
        Variable x=m.newIntVar("x", 0, 4).getVariable();
        LinearConstraint c=new LinearConstraint(LinearExpr.var(x).addConstant(-3), LinearConstraint.Op.LE);
        assertThat(c.getRhs()).isEqualTo(3L);
        assertThat(c.toString()).isEqualTo("{x:1} <= 3");
        Solution s=new Solution();
        s.setValue(x, 3);
        assertThat(c.satisfiedBy(s)).isTrue();
        s.setValue(x, 4);
        assertThat(c.satisfiedBy(s)).isFalse();
    }

    @Test
    public void satisfactionRespectsBounds() {
        Model m=new Model();
        Variable x=m.newIntVar("x", 0, 4).getVariable();
        LinearConstraint c=new LinearConstraint(LinearExpr.var(x), LinearConstraint.Op.GE);
        LinearForm lf=new LinearForm(Collections.singletonList(c), LinearExpr.var(x), true);
        Solution s=new Solution();
        s.setValue(x, 5);
        assertThat(c.satisfiedBy(s)).isTrue();
        assertThat(lf.satisfiedBy(s)).isFalse();
        s.setValue(x, 2);
        assertThat(lf.satisfiedBy(s)).isTrue();
        assertThat(lf.objectiveValue(s)).isEqualTo(2L);
        assertThat(lf.toString()).startsWith("Minimize\n    {x:1}\nSubject To\n    {x:1} >= 0\nBounds\n");
    }
}
