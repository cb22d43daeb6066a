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
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ModelTest {
    @Test
    public void nonBooleanConstraintIsRejected() {
        Model m=new Model();
        Identifier x=m.newIntVar("x", 0, 3);
        ModelException e=assertThrows(ModelException.class, () -> m.add(new WeightedSum(x, NumberConstant.make(1))));
        assertThat(e.getKind()).isEqualTo(ModelException.Kind.TYPE_ERROR);
        assertThat(m.numConstraints()).isEqualTo(0);
    }

    @Test
    public void emptyDomainIsRejected() {
        Model m=new Model();
        ModelException e=assertThrows(ModelException.class, () -> m.newIntVar("x", 3, 2));
        assertThat(e.getKind()).isEqualTo(ModelException.Kind.TYPE_ERROR);
        assertThat(e.getExpression()).isEqualTo("x");
    }

    @Test
    public void copyHasItsOwnAuxiliaries() {
        Model m=new Model();
        Identifier x=m.newIntVar("x", 0, 3);
        m.add(new LessEqual(x, NumberConstant.make(2)));
        Model c=m.copy();
        Identifier aux=c.global_symbols.newAuxHelper(new WeightedSum(x, NumberConstant.make(1)));
        assertThat(c.global_symbols.numAuxiliaries()).isEqualTo(1);
        assertThat(m.global_symbols.numAuxiliaries()).isEqualTo(0);
        assertThat(m.global_symbols.hasVariable(aux.getVariable().getId())).isFalse();
        assertThat(c.global_symbols.getVariable(x.getVariable().getId())).isSameInstanceAs(x.getVariable());
        assertThat(c.getConstraints()).isEqualTo(m.getConstraints());
    }

    @Test
    public void identitiesAreUniqueAcrossCopies() {
        Model m=new Model();
        m.newBoolVar("a");
        Identifier u=m.copy().global_symbols.newAuxiliaryBoolean();
        Identifier v=m.copy().global_symbols.newAuxiliaryBoolean();
        assertThat(u.getVariable()).isNotEqualTo(v.getVariable());
        assertThat(u.getVariable().getName()).startsWith("aux_b");
    }

    @Test
    public void auxiliaryDomainFromBounds() {
        Model m=new Model();
        Identifier x=m.newIntVar("x", -1, 3);
        Identifier y=m.newIntVar("y", 0, 2);
        Identifier aux=m.global_symbols.newAuxHelper(new Times(x, y));
        assertThat(aux.getVariable().getBounds()).isEqualTo(new Intpair(-2, 6));
        assertThat(aux.getVariable().isAuxiliary()).isTrue();
        assertThat(m.global_symbols.getRepresents(aux.getVariable())).isEqualTo("(x * y)");
        assertThat(m.global_symbols.toString()).contains("$ (x * y)");
    }

    @Test
    public void satisfactionNeedsDefinedObjective() {
        Model m=new Model();
        Identifier x=m.newIntVar("x", 0, 2);
        Identifier y=m.newIntVar("y", 0, 2);
        m.add(new LessEqual(x, y));
        m.minimize(new Divide(x, y));
        Solution s=new Solution();
        s.setValue(x.getVariable(), 0);
        s.setValue(y.getVariable(), 0);
        assertThat(m.satisfiedBy(s)).isFalse();
        s.setValue(y.getVariable(), 1);
        assertThat(m.satisfiedBy(s)).isTrue();
        assertThat(m.getVariables()).containsExactly(x.getVariable(), y.getVariable()).inOrder();
    }
}
