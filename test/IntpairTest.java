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

import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;

public class IntpairTest {
    @Test
    public void saturatingArithmetic() {
        assertThat(Intpair.safeAdd(Long.MAX_VALUE, 1)).isEqualTo(Long.MAX_VALUE);
        assertThat(Intpair.safeAdd(Long.MIN_VALUE, -1)).isEqualTo(Long.MIN_VALUE);
        assertThat(Intpair.safeAdd(3, -5)).isEqualTo(-2);
        assertThat(Intpair.safeMul(Long.MAX_VALUE, 2)).isEqualTo(Long.MAX_VALUE);
        assertThat(Intpair.safeMul(Long.MAX_VALUE, -2)).isEqualTo(Long.MIN_VALUE);
        assertThat(Intpair.safeMul(-4, 5)).isEqualTo(-20);
    }

    @Test
    public void multiplyByNegativeSwapsEnds() {
        assertThat(new Intpair(-1, 3).multiply(-2)).isEqualTo(new Intpair(-6, 2));
    }

    @Test
    public void unionAndIntersection() {
        Intpair a=new Intpair(0, 5);
        Intpair b=new Intpair(3, 9);
        assertThat(a.union(b)).isEqualTo(new Intpair(0, 9));
        assertThat(a.intersect(b)).isEqualTo(new Intpair(3, 5));
        assertThat(new Intpair(0, 1).intersect(new Intpair(4, 5)).isEmpty()).isTrue();
        assertThat(a.contains(5)).isTrue();
        assertThat(a.contains(6)).isFalse();
        assertThat(a.size()).isEqualTo(6);
    }
}
