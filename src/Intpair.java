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

//  Pair of longs, used for bounds of expressions. Both ends inclusive.

public final class Intpair {
    public final long lower;
    public final long upper;

    public Intpair(long l, long u) {
        lower=l;
        upper=u;
    }

    public boolean isEmpty() {
        return lower>upper;
    }

    public boolean contains(long val) {
        return val>=lower && val<=upper;
    }

    public long size() {
        return upper-lower+1;
    }

    public Intpair union(Intpair other) {
        return new Intpair(Math.min(lower, other.lower), Math.max(upper, other.upper));
    }

    public Intpair intersect(Intpair other) {
        return new Intpair(Math.max(lower, other.lower), Math.min(upper, other.upper));
    }

    //  Bounds of a*this where a is a constant.
    public Intpair multiply(long a) {
        long x=safeMul(lower, a);
        long y=safeMul(upper, a);
        return new Intpair(Math.min(x, y), Math.max(x, y));
    }

    public Intpair add(Intpair other) {
        return new Intpair(safeAdd(lower, other.lower), safeAdd(upper, other.upper));
    }

    @Override
    public boolean equals(Object o) {
        if(!(o instanceof Intpair)) {
            return false;
        }
        Intpair p=(Intpair) o;
        return p.lower==lower && p.upper==upper;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(lower)*31+Long.hashCode(upper);
    }

    public String toString() {
        return "["+lower+", "+upper+"]";
    }

    ////////////////////////////////////////////////////////////////////////////
    //  Saturating arithmetic for bounds. Bounds are never allowed to wrap.

    public static long safeAdd(long a, long b) {
        long r=a+b;
        if(((a^r) & (b^r)) < 0) {
            return a<0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        return r;
    }

    public static long safeMul(long a, long b) {
        long hi=Math.multiplyHigh(a, b);
        long lo=a*b;
        if((hi==0 && lo>=0) || (hi==-1 && lo<0)) {
            return lo;
        }
        return ((a<0)==(b<0)) ? Long.MAX_VALUE : Long.MIN_VALUE;
    }
}
