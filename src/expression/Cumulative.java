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

//  cumulative(starts, durations, demands, capacity). The children are the n
//  starts, then the n durations, then the n demands, then the capacity.
//  Durations, demands and capacity are non-negative, and at the start time
//  of every task the total demand of the running tasks is within capacity.

public class Cumulative extends GlobalConstraint {
    private final int numTasks;

    public Cumulative(ASTNode[] starts, ASTNode[] durations, ASTNode[] demands, ASTNode capacity) {
        super(concat(starts, durations, demands, capacity));
        if(starts.length!=durations.length || starts.length!=demands.length) {
            throw new IllegalArgumentException("cumulative: starts, durations and demands differ in length");
        }
        numTasks=starts.length;
    }

    private Cumulative(ASTNode[] ch, int n) {
        super(ch);
        numTasks=n;
    }

    private static ASTNode[] concat(ASTNode[] s, ASTNode[] d, ASTNode[] r, ASTNode c) {
        ASTNode[] ch=new ASTNode[s.length+d.length+r.length+1];
        System.arraycopy(s, 0, ch, 0, s.length);
        System.arraycopy(d, 0, ch, s.length, d.length);
        System.arraycopy(r, 0, ch, s.length+d.length, r.length);
        ch[ch.length-1]=c;
        return ch;
    }

    public ASTNode copy(ASTNode[] ch) {
        return new Cumulative(ch, numTasks);
    }

    public String getTag() {
        return "cumulative";
    }

    public boolean isRelation() {
        return true;
    }

    public int numTasks() {
        return numTasks;
    }
    public ASTNode getStart(int i) {
        return getChild(i);
    }
    public ASTNode getDuration(int i) {
        return getChild(numTasks+i);
    }
    public ASTNode getDemand(int i) {
        return getChild(2*numTasks+i);
    }
    public ASTNode getCapacity() {
        return getChild(3*numTasks);
    }

    public Long evaluate(Solution s) {
        long[] v=evaluateChildren(s);
        if(undefined(v)) {
            return 0L;
        }
        int n=numTasks;
        long cap=v[3*n];
        if(cap<0) {
            return 0L;
        }
        for(int i=0; i<n; i++) {
            if(v[n+i]<0 || v[2*n+i]<0) {
                return 0L;
            }
        }
        for(int i=0; i<n; i++) {
            long t=v[i];
            long usage=0;
            for(int j=0; j<n; j++) {
                if(v[j]<=t && t<v[j]+v[n+j]) {
                    usage+=v[2*n+j];
                }
            }
            if(usage>cap) {
                return 0L;
            }
        }
        return 1L;
    }

    @Override
    protected boolean attributesEqual(ASTNode other) {
        return ((Cumulative) other).numTasks==numTasks;
    }
    @Override
    protected int attributesHash() {
        return numTasks;
    }
    @Override
    protected int compareAttributes(ASTNode other) {
        return Integer.compare(numTasks, ((Cumulative) other).numTasks);
    }

    public String toString() {
        StringBuilder b=new StringBuilder("cumulative(");
        for(int part=0; part<3; part++) {
            b.append("[");
            for(int i=0; i<numTasks; i++) {
                if(i>0) {
                    b.append(", ");
                }
                b.append(getChild(part*numTasks+i));
            }
            b.append("], ");
        }
        b.append(getCapacity());
        b.append(")");
        return b.toString();
    }
}
