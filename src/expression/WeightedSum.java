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

//  Sum of children times constant weights. Also used for binary and unary
//  minus. In normal form the children are sorted, like terms are merged and
//  there is at most one constant, which comes last with weight 1.

public class WeightedSum extends ASTNode {
    private final long[] weights;

    public WeightedSum(ASTNode[] ch, long[] w) {
        super(ch);
        assert ch.length==w.length;
        weights=w.clone();
    }

    public WeightedSum(ArrayList<ASTNode> ch, ArrayList<Long> w) {
        super(ch);
        weights=new long[w.size()];
        for(int i=0; i<weights.length; i++) {
            weights[i]=w.get(i);
        }
    }

    public WeightedSum(ArrayList<ASTNode> ch) {
        super(ch);
        weights=new long[ch.size()];
        Arrays.fill(weights, 1L);
    }

    public WeightedSum(ASTNode l, ASTNode r) {
        super(l, r);
        weights=new long[]{1, 1};
    }

    //  a*weight
    public WeightedSum(ASTNode a, long weight) {
        super(a);
        weights=new long[]{weight};
    }

    public static ASTNode negative(ASTNode a) {
        return new WeightedSum(a, -1);
    }

    public ASTNode copy(ASTNode[] ch) {
        return new WeightedSum(ch, weights);
    }

    public long getWeight(int i) {
        return weights[i];
    }

    public Intpair getBounds() {
        Intpair b=new Intpair(0, 0);
        for(int i=0; i<numChildren(); i++) {
            b=b.add(getChild(i).getBounds().multiply(weights[i]));
        }
        return b;
    }

    //  Sum of the weighted constant children.
    public long constantTerm() {
        long c=0;
        for(int i=0; i<numChildren(); i++) {
            if(getChild(i).isConstant()) {
                c+=weights[i]*getChild(i).getValue();
            }
        }
        return c;
    }

    //  This sum with the constant children removed.
    public ASTNode withoutConstant() {
        ArrayList<ASTNode> ch=new ArrayList<ASTNode>();
        ArrayList<Long> w=new ArrayList<Long>();
        for(int i=0; i<numChildren(); i++) {
            if(!getChild(i).isConstant()) {
                ch.add(getChild(i));
                w.add(weights[i]);
            }
        }
        if(ch.size()==0) {
            return NumberConstant.make(0);
        }
        return new WeightedSum(ch, w);
    }

    public ASTNode simplify() {
        // Collect terms, multiplying out nested sums.
        ArrayList<ASTNode> terms=new ArrayList<ASTNode>();
        ArrayList<Long> tw=new ArrayList<Long>();
        boolean changed=false;
        for(int i=0; i<numChildren(); i++) {
            ASTNode c=getChild(i);
            if(c instanceof WeightedSum) {
                WeightedSum inner=(WeightedSum) c;
                for(int j=0; j<inner.numChildren(); j++) {
                    terms.add(inner.getChild(j));
                    tw.add(inner.weights[j]*weights[i]);
                }
                changed=true;
            }
            else {
                terms.add(c);
                tw.add(weights[i]);
            }
        }

        // Merge like terms and fold constants. The LinkedHashMap keys are
        // compared structurally.
        long constant=0;
        LinkedHashMap<ASTNode, Long> merged=new LinkedHashMap<ASTNode, Long>();
        for(int i=0; i<terms.size(); i++) {
            ASTNode t=terms.get(i);
            if(t.isConstant()) {
                constant+=tw.get(i)*t.getValue();
                continue;
            }
            Long prev=merged.get(t);
            if(prev!=null) {
                changed=true;
                merged.put(t, prev+tw.get(i));
            }
            else {
                merged.put(t, tw.get(i));
            }
        }

        ArrayList<ASTNode> ch=new ArrayList<ASTNode>();
        for(Map.Entry<ASTNode, Long> e : merged.entrySet()) {
            // A zero-weight partial term still decides whether the sum is defined.
            if(e.getValue()==0 && e.getKey().isTotal()) {
                changed=true;
                continue;
            }
            ch.add(e.getKey());
        }
        Collections.sort(ch, ASTNode.canonicalOrder);

        ArrayList<ASTNode> newch=new ArrayList<ASTNode>();
        ArrayList<Long> neww=new ArrayList<Long>();
        for(ASTNode c : ch) {
            newch.add(c);
            neww.add(merged.get(c));
        }
        if(constant!=0) {
            newch.add(NumberConstant.make(constant));
            neww.add(1L);
        }

        if(newch.size()==0) {
            return NumberConstant.make(0);
        }
        if(newch.size()==1 && neww.get(0)==1) {
            return newch.get(0);
        }
        if(newch.size()==1 && newch.get(0).isConstant()) {
            return NumberConstant.make(neww.get(0)*newch.get(0).getValue());
        }

        // Unchanged when the terms, their order and weights are the same.
        if(!changed) {
            if(newch.size()!=numChildren()) {
                changed=true;
            }
            else {
                for(int i=0; i<newch.size(); i++) {
                    if(!newch.get(i).equals(getChild(i)) || neww.get(i)!=weights[i]) {
                        changed=true;
                        break;
                    }
                }
            }
        }
        if(changed) {
            return new WeightedSum(newch, neww);
        }
        return null;
    }

    public Long evaluate(Solution s) {
        long[] v=evaluateChildren(s);
        if(v==null) {
            return null;
        }
        long total=0;
        for(int i=0; i<v.length; i++) {
            total+=weights[i]*v[i];
        }
        return total;
    }

    @Override
    protected boolean attributesEqual(ASTNode other) {
        return Arrays.equals(weights, ((WeightedSum) other).weights);
    }
    @Override
    protected int attributesHash() {
        return Arrays.hashCode(weights);
    }
    @Override
    protected int compareAttributes(ASTNode other) {
        long[] w=((WeightedSum) other).weights;
        if(weights.length!=w.length) {
            return Integer.compare(weights.length, w.length);
        }
        for(int i=0; i<weights.length; i++) {
            int r=Long.compare(weights[i], w[i]);
            if(r!=0) {
                return r;
            }
        }
        return 0;
    }

    public String toString() {
        StringBuilder b=new StringBuilder("(");
        for(int i=0; i<numChildren(); i++) {
            long w=weights[i];
            if(i==0) {
                if(w==-1) {
                    b.append("-");
                }
                else if(w!=1) {
                    b.append(w);
                    b.append("*");
                }
            }
            else if(getChild(i).isConstant()) {
                long c=w*getChild(i).getValue();
                b.append(c<0 ? " - " : " + ");
                b.append(Math.abs(c));
                continue;
            }
            else {
                b.append(w<0 ? " - " : " + ");
                long aw=Math.abs(w);
                if(aw!=1) {
                    b.append(aw);
                    b.append("*");
                }
            }
            b.append(getChild(i));
        }
        b.append(")");
        return b.toString();
    }
}
