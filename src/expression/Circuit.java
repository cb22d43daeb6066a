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

//  Successor variables x_0..x_{n-1} (0-based) form a single Hamiltonian
//  circuit. There is no decomposition: a target must support it natively.

public class Circuit extends GlobalConstraint {
    public Circuit(ASTNode... ch) {
        super(ch);
    }

    public Circuit(ArrayList<ASTNode> ch) {
        super(ch);
    }

    public ASTNode copy(ASTNode[] ch) {
        return new Circuit(ch);
    }

    public String getTag() {
        return "circuit";
    }

    public boolean isRelation() {
        return true;
    }

    public Long evaluate(Solution s) {
        long[] v=evaluateChildren(s);
        if(undefined(v)) {
            return 0L;
        }
        int n=v.length;
        if(n==0) {
            return 1L;
        }
        boolean[] visited=new boolean[n];
        int cur=0;
        for(int step=0; step<n; step++) {
            if(visited[cur] || v[cur]<0 || v[cur]>=n) {
                return 0L;
            }
            visited[cur]=true;
            cur=(int) v[cur];
        }
        return bool(cur==0);
    }

    public String toString() {
        return prefix("circuit");
    }
}
