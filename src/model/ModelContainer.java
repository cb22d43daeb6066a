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

//  Runs the fixed sequence of passes over a working copy of a model for one
//  target. Owns the statistics of the run, so separate containers can run on
//  separate threads.

public class ModelContainer {
    private final Capabilities caps;

    //  Current state of the working copy.
    private Model m;

    private boolean flattened=false;

    private final LinkedHashMap<String, Integer> stats=new LinkedHashMap<String, Integer>();

    public ModelContainer(Model _m, Capabilities _caps) {
        m=_m.copy();
        caps=_caps;
    }

    public Map<String, Integer> getStats() {
        return Collections.unmodifiableMap(stats);
    }

    public Capabilities getCapabilities() {
        return caps;
    }

    //  Everything up to and including flattening. Returns the flat model.
    public Model instanceFlattening() {
        if(flattened) {
            return m;
        }
        if(caps.getTerminal()==Capabilities.Terminal.CLAUSAL && m.hasObjective()) {
            throw ModelException.notSupported("objective not supported by target", "cnf conversion", m.getObjective());
        }
        int aux0=m.global_symbols.numAuxiliaries();
        CmdFlags.printlnIfVerbose("Reformulating for "+caps);

        CmdFlags.printlnIfVerbose("Rules: Normalisation");
        m=new TransformNormalise(m).transform();
        auditFixedPoint("normalise");
        record("normalise");

        CmdFlags.printlnIfVerbose("Rules: Negation pushdown");
        m=new TransformPushNegation(m).transform();
        auditNegation("negation pushdown");
        record("negation pushdown");

        CmdFlags.printlnIfVerbose("Rules: Safening partial functions");
        m=new TransformSafen(m).transform();
        record("safening");

        CmdFlags.printlnIfVerbose("Rules: Decomposition of global constraints");
        m=new TransformDecomposeGlobals(m, caps).transform();
        auditGlobals("decomposition");
        record("decomposition");

        m=new TransformNormalise(m).transform();
        auditFixedPoint("normalise");
        m=new TransformPushNegation(m).transform();
        auditNegation("negation pushdown");
        record("normalise (2)");

        CmdFlags.printlnIfVerbose("Rules: Reification");
        m=new TransformReify(m, caps).transform();
        record("reification");

        CmdFlags.printlnIfVerbose("Rules: Flattening");
        m=new TransformToFlat(m).transform();
        auditFlat("flattening");
        record("flattening");

        if(!caps.hasNativeReification()) {
            // Flattening introduces new aux = relation constraints.
            m=new TransformReify(m, caps).transform();
            auditFlat("reification");
            record("reification (2)");
        }

        stats.put("auxiliary variables", m.global_symbols.numAuxiliaries()-aux0);
        flattened=true;
        return m;
    }

    public LinearForm mipOutput() {
        requireTerminal(Capabilities.Terminal.LINEAR);
        Model flat=instanceFlattening();
        LinearForm lf=new MIP(flat).process();
        stats.put("linear constraints", lf.getConstraints().size());
        return lf;
    }

    public ClausalForm satOutput() {
        requireTerminal(Capabilities.Terminal.CLAUSAL);
        Model flat=instanceFlattening();
        ClausalForm cf=new CNFEncoder(flat).process();
        stats.put("sat variables", cf.numVariables());
        stats.put("sat clauses", cf.numClauses());
        return cf;
    }

    //  Runs the pipeline through to the terminal form of the target.
    public Reformulation process() {
        switch(caps.getTerminal()) {
            case LINEAR:
                LinearForm lf=mipOutput();
                return new Reformulation(m, caps, lf, null, stats);
            case CLAUSAL:
                ClausalForm cf=satOutput();
                return new Reformulation(m, caps, null, cf, stats);
            default:
                Model flat=instanceFlattening();
                return new Reformulation(flat, caps, null, null, stats);
        }
    }

    private void requireTerminal(Capabilities.Terminal t) {
        if(caps.getTerminal()!=t) {
            throw new ModelException(ModelException.Kind.CONFIGURATION, "target output is "+caps.getTerminal()+", not "+t, "output", null);
        }
    }

    private void record(String pass) {
        stats.put("constraints after "+pass, m.numConstraints());
        CmdFlags.printlnIfVerbose("After "+pass+": "+m.numConstraints()+" constraints");
    }

    /////////////////////////////////////////////////////////////////////////
    //
    //   Audits, only when switched on.

    private void auditFixedPoint(String pass) {
        if(!CmdFlags.getAudit()) {
            return;
        }
        for(ASTNode c : m.getConstraints()) {
            if(!TransformNormalise.normalise(c).equals(c)) {
                throw new InvariantViolationException("not a fixed point of normalisation", pass, c);
            }
        }
    }

    private void auditNegation(String pass) {
        if(!CmdFlags.getAudit()) {
            return;
        }
        for(ASTNode c : m.getConstraints()) {
            checkNegation(c, pass);
        }
        if(m.hasObjective()) {
            checkNegation(m.getObjective(), pass);
        }
    }

    private static void checkNegation(ASTNode e, String pass) {
        if(e instanceof Negate && !(e.getChild(0) instanceof Identifier) && !(e.getChild(0) instanceof GlobalConstraint)) {
            throw new InvariantViolationException("negation not at a leaf", pass, e);
        }
        for(int i=0; i<e.numChildren(); i++) {
            checkNegation(e.getChild(i), pass);
        }
    }

    private void auditGlobals(String pass) {
        if(!CmdFlags.getAudit()) {
            return;
        }
        for(ASTNode c : m.getConstraints()) {
            checkGlobals(c, pass);
        }
        if(m.hasObjective()) {
            checkGlobals(m.getObjective(), pass);
        }
    }

    private void checkGlobals(ASTNode e, String pass) {
        if(e instanceof GlobalConstraint && !caps.supportsGlobal(((GlobalConstraint) e).getTag())) {
            throw new InvariantViolationException("unsupported global remains", pass, e);
        }
        for(int i=0; i<e.numChildren(); i++) {
            checkGlobals(e.getChild(i), pass);
        }
    }

    private void auditFlat(String pass) {
        if(!CmdFlags.getAudit()) {
            return;
        }
        for(ASTNode c : m.getConstraints()) {
            if(!TransformToFlat.isFlat(c)) {
                throw new InvariantViolationException("constraint not flat", pass, c);
            }
        }
        if(m.hasObjective() && !TransformToFlat.isFlatObjective(m.getObjective())) {
            throw new InvariantViolationException("objective not flat", pass, m.getObjective());
        }
    }
}
