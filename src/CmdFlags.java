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

//  Process-wide options and console reporting. Anything that belongs to a
//  single model (counters, statistics, the target) lives elsewhere.

public final class CmdFlags {
    private static volatile boolean verbose = false;

    //  Check pass post-conditions as the pipeline runs.
    private static volatile boolean audit = false;

    public static String version="0.3.0";

    private CmdFlags() {}

    public static boolean getVerbose() {
        return verbose;
    }
    public static void setVerbose(boolean v) {
        verbose=v;
    }

    public static boolean getAudit() {
        return audit;
    }
    public static void setAudit(boolean a) {
        audit=a;
    }

    public static void printlnIfVerbose(Object o) {
        if (verbose) {
            System.out.println(o);
        }
    }

    public static void println(Object o) {
        System.out.println(o);
    }

    public static void warning(String warn) {
        System.err.println("WARNING: "+warn);
    }

    //  Returns the arguments that were not recognised as flags.
    public static ArrayList<String> parseArguments(String[] args) {
        ArrayList<String> rest=new ArrayList<String>();
        for(int i=0; i<args.length; i++) {
            String cur=args[i];
            if(cur.equals("-v") || cur.equals("-verbose")) {
                setVerbose(true);
            }
            else if(cur.equals("-audit")) {
                setAudit(true);
            }
            else if(cur.equals("-no-audit")) {
                setAudit(false);
            }
            else if(cur.equals("-version")) {
                println("Jermyn version "+version);
            }
            else if(cur.startsWith("-")) {
                throw new ModelException(ModelException.Kind.CONFIGURATION, "unrecognised flag", "command line", cur);
            }
            else {
                rest.add(cur);
            }
        }
        return rest;
    }
}
