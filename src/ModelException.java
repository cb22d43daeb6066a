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

//  A modelling error: something the caller can fix by changing the model
//  or by choosing a different target.

public class ModelException extends RuntimeException {
    public static final long serialVersionUID = 1L;

    public enum Kind {TYPE_ERROR, NOT_SUPPORTED, UNREIFIABLE, CONFIGURATION}

    private final Kind kind;
    private final String pass;
    private final String expression;

    public ModelException(Kind kind, String detail, String pass, Object expression) {
        super(kind+": "+detail+" [in "+pass+"]"+(expression==null ? "" : ": "+expression));
        this.kind=kind;
        this.pass=pass;
        this.expression=(expression==null) ? null : expression.toString();
    }

    public Kind getKind() {
        return kind;
    }

    //  Name of the pass that rejected the model.
    public String getPass() {
        return pass;
    }

    //  Description of the offending expression, may be null.
    public String getExpression() {
        return expression;
    }

    public static ModelException notSupported(String detail, String pass, Object expression) {
        return new ModelException(Kind.NOT_SUPPORTED, detail, pass, expression);
    }

    public static ModelException typeError(String detail, String pass, Object expression) {
        return new ModelException(Kind.TYPE_ERROR, detail, pass, expression);
    }
}
