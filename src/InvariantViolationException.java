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

//  Internal error. A pass was given something an earlier pass should have
//  eliminated, or an audited post-condition does not hold. Never caused by
//  the model itself.

public class InvariantViolationException extends RuntimeException {
    public static final long serialVersionUID = 1L;

    private final String pass;

    public InvariantViolationException(String detail, String pass, Object expression) {
        super("Internal error: "+detail+" [in "+pass+"]"+(expression==null ? "" : ": "+expression));
        this.pass=pass;
    }

    public String getPass() {
        return pass;
    }
}
