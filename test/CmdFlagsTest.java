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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CmdFlagsTest {
    @AfterEach
    public void reset() {
        CmdFlags.setVerbose(false);
        CmdFlags.setAudit(false);
    }

    @Test
    public void flagsAreConsumed() {
        ArrayList<String> rest=CmdFlags.parseArguments(new String[]{"-v", "model.txt", "-audit"});
        assertThat(rest).containsExactly("model.txt");
        assertThat(CmdFlags.getVerbose()).isTrue();
        assertThat(CmdFlags.getAudit()).isTrue();

        CmdFlags.parseArguments(new String[]{"-no-audit"});
        assertThat(CmdFlags.getAudit()).isFalse();
    }

    @Test
    public void unknownFlagIsConfigurationError() {
        ModelException e=assertThrows(ModelException.class, () -> CmdFlags.parseArguments(new String[]{"-fast"}));
        assertThat(e.getKind()).isEqualTo(ModelException.Kind.CONFIGURATION);
        assertThat(e.getExpression()).isEqualTo("-fast");
    }
}
