/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of Espalier.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.espalier.console;

import com.hellblazer.espalier.avl.tree.BalanceMode;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class PracticeSessionTest {

    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

    private static EspalierCommandLine.Config quiet(String... args) {
        var config = EspalierCommandLine.parse(args);
        config.quiet = true;
        return config;
    }

    private String output() {
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private PracticeSession session(EspalierCommandLine.Config config, String input) {
        return new PracticeSession(config, new BufferedReader(new StringReader(input)),
                                   new PrintStream(bytes, true, StandardCharsets.UTF_8));
    }

    @Test
    public void testAutomaticSessionPrintsStepsAndTree() {
        var session = session(quiet(), "a 30\na 20\na 10\ninorder\nexit\na 99\n");
        assertEquals(0, session.run());

        var out = output();
        assertTrue(out.contains("Added 10 to the tree"));
        assertTrue(out.contains("Performing right rotation on node 30"));
        assertTrue(out.contains("After insertion (before balancing):"));
        assertTrue(out.contains("|10 | ╩ |30 |"), out);
        assertTrue(out.contains("Inorder traversal: 10 -> 20 -> 30"));
        assertFalse(out.contains("Added 99"), "input after exit must be ignored");
        assertFalse(session.getEngine().snapshot().inOrder().contains(99));
    }

    @Test
    public void testBannerAndEndOfInput() {
        var session = session(EspalierCommandLine.parse(new String[] { "--mode", "practice" }), "\n");
        assertEquals(0, session.run());
        var out = output();
        assertTrue(out.startsWith("AVL Tree Practice Tool"));
        assertTrue(out.contains("Mode: Practice"));
        assertTrue(out.contains("Type 'help' for commands."));
    }

    @Test
    public void testErrorsAreReported() {
        var session = session(quiet(), "a ten\na 1000\nfly\nd 5\nhelp\n");
        session.run();
        var out = output();
        assertTrue(out.contains("✗ Invalid number"));
        assertTrue(out.contains("✗ Value must be between -99 and 999"));
        assertTrue(out.contains("✗ Invalid command. Try 'help'."));
        assertTrue(out.contains("✗ Value 5 not found in the tree!"));
        assertTrue(out.contains("config steps on/off"));
    }

    @Test
    public void testInputFailure() {
        var failing = new Reader() {
            @Override
            public void close() {
            }

            @Override
            public int read(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("boom");
            }
        };
        var session = new PracticeSession(quiet(), new BufferedReader(failing),
                                          new PrintStream(bytes, true, StandardCharsets.UTF_8));
        assertEquals(1, session.run());
        assertTrue(output().contains("✗ Input failed: boom"));
    }

    @Test
    public void testPracticeSession() {
        var session = session(quiet(), """
                                        config mode practice
                                        a 30
                                        a 20
                                        a 10
                                        hint
                                        rr 20
                                        rr 30
                                        exit
                                        """);
        session.run();
        var out = output();
        assertTrue(out.contains("Mode set to practice"));
        assertTrue(out.contains("Tree is unbalanced! Node 30 has balance factor 2"));
        assertTrue(out.contains("→ Try 'rotate right 30' (Left-Left case)"));
        assertTrue(out.contains("✗ Incorrect rotation"), out);
        assertTrue(out.contains("Performed right rotation on node 30"));
        assertTrue(out.contains("Tree is balanced!"));
        assertEquals(BalanceMode.PRACTICE, session.getEngine().getMode());
        assertEquals("(10 20 30)", session.getEngine().snapshot().toString());
    }

    @Test
    public void testSettings() {
        var session = session(quiet(), "config autoshow off\nconfig steps off\na 30\na 20\na 10\ntree\n");
        session.run();
        var out = output();
        assertTrue(out.contains("Auto-show tree disabled"));
        assertTrue(out.contains("Show steps disabled"));
        assertFalse(session.getEngine().isShowSteps());
        assertFalse(out.contains("Step 1"));
        assertFalse(out.contains("After insertion"));
        // only the explicit tree command prints a grid
        assertEquals(1, out.split("\\|10 \\| ╩ \\|30 \\|", -1).length - 1);
    }
}
