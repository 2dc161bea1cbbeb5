package com.dependforce.dependency;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScriptNormalizer Tests")
class ScriptNormalizerTest {

    private static final String VIEW = "CREATE VIEW [dbo].[vOrders] AS SELECT Id FROM dbo.Orders";

    @Test
    @DisplayName("Strips session toggles with their batch separators")
    void testStripsToggles() {
        String script = "SET ANSI_NULLS ON\r\nGO\r\nSET QUOTED_IDENTIFIER ON\r\nGO\r\n" + VIEW + "\r\n";

        String normalized = ScriptNormalizer.normalize(script);

        assertEquals(VIEW + "\nGO", normalized);
    }

    @Test
    @DisplayName("Strips ON toggles regardless of casing and repetition")
    void testCaseAndRepetition() {
        String script = "set ansi_nulls on;\nSET QUOTED_IDENTIFIER ON\n" + VIEW
            + "\nSet Ansi_Nulls On\nset quoted_identifier on;\ngo\n";

        String normalized = ScriptNormalizer.normalize(script);

        assertEquals(VIEW + "\nGO", normalized);
    }

    @Test
    @DisplayName("Keeps OFF settings and their batch separators")
    void testKeepsOffSettings() {
        String script = "SET ANSI_NULLS OFF\nGO\nSET QUOTED_IDENTIFIER OFF\nGO\n"
            + "CREATE VIEW v AS SELECT 1 AS x WHERE NULL = NULL";

        String normalized = ScriptNormalizer.normalize(script);

        assertEquals(script + "\nGO", normalized);
        assertEquals(normalized, ScriptNormalizer.normalize(normalized));
    }

    @Test
    @DisplayName("Strips only the ON half of a mixed pair")
    void testMixedSettings() {
        String script = "SET ANSI_NULLS ON\nGO\nSET QUOTED_IDENTIFIER OFF\nGO\n" + VIEW;

        assertEquals("SET QUOTED_IDENTIFIER OFF\nGO\n" + VIEW + "\nGO", ScriptNormalizer.normalize(script));
    }

    @Test
    @DisplayName("Appends the batch terminator when the script has none")
    void testAppendsTerminator() {
        assertEquals(VIEW + "\nGO", ScriptNormalizer.normalize(VIEW));
    }

    @Test
    @DisplayName("Normalizing twice gives the same script")
    void testIdempotent() {
        String once = ScriptNormalizer.normalize("SET ANSI_NULLS ON\nGO\n" + VIEW);

        assertEquals(once, ScriptNormalizer.normalize(once));
    }

    @Test
    @DisplayName("Leaves other SET statements alone")
    void testKeepsOtherSettings() {
        String script = "SET NOCOUNT ON\n" + VIEW;

        assertTrue(ScriptNormalizer.normalize(script).startsWith("SET NOCOUNT ON"));
    }

    @Test
    @DisplayName("Null script stays null")
    void testNull() {
        assertNull(ScriptNormalizer.normalize(null));
    }

    @Test
    @DisplayName("Script made only of toggles becomes just the terminator")
    void testOnlyToggles() {
        assertEquals("GO", ScriptNormalizer.normalize("SET ANSI_NULLS ON\nGO\nSET QUOTED_IDENTIFIER ON\nGO"));
    }
}
