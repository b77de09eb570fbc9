package com.vidnyan.pyguard.adapter.out.detector;

import com.vidnyan.pyguard.domain.model.Severity;
import org.junit.jupiter.api.Test;

import static com.vidnyan.pyguard.adapter.out.detector.Detection.count;
import static com.vidnyan.pyguard.adapter.out.detector.Detection.first;
import static com.vidnyan.pyguard.adapter.out.detector.Detection.has;
import static org.junit.jupiter.api.Assertions.*;

class OrganizationRulesTest {

    @Test
    void localImport_ShouldFlagImportsInsideFunctions() {
        String source = """
                import os

                def load():
                    import json
                    from pathlib import Path
                    return json, Path, os
                """;

        assertEquals(2, count(source, "O001"));
    }

    @Test
    void duplicateImport_ShouldFlagRepeatedTopLevelImports() {
        String source = """
                import os
                from typing import List
                import os
                from typing import List, Dict
                """;

        assertEquals(2, count(source, "O002"));
        assertEquals(3, first(source, "O002").orElseThrow().line());
    }

    @Test
    void duplicateImport_ShouldIgnoreConditionalAndAliasedImports() {
        String source = """
                import json
                import json as stdjson
                try:
                    import ujson as json
                except ImportError:
                    import json
                """;

        assertFalse(has(source, "O002"));
    }

    @Test
    void wildcardImport_ShouldBeHighSeverity() {
        assertEquals(Severity.HIGH, first("from os import *\n", "O003").orElseThrow().severity());
        assertFalse(has("from os import path\n", "O003"));
    }

    @Test
    void godClass_ShouldFlagMoreThanTwentyMethods() {
        StringBuilder big = new StringBuilder("class Manager:\n");
        for (int i = 0; i < 21; i++) {
            big.append("    def m").append(i).append("(self):\n        pass\n");
        }
        StringBuilder small = new StringBuilder("class Manager:\n");
        for (int i = 0; i < 20; i++) {
            small.append("    def m").append(i).append("(self):\n        pass\n");
        }

        assertTrue(has(big.toString(), "O004"));
        assertFalse(has(small.toString(), "O004"));
    }

    @Test
    void leftoverDebugger_ShouldFlagBreakpointsAndPdb() {
        assertTrue(has("breakpoint()\n", "O005"));
        assertTrue(has("import pdb\n", "O005"));
        assertEquals(2, count("import pdb; pdb.set_trace()\n", "O005"));
        assertFalse(has("import logging\n", "O005"));
    }
}
