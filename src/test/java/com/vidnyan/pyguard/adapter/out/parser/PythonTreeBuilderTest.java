package com.vidnyan.pyguard.adapter.out.parser;

import com.vidnyan.pyguard.domain.model.SourceFile;
import com.vidnyan.pyguard.domain.model.StageOutcome;
import com.vidnyan.pyguard.domain.syntax.Ast;
import com.vidnyan.pyguard.domain.syntax.NodeKind;
import com.vidnyan.pyguard.domain.syntax.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PythonTreeBuilderTest {

    private final PythonTreeBuilder builder = new PythonTreeBuilder();

    private static SourceFile source(String content) {
        return new SourceFile(Path.of("module.py"), content, SourceFile.countLines(content));
    }

    @Test
    void build_ValidSource_ShouldReturnTree() {
        StageOutcome<SyntaxTree> outcome = builder.build(source("def f():\n    return 1\n"));

        assertTrue(outcome.isOk());
        assertEquals(1, outcome.value().module().body().size());
        assertEquals(2, outcome.value().lineCount());
    }

    @Test
    void build_EmptySource_ShouldReturnEmptyModule() {
        StageOutcome<SyntaxTree> outcome = builder.build(source(""));

        assertTrue(outcome.isOk());
        assertTrue(outcome.value().module().body().isEmpty());
    }

    @Test
    void build_SyntaxError_ShouldSkipWithReason() {
        StageOutcome<SyntaxTree> outcome = builder.build(source("def broken(:\n"));

        assertEquals(StageOutcome.Status.SKIPPED, outcome.status());
        assertNull(outcome.value());
        assertTrue(outcome.reason().startsWith("syntax error"));
    }

    @Test
    void build_TypeAliasStatement_ShouldParseAsAssignment() {
        StageOutcome<SyntaxTree> outcome = builder.build(source("type Alias = list[int]\n"));

        assertTrue(outcome.isOk());
        Ast.Assign alias = (Ast.Assign) outcome.value().module().body().get(0);
        assertEquals("Alias", ((Ast.Name) alias.targets().get(0)).id());
        assertEquals(NodeKind.SUBSCRIPT, alias.value().kind());
    }

    @Test
    void build_NonAsciiSource_ShouldReportCharacterColumns() {
        StageOutcome<SyntaxTree> outcome = builder.build(source("s = 'héllo'; x = 1\n"));

        assertTrue(outcome.isOk());
        assertEquals(13, outcome.value().module().body().get(1).span().column());
    }

    @Test
    void build_PythonTwoPrint_ShouldSkip() {
        StageOutcome<SyntaxTree> outcome = builder.build(source("print \"hello\"\n"));

        assertEquals(StageOutcome.Status.SKIPPED, outcome.status());
    }
}
