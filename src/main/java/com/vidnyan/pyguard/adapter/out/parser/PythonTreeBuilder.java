package com.vidnyan.pyguard.adapter.out.parser;

import com.vidnyan.pyguard.application.port.out.SyntaxTreeBuilder;
import com.vidnyan.pyguard.domain.model.SourceFile;
import com.vidnyan.pyguard.domain.model.StageOutcome;
import com.vidnyan.pyguard.domain.syntax.Ast;
import com.vidnyan.pyguard.domain.syntax.SyntaxTree;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Parses source with tree-sitter-python and maps the tree onto {@link Ast}.
 * Syntax errors are reported as SKIPPED; a syntax checker is someone else's job.
 */
@Slf4j
@Component
public class PythonTreeBuilder implements SyntaxTreeBuilder {

    @Override
    public StageOutcome<SyntaxTree> build(SourceFile source) {
        try {
            Ast.Module module = TreeSitterPythonParser.parseModule(source.content());
            return StageOutcome.ok(new SyntaxTree(module, source.lineCount()));
        } catch (PythonSyntaxException e) {
            log.debug("Syntax error in {}: {}", source.path(), e.getMessage());
            return StageOutcome.skipped("syntax error: " + e.getMessage());
        } catch (StackOverflowError e) {
            return StageOutcome.skipped("source nested too deeply to parse");
        }
    }
}
