package com.vidnyan.pyguard.application.port.out;

import com.vidnyan.pyguard.domain.model.SourceFile;
import com.vidnyan.pyguard.domain.model.StageOutcome;
import com.vidnyan.pyguard.domain.syntax.SyntaxTree;

/**
 * Port for turning source text into a syntax tree.
 * Unparsable source is a SKIPPED outcome, not an error.
 */
public interface SyntaxTreeBuilder {

    StageOutcome<SyntaxTree> build(SourceFile source);
}
