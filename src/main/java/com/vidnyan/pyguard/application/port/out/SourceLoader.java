package com.vidnyan.pyguard.application.port.out;

import com.vidnyan.pyguard.domain.model.GuardSettings;
import com.vidnyan.pyguard.domain.model.SourceFile;
import com.vidnyan.pyguard.domain.model.StageOutcome;

/**
 * Port for reading the file under analysis.
 * Boundary, extension, existence and size checks happen here; rejections are SKIPPED outcomes.
 */
public interface SourceLoader {

    StageOutcome<SourceFile> load(String filePath, GuardSettings settings);
}
