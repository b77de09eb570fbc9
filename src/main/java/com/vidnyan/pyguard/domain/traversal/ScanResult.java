package com.vidnyan.pyguard.domain.traversal;

import com.vidnyan.pyguard.domain.model.Finding;

import java.util.List;

/**
 * Raw output of one traversal, before filtering.
 */
public record ScanResult(
    List<Finding> findings,
    List<RuleFault> faults,
    int nodesVisited
) {

    public boolean hasFaults() {
        return !faults.isEmpty();
    }
}
