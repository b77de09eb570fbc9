package com.vidnyan.pyguard.domain.policy;

/**
 * Final classification of one invocation.
 */
public enum Decision {
    SILENT,
    WARN,
    BLOCK
}
