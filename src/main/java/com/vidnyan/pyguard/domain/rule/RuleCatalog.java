package com.vidnyan.pyguard.domain.rule;

import java.util.List;

/**
 * A family of rules contributed to the registry.
 */
public interface RuleCatalog {

    List<Rule> rules();
}
