package com.vidnyan.pyguard.domain.rule;

import com.vidnyan.pyguard.domain.syntax.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed rule catalogue plus the dispatch table from node kind to interested rules.
 * Built once at startup; immutable afterwards.
 */
public final class RuleRegistry {

    private final List<Rule> rules;
    private final Map<NodeKind, List<Rule>> dispatch;

    public RuleRegistry(List<Rule> rules) {
        Set<String> ids = new HashSet<>();
        Set<String> codes = new HashSet<>();
        Map<NodeKind, List<Rule>> table = new EnumMap<>(NodeKind.class);
        for (Rule rule : rules) {
            RuleDescriptor descriptor = rule.descriptor();
            if (!ids.add(descriptor.id())) {
                throw new IllegalStateException("Duplicate rule id: " + descriptor.id());
            }
            if (!codes.add(descriptor.code())) {
                throw new IllegalStateException("Duplicate rule code: " + descriptor.code());
            }
            if (rule.interests().isEmpty()) {
                throw new IllegalStateException("Rule " + descriptor.code() + " declares no node kinds");
            }
            for (NodeKind kind : rule.interests()) {
                table.computeIfAbsent(kind, k -> new ArrayList<>()).add(rule);
            }
        }
        table.replaceAll((kind, list) -> List.copyOf(list));
        this.rules = List.copyOf(rules);
        this.dispatch = Collections.unmodifiableMap(table);
    }

    public static RuleRegistry fromCatalogs(List<? extends RuleCatalog> catalogs) {
        List<Rule> all = new ArrayList<>();
        catalogs.forEach(catalog -> all.addAll(catalog.rules()));
        return new RuleRegistry(all);
    }

    public List<Rule> rules() {
        return rules;
    }

    public List<Rule> rulesFor(NodeKind kind) {
        return dispatch.getOrDefault(kind, List.of());
    }

    /**
     * Lookup by slug id or code.
     */
    public Optional<Rule> find(String idOrCode) {
        return rules.stream()
                .filter(rule -> rule.descriptor().id().equalsIgnoreCase(idOrCode)
                        || rule.descriptor().code().equalsIgnoreCase(idOrCode))
                .findFirst();
    }

    public int size() {
        return rules.size();
    }
}
