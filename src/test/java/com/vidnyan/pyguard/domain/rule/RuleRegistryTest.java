package com.vidnyan.pyguard.domain.rule;

import com.vidnyan.pyguard.domain.model.Category;
import com.vidnyan.pyguard.domain.model.Severity;
import com.vidnyan.pyguard.domain.syntax.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RuleRegistryTest {

    private static Rule rule(String code, String id, NodeKind... kinds) {
        return Rule.of(RuleDescriptor.of(code, id, Category.GOTCHA, Severity.LOW, id),
                Set.of(kinds), (node, ctx) -> Optional.empty());
    }

    @Test
    void constructor_ShouldRejectDuplicateIds() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> new RuleRegistry(List.of(
                rule("T001", "same", NodeKind.NAME),
                rule("T002", "same", NodeKind.CALL))));

        assertTrue(e.getMessage().contains("same"));
    }

    @Test
    void constructor_ShouldRejectDuplicateCodes() {
        assertThrows(IllegalStateException.class, () -> new RuleRegistry(List.of(
                rule("T001", "first", NodeKind.NAME),
                rule("T001", "second", NodeKind.CALL))));
    }

    @Test
    void constructor_ShouldRejectRulesWithoutInterests() {
        assertThrows(IllegalStateException.class, () -> new RuleRegistry(List.of(rule("T001", "idle"))));
    }

    @Test
    void rulesFor_ShouldDispatchByNodeKind() {
        Rule names = rule("T001", "names", NodeKind.NAME);
        Rule both = rule("T002", "both", NodeKind.NAME, NodeKind.CALL);
        RuleRegistry registry = new RuleRegistry(List.of(names, both));

        assertEquals(List.of(names, both), registry.rulesFor(NodeKind.NAME));
        assertEquals(List.of(both), registry.rulesFor(NodeKind.CALL));
        assertTrue(registry.rulesFor(NodeKind.RETURN).isEmpty());
    }

    @Test
    void find_ShouldMatchIdOrCodeIgnoringCase() {
        Rule target = rule("T042", "answer", NodeKind.NAME);
        RuleCatalog catalog = () -> List.of(target);
        RuleRegistry registry = RuleRegistry.fromCatalogs(List.of(catalog));

        assertEquals(Optional.of(target), registry.find("t042"));
        assertEquals(Optional.of(target), registry.find("ANSWER"));
        assertTrue(registry.find("T043").isEmpty());
        assertEquals(1, registry.size());
    }
}
