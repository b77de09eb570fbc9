package com.vidnyan.pyguard.adapter.out.detector;

import com.vidnyan.pyguard.domain.model.Category;
import com.vidnyan.pyguard.domain.rule.Rule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RuleCatalogsTest {

    private static final Pattern ID = Pattern.compile("[a-z0-9]+(-[a-z0-9]+)*");

    @Test
    void registry_ShouldHoldTheFullCatalogue() {
        assertEquals(55, Detection.REGISTRY.size());

        Map<Category, Long> perCategory = Detection.REGISTRY.rules().stream()
                .collect(Collectors.groupingBy(rule -> rule.descriptor().category(), Collectors.counting()));
        assertEquals(11L, perCategory.get(Category.RUNTIME));
        assertEquals(5L, perCategory.get(Category.PERFORMANCE));
        assertEquals(10L, perCategory.get(Category.COMPLEXITY));
        assertEquals(9L, perCategory.get(Category.SECURITY));
        assertEquals(5L, perCategory.get(Category.ORGANIZATION));
        assertEquals(5L, perCategory.get(Category.RESOURCE));
        assertEquals(10L, perCategory.get(Category.GOTCHA));
    }

    @Test
    void descriptors_ShouldUseKebabCaseIdsAndCategoryPrefixedCodes() {
        Map<Category, String> prefixes = Map.of(
                Category.RUNTIME, "R", Category.PERFORMANCE, "P", Category.COMPLEXITY, "C",
                Category.SECURITY, "S", Category.ORGANIZATION, "O", Category.RESOURCE, "M",
                Category.GOTCHA, "G");

        for (Rule rule : Detection.REGISTRY.rules()) {
            String code = rule.descriptor().code();
            assertTrue(ID.matcher(rule.id()).matches(), rule.id());
            assertTrue(code.matches("[A-Z]\\d{3}"), code);
            assertEquals(prefixes.get(rule.descriptor().category()), code.substring(0, 1), code);
            assertFalse(rule.descriptor().title().isBlank(), code);
        }
    }

    @Test
    void find_ShouldResolveKnownRules() {
        assertEquals("R001", Detection.REGISTRY.find("mutable-default").orElseThrow().descriptor().code());
        assertTrue(Detection.REGISTRY.find("G010").isPresent());
        assertTrue(Detection.REGISTRY.find("S010").isEmpty());
    }

    @Test
    void cleanSource_ShouldProduceNoFindings() {
        List<String> codes = Detection.codes("""
                import logging

                logger = logging.getLogger(__name__)


                def total(values):
                    result = 0
                    for value in values:
                        result += value
                    return result
                """);

        assertEquals(List.of(), codes);
    }
}
