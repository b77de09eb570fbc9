package com.vidnyan.pyguard.adapter.out.detector;

import org.junit.jupiter.api.Test;

import static com.vidnyan.pyguard.adapter.out.detector.Detection.count;
import static com.vidnyan.pyguard.adapter.out.detector.Detection.has;
import static org.junit.jupiter.api.Assertions.*;

class PerformanceRulesTest {

    @Test
    void stringConcat_ShouldTrackNamesInitializedWithStrings() {
        String source = """
                def build(items):
                    result = ""
                    for item in items:
                        result += item
                    return result
                """;

        assertEquals(1, count(source, "P001"));
    }

    @Test
    void stringConcat_ShouldDetectInAsyncLoop() {
        String source = """
                async def collect(stream):
                    text = ""
                    async for chunk in stream:
                        text += chunk
                    return text
                """;

        assertTrue(has(source, "P001"));
    }

    @Test
    void stringConcat_ShouldFlagStringOperandAndReportOncePerLoop() {
        String source = """
                for row in rows:
                    line += str(row)
                    line += ", "
                """;

        assertEquals(1, count(source, "P001"));
    }

    @Test
    void stringConcat_ShouldIgnoreNumericAccumulators() {
        String source = """
                total = 0
                for value in values:
                    total += value
                """;

        assertFalse(has(source, "P001"));
    }

    @Test
    void rangeLen_ShouldFlagLoopsAndComprehensions() {
        assertTrue(has("for i in range(len(items)):\n    print(items[i])\n", "P002"));
        assertTrue(has("pairs = [items[i] for i in range(len(items))]\n", "P002"));
        assertFalse(has("for i in range(10):\n    print(i)\n", "P002"));
    }

    @Test
    void dictKeys_ShouldFlagPlainKeysCall() {
        assertTrue(has("for key in config.keys():\n    print(key)\n", "P003"));
        assertFalse(has("for key in config:\n    print(key)\n", "P003"));
    }

    @Test
    void literalMembership_ShouldOnlyFlagInsideLoops() {
        String inLoop = """
                for user in users:
                    if user.role in ["admin", "owner"]:
                        grant(user)
                """;

        assertTrue(has(inLoop, "P004"));
        assertFalse(has("allowed = role in ['admin', 'owner']\n", "P004"));
    }

    @Test
    void regexInLoop_ShouldFlagConstantPatterns() {
        String constant = """
                for line in lines:
                    found = re.match(r"^\\d+", line)
                """;
        String precompiled = """
                for line in lines:
                    found = PATTERN.match(line)
                """;

        assertTrue(has(constant, "P005"));
        assertFalse(has(precompiled, "P005"));
    }
}
