package com.vidnyan.pyguard.adapter.out.detector;

import com.vidnyan.pyguard.domain.model.Finding;
import com.vidnyan.pyguard.domain.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.pyguard.adapter.out.detector.Detection.codes;
import static com.vidnyan.pyguard.adapter.out.detector.Detection.count;
import static com.vidnyan.pyguard.adapter.out.detector.Detection.first;
import static com.vidnyan.pyguard.adapter.out.detector.Detection.has;
import static org.junit.jupiter.api.Assertions.*;

class SecurityRulesTest {

    @Test
    void injection_ShouldFlagFormattedQuery() {
        String source = "cursor.execute(f\"SELECT * FROM t WHERE id={user_id}\")\n";

        assertEquals(List.of("S001"), codes(source));
        Finding finding = first(source, "S001").orElseThrow();
        assertEquals(Severity.CRITICAL, finding.severity());
        assertEquals("injection-heuristic", finding.ruleId());
    }

    @Test
    void injection_ShouldFlagConcatenationPercentAndFormat() {
        assertTrue(has("cursor.execute(\"SELECT * FROM t WHERE id=\" + user_id)\n", "S001"));
        assertTrue(has("cursor.execute(\"SELECT * FROM t WHERE id=%s\" % user_id)\n", "S001"));
        assertTrue(has("db.execute(\"DELETE FROM t WHERE id={}\".format(user_id))\n", "S001"));
    }

    @Test
    void injection_ShouldAcceptConcatenatedLiterals() {
        assertFalse(has("cursor.execute('SELECT 1' + ' FROM t')\n", "S001"));
        assertFalse(has("cursor.execute('SELECT *' + ' FROM t' + ' WHERE id = %s', (user_id,))\n", "S001"));
        assertTrue(has("cursor.execute('SELECT *' + ' FROM t WHERE id = ' + user_id)\n", "S001"));
    }

    @Test
    void injection_ShouldAcceptParameterizedQuery() {
        assertFalse(has("cursor.execute(\"SELECT * FROM t WHERE id=%s\", (user_id,))\n", "S001"));
        assertFalse(has("cursor.execute(QUERY, params)\n", "S001"));
    }

    @Test
    void commandInjection_ShouldFlagShellTrueAndDynamicOsSystem() {
        String source = """
                import subprocess
                user_input = input("Enter filename: ")
                subprocess.run(f"cat {user_input}", shell=True)
                """;

        assertEquals(Severity.CRITICAL, first(source, "S002").orElseThrow().severity());
        assertTrue(has("os.system(\"rm -rf \" + path)\n", "S002"));
        assertFalse(has("subprocess.run([\"ls\", \"-l\"])\n", "S002"));
        assertFalse(has("os.system(\"clear\")\n", "S002"));
    }

    @Test
    void hardcodedSecret_ShouldFlagRealLookingValues() {
        String source = """
                PASSWORD = "super_secret_password"
                API_KEY = "sk_live_abc123xyz789"
                """;

        assertEquals(2, count(source, "S003"));
    }

    @Test
    void hardcodedSecret_ShouldIgnorePlaceholders() {
        String source = """
                PASSWORD = "TODO"
                API_KEY = "your-key-here"
                token = ""
                secret = os.environ["SECRET"]
                """;

        assertFalse(has(source, "S003"));
    }

    @Test
    void weakHash_ShouldFlagMd5AndSha1() {
        assertTrue(has("digest = hashlib.md5(password.encode()).hexdigest()\n", "S004"));
        assertTrue(has("h = hashlib.new(\"SHA1\")\n", "S004"));
        assertFalse(has("h = hashlib.sha256(data)\n", "S004"));
    }

    @Test
    void unsafeDeserialization_ShouldFlagPickleAndUnsafeYaml() {
        String pickled = """
                import pickle
                with open('data.pkl', 'rb') as f:
                    data = pickle.load(f)
                """;

        assertTrue(has(pickled, "S005"));
        assertTrue(has("config = yaml.load(stream)\n", "S005"));
        assertFalse(has("config = yaml.load(stream, Loader=yaml.SafeLoader)\n", "S005"));
        assertFalse(has("config = yaml.safe_load(stream)\n", "S005"));
    }

    @Test
    void tlsVerification_ShouldFlagVerifyFalse() {
        assertTrue(has("requests.get(url, verify=False, timeout=5)\n", "S006"));
        assertFalse(has("requests.get(url, verify=True, timeout=5)\n", "S006"));
    }

    @Test
    void weakRandom_ShouldFlagSensitiveNamesOnly() {
        assertTrue(has("token = random.randint(1000, 9999)\n", "S007"));
        assertFalse(has("delay = random.uniform(0.1, 0.5)\n", "S007"));
    }

    @Test
    void insecureTempfileAndDebugMode_ShouldBeReported() {
        assertTrue(has("path = tempfile.mktemp()\n", "S008"));
        assertTrue(has("app.run(debug=True)\n", "S009"));
        assertFalse(has("app.run(debug=False)\n", "S009"));
    }
}
