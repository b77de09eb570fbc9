package com.vidnyan.pyguard.adapter.out.detector;

import org.junit.jupiter.api.Test;

import static com.vidnyan.pyguard.adapter.out.detector.Detection.count;
import static com.vidnyan.pyguard.adapter.out.detector.Detection.first;
import static com.vidnyan.pyguard.adapter.out.detector.Detection.has;
import static org.junit.jupiter.api.Assertions.*;

class ResourceRulesTest {

    @Test
    void openWithoutContextManager_ShouldAllowWithItems() {
        assertTrue(has("f = open('data.txt')\n", "M001"));
        assertTrue(has("data = open('data.txt').read()\n", "M001"));
        assertFalse(has("with open('data.txt') as f:\n    data = f.read()\n", "M001"));
        assertFalse(has("with ExitStack() as stack:\n    f = stack.enter_context(open('a'))\n", "M001"));
    }

    @Test
    void dbOperation_ShouldRequireGuardInsideFunctions() {
        String unguarded = """
                def save_user(session, user):
                    session.add(user)
                    session.commit()
                """;
        String guarded = """
                def save_user(session, user):
                    try:
                        session.add(user)
                        session.commit()
                    except Exception:
                        session.rollback()
                        raise
                """;

        assertTrue(first(unguarded, "M002").orElseThrow().message().contains("database operation"));
        assertEquals(1, count(guarded, "M002"));
        assertEquals(6, first(guarded, "M002").orElseThrow().line());
        assertFalse(has("cursor.commit()\n", "M002"));
    }

    @Test
    void dbOperation_ShouldNotInheritGuardIntoNestedFunction() {
        String source = """
                def outer(db):
                    try:
                        def inner():
                            db.commit()
                        return inner
                    except Exception:
                        raise
                """;

        assertEquals(4, first(source, "M002").orElseThrow().line());
    }

    @Test
    void enterNotReturningSelf_ShouldFlagOtherReturnValues() {
        String none = """
                class MyContext:
                    def __enter__(self):
                        return None

                    def __exit__(self, exc_type, exc_val, exc_tb):
                        pass
                """;
        String self = """
                class MyContext:
                    def __enter__(self):
                        return self
                """;

        assertTrue(has(none, "M003"));
        assertFalse(has(self, "M003"));
    }

    @Test
    void requestWithoutTimeout_ShouldFlagRequestsAndHttpx() {
        assertTrue(has("resp = requests.get(url)\n", "M004"));
        assertTrue(has("resp = httpx.post(url, json=body)\n", "M004"));
        assertFalse(has("resp = requests.get(url, timeout=10)\n", "M004"));
        assertFalse(has("resp = requests.get(url, **options)\n", "M004"));
        assertFalse(has("resp = session.get(url)\n", "M004"));
    }

    @Test
    void endpoint_ShouldRequireTryInRouteHandler() {
        String unguarded = """
                @app.route("/users")
                def list_users():
                    return fetch_users()
                """;
        String guarded = """
                @router.get("/users")
                async def list_users():
                    try:
                        return await fetch_users()
                    except LookupError:
                        raise
                """;

        assertTrue(first(unguarded, "M005").orElseThrow().message().contains("API endpoint"));
        assertFalse(has(guarded, "M005"));
        assertFalse(has("def helper():\n    return 1\n", "M005"));
    }
}
