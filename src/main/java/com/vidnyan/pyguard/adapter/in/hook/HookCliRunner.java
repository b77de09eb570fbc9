package com.vidnyan.pyguard.adapter.in.hook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Hook entry point: reads the event from stdin and writes exactly one JSON line to stdout.
 * Logs go to stderr. The process exit status stays 0 whatever the verdict.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "pyguard.hook", name = "stdin", havingValue = "true", matchIfMissing = true)
public class HookCliRunner implements CommandLineRunner {

    private final PostToolUseHandler handler;

    @Override
    public void run(String... args) throws Exception {
        process(System.in, System.out);
    }

    void process(InputStream in, OutputStream out) throws IOException {
        String payload;
        try {
            payload = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read hook payload: {}", e.getMessage());
            payload = "";
        }

        HookResponse response;
        try {
            response = handler.handle(payload);
        } catch (RuntimeException e) {
            log.error("Hook handling failed", e);
            response = HookResponse.silent();
        }

        out.write((handler.render(response) + System.lineSeparator()).getBytes(StandardCharsets.UTF_8));
        out.flush();
    }
}
