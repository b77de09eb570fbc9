package com.vidnyan.pyguard;

import com.vidnyan.pyguard.adapter.in.hook.HookResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * PyGuard - Python antipattern guard.
 * 
 * Runs once per edited file as a post-tool-use hook: JSON in on stdin, one JSON decision out on stdout.
 */
@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
public class PyGuardApplication {

    public static void main(String[] args) {
        try {
            SpringApplication.exit(SpringApplication.run(PyGuardApplication.class, args));
        } catch (RuntimeException e) {
            log.error("PyGuard failed to start", e);
            System.out.println(HookResponse.SILENT_JSON);
        }
        System.exit(0);
    }
}
