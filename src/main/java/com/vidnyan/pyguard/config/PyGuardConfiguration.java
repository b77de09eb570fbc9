package com.vidnyan.pyguard.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.pyguard.domain.policy.FindingAggregator;
import com.vidnyan.pyguard.domain.policy.PolicyEngine;
import com.vidnyan.pyguard.domain.report.VerdictReporter;
import com.vidnyan.pyguard.domain.rule.RuleCatalog;
import com.vidnyan.pyguard.domain.rule.RuleRegistry;
import com.vidnyan.pyguard.domain.traversal.ContextTrackingWalker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for PyGuard components.
 * The domain stays free of Spring; its services are wired here.
 */
@Slf4j
@Configuration
public class PyGuardConfiguration {

    /**
     * ObjectMapper for the hook protocol. Output must stay on a single line.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    @Bean
    public RuleRegistry ruleRegistry(List<RuleCatalog> catalogs) {
        RuleRegistry registry = RuleRegistry.fromCatalogs(catalogs);
        log.debug("Registered {} rules from {} catalogs", registry.size(), catalogs.size());
        registry.rules().forEach(rule -> log.trace("  - {}", rule));
        return registry;
    }

    @Bean
    public ContextTrackingWalker contextTrackingWalker(RuleRegistry ruleRegistry) {
        return new ContextTrackingWalker(ruleRegistry);
    }

    @Bean
    public FindingAggregator findingAggregator() {
        return new FindingAggregator();
    }

    @Bean
    public PolicyEngine policyEngine() {
        return new PolicyEngine();
    }

    @Bean
    public VerdictReporter verdictReporter() {
        return new VerdictReporter();
    }
}
