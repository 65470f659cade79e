package com.sovereign.core.gateway;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pattern tables consulted by {@link ValidationGateway}. All matching is
 * case-insensitive substring matching against the action (and, for
 * manipulation markers, the intent).
 */
@Component
@ConfigurationProperties(prefix = "sovereign.gateway")
public class GatewayProperties {

    /** Destructive operations against the system's own integrity. The only hard veto. */
    private List<String> selfPreservationPatterns = List.of(
            "rm -rf /",
            "sudo rm",
            "delete --force",
            ":(){:|:&};:",
            "delete safety",
            "disable heart",
            "remove validation",
            "shutdown sovereign",
            "bypass alignment",
            "ignore love",
            "remove heart",
            "disable conscience"
    );

    /** Markers suggesting manipulation or bypass. Advisory only. */
    private List<String> manipulationPatterns = List.of(
            "hack",
            "bypass",
            "force",
            "ignore previous",
            "disregard safety",
            "jailbreak",
            "pretend",
            "roleplay bypass",
            "forget rules"
    );

    /** Actions longer than this many characters draw a complexity warning. */
    private int complexityThreshold = 1000;

    /** Tokens that exempt a long action from the complexity warning. */
    private List<String> complexityExemptions = List.of("echo");

    public List<String> getSelfPreservationPatterns() { return selfPreservationPatterns; }
    public void setSelfPreservationPatterns(List<String> selfPreservationPatterns) { this.selfPreservationPatterns = selfPreservationPatterns; }
    public List<String> getManipulationPatterns() { return manipulationPatterns; }
    public void setManipulationPatterns(List<String> manipulationPatterns) { this.manipulationPatterns = manipulationPatterns; }
    public int getComplexityThreshold() { return complexityThreshold; }
    public void setComplexityThreshold(int complexityThreshold) { this.complexityThreshold = complexityThreshold; }
    public List<String> getComplexityExemptions() { return complexityExemptions; }
    public void setComplexityExemptions(List<String> complexityExemptions) { this.complexityExemptions = complexityExemptions; }
}
