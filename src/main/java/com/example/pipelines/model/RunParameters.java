package com.example.pipelines.model;

import java.util.Map;

/**
 * Options for triggering a run. A null branch means the repository default.
 */
public record RunParameters(String sourceBranch, Map<String, String> variables) {

    public static final String DEFAULT_BRANCH = "refs/heads/main";

    public RunParameters {
        variables = variables == null ? Map.of() : Map.copyOf(variables);
    }

    public static RunParameters defaults() {
        return new RunParameters(null, Map.of());
    }

    public String effectiveBranch() {
        return sourceBranch == null || sourceBranch.isBlank() ? DEFAULT_BRANCH : sourceBranch;
    }
}
