package com.example.pipelines.data;

/**
 * Cache key layout for pipeline data. Keys are plain strings; scopes are expressed as prefixes.
 */
public final class CacheKeys {

    public static final String PROJECTS = "projects";

    private CacheKeys() {}

    public static String pipelines(String projectId) {
        return "pipelines:" + projectId;
    }

    public static String runs(String projectId, int pipelineId) {
        return "runs:" + projectId + ":" + pipelineId;
    }

    /** Prefix shared by every runs entry of one project. */
    public static String projectRunsPrefix(String projectId) {
        return "runs:" + projectId + ":";
    }
}
