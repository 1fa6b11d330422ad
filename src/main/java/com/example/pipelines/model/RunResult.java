package com.example.pipelines.model;

public enum RunResult {
    SUCCEEDED,
    FAILED,
    CANCELED,
    ABANDONED,
    PARTIALLY_SUCCEEDED
}
