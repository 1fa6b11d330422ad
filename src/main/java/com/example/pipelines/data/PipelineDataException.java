package com.example.pipelines.data;

public class PipelineDataException extends RuntimeException {
    public PipelineDataException(String message, Throwable cause) { super(message, cause); }
}
