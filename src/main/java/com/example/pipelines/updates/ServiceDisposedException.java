package com.example.pipelines.updates;

public class ServiceDisposedException extends IllegalStateException {
    public ServiceDisposedException(String message) { super(message); }
}
