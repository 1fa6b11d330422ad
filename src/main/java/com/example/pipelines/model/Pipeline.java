package com.example.pipelines.model;

public record Pipeline(int id,
                       String name,
                       String projectId,
                       String folder,
                       int revision,
                       String url) {}
