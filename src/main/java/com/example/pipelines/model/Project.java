package com.example.pipelines.model;

public record Project(String id, String name, String description, String url) {}
