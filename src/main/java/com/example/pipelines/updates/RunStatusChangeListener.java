package com.example.pipelines.updates;

@FunctionalInterface
public interface RunStatusChangeListener {
    void onRunStatusChanged(RunStatusChangeEvent event);
}
