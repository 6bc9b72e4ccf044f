package com.naag.docsync.dto;

import com.naag.docsync.scheduler.TriggerResult;

public record TriggerResponse(String pipeline, TriggerResult result, String message) {

    public static TriggerResponse of(String pipeline, TriggerResult result) {
        String message = switch (result) {
            case STARTED -> "Run started in background";
            case ALREADY_RUNNING -> "Pipeline is already running";
            case INVALID_PIPELINE -> "Unknown pipeline: " + pipeline;
            case UNAVAILABLE -> "Run could not be started, try again later";
        };
        return new TriggerResponse(pipeline, result, message);
    }
}
