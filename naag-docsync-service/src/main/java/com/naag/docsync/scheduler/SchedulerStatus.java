package com.naag.docsync.scheduler;

import java.util.List;

public record SchedulerStatus(boolean running, List<PipelineStatus> pipelines) {}
