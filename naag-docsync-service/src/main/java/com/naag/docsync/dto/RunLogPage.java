package com.naag.docsync.dto;

import java.util.List;

public record RunLogPage(List<RunLogEntry> items, int page, int size, long totalElements, int totalPages) {}
