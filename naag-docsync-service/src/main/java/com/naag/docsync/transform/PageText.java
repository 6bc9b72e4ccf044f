package com.naag.docsync.transform;

/** Text of one page; page numbers start at 1. */
public record PageText(int pageNumber, String text) {}
