package com.naag.docsync.source;

@FunctionalInterface
public interface AccessTokenProvider {
    String getAccessToken();
}
