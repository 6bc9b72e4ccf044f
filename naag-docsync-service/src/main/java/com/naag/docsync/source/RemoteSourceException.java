package com.naag.docsync.source;

/**
 * Transport failure talking to the remote drive (network, auth, throttling).
 */
public class RemoteSourceException extends RuntimeException {

    private final int statusCode;

    public RemoteSourceException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public RemoteSourceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
