package com.naag.docsync.sync;

import com.naag.docsync.source.RemoteFile;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Decides whether a remote file is newer than what the store holds. Both timestamps are parsed,
 * so equal instants in different ISO-8601 spellings compare equal. Equal means unchanged.
 */
@Slf4j
public class ChangeDetector {

    /**
     * @throws DateTimeParseException when the remote timestamp cannot be parsed
     */
    public boolean isChanged(String remoteLastModified, Optional<String> storedLastModified) {
        Instant remote = RemoteFile.parseTimestamp(remoteLastModified);
        if (storedLastModified.isEmpty()) {
            return true;
        }
        Instant stored;
        try {
            stored = RemoteFile.parseTimestamp(storedLastModified.get());
        } catch (DateTimeParseException e) {
            log.warn("Unparseable stored last_modified '{}', reprocessing", storedLastModified.get());
            return true;
        }
        return remote.isAfter(stored);
    }
}
