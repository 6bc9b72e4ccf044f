package com.naag.docsync.transform;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Stable chunk identity: the same file, page and chunk index always give the same id, so a
 * reprocessed file replaces its previous chunks.
 */
public final class ChunkIds {

    private ChunkIds() {}

    public static String chunkId(String fileId, int pageNumber, int chunkIndex) {
        String key = fileId + "_p" + pageNumber + "_" + chunkIndex;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
