package com.naag.docsync.domain;

import com.naag.docsync.source.RemoteFile;
import com.naag.docsync.transform.ExtractedContent;

import java.util.List;
import java.util.Optional;

/**
 * Maps extracted content of one file to the records of a domain.
 */
public interface RecordMapper {

    ContentDomain domain();

    /**
     * Record id to look up before downloading, when it can be derived from metadata alone.
     * Empty means the store is looked up by source file id instead.
     */
    Optional<String> lookupId(RemoteFile file);

    List<RecordDraft> map(RemoteFile file, ExtractedContent content);
}
