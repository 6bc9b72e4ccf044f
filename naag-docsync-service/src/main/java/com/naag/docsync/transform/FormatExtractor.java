package com.naag.docsync.transform;

import com.naag.docsync.source.RemoteFile;

public interface FormatExtractor {

    ContentFormat format();

    /**
     * @throws ContentExtractionException when nothing usable can be extracted from the file
     */
    ExtractedContent extract(byte[] bytes, RemoteFile file, OcrPolicy ocrPolicy);
}
