package com.naag.docsync.source;

import java.util.List;

/** One page of a folder listing; {@code nextPageToken} is null on the last page. */
public record FolderPage(List<RemoteFile> files, String nextPageToken) {

    public boolean hasMore() {
        return nextPageToken != null && !nextPageToken.isBlank();
    }
}
