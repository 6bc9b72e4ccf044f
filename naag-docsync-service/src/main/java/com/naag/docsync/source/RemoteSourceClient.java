package com.naag.docsync.source;

import java.util.ArrayList;
import java.util.List;

/**
 * Read access to the document repository.
 */
public interface RemoteSourceClient {

    /**
     * Lists one page of a folder.
     *
     * @param pageToken null for the first page, otherwise the token returned by the previous page
     */
    FolderPage listFolder(String folderPath, String pageToken);

    byte[] getContent(String fileId);

    /**
     * Follows pagination until exhausted. Any page failure propagates, so callers never see
     * a partial listing.
     */
    default List<RemoteFile> listAll(String folderPath) {
        List<RemoteFile> all = new ArrayList<>();
        String token = null;
        do {
            FolderPage page = listFolder(folderPath, token);
            all.addAll(page.files());
            token = page.hasMore() ? page.nextPageToken() : null;
        } while (token != null);
        return all;
    }
}
