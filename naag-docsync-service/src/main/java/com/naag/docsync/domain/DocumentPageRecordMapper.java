package com.naag.docsync.domain;

import com.naag.docsync.source.RemoteFile;
import com.naag.docsync.store.payload.DocumentPagePayload;
import com.naag.docsync.transform.ChunkIds;
import com.naag.docsync.transform.ExtractedContent;
import com.naag.docsync.transform.PageText;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** One record per page; pages are never split further. */
public class DocumentPageRecordMapper implements RecordMapper {

    @Override
    public ContentDomain domain() {
        return ContentDomain.DOCUMENT_PAGE;
    }

    @Override
    public Optional<String> lookupId(RemoteFile file) {
        return Optional.empty();
    }

    @Override
    public List<RecordDraft> map(RemoteFile file, ExtractedContent content) {
        List<RecordDraft> drafts = new ArrayList<>(content.pages().size());
        for (PageText page : content.pages()) {
            int chunkIndex = 0;
            String id = ChunkIds.chunkId(file.id(), page.pageNumber(), chunkIndex);
            drafts.add(new RecordDraft(id, page.text(), new DocumentPagePayload(
                    page.text(), page.pageNumber(), chunkIndex, content.totalPages(),
                    file.lastModified(), file.id(), file.name(), file.webUrl(), page.text())));
        }
        return drafts;
    }
}
