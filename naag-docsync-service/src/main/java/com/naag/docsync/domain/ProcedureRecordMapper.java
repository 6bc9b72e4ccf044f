package com.naag.docsync.domain;

import com.naag.docsync.source.RemoteFile;
import com.naag.docsync.store.payload.ProcedurePayload;
import com.naag.docsync.transform.ExtractedContent;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/** One record per procedure document, keyed by the MD5 of its file name. */
public class ProcedureRecordMapper implements RecordMapper {

    private final ProcedureFieldParser fieldParser;

    public ProcedureRecordMapper(ProcedureFieldParser fieldParser) {
        this.fieldParser = fieldParser;
    }

    @Override
    public ContentDomain domain() {
        return ContentDomain.PROCEDURE;
    }

    @Override
    public Optional<String> lookupId(RemoteFile file) {
        return Optional.of(recordId(file.name()));
    }

    @Override
    public List<RecordDraft> map(RemoteFile file, ExtractedContent content) {
        String fullText = content.text();
        ProcedureFieldParser.ProcedureFields f = fieldParser.parse(file.name(), fullText);

        String searchText = "SOP: " + f.title() + ". Type: " + f.type() + ". Tujuan: " + f.purpose()
                + " Uraian: " + f.description() + " Dokumen: " + f.documents();

        ProcedurePayload payload = new ProcedurePayload(
                f.title(), f.type(), f.purpose(), f.description(), f.documents(),
                f.date(), f.docNo(), f.revision(), fullText, file.size(),
                file.lastModified(), file.id(), file.name(), file.webUrl(), searchText);

        return List.of(new RecordDraft(recordId(file.name()), searchText, payload));
    }

    static String recordId(String filename) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(filename.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
