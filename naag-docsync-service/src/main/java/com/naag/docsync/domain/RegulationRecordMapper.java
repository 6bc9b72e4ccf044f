package com.naag.docsync.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.naag.docsync.source.RemoteFile;
import com.naag.docsync.store.payload.RegulationPayload;
import com.naag.docsync.transform.ContentExtractionException;
import com.naag.docsync.transform.ExtractedContent;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One record per HS code export. The file name stem is the HS code and the record id, so the
 * store can be checked before the file is downloaded.
 */
public class RegulationRecordMapper implements RecordMapper {

    @Override
    public ContentDomain domain() {
        return ContentDomain.REGULATION;
    }

    @Override
    public Optional<String> lookupId(RemoteFile file) {
        return Optional.of(file.stem());
    }

    @Override
    public List<RecordDraft> map(RemoteFile file, ExtractedContent content) {
        JsonNode doc = content.structuredFields();
        if (doc == null) {
            throw new ContentExtractionException("No structured fields for " + file.name());
        }

        String hsCode = text(doc, "hs_code");
        if (hsCode.isEmpty()) hsCode = file.stem();
        List<String> parents = strings(doc.get("hs_parent_uraian"));
        String searchText = ("HSCode: " + hsCode + " " + String.join(" ", parents)).trim();

        RegulationPayload payload = new RegulationPayload(
                hsCode,
                text(doc, "deskripsi"),
                text(doc, "uraian_barang"),
                text(doc, "bagian"),
                text(doc, "bab"),
                parents,
                strings(doc.get("bc_document_types")),
                text(doc, "link"),
                doc,
                file.lastModified(),
                file.id(),
                file.name(),
                file.webUrl(),
                searchText);

        return List.of(new RecordDraft(file.stem(), searchText, payload));
    }

    private static String text(JsonNode doc, String field) {
        JsonNode n = doc.get(field);
        return n == null || n.isNull() ? "" : n.asText("");
    }

    private static List<String> strings(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) return out;
        if (node.isArray()) {
            for (JsonNode n : node) {
                if (!n.isNull()) out.add(n.asText());
            }
        } else if (!node.asText("").isBlank()) {
            out.add(node.asText());
        }
        return out;
    }
}
