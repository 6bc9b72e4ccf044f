package com.naag.docsync.domain;

import com.naag.docsync.source.RemoteFile;
import com.naag.docsync.store.payload.CasePayload;
import com.naag.docsync.transform.ExtractedContent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.naag.docsync.transform.SpreadsheetExtractor.COL_ANSWER;
import static com.naag.docsync.transform.SpreadsheetExtractor.COL_DATE;
import static com.naag.docsync.transform.SpreadsheetExtractor.COL_NO;
import static com.naag.docsync.transform.SpreadsheetExtractor.COL_QUESTION;

/** One record per workbook row, keyed by the case number. */
@Slf4j
public class CaseRecordMapper implements RecordMapper {

    @Override
    public ContentDomain domain() {
        return ContentDomain.CASE;
    }

    @Override
    public Optional<String> lookupId(RemoteFile file) {
        return Optional.empty();
    }

    @Override
    public List<RecordDraft> map(RemoteFile file, ExtractedContent content) {
        List<RecordDraft> drafts = new ArrayList<>();
        for (Map<String, String> row : content.rows()) {
            String caseNo = normalizeCaseNo(row.get(COL_NO));
            if (caseNo == null) {
                log.warn("Skipping row with non-numeric case number '{}' in {}", row.get(COL_NO), file.name());
                continue;
            }
            String date = row.getOrDefault(COL_DATE, "");
            String question = row.get(COL_QUESTION);
            String answer = row.get(COL_ANSWER);

            String searchText = "Q: " + question + " A: " + answer;
            String fullText = "Case #" + caseNo + " (" + date + "): " + searchText;

            drafts.add(new RecordDraft(caseNo, searchText, new CasePayload(
                    caseNo, date, question, answer, fullText,
                    file.lastModified(), file.id(), file.name(), file.webUrl(), searchText)));
        }
        return drafts;
    }

    /** Case numbers come back from spreadsheets as "12" or "12.0". */
    static String normalizeCaseNo(String raw) {
        if (raw == null) return null;
        String value = raw.trim();
        if (value.endsWith(".0")) value = value.substring(0, value.length() - 2);
        return value.matches("\\d+") ? value : null;
    }
}
