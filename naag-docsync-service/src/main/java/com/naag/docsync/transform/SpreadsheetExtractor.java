package com.naag.docsync.transform;

import com.naag.docsync.source.RemoteFile;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the first sheet of a case workbook. The header row names the columns; each later
 * row becomes a map keyed by upper-cased header.
 */
@Slf4j
public class SpreadsheetExtractor implements FormatExtractor {

    public static final String COL_NO = "NO";
    public static final String COL_DATE = "DATE";
    public static final String COL_QUESTION = "QUESTION";
    public static final String COL_ANSWER = "ANSWER";

    private static final List<String> REQUIRED = List.of(COL_NO, COL_QUESTION, COL_ANSWER);

    @Override
    public ContentFormat format() {
        return ContentFormat.SPREADSHEET;
    }

    @Override
    public ExtractedContent extract(byte[] bytes, RemoteFile file, OcrPolicy ocrPolicy) {
        DataFormatter formatter = new DataFormatter();
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(bytes))) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new ContentExtractionException("Workbook " + file.name() + " has no sheets");
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row header = sheet.getRow(sheet.getFirstRowNum());
            if (header == null) {
                throw new ContentExtractionException("Workbook " + file.name() + " has no header row");
            }

            Map<String, Integer> columns = new HashMap<>();
            for (Cell cell : header) {
                String name = formatter.formatCellValue(cell).trim().toUpperCase(Locale.ROOT);
                if (!name.isEmpty()) columns.putIfAbsent(name, cell.getColumnIndex());
            }
            List<String> missing = REQUIRED.stream().filter(c -> !columns.containsKey(c)).toList();
            if (!missing.isEmpty()) {
                throw new ContentExtractionException("Workbook " + file.name() + " is missing columns " + missing);
            }

            List<Map<String, String>> rows = new ArrayList<>();
            for (int i = header.getRowNum() + 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) continue;

                Map<String, String> values = new LinkedHashMap<>();
                columns.forEach((name, index) -> values.put(name, formatter.formatCellValue(row.getCell(index)).trim()));

                if (REQUIRED.stream().anyMatch(c -> values.get(c).isEmpty())) {
                    if (values.values().stream().anyMatch(v -> !v.isEmpty())) {
                        log.warn("Skipping incomplete row {} in {}", i + 1, file.name());
                    }
                    continue;
                }
                rows.add(values);
            }
            log.info("Read {} case rows from {}", rows.size(), file.name());
            return ExtractedContent.ofRows(rows);
        } catch (IOException | RuntimeException e) {
            if (e instanceof ContentExtractionException cee) throw cee;
            throw new ContentExtractionException("Could not read workbook " + file.name() + ": " + e.getMessage(), e);
        }
    }
}
