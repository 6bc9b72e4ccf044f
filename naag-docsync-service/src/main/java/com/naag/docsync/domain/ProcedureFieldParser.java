package com.naag.docsync.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.naag.docsync.json.Json;
import com.naag.docsync.llm.GenerativeClient;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the structured fields out of a procedure document. A configured LLM is asked first;
 * section-header parsing of the text is the fallback.
 */
@Slf4j
public class ProcedureFieldParser {

    public record ProcedureFields(
            String title,
            String type,
            String purpose,
            String description,
            String documents,
            String date,
            String docNo,
            String revision
    ) {}

    private enum Section { TUJUAN, URAIAN, DOKUMEN }

    static final String PROMPT = """
            You are an expert at analyzing Standard Operating Procedure (SOP) and Instruksi Kerja (IK) documents in Indonesian language.

            Extract the following from the document text below:
            1. sop_title: the main title of the document
            2. tujuan: the complete purpose/objective section (TUJUAN)
            3. uraian: the detailed procedure steps (URAIAN), usually the longest section
            4. dokumen: the required documents listed in the DOKUMEN section
            5. date: the document date as shown in the header
            6. doc_no: the document number (e.g. "13.1")
            7. rev: the revision number (e.g. "03")

            Use an empty string for any field that is not clearly present. Preserve Indonesian text exactly.
            Return ONLY a JSON object with the keys sop_title, tujuan, uraian, dokumen, date, doc_no, rev.
            No markdown formatting, no additional text.
            """;

    private static final int MAX_PROMPT_CHARS = 60_000;

    private static final Pattern HEADING =
            Pattern.compile("(?im)^[ \\t]*(?:[0-9IVX]+[.)][ \\t]*)?(TUJUAN|URAIAN|DOKUMEN)[ \\t]*:?[ \\t]*$");
    private static final Pattern DOC_NO = Pattern.compile("(?i)Doc\\.?\\s*No\\.?\\s*[:.]?\\s*([\\w./-]+)");
    private static final Pattern REVISION = Pattern.compile("(?i)\\bRev\\.?\\s*[:.]?\\s*(\\w+)");
    private static final Pattern DATE = Pattern.compile("(?i)\\b(?:Date|Tanggal)\\s*[:.]?\\s*([^\\n]+)");

    private final GenerativeClient client;
    private final String model;

    public ProcedureFieldParser(GenerativeClient client, String model) {
        this.client = client;
        this.model = model;
    }

    public ProcedureFields parse(String filename, String text) {
        String type = typeFromFilename(filename);
        if (client != null && client.isAvailable() && text != null && !text.isBlank()) {
            try {
                String prompt = PROMPT + "\nDocument text:\n"
                        + (text.length() > MAX_PROMPT_CHARS ? text.substring(0, MAX_PROMPT_CHARS) : text);
                return fromJson(client.generate(model, prompt), filename, type);
            } catch (RuntimeException e) {
                log.warn("LLM field extraction failed for {}, using section parsing: {}", filename, e.getMessage());
            }
        }
        return fromSections(filename, text == null ? "" : text, type);
    }

    static String typeFromFilename(String filename) {
        if (filename != null && filename.contains("_")) {
            String prefix = filename.substring(0, filename.indexOf('_')).toUpperCase(Locale.ROOT);
            if (prefix.equals("IK") || prefix.equals("SOP")) {
                return prefix;
            }
        }
        return "UNKNOWN";
    }

    static String titleFromFilename(String filename) {
        String stem = filename;
        int dot = stem.lastIndexOf('.');
        if (dot > 0) stem = stem.substring(0, dot);
        String type = typeFromFilename(filename);
        if (!type.equals("UNKNOWN")) stem = stem.substring(stem.indexOf('_') + 1);
        return stem.replace('_', ' ').trim();
    }

    ProcedureFields fromJson(String response, String filename, String type) {
        String cleaned = response == null ? "" : response.trim();
        if (cleaned.startsWith("```")) {
            cleaned = cleaned.replaceFirst("^```(?:json)?\\s*", "").replaceFirst("\\s*```$", "");
        }
        JsonNode node;
        try {
            node = Json.MAPPER.readTree(cleaned);
        } catch (Exception e) {
            throw new IllegalStateException("LLM did not return JSON: " + e.getMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalStateException("LLM did not return a JSON object");
        }
        String title = node.path("sop_title").asText("");
        return new ProcedureFields(
                title.isBlank() ? titleFromFilename(filename) : title,
                type,
                node.path("tujuan").asText(""),
                node.path("uraian").asText(""),
                node.path("dokumen").asText(""),
                node.path("date").asText(""),
                node.path("doc_no").asText(""),
                node.path("rev").asText(""));
    }

    ProcedureFields fromSections(String filename, String text, String type) {
        Map<Section, String> sections = new EnumMap<>(Section.class);
        Matcher m = HEADING.matcher(text);
        Section current = null;
        int bodyStart = 0;
        while (m.find()) {
            if (current != null) sections.putIfAbsent(current, text.substring(bodyStart, m.start()).trim());
            current = Section.valueOf(m.group(1).toUpperCase(Locale.ROOT));
            bodyStart = m.end();
        }
        if (current != null) sections.putIfAbsent(current, text.substring(bodyStart).trim());

        return new ProcedureFields(
                titleFromFilename(filename),
                type,
                sections.getOrDefault(Section.TUJUAN, ""),
                sections.getOrDefault(Section.URAIAN, sections.isEmpty() ? text.trim() : ""),
                sections.getOrDefault(Section.DOKUMEN, ""),
                firstGroup(DATE, text),
                firstGroup(DOC_NO, text),
                firstGroup(REVISION, text));
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group(1).trim() : "";
    }
}
