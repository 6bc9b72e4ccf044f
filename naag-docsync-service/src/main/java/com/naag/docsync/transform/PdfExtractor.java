package com.naag.docsync.transform;

import com.naag.docsync.source.RemoteFile;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Page-aware PDF extraction. Each page yields its native text layer, or OCR output when the
 * policy asks for it. Pages that fail or stay empty are skipped; the file only fails when no
 * page produced text.
 */
@Slf4j
public class PdfExtractor implements FormatExtractor {

    static final String PDF_MIME = "application/pdf";

    private final OcrService ocrService;

    public PdfExtractor(OcrService ocrService) {
        this.ocrService = ocrService;
    }

    @Override
    public ContentFormat format() {
        return ContentFormat.PDF;
    }

    @Override
    public ExtractedContent extract(byte[] bytes, RemoteFile file, OcrPolicy ocrPolicy) {
        List<PageText> pages;
        int totalPages;
        try (PDDocument document = Loader.loadPDF(bytes)) {
            totalPages = document.getNumberOfPages();
            pages = extractPages(document, file.name(), ocrPolicy);
        } catch (IOException e) {
            log.warn("Could not open PDF {} ({}), trying whole-document OCR", file.name(), e.getMessage());
            return ocrWholeDocument(bytes, file);
        }

        if (pages.isEmpty()) {
            throw new ContentExtractionException("No text extracted from any of " + totalPages + " pages of " + file.name());
        }
        log.info("Extracted {}/{} pages from {}", pages.size(), totalPages, file.name());
        return ExtractedContent.ofPages(ContentFormat.PDF, pages, totalPages);
    }

    /**
     * Extracts every page of an open document. Used for PDFs and for slide decks converted to PDF.
     */
    List<PageText> extractPages(PDDocument document, String label, OcrPolicy ocrPolicy) {
        int total = document.getNumberOfPages();
        List<PageText> pages = new ArrayList<>(total);

        for (int pageNumber = 1; pageNumber <= total; pageNumber++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ContentExtractionException("Interrupted while extracting " + label);
            }
            try {
                String text = nativeText(document, pageNumber);
                boolean needsOcr = ocrPolicy == OcrPolicy.ALWAYS
                        || (ocrPolicy == OcrPolicy.WHEN_SCANNED && text.isBlank());
                if (needsOcr && ocrService.isAvailable()) {
                    Optional<String> ocr = ocrService.extractText(singlePage(document, pageNumber), PDF_MIME,
                            label + " page " + pageNumber);
                    if (ocr.isPresent()) {
                        text = ocr.get();
                    }
                }
                if (text.isBlank()) {
                    log.warn("No text on page {} of {}, skipping", pageNumber, label);
                    continue;
                }
                pages.add(new PageText(pageNumber, text.trim()));
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to extract page {} of {}, skipping: {}", pageNumber, label, e.getMessage());
            }
        }
        return pages;
    }

    ExtractedContent ocrWholeDocument(byte[] bytes, RemoteFile file) {
        Optional<String> text = ocrService.extractText(bytes, PDF_MIME, file.name());
        if (text.isEmpty()) {
            throw new ContentExtractionException("PDF " + file.name() + " is unreadable and OCR produced no text");
        }
        return ExtractedContent.ofPages(ContentFormat.PDF, List.of(new PageText(1, text.get())), 1);
    }

    private static String nativeText(PDDocument document, int pageNumber) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(true);
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        String text = stripper.getText(document);
        return text == null ? "" : text;
    }

    private static byte[] singlePage(PDDocument document, int pageNumber) throws IOException {
        try (PDDocument single = new PDDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            single.importPage(document.getPage(pageNumber - 1));
            single.save(out);
            return out.toByteArray();
        }
    }
}
