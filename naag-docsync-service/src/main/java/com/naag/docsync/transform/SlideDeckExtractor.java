package com.naag.docsync.transform;

import com.naag.docsync.source.RemoteFile;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.poi.sl.usermodel.Shape;
import org.apache.poi.sl.usermodel.Slide;
import org.apache.poi.sl.usermodel.SlideShow;
import org.apache.poi.sl.usermodel.SlideShowFactory;
import org.apache.poi.sl.usermodel.TextShape;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;

/**
 * Slide decks become one page per slide through PDF conversion. When conversion is not
 * possible the deck's text frames are read directly as a single document-level page.
 */
@Slf4j
public class SlideDeckExtractor implements FormatExtractor {

    private final SlideDeckConverter converter;
    private final PdfExtractor pdfExtractor;

    public SlideDeckExtractor(SlideDeckConverter converter, PdfExtractor pdfExtractor) {
        this.converter = converter;
        this.pdfExtractor = pdfExtractor;
    }

    @Override
    public ContentFormat format() {
        return ContentFormat.SLIDE_DECK;
    }

    @Override
    public ExtractedContent extract(byte[] bytes, RemoteFile file, OcrPolicy ocrPolicy) {
        byte[] pdf;
        try {
            pdf = converter.toPdf(bytes, file.name());
        } catch (ContentExtractionException e) {
            log.warn("Conversion of {} failed ({}), falling back to slide text", file.name(), e.getMessage());
            return extractSlideText(bytes, file);
        }

        try (PDDocument document = Loader.loadPDF(pdf)) {
            List<PageText> pages = pdfExtractor.extractPages(document, file.name(), ocrPolicy);
            if (!pages.isEmpty()) {
                return ExtractedContent.ofPages(ContentFormat.SLIDE_DECK, pages, document.getNumberOfPages());
            }
            log.warn("Converted deck {} yielded no text, falling back to slide text", file.name());
        } catch (IOException e) {
            log.warn("Converted deck {} is unreadable ({}), falling back to slide text", file.name(), e.getMessage());
        }
        return extractSlideText(bytes, file);
    }

    ExtractedContent extractSlideText(byte[] bytes, RemoteFile file) {
        StringBuilder sb = new StringBuilder();
        try (SlideShow<?, ?> show = SlideShowFactory.create(new ByteArrayInputStream(bytes))) {
            for (Slide<?, ?> slide : show.getSlides()) {
                for (Shape<?, ?> shape : slide.getShapes()) {
                    if (shape instanceof TextShape<?, ?> textShape) {
                        String text = textShape.getText();
                        if (text != null && !text.isBlank()) {
                            sb.append(text.trim()).append('\n');
                        }
                    }
                }
                sb.append('\n');
            }
        } catch (IOException | RuntimeException e) {
            throw new ContentExtractionException("Could not read slide deck " + file.name() + ": " + e.getMessage(), e);
        }

        String text = sb.toString().trim();
        if (text.isEmpty()) {
            throw new ContentExtractionException("Slide deck " + file.name() + " contains no text");
        }
        return ExtractedContent.ofPages(ContentFormat.SLIDE_DECK, List.of(new PageText(1, text)), 1);
    }
}
