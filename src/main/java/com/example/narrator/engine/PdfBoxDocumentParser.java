package com.example.narrator.engine;

import com.example.narrator.engine.Interfaces.DocumentParser;
import com.example.narrator.exception.ValidationException;
import com.example.narrator.model.BoundingBox;
import com.example.narrator.model.ElementRole;
import com.example.narrator.model.Slide;
import com.example.narrator.model.SlideElement;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads slide decks exported as PDF: one slide per page, one element per text run, with boxes
 * scaled from page units into the output frame.
 */
public class PdfBoxDocumentParser implements DocumentParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(PdfBoxDocumentParser.class);

    @Override
    public boolean supports(Path document) {
        return document != null && document.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    @Override
    public List<Slide> parse(Path document, int frameWidth, int frameHeight) {
        if (document == null || !Files.isRegularFile(document)) {
            throw new ValidationException("Document not found: " + document);
        }
        try (PDDocument pdf = Loader.loadPDF(document.toFile())) {
            List<Slide> slides = new ArrayList<>();
            for (int pageIndex = 0; pageIndex < pdf.getNumberOfPages(); pageIndex++) {
                PDPage page = pdf.getPage(pageIndex);
                PDRectangle box = page.getCropBox();
                RunCollector collector = new RunCollector();
                collector.setSortByPosition(true);
                collector.setStartPage(pageIndex + 1);
                collector.setEndPage(pageIndex + 1);
                collector.getText(pdf);
                slides.add(toSlide(pageIndex, collector.runs, box.getWidth(), box.getHeight(), frameWidth, frameHeight));
            }
            LOGGER.info("PDF parsed document={} slides={}", document.getFileName(), slides.size());
            return slides;
        } catch (IOException e) {
            throw new ValidationException("Cannot read PDF " + document + ": " + e.getMessage(), e);
        }
    }

    private static Slide toSlide(int index, List<TextRun> runs, float pageWidth, float pageHeight, int frameWidth, int frameHeight) {
        double sx = pageWidth > 0 ? frameWidth / (double) pageWidth : 1.0;
        double sy = pageHeight > 0 ? frameHeight / (double) pageHeight : 1.0;

        int titleRun = -1;
        float largest = 0f;
        for (int i = 0; i < runs.size(); i++) {
            if (runs.get(i).fontSize() > largest) {
                largest = runs.get(i).fontSize();
                titleRun = i;
            }
        }

        List<SlideElement> elements = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < runs.size(); i++) {
            TextRun run = runs.get(i);
            BoundingBox bbox = new BoundingBox(
                    (int) Math.round(run.minX() * sx),
                    (int) Math.round(run.minY() * sy),
                    (int) Math.max(1, Math.round((run.maxX() - run.minX()) * sx)),
                    (int) Math.max(1, Math.round((run.maxY() - run.minY()) * sy)))
                    .clampTo(frameWidth, frameHeight);
            elements.add(new SlideElement(index, i == titleRun ? ElementRole.TITLE : ElementRole.BODY, run.text(), bbox));
            if (text.length() > 0) text.append('\n');
            text.append(run.text());
        }
        String title = titleRun >= 0 ? runs.get(titleRun).text() : null;
        return new Slide(index, title, text.toString(), elements);
    }

    private record TextRun(String text, float minX, float minY, float maxX, float maxY, float fontSize) {}

    private static final class RunCollector extends PDFTextStripper {
        private final List<TextRun> runs = new ArrayList<>();

        @Override
        protected void writeString(String text, List<TextPosition> positions) throws IOException {
            if (text == null || text.isBlank() || positions.isEmpty()) {
                return;
            }
            float minX = Float.MAX_VALUE;
            float minY = Float.MAX_VALUE;
            float maxX = -Float.MAX_VALUE;
            float maxY = -Float.MAX_VALUE;
            float fontSize = 0f;
            for (TextPosition tp : positions) {
                float top = tp.getYDirAdj() - tp.getHeightDir();
                minX = Math.min(minX, tp.getXDirAdj());
                minY = Math.min(minY, top);
                maxX = Math.max(maxX, tp.getXDirAdj() + tp.getWidthDirAdj());
                maxY = Math.max(maxY, tp.getYDirAdj());
                fontSize = Math.max(fontSize, tp.getFontSizeInPt());
            }
            runs.add(new TextRun(text.trim(), minX, minY, maxX, maxY, fontSize));
            super.writeString(text, positions);
        }
    }
}
