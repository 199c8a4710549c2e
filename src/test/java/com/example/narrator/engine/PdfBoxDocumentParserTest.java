package com.example.narrator.engine;

import com.example.narrator.exception.ValidationException;
import com.example.narrator.model.ElementRole;
import com.example.narrator.model.Slide;
import com.example.narrator.model.SlideElement;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PdfBoxDocumentParserTest {

    @TempDir
    Path tmp;

    private final PdfBoxDocumentParser parser = new PdfBoxDocumentParser();

    @Test
    void eachPageBecomesASlideWithTitleAndScaledBoxes() throws Exception {
        Path pdf = deck(tmp.resolve("deck.pdf"),
                new String[]{"Plasma", "Fourth state of matter"},
                new String[]{"Fusion", "Powers the stars"});

        List<Slide> slides = parser.parse(pdf, 1920, 1080);

        assertThat(slides).hasSize(2);
        Slide first = slides.get(0);
        assertThat(first.index()).isZero();
        assertThat(first.title()).isEqualTo("Plasma");
        assertThat(first.text()).contains("Plasma", "Fourth state of matter");
        assertThat(first.elements()).extracting(SlideElement::role).contains(ElementRole.TITLE, ElementRole.BODY);
        assertThat(first.elements()).allSatisfy(element -> {
            assertThat(element.slideIndex()).isZero();
            assertThat(element.box().x() + element.box().width()).isLessThanOrEqualTo(1920);
            assertThat(element.box().y() + element.box().height()).isLessThanOrEqualTo(1080);
            assertThat(element.box().width()).isPositive();
        });
        SlideElement title = first.elements().stream().filter(e -> e.role() == ElementRole.TITLE).findFirst().orElseThrow();
        SlideElement body = first.elements().stream().filter(e -> e.role() == ElementRole.BODY).findFirst().orElseThrow();
        assertThat(title.box().y()).isLessThan(body.box().y());
        assertThat(slides.get(1).title()).isEqualTo("Fusion");
    }

    @Test
    void supportsOnlyPdfFiles() {
        assertThat(parser.supports(Path.of("slides.PDF"))).isTrue();
        assertThat(parser.supports(Path.of("slides.pptx"))).isFalse();
    }

    @Test
    void unreadableDocumentsAreRejected() throws Exception {
        Path notPdf = Files.writeString(tmp.resolve("broken.pdf"), "not a pdf");

        assertThrows(ValidationException.class, () -> parser.parse(notPdf, 1920, 1080));
        assertThrows(ValidationException.class, () -> parser.parse(tmp.resolve("missing.pdf"), 1920, 1080));
    }

    private static Path deck(Path target, String[]... pages) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            PDType1Font bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
            PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (String[] lines : pages) {
                PDRectangle size = new PDRectangle(960, 540);
                PDPage page = new PDPage(size);
                doc.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(doc, page)) {
                    content.beginText();
                    content.setFont(bold, 40);
                    content.newLineAtOffset(60, 460);
                    content.showText(lines[0]);
                    content.endText();

                    content.beginText();
                    content.setFont(regular, 20);
                    content.newLineAtOffset(60, 300);
                    content.showText(lines[1]);
                    content.endText();
                }
            }
            doc.save(target.toFile());
        }
        return target;
    }
}
