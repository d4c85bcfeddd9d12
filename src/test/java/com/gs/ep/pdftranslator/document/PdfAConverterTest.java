package com.gs.ep.pdftranslator.document;

import com.gs.ep.pdftranslator.PdfFormatException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.color.PDOutputIntent;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.PDFAIdentificationSchema;
import org.apache.xmpbox.xml.DomXmpParser;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PdfAConverterTest {

    private static byte[] pdf(String title) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(PDType1Font.HELVETICA, 12);
                content.newLineAtOffset(72, 700);
                content.showText("Compatible text");
                content.endText();
            }
            document.getDocumentInformation().setTitle(title);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }

    @Test
    void convert_shouldAddPdfAIdentificationAndSrgbOutputIntent() throws Exception {
        byte[] converted = PdfAConverter.convert(pdf("Report"));

        try (PDDocument document = PDDocument.load(converted)) {
            PDDocumentCatalog catalog = document.getDocumentCatalog();
            List<PDOutputIntent> intents = catalog.getOutputIntents();
            assertEquals(1, intents.size());
            assertEquals(PdfAConverter.SRGB, intents.get(0).getOutputConditionIdentifier());
            assertNotNull(intents.get(0).getDestOutputIntent());

            assertNotNull(catalog.getMetadata());
            XMPMetadata xmp = new DomXmpParser().parse(catalog.getMetadata().toByteArray());
            PDFAIdentificationSchema identification = xmp.getPDFIdentificationSchema();
            assertEquals(Integer.valueOf(2), identification.getPart());
            assertEquals("B", identification.getConformance());
            assertEquals("Report", xmp.getDublinCoreSchema().getTitle());

            assertTrue(new PDFTextStripper().getText(document).contains("Compatible text"));
        }
    }

    @Test
    void convert_withExistingOutputIntent_shouldNotAddAnother() throws Exception {
        byte[] once = PdfAConverter.convert(pdf("Twice"));
        byte[] twice = PdfAConverter.convert(once);

        try (PDDocument document = PDDocument.load(twice)) {
            assertEquals(1, document.getDocumentCatalog().getOutputIntents().size());
        }
    }

    @Test
    void convert_withGarbage_shouldThrowFormatException() {
        assertThrows(PdfFormatException.class,
                () -> PdfAConverter.convert("not a pdf".getBytes(StandardCharsets.US_ASCII)));
    }
}
