package com.gs.ep.pdftranslator.document;

import com.gs.ep.pdftranslator.PdfFormatException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.pdfbox.pdmodel.graphics.color.PDOutputIntent;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.AdobePDFSchema;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.schema.PDFAIdentificationSchema;
import org.apache.xmpbox.type.BadFieldValueException;
import org.apache.xmpbox.xml.XmpSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.transform.TransformerException;
import java.awt.color.ColorSpace;
import java.awt.color.ICC_Profile;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Marks a document as PDF/A-2b: XMP metadata with the PDF/A identification and
 * an sRGB output intent. Fonts and content are left as they are, so viewers that
 * insist on PDF/A accept the file while strict validators may still object.
 */
public final class PdfAConverter {
    private static final Logger LOGGER = LoggerFactory.getLogger(PdfAConverter.class);

    static final String SRGB = "sRGB IEC61966-2.1";
    static final String COLOR_REGISTRY = "http://www.color.org";
    static final int PART = 2;
    static final String CONFORMANCE = "B";

    private PdfAConverter() {
    }

    /**
     * @throws PdfFormatException when the bytes are not a readable PDF
     */
    public static byte[] convert(byte[] pdf) throws IOException {
        PDDocument document;
        try {
            document = PDDocument.load(pdf);
        } catch (IOException e) {
            throw new PdfFormatException("Unable to parse PDF: " + e.getMessage(), e);
        }
        try {
            if (document.isEncrypted()) {
                document.setAllSecurityToBeRemoved(true);
            }
            apply(document);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            LOGGER.debug("Converted input to PDF/A-{}{} ({} bytes)", PART, CONFORMANCE, out.size());
            return out.toByteArray();
        } finally {
            document.close();
        }
    }

    static void apply(PDDocument document) throws IOException {
        PDDocumentCatalog catalog = document.getDocumentCatalog();
        PDMetadata metadata = new PDMetadata(document);
        metadata.importXMPMetadata(xmp(document.getDocumentInformation()));
        catalog.setMetadata(metadata);

        if (catalog.getOutputIntents().isEmpty()) {
            byte[] profile = ICC_Profile.getInstance(ColorSpace.CS_sRGB).getData();
            PDOutputIntent intent = new PDOutputIntent(document, new ByteArrayInputStream(profile));
            intent.setInfo(SRGB);
            intent.setOutputCondition(SRGB);
            intent.setOutputConditionIdentifier(SRGB);
            intent.setRegistryName(COLOR_REGISTRY);
            catalog.addOutputIntent(intent);
        }
    }

    private static byte[] xmp(PDDocumentInformation info) throws IOException {
        XMPMetadata xmp = XMPMetadata.createXMPMetadata();
        try {
            PDFAIdentificationSchema identification = xmp.createAndAddPFAIdentificationSchema();
            identification.setPart(PART);
            identification.setConformance(CONFORMANCE);

            DublinCoreSchema dublinCore = xmp.createAndAddDublinCoreSchema();
            if (info.getTitle() != null) {
                dublinCore.setTitle(info.getTitle());
            }
            if (info.getAuthor() != null) {
                dublinCore.addCreator(info.getAuthor());
            }
            if (info.getProducer() != null) {
                AdobePDFSchema adobe = xmp.createAndAddAdobePDFSchema();
                adobe.setProducer(info.getProducer());
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            new XmpSerializer().serialize(xmp, out, true);
            return out.toByteArray();
        } catch (BadFieldValueException | TransformerException e) {
            throw new IOException("Unable to build PDF/A metadata", e);
        }
    }
}
