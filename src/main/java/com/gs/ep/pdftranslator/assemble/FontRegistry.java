package com.gs.ep.pdftranslator.assemble;

import com.gs.ep.pdftranslator.config.TranslationConfig;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Loads the font translated text is drawn with and makes it visible under
 * {@link #TRANSLATION_FONT} in the resource dictionaries of the document.
 */
public class FontRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(FontRegistry.class);

    public static final COSName TRANSLATION_FONT = COSName.getPDFName("TranslationFont");

    private final FontProvisioner provisioner;
    private final boolean subset;
    private final String targetLanguage;

    public FontRegistry(String fontPath, boolean subset) {
        this(FontProvisioner.fixed(fontPath), subset, "");
    }

    public FontRegistry(FontProvisioner provisioner, boolean subset, String targetLanguage) {
        this.provisioner = provisioner;
        this.subset = subset;
        this.targetLanguage = targetLanguage == null ? "" : targetLanguage;
    }

    public static FontRegistry fromConfig(TranslationConfig config) {
        return new FontRegistry(FontProvisioner.fromConfig(config), config.isSubsetFonts(),
                config.getTargetLanguage());
    }

    /**
     * The provisioned TrueType font embedded as Type 0, or Helvetica when no usable
     * font file can be found. A warning is logged when the chosen font has no
     * glyphs for the target language's script.
     */
    public PDFont load(PDDocument document) {
        PDFont font = loadFont(document);
        String sample = scriptSample(targetLanguage);
        if (!sample.isEmpty() && !canEncode(font, sample)) {
            LOGGER.warn("Translation font {} cannot draw {} text; runs it cannot encode keep their original text",
                    font.getName(), targetLanguage);
        }
        return font;
    }

    private PDFont loadFont(PDDocument document) {
        Path fontFile = provisioner.resolve();
        if (fontFile == null) {
            LOGGER.debug("No translation font available, using Helvetica");
            return PDType1Font.HELVETICA;
        }
        try (InputStream input = Files.newInputStream(fontFile)) {
            PDFont font = PDType0Font.load(document, input, subset);
            LOGGER.debug("Loaded translation font {} (subset={})", fontFile.getFileName(), subset);
            return font;
        } catch (IOException e) {
            LOGGER.warn("Failed to load translation font {}, using Helvetica", fontFile, e);
            return PDType1Font.HELVETICA;
        }
    }

    /**
     * A few characters of the script {@code language} is written in, empty for
     * Latin-script or unknown languages.
     */
    static String scriptSample(String language) {
        String primary = language.toLowerCase(Locale.ROOT);
        int dash = primary.indexOf('-');
        if (dash >= 0) {
            primary = primary.substring(0, dash);
        }
        switch (primary) {
            case "zh":
                return "\u4e2d\u6587";
            case "ja":
                return "\u65e5\u672c\u8a9e";
            case "ko":
                return "\ud55c\uad6d\uc5b4";
            case "ru":
            case "uk":
                return "\u042f\u0437\u044b\u043a";
            case "el":
                return "\u0395\u03bb\u03bb";
            case "ar":
                return "\u0639\u0631\u0628";
            case "he":
                return "\u05e2\u05d1\u05e8";
            case "th":
                return "\u0e44\u0e17\u0e22";
            case "hi":
                return "\u0939\u093f\u0928";
            default:
                return "";
        }
    }

    static boolean canEncode(PDFont font, String text) {
        try {
            font.encode(text);
            return true;
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }

    /**
     * Adds {@code font} to every page resource dictionary, and every form XObject
     * resource dictionary below it, that has no entry of that name yet.
     *
     * @return the number of dictionaries that were changed
     */
    public int register(PDDocument document, PDFont font) {
        Map<COSDictionary, Boolean> visited = new IdentityHashMap<>();
        int registered = 0;
        for (PDPage page : document.getPages()) {
            PDResources resources = page.getResources();
            if (resources == null) {
                resources = new PDResources();
                page.setResources(resources);
            }
            registered += register(resources, font, visited);
        }
        LOGGER.debug("Registered translation font in {} resource dictionaries", registered);
        return registered;
    }

    private int register(PDResources resources, PDFont font, Map<COSDictionary, Boolean> visited) {
        if (visited.put(resources.getCOSObject(), Boolean.TRUE) != null) {
            return 0;
        }
        int registered = 0;
        if (!hasFont(resources)) {
            resources.put(TRANSLATION_FONT, font);
            registered++;
        }
        for (COSName name : resources.getXObjectNames()) {
            PDXObject xObject;
            try {
                xObject = resources.getXObject(name);
            } catch (IOException e) {
                LOGGER.warn("Skipping unreadable XObject {}: {}", name.getName(), e.getMessage());
                continue;
            }
            if (xObject instanceof PDFormXObject) {
                PDResources formResources = ((PDFormXObject) xObject).getResources();
                if (formResources != null) {
                    registered += register(formResources, font, visited);
                }
            }
        }
        return registered;
    }

    static boolean hasFont(PDResources resources) {
        COSBase fonts = resources.getCOSObject().getDictionaryObject(COSName.FONT);
        return fonts instanceof COSDictionary && ((COSDictionary) fonts).containsKey(TRANSLATION_FONT);
    }
}
