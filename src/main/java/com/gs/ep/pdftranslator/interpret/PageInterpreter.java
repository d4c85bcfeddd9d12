package com.gs.ep.pdftranslator.interpret;

import com.gs.ep.pdftranslator.assemble.FontRegistry;
import com.gs.ep.pdftranslator.document.ObjectPatch;
import com.gs.ep.pdftranslator.document.ObjectRef;
import com.gs.ep.pdftranslator.document.WorkingDocument;
import com.gs.ep.pdftranslator.layout.RegionMask;
import com.gs.ep.pdftranslator.translate.SpanTranslator;
import com.gs.ep.pdftranslator.translate.TranslationException;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSFloat;
import org.apache.pdfbox.cos.COSInteger;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSNumber;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.io.IOUtils;
import org.apache.pdfbox.pdfparser.PDFStreamParser;
import org.apache.pdfbox.pdfwriter.ContentStreamWriter;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.common.PDStream;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType3Font;
import org.apache.pdfbox.util.Matrix;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.Point2D;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rewrites the text of one page content stream in place.
 *
 * <p>
 * Work happens in three steps so that network calls stay outside the document
 * lock:
 * </p>
 * <ol>
 * <li>{@link #decode} walks the content stream, tracking the graphics and text
 * state, samples the region mask at every text show and groups translatable
 * shows into {@link TextRun}s. Needs the document lock.</li>
 * <li>{@link #translateRuns} sends each run through the cache and translator. No
 * lock.</li>
 * <li>{@link #emit} serializes the rewritten stream, allocates a new content
 * stream for the page and returns the payload as an {@link ObjectPatch}. Needs
 * the document lock.</li>
 * </ol>
 *
 * <p>
 * Everything that is not part of a translated run is written back token for
 * token. Each translated line is drawn once, at the position of its first show,
 * with the translation font at the original size and with horizontal scaling
 * squeezed so it fits the original line width.
 * </p>
 */
public class PageInterpreter {
    private static final Logger LOGGER = LoggerFactory.getLogger(PageInterpreter.class);

    private static final Set<String> SHOW_OPERATORS = new HashSet<>(Arrays.asList("Tj", "TJ", "'", "\""));
    // Operators that leave a run open
    private static final Set<String> RUN_NEUTRAL_OPERATORS = new HashSet<>(Arrays.asList(
            "Tf", "Tc", "Tw", "Tz", "TL", "Ts", "Tr", "Td", "TD", "Tm", "T*",
            "BMC", "BDC", "EMC", "MP", "DP"));
    private static final Set<String> LINE_MATRIX_OPERATORS = new HashSet<>(Arrays.asList(
            "Td", "TD", "Tm", "T*", "'", "\"", "BT", "ET"));

    /**
     * TJ adjustments below this value (thousandths of text space) are read as a word gap.
     */
    static final float WORD_GAP_ADJUSTMENT = -200f;
    static final float MIN_HORIZONTAL_SCALING_RATIO = 0.5f;

    private final Pattern formulaFontPattern;
    private final Pattern formulaCharPattern;

    public PageInterpreter() {
        this(null, null);
    }

    /**
     * @param formulaFontPattern shows in a font whose base name starts with a match are kept
     * @param formulaCharPattern shows whose whole text matches are kept
     */
    public PageInterpreter(String formulaFontPattern, String formulaCharPattern) {
        this.formulaFontPattern = compile(formulaFontPattern);
        this.formulaCharPattern = compile(formulaCharPattern);
    }

    private static Pattern compile(String regex) {
        return regex == null || regex.trim().isEmpty() ? null : Pattern.compile(regex);
    }

    static boolean isShowOperator(String name) {
        return SHOW_OPERATORS.contains(name);
    }

    // ------------------------------------------------------------------ decode

    public PageProgram decode(int pageIndex, PDPage page, RegionMask mask) throws IOException {
        MutableList<ContentOperation> operations = group(parseTokens(page));
        Decoder decoder = new Decoder(page, mask);
        for (ContentOperation operation : operations) {
            decoder.process(operation);
        }
        decoder.closeRun();
        LOGGER.debug("Page {}: {} operations, {} text runs", pageIndex, operations.size(), decoder.runs.size());
        return new PageProgram(pageIndex, page, operations, decoder.runs);
    }

    private static List<Object> parseTokens(PDPage page) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Iterator<PDStream> streams = page.getContentStreams();
        while (streams.hasNext()) {
            try (InputStream in = streams.next().createInputStream()) {
                IOUtils.copy(in, buffer);
            }
            buffer.write('\n');
        }
        PDFStreamParser parser = new PDFStreamParser(buffer.toByteArray());
        List<Object> tokens = new ArrayList<>();
        Object token;
        while ((token = parser.parseNextToken()) != null) {
            tokens.add(token);
        }
        return tokens;
    }

    private static MutableList<ContentOperation> group(List<Object> tokens) {
        MutableList<ContentOperation> operations = Lists.mutable.empty();
        List<COSBase> operands = new ArrayList<>();
        for (Object token : tokens) {
            if (token instanceof Operator) {
                operations.add(new ContentOperation((Operator) token, operands));
                operands = new ArrayList<>();
            } else if (token instanceof COSBase) {
                operands.add((COSBase) token);
            }
        }
        if (!operands.isEmpty()) {
            operations.add(new ContentOperation(null, operands));
        }
        return operations;
    }

    /**
     * Text-related part of the graphics state, saved by q and restored by Q.
     */
    private static final class GraphicsState {
        Matrix ctm = new Matrix();
        COSName fontName;
        PDFont font;
        float fontSize;
        float charSpacing;
        float wordSpacing;
        float horizontalScaling = 100f;
        float leading;
        float rise;

        GraphicsState copy() {
            GraphicsState copy = new GraphicsState();
            copy.ctm = ctm.clone();
            copy.fontName = fontName;
            copy.font = font;
            copy.fontSize = fontSize;
            copy.charSpacing = charSpacing;
            copy.wordSpacing = wordSpacing;
            copy.horizontalScaling = horizontalScaling;
            copy.leading = leading;
            copy.rise = rise;
            return copy;
        }

        TextStateSnapshot snapshot() {
            return new TextStateSnapshot(fontName, fontSize, charSpacing, wordSpacing, horizontalScaling);
        }
    }

    private final class Decoder {
        private final PDResources resources;
        private final PDRectangle cropBox;
        private final RegionMask mask;
        private final Map<COSName, PDFont> fonts = new HashMap<>();
        private final Deque<GraphicsState> stack = new ArrayDeque<>();
        private final MutableList<TextRun> runs = Lists.mutable.empty();

        private GraphicsState gs = new GraphicsState();
        private boolean inText;
        private Matrix textMatrix = new Matrix();
        private Matrix lineMatrix = new Matrix();
        private float lineAdvance;
        private TextRun current;

        Decoder(PDPage page, RegionMask mask) {
            this.resources = page.getResources();
            this.cropBox = page.getCropBox();
            this.mask = mask;
        }

        void process(ContentOperation operation) throws IOException {
            String name = operation.getName();
            List<COSBase> operands = operation.getOperands();
            if (!RUN_NEUTRAL_OPERATORS.contains(name) && !SHOW_OPERATORS.contains(name)) {
                closeRun();
            }
            switch (name) {
                case "q":
                    stack.push(gs.copy());
                    break;
                case "Q":
                    if (!stack.isEmpty()) {
                        gs = stack.pop();
                    }
                    break;
                case "cm":
                    if (operands.size() == 6 && allNumbers(operands)) {
                        gs.ctm = matrixOf(operands).multiply(gs.ctm);
                    }
                    break;
                case "BT":
                    inText = true;
                    textMatrix = new Matrix();
                    lineMatrix = new Matrix();
                    lineAdvance = 0;
                    break;
                case "ET":
                    inText = false;
                    break;
                case "Tf":
                    if (operands.size() == 2 && operands.get(0) instanceof COSName
                            && operands.get(1) instanceof COSNumber) {
                        gs.fontName = (COSName) operands.get(0);
                        gs.fontSize = ((COSNumber) operands.get(1)).floatValue();
                        gs.font = loadFont(gs.fontName);
                    }
                    break;
                case "Tc":
                    gs.charSpacing = number(operands, 0, gs.charSpacing);
                    break;
                case "Tw":
                    gs.wordSpacing = number(operands, 0, gs.wordSpacing);
                    break;
                case "Tz":
                    gs.horizontalScaling = number(operands, 0, gs.horizontalScaling);
                    break;
                case "TL":
                    gs.leading = number(operands, 0, gs.leading);
                    break;
                case "Ts":
                    gs.rise = number(operands, 0, gs.rise);
                    break;
                case "Td":
                    moveLine(number(operands, 0, 0), number(operands, 1, 0));
                    break;
                case "TD":
                    gs.leading = -number(operands, 1, 0);
                    moveLine(number(operands, 0, 0), number(operands, 1, 0));
                    break;
                case "Tm":
                    if (operands.size() == 6 && allNumbers(operands)) {
                        lineMatrix = matrixOf(operands);
                        textMatrix = lineMatrix.clone();
                        lineAdvance = 0;
                    }
                    break;
                case "T*":
                    moveLine(0, -gs.leading);
                    break;
                case "'":
                    moveLine(0, -gs.leading);
                    show(operation, operands.isEmpty() ? null : operands.get(operands.size() - 1));
                    break;
                case "\"":
                    gs.wordSpacing = number(operands, 0, gs.wordSpacing);
                    gs.charSpacing = number(operands, 1, gs.charSpacing);
                    moveLine(0, -gs.leading);
                    show(operation, operands.size() < 3 ? null : operands.get(2));
                    break;
                case "Tj":
                case "TJ":
                    show(operation, operands.isEmpty() ? null : operands.get(0));
                    break;
                default:
                    break;
            }
        }

        private void moveLine(float tx, float ty) {
            lineMatrix = Matrix.getTranslateInstance(tx, ty).multiply(lineMatrix);
            textMatrix = lineMatrix.clone();
            lineAdvance = 0;
        }

        private void advance(float tx) {
            textMatrix = Matrix.getTranslateInstance(tx, 0).multiply(textMatrix);
            lineAdvance += tx;
        }

        private PDFont loadFont(COSName fontName) {
            if (fonts.containsKey(fontName)) {
                return fonts.get(fontName);
            }
            PDFont font = null;
            if (resources != null) {
                try {
                    font = resources.getFont(fontName);
                } catch (IOException e) {
                    LOGGER.debug("Font {} could not be loaded, its text is kept as is: {}", fontName.getName(),
                            e.getMessage());
                }
            }
            fonts.put(fontName, font);
            return font;
        }

        private Matrix renderingMatrix() {
            return Matrix.getTranslateInstance(0, gs.rise).multiply(textMatrix).multiply(gs.ctm);
        }

        private Point2D.Float devicePoint() {
            Matrix m = renderingMatrix();
            return new Point2D.Float(m.getTranslateX(), m.getTranslateY());
        }

        private void show(ContentOperation operation, COSBase text) throws IOException {
            TextStateSnapshot state = gs.snapshot();
            Point2D.Float anchor = devicePoint();
            Matrix lineStart = textMatrix.multiply(gs.ctm);
            operation.anchor = anchor;
            operation.state = state;

            int regionId = mask.regionAtPoint(anchor.x - cropBox.getLowerLeftX(), anchor.y - cropBox.getLowerLeftY());
            operation.regionId = regionId;

            StringBuilder decoded = new StringBuilder();
            boolean decodable = decodeAndAdvance(text, decoded);
            operation.decodedText = decodable ? decoded.toString() : null;

            if (!inText || !RegionMask.isTranslatable(regionId) || !decodable || isFormula(decoded.toString())) {
                closeRun();
                return;
            }

            float a = lineStart.getValue(0, 0);
            float b = lineStart.getValue(0, 1);
            float hScale = (float) Math.hypot(a, b);
            float dirX = hScale == 0 ? 1 : a / hScale;
            float dirY = hScale == 0 ? 0 : b / hScale;
            float fontSizeDevice = Math.abs(state.fontSize)
                    * (float) Math.hypot(lineStart.getValue(1, 0), lineStart.getValue(1, 1));

            if (current != null && current.getRegionId() != regionId) {
                closeRun();
            }
            if (current == null) {
                current = new TextRun(regionId);
            }
            TextRun.Line line = current.lines.isEmpty() ? null : current.lines.getLast();
            boolean firstOfLine = false;
            if (line == null || line.offBaseline(anchor) > Math.max(1f, 0.5f * line.fontSizeDevice)) {
                line = new TextRun.Line(anchor, dirX, dirY, hScale, fontSizeDevice);
                current.lines.add(line);
                firstOfLine = true;
            } else if (line.gapTo(anchor) > 0.15f * line.fontSizeDevice && !endsWithSpace(line.text)) {
                line.text.append(' ');
            }
            line.text.append(decoded);
            line.end = devicePoint();

            operation.firstOfLine = firstOfLine;
            operation.lineIndex = current.lines.size() - 1;
            current.shows.add(operation);
            current.endLineMatrix = lineMatrix.clone();
            current.endLineAdvance = lineAdvance;
            current.endState = gs.snapshot();
        }

        /**
         * Decodes a string or TJ array with the current font, appending Unicode text
         * to {@code out} and moving the text matrix past every glyph.
         *
         * @return false when the text cannot be mapped to Unicode
         */
        private boolean decodeAndAdvance(COSBase text, StringBuilder out) throws IOException {
            PDFont font = gs.font;
            boolean decodable = font != null && !(font instanceof PDType3Font);
            if (text instanceof COSString) {
                return decodeString((COSString) text, out) && decodable;
            }
            if (text instanceof COSArray) {
                for (COSBase element : (COSArray) text) {
                    if (element instanceof COSString) {
                        decodable &= decodeString((COSString) element, out);
                    } else if (element instanceof COSNumber) {
                        float adjustment = ((COSNumber) element).floatValue();
                        advance(-adjustment / 1000f * gs.fontSize * gs.horizontalScaling / 100f);
                        if (adjustment < WORD_GAP_ADJUSTMENT && !endsWithSpace(out)) {
                            out.append(' ');
                        }
                    }
                }
                return decodable;
            }
            return false;
        }

        private boolean decodeString(COSString string, StringBuilder out) throws IOException {
            PDFont font = gs.font;
            if (font == null) {
                return false;
            }
            boolean decodable = true;
            InputStream in = new ByteArrayInputStream(string.getBytes());
            while (in.available() > 0) {
                int before = in.available();
                int code = font.readCode(in);
                int consumed = before - in.available();
                String unicode = font.toUnicode(code);
                if (unicode == null) {
                    decodable = false;
                } else {
                    out.append(unicode);
                }
                float width = font.getDisplacement(code).getX();
                float spacing = gs.charSpacing + (consumed == 1 && code == 32 ? gs.wordSpacing : 0);
                advance((width * gs.fontSize + spacing) * gs.horizontalScaling / 100f);
            }
            return decodable;
        }

        private boolean isFormula(String text) {
            if (formulaFontPattern != null && gs.font != null) {
                String baseName = gs.font.getName();
                if (baseName != null) {
                    int plus = baseName.indexOf('+');
                    String stripped = plus >= 0 ? baseName.substring(plus + 1) : baseName;
                    if (formulaFontPattern.matcher(stripped).lookingAt()) {
                        return true;
                    }
                }
            }
            return formulaCharPattern != null && !text.isEmpty() && formulaCharPattern.matcher(text).matches();
        }

        void closeRun() {
            if (current == null) {
                return;
            }
            TextRun run = current;
            current = null;
            if (!run.hasLetters()) {
                return;
            }
            run.setIndex(runs.size());
            runs.add(run);
            for (ContentOperation show : run.shows) {
                show.runIndex = run.getIndex();
            }
            run.shows.getLast().lastOfRun = true;
        }
    }

    private static boolean endsWithSpace(CharSequence text) {
        return text.length() > 0 && Character.isWhitespace(text.charAt(text.length() - 1));
    }

    private static boolean allNumbers(List<COSBase> operands) {
        for (COSBase operand : operands) {
            if (!(operand instanceof COSNumber)) {
                return false;
            }
        }
        return true;
    }

    private static Matrix matrixOf(List<COSBase> operands) {
        return new Matrix(
                ((COSNumber) operands.get(0)).floatValue(),
                ((COSNumber) operands.get(1)).floatValue(),
                ((COSNumber) operands.get(2)).floatValue(),
                ((COSNumber) operands.get(3)).floatValue(),
                ((COSNumber) operands.get(4)).floatValue(),
                ((COSNumber) operands.get(5)).floatValue());
    }

    private static float number(List<COSBase> operands, int index, float defaultValue) {
        if (index < operands.size() && operands.get(index) instanceof COSNumber) {
            return ((COSNumber) operands.get(index)).floatValue();
        }
        return defaultValue;
    }

    // --------------------------------------------------------------- translate

    /**
     * Translates every run of the program. Runs whose translation fails keep a null
     * translation and are written verbatim.
     *
     * @throws TranslationException only when the span translator is strict
     */
    public void translateRuns(PageProgram program, SpanTranslator translator) throws TranslationException {
        for (TextRun run : program.getRuns()) {
            String text = run.getText();
            if (text.isEmpty()) {
                continue;
            }
            Optional<String> translation = translator.translate(text);
            run.setTranslation(translation.map(PageInterpreter::collapseWhitespace).orElse(null));
        }
    }

    static String collapseWhitespace(String text) {
        return text.replaceAll("\\s+", " ").trim();
    }

    // -------------------------------------------------------------------- emit

    /**
     * Serializes the rewritten page, points the page at a newly allocated content
     * stream and returns the pending payload. Call while holding the document lock.
     */
    public ObjectPatch emit(PageProgram program, WorkingDocument document) throws IOException {
        PDFont font = document.getTranslationFont();
        if (font == null) {
            throw new IllegalStateException("Translation font has not been loaded");
        }
        List<List<EncodedLine>> encodedRuns = new ArrayList<>();
        for (TextRun run : program.getRuns()) {
            encodedRuns.add(run.isTranslated() ? encodeRun(run, font) : null);
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ContentStreamWriter writer = new ContentStreamWriter(out);
        List<ContentOperation> operations = program.getOperations().toList();
        int translatedRuns = 0;
        for (int i = 0; i < operations.size(); i++) {
            ContentOperation operation = operations.get(i);
            List<EncodedLine> lines = operation.runIndex >= 0 ? encodedRuns.get(operation.runIndex) : null;
            if (lines == null) {
                writeVerbatim(writer, operation);
                continue;
            }
            writeLineEffect(writer, operation);
            if (operation.firstOfLine) {
                writeTranslatedLine(writer, lines.get(operation.lineIndex), operation.state, font);
            }
            if (operation.lastOfRun) {
                translatedRuns++;
                if (needsMatrixRestore(operations, i)) {
                    writeMatrixRestore(writer, program.getRuns().get(operation.runIndex));
                }
            }
        }

        byte[] payload = out.toByteArray();
        ObjectRef target = document.allocateStream();
        document.repointContents(program.getPage(), target);
        LOGGER.debug("Page {}: {} of {} runs translated, {} bytes", program.getPageIndex(), translatedRuns,
                program.getRuns().size(), payload.length);
        return new ObjectPatch(program.getPageIndex(), target, payload, translatedRuns);
    }

    /**
     * One translated line ready to be written.
     */
    private static final class EncodedLine {
        final String text;
        final byte[] bytes;
        final float width;
        final float availableWidth;

        EncodedLine(String text, byte[] bytes, float width, float availableWidth) {
            this.text = text;
            this.bytes = bytes;
            this.width = width;
            this.availableWidth = availableWidth;
        }
    }

    /**
     * @return the encoded lines, or null when the font cannot encode the translation
     */
    private List<EncodedLine> encodeRun(TextRun run, PDFont font) {
        float[] widths = run.getLineWidths();
        List<String> segments = distribute(run.getTranslation(), widths);
        List<EncodedLine> lines = new ArrayList<>();
        try {
            for (int i = 0; i < segments.size(); i++) {
                String segment = segments.get(i);
                ContentOperation first = firstShowOfLine(run, i);
                float fontSize = first == null ? 0 : first.state.fontSize;
                byte[] bytes = font.encode(segment);
                float width = font.getStringWidth(segment) / 1000f * Math.abs(fontSize);
                lines.add(new EncodedLine(segment, bytes, width, widths[i]));
            }
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.debug("Translation font cannot encode run {}, keeping original: {}", run.getIndex(),
                    e.getMessage());
            return null;
        }
        return lines;
    }

    private static ContentOperation firstShowOfLine(TextRun run, int lineIndex) {
        for (ContentOperation show : run.shows) {
            if (show.firstOfLine && show.lineIndex == lineIndex) {
                return show;
            }
        }
        return null;
    }

    /**
     * Splits {@code text} into one segment per line, sized in proportion to the
     * original line widths and cut at spaces where the text has any.
     */
    static List<String> distribute(String text, float[] widths) {
        List<String> segments = new ArrayList<>();
        int lineCount = Math.max(1, widths.length);
        if (lineCount == 1) {
            segments.add(text.trim());
            return segments;
        }
        float total = 0;
        for (float width : widths) {
            total += Math.max(0, width);
        }
        boolean hasSpaces = text.indexOf(' ') >= 0;
        int length = text.length();
        int start = 0;
        float cumulative = 0;
        for (int i = 0; i < lineCount - 1; i++) {
            cumulative += total > 0 ? Math.max(0, widths[i]) : 1;
            float share = total > 0 ? cumulative / total : cumulative / lineCount;
            int target = Math.max(start, Math.min(length, Math.round(length * share)));
            int cut = hasSpaces ? nearestSpace(text, start, target) : target;
            if (cut > 0 && cut < length && Character.isLowSurrogate(text.charAt(cut))) {
                cut++;
            }
            cut = Math.max(start, Math.min(length, cut));
            segments.add(text.substring(start, cut).trim());
            start = cut;
        }
        segments.add(text.substring(start).trim());
        return segments;
    }

    private static int nearestSpace(String text, int from, int target) {
        if (target >= text.length()) {
            return text.length();
        }
        int best = -1;
        for (int i = from; i < text.length(); i++) {
            if (text.charAt(i) == ' ' && (best < 0 || Math.abs(i - target) < Math.abs(best - target))) {
                best = i;
            }
        }
        return best < 0 ? text.length() : best;
    }

    private static void writeVerbatim(ContentStreamWriter writer, ContentOperation operation) throws IOException {
        List<Object> tokens = new ArrayList<Object>(operation.getOperands());
        if (operation.getOperator() != null) {
            tokens.add(operation.getOperator());
        }
        writer.writeTokens(tokens);
    }

    /**
     * Keeps the line-advance part of a dropped ' or " show.
     */
    private static void writeLineEffect(ContentStreamWriter writer, ContentOperation operation) throws IOException {
        List<COSBase> operands = operation.getOperands();
        if ("'".equals(operation.getName())) {
            writer.writeTokens(Operator.getOperator("T*"));
        } else if ("\"".equals(operation.getName()) && operands.size() >= 2) {
            writer.writeTokens(operands.get(0), Operator.getOperator("Tw"),
                    operands.get(1), Operator.getOperator("Tc"),
                    Operator.getOperator("T*"));
        }
    }

    private static void writeTranslatedLine(ContentStreamWriter writer, EncodedLine line, TextStateSnapshot state,
            PDFont font) throws IOException {
        if (line.text.isEmpty()) {
            return;
        }
        float scaling = state.horizontalScaling;
        if (line.width > 0) {
            float fitted = 100f * line.availableWidth / line.width;
            scaling = Math.max(Math.min(scaling, fitted), state.horizontalScaling * MIN_HORIZONTAL_SCALING_RATIO);
        }
        if (font.willBeSubset()) {
            line.text.codePoints().forEach(font::addToSubset);
        }
        COSString string = new COSString(line.bytes);
        string.setForceHexForm(true);
        writer.writeTokens(
                FontRegistry.TRANSLATION_FONT, new COSFloat(state.fontSize), Operator.getOperator("Tf"),
                COSInteger.ZERO, Operator.getOperator("Tc"),
                COSInteger.ZERO, Operator.getOperator("Tw"),
                new COSFloat(scaling), Operator.getOperator("Tz"),
                string, Operator.getOperator("Tj"));
        if (state.fontName != null) {
            writer.writeTokens(state.fontName, new COSFloat(state.fontSize), Operator.getOperator("Tf"));
        }
        writer.writeTokens(
                new COSFloat(state.charSpacing), Operator.getOperator("Tc"),
                new COSFloat(state.wordSpacing), Operator.getOperator("Tw"),
                new COSFloat(state.horizontalScaling), Operator.getOperator("Tz"));
    }

    /**
     * True when a later show in the same text object relies on the text matrix left
     * behind by the run, with no line-matrix operator in between.
     */
    private static boolean needsMatrixRestore(List<ContentOperation> operations, int runEnd) {
        for (int i = runEnd + 1; i < operations.size(); i++) {
            String name = operations.get(i).getName();
            if ("Tj".equals(name) || "TJ".equals(name)) {
                return true;
            }
            if (LINE_MATRIX_OPERATORS.contains(name)) {
                return false;
            }
        }
        return false;
    }

    /**
     * Puts back both text matrices: Tm sets the line matrix, then a number-only TJ
     * moves the text matrix by the advance of the replaced glyphs.
     */
    private static void writeMatrixRestore(ContentStreamWriter writer, TextRun run) throws IOException {
        Matrix m = run.endLineMatrix;
        writer.writeTokens(
                new COSFloat(m.getValue(0, 0)), new COSFloat(m.getValue(0, 1)),
                new COSFloat(m.getValue(1, 0)), new COSFloat(m.getValue(1, 1)),
                new COSFloat(m.getValue(2, 0)), new COSFloat(m.getValue(2, 1)),
                Operator.getOperator("Tm"));
        TextStateSnapshot state = run.endState;
        float scale = state.fontSize * state.horizontalScaling / 100f;
        if (run.endLineAdvance != 0 && scale != 0) {
            COSArray adjustment = new COSArray();
            adjustment.add(new COSFloat(-run.endLineAdvance * 1000f / scale));
            writer.writeTokens(adjustment, Operator.getOperator("TJ"));
        }
    }
}
