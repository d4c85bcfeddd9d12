package com.gs.ep.pdftranslator.assemble;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds a tiny but complete TrueType font in memory. Every glyph is the same
 * box, which is enough for PDFBox to embed, subset and extract text drawn with it.
 */
public final class TrueTypeFixture {
    private static final int UNITS_PER_EM = 1000;
    private static final int GLYPH_SIZE = 34;

    private TrueTypeFixture() {
    }

    /**
     * A font named {@code TestCjk-Regular} with glyphs for space and every BMP
     * character of {@code characters}.
     */
    public static byte[] fontFor(String characters) throws IOException {
        TreeSet<Integer> codes = new TreeSet<>();
        for (int i = 0; i < characters.length(); i++) {
            char c = characters.charAt(i);
            if (c != ' ' && !Character.isSurrogate(c) && c != 0xFFFF) {
                codes.add((int) c);
            }
        }
        // glyph 0 is .notdef, glyph 1 is space
        int numGlyphs = codes.size() + 2;

        Map<String, byte[]> tables = new TreeMap<>();
        tables.put("OS/2", os2());
        tables.put("cmap", cmap(codes));
        tables.put("glyf", glyf(numGlyphs));
        tables.put("head", head());
        tables.put("hhea", hhea(numGlyphs));
        tables.put("hmtx", hmtx(numGlyphs));
        tables.put("loca", loca(numGlyphs));
        tables.put("maxp", maxp(numGlyphs));
        tables.put("name", name());
        tables.put("post", post());
        return assemble(tables);
    }

    private static byte[] assemble(Map<String, byte[]> tables) throws IOException {
        int count = tables.size();
        int power = Integer.highestOneBit(count);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeInt(0x00010000);
        out.writeShort(count);
        out.writeShort(power * 16);
        out.writeShort(Integer.numberOfTrailingZeros(power));
        out.writeShort(count * 16 - power * 16);
        int offset = 12 + 16 * count;
        for (Map.Entry<String, byte[]> table : tables.entrySet()) {
            out.write(table.getKey().getBytes(StandardCharsets.US_ASCII));
            out.writeInt(checksum(table.getValue()));
            out.writeInt(offset);
            out.writeInt(table.getValue().length);
            offset += padded(table.getValue().length);
        }
        for (byte[] data : tables.values()) {
            out.write(data);
            for (int i = data.length; i < padded(data.length); i++) {
                out.writeByte(0);
            }
        }
        out.flush();
        return bytes.toByteArray();
    }

    private static int padded(int length) {
        return (length + 3) & ~3;
    }

    private static int checksum(byte[] data) {
        int sum = 0;
        for (int i = 0; i < padded(data.length); i += 4) {
            int word = 0;
            for (int j = 0; j < 4; j++) {
                word = (word << 8) | (i + j < data.length ? data[i + j] & 0xFF : 0);
            }
            sum += word;
        }
        return sum;
    }

    private static byte[] os2() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeShort(2); // version
        out.writeShort(UNITS_PER_EM); // xAvgCharWidth
        out.writeShort(400); // usWeightClass
        out.writeShort(5); // usWidthClass
        out.writeShort(0); // fsType: installable embedding
        for (int i = 0; i < 10; i++) {
            out.writeShort(100); // sub/superscript sizes and offsets, strikeout
        }
        out.writeShort(0); // sFamilyClass
        out.write(new byte[10]); // panose
        out.write(new byte[16]); // ulUnicodeRange1-4
        out.write("TEST".getBytes(StandardCharsets.US_ASCII));
        out.writeShort(0x40); // fsSelection: regular
        out.writeShort(0x20); // usFirstCharIndex
        out.writeShort(0xFFFF); // usLastCharIndex
        out.writeShort(800); // sTypoAscender
        out.writeShort(-200); // sTypoDescender
        out.writeShort(0); // sTypoLineGap
        out.writeShort(1000); // usWinAscent
        out.writeShort(200); // usWinDescent
        out.writeInt(0); // ulCodePageRange1
        out.writeInt(0); // ulCodePageRange2
        out.writeShort(500); // sxHeight
        out.writeShort(700); // sCapHeight
        out.writeShort(0); // usDefaultChar
        out.writeShort(0x20); // usBreakChar
        out.writeShort(1); // usMaxContext
        return bytes.toByteArray();
    }

    /**
     * Windows Unicode BMP subtable in format 4, one segment per character plus the
     * mandatory closing 0xFFFF segment.
     */
    private static byte[] cmap(TreeSet<Integer> codes) throws IOException {
        TreeMap<Integer, Integer> glyphs = new TreeMap<>();
        glyphs.put(0x20, 1);
        int gid = 2;
        for (int code : codes) {
            glyphs.put(code, gid++);
        }
        int segCount = glyphs.size() + 1;
        int power = Integer.highestOneBit(segCount);
        int searchRange = power * 2;

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeShort(0); // version
        out.writeShort(1); // numTables
        out.writeShort(3); // platform: Windows
        out.writeShort(1); // encoding: Unicode BMP
        out.writeInt(12);
        out.writeShort(4); // format
        out.writeShort(16 + 8 * segCount);
        out.writeShort(0); // language
        out.writeShort(segCount * 2);
        out.writeShort(searchRange);
        out.writeShort(Integer.numberOfTrailingZeros(power));
        out.writeShort(segCount * 2 - searchRange);
        for (int code : glyphs.keySet()) {
            out.writeShort(code); // endCode
        }
        out.writeShort(0xFFFF);
        out.writeShort(0); // reservedPad
        for (int code : glyphs.keySet()) {
            out.writeShort(code); // startCode
        }
        out.writeShort(0xFFFF);
        for (Map.Entry<Integer, Integer> glyph : glyphs.entrySet()) {
            out.writeShort((glyph.getValue() - glyph.getKey()) & 0xFFFF); // idDelta
        }
        out.writeShort(1);
        for (int i = 0; i < segCount; i++) {
            out.writeShort(0); // idRangeOffset
        }
        return bytes.toByteArray();
    }

    /**
     * One simple glyph per id: a single closed contour through four on-curve points.
     */
    private static byte[] glyf(int numGlyphs) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        for (int i = 0; i < numGlyphs; i++) {
            out.writeShort(1); // numberOfContours
            out.writeShort(100);
            out.writeShort(0);
            out.writeShort(900);
            out.writeShort(800);
            out.writeShort(3); // endPtsOfContours
            out.writeShort(0); // instructionLength
            for (int p = 0; p < 4; p++) {
                out.writeByte(0x01); // on curve, long x and y
            }
            out.writeShort(100);
            out.writeShort(800);
            out.writeShort(0);
            out.writeShort(-800);
            out.writeShort(0);
            out.writeShort(0);
            out.writeShort(800);
            out.writeShort(0);
        }
        return bytes.toByteArray();
    }

    private static byte[] loca(int numGlyphs) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        for (int i = 0; i <= numGlyphs; i++) {
            out.writeShort(i * GLYPH_SIZE / 2);
        }
        return bytes.toByteArray();
    }

    private static byte[] head() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeInt(0x00010000); // version
        out.writeInt(0x00010000); // fontRevision
        out.writeInt(0); // checkSumAdjustment
        out.writeInt(0x5F0F3CF5); // magicNumber
        out.writeShort(0x000B); // flags
        out.writeShort(UNITS_PER_EM);
        out.writeLong(0); // created
        out.writeLong(0); // modified
        out.writeShort(0);
        out.writeShort(0);
        out.writeShort(UNITS_PER_EM);
        out.writeShort(UNITS_PER_EM);
        out.writeShort(0); // macStyle
        out.writeShort(8); // lowestRecPPEM
        out.writeShort(2); // fontDirectionHint
        out.writeShort(0); // indexToLocFormat: short offsets
        out.writeShort(0); // glyphDataFormat
        return bytes.toByteArray();
    }

    private static byte[] hhea(int numGlyphs) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeInt(0x00010000);
        out.writeShort(800); // ascender
        out.writeShort(-200); // descender
        out.writeShort(0); // lineGap
        out.writeShort(UNITS_PER_EM); // advanceWidthMax
        out.writeShort(100); // minLeftSideBearing
        out.writeShort(100); // minRightSideBearing
        out.writeShort(900); // xMaxExtent
        out.writeShort(1); // caretSlopeRise
        out.writeShort(0); // caretSlopeRun
        for (int i = 0; i < 5; i++) {
            out.writeShort(0); // caretOffset and reserved
        }
        out.writeShort(0); // metricDataFormat
        out.writeShort(numGlyphs); // numberOfHMetrics
        return bytes.toByteArray();
    }

    private static byte[] hmtx(int numGlyphs) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        for (int i = 0; i < numGlyphs; i++) {
            out.writeShort(UNITS_PER_EM);
            out.writeShort(100);
        }
        return bytes.toByteArray();
    }

    private static byte[] maxp(int numGlyphs) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeInt(0x00010000);
        out.writeShort(numGlyphs);
        out.writeShort(4); // maxPoints
        out.writeShort(1); // maxContours
        out.writeShort(0); // maxCompositePoints
        out.writeShort(0); // maxCompositeContours
        out.writeShort(2); // maxZones
        out.writeShort(0); // maxTwilightPoints
        out.writeShort(0); // maxStorage
        out.writeShort(0); // maxFunctionDefs
        out.writeShort(0); // maxInstructionDefs
        out.writeShort(0); // maxStackElements
        out.writeShort(0); // maxSizeOfInstructions
        out.writeShort(0); // maxComponentElements
        out.writeShort(0); // maxComponentDepth
        return bytes.toByteArray();
    }

    private static byte[] name() throws IOException {
        String[] values = {"TestCjk", "Regular", "TestCjk Regular", "TestCjk-Regular"};
        int[] ids = {1, 2, 4, 6};
        ByteArrayOutputStream strings = new ByteArrayOutputStream();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeShort(0); // format
        out.writeShort(values.length);
        out.writeShort(6 + 12 * values.length);
        for (int i = 0; i < values.length; i++) {
            byte[] value = values[i].getBytes(StandardCharsets.UTF_16BE);
            out.writeShort(3); // platform: Windows
            out.writeShort(1); // encoding: Unicode BMP
            out.writeShort(0x409); // language: en-US
            out.writeShort(ids[i]);
            out.writeShort(value.length);
            out.writeShort(strings.size());
            strings.write(value);
        }
        out.write(strings.toByteArray());
        return bytes.toByteArray();
    }

    private static byte[] post() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeInt(0x00030000); // version 3: no glyph names
        out.writeInt(0); // italicAngle
        out.writeShort(-100); // underlinePosition
        out.writeShort(50); // underlineThickness
        out.writeInt(0); // isFixedPitch
        out.writeInt(0);
        out.writeInt(0);
        out.writeInt(0);
        out.writeInt(0);
        return bytes.toByteArray();
    }
}
