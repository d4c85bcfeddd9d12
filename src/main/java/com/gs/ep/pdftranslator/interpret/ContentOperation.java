package com.gs.ep.pdftranslator.interpret;

import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSBase;

import java.awt.geom.Point2D;
import java.util.Collections;
import java.util.List;

/**
 * One decoded content-stream instruction, kept in program order. Text-showing
 * operations also carry their device-space anchor, the region sampled there and
 * the text state they were shown with.
 */
public class ContentOperation {
    private final Operator operator;
    private final List<COSBase> operands;

    Point2D.Float anchor;
    int regionId = -1;
    String decodedText;
    TextStateSnapshot state;
    int runIndex = -1;
    int lineIndex = -1;
    boolean firstOfLine;
    boolean lastOfRun;

    public ContentOperation(Operator operator, List<COSBase> operands) {
        this.operator = operator;
        this.operands = Collections.unmodifiableList(operands);
    }

    /**
     * Null for operands left dangling at the end of a stream.
     */
    public Operator getOperator() {
        return operator;
    }

    public String getName() {
        return operator == null ? "" : operator.getName();
    }

    public List<COSBase> getOperands() {
        return operands;
    }

    public boolean isShow() {
        return PageInterpreter.isShowOperator(getName());
    }

    public Point2D.Float getAnchor() {
        return anchor;
    }

    public int getRegionId() {
        return regionId;
    }

    public String getDecodedText() {
        return decodedText;
    }

    /**
     * Index of the run this show belongs to, or -1 when it is copied verbatim.
     */
    public int getRunIndex() {
        return runIndex;
    }

    @Override
    public String toString() {
        return operands + " " + getName();
    }
}
