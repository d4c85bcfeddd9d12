package com.gs.ep.pdftranslator.pipeline;

import java.nio.file.Path;

/**
 * What happened to one input file of a batch.
 */
public class FileOutcome {

    public enum Status {
        SUCCESS,
        CANCELLED,
        FAILED
    }

    private final Path input;
    private final Status status;
    private final Path monoPath;
    private final Path dualPath;
    private final long monoSize;
    private final long dualSize;
    private final String error;

    private FileOutcome(Path input, Status status, Path monoPath, Path dualPath, long monoSize, long dualSize,
            String error) {
        this.input = input;
        this.status = status;
        this.monoPath = monoPath;
        this.dualPath = dualPath;
        this.monoSize = monoSize;
        this.dualSize = dualSize;
        this.error = error;
    }

    public static FileOutcome success(Path input, Path monoPath, long monoSize, Path dualPath, long dualSize) {
        return new FileOutcome(input, Status.SUCCESS, monoPath, dualPath, monoSize, dualSize, null);
    }

    public static FileOutcome cancelled(Path input) {
        return new FileOutcome(input, Status.CANCELLED, null, null, 0, 0, null);
    }

    /**
     * Cancelled part way; the outputs hold the pages finished before cancellation.
     */
    public static FileOutcome cancelled(Path input, Path monoPath, long monoSize, Path dualPath, long dualSize) {
        return new FileOutcome(input, Status.CANCELLED, monoPath, dualPath, monoSize, dualSize, null);
    }

    public static FileOutcome failed(Path input, String error) {
        return new FileOutcome(input, Status.FAILED, null, null, 0, 0, error);
    }

    public Path getInput() {
        return input;
    }

    public Status getStatus() {
        return status;
    }

    public Path getMonoPath() {
        return monoPath;
    }

    public Path getDualPath() {
        return dualPath;
    }

    public long getMonoSize() {
        return monoSize;
    }

    public long getDualSize() {
        return dualSize;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        switch (status) {
            case SUCCESS:
                return input.getFileName() + ": " + monoPath + " (" + monoSize + " bytes), " + dualPath + " ("
                        + dualSize + " bytes)";
            case FAILED:
                return input.getFileName() + ": FAILED " + error;
            default:
                return monoPath == null ? input.getFileName() + ": CANCELLED"
                        : input.getFileName() + ": CANCELLED, partial output " + monoPath + ", " + dualPath;
        }
    }
}
