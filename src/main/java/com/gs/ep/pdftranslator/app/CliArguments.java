package com.gs.ep.pdftranslator.app;

import com.gs.ep.pdftranslator.pipeline.PageRanges;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Command line of {@link PdfTranslatorCli}.
 */
public class CliArguments {
    static final String USAGE = "Usage: PdfTranslatorCli <input.pdf|http(s) URL>... [-o outputDir] [-p pages] [-s service]"
            + " [-t threads] [-f fontPattern] [-c charPattern] [--layout boxes.json] [--prompt prompt.txt]"
            + " [--font font.ttf] [--ignore-cache] [--skip-subset-fonts] [-cp] [--strict] [--debug] [--version]";

    private final List<String> inputs = new ArrayList<>();
    private Path outputDir = Paths.get("output");
    private List<Integer> pages = Collections.emptyList();
    private String service;
    private Integer threads;
    private String formulaFontPattern;
    private String formulaCharPattern;
    private Path layoutFile;
    private String promptFile;
    private String fontPath;
    private boolean ignoreCache;
    private boolean skipSubsetFonts;
    private boolean compatible;
    private boolean strict;
    private boolean debug;
    private boolean version;

    /**
     * @throws IllegalArgumentException on unknown options or missing option values, and when
     *                                  no input is given without {@code --version}
     */
    public static CliArguments parse(String[] args) {
        CliArguments parsed = new CliArguments();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-o":
                case "--output":
                    parsed.outputDir = Paths.get(value(args, ++i, arg));
                    break;
                case "-p":
                case "--pages":
                    parsed.pages = PageRanges.parse(value(args, ++i, arg));
                    break;
                case "-s":
                case "--service":
                    parsed.service = value(args, ++i, arg);
                    break;
                case "-t":
                case "--thread":
                    parsed.threads = parseThreads(value(args, ++i, arg));
                    break;
                case "-f":
                case "--vfont":
                    parsed.formulaFontPattern = value(args, ++i, arg);
                    break;
                case "-c":
                case "--vchar":
                    parsed.formulaCharPattern = value(args, ++i, arg);
                    break;
                case "--layout":
                    parsed.layoutFile = Paths.get(value(args, ++i, arg));
                    break;
                case "--prompt":
                    parsed.promptFile = value(args, ++i, arg);
                    break;
                case "--font":
                    parsed.fontPath = value(args, ++i, arg);
                    break;
                case "--ignore-cache":
                    parsed.ignoreCache = true;
                    break;
                case "--skip-subset-fonts":
                    parsed.skipSubsetFonts = true;
                    break;
                case "-cp":
                case "--compatible":
                    parsed.compatible = true;
                    break;
                case "-v":
                case "--version":
                    parsed.version = true;
                    break;
                case "--strict":
                    parsed.strict = true;
                    break;
                case "-d":
                case "--debug":
                    parsed.debug = true;
                    break;
                default:
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    parsed.inputs.add(arg);
            }
        }
        if (parsed.inputs.isEmpty() && !parsed.version) {
            throw new IllegalArgumentException("No input files given");
        }
        return parsed;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static int parseThreads(String value) {
        try {
            int threads = Integer.parseInt(value.trim());
            if (threads < 1) {
                throw new IllegalArgumentException("Thread count must be positive: " + value);
            }
            return threads;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid thread count: " + value, e);
        }
    }

    /**
     * Local paths and http(s) URLs, in command line order.
     */
    public List<String> getInputs() {
        return Collections.unmodifiableList(inputs);
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public List<Integer> getPages() {
        return pages;
    }

    public String getService() {
        return service;
    }

    public Integer getThreads() {
        return threads;
    }

    public String getFormulaFontPattern() {
        return formulaFontPattern;
    }

    public String getFormulaCharPattern() {
        return formulaCharPattern;
    }

    public Path getLayoutFile() {
        return layoutFile;
    }

    public String getPromptFile() {
        return promptFile;
    }

    public String getFontPath() {
        return fontPath;
    }

    public boolean isIgnoreCache() {
        return ignoreCache;
    }

    public boolean isSkipSubsetFonts() {
        return skipSubsetFonts;
    }

    public boolean isCompatible() {
        return compatible;
    }

    public boolean isVersion() {
        return version;
    }

    public boolean isStrict() {
        return strict;
    }

    public boolean isDebug() {
        return debug;
    }
}
