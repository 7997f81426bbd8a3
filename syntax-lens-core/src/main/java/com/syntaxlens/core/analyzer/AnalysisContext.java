package com.syntaxlens.core.analyzer;

import com.syntaxlens.core.config.AnalyzerConfig;
import com.syntaxlens.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Context provided to analyzers during execution.
 *
 * @param file path of the source; used for naming and language detection
 * @param content source text
 * @param config analyzer configuration
 */
public record AnalysisContext(
    Path file,
    String content,
    AnalyzerConfig config
) {
    public AnalysisContext {
        Objects.requireNonNull(file, "file must not be null");
        if (content == null) {
            content = "";
        }
        if (config == null) {
            config = AnalyzerConfig.defaults();
        }
    }

    /**
     * Reads a file into a context.
     *
     * @param file source file
     * @param config analyzer configuration
     * @return context holding the file's content
     * @throws IOException if the file cannot be read
     */
    public static AnalysisContext forFile(Path file, AnalyzerConfig config) throws IOException {
        return new AnalysisContext(file, FileUtils.readString(file), config);
    }

    /**
     * @return file extension without dot, lower-cased by the caller if needed
     */
    public String extension() {
        return FileUtils.getExtension(file);
    }

    /**
     * @return the file's name for reports
     */
    public String sourceName() {
        Path name = file.getFileName();
        return name != null ? name.toString() : file.toString();
    }
}
