package com.syntaxlens.cli;

import com.syntaxlens.core.model.SourceLanguage;
import com.syntaxlens.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * A source file read for a command, with its language.
 *
 * @param path file path
 * @param content file content
 * @param language language implied by the extension
 */
record SourceFile(Path path, String content, SourceLanguage language) {

    private static final Logger log = LoggerFactory.getLogger(SourceFile.class);

    /**
     * @param path file to read
     * @return the file, or empty after logging why it cannot be read
     */
    static Optional<SourceFile> read(Path path) {
        if (!FileUtils.isReadableFile(path)) {
            log.error("File not found or not readable: {}", path);
            return Optional.empty();
        }
        try {
            return Optional.of(new SourceFile(path, FileUtils.readString(path), FileUtils.languageOf(path)));
        } catch (IOException e) {
            log.error("Failed to read {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    boolean is(SourceLanguage expected) {
        return language == expected;
    }
}
