package com.syntaxlens.core.util;

import com.syntaxlens.core.model.SourceLanguage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void readString_utf8File_returnsContent() throws IOException {
        Path file = tempDir.resolve("a.css");
        Files.writeString(file, "p::before { content: \"→\"; }");

        assertThat(FileUtils.readString(file)).isEqualTo("p::before { content: \"→\"; }");
    }

    @Test
    void isReadableFile_directoryOrMissing_returnsFalse() throws IOException {
        Path file = Files.createFile(tempDir.resolve("x.js"));

        assertThat(FileUtils.isReadableFile(file)).isTrue();
        assertThat(FileUtils.isReadableFile(tempDir)).isFalse();
        assertThat(FileUtils.isReadableFile(tempDir.resolve("missing.js"))).isFalse();
    }

    @Test
    void getExtension_variousNames_returnsSuffixWithoutDot() {
        assertThat(FileUtils.getExtension(Path.of("src/app.min.js"))).isEqualTo("js");
        assertThat(FileUtils.getExtension(Path.of(".eslintrc"))).isEmpty();
        assertThat(FileUtils.getExtension(Path.of("Makefile"))).isEmpty();
    }

    @Test
    void languageOf_knownAndUnknownExtensions() {
        assertThat(FileUtils.languageOf(Path.of("site.CSS"))).isEqualTo(SourceLanguage.CSS);
        assertThat(FileUtils.languageOf(Path.of("lib.cjs"))).isEqualTo(SourceLanguage.JAVASCRIPT);
        assertThat(FileUtils.languageOf(Path.of("notes.txt"))).isEqualTo(SourceLanguage.UNKNOWN);
    }
}
