package com.dubbi.statetrace.trace.parser;

import static com.dubbi.statetrace.trace.TraceFixtures.HOME;
import static com.dubbi.statetrace.trace.TraceFixtures.LOGIN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dubbi.statetrace.trace.TraceFixtures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TraceDocumentTest {

    @TempDir
    Path tempDir;

    @Test
    void splitsStatesSectionIntoMultiLineBlocks() {
        TraceDocument document = TraceDocument.of(TraceFixtures.loginHomeTrace());

        assertThat(document.screenBlocks()).containsExactly(
                LOGIN + ", Login, activity=MainActivity\n  Shows the login form, with two fields",
                HOME + ", Home, activity=HomeActivity"
        );
    }

    @Test
    void normalizesWindowsLineEndings() {
        TraceDocument document = TraceDocument.of(TraceFixtures.loginHomeTrace().replace("\n", "\r\n"));

        assertThat(document.text()).doesNotContain("\r");
        assertThat(document.screenBlocks()).hasSize(2);
    }

    @Test
    void missingStatesSectionYieldsNoBlocks() {
        TraceDocument document = TraceDocument.of("Transitions (0):\n");

        assertThat(document.statesSection()).isEmpty();
        assertThat(document.screenBlocks()).isEmpty();
    }

    @Test
    void readerReturnsEmptyForMissingFile() {
        assertThat(TraceDocumentReader.read(tempDir.resolve("nope.txt"))).isEmpty();
    }

    @Test
    void readerLoadsExistingFile() throws IOException {
        Path file = tempDir.resolve("graph.txt");
        Files.writeString(file, TraceFixtures.loginHomeTrace());

        assertThat(TraceDocumentReader.read(file))
                .hasValueSatisfying(doc -> assertThat(doc.statesSection()).isPresent());
    }

    @Test
    void readerWrapsUndecodableContent() throws IOException {
        Path file = tempDir.resolve("broken.txt");
        Files.write(file, new byte[]{(byte) 0xC3, (byte) 0x28, (byte) 0xFF});

        assertThatThrownBy(() -> TraceDocumentReader.read(file))
                .isInstanceOf(TraceReadException.class)
                .hasMessageContaining("broken.txt");
    }
}
