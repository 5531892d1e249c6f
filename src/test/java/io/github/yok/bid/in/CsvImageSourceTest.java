package io.github.yok.bid.in;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.bid.core.InvalidInputException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvImageSourceTest {

    @TempDir
    Path dir;

    @Test
    void readsOneImageRowPerRecord() throws IOException {
        Path file = dir.resolve("blurred.csv");
        Files.write(file, "0.1, 0.2, 0.3\n\n0.4,0.5,0.6\n".getBytes(StandardCharsets.UTF_8));

        SourceImage source = new CsvImageSource(file.toString()).load();

        assertThat(source.getName()).isEqualTo("blurred");
        assertThat(source.getBlurred().height()).isEqualTo(2);
        assertThat(source.getBlurred().width()).isEqualTo(3);
        assertThat(source.getBlurred().row(1)).containsExactly(0.4, 0.5, 0.6);
        assertThat(source.groundTruth()).isEmpty();
    }

    @Test
    void rejectsNonNumericAndRaggedContent() throws IOException {
        Path text = dir.resolve("text.csv");
        Files.write(text, "0.1,abc\n".getBytes(StandardCharsets.UTF_8));
        Path ragged = dir.resolve("ragged.csv");
        Files.write(ragged, "0.1,0.2\n0.3\n".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> new CsvImageSource(text.toString()).load())
                .isInstanceOf(InvalidInputException.class).hasMessageContaining("abc");
        assertThatThrownBy(() -> new CsvImageSource(ragged.toString()).load())
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void wrapsMissingFileInIllegalStateException() {
        Path missing = dir.resolve("missing.csv");

        assertThatThrownBy(() -> new CsvImageSource(missing.toString()).load())
                .isInstanceOf(IllegalStateException.class).hasMessageContaining("missing.csv")
                .hasCauseInstanceOf(IOException.class);
    }
}
