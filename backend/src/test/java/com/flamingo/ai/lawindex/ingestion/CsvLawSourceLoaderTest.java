package com.flamingo.ai.lawindex.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.lawindex.config.LawIndexConfig;
import com.flamingo.ai.lawindex.exception.LawSourceException;
import com.flamingo.ai.lawindex.model.LawSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("CsvLawSourceLoader Tests")
class CsvLawSourceLoaderTest {

  @TempDir Path tempDir;

  private LawIndexConfig config;
  private CsvLawSourceLoader loader;

  @BeforeEach
  void setUp() {
    config = new LawIndexConfig();
    loader = new CsvLawSourceLoader(config, new LawSubjectFilter(config));
  }

  @Test
  @DisplayName("should load rows whose subject passes the filter, keeping multi-line text")
  void shouldLoadFilteredRows() throws IOException {
    Path csv =
        write(
            "subject,text\n"
                + "\"Luật Đất đai 2024 (mới nhất)\",\"Điều 1. Phạm vi\n1. Nội dung A\"\n"
                + "\"Luật Đất đai 2024 (sửa đổi)\",\"Điều 1. Sửa đổi\"\n"
                + "\"Luật Nhà ở 2023 (mới nhất)\",\"Điều 2. Đối tượng\"\n");

    List<LawSource> sources = loader.load(csv);

    assertThat(sources)
        .containsExactly(
            new LawSource("Luật Đất đai 2024 (mới nhất)", "Điều 1. Phạm vi\n1. Nội dung A"),
            new LawSource("Luật Nhà ở 2023 (mới nhất)", "Điều 2. Đối tượng"));
  }

  @Test
  @DisplayName("should read the configured CSV path")
  void shouldReadConfiguredPath() throws IOException {
    Path csv = write("subject,text\n\"Luật A (mới nhất)\",\"Điều 1. X\"\n");
    config.getSource().setCsvPath(csv.toString());

    assertThat(loader.load())
        .extracting(LawSource::lawIdentifier)
        .containsExactly("Luật A (mới nhất)");
  }

  @Test
  @DisplayName("should keep rows with empty text as empty documents")
  void shouldKeepRowsWithEmptyText() throws IOException {
    Path csv = write("subject,text\n\"Luật B (mới nhất)\",\n");

    assertThat(loader.load(csv)).containsExactly(new LawSource("Luật B (mới nhất)", ""));
  }

  @Test
  @DisplayName("should fail when the dataset file is missing")
  void shouldFailWhenFileMissing() {
    Path missing = tempDir.resolve("missing.csv");

    assertThatThrownBy(() -> loader.load(missing))
        .isInstanceOf(LawSourceException.class)
        .hasMessageContaining("not found");
  }

  @Test
  @DisplayName("should fail when the required columns are absent")
  void shouldFailWhenColumnsMissing() throws IOException {
    Path csv = write("title,body\n\"Luật C (mới nhất)\",\"Điều 1. X\"\n");

    assertThatThrownBy(() -> loader.load(csv))
        .isInstanceOf(LawSourceException.class)
        .hasMessageContaining("'subject'")
        .extracting(e -> ((LawSourceException) e).getUserMessage())
        .isEqualTo("Failed to load law dataset");
  }

  @Test
  @DisplayName("should return nothing for a header-only file")
  void shouldReturnEmptyForHeaderOnly() throws IOException {
    assertThat(loader.load(write("subject,text\n"))).isEmpty();
  }

  @Test
  @DisplayName("should treat a short row without a text cell as an empty document")
  void shouldAcceptShortRow() throws IOException {
    Path csv =
        write(
            "subject,text,note\n"
                + "\"Luật D (mới nhất)\"\n"
                + "\"Luật E (mới nhất)\",\"Điều 1. X\",ghi chú\n");

    assertThat(loader.load(csv))
        .containsExactly(
            new LawSource("Luật D (mới nhất)", ""),
            new LawSource("Luật E (mới nhất)", "Điều 1. X"));
  }

  @Test
  @DisplayName("should keep one source per subject, with the last row's text at the first position")
  void shouldKeepLastRowForDuplicateSubject() throws IOException {
    Path csv =
        write(
            "subject,text\n"
                + "\"Luật F (mới nhất)\",\"Điều 1. Cũ\"\n"
                + "\"Luật G (mới nhất)\",\"Điều 1. G\"\n"
                + "\"Luật F (mới nhất)\",\"Điều 1. Mới\"\n");

    assertThat(loader.load(csv))
        .containsExactly(
            new LawSource("Luật F (mới nhất)", "Điều 1. Mới"),
            new LawSource("Luật G (mới nhất)", "Điều 1. G"));
  }

  @Test
  @DisplayName("should fail on a header-only file without the required columns")
  void shouldFailWhenHeaderOnlyLacksColumns() throws IOException {
    Path csv = write("title,body\n");

    assertThatThrownBy(() -> loader.load(csv))
        .isInstanceOf(LawSourceException.class)
        .hasMessageContaining("'text'");
  }

  private Path write(String content) throws IOException {
    Path csv = tempDir.resolve("luat.csv");
    Files.writeString(csv, content, StandardCharsets.UTF_8);
    return csv;
  }
}
