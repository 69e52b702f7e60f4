package com.flamingo.ai.lawindex.ingestion;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flamingo.ai.lawindex.config.LawIndexConfig;
import com.flamingo.ai.lawindex.exception.LawSourceException;
import com.flamingo.ai.lawindex.model.LawSource;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link LawSourceLoader} reading a UTF-8 CSV file with a header row.
 *
 * <p>The subject column becomes the law identifier and the text column the statute body. Quoted
 * cells may span several lines, which is how statute bodies are stored. Rows are filtered through
 * {@link LawSubjectFilter}; a subject listed twice keeps its first position and its last text.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CsvLawSourceLoader implements LawSourceLoader {

  private static final CsvMapper CSV_MAPPER =
      CsvMapper.builder().enable(CsvParser.Feature.SKIP_EMPTY_LINES).build();

  private final LawIndexConfig config;
  private final LawSubjectFilter subjectFilter;

  @Override
  public List<LawSource> load() {
    return load(Path.of(config.getSource().getCsvPath()));
  }

  /**
   * Loads and filters the statutes stored in the given CSV file.
   *
   * @param csvPath path to the dataset
   * @return kept statutes in file order, one per subject (the last row wins)
   */
  public List<LawSource> load(Path csvPath) {
    if (!Files.isRegularFile(csvPath)) {
      throw new LawSourceException(csvPath.toString(), "Law dataset not found: " + csvPath);
    }

    String subjectColumn = config.getSource().getSubjectColumn();
    String textColumn = config.getSource().getTextColumn();
    CsvSchema schema = CsvSchema.emptySchema().withHeader();

    Map<String, LawSource> sources = new LinkedHashMap<>();
    int rows = 0;
    try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8);
        MappingIterator<Map<String, String>> it =
            CSV_MAPPER.readerForMapOf(String.class).with(schema).readValues(reader)) {
      boolean hasRow = it.hasNextValue();
      requireColumns(csvPath, (CsvSchema) it.getParserSchema(), subjectColumn, textColumn);

      while (hasRow) {
        Map<String, String> row = it.nextValue();
        rows++;
        hasRow = it.hasNextValue();

        String subject = row.get(subjectColumn);
        if (!subjectFilter.accepts(subject)) {
          continue;
        }
        // trailing empty cells are omitted from short rows
        String text = row.getOrDefault(textColumn, "");
        if (text == null || text.isBlank()) {
          log.warn("Law '{}' has no text, it will yield no articles", subject);
        }
        LawSource previous = sources.put(subject, new LawSource(subject, text == null ? "" : text));
        if (previous != null) {
          log.warn("Law '{}' appears more than once, keeping the last row", subject);
        }
      }
    } catch (IOException e) {
      throw new LawSourceException(
          csvPath.toString(), "Failed to read law dataset " + csvPath + ": " + e.getMessage(), e);
    }

    log.info(
        "Loaded {} of {} laws from {} ({} excluded by subject or duplicated)",
        sources.size(),
        rows,
        csvPath,
        rows - sources.size());
    return List.copyOf(sources.values());
  }

  private static void requireColumns(
      Path csvPath, CsvSchema header, String subjectColumn, String textColumn) {
    if (header == null
        || header.column(subjectColumn) == null
        || header.column(textColumn) == null) {
      throw new LawSourceException(
          csvPath.toString(),
          String.format(
              "Law dataset %s must have '%s' and '%s' columns",
              csvPath, subjectColumn, textColumn));
    }
  }
}
