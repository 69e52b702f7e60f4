package com.flamingo.ai.lawindex.ingestion;

import com.flamingo.ai.lawindex.config.LawIndexConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Selects which dataset rows are indexed, based on the row's subject.
 *
 * <p>Only the latest consolidated version of a law is kept: the subject must contain the include
 * marker ({@code "mới nhất"}) and must not contain the exclude marker ({@code "sửa đổi"}), so
 * amending laws are skipped even when they are flagged as latest.
 */
@Component
@RequiredArgsConstructor
public class LawSubjectFilter {

  private final LawIndexConfig config;

  /**
   * Returns {@code true} if a row with this subject should be indexed.
   *
   * @param subject the row subject; {@code null} is rejected
   * @return whether the row is kept
   */
  public boolean accepts(String subject) {
    if (subject == null) {
      return false;
    }
    LawIndexConfig.Source source = config.getSource();
    return subject.contains(source.getIncludeMarker())
        && !subject.contains(source.getExcludeMarker());
  }
}
