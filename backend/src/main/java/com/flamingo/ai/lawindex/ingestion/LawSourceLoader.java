package com.flamingo.ai.lawindex.ingestion;

import com.flamingo.ai.lawindex.model.LawSource;
import java.util.List;

/** Supplies the statutes to index, already filtered to the versions that should be indexed. */
public interface LawSourceLoader {

  /**
   * Loads all statutes selected for indexing.
   *
   * @return statutes in dataset order
   * @throws com.flamingo.ai.lawindex.exception.LawSourceException if the dataset cannot be read
   */
  List<LawSource> load();
}
