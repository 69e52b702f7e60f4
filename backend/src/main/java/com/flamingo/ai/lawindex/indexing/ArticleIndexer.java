package com.flamingo.ai.lawindex.indexing;

import com.flamingo.ai.lawindex.model.ArticleRecord;
import java.util.List;

/**
 * Persists article records for retrieval. Implementations embed {@link ArticleRecord#content()}
 * and store it with {@link ArticleRecord#metadata()} under an identifier of their choosing.
 */
public interface ArticleIndexer {

  /**
   * Indexes the given records.
   *
   * @param records records to index
   * @return number of records stored
   * @throws com.flamingo.ai.lawindex.exception.ArticleIndexingException if embedding or storage
   *     fails
   */
  int index(List<ArticleRecord> records);
}
