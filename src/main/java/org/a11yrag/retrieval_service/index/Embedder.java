package org.a11yrag.retrieval_service.index;

/**
 * Turns text into a fixed-length vector. The same instance embeds indexed chunks and query text,
 * so both live in one vector space.
 */
public interface Embedder {

  /**
   * @param text text to embed, may be empty
   * @return vector of length {@link #dimension()}, never all zeros
   */
  float[] embed(String text);

  /**
   * False when {@code text} carries no content the embedder can represent, for instance only stop
   * words. Such text still embeds to a valid vector for indexing, but querying with it is
   * meaningless.
   */
  default boolean canEmbed(String text) {
    return text != null && !text.isBlank();
  }

  int dimension();
}
