package org.a11yrag.retrieval_service.index;

import java.io.Closeable;
import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.a11yrag.retrieval_service.exceptions.VectorIndexUnavailableException;
import org.a11yrag.retrieval_service.model.Partition;
import org.a11yrag.retrieval_service.model.SourceMetadata;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherFactory;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.store.Directory;

/**
 * {@link VectorIndex} backed by one Lucene index. Chunks are stored with a cosine {@link
 * KnnFloatVectorField}; queries run a {@link KnnFloatVectorQuery} on a searcher acquired from a
 * {@link SearcherManager}. Lucene's cosine score {@code (1 + cos) / 2} is already in [0,1].
 */
@Slf4j
public class LuceneVectorIndex implements VectorIndex, Closeable {

  static final String FIELD_KEY = "key";
  static final String FIELD_DOCUMENT_ID = "documentId";
  static final String FIELD_CHUNK_ID = "chunkId";
  static final String FIELD_TEXT = "text";
  static final String FIELD_VECTOR = "vector";
  static final String FIELD_AUTHOR_ID = "authorId";
  static final String FIELD_AFFILIATION = "affiliation";
  static final String FIELD_PUBLICATION_DATE = "publicationDate";
  static final String FIELD_TITLE = "title";
  static final String FIELD_SUPERSEDED = "superseded";

  private static final Comparator<IndexedHit> HIT_ORDER =
      Comparator.comparingDouble(IndexedHit::score)
          .reversed()
          .thenComparing(IndexedHit::documentId)
          .thenComparing(IndexedHit::chunkId);

  private final Partition partition;
  private final Directory directory;
  private final Embedder embedder;
  private final IndexWriter writer;
  private final SearcherManager searcherManager;
  private volatile boolean open = true;

  private LuceneVectorIndex(
      Partition partition,
      Directory directory,
      Embedder embedder,
      IndexWriter writer,
      SearcherManager searcherManager) {
    this.partition = partition;
    this.directory = directory;
    this.embedder = embedder;
    this.writer = writer;
    this.searcherManager = searcherManager;
  }

  /**
   * Opens (or creates) the index in the given directory.
   *
   * @throws IllegalStateException if the index cannot be opened
   */
  public static LuceneVectorIndex open(Partition partition, Directory directory, Embedder embedder) {
    try {
      IndexWriterConfig config = new IndexWriterConfig(new StandardAnalyzer());
      config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
      IndexWriter writer = new IndexWriter(directory, config);
      SearcherManager manager = new SearcherManager(writer, new SearcherFactory());
      log.debug("Vector index for {} opened", partition);
      return new LuceneVectorIndex(partition, directory, embedder, writer, manager);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to open vector index for " + partition, e);
    }
  }

  @Override
  public Partition partition() {
    return partition;
  }

  /**
   * Embeds and stores the chunks, replacing chunks with the same document and chunk id, then
   * commits and refreshes the searcher.
   *
   * @throws IllegalArgumentException if a chunk belongs to another partition
   * @throws VectorIndexUnavailableException if the index is closed or the write fails
   */
  public void index(Collection<IndexedChunk> chunks) {
    ensureOpen();
    try {
      for (IndexedChunk chunk : chunks) {
        if (chunk.metadata().documentType() != partition) {
          throw new IllegalArgumentException(
              "Chunk " + chunk.key() + " belongs to " + chunk.metadata().documentType()
                  + ", not " + partition);
        }
        writer.updateDocument(new Term(FIELD_KEY, chunk.key()), toDocument(chunk));
      }
      writer.commit();
      searcherManager.maybeRefreshBlocking();
      log.debug("Indexed {} chunks into {}", chunks.size(), partition);
    } catch (IOException | AlreadyClosedException e) {
      throw new VectorIndexUnavailableException("Failed to write to index " + partition, e);
    }
  }

  @Override
  public List<IndexedHit> query(String text, int topK) {
    ensureOpen();
    float[] vector;
    try {
      if (!embedder.canEmbed(text)) {
        log.debug("Query text for {} has no embeddable tokens, returning no hits", partition);
        return List.of();
      }
      vector = embedder.embed(text);
    } catch (RuntimeException e) {
      throw new VectorIndexUnavailableException("Embedding failed for " + partition, e);
    }

    IndexSearcher searcher = null;
    try {
      searcher = searcherManager.acquire();
      TopDocs topDocs = searcher.search(new KnnFloatVectorQuery(FIELD_VECTOR, vector, topK), topK);
      StoredFields storedFields = searcher.storedFields();
      List<IndexedHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
      for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
        hits.add(toHit(storedFields.document(scoreDoc.doc), scoreDoc.score));
      }
      hits.sort(HIT_ORDER);
      return hits;
    } catch (IOException | AlreadyClosedException e) {
      throw new VectorIndexUnavailableException("Search failed in index " + partition, e);
    } finally {
      release(searcher);
    }
  }

  /** Number of live chunks visible to searches. */
  public int size() {
    ensureOpen();
    IndexSearcher searcher = null;
    try {
      searcher = searcherManager.acquire();
      return searcher.getIndexReader().numDocs();
    } catch (IOException e) {
      throw new VectorIndexUnavailableException("Cannot read index " + partition, e);
    } finally {
      release(searcher);
    }
  }

  public boolean isOpen() {
    return open;
  }

  @Override
  public synchronized void close() {
    if (!open) {
      return;
    }
    open = false;
    try {
      searcherManager.close();
      writer.close();
      directory.close();
      log.debug("Vector index for {} closed", partition);
    } catch (IOException e) {
      log.error("Error closing vector index for {}", partition, e);
    }
  }

  private void ensureOpen() {
    if (!open) {
      throw new VectorIndexUnavailableException("Index " + partition + " is closed");
    }
  }

  private void release(IndexSearcher searcher) {
    if (searcher == null) {
      return;
    }
    try {
      searcherManager.release(searcher);
    } catch (IOException | AlreadyClosedException e) {
      log.warn("Failed to release searcher for {}: {}", partition, e.getMessage());
    }
  }

  private Document toDocument(IndexedChunk chunk) {
    SourceMetadata metadata = chunk.metadata();
    Document doc = new Document();
    doc.add(new StringField(FIELD_KEY, chunk.key(), Field.Store.NO));
    doc.add(new StringField(FIELD_DOCUMENT_ID, chunk.documentId(), Field.Store.YES));
    doc.add(new StoredField(FIELD_CHUNK_ID, chunk.chunkId()));
    doc.add(new StoredField(FIELD_TEXT, chunk.text()));
    doc.add(
        new KnnFloatVectorField(
            FIELD_VECTOR, embedder.embed(chunk.text()), VectorSimilarityFunction.COSINE));
    addIfPresent(doc, FIELD_AUTHOR_ID, metadata.authorId());
    addIfPresent(doc, FIELD_AFFILIATION, metadata.affiliation());
    addIfPresent(doc, FIELD_TITLE, metadata.title());
    if (metadata.publicationDate() != null) {
      doc.add(new StoredField(FIELD_PUBLICATION_DATE, metadata.publicationDate().toString()));
    }
    doc.add(new StoredField(FIELD_SUPERSEDED, Boolean.toString(metadata.superseded())));
    return doc;
  }

  private static void addIfPresent(Document doc, String field, String value) {
    if (value != null && !value.isBlank()) {
      doc.add(new StoredField(field, value));
    }
  }

  private IndexedHit toHit(Document doc, float score) {
    String date = doc.get(FIELD_PUBLICATION_DATE);
    SourceMetadata metadata =
        new SourceMetadata(
            doc.get(FIELD_AUTHOR_ID),
            doc.get(FIELD_AFFILIATION),
            date == null ? null : LocalDate.parse(date),
            partition,
            doc.get(FIELD_TITLE),
            Boolean.parseBoolean(doc.get(FIELD_SUPERSEDED)));
    return new IndexedHit(
        doc.get(FIELD_DOCUMENT_ID),
        doc.get(FIELD_CHUNK_ID),
        Math.max(0.0, Math.min(1.0, score)),
        metadata);
  }
}
