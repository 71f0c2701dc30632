package org.a11yrag.retrieval_service.authority.model;

/** Which rule produced an {@link AuthorityRecord}. */
public enum AuthorityBasis {
  KNOWN_AUTHOR,
  AFFILIATION,
  DOCUMENT_TYPE_DEFAULT
}
