package org.a11yrag.retrieval_service.ontology.domain;

/** Whether a domain describes a group of users or a web technology. */
public enum DomainCategory {
  ACCESSIBILITY,
  TECHNOLOGY
}
