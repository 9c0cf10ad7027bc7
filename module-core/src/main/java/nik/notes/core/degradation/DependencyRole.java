package nik.notes.core.degradation;

/** Role an external dependency plays for the suggestion flow. */
public enum DependencyRole {
  /** Relational store. Required, no fallback. */
  DURABLE_STORE,
  /** Shared cache. Optional. */
  CACHE,
  /** Real suggestion generator. Optional, substituted by the mock generator. */
  GENERATION_BACKEND,
  /** Enrichment such as weather. Optional, omitted when missing. */
  AUXILIARY_CONTEXT
}
