package nik.notes.core.domain.model;

/** Where a suggestion list came from. */
public enum SuggestionSource {
  /** Produced by the real generative backend. */
  GENERATED,
  /** Produced by the deterministic substitute. */
  MOCK
}
