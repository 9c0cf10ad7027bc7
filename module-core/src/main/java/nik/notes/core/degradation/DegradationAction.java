package nik.notes.core.degradation;

public enum DegradationAction {
  PROCEED,
  FAIL_HARD,
  BYPASS_CACHE,
  USE_MOCK_GENERATOR,
  OMIT_CONTEXT
}
