package nik.notes.core.port.out;

import nik.notes.core.domain.model.RequestParameters;
import nik.notes.core.domain.model.SuggestionList;

/** Deterministic substitute generator. Total, no I/O; equal inputs give equal outputs. */
public interface MockBackend {

  SuggestionList generate(RequestParameters params);
}
