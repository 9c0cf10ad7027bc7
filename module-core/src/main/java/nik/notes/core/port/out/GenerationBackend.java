package nik.notes.core.port.out;

import java.time.Duration;
import nik.notes.core.domain.model.RequestParameters;
import nik.notes.core.domain.model.SuggestionList;

/**
 * Port to the real (slow, fallible) suggestion generator.
 *
 * <p>Fails with {@link nik.notes.error.exception.GenerationFailureException}, {@link
 * nik.notes.error.exception.DependencyTimeoutException} or {@link
 * nik.notes.error.exception.DependencyUnavailableException}.
 */
public interface GenerationBackend {

  SuggestionList generate(RequestParameters params, Duration timeout);
}
