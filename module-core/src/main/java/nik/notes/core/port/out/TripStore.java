package nik.notes.core.port.out;

import java.util.Optional;
import nik.notes.core.domain.model.TripRecord;

/**
 * Port to the durable relational store.
 *
 * <p>Required dependency: an unreachable store raises {@link
 * nik.notes.error.exception.StoreFailureException}, which callers must not swallow.
 */
public interface TripStore {

  Optional<TripRecord> findById(long tripId);
}
