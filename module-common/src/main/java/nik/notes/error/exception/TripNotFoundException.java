package nik.notes.error.exception;

import nik.notes.error.CommonErrorCode;
import nik.notes.error.exception.base.ClientBaseException;
import nik.notes.error.exception.marker.CircuitBreakerIgnoreMarker;

public class TripNotFoundException extends ClientBaseException
    implements CircuitBreakerIgnoreMarker {

  public TripNotFoundException(long tripId) {
    super(CommonErrorCode.TRIP_NOT_FOUND, tripId);
  }
}
