package nik.notes.core.domain.model;

/**
 * Cache key of a suggestion set: {@code ai_suggestions:<32 hex chars>}.
 *
 * <p>Not a security token. Stable across restarts (no salt).
 */
public record Fingerprint(String value) {

  public static final String NAMESPACE = "ai_suggestions:";

  public Fingerprint {
    if (value == null || !value.startsWith(NAMESPACE)) {
      throw new IllegalArgumentException("fingerprint must start with " + NAMESPACE);
    }
  }

  public static Fingerprint ofDigest(String hexDigest) {
    return new Fingerprint(NAMESPACE + hexDigest);
  }

  public String digest() {
    return value.substring(NAMESPACE.length());
  }

  @Override
  public String toString() {
    return value;
  }
}
