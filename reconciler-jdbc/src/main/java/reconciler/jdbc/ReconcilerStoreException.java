package reconciler.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC store implementations.
 */
public final class ReconcilerStoreException extends RuntimeException {
  public ReconcilerStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
