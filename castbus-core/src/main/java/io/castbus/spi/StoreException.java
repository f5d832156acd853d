package io.castbus.spi;

/**
 * Raised by storage implementations when a read or write cannot be completed.
 */
public class StoreException extends RuntimeException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
