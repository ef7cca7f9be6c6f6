package io.b2mash.b2b.automation.store;

/** Raised by {@link TabularStore} implementations when a read or write cannot be completed. */
public class StoreException extends RuntimeException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
