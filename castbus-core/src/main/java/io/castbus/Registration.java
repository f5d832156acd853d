package io.castbus;

/**
 * Handle that undoes one or more subscriptions when closed.
 *
 * <p>Closing is idempotent and never throws.
 */
@FunctionalInterface
public interface Registration extends AutoCloseable {

  /**
   * Removes the subscriptions held by this registration.
   */
  @Override
  void close();
}
