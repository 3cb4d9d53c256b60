package io.firebolt.client.log;

/**
 * Interface used by the driver to log information
 *
 * <p>Five levels are included in this interface, from high to low: ERROR WARN INFO DEBUG TRACE
 */
public interface FireboltLogger {
  boolean isDebugEnabled();

  boolean isErrorEnabled();

  boolean isInfoEnabled();

  boolean isTraceEnabled();

  boolean isWarnEnabled();

  /**
   * Logs message at DEBUG level.
   *
   * @param msg Message or message format
   * @param arguments objects that supply value to placeholders in the message format. Expensive
   *     operations that supply these values can be specified using lambdas implementing {@link
   *     ArgSupplier} so that they are run only if the message is going to be logged. E.g., {@code
   *     Logger.debug("Value: {}", (ArgSupplier) () -> expensiveOperation());}
   */
  void debug(String msg, Object... arguments);

  void debug(String msg, Throwable t);

  void error(String msg, Object... arguments);

  void error(String msg, Throwable t);

  void info(String msg, Object... arguments);

  void info(String msg, Throwable t);

  void trace(String msg, Object... arguments);

  void trace(String msg, Throwable t);

  void warn(String msg, Object... arguments);

  void warn(String msg, Throwable t);
}
