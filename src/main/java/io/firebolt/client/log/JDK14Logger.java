package io.firebolt.client.log;

import io.firebolt.client.util.SecretDetector;
import java.text.MessageFormat;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Use java.util.logging to implements FireboltLogger.
 *
 * <p>Log Level mapping from FireboltLogger to java.util.logging: ERROR -- SEVERE WARN -- WARNING
 * INFO -- INFO DEBUG -- FINE TRACE -- FINEST
 */
public class JDK14Logger implements FireboltLogger {
  static final String DRIVER_LOGGER_NAME = "io.firebolt.client";

  private final Logger jdkLogger;

  private final Set<String> logMethods =
      new HashSet<>(Arrays.asList("debug", "error", "info", "trace", "warn", "logInternal"));

  public JDK14Logger(String name) {
    this.jdkLogger = Logger.getLogger(name);
  }

  public boolean isDebugEnabled() {
    return this.jdkLogger.isLoggable(Level.FINE);
  }

  public boolean isErrorEnabled() {
    return this.jdkLogger.isLoggable(Level.SEVERE);
  }

  public boolean isInfoEnabled() {
    return this.jdkLogger.isLoggable(Level.INFO);
  }

  public boolean isTraceEnabled() {
    return this.jdkLogger.isLoggable(Level.FINEST);
  }

  public boolean isWarnEnabled() {
    return this.jdkLogger.isLoggable(Level.WARNING);
  }

  public void debug(String msg, Object... arguments) {
    logInternal(Level.FINE, msg, arguments);
  }

  public void debug(String msg, Throwable t) {
    logInternal(Level.FINE, msg, t);
  }

  public void error(String msg, Object... arguments) {
    logInternal(Level.SEVERE, msg, arguments);
  }

  public void error(String msg, Throwable t) {
    logInternal(Level.SEVERE, msg, t);
  }

  public void info(String msg, Object... arguments) {
    logInternal(Level.INFO, msg, arguments);
  }

  public void info(String msg, Throwable t) {
    logInternal(Level.INFO, msg, t);
  }

  public void trace(String msg, Object... arguments) {
    logInternal(Level.FINEST, msg, arguments);
  }

  public void trace(String msg, Throwable t) {
    logInternal(Level.FINEST, msg, t);
  }

  public void warn(String msg, Object... arguments) {
    logInternal(Level.WARNING, msg, arguments);
  }

  public void warn(String msg, Throwable t) {
    logInternal(Level.WARNING, msg, t);
  }

  /**
   * Sets the level of the driver root logger.
   *
   * @param level java.util.logging level
   */
  public static void setLevel(Level level) {
    Logger.getLogger(DRIVER_LOGGER_NAME).setLevel(level);
  }

  public static Level getLevel() {
    return Logger.getLogger(DRIVER_LOGGER_NAME).getLevel();
  }

  private void logInternal(Level level, String msg, Object... arguments) {
    if (jdkLogger.isLoggable(level)) {
      String[] source = findSourceInStack();
      String message;
      try {
        message = MessageFormat.format(refactorString(msg), evaluateLambdaArgs(arguments));
      } catch (IllegalArgumentException e) {
        message = "Unable to format msg: " + msg;
      }
      jdkLogger.logp(level, source[0], source[1], SecretDetector.maskSecrets(message));
    }
  }

  private void logInternal(Level level, String msg, Throwable t) {
    if (jdkLogger.isLoggable(level)) {
      String[] source = findSourceInStack();
      jdkLogger.logp(level, source[0], source[1], SecretDetector.maskSecrets(msg), t);
    }
  }

  /**
   * Converts SLF4J style placeholders into java.util.logging ones, e.g. {@code "Error in {} on
   * {}"} becomes {@code "Error in {0} on {1}"}. Single quotes are doubled so that MessageFormat
   * keeps them.
   *
   * @param original original string
   * @return refactored string
   */
  static String refactorString(String original) {
    StringBuilder sb = new StringBuilder();
    int argCount = 0;
    for (int i = 0; i < original.length(); i++) {
      char c = original.charAt(i);
      if (c == '{' && i < original.length() - 1 && original.charAt(i + 1) == '}') {
        sb.append('{').append(argCount).append('}');
        argCount++;
        i++;
      } else if (c == '\'') {
        sb.append("''");
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  /**
   * Locates the caller as the first frame after the logging methods.
   *
   * @return an array of size two, first element is className and second is methodName
   */
  private String[] findSourceInStack() {
    StackTraceElement[] stackTraces = Thread.currentThread().getStackTrace();
    String[] results = new String[2];
    for (int i = 0; i < stackTraces.length; i++) {
      if (logMethods.contains(stackTraces[i].getMethodName())) {
        for (int j = i; j < stackTraces.length; j++) {
          if (!logMethods.contains(stackTraces[j].getMethodName())) {
            results[0] = stackTraces[j].getClassName();
            results[1] = stackTraces[j].getMethodName();
            return results;
          }
        }
      }
    }
    return results;
  }

  private static Object[] evaluateLambdaArgs(Object... args) {
    final Object[] result = new Object[args.length];

    for (int i = 0; i < args.length; i++) {
      Object arg = args[i] instanceof ArgSupplier ? ((ArgSupplier) args[i]).get() : args[i];
      // MessageFormat would otherwise apply locale specific number grouping
      result[i] = arg instanceof Number ? String.valueOf(arg) : arg;
    }

    return result;
  }
}
