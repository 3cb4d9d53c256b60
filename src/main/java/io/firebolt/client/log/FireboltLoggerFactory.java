package io.firebolt.client.log;

/** Used to create FireboltLogger instance */
public class FireboltLoggerFactory {
  public static final String LOGGER_IMPL_PROPERTY = "io.firebolt.client.loggerImpl";

  private static LoggerImpl loggerImplementation;

  enum LoggerImpl {
    SLF4JLOGGER("io.firebolt.client.log.SLF4JLogger"),
    JDK14LOGGER("io.firebolt.client.log.JDK14Logger");

    private final String loggerImplClassName;

    LoggerImpl(String loggerClass) {
      this.loggerImplClassName = loggerClass;
    }

    public String getLoggerImplClassName() {
      return this.loggerImplClassName;
    }

    public static LoggerImpl fromString(String loggerImplClassName) {
      if (loggerImplClassName != null) {
        for (LoggerImpl imp : LoggerImpl.values()) {
          if (loggerImplClassName.equalsIgnoreCase(imp.getLoggerImplClassName())) {
            return imp;
          }
        }
      }
      return null;
    }
  }

  /**
   * @param clazz Class type that the logger is instantiated
   * @return A FireboltLogger instance given the name of the class
   */
  public static FireboltLogger getLogger(Class<?> clazz) {
    return getLogger(clazz.getName());
  }

  /**
   * @param name name to indicate the class (might be different with the class name) that the logger
   *     is instantiated
   * @return A FireboltLogger instance given the name
   */
  public static synchronized FireboltLogger getLogger(String name) {
    if (loggerImplementation == null) {
      String logger = System.getProperty(LOGGER_IMPL_PROPERTY);

      loggerImplementation = LoggerImpl.fromString(logger);

      if (loggerImplementation == null) {
        // default to use java util logging
        loggerImplementation = LoggerImpl.JDK14LOGGER;
      }
    }

    switch (loggerImplementation) {
      case SLF4JLOGGER:
        return new SLF4JLogger(name);
      case JDK14LOGGER:
      default:
        return new JDK14Logger(name);
    }
  }

  // visible for tests
  static synchronized void reset() {
    loggerImplementation = null;
  }
}
