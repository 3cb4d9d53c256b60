package io.firebolt.client.api;

import io.firebolt.client.log.FireboltLogger;
import io.firebolt.client.log.FireboltLoggerFactory;
import java.sql.SQLException;
import java.text.MessageFormat;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Every failure surfaced by the driver. The {@link ErrorCode} tells the kind of failure apart:
 * resolution diagnostics (account, engine, database), server side execution errors, client misuse
 * and local decoding problems.
 */
public class FireboltSQLException extends SQLException {
  private static final FireboltLogger logger =
      FireboltLoggerFactory.getLogger(FireboltSQLException.class);

  private static final long serialVersionUID = 1L;

  private static final ResourceBundle errorMessages =
      ResourceBundle.getBundle(ErrorCode.errorMessageResource);

  private final ErrorCode errorCode;

  private String queryId;

  /**
   * @param errorCode the error code
   * @param params additional parameters
   */
  public FireboltSQLException(ErrorCode errorCode, Object... params) {
    this(null, errorCode, params);
  }

  /**
   * @param ex Throwable exception
   * @param errorCode the error code
   * @param params additional parameters
   */
  public FireboltSQLException(Throwable ex, ErrorCode errorCode, Object... params) {
    super(
        getLocalizedMessage(errorCode, params),
        errorCode.getSqlState(),
        errorCode.getMessageCode(),
        ex);
    this.errorCode = errorCode;

    if (ex == null) {
      logger.debug(
          "Firebolt exception: {}, sqlState: {}, vendorCode: {}",
          getMessage(),
          getSQLState(),
          getErrorCode());
    } else {
      logger.debug("Firebolt exception: " + getMessage(), ex);
    }
  }

  public ErrorCode getDriverErrorCode() {
    return errorCode;
  }

  public String getQueryId() {
    return queryId;
  }

  public FireboltSQLException withQueryId(String queryId) {
    this.queryId = queryId;
    return this;
  }

  static String getLocalizedMessage(ErrorCode errorCode, Object... params) {
    String key = String.valueOf(errorCode.getMessageCode());
    try {
      String pattern = errorMessages.getString(key);
      return MessageFormat.format(pattern, params == null ? new Object[0] : params);
    } catch (MissingResourceException e) {
      return "!!" + key + "!!";
    }
  }
}
