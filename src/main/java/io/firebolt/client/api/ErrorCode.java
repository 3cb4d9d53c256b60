package io.firebolt.client.api;

/**
 * Driver error codes.
 *
 * <p>Each code maps to a message template in {@value #errorMessageResource} and a SQLSTATE.
 */
public enum ErrorCode {
  INTERNAL_ERROR(300001, SqlState.INTERNAL_ERROR),
  INTERFACE_ERROR(300002, SqlState.SQLCLIENT_UNABLE_TO_ESTABLISH_SQLCONNECTION),
  CONFIGURATION_ERROR(300003, SqlState.INVALID_PARAMETER_VALUE),
  NETWORK_ERROR(300004, SqlState.IO_ERROR),
  HTTP_ERROR(300005, SqlState.CONNECTION_EXCEPTION),
  ACCOUNT_NOT_FOUND(300006, SqlState.INVALID_AUTHORIZATION_SPECIFICATION),
  ENGINE_NOT_FOUND(300007, SqlState.UNDEFINED_OBJECT),
  ENGINE_NOT_RUNNING(300008, SqlState.OBJECT_NOT_IN_PREREQUISITE_STATE),
  DATABASE_NOT_FOUND(300009, SqlState.INVALID_CATALOG_NAME),
  OPERATIONAL_ERROR(300010, SqlState.SYSTEM_ERROR),
  PROGRAMMING_ERROR(300011, SqlState.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION),
  INVALID_PARAMETER(300012, SqlState.INVALID_PARAMETER_VALUE),
  NO_DATA(300013, SqlState.NO_DATA),
  CONNECTION_CLOSED(300014, SqlState.CONNECTION_DOES_NOT_EXIST),
  CURSOR_CLOSED(300015, SqlState.INVALID_CURSOR_STATE),
  DECODE_ERROR(300016, SqlState.DATA_EXCEPTION),
  DATA_ERROR(300017, SqlState.DATA_EXCEPTION),
  INVALID_SQL(300018, SqlState.SYNTAX_ERROR),
  ASYNC_EXECUTION_UNAVAILABLE(300019, SqlState.FEATURE_NOT_SUPPORTED),
  BAD_RESPONSE(300020, SqlState.INTERNAL_ERROR);

  public static final String errorMessageResource = "io.firebolt.client.api.error_messages";

  /** Driver message code associated to the error. */
  private final int messageCode;

  private final String sqlState;

  ErrorCode(int messageCode, String sqlState) {
    this.messageCode = messageCode;
    this.sqlState = sqlState;
  }

  public int getMessageCode() {
    return messageCode;
  }

  public String getSqlState() {
    return sqlState;
  }

  @Override
  public String toString() {
    return "ErrorCode{" + "messageCode=" + messageCode + ", sqlState=" + sqlState + '}';
  }
}
