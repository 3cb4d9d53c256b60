package io.firebolt.client.api;

/** SQLSTATE class/subclass values used by the driver. */
public final class SqlState {
  public static final String CONNECTION_EXCEPTION = "08000";
  public static final String SQLCLIENT_UNABLE_TO_ESTABLISH_SQLCONNECTION = "08001";
  public static final String CONNECTION_DOES_NOT_EXIST = "08003";
  public static final String FEATURE_NOT_SUPPORTED = "0A000";
  public static final String NO_DATA = "02000";
  public static final String DATA_EXCEPTION = "22000";
  public static final String INVALID_PARAMETER_VALUE = "22023";
  public static final String INVALID_CURSOR_STATE = "24000";
  public static final String INVALID_AUTHORIZATION_SPECIFICATION = "28000";
  public static final String INVALID_CATALOG_NAME = "3D000";
  public static final String SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION = "42000";
  public static final String SYNTAX_ERROR = "42601";
  public static final String UNDEFINED_OBJECT = "42704";
  public static final String SYSTEM_ERROR = "58000";
  public static final String IO_ERROR = "58030";
  public static final String OBJECT_NOT_IN_PREREQUISITE_STATE = "55000";
  public static final String INTERNAL_ERROR = "XX000";

  private SqlState() {}
}
