package io.firebolt.client.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Search for credentials in sql and/or other text */
public class SecretDetector {
  // "\\s*" refers to >= 0 spaces, "[^']" refers to chars other than `'`
  private static final Pattern AWS_KEY_PATTERN =
      Pattern.compile(
          "(aws_key_id|aws_secret_key|aws_session_token|aws_role_arn|aws_role_external_id)"
              + "(\\s*=\\s*)'([^']+)'",
          Pattern.CASE_INSENSITIVE);

  // CREATE EXTERNAL TABLE ... CREDENTIALS = (...)
  private static final Pattern CREDENTIALS_PATTERN =
      Pattern.compile("aws_key_id|credentials", Pattern.CASE_INSENSITIVE);

  // Used for detecting OAuth tokens in serialized JSON
  private static final Pattern OAUTH_JSON_PATTERN =
      Pattern.compile(
          "(access_token|refresh_token|client_secret)\""
              + "\\s*:\\s*"
              + "\"([a-zA-Z0-9!#$%&'\\()*+,-./:;<=>?@\\[\\]^_`\\{|\\}~]{3,})\"",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern BEARER_PATTERN =
      Pattern.compile("(Bearer\\s+)([a-z0-9._\\-+/=]{8,})", Pattern.CASE_INSENSITIVE);

  // Search for password pattern
  private static final Pattern PASSWORD_PATTERN =
      Pattern.compile(
          "(password|passcode|pwd|client_secret)"
              + "([\'\"\\s:=]+)"
              + "([a-z0-9!\"#$%&\\()*+,-./:;<=>?@\\[\\]^_`\\{|\\}~]{6,})",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern SENSITIVE_PARAMETER_NAME =
      Pattern.compile(
          ".*?(password|pwd|token|secret|passcode|credential).*?", Pattern.CASE_INSENSITIVE);

  // only attempt to find secrets in its leading 100Kb
  private static final int MAX_LENGTH = 100 * 1000;

  /**
   * Whether a query carries cloud credentials and must not be logged verbatim, e.g. {@code CREATE
   * EXTERNAL TABLE ... CREDENTIALS = (AWS_KEY_ID = '...')}.
   *
   * @param sql query text
   * @return true if the text mentions credentials
   */
  public static boolean containsCredentials(String sql) {
    return sql != null && CREDENTIALS_PATTERN.matcher(head(sql)).find();
  }

  /**
   * Mask sensitive parameter values. Used for connection properties whose values are logged when
   * a connection is opened.
   *
   * @param key parameter key
   * @param value parameter value, which is sometimes masked
   * @return the original value if the key is not sensitive, otherwise a masked text
   */
  public static String maskParameterValue(String key, String value) {
    if (key != null && SENSITIVE_PARAMETER_NAME.matcher(key).matches()) {
      return "****";
    }
    return value;
  }

  /**
   * Masks any secrets present in the input string: AWS keys, bearer tokens, OAuth tokens in JSON
   * and password-like assignments.
   *
   * @param text Text which may contain secrets
   * @return Masked string
   */
  public static String maskSecrets(String text) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    String masked = replace(AWS_KEY_PATTERN, text, "$1$2'****'");
    masked = replace(OAUTH_JSON_PATTERN, masked, "$1\":\"****\"");
    masked = replace(BEARER_PATTERN, masked, "$1****");
    return replace(PASSWORD_PATTERN, masked, "$1$2****");
  }

  private static String replace(Pattern pattern, String text, String replacement) {
    if (text == null) {
      return null;
    }
    String head = head(text);
    Matcher matcher = pattern.matcher(head);
    if (matcher.find()) {
      return matcher.replaceAll(replacement) + text.substring(head.length());
    }
    return text;
  }

  private static String head(String text) {
    return text.length() <= MAX_LENGTH ? text : text.substring(0, MAX_LENGTH);
  }
}
