package io.firebolt.client.core;

import io.firebolt.client.api.ErrorCode;
import io.firebolt.client.api.FireboltSQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a query template into statements and substitutes {@code ?} placeholders with formatted
 * parameter values.
 *
 * <p>Statement separators and placeholders are only recognized outside of string literals, quoted
 * identifiers and comments. {@code \?} stands for a literal question mark and never consumes a
 * parameter.
 */
public class StatementSplitter {
  private static final Pattern SET_PREFIX = Pattern.compile("(?is)^\\s*set(\\s.*|)$");

  private static final Pattern SET_STATEMENT =
      Pattern.compile("(?is)^\\s*set\\s+([a-z_][a-z0-9_.]*)\\s*=\\s*(.*?)\\s*$");

  private StatementSplitter() {}

  /**
   * Splits the template and formats it once per parameter set.
   *
   * @param template query text, possibly holding several statements separated by {@code ;}
   * @param parameterSets parameter sets; statements are produced set by set, in document order
   *     within each set. Null or empty means a single set without parameters.
   * @return statements ready to run
   * @throws FireboltSQLException on malformed SQL or a parameter count mismatch
   */
  public static List<Statement> splitFormatSql(
      String template, List<? extends List<?>> parameterSets) throws FireboltSQLException {
    List<ParsedStatement> parsed = parse(template);

    List<? extends List<?>> sets =
        parameterSets == null || parameterSets.isEmpty()
            ? Collections.singletonList(Collections.emptyList())
            : parameterSets;

    List<Statement> statements = new ArrayList<>(parsed.size() * sets.size());
    for (List<?> parameters : sets) {
      List<?> params = parameters == null ? Collections.emptyList() : parameters;
      int consumed = 0;
      for (ParsedStatement statement : parsed) {
        if (consumed + statement.placeholderCount() > params.size()) {
          throw new FireboltSQLException(
              ErrorCode.DATA_ERROR,
              "Invalid number of arguments: not enough parameters provided for query: "
                  + statement.joined());
        }
        String sql = statement.render(params, consumed);
        consumed += statement.placeholderCount();
        statements.add(toStatement(sql));
      }
      if (consumed < params.size()) {
        throw new FireboltSQLException(
            ErrorCode.DATA_ERROR,
            "Invalid number of arguments: too many parameters provided: expected "
                + consumed
                + ", got "
                + params.size());
      }
    }
    return statements;
  }

  /**
   * Recognizes {@code SET name = value}.
   *
   * @param sql a single statement
   * @return a set parameter directive, or a query
   * @throws FireboltSQLException if the statement starts with SET but is not of the expected form
   */
  static Statement toStatement(String sql) throws FireboltSQLException {
    String code = stripLeadingComments(sql);
    if (!SET_PREFIX.matcher(code).matches()) {
      return new Statement.Query(sql);
    }
    Matcher matcher = SET_STATEMENT.matcher(code);
    if (!matcher.matches()) {
      throw invalidSet(code);
    }
    String value = stripQuotes(matcher.group(2));
    if (value.isEmpty()) {
      throw invalidSet(code);
    }
    return new Statement.SetParameter(matcher.group(1), value);
  }

  private static String stripLeadingComments(String sql) {
    int i = 0;
    while (i < sql.length()) {
      if (Character.isWhitespace(sql.charAt(i))) {
        i++;
      } else if (sql.startsWith("--", i)) {
        int end = sql.indexOf('\n', i);
        i = end < 0 ? sql.length() : end + 1;
      } else if (sql.startsWith("/*", i)) {
        int end = sql.indexOf("*/", i + 2);
        i = end < 0 ? sql.length() : end + 2;
      } else {
        break;
      }
    }
    return sql.substring(i);
  }

  private static FireboltSQLException invalidSet(String sql) {
    return new FireboltSQLException(
        ErrorCode.INVALID_SQL,
        "Invalid set statement format: " + sql + ", expected SET <param> = <value>");
  }

  private static String stripQuotes(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && value.charAt(start) == '\'') {
      start++;
    }
    while (end > start && value.charAt(end - 1) == '\'') {
      end--;
    }
    return value.substring(start, end);
  }

  /**
   * Tokenizes the template into statements, each kept as the text fragments between its
   * placeholders. Whitespace or comment only statements are dropped.
   */
  static List<ParsedStatement> parse(String sql) throws FireboltSQLException {
    List<ParsedStatement> statements = new ArrayList<>();
    List<String> fragments = new ArrayList<>();
    StringBuilder fragment = new StringBuilder();
    boolean hasCode = false;

    int i = 0;
    int length = sql.length();
    while (i < length) {
      char c = sql.charAt(i);
      char next = i + 1 < length ? sql.charAt(i + 1) : 0;

      if (c == '-' && next == '-') {
        int end = sql.indexOf('\n', i);
        end = end < 0 ? length : end + 1;
        fragment.append(sql, i, end);
        i = end;
      } else if (c == '/' && next == '*') {
        int end = sql.indexOf("*/", i + 2);
        if (end < 0) {
          throw new FireboltSQLException(ErrorCode.INVALID_SQL, "unterminated comment in " + sql);
        }
        fragment.append(sql, i, end + 2);
        i = end + 2;
      } else if (c == '\'') {
        boolean escapeString = i > 0 && isEscapeStringPrefix(sql, i - 1);
        i = appendSingleQuoted(sql, i, escapeString, fragment);
        hasCode = true;
      } else if (c == '"') {
        i = appendDoubleQuoted(sql, i, fragment);
        hasCode = true;
      } else if (c == '\\' && next == '?') {
        fragment.append('?');
        hasCode = true;
        i += 2;
      } else if (c == '?') {
        fragments.add(fragment.toString());
        fragment.setLength(0);
        hasCode = true;
        i++;
      } else if (c == ';') {
        if (hasCode) {
          fragments.add(fragment.toString());
          statements.add(new ParsedStatement(fragments));
        }
        fragments = new ArrayList<>();
        fragment.setLength(0);
        hasCode = false;
        i++;
      } else {
        fragment.append(c);
        hasCode |= !Character.isWhitespace(c);
        i++;
      }
    }
    if (hasCode) {
      fragments.add(fragment.toString());
      statements.add(new ParsedStatement(fragments));
    }
    return statements;
  }

  // E'...' strings interpret backslash escapes
  private static boolean isEscapeStringPrefix(String sql, int index) {
    char prefix = sql.charAt(index);
    if (prefix != 'E' && prefix != 'e') {
      return false;
    }
    return index == 0 || !Character.isLetterOrDigit(sql.charAt(index - 1));
  }

  private static int appendSingleQuoted(
      String sql, int start, boolean escapeString, StringBuilder out) throws FireboltSQLException {
    out.append('\'');
    int i = start + 1;
    while (i < sql.length()) {
      char c = sql.charAt(i);
      char next = i + 1 < sql.length() ? sql.charAt(i + 1) : 0;
      if (c == '\\' && next == '?') {
        out.append('?');
        i += 2;
      } else if (escapeString && c == '\\' && i + 1 < sql.length()) {
        out.append(c).append(next);
        i += 2;
      } else if (c == '\'' && next == '\'') {
        out.append("''");
        i += 2;
      } else if (c == '\'') {
        out.append('\'');
        return i + 1;
      } else {
        out.append(c);
        i++;
      }
    }
    throw new FireboltSQLException(
        ErrorCode.INVALID_SQL, "unterminated string literal starting at position " + start);
  }

  private static int appendDoubleQuoted(String sql, int start, StringBuilder out)
      throws FireboltSQLException {
    out.append('"');
    int i = start + 1;
    while (i < sql.length()) {
      char c = sql.charAt(i);
      if (c == '"') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == '"') {
          out.append("\"\"");
          i += 2;
          continue;
        }
        out.append('"');
        return i + 1;
      }
      out.append(c);
      i++;
    }
    throw new FireboltSQLException(
        ErrorCode.INVALID_SQL, "unterminated quoted identifier starting at position " + start);
  }

  /** A statement kept as the text around its placeholders. */
  static final class ParsedStatement {
    private final List<String> fragments;

    ParsedStatement(List<String> fragments) {
      List<String> trimmed = new ArrayList<>(fragments);
      int last = trimmed.size() - 1;
      trimmed.set(0, stripLeading(trimmed.get(0)));
      trimmed.set(last, stripTrailing(trimmed.get(last)));
      this.fragments = Collections.unmodifiableList(trimmed);
    }

    int placeholderCount() {
      return fragments.size() - 1;
    }

    List<String> fragments() {
      return fragments;
    }

    String render(List<?> parameters, int offset) throws FireboltSQLException {
      StringBuilder sb = new StringBuilder(fragments.get(0));
      for (int p = 1; p < fragments.size(); p++) {
        sb.append(ParameterFormatter.format(parameters.get(offset + p - 1)));
        sb.append(fragments.get(p));
      }
      return sb.toString();
    }

    String joined() {
      return String.join("?", fragments);
    }

    private static String stripLeading(String s) {
      int i = 0;
      while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
        i++;
      }
      return s.substring(i);
    }

    private static String stripTrailing(String s) {
      int i = s.length();
      while (i > 0 && Character.isWhitespace(s.charAt(i - 1))) {
        i--;
      }
      return s.substring(0, i);
    }
  }
}
