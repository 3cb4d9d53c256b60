package io.firebolt.client.core.auth;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.firebolt.client.api.ErrorCode;
import io.firebolt.client.api.FireboltSQLException;
import org.junit.jupiter.api.Test;

public class TokenAuthTest {

  @Test
  public void testTokenIsTrimmed() throws Exception {
    TokenAuth auth = new TokenAuth("  abc  ");
    assertThat(auth.getToken(), equalTo("abc"));
    auth.invalidate();
    assertThat(auth.getToken(), equalTo("abc"));
    assertThat(auth.toString(), not(containsString("abc")));
  }

  @Test
  public void testBlankToken() {
    for (String token : new String[] {null, "", "   "}) {
      FireboltSQLException ex =
          assertThrows(FireboltSQLException.class, () -> new TokenAuth(token));
      assertThat(ex.getDriverErrorCode(), equalTo(ErrorCode.CONFIGURATION_ERROR));
    }
  }
}
