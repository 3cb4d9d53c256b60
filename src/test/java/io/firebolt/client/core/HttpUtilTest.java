package io.firebolt.client.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.Matchers.startsWith;

import org.apache.http.impl.client.CloseableHttpClient;
import org.junit.jupiter.api.Test;

public class HttpUtilTest {

  @Test
  public void testUserAgent() {
    String userAgent = HttpUtil.buildUserAgent("MyApp/1.0");
    assertThat(userAgent, startsWith(HttpUtil.CLIENT_NAME + "/"));
    assertThat(userAgent, endsWith(" MyApp/1.0"));
    assertThat(HttpUtil.buildUserAgent(""), endsWith("JAVA/" + System.getProperty("java.version")));
  }

  @Test
  public void testTimeoutConversionSaturates() {
    assertThat(HttpUtil.toMillis(0), equalTo(0));
    assertThat(HttpUtil.toMillis(60), equalTo(60_000));
    assertThat(HttpUtil.toMillis(2_147_483), equalTo(2_147_483_000));
    assertThat(HttpUtil.toMillis(2_147_484), equalTo(Integer.MAX_VALUE));
    assertThat(HttpUtil.toMillis(Integer.MAX_VALUE), equalTo(Integer.MAX_VALUE));
  }

  @Test
  public void testImplementationVersionFallback() {
    // classes loaded from target/classes carry no manifest
    assertThat(HttpUtil.getImplementationVersion(), equalTo("dev"));
  }

  @Test
  public void testClientsAreSharedPerSettings() {
    HttpClientSettingsKey key = new HttpClientSettingsKey(60, 0, " suffix ");
    CloseableHttpClient client = HttpUtil.getHttpClient(key);
    assertThat(
        HttpUtil.getHttpClient(new HttpClientSettingsKey(60, 0, "suffix")), sameInstance(client));
    assertThat(
        HttpUtil.getHttpClient(new HttpClientSettingsKey(10, 0, "suffix")),
        not(sameInstance(client)));
  }

  @Test
  public void testSettingsKeyEquality() {
    assertThat(
        new HttpClientSettingsKey(1, 2, null), equalTo(new HttpClientSettingsKey(1, 2, "")));
    assertThat(
        new HttpClientSettingsKey(1, 2, "a").hashCode(),
        equalTo(new HttpClientSettingsKey(1, 2, "a").hashCode()));
  }
}
