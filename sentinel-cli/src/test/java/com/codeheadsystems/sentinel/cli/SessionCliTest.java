package com.codeheadsystems.sentinel.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class SessionCliTest {

  @Test
  void parse_loginWithOptions() {
    SessionCli.Options options = SessionCli.Options.parse(new String[]{
        "login", "alice@example.com", "hunter2",
        "--api-key", "abc", "--base-url", "http://localhost:9099/v1", "--store", "/tmp/cred.json"}, null);

    assertThat(options.command()).isEqualTo("login");
    assertThat(options.arguments()).containsExactly("alice@example.com", "hunter2");
    assertThat(options.apiKey()).isEqualTo("abc");
    assertThat(options.baseUrl()).isEqualTo(URI.create("http://localhost:9099/v1"));
    assertThat(options.store()).isEqualTo(Path.of("/tmp/cred.json"));
  }

  @Test
  void parse_apiKeyFromEnvironment() {
    SessionCli.Options options = SessionCli.Options.parse(new String[]{"status"}, "from-env");

    assertThat(options.apiKey()).isEqualTo("from-env");
    assertThat(options.arguments()).isEmpty();
  }

  @Test
  void parse_optionOverridesEnvironment() {
    SessionCli.Options options = SessionCli.Options.parse(new String[]{"logout", "--api-key", "flag"}, "env");

    assertThat(options.apiKey()).isEqualTo("flag");
  }

  @Test
  void parse_wrongArity_isRejected() {
    assertThatThrownBy(() -> SessionCli.Options.parse(new String[]{"login", "alice@example.com"}, "k"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("takes 2");
  }

  @Test
  void parse_unknownCommand_isRejected() {
    assertThatThrownBy(() -> SessionCli.Options.parse(new String[]{"whoami"}, "k"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unknown command");
  }

  @Test
  void parse_missingApiKey_isRejected() {
    assertThatThrownBy(() -> SessionCli.Options.parse(new String[]{"status"}, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("API key");
  }

  @Test
  void parse_optionWithoutValue_isRejected() {
    assertThatThrownBy(() -> SessionCli.Options.parse(new String[]{"status", "--store"}, "k"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("--store");
  }

  @Test
  void parse_getWithValidUrl() {
    SessionCli.Options options = SessionCli.Options.parse(new String[]{"get", "https://example.com/recipes.json"}, "k");

    assertThat(options.arguments()).containsExactly("https://example.com/recipes.json");
  }

  @Test
  void parse_getWithMalformedUrl_isRejected() {
    assertThatThrownBy(() -> SessionCli.Options.parse(new String[]{"get", "http://bad host/"}, "k"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Invalid URL");
  }

  @Test
  void parse_getWithoutHttpScheme_isRejected() {
    assertThatThrownBy(() -> SessionCli.Options.parse(new String[]{"get", "example.com/recipes"}, "k"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Not an http(s) URL");
  }
}
