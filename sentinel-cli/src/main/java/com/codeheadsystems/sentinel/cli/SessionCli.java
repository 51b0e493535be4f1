package com.codeheadsystems.sentinel.cli;

import com.codeheadsystems.sentinel.client.SessionClient;
import com.codeheadsystems.sentinel.client.accessor.HttpAuthGateway;
import com.codeheadsystems.sentinel.client.clock.ExecutorSessionClock;
import com.codeheadsystems.sentinel.client.clock.SessionClock;
import com.codeheadsystems.sentinel.client.config.GatewayConfig;
import com.codeheadsystems.sentinel.client.config.SessionClientConfig;
import com.codeheadsystems.sentinel.client.exceptions.AuthenticationException;
import com.codeheadsystems.sentinel.client.exceptions.StaleAuthenticationException;
import com.codeheadsystems.sentinel.client.model.AccessDecision;
import com.codeheadsystems.sentinel.client.session.Credential;
import com.codeheadsystems.sentinel.client.session.Session;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Command-line session client against an identity-toolkit provider.
 *
 * <pre>
 * Usage:
 *   java -jar sentinel-cli.jar &lt;command&gt; [arguments] [options]
 *
 * Commands:
 *   signup &lt;email&gt; &lt;password&gt;   Register and start a session.
 *   login  &lt;email&gt; &lt;password&gt;   Sign in and start a session.
 *   status                       Show the session and the guard's decision for /recipes.
 *   logout                       End the session and erase the stored credential.
 *   get &lt;url&gt;                    GET the url with the session token attached.
 *
 * Options:
 *   --api-key &lt;key&gt;      Provider API key            (or SENTINEL_API_KEY)
 *   --base-url &lt;url&gt;     Provider base URL           (default: identity toolkit v1)
 *   --store &lt;path&gt;       Stored credential location  (default: ~/.sentinel/credential.json)
 * </pre>
 *
 * <p>Every run first restores the stored credential, so a login lasts across runs until the
 * provider's token expires.
 */
public class SessionCli {

  private static final String PROTECTED_ROUTE = "/recipes";
  private static final Path DEFAULT_STORE =
      Path.of(System.getProperty("user.home"), ".sentinel", "credential.json");

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    Options options;
    try {
      options = Options.parse(args, System.getenv("SENTINEL_API_KEY"));
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      printUsage();
      System.exit(1);
      return;
    }

    HttpClient httpClient = HttpClient.newHttpClient();
    ObjectMapper objectMapper = new ObjectMapper();
    HttpAuthGateway gateway = new HttpAuthGateway(httpClient, objectMapper,
        GatewayConfig.of(options.baseUrl(), options.apiKey()));

    int exitCode;
    try (ExecutorSessionClock clock = new ExecutorSessionClock();
         SessionClient client = new SessionClient(
             SessionClientConfig.of(options.store()), gateway, clock, objectMapper)) {
      client.start().join();
      exitCode = run(options, client, clock, httpClient);
    }
    System.exit(exitCode);
  }

  static int run(Options options, SessionClient client, SessionClock clock, HttpClient httpClient) {
    try {
      switch (options.command()) {
        case "signup" -> runAuthenticate(client, options, true);
        case "login" -> runAuthenticate(client, options, false);
        case "status" -> runStatus(client, clock.now());
        case "logout" -> {
          client.logout().join();
          System.out.println("Logged out.");
        }
        case "get" -> {
          return runGet(client, httpClient, URI.create(options.arguments().get(0)));
        }
        default -> throw new IllegalStateException("Unhandled command: " + options.command());
      }
      return 0;
    } catch (CompletionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      if (cause instanceof AuthenticationException authenticationException) {
        System.err.println("Authentication failed: " + authenticationException.getMessage()
            + " (" + authenticationException.kind() + ")");
        return 2;
      }
      if (cause instanceof StaleAuthenticationException) {
        System.err.println("Authentication superseded: " + cause.getMessage());
        return 2;
      }
      System.err.println("Error: " + cause.getMessage());
      return 1;
    } catch (IOException | IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      System.err.println("Interrupted");
      return 1;
    }
  }

  private static void runAuthenticate(SessionClient client, Options options, boolean signup) {
    String email = options.arguments().get(0);
    String password = options.arguments().get(1);
    System.out.println((signup ? "Signing up " : "Logging in ") + email + "...");
    Credential credential = signup
        ? client.controller().signup(email, password).join()
        : client.controller().login(email, password).join();
    System.out.println("Authenticated.");
    System.out.println("  subject : " + credential.subjectId());
    System.out.println("  expires : " + credential.expiresAt());
  }

  private static void runStatus(SessionClient client, Instant now) {
    Session session = client.sessionState().current();
    AccessDecision decision = client.accessGuard().authorize(PROTECTED_ROUTE);
    if (session.isValid(now)) {
      Credential credential = session.credential().orElseThrow();
      System.out.println("Logged in as " + credential.email());
      System.out.println("  remaining : " + Duration.between(now, credential.expiresAt()).withNanos(0));
    } else {
      System.out.println("Not logged in.");
    }
    if (decision instanceof AccessDecision.Redirect redirect) {
      System.out.println("  " + PROTECTED_ROUTE + " : redirect to " + redirect.target());
    } else {
      System.out.println("  " + PROTECTED_ROUTE + " : allowed");
    }
  }

  private static int runGet(SessionClient client, HttpClient httpClient, URI uri)
      throws IOException, InterruptedException {
    HttpRequest request = client.requestAugmenter().apply(HttpRequest.newBuilder(uri).GET().build());
    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    System.out.println("  HTTP status : " + response.statusCode());
    System.out.println("  Body        : " + response.body());
    return response.statusCode() < 400 ? 0 : 1;
  }

  private static void printUsage() {
    System.err.println("Usage: SessionCli <command> [arguments] [options]");
    System.err.println();
    System.err.println("Commands:");
    System.err.println("  signup <email> <password>   Register and start a session");
    System.err.println("  login  <email> <password>   Sign in and start a session");
    System.err.println("  status                      Show the session and the /recipes decision");
    System.err.println("  logout                      End the session");
    System.err.println("  get <url>                   GET the url with the token attached");
    System.err.println();
    System.err.println("Options:");
    System.err.println("  --api-key <key>     Provider API key (or SENTINEL_API_KEY)");
    System.err.println("  --base-url <url>    Provider base URL (default: " + GatewayConfig.IDENTITY_TOOLKIT + ")");
    System.err.println("  --store <path>      Stored credential (default: " + DEFAULT_STORE + ")");
  }

  /**
   * Parsed command line.
   *
   * @param command   the command
   * @param arguments the command's positional arguments
   * @param apiKey    the provider API key
   * @param baseUrl   the provider base URL
   * @param store     the credential file
   */
  record Options(String command, List<String> arguments, String apiKey, URI baseUrl, Path store) {

    static Options parse(String[] args, String apiKeyFromEnvironment) {
      String apiKey = apiKeyFromEnvironment;
      URI baseUrl = GatewayConfig.IDENTITY_TOOLKIT;
      Path store = DEFAULT_STORE;
      List<String> positional = new ArrayList<>();

      for (int i = 0; i < args.length; i++) {
        switch (args[i]) {
          case "--api-key"  -> apiKey  = value(args, ++i);
          case "--base-url" -> baseUrl = URI.create(value(args, ++i));
          case "--store"    -> store   = Path.of(value(args, ++i));
          default           -> positional.add(args[i]);
        }
      }

      if (positional.isEmpty()) {
        throw new IllegalArgumentException("Missing command");
      }
      String command = positional.get(0);
      List<String> arguments = List.copyOf(positional.subList(1, positional.size()));
      int expected = switch (command) {
        case "signup", "login" -> 2;
        case "get" -> 1;
        case "status", "logout" -> 0;
        default -> throw new IllegalArgumentException("Unknown command: " + command);
      };
      if (arguments.size() != expected) {
        throw new IllegalArgumentException(command + " takes " + expected + " argument(s)");
      }
      if (command.equals("get")) {
        requireHttpUrl(arguments.get(0));
      }
      if (apiKey == null || apiKey.isBlank()) {
        throw new IllegalArgumentException("No API key: pass --api-key or set SENTINEL_API_KEY");
      }
      return new Options(command, arguments, apiKey, baseUrl, store);
    }

    private static void requireHttpUrl(String url) {
      URI uri;
      try {
        uri = new URI(url);
      } catch (URISyntaxException e) {
        throw new IllegalArgumentException("Invalid URL: " + url, e);
      }
      String scheme = uri.getScheme();
      if ((!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) || uri.getHost() == null) {
        throw new IllegalArgumentException("Not an http(s) URL: " + url);
      }
    }

    private static String value(String[] args, int index) {
      if (index >= args.length) {
        throw new IllegalArgumentException("Missing value for " + args[index - 1]);
      }
      return args[index];
    }
  }
}
