package io.github.panghy.valkeyvector.config;

import java.net.URI;

/**
 * Host and port extracted from a {@code scheme://host:port} connection string.
 *
 * @param host server host, {@code localhost} when the URL has none
 * @param port server port, {@code 6379} when the URL has none
 */
public record ConnectionUrl(String host, int port) {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 6379;

  public ConnectionUrl {
    if (host == null || host.isBlank()) throw new IllegalArgumentException("host must not be blank");
    if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
  }

  /**
   * Parses a connection URL such as {@code valkey://cache.internal:6380}. A {@code null} or blank
   * URL yields {@code localhost:6379}.
   *
   * @throws IllegalArgumentException if the URL is not a valid URI
   */
  public static ConnectionUrl parse(String url) {
    if (url == null || url.isBlank()) return new ConnectionUrl(DEFAULT_HOST, DEFAULT_PORT);
    URI uri = URI.create(url.trim());
    String host = uri.getHost() == null ? DEFAULT_HOST : uri.getHost();
    int port = uri.getPort() < 0 ? DEFAULT_PORT : uri.getPort();
    return new ConnectionUrl(host, port);
  }

  @Override
  public String toString() {
    return host + ":" + port;
  }
}
