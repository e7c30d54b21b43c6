package io.github.panghy.valkeyvector.connection;

import io.github.panghy.valkeyvector.config.ConnectionUrl;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.UnifiedJedis;

/**
 * Creates client handles for a {@link ConnectionManager}. Replaceable so that tests and embedders
 * can supply their own handles.
 */
@FunctionalInterface
public interface ValkeyClientFactory {

  UnifiedJedis create(ConnectionUrl url, JedisClientConfig clientConfig);

  /** Default factory: a pooled handle to a single standalone server. */
  static ValkeyClientFactory pooled() {
    return (url, clientConfig) -> new JedisPooled(new HostAndPort(url.host(), url.port()), clientConfig);
  }
}
