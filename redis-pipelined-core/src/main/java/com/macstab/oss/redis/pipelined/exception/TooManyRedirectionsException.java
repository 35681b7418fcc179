/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.exception;

/** MOVED/ASK redirections exceeded {@code ClusterConfig.maxRedirections}. */
public class TooManyRedirectionsException extends RedisException {

  private static final long serialVersionUID = 1L;

  public TooManyRedirectionsException(final int redirections, final String lastError) {
    super("Gave up after " + redirections + " redirections, last: " + lastError);
  }
}
