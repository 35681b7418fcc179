/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.exception;

import com.macstab.oss.redis.pipelined.protocol.Level;

/**
 * A batch contains a command the executing client surface is not allowed to run.
 *
 * <p>Example: {@code WATCH} (connection state) submitted as a plain batch to a pooled node client,
 * where the next batch may land on a different connection.
 */
public class RequiredLevelViolationException extends RedisException {

  private static final long serialVersionUID = 1L;

  public RequiredLevelViolationException(
      final String commandName, final Level commandLevel, final String clientType) {
    super(
        "Command "
            + commandName
            + " (level "
            + commandLevel
            + ") cannot be executed by "
            + clientType);
  }
}
