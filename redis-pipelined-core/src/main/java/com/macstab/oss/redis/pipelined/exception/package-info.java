/* (C)2026 Christian Schnapka / Macstab GmbH */

/** Unchecked exceptions completing client futures; all extend {@code RedisException}. */
package com.macstab.oss.redis.pipelined.exception;
