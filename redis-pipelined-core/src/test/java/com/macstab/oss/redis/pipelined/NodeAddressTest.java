/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Tests for {@link NodeAddress}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("NodeAddress")
class NodeAddressTest {

  @Test
  @DisplayName("Should parse host and port")
  void shouldParse() {
    assertThat(NodeAddress.parse("10.0.0.7:6380")).isEqualTo(new NodeAddress("10.0.0.7", 6380));
  }

  @Test
  @DisplayName("Should split IPv6 literals at the last colon")
  void shouldParseIpv6() {
    // Act
    final var address = NodeAddress.parse("::1:7000");

    // Assert
    assertThat(address.host()).isEqualTo("::1");
    assertThat(address.port()).isEqualTo(7000);
  }

  @Test
  @DisplayName("Should format as host:port")
  void shouldFormat() {
    assertThat(new NodeAddress("redis-1", 6379)).hasToString("redis-1:6379");
  }

  @ParameterizedTest
  @ValueSource(strings = {"localhost", ":6379", "localhost:", "localhost:abc", "localhost:0"})
  @DisplayName("Should reject malformed addresses")
  void shouldRejectMalformed(final String input) {
    assertThatIllegalArgumentException().isThrownBy(() -> NodeAddress.parse(input));
  }

  @Test
  @DisplayName("Should reject a blank host")
  void shouldRejectBlankHost() {
    assertThatIllegalArgumentException().isThrownBy(() -> new NodeAddress(" ", 6379));
  }
}
