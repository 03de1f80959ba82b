package com.druidio.connection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("StaticPool Tests")
class StaticPoolTest {

    @Test
    @DisplayName("should rotate over brokers by default")
    void shouldRotateByDefault() {
        // Given
        StaticPool pool = new StaticPool(List.of("b1:8082", "b2:8082", "b3:8082"));

        // When
        List<String> picked = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            picked.add(pool.broker());
        }

        // Then
        assertThat(picked).containsExactly("b1:8082", "b2:8082", "b3:8082", "b1:8082", "b2:8082", "b3:8082");
        assertThat(pool.getStrategy()).hasToString("round-robin");
    }

    @Test
    @DisplayName("should always return the only broker")
    void shouldReturnSingleBroker() {
        // Given
        StaticPool pool = new StaticPool(List.of("only:8082"));

        // When / Then
        assertThat(pool.broker()).isEqualTo("only:8082");
        assertThat(pool.broker()).isEqualTo("only:8082");
        assertThat(pool.getStrategy()).hasToString("constant");
    }

    @Test
    @DisplayName("should honour an explicit strategy")
    void shouldHonourExplicitStrategy() {
        // Given
        StaticPool pool = new StaticPool(List.of("b1:8082", "b2:8082"), SelectionStrategy.constant());

        // When / Then
        assertThat(pool.broker()).isEqualTo("b1:8082");
        assertThat(pool.broker()).isEqualTo("b1:8082");
    }

    @Test
    @DisplayName("should reject empty or missing broker list")
    void shouldRejectEmptyList() {
        assertThatThrownBy(() -> new StaticPool(List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("At least one broker");
        assertThatThrownBy(() -> new StaticPool(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should not be affected by later changes to the given list")
    void shouldCopyBrokerList() {
        // Given
        List<String> brokers = new ArrayList<>(List.of("b1:8082"));
        StaticPool pool = new StaticPool(brokers);

        // When
        brokers.add("b2:8082");

        // Then
        assertThat(pool.getBrokers()).containsExactly("b1:8082");
        assertThatThrownBy(() -> pool.getBrokers().add("b3:8082"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
