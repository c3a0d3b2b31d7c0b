package com.example.checkout.unit.domain;

import com.example.checkout.domain.model.OrderNumber;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Order Number Tests")
class OrderNumberTest {

    @Test
    @DisplayName("should_generate_prefixed_nine_digit_number - 產生 ORD- 加九位數字")
    void should_generate_prefixed_nine_digit_number() {
        // Given: epoch second 1714557600 ends in 557600
        Instant now = Instant.ofEpochSecond(1_714_557_600L);

        // When
        OrderNumber number = OrderNumber.generate(now, new Random(42));

        // Then
        assertThat(number.getValue()).matches("ORD-\\d{9}");
        assertThat(number.getValue()).startsWith("ORD-557600");
        assertThat(OrderNumber.of(number.getValue())).isEqualTo(number);
    }

    @Test
    @DisplayName("should_pad_small_timestamps - 時間戳不足六位時補零")
    void should_pad_small_timestamps() {
        OrderNumber number = OrderNumber.generate(Instant.ofEpochSecond(42), new Random(1));

        assertThat(number.getValue()).startsWith("ORD-000042");
        int suffix = Integer.parseInt(number.getValue().substring(10));
        assertThat(suffix).isBetween(100, 999);
    }

    @Test
    @DisplayName("should_not_repeat_across_ticking_clock - 時鐘前進時不重複")
    void should_not_repeat_across_ticking_clock() {
        // Given
        Random random = new Random();
        Instant start = Instant.parse("2024-05-01T00:00:00Z");
        Set<String> seen = new HashSet<>();

        // When
        for (int i = 0; i < 10_000; i++) {
            seen.add(OrderNumber.generate(start.plusSeconds(i), random).getValue());
        }

        // Then
        assertThat(seen).hasSize(10_000);
    }

    @Test
    @DisplayName("should_reject_malformed_numbers - 拒絕格式錯誤的訂單編號")
    void should_reject_malformed_numbers() {
        assertThatThrownBy(() -> OrderNumber.of("ORD-12345"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid order number format");
        assertThatThrownBy(() -> OrderNumber.of("INV-123456789"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
