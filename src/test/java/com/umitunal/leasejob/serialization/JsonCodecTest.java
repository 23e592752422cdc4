package com.umitunal.leasejob.serialization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class JsonCodecTest {

    public static class Greeting {
        public String message;
        public int count;
    }

    @Test
    @DisplayName("Should store payloads as readable JSON")
    void testReadableJson() {
        // Given
        JsonCodec<Greeting> codec = new JsonCodec<>(Greeting.class);
        Greeting greeting = new Greeting();
        greeting.message = "hello";
        greeting.count = 2;

        // When
        String stored = new String(codec.encode(greeting), StandardCharsets.UTF_8);

        // Then
        assertThat(stored).contains("\"message\":\"hello\"").contains("\"count\":2");
    }

    @Test
    @DisplayName("Should ignore fields it does not know")
    void testUnknownFields() {
        // Given
        JsonCodec<Greeting> codec = new JsonCodec<>(Greeting.class);
        byte[] stored = "{\"message\":\"hi\",\"addedLater\":true}".getBytes(StandardCharsets.UTF_8);

        // When
        Greeting decoded = codec.decode(stored);

        // Then
        assertThat(decoded.message).isEqualTo("hi");
    }

    @Test
    @DisplayName("Should wrap malformed JSON in a codec exception")
    void testMalformedJson() {
        // Given
        JsonCodec<Greeting> codec = new JsonCodec<>(Greeting.class);

        // When/Then
        assertThatThrownBy(() -> codec.decode("{not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(PayloadCodecException.class)
                .hasMessageContaining("Greeting");
    }
}
