package com.druidio.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DruidClientException Tests")
class DruidClientExceptionTest {

    @Test
    @DisplayName("should append the error kind to the message")
    void shouldAppendKind() {
        // When
        DruidClientException e = new DruidClientException(ErrorKind.SERVER, "Broker reported an error: boom");

        // Then
        assertThat(e.getMessage()).isEqualTo("Broker reported an error: boom [Kind: SERVER]");
        assertThat(e.getResponseBody()).isNull();
    }

    @Test
    @DisplayName("should keep cause and short body as is")
    void shouldKeepCauseAndBody() {
        // Given
        IOException cause = new IOException("reset");

        // When
        DruidClientException e = new DruidClientException(ErrorKind.RESPONSE_PARSING, "bad", "{\"x\":1}", cause);

        // Then
        assertThat(e).hasCause(cause);
        assertThat(e.getResponseBody()).isEqualTo("{\"x\":1}");
    }

    @Test
    @DisplayName("should truncate oversized response bodies")
    void shouldTruncateBody() {
        // Given
        String body = "x".repeat(DruidClientException.MAX_BODY_LENGTH + 10);

        // When
        DruidClientException e = new DruidClientException(ErrorKind.SERVER, "bad", body, null);

        // Then
        assertThat(e.getResponseBody())
            .startsWith("x".repeat(DruidClientException.MAX_BODY_LENGTH))
            .endsWith("... [truncated 10 chars]");
        assertThat(DruidClientException.excerpt("x".repeat(DruidClientException.MAX_BODY_LENGTH)))
            .hasSize(DruidClientException.MAX_BODY_LENGTH);
    }

    @Test
    @DisplayName("should treat missing kind as unknown")
    void shouldDefaultKindToUnknown() {
        // When
        DruidClientException e = new DruidClientException(null, "lost");

        // Then
        assertThat(e.getKind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(e.getMessage()).endsWith("[Kind: UNKNOWN]");
    }
}
