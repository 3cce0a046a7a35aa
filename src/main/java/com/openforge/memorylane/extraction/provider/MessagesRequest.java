package com.openforge.memorylane.extraction.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Request body for POST /v1/messages. Field names are serialised in snake_case
 * by the shared ObjectMapper ({@code maxTokens} → {@code max_tokens}).
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessagesRequest(
        String        model,
        Integer       maxTokens,
        String        system,
        List<Turn>    messages
) {

    public record Turn(String role, String content) {

        public static Turn user(String content) {
            return new Turn("user", content);
        }
    }
}
