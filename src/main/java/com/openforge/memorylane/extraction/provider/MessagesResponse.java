package com.openforge.memorylane.extraction.provider;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Response envelope from /v1/messages. Only text blocks carry the reply.
 */
public record MessagesResponse(
        String             id,
        String             model,
        List<ContentBlock> content,
        String             stopReason
) {

    /** Concatenation of every text block, in order. */
    public String text() {
        if (content == null) return "";
        return content.stream()
                .filter(b -> "text".equals(b.type()))
                .map(ContentBlock::text)
                .filter(Objects::nonNull)
                .collect(Collectors.joining());
    }

    public record ContentBlock(String type, String text) {}
}
