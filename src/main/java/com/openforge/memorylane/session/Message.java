package com.openforge.memorylane.session;

import java.time.Instant;

/**
 * A single turn of a recorded assistant session.
 *
 * role variants:
 *   "user"      : human turn
 *   "assistant" : model reply
 *
 * @param timestamp may be null when the transcript line carried no time
 */
public record Message(
        String  role,
        String  content,
        Instant timestamp
) {

    public static final String USER      = "user";
    public static final String ASSISTANT = "assistant";

    public Message {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role cannot be null or blank");
        }
        if (content == null) {
            content = "";
        }
    }

    public static Message user(String content, Instant timestamp) {
        return new Message(USER, content, timestamp);
    }

    public static Message assistant(String content, Instant timestamp) {
        return new Message(ASSISTANT, content, timestamp);
    }

    public boolean isUser() {
        return USER.equals(role);
    }
}
