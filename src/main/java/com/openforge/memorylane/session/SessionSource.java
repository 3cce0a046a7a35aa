package com.openforge.memorylane.session;

import java.util.List;

/**
 * Read-only access to recorded assistant sessions.
 */
public interface SessionSource {

    /**
     * @return the session's messages in transcript order
     * @throws SessionNotFoundException if no session with this id exists
     */
    List<Message> getMessages(String sessionId);

    class SessionNotFoundException extends RuntimeException {
        public SessionNotFoundException(String sessionId) {
            super("Session not found: " + sessionId);
        }
    }
}
