package com.openforge.memorylane.extraction;

/**
 * The local assistant CLI. Its usability depends on installation and an OAuth
 * session that can expire at any time, so callers re-check it per request.
 */
public interface LocalAgentProvider extends ExtractionProvider {

    Status checkStatus();

    /**
     * @param installed     the CLI binary answered a version probe
     * @param authenticated the CLI reported an active login
     * @param detail        version string, account or failure reason (for logs)
     */
    record Status(boolean installed, boolean authenticated, String detail) {

        public static Status unavailable(String reason) {
            return new Status(false, false, reason);
        }

        public boolean usable() {
            return installed && authenticated;
        }
    }
}
