package com.openforge.memorylane.extraction;

/**
 * Failure taxonomy of the extraction path.
 *
 * None of these escape {@link MemoryExtractionClient#extract}; they drive the
 * CLI → API fallback and end up in the structured extraction log instead.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) { super(message); }
    public ExtractionException(String message, Throwable cause) { super(message, cause); }

    /** The requested transport is not configured for this call (CLI disabled, no API key). */
    public static class ProviderUnavailableException extends ExtractionException {
        public ProviderUnavailableException(String message) { super(message); }
    }

    /** A single provider failed (timeout, non-zero exit, HTTP error, open circuit). */
    public static class ProviderFailureException extends ExtractionException {
        public ProviderFailureException(String message) { super(message); }
        public ProviderFailureException(String message, Throwable cause) { super(message, cause); }
    }

    /** The provider reply could not be read as a JSON array. Counts as a provider failure. */
    public static class MalformedResponseException extends ProviderFailureException {
        public MalformedResponseException(String message) { super(message); }
        public MalformedResponseException(String message, Throwable cause) { super(message, cause); }
    }

    /** One array item is missing a required field; only that item is dropped. */
    public static class InvalidCandidateException extends ExtractionException {
        public InvalidCandidateException(String message) { super(message); }
        public InvalidCandidateException(String message, Throwable cause) { super(message, cause); }
    }
}
