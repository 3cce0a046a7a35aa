package com.openforge.memorylane.api;

/**
 * Optional body of POST /api/sessions/{id}/extract.
 *
 * @param apiKey key for the messages API; when absent the configured key (if any) is used
 */
public record ExtractRequest(String apiKey) {}
