package com.openforge.memorylane.extraction;

/**
 * The two extraction transports. The value doubles as the {@code chosen_method}
 * field of the extraction log.
 */
public enum ProviderKind {

    /** Locally installed, OAuth-authenticated assistant CLI. */
    CLI("cli"),

    /** Keyed HTTP messages API. */
    API("api");

    private final String method;

    ProviderKind(String method) {
        this.method = method;
    }

    public String method() {
        return method;
    }
}
