package com.noodles.opgraph.path;

/**
 * The two slot namespaces an operator exposes: parameters ({@code par}) and
 * outputs ({@code out}).
 */
public enum HandleNamespace {
    PAR("par"),
    OUT("out");

    private final String token;

    HandleNamespace(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /** Exact, case-sensitive lookup; {@code null} for anything else. */
    public static HandleNamespace fromToken(String text) {
        for (HandleNamespace ns : values()) {
            if (ns.token.equals(text))
                return ns;
        }
        return null;
    }
}
