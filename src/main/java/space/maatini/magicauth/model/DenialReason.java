package space.maatini.magicauth.model;

/**
 * Why a request to a protected path was denied.
 * <p>
 * Revoked, expired, exhausted, wrong-path and unknown tokens all collapse
 * into {@link #INVALID_TOKEN}.
 */
public enum DenialReason {
    NO_TOKEN("no_token", "Access denied: No token provided"),
    INVALID_TOKEN("invalid_token", "Access denied: Invalid token");

    private final String code;
    private final String message;

    DenialReason(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String code() {
        return code;
    }

    /**
     * Default plain-text body of the denial response.
     */
    public String message() {
        return message;
    }
}
