package space.maatini.magicauth.model;

import java.util.Objects;

/**
 * Outcome of a token validation: either the updated token record or the
 * denial reason.
 */
public record ValidationResult(AccessToken token, DenialReason reason) {

    public static ValidationResult granted(AccessToken token) {
        return new ValidationResult(Objects.requireNonNull(token, "token"), null);
    }

    public static ValidationResult denied(DenialReason reason) {
        return new ValidationResult(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isGranted() {
        return token != null;
    }
}
