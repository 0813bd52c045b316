package space.maatini.magicauth.token;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import space.maatini.magicauth.model.DenialReason;
import space.maatini.magicauth.model.ValidationResult;

import java.time.Instant;

/**
 * Validates a candidate token against a canonical protected path and
 * records the access on success.
 * <p>
 * A token is accepted iff it exists, is still valid, was issued for exactly
 * that path, is not expired and has uses left. Which of these failed is
 * deliberately not reported.
 */
@ApplicationScoped
public class TokenValidator {

    private static final Logger LOG = Logger.getLogger(TokenValidator.class);

    @Inject
    TokenRepository repository;

    public TokenValidator() {
    }

    public TokenValidator(TokenRepository repository) {
        this.repository = repository;
    }

    /**
     * Validates the token and, if accepted, increments its access count
     * exactly once.
     *
     * @param tokenValue    the secret presented by the client, may be null
     * @param protectedPath the canonical path of the matched route
     * @param now           the evaluation instant
     */
    public ValidationResult validate(String tokenValue, String protectedPath, Instant now) {
        if (tokenValue == null || tokenValue.isEmpty()) {
            return ValidationResult.denied(DenialReason.NO_TOKEN);
        }

        return repository.recordUsage(tokenValue, protectedPath, now)
                .map(token -> {
                    LOG.debugf("Recorded access %d for token %s on %s", token.timesAccessed(), token.id(),
                            protectedPath);
                    return ValidationResult.granted(token);
                })
                .orElseGet(() -> ValidationResult.denied(DenialReason.INVALID_TOKEN));
    }
}
