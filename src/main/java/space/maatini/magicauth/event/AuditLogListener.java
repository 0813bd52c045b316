package space.maatini.magicauth.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import space.maatini.magicauth.config.MagicAuthConfig;
import space.maatini.magicauth.model.AccessRequest;
import space.maatini.magicauth.model.AccessToken;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes every access decision as one JSON line to the {@code audit} logger.
 * Token secrets are never logged; the token query parameter is redacted.
 */
@ApplicationScoped
public class AuditLogListener implements AccessEventListener {

    private static final Logger AUDIT_LOG = Logger.getLogger("audit");
    private static final Logger LOG = Logger.getLogger(AuditLogListener.class);

    static final String REDACTED = "[REDACTED]";

    @Inject
    MagicAuthConfig config;

    @Inject
    ObjectMapper objectMapper;

    @Override
    public void onAccessGranted(AccessGrantedEvent event) {
        AccessToken token = event.token();
        write(new AuditLogEntry(
                Instant.now().toString(),
                "access_granted",
                requestInfo(event.request()),
                event.protectedPath(),
                null,
                new TokenInfo(token.id(), token.description(), token.timesAccessed(), token.maxUses())));
    }

    @Override
    public void onAccessDenied(AccessDeniedEvent event) {
        write(new AuditLogEntry(
                Instant.now().toString(),
                "access_denied",
                requestInfo(event.request()),
                null,
                event.reason().code(),
                null));
    }

    private void write(AuditLogEntry entry) {
        if (!config.audit().enabled()) {
            return;
        }
        try {
            AUDIT_LOG.info(objectMapper.writeValueAsString(entry));
        } catch (Exception e) {
            LOG.warnf("Failed to write audit log: %s", e.getMessage());
        }
    }

    private RequestInfo requestInfo(AccessRequest request) {
        Map<String, List<String>> query = new LinkedHashMap<>(request.queryParameters());
        query.computeIfPresent(config.tokenParam(), (name, values) -> List.of(REDACTED));
        return new RequestInfo(request.path(), query);
    }

    /**
     * Audit log entry structure.
     */
    public record AuditLogEntry(
            String timestamp,
            String eventType,
            RequestInfo request,
            String protectedPath,
            String reason,
            TokenInfo token) {
    }

    public record RequestInfo(
            String path,
            Map<String, List<String>> query) {
    }

    public record TokenInfo(
            String id,
            String description,
            int timesAccessed,
            Integer maxUses) {
    }
}
