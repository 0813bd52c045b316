package space.maatini.magicauth.filter;

import io.quarkus.qute.Engine;
import io.quarkus.qute.Template;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.literal.NamedLiteral;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import space.maatini.magicauth.config.MagicAuthConfig;
import space.maatini.magicauth.model.DenialReason;

import java.util.Optional;

/**
 * Builds the response for a denied request.
 * <p>
 * A configured {@link ForbiddenHandler} takes precedence over a configured
 * template, which takes precedence over the plain-text 403 default.
 */
@ApplicationScoped
public class ForbiddenResponder {

    private static final Logger LOG = Logger.getLogger(ForbiddenResponder.class);

    @Inject
    MagicAuthConfig config;

    @Inject
    @Any
    Instance<ForbiddenHandler> handlers;

    @Inject
    Engine engine;

    public Response respond(String path, DenialReason reason) {
        Optional<String> handlerName = config.forbiddenHandler();
        if (handlerName.isPresent()) {
            return resolveHandler(handlerName.get()).handle(path, reason);
        }

        Optional<String> templateId = config.forbiddenTemplate();
        if (templateId.isPresent()) {
            return Response.status(Response.Status.FORBIDDEN)
                    .type(MediaType.TEXT_HTML_TYPE.withCharset("UTF-8"))
                    .entity(renderTemplate(templateId.get(), path, reason))
                    .build();
        }

        return plainForbidden(reason.message());
    }

    /**
     * Generic plain-text 403.
     */
    public static Response plainForbidden(String message) {
        return Response.status(Response.Status.FORBIDDEN)
                .type(MediaType.TEXT_PLAIN_TYPE.withCharset("UTF-8"))
                .entity(message)
                .build();
    }

    private ForbiddenHandler resolveHandler(String name) {
        Instance<ForbiddenHandler> selected = handlers.select(NamedLiteral.of(name));
        if (!selected.isResolvable()) {
            throw new IllegalStateException("No ForbiddenHandler bean named '" + name + "'");
        }
        return selected.get();
    }

    private String renderTemplate(String id, String path, DenialReason reason) {
        Template template = engine.getTemplate(id);
        if (template == null) {
            throw new IllegalStateException("Forbidden template '" + id + "' not found");
        }
        LOG.debugf("Rendering forbidden template %s for %s", id, path);
        return template
                .data("path", path)
                .data("reason", reason.code())
                .render();
    }
}
