package space.maatini.magicauth.resource;

import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import space.maatini.magicauth.config.MagicAuthConfig;
import space.maatini.magicauth.model.AccessToken;
import space.maatini.magicauth.service.TokenAdminService;
import space.maatini.magicauth.service.TokenAdminService.TokenView;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST surface for token administration. Answers 404 unless
 * {@code magic-auth.admin.enabled} is set.
 */
@Path("/magic-auth/admin")
@Produces(MediaType.APPLICATION_JSON)
public class TokenAdminResource {

    private static final Logger LOG = Logger.getLogger(TokenAdminResource.class);

    @Inject
    MagicAuthConfig config;

    @Inject
    TokenAdminService adminService;

    /**
     * Lists the canonical paths tokens can be issued for.
     */
    @GET
    @Path("paths")
    public List<String> protectedPaths() {
        ensureEnabled();
        return adminService.protectedPaths();
    }

    @GET
    @Path("tokens")
    public List<TokenView> tokens() {
        ensureEnabled();
        return adminService.list();
    }

    @GET
    @Path("tokens/{id}")
    public TokenView token(@PathParam("id") String id) {
        ensureEnabled();
        return adminService.find(id).orElseThrow(() -> new NotFoundException("Unknown token " + id));
    }

    /**
     * Issues a token; the response carries the access link.
     */
    @POST
    @Path("tokens")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response issue(IssueTokenRequest request) {
        ensureEnabled();
        if (request == null) {
            throw new BadRequestException("Request body is required");
        }
        try {
            AccessToken token = adminService.issue(request.description(), request.path(), request.expiresAt(),
                    request.maxUses());
            TokenView view = adminService.find(token.id()).orElseThrow();
            return Response.created(URI.create("/magic-auth/admin/tokens/" + token.id()))
                    .entity(view)
                    .build();
        } catch (IllegalArgumentException e) {
            LOG.debugf("Rejected token request: %s", e.getMessage());
            throw new BadRequestException(e.getMessage());
        }
    }

    @POST
    @Path("tokens/{id}/revoke")
    public TokenView revoke(@PathParam("id") String id) {
        ensureEnabled();
        return adminService.revoke(id).orElseThrow(() -> new NotFoundException("Unknown token " + id));
    }

    @DELETE
    @Path("tokens/{id}")
    public Response delete(@PathParam("id") String id) {
        ensureEnabled();
        if (!adminService.delete(id)) {
            throw new NotFoundException("Unknown token " + id);
        }
        return Response.noContent().build();
    }

    /**
     * Deletes expired and exhausted tokens right away.
     */
    @POST
    @Path("cleanup")
    public Map<String, Integer> cleanup() {
        ensureEnabled();
        return Map.of("deleted", adminService.cleanup());
    }

    private void ensureEnabled() {
        if (!config.admin().enabled()) {
            throw new NotFoundException();
        }
    }

    /**
     * Payload for issuing a token.
     */
    public record IssueTokenRequest(
            String description,
            String path,
            Instant expiresAt,
            Integer maxUses) {
    }
}
