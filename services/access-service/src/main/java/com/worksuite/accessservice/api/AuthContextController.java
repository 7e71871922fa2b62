package com.worksuite.accessservice.api;

import com.worksuite.accessservice.infrastructure.web.AccessDeniedException;
import com.worksuite.accessservice.infrastructure.web.AuthorizationFilter;
import com.worksuite.observability.AccessMetrics;
import com.worksuite.security.AccessDecisionPoint;
import com.worksuite.security.AccessMode;
import com.worksuite.security.AuthorizationContext;
import com.worksuite.security.credential.CredentialSettings;
import com.worksuite.security.credential.TokenIssuer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * The caller's own authorization context, and workspace switching.
 */
@RestController
@RequestMapping("/api/v1")
public class AuthContextController {

    private static final Logger log = LoggerFactory.getLogger(AuthContextController.class);

    private final AccessDecisionPoint decisionPoint;
    private final TokenIssuer tokenIssuer;
    private final CredentialSettings credentialSettings;
    private final AccessMetrics metrics;

    public AuthContextController(
            AccessDecisionPoint decisionPoint,
            TokenIssuer tokenIssuer,
            CredentialSettings credentialSettings,
            AccessMetrics metrics) {
        this.decisionPoint = decisionPoint;
        this.tokenIssuer = tokenIssuer;
        this.credentialSettings = credentialSettings;
        this.metrics = metrics;
    }

    @GetMapping("/auth/me")
    public MeResponse me(
            @RequestAttribute(AuthorizationFilter.CONTEXT_ATTRIBUTE) AuthorizationContext ctx) {
        return MeResponse.from(ctx);
    }

    /**
     * Issues a token whose tenant hint is the given workspace. The caller must be able to read
     * the workspace; an expired trial does not prevent switching into it.
     */
    @PostMapping("/workspaces/{workspaceId}/token")
    public TokenResponse switchWorkspace(
            @RequestAttribute(AuthorizationFilter.CONTEXT_ATTRIBUTE) AuthorizationContext ctx,
            @PathVariable long workspaceId) {
        AccessDeniedException.check(
                decisionPoint.requireWorkspaceAccess(ctx, workspaceId, AccessMode.READ));
        String token = tokenIssuer.generateToken(ctx.userId(), workspaceId);
        metrics.tokenIssued();
        log.info("User {} switched to workspace {}", ctx.userId(), workspaceId);
        return new TokenResponse(token, workspaceId, credentialSettings.tokenExpiry().toSeconds());
    }
}
