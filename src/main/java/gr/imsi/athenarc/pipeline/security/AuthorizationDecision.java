package gr.imsi.athenarc.pipeline.security;

import gr.imsi.athenarc.pipeline.exception.PipelineStage;
import gr.imsi.athenarc.pipeline.exception.QueryForbiddenException;

/**
 * Outcome of an access check: allowed, or denied on the first failing resource.
 */
public final class AuthorizationDecision {

    private static final AuthorizationDecision ALLOWED = new AuthorizationDecision(null, null);

    private final String deniedResource;
    private final String reason;

    private AuthorizationDecision(String deniedResource, String reason) {
        this.deniedResource = deniedResource;
        this.reason = reason;
    }

    public static AuthorizationDecision allowed() {
        return ALLOWED;
    }

    public static AuthorizationDecision denied(String resource, String reason) {
        return new AuthorizationDecision(resource, reason);
    }

    public boolean isAllowed() {
        return deniedResource == null;
    }

    public String getDeniedResource() {
        return deniedResource;
    }

    public String getReason() {
        return reason;
    }

    public void throwIfDenied() {
        if (!isAllowed()) {
            throw new QueryForbiddenException(PipelineStage.AUTHORIZED, deniedResource, reason);
        }
    }

    @Override
    public String toString() {
        return isAllowed() ? "Allowed" : "Denied{" + deniedResource + ": " + reason + '}';
    }
}
