package com.worksuite.security;

import java.util.Objects;

/**
 * Outcome of authenticating a request: either a context or an authentication failure.
 *
 * @param context resolved context, {@code null} on failure
 * @param failure failure code of kind {@link FailureKind#UNAUTHENTICATED}, {@code null} on success
 * @param message failure detail, {@code null} on success
 */
public record AuthenticationResult(AuthorizationContext context, FailureCode failure, String message) {

    public AuthenticationResult {
        if ((context == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of context or failure must be set");
        }
    }

    public static AuthenticationResult success(AuthorizationContext context) {
        return new AuthenticationResult(Objects.requireNonNull(context, "context"), null, null);
    }

    public static AuthenticationResult failure(FailureCode code, String message) {
        return new AuthenticationResult(null, code, message == null ? code.defaultMessage() : message);
    }

    public boolean authenticated() {
        return context != null;
    }
}
