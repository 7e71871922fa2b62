package com.worksuite.security;

/**
 * Raised inside the authentication pipeline when a credential or identity is rejected.
 * <p>
 * Never escapes {@link AuthorizationEngine}: the engine converts it into an {@link
 * AuthenticationResult} so request handlers can branch on the {@link FailureCode}.
 */
public class AuthenticationException extends RuntimeException {

    private final FailureCode code;

    public AuthenticationException(FailureCode code) {
        this(code, code.defaultMessage(), null);
    }

    public AuthenticationException(FailureCode code, String message) {
        this(code, message, null);
    }

    public AuthenticationException(FailureCode code, String message, Throwable cause) {
        super(message, cause);
        if (code.kind() != FailureKind.UNAUTHENTICATED) {
            throw new IllegalArgumentException(
                    "%s is not an authentication failure".formatted(code));
        }
        this.code = code;
    }

    public FailureCode code() {
        return code;
    }
}
