package com.worksuite.accessservice.api;

/**
 * A freshly issued bearer credential.
 *
 * @param token compact JWS
 * @param workspaceId tenant hint carried by the token
 * @param expiresIn lifetime in seconds
 */
public record TokenResponse(String token, long workspaceId, long expiresIn) {
}
