package com.example.icc.auth;

import jakarta.servlet.http.HttpServletRequest;

public interface Authenticator {

    /**
     * Resolves the user behind {@code request}. Requests without credentials are anonymous.
     *
     * @throws com.example.icc.error.IccException if the credentials are present but not valid
     */
    AuthContext authenticate(HttpServletRequest request);

    /**
     * The user id of an authenticated context, {@link AuthContext#ANONYMOUS_USER_ID} for anonymous.
     */
    default long userId(AuthContext context) {
        return context.getUserId();
    }
}
