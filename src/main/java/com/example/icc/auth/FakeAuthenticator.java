package com.example.icc.auth;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Treats every request as the same user. For development only.
 */
@Component
@ConditionalOnProperty(name = "icc.auth", havingValue = "fake", matchIfMissing = true)
public class FakeAuthenticator implements Authenticator {

    private static final Logger logger = LoggerFactory.getLogger(FakeAuthenticator.class);

    private final AuthContext context;

    public FakeAuthenticator(@Value("${icc.auth.fake-user-id:1}") long userId) {
        this.context = new AuthContext(userId);
        logger.info("Auth method: fake (user id {} for all requests)", userId);
    }

    @Override
    public AuthContext authenticate(HttpServletRequest request) {
        return context;
    }
}
