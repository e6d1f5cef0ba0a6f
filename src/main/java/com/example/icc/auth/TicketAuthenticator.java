package com.example.icc.auth;

import com.example.icc.error.IccException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Base64;

/**
 * Reads the access token that the auth service issues into the {@code Authentication}
 * header and verifies its HS256 signature. Requests without the header are anonymous.
 */
@Component
@ConditionalOnProperty(name = "icc.auth", havingValue = "ticket")
public class TicketAuthenticator implements Authenticator {

    private static final Logger logger = LoggerFactory.getLogger(TicketAuthenticator.class);

    static final String HEADER = "Authentication";
    private static final String BEARER = "bearer ";
    private static final String HMAC = "HmacSHA256";

    private final byte[] tokenKey;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public TicketAuthenticator(@Value("${icc.auth.token-key}") String tokenKey, ObjectMapper objectMapper) {
        this(tokenKey.getBytes(StandardCharsets.UTF_8), objectMapper, Clock.systemUTC());
    }

    TicketAuthenticator(byte[] tokenKey, ObjectMapper objectMapper, Clock clock) {
        this.tokenKey = tokenKey;
        this.objectMapper = objectMapper;
        this.clock = clock;
        logger.info("Auth method: ticket");
    }

    @Override
    public AuthContext authenticate(HttpServletRequest request) {
        String header = request.getHeader(HEADER);
        if (header == null || header.isBlank()) {
            return AuthContext.ANONYMOUS;
        }

        String token = header.trim();
        if (token.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            token = token.substring(BEARER.length()).trim();
        }

        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            throw IccException.notAllowed("Invalid access token");
        }
        if (!MessageDigest.isEqual(sign(parts[0] + "." + parts[1]), decode(parts[2]))) {
            throw IccException.notAllowed("Invalid access token");
        }

        JsonNode claims;
        try {
            claims = objectMapper.readTree(decode(parts[1]));
        } catch (IOException e) {
            throw IccException.notAllowed("Invalid access token");
        }

        JsonNode exp = claims.get("exp");
        if (exp != null && exp.asLong() < clock.instant().getEpochSecond()) {
            throw IccException.notAllowed("Access token expired");
        }

        JsonNode userId = claims.get("userId");
        if (userId == null || !userId.canConvertToLong() || userId.asLong() <= 0) {
            throw IccException.notAllowed("Access token has no user");
        }
        return new AuthContext(userId.asLong());
    }

    byte[] sign(String data) {
        try {
            Mac mac = Mac.getInstance(HMAC);
            mac.init(new SecretKeySpec(tokenKey, HMAC));
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HS256 not available", e);
        }
    }

    private static byte[] decode(String part) {
        try {
            return Base64.getUrlDecoder().decode(part);
        } catch (IllegalArgumentException e) {
            throw IccException.notAllowed("Invalid access token");
        }
    }
}
