package com.ai.echomi.auth;

import com.ai.echomi.exception.UnauthorizedRequestException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the shared secret the owner's app sends with order-management calls.
 * Mock mode accepts any secret.
 */
@Component
public class SharedSecretVerifier {

    private static final Logger log = LoggerFactory.getLogger(SharedSecretVerifier.class);

    private final String secretKey;
    private final boolean mockMode;

    public SharedSecretVerifier(@Value("${echomi.secret-key:}") String secretKey,
                                @Value("${echomi.mock-mode:false}") boolean mockMode) {
        this.secretKey = secretKey;
        this.mockMode = mockMode;
    }

    public void verify(String supplied) {
        if (mockMode) {
            return;
        }
        if (StringUtils.isBlank(secretKey) || supplied == null
                || !MessageDigest.isEqual(secretKey.getBytes(StandardCharsets.UTF_8), supplied.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected request with an invalid secret key");
            throw new UnauthorizedRequestException("Unauthorized");
        }
    }
}
