package com.trophykit.core.auth.xbox;

import java.io.IOException;
import java.util.Optional;

/**
 * Supplies a fresh Microsoft account access token once the Xbox session has expired.
 * Empty means no token is available and the call fails with a session-expired error.
 */
@FunctionalInterface
public interface TokenRefreshCallback {
    Optional<String> refreshAccessToken() throws IOException, InterruptedException;
}
