package app.jira.auth;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/**
 * OAuth 2.0 (3LO) access token sent as a bearer credential.
 */
public class HttpBearerAuth implements Authentication {

    private final String scheme;
    private final String bearerToken;

    public HttpBearerAuth(String scheme, String bearerToken) {
        this.scheme = scheme;
        this.bearerToken = bearerToken;
    }

    public HttpBearerAuth(String bearerToken) {
        this("Bearer", bearerToken);
    }

    @Override
    public void applyTo(HttpHeaders headers) {
        if (!isPresent()) {
            return;
        }
        String prefix = StringUtils.hasText(scheme) ? scheme : "Bearer";
        headers.set(HttpHeaders.AUTHORIZATION, prefix + " " + bearerToken.trim());
    }

    @Override
    public boolean isPresent() {
        return StringUtils.hasText(bearerToken);
    }
}
