package app.jira.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/**
 * Jira Cloud API token authentication: account email and API token sent as HTTP Basic.
 */
public class HttpBasicAuth implements Authentication {

    private final String username;
    private final String password;

    public HttpBasicAuth(String username, String password) {
        this.username = username;
        this.password = password;
    }

    @Override
    public void applyTo(HttpHeaders headers) {
        if (!isPresent()) {
            return;
        }
        String value = (username == null ? "" : username) + ":" + (password == null ? "" : password);
        String encoded = Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
        headers.set(HttpHeaders.AUTHORIZATION, "Basic " + encoded);
    }

    @Override
    public boolean isPresent() {
        return StringUtils.hasText(username) && StringUtils.hasText(password);
    }
}
