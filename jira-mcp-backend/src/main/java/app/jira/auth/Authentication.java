package app.jira.auth;

import org.springframework.http.HttpHeaders;

/**
 * An authentication scheme that decorates an outgoing request.
 */
public interface Authentication {

    void applyTo(HttpHeaders headers);

    /**
     * Whether this scheme carries any credential at all.
     */
    boolean isPresent();
}
