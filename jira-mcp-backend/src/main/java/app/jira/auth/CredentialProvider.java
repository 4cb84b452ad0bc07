package app.jira.auth;

import org.springframework.http.HttpHeaders;

/**
 * Supplies the credential for one outgoing request. Called once per request; implementations
 * may rotate credentials between calls and callers must not cache the result.
 */
@FunctionalInterface
public interface CredentialProvider {

    Authentication currentAuthentication();

    static CredentialProvider none() {
        return () -> NoAuthentication.INSTANCE;
    }

    final class NoAuthentication implements Authentication {

        static final NoAuthentication INSTANCE = new NoAuthentication();

        private NoAuthentication() {
        }

        @Override
        public void applyTo(HttpHeaders headers) {
        }

        @Override
        public boolean isPresent() {
            return false;
        }
    }
}
