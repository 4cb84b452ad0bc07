package app.jira.auth;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

class EnvironmentCredentialProviderTest {

    private final Map<String, String> environment = new HashMap<>();

    @Test
    void sendsEmailAndApiTokenAsBasic() {
        HttpHeaders headers = apply(new EnvironmentCredentialProvider(environment::get, "dev@example.com", "secret", null));

        String expected = Base64.getEncoder().encodeToString("dev@example.com:secret".getBytes(StandardCharsets.UTF_8));
        assertThat(headers.getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Basic " + expected);
    }

    @Test
    void prefersAccessToken() {
        environment.put(EnvironmentCredentialProvider.ACCESS_TOKEN_VARIABLE, " oauth-token ");

        HttpHeaders headers = apply(new EnvironmentCredentialProvider(environment::get, "dev@example.com", "secret", null));

        assertThat(headers.getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer oauth-token");
    }

    @Test
    void environmentOverridesConfiguredValuesOnEveryCall() {
        EnvironmentCredentialProvider provider =
                new EnvironmentCredentialProvider(environment::get, "dev@example.com", "old", null);
        String before = apply(provider).getFirst(HttpHeaders.AUTHORIZATION);

        environment.put(EnvironmentCredentialProvider.API_TOKEN_VARIABLE, "rotated");
        String after = apply(provider).getFirst(HttpHeaders.AUTHORIZATION);

        assertThat(after).isNotEqualTo(before);
        assertThat(after).isEqualTo("Basic " + Base64.getEncoder()
                .encodeToString("dev@example.com:rotated".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void leavesRequestUnauthenticatedWithoutCredentials() {
        EnvironmentCredentialProvider provider = new EnvironmentCredentialProvider(environment::get, "dev@example.com", null, null);

        assertThat(provider.currentAuthentication().isPresent()).isFalse();
        assertThat(apply(provider).containsKey(HttpHeaders.AUTHORIZATION)).isFalse();
    }

    private static HttpHeaders apply(CredentialProvider provider) {
        HttpHeaders headers = new HttpHeaders();
        provider.currentAuthentication().applyTo(headers);
        return headers;
    }
}
