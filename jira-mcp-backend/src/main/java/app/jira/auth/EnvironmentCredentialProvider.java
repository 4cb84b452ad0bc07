package app.jira.auth;

import java.util.function.UnaryOperator;

import org.springframework.util.StringUtils;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads Jira credentials from the process environment on every call, falling back to the
 * configured values.
 * <p>
 * An access token wins over email + API token, matching how Jira Cloud treats OAuth apps.
 */
@Slf4j
public class EnvironmentCredentialProvider implements CredentialProvider {

    public static final String EMAIL_VARIABLE = "JIRA_EMAIL";
    public static final String API_TOKEN_VARIABLE = "JIRA_API_TOKEN";
    public static final String ACCESS_TOKEN_VARIABLE = "JIRA_ACCESS_TOKEN";

    private final UnaryOperator<String> environment;
    private final String fallbackEmail;
    private final String fallbackApiToken;
    private final String fallbackAccessToken;

    public EnvironmentCredentialProvider(String fallbackEmail, String fallbackApiToken, String fallbackAccessToken) {
        this(System::getenv, fallbackEmail, fallbackApiToken, fallbackAccessToken);
    }

    public EnvironmentCredentialProvider(UnaryOperator<String> environment,
                                         String fallbackEmail,
                                         String fallbackApiToken,
                                         String fallbackAccessToken) {
        this.environment = environment;
        this.fallbackEmail = fallbackEmail;
        this.fallbackApiToken = fallbackApiToken;
        this.fallbackAccessToken = fallbackAccessToken;
    }

    @Override
    public Authentication currentAuthentication() {
        String accessToken = lookup(ACCESS_TOKEN_VARIABLE, fallbackAccessToken);
        if (StringUtils.hasText(accessToken)) {
            return new HttpBearerAuth(accessToken);
        }
        String email = lookup(EMAIL_VARIABLE, fallbackEmail);
        String apiToken = lookup(API_TOKEN_VARIABLE, fallbackApiToken);
        HttpBasicAuth basic = new HttpBasicAuth(email, apiToken);
        if (!basic.isPresent()) {
            log.debug("No Jira credentials configured, sending request unauthenticated");
        }
        return basic;
    }

    private String lookup(String variable, String fallback) {
        String value = environment.apply(variable);
        if (StringUtils.hasText(value)) {
            return value.trim();
        }
        return StringUtils.hasText(fallback) ? fallback.trim() : null;
    }
}
