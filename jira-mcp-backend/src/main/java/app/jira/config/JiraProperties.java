package app.jira.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

/**
 * Connection and credential settings for the Jira Cloud site.
 *
 * @param baseUrl           site root, e.g. {@code https://your-domain.atlassian.net}
 * @param email             account email for API token authentication
 * @param apiToken          API token paired with {@code email}
 * @param accessToken       OAuth 2.0 access token, preferred over email + API token when set
 * @param catalogueLocation Spring resource location of the operation catalogue
 */
@ConfigurationProperties(prefix = "jira")
public record JiraProperties(String baseUrl,
                             String email,
                             String apiToken,
                             String accessToken,
                             String catalogueLocation) {

    public static final String DEFAULT_BASE_URL = "http://localhost:8080";
    public static final String DEFAULT_CATALOGUE_LOCATION = "classpath:catalogue/jira-cloud.json";

    public JiraProperties {
        baseUrl = normalizeBaseUrl(baseUrl);
        email = normalizeSecret(email);
        apiToken = normalizeSecret(apiToken);
        accessToken = normalizeSecret(accessToken);
        catalogueLocation = StringUtils.hasText(catalogueLocation)
                ? catalogueLocation.trim()
                : DEFAULT_CATALOGUE_LOCATION;
    }

    private static String normalizeBaseUrl(String value) {
        String candidate = StringUtils.hasText(value) ? value.trim() : DEFAULT_BASE_URL;
        while (candidate.endsWith("/")) {
            candidate = candidate.substring(0, candidate.length() - 1);
        }
        return candidate;
    }

    private static String normalizeSecret(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
