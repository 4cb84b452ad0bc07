package app.jira.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import com.fasterxml.jackson.databind.ObjectMapper;

import app.jira.auth.CredentialProvider;
import app.jira.auth.EnvironmentCredentialProvider;
import app.jira.catalogue.CatalogueLoader;
import app.jira.catalogue.OperationRegistry;

@Configuration
public class DispatcherConfiguration {

    @Bean
    public CatalogueLoader catalogueLoader(ObjectMapper objectMapper) {
        return new CatalogueLoader(objectMapper);
    }

    /**
     * Built once at startup; a malformed catalogue aborts the context.
     */
    @Bean
    public OperationRegistry operationRegistry(CatalogueLoader loader, ResourceLoader resourceLoader,
                                               JiraProperties properties) {
        return loader.load(resourceLoader.getResource(properties.catalogueLocation()));
    }

    @Bean
    public CredentialProvider credentialProvider(JiraProperties properties) {
        return new EnvironmentCredentialProvider(properties.email(), properties.apiToken(), properties.accessToken());
    }
}
