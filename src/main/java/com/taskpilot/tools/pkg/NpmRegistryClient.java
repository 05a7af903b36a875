package com.taskpilot.tools.pkg;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskpilot.config.AgentProperties;
import com.taskpilot.tools.ToolExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
@Slf4j
public class NpmRegistryClient {

    private final RestClient registryClient;

    public NpmRegistryClient(RestClient.Builder restClientBuilder, AgentProperties properties) {
        this.registryClient = restClientBuilder
                .baseUrl(properties.getNpmRegistryUrl())
                .build();
    }

    public NpmPackageInfo fetch(String packageName) {
        JsonNode body;
        try {
            body = registryClient.get()
                    .uri("/{name}", packageName)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException ex) {
            if (ex.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                throw new ToolExecutionException("Package \"" + packageName + "\" not found");
            }
            throw new ToolExecutionException("npm registry returned " + ex.getStatusCode().value()
                    + " for \"" + packageName + "\"", ex);
        } catch (RestClientException ex) {
            log.warn("npm registry lookup failed for {}: {}", packageName, ex.getMessage());
            throw new ToolExecutionException("Could not reach the npm registry: " + ex.getMessage(), ex);
        }
        if (body == null || body.isMissingNode() || !body.hasNonNull("name")) {
            throw new ToolExecutionException("Package \"" + packageName + "\" not found");
        }
        String version = body.path("dist-tags").path("latest").asText("unknown");
        JsonNode latest = body.path("versions").path(version);
        return new NpmPackageInfo(
                body.path("name").asText(packageName),
                version,
                firstText(latest.path("description"), body.path("description"), "No description"),
                firstText(latest.path("license"), body.path("license"), "unknown"),
                firstText(latest.path("homepage"), body.path("homepage"), ""));
    }

    private String firstText(JsonNode primary, JsonNode secondary, String fallback) {
        if (primary.isTextual() && !primary.asText().isBlank()) {
            return primary.asText();
        }
        if (secondary.isTextual() && !secondary.asText().isBlank()) {
            return secondary.asText();
        }
        return fallback;
    }
}
