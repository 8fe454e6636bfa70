package dev.forgelink.infrastructure.gitea;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.forgelink.config.GiteaProperties;
import dev.forgelink.domain.entity.Installation;
import dev.forgelink.exception.InstallationConfigurationException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Gitea REST API (v1) client with circuit breaker and rate limiting.
 *
 * <p>Every call is made on behalf of one {@link Installation}: the base URL comes from its
 * metadata, the bearer token from its stored access token. Non-2xx answers surface as
 * {@link GiteaApiException} with the upstream status.
 */
@Component
public class GiteaApiClient {
    private static final Logger log = LoggerFactory.getLogger(GiteaApiClient.class);

    static final String API_VERSION = "/api/v1";

    private final WebClient webClient;
    private final GiteaProperties properties;

    public GiteaApiClient(WebClient.Builder builder, GiteaProperties properties) {
        this.properties = properties;
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.responseTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) properties.connectTimeout().toMillis());
        this.webClient = builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE).build();
    }

    @CircuitBreaker(name = "gitea-api") @RateLimiter(name = "gitea-api")
    public GiteaUser getCurrentUser(Installation installation) {
        return get(installation, "/user", GiteaUser.class);
    }

    @CircuitBreaker(name = "gitea-api") @RateLimiter(name = "gitea-api")
    public List<GiteaRepository> listUserRepositories(Installation installation) {
        List<GiteaRepository> repos = exchange(installation, webClient.get()
                .uri(apiUrl(installation, "/user/repos"))
                .header(HttpHeaders.AUTHORIZATION, bearer(installation))
                .retrieve()
                .onStatus(HttpStatusCode::isError, GiteaApiClient::toApiException)
                .bodyToMono(new ParameterizedTypeReference<List<GiteaRepository>>() {}));
        return repos != null ? repos : List.of();
    }

    @CircuitBreaker(name = "gitea-api") @RateLimiter(name = "gitea-api")
    public GiteaRepository getRepository(Installation installation, String repo) {
        return get(installation, "/repos/" + repo, GiteaRepository.class);
    }

    /**
     * Registers our webhook on {@code repo} for push and pull request events. The configured
     * secret is the installation's composite secret, which Gitea echoes back in each delivery.
     *
     * @return the Gitea hook id
     */
    @CircuitBreaker(name = "gitea-api") @RateLimiter(name = "gitea-api")
    public long createRepositoryWebhook(Installation installation, String repo) {
        Map<String, Object> body = Map.of(
                "type", "gitea",
                "events", List.of("push", "pull_request"),
                "active", true,
                "config", Map.of(
                        "url", properties.webhookUrl(),
                        "content_type", "json",
                        "secret", installation.compositeWebhookSecret()));
        GiteaHook hook = post(installation, "/repos/" + repo + "/hooks", body, GiteaHook.class);
        log.info("Webhook {} registered on {} for installation {}", hook.id(), repo, installation.getId());
        return hook.id();
    }

    @CircuitBreaker(name = "gitea-api") @RateLimiter(name = "gitea-api")
    public void deleteRepositoryWebhook(Installation installation, String repo, long hookId) {
        exchange(installation, webClient.delete()
                .uri(apiUrl(installation, "/repos/" + repo + "/hooks/" + hookId))
                .header(HttpHeaders.AUTHORIZATION, bearer(installation))
                .retrieve()
                .onStatus(HttpStatusCode::isError, GiteaApiClient::toApiException)
                .toBodilessEntity());
        log.info("Webhook {} removed from {}", hookId, repo);
    }

    @CircuitBreaker(name = "gitea-api") @RateLimiter(name = "gitea-api")
    public GiteaIssue getIssue(Installation installation, String repo, String index) {
        return get(installation, "/repos/" + repo + "/issues/" + index, GiteaIssue.class);
    }

    @CircuitBreaker(name = "gitea-api") @RateLimiter(name = "gitea-api")
    public GiteaIssue createIssue(Installation installation, String repo, String title, String body) {
        return post(installation, "/repos/" + repo + "/issues",
                Map.of("title", title, "body", body != null ? body : ""), GiteaIssue.class);
    }

    @CircuitBreaker(name = "gitea-api") @RateLimiter(name = "gitea-api")
    public void createIssueComment(Installation installation, String repo, String index, String body) {
        post(installation, "/repos/" + repo + "/issues/" + index + "/comments", Map.of("body", body), Map.class);
    }

    @CircuitBreaker(name = "gitea-api") @RateLimiter(name = "gitea-api")
    public List<GiteaIssue> searchIssues(Installation installation, String repo, String query) {
        URI uri = UriComponentsBuilder.fromUriString(apiUrl(installation, "/repos/" + repo + "/issues"))
                .queryParam("q", query)
                .encode()
                .build()
                .toUri();
        List<GiteaIssue> issues = exchange(installation, webClient.get()
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, bearer(installation))
                .retrieve()
                .onStatus(HttpStatusCode::isError, GiteaApiClient::toApiException)
                .bodyToMono(new ParameterizedTypeReference<List<GiteaIssue>>() {}));
        return issues != null ? issues : List.of();
    }

    @CircuitBreaker(name = "gitea-api") @RateLimiter(name = "gitea-api")
    public List<Map<String, Object>> getLastCommits(Installation installation, String repo) {
        List<Map<String, Object>> commits = exchange(installation, webClient.get()
                .uri(apiUrl(installation, "/repos/" + repo + "/commits"))
                .header(HttpHeaders.AUTHORIZATION, bearer(installation))
                .retrieve()
                .onStatus(HttpStatusCode::isError, GiteaApiClient::toApiException)
                .bodyToMono(new ParameterizedTypeReference<List<Map<String, Object>>>() {}));
        return commits != null ? commits : List.of();
    }

    private <T> T get(Installation installation, String path, Class<T> type) {
        return exchange(installation, webClient.get()
                .uri(apiUrl(installation, path))
                .header(HttpHeaders.AUTHORIZATION, bearer(installation))
                .retrieve()
                .onStatus(HttpStatusCode::isError, GiteaApiClient::toApiException)
                .bodyToMono(type));
    }

    private <T> T post(Installation installation, String path, Object body, Class<T> type) {
        return exchange(installation, webClient.post()
                .uri(apiUrl(installation, path))
                .header(HttpHeaders.AUTHORIZATION, bearer(installation))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, GiteaApiClient::toApiException)
                .bodyToMono(type));
    }

    private static <T> T exchange(Installation installation, Mono<T> call) {
        try {
            return call.block();
        } catch (WebClientRequestException e) {
            log.warn("Gitea unreachable for installation {}: {}", installation.getId(), e.getMessage());
            throw new GiteaApiException(0, "Gitea unreachable: " + e.getMessage(), e);
        }
    }

    private static Mono<GiteaApiException> toApiException(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new GiteaApiException(status, "Gitea API returned " + status + ": " + body, null));
    }

    static String apiUrl(Installation installation, String path) {
        String baseUrl = installation.getBaseUrl();
        if (baseUrl == null) {
            throw new InstallationConfigurationException("Installation " + installation.getId() + " has no base_url");
        }
        return stripTrailingSlash(baseUrl) + API_VERSION + path;
    }

    private static String bearer(Installation installation) {
        String token = installation.getAccessToken();
        if (token == null || token.isBlank()) {
            throw new InstallationConfigurationException("Installation " + installation.getId() + " has no access token");
        }
        return "Bearer " + token;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GiteaUser(long id, String login, @JsonProperty("avatar_url") String avatarUrl) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GiteaRepository(long id, @JsonProperty("full_name") String fullName,
                                  @JsonProperty("html_url") String htmlUrl) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GiteaIssue(long number, String title, String body,
                             @JsonProperty("html_url") String htmlUrl) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GiteaHook(long id) {}
}
