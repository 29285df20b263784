package com.rewardradar.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Rewards API client on WebClient. Calls block on the caller's thread; interrupting that thread
 * cancels the exchange and releases the connection.
 */
@Slf4j
public class WebClientRewardsApiClient implements RewardsApiClient {

    private static final int MAX_LOGGED_BODY = 500;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String authUrl;
    private final String graphqlUrl;
    private final Duration requestTimeout;

    public WebClientRewardsApiClient(WebClient.Builder builder, ObjectMapper objectMapper,
                                     String authUrl, String graphqlUrl, Duration requestTimeout) {
        this.webClient = builder.build();
        this.objectMapper = objectMapper;
        this.authUrl = authUrl;
        this.graphqlUrl = graphqlUrl;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String login(Credentials credentials) {
        credentials.validate();
        Map<String, Object> body = Map.of("email", credentials.email(), "password", credentials.password());
        String json = blockFor("login", webClient.post()
                .uri(authUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(this::readLoginResponse));
        JsonNode token = readTree(json).path("token");
        if (!token.isTextual() || token.asText().isBlank()) {
            throw new CredentialsInvalidException("Token not received from API");
        }
        return token.asText();
    }

    @Override
    public GridRewardsPeriod fetchGridRewards(AccessToken token, String homeId, Instant from, Instant to) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("homeId", homeId);
        variables.put("fromDate", from.toString());
        variables.put("toDate", to.toString());
        JsonNode data = graphql(token, GraphQlQueries.GRID_REWARDS, variables);
        JsonNode period = data.path("me").path("home").path("gridRewardsHistoryPeriod");
        if (period.isMissingNode() || period.isNull()) {
            throw new RewardsQueryException("gridRewardsHistoryPeriod missing for " + from + " - " + to);
        }
        return new GridRewardsPeriod(
                decimalOrNull(period.path("vehicleRewards")),
                decimalOrNull(period.path("batteryRewards")),
                decimalOrNull(period.path("totalReward")),
                period.path("currency").isTextual() ? period.path("currency").asText() : null,
                instantOr(period.path("from"), from),
                instantOr(period.path("to"), to));
    }

    @Override
    public List<Home> fetchHomes(AccessToken token) {
        JsonNode homes = graphql(token, GraphQlQueries.HOMES, null).path("me").path("homes");
        if (!homes.isArray()) {
            throw new RewardsQueryException("homes is not a list");
        }
        List<Home> result = new ArrayList<>();
        for (JsonNode home : homes) {
            String id = home.path("id").asText(null);
            if (id == null || id.isBlank()) {
                log.warn("Skipping home without id");
                continue;
            }
            result.add(new Home(id,
                    home.path("timeZone").asText(null),
                    home.path("hasSmartMeterCapabilities").asBoolean(false),
                    home.path("hasSignedEnergyDeal").asBoolean(false),
                    home.path("hasConsumption").asBoolean(false)));
        }
        return result;
    }

    @Override
    public List<Device> fetchDevices(AccessToken token, String homeId) {
        JsonNode gizmos = graphql(token, GraphQlQueries.DEVICES, Map.of("homeId", homeId))
                .path("me").path("home").path("gizmos");
        if (!gizmos.isArray()) {
            throw new RewardsQueryException("gizmos is not a list");
        }
        List<Device> result = new ArrayList<>();
        for (JsonNode gizmo : gizmos) {
            String type = gizmo.path("type").asText(null);
            if (type == null || type.isBlank()) {
                log.warn("Skipping gizmo without type");
                continue;
            }
            result.add(new Device(gizmo.path("id").asText(null), gizmo.path("title").asText(null),
                    type, gizmo.path("isHidden").asBoolean(false)));
        }
        return result;
    }

    private JsonNode graphql(AccessToken token, String query, Map<String, Object> variables) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        if (variables != null && !variables.isEmpty()) {
            payload.put("variables", variables);
        }
        String json = blockFor("graphql", webClient.post()
                .uri(graphqlUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token.value())
                .bodyValue(payload)
                .exchangeToMono(this::readQueryResponse));
        JsonNode root = readTree(json);
        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            List<String> messages = new ArrayList<>();
            errors.forEach(e -> messages.add(e.path("message").asText(e.toString())));
            throw new RewardsQueryException("GraphQL query failed: " + String.join(", ", messages));
        }
        return root.path("data");
    }

    private Mono<String> readLoginResponse(ClientResponse response) {
        int status = response.statusCode().value();
        if (status == 400 || status == 401) {
            return response.releaseBody()
                    .then(Mono.error(new CredentialsInvalidException("Authentication failed: invalid email or password")));
        }
        return readQueryResponse(response);
    }

    private Mono<String> readQueryResponse(ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        if (status.value() == 401) {
            return response.releaseBody()
                    .then(Mono.error(new UnauthorizedException("Token rejected (401)")));
        }
        if (status.value() == 429) {
            Duration retryAfter = parseRetryAfter(response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER));
            return response.releaseBody()
                    .then(Mono.error(new RemoteRateLimitedException("Rate limited by API (429)", retryAfter)));
        }
        if (status.isError()) {
            return response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .flatMap(body -> {
                        log.warn("Request failed - status {}, body: {}", status.value(), abbreviate(body));
                        RewardsApiException error = status.is5xxServerError()
                                ? new TransientApiException("Server error (" + status.value() + ")")
                                : new RewardsQueryException("Request failed (" + status.value() + ")");
                        return Mono.<String>error(error);
                    });
        }
        return response.bodyToMono(String.class).defaultIfEmpty("");
    }

    private String blockFor(String operation, Mono<String> call) {
        try {
            return call
                    .timeout(requestTimeout)
                    .onErrorMap(TimeoutException.class,
                            e -> new TransientApiException(operation + " timed out after " + requestTimeout, e))
                    .onErrorMap(WebClientRequestException.class,
                            e -> new TransientApiException(operation + " network error: " + e.getMessage(), e))
                    .block();
        } catch (RewardsApiException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new FetchCancelledException(operation + " interrupted", cause);
            }
            throw new TransientApiException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            throw new RewardsQueryException("Empty response body");
        }
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            throw new RewardsQueryException("Unparseable response body", e);
        }
    }

    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            double seconds = Double.parseDouble(header.trim());
            return seconds < 0 ? null : Duration.ofMillis(Math.round(seconds * 1000));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static BigDecimal decimalOrNull(JsonNode node) {
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Instant instantOr(JsonNode node, Instant fallback) {
        if (!node.isTextual()) {
            return fallback;
        }
        try {
            return OffsetDateTime.parse(node.asText()).toInstant();
        } catch (DateTimeParseException e) {
            return fallback;
        }
    }

    private static String abbreviate(String body) {
        return body.length() <= MAX_LOGGED_BODY ? body : body.substring(0, MAX_LOGGED_BODY) + "...";
    }
}
