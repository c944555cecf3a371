package com.datahub.calgroup.client;

import com.datahub.calgroup.exception.HubResponseParseException;
import com.datahub.calgroup.model.dto.HubEndpoint;
import com.datahub.calgroup.model.dto.HubRequest;
import com.datahub.calgroup.model.dto.HubResponse;
import com.datahub.calgroup.model.dto.HubUser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * The hub's user endpoints, authenticated with the hub API token.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HubApiClient {

    private final HubPaginator paginator;
    private final BoundedFetcher fetcher;
    private final ObjectMapper objectMapper;

    /**
     * Every user on the hub, fetched lazily page by page.
     */
    public Stream<HubUser> listUsers(HubEndpoint hub) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(hub.url()).path("/users");
        if (hub.pageSize() > 0) {
            uri.queryParam("limit", hub.pageSize());
        }
        URI usersUrl = uri.build().toUri();
        log.info("Listing hub users from {}", usersUrl);
        return paginator.fetchPaginated(HubRequest.get(usersUrl, authHeaders(hub)))
                .map(HubUser::fromJson);
    }

    /**
     * Full model of one user, including {@code auth_state} when the token may read it.
     */
    public CompletableFuture<HubUser> getUser(HubEndpoint hub, String name) {
        URI userUrl = UriComponentsBuilder.fromHttpUrl(hub.url())
                .pathSegment("users", name)
                .build()
                .encode()
                .toUri();
        return fetcher.fetchAsync(HubRequest.get(userUrl, authHeaders(hub)))
                .thenApply(this::toUser);
    }

    private HubUser toUser(HubResponse response) {
        try {
            JsonNode node = objectMapper.readTree(response.body() == null ? "" : response.body());
            if (node == null || !node.isObject()) {
                throw new HubResponseParseException("Expected a user object from " + response.url());
            }
            return HubUser.fromJson(node);
        } catch (JsonProcessingException e) {
            throw new HubResponseParseException("User response from " + response.url() + " is not valid JSON", e);
        }
    }

    private static HttpHeaders authHeaders(HubEndpoint hub) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "token " + hub.apiToken());
        return headers;
    }
}
