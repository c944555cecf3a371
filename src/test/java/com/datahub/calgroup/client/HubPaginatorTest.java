package com.datahub.calgroup.client;

import com.datahub.calgroup.exception.HubResponseParseException;
import com.datahub.calgroup.exception.HubTransportException;
import com.datahub.calgroup.model.dto.HubRequest;
import com.datahub.calgroup.model.dto.HubResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("HubPaginator Tests")
class HubPaginatorTest {

    private static final String USERS = "https://datahub.berkeley.edu/hub/api/users";

    @Mock
    private BoundedFetcher fetcher;

    private HubPaginator paginator;
    private final Map<String, CompletableFuture<HubResponse>> pages = new HashMap<>();
    private final List<HubRequest> requests = new ArrayList<>();

    @BeforeEach
    void setUp() {
        paginator = new HubPaginator(fetcher, new ObjectMapper());
        when(fetcher.fetchAsync(any())).thenAnswer(invocation -> {
            HubRequest request = invocation.getArgument(0);
            requests.add(request);
            CompletableFuture<HubResponse> page = pages.get(request.url().toString());
            if (page == null) {
                throw new AssertionError("unexpected request " + request.url());
            }
            return page;
        });
    }

    private void page(String url, String body) {
        pages.put(url, CompletableFuture.completedFuture(new HubResponse(URI.create(url), 200, body)));
    }

    private static HubRequest seed() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "token abc");
        return HubRequest.get(URI.create(USERS), headers);
    }

    private static List<String> names(Stream<JsonNode> items) {
        return items.map(item -> item.path("name").asText()).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should yield a plain list as is with a single fetch")
    void shouldYieldPlainListWithOneFetch() {
        page(USERS, "[{\"name\":\"carol\",\"admin\":false},{\"name\":\"dave\",\"admin\":false}]");

        List<String> names = names(paginator.fetchPaginated(seed()));

        assertThat(names).containsExactly("carol", "dave");
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).headers().getFirst(HttpHeaders.ACCEPT))
                .isEqualTo(HubPaginator.PAGINATION_MEDIA_TYPE);
        assertThat(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("token abc");
    }

    @Test
    @DisplayName("Should follow next links across pages in order")
    void shouldFollowPagesInOrder() {
        page(USERS, "{\"items\":[{\"name\":\"a\"},{\"name\":\"b\"}],"
                + "\"_pagination\":{\"offset\":0,\"limit\":2,\"next\":{\"offset\":2,\"limit\":2,\"url\":\"" + USERS + "?offset=2&limit=2\"}}}");
        page(USERS + "?offset=2&limit=2", "{\"items\":[{\"name\":\"c\"},{\"name\":\"d\"},{\"name\":\"e\"}],"
                + "\"_pagination\":{\"next\":{\"url\":\"" + USERS + "?offset=5&limit=2\"}}}");
        page(USERS + "?offset=5&limit=2", "{\"items\":[{\"name\":\"f\"}],\"_pagination\":{\"next\":null}}");

        List<String> names = names(paginator.fetchPaginated(seed()));

        assertThat(names).containsExactly("a", "b", "c", "d", "e", "f");
        assertThat(requests).extracting(r -> r.url().toString())
                .containsExactly(USERS, USERS + "?offset=2&limit=2", USERS + "?offset=5&limit=2");
        assertThat(requests).allSatisfy(r ->
                assertThat(r.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("token abc"));
    }

    @Test
    @DisplayName("Should request the next page before the current page is consumed")
    void shouldPipelineNextPage() {
        page(USERS, "{\"items\":[{\"name\":\"a\"},{\"name\":\"b\"}],\"_pagination\":{\"next\":{\"url\":\"" + USERS + "?offset=2\"}}}");
        page(USERS + "?offset=2", "{\"items\":[{\"name\":\"c\"}],\"_pagination\":{\"next\":null}}");

        Stream<JsonNode> items = paginator.fetchPaginated(seed());
        assertThat(requests).hasSize(1);

        Iterator<JsonNode> iterator = items.iterator();
        assertThat(iterator.next().path("name").asText()).isEqualTo("a");
        assertThat(requests).hasSize(2);
    }

    @Test
    @DisplayName("Should stop when the pagination block has no next key")
    void shouldStopWithoutNextKey() {
        page(USERS, "{\"items\":[{\"name\":\"a\"}],\"_pagination\":{\"offset\":0,\"limit\":200,\"total\":1}}");

        assertThat(names(paginator.fetchPaginated(seed()))).containsExactly("a");
        assertThat(requests).hasSize(1);
    }

    @Test
    @DisplayName("Should yield nothing for an empty last page")
    void shouldHandleEmptyPage() {
        page(USERS, "{\"items\":[],\"_pagination\":{\"next\":null}}");

        assertThat(names(paginator.fetchPaginated(seed()))).isEmpty();
    }

    @Test
    @DisplayName("Should fail on an object without an items list")
    void shouldFailOnUnexpectedShape() {
        page(USERS, "{\"users\":[{\"name\":\"a\"}]}");

        assertThatThrownBy(() -> names(paginator.fetchPaginated(seed())))
                .isInstanceOf(HubResponseParseException.class);
    }

    @Test
    @DisplayName("Should fail on a body that is not JSON")
    void shouldFailOnInvalidJson() {
        page(USERS, "<html>502 Bad Gateway</html>");

        assertThatThrownBy(() -> names(paginator.fetchPaginated(seed())))
                .isInstanceOf(HubResponseParseException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    @DisplayName("Should fail on a next pointer without url")
    void shouldFailOnNextWithoutUrl() {
        page(USERS, "{\"items\":[{\"name\":\"a\"}],\"_pagination\":{\"next\":{\"offset\":1}}}");

        assertThatThrownBy(() -> names(paginator.fetchPaginated(seed())))
                .isInstanceOf(HubResponseParseException.class);
    }

    @Test
    @DisplayName("Should surface a failed page fetch after yielding earlier pages")
    void shouldPropagateTransportErrorMidStream() {
        page(USERS, "{\"items\":[{\"name\":\"a\"}],\"_pagination\":{\"next\":{\"url\":\"" + USERS + "?offset=1\"}}}");
        pages.put(USERS + "?offset=1", CompletableFuture.failedFuture(new HubTransportException("timed out")));

        List<String> seen = new ArrayList<>();
        assertThatThrownBy(() -> paginator.fetchPaginated(seed()).forEach(item -> seen.add(item.path("name").asText())))
                .isInstanceOf(HubTransportException.class)
                .hasMessage("timed out");
        assertThat(seen).containsExactly("a");
    }

    @Test
    @DisplayName("Should fail with a parse error on a malformed next url")
    void shouldFailOnMalformedNextUrl() {
        page(USERS, "{\"items\":[{\"name\":\"a\"}],\"_pagination\":{\"next\":{\"url\":\"https://datahub berkeley/users?offset=1\"}}}");

        assertThatThrownBy(() -> names(paginator.fetchPaginated(seed())))
                .isInstanceOf(HubResponseParseException.class)
                .hasMessageContaining("Malformed pagination 'next' url");
    }

    @Test
    @DisplayName("Should cancel the pipelined page request when the stream is closed early")
    void shouldCancelPendingPageOnClose() {
        page(USERS, "{\"items\":[{\"name\":\"a\"},{\"name\":\"b\"}],\"_pagination\":{\"next\":{\"url\":\"" + USERS + "?offset=2\"}}}");
        CompletableFuture<HubResponse> secondPage = new CompletableFuture<>();
        pages.put(USERS + "?offset=2", secondPage);

        try (Stream<JsonNode> items = paginator.fetchPaginated(seed())) {
            assertThat(items.iterator().next().path("name").asText()).isEqualTo("a");
            assertThat(requests).hasSize(2);
        }

        assertThat(secondPage).isCancelled();
    }
}
