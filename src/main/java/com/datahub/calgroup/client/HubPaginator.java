package com.datahub.calgroup.client;

import com.datahub.calgroup.exception.HubResponseParseException;
import com.datahub.calgroup.model.dto.HubRequest;
import com.datahub.calgroup.model.dto.HubResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks a hub list endpoint page by page and exposes every item as one lazy stream.
 *
 * Handles both response shapes the hub can send: a bare JSON list (older hubs,
 * no pagination) and the paginated envelope
 * {@code {"items": [...], "_pagination": {"next": {"url": ...} | null}}}.
 * The request for the next page goes out as soon as the current page is parsed,
 * so it overlaps with consumption of the current items.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HubPaginator {

    public static final String PAGINATION_MEDIA_TYPE = "application/jupyterhub-pagination+json";

    private final BoundedFetcher fetcher;
    private final ObjectMapper objectMapper;

    /**
     * Returns the items of every page in page order. The stream can be consumed
     * only once; the first request is issued immediately. Closing the stream
     * cancels a page request that has not been consumed yet.
     */
    public Stream<JsonNode> fetchPaginated(HubRequest seed) {
        HubRequest request = seed.withHeader(HttpHeaders.ACCEPT, PAGINATION_MEDIA_TYPE);
        PageIterator pages = new PageIterator(request);
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(pages, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(pages::cancel);
    }

    private final class PageIterator implements Iterator<JsonNode> {

        private final URI firstUrl;
        private HubRequest request;
        private CompletableFuture<HubResponse> pending;
        private Iterator<JsonNode> items = Collections.emptyIterator();
        private int pageNo = 1;
        private int itemCount;
        private boolean done;

        PageIterator(HubRequest request) {
            this.firstUrl = request.url();
            this.request = request;
            this.pending = fetcher.fetchAsync(request);
        }

        @Override
        public boolean hasNext() {
            while (!items.hasNext()) {
                if (pending == null) {
                    if (!done) {
                        done = true;
                        log.debug("Fetched {} items from {} in {} pages", itemCount, firstUrl, pageNo);
                    }
                    return false;
                }
                loadPage();
            }
            return true;
        }

        @Override
        public JsonNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            itemCount++;
            return items.next();
        }

        void cancel() {
            if (pending != null && pending.cancel(true)) {
                log.debug("Cancelled pending page request for {}", request.url());
            }
            pending = null;
        }

        private void loadPage() {
            HubResponse response = BoundedFetcher.await(pending);
            pending = null;
            JsonNode model = parse(response);

            if (model.isArray()) {
                // pre-2.0 hub: the whole list, no pagination
                items = model.elements();
                return;
            }
            if (!model.isObject() || !model.path("items").isArray()) {
                throw new HubResponseParseException(
                        "Expected a JSON list or an object with an 'items' list from " + response.url());
            }
            JsonNode next = model.path("_pagination").path("next");
            if (next.isObject()) {
                JsonNode nextUrl = next.path("url");
                if (!nextUrl.isTextual() || nextUrl.asText().isBlank()) {
                    throw new HubResponseParseException("Pagination 'next' without a url in response from " + response.url());
                }
                URI nextUri;
                try {
                    nextUri = URI.create(nextUrl.asText());
                } catch (IllegalArgumentException e) {
                    throw new HubResponseParseException(
                            "Malformed pagination 'next' url '" + nextUrl.asText() + "' in response from " + response.url(), e);
                }
                pageNo++;
                log.info("Fetching page {} {}", pageNo, nextUri);
                request = request.withUrl(nextUri);
                pending = fetcher.fetchAsync(request);
            } else if (!next.isMissingNode() && !next.isNull()) {
                throw new HubResponseParseException("Unexpected pagination 'next' value in response from " + response.url());
            }
            items = model.path("items").elements();
        }

        private JsonNode parse(HubResponse response) {
            String body = response.body();
            if (body == null || body.isBlank()) {
                throw new HubResponseParseException("Empty response body from " + response.url());
            }
            try {
                return objectMapper.readTree(body);
            } catch (JsonProcessingException e) {
                throw new HubResponseParseException("Response from " + response.url() + " is not valid JSON", e);
            }
        }
    }
}
