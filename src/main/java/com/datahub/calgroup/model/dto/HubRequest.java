package com.datahub.calgroup.model.dto;

import org.springframework.http.HttpHeaders;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * A GET against the hub API. Headers are copied and frozen on construction,
 * so a request can be reused for follow-up pages with {@link #withUrl(URI)}.
 *
 * @param timeout per-request timeout, or {@code null} for the fetcher default
 */
public record HubRequest(URI url, HttpHeaders headers, Duration timeout) {

    public HubRequest {
        Objects.requireNonNull(url, "url");
        HttpHeaders copy = new HttpHeaders();
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = HttpHeaders.readOnlyHttpHeaders(copy);
    }

    public static HubRequest get(URI url, HttpHeaders headers) {
        return new HubRequest(url, headers, null);
    }

    public HubRequest withUrl(URI nextUrl) {
        return new HubRequest(nextUrl, headers, timeout);
    }

    public HubRequest withHeader(String name, String value) {
        HttpHeaders copy = new HttpHeaders();
        copy.putAll(headers);
        copy.set(name, value);
        return new HubRequest(url, copy, timeout);
    }

    public HubRequest withTimeout(Duration requestTimeout) {
        return new HubRequest(url, headers, requestTimeout);
    }
}
