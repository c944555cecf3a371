package com.datahub.calgroup.client.impl;

import com.datahub.calgroup.client.GrouperApiClient;
import com.datahub.calgroup.exception.GrouperResponseParseException;
import com.datahub.calgroup.exception.GrouperTransportException;
import com.datahub.calgroup.model.dto.GrouperEndpoint;
import com.datahub.calgroup.model.dto.MemberIdentifier;
import com.datahub.calgroup.model.dto.ReconciliationJob;
import com.datahub.calgroup.model.dto.ReconciliationOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Grouper REST "add member" call in replace mode.
 * Request and response shapes follow the WsRestAddMemberRequest JSON samples of Grouper WS.
 */
@Slf4j
@Service
public class RestGrouperApiClient implements GrouperApiClient {

    static final MediaType GROUPER_JSON = MediaType.parseMediaType("text/x-json");
    static final String REQUEST_KEY = "WsRestAddMemberRequest";
    static final String PROBLEM_KEY = "WsRestResultProblem";
    static final String RESULTS_KEY = "WsAddMemberResults";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public RestGrouperApiClient(@Qualifier("grouperRestTemplate") RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public ReconciliationOutcome replaceMembers(GrouperEndpoint endpoint, ReconciliationJob job) {
        URI url = UriComponentsBuilder.fromHttpUrl(endpoint.baseUrl())
                .pathSegment("groups", job.groupName(), "members")
                .build()
                .encode()
                .toUri();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(GROUPER_JSON);
        headers.setBasicAuth(endpoint.username(), endpoint.password());
        String body = buildRequestBody(job);

        log.info("Sending {} members to {} (replaceAllExisting={})",
                job.members().size(), job.groupName(), job.replaceExisting());
        String responseBody;
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    url, HttpMethod.PUT, new HttpEntity<>(body, headers), String.class);
            responseBody = response.getBody();
        } catch (HttpStatusCodeException e) {
            // Grouper reports problems with an error status and a WsRestResultProblem body
            log.warn("Grouper returned {} for group {}", e.getStatusCode().value(), job.groupName());
            responseBody = e.getResponseBodyAsString();
            if (responseBody == null || responseBody.isBlank()) {
                throw new GrouperTransportException(
                        "Grouper returned " + e.getStatusCode().value() + " with no body for " + url, e);
            }
        } catch (RestClientException e) {
            throw new GrouperTransportException("Grouper request to " + url + " failed: " + e.getMessage(), e);
        }

        return toOutcome(job, responseBody, url);
    }

    String buildRequestBody(ReconciliationJob job) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode request = root.putObject(REQUEST_KEY);
        request.put("replaceAllExisting", job.replaceExisting() ? "T" : "F");
        ArrayNode lookups = request.putArray("subjectLookups");
        for (MemberIdentifier member : job.members()) {
            lookups.addObject().put(member.kind().getLookupKey(), member.value());
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize Grouper request", e);
        }
    }

    private ReconciliationOutcome toOutcome(ReconciliationJob job, String responseBody, URI url) {
        JsonNode out;
        try {
            out = objectMapper.readTree(responseBody == null ? "" : responseBody);
        } catch (JsonProcessingException e) {
            throw new GrouperResponseParseException("Grouper response from " + url + " is not valid JSON", e);
        }
        if (out == null || !out.isObject()) {
            throw new GrouperResponseParseException("Expected a JSON object from " + url);
        }
        if (out.has(PROBLEM_KEY)) {
            JsonNode meta = out.path(PROBLEM_KEY).path("resultMetadata");
            log.error("{} in Grouper output for {}: {}", PROBLEM_KEY, job.groupName(), meta);
            return ReconciliationOutcome.problem(job, meta.isMissingNode() ? null : meta);
        }
        JsonNode meta = out.path(RESULTS_KEY).path("resultMetadata");
        log.info("Grouper accepted membership of {} ({} members)", job.groupName(), job.members().size());
        return ReconciliationOutcome.succeeded(job, meta.isMissingNode() ? null : meta);
    }
}
