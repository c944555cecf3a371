package com.datahub.calgroup.model.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A user as returned by the hub's user API. Only the fields the sync needs are kept.
 * A record with no usable name keeps {@code name == null} and is skipped later
 * instead of failing the cycle.
 */
public record HubUser(String name, boolean admin, JsonNode authState) {

    public static HubUser fromJson(JsonNode node) {
        JsonNode nameNode = node.path("name");
        String name = nameNode.isTextual() ? nameNode.asText() : null;
        boolean admin = node.path("admin").asBoolean(false);
        JsonNode authState = node.hasNonNull("auth_state") ? node.get("auth_state") : node.get("authState");
        if (authState != null && authState.isNull()) {
            authState = null;
        }
        return new HubUser(name, admin, authState);
    }
}
