package com.datahub.calgroup.model.dto;

/**
 * Where and how to reach the hub API.
 *
 * @param pageSize page size hint sent as {@code limit}; 0 leaves it to the server
 */
public record HubEndpoint(String url, String apiToken, int pageSize) {

    @Override
    public String toString() {
        return "HubEndpoint[url=" + url + ", pageSize=" + pageSize + "]";
    }
}
