package com.datahub.calgroup.model.dto;

public record GrouperEndpoint(String baseUrl, String username, String password) {

    @Override
    public String toString() {
        return "GrouperEndpoint[baseUrl=" + baseUrl + ", username=" + username + "]";
    }
}
