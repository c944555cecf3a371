package com.datahub.calgroup.model.dto;

import java.net.URI;

public record HubResponse(URI url, int status, String body) {}
