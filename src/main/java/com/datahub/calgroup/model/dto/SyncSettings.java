package com.datahub.calgroup.model.dto;

/**
 * Fully resolved settings for one reconciliation cycle. Built once at startup
 * and handed to every cycle, so nothing below the scheduler reads the environment.
 *
 * @param groupName explicit target group, or {@code null} to derive it from the hub URL
 * @param groupBase stem prepended to derived group names
 */
public record SyncSettings(
    HubEndpoint hub,
    GrouperEndpoint grouper,
    String groupName,
    String groupBase,
    boolean replaceExisting
) {}
