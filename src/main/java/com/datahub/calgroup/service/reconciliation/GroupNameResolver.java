package com.datahub.calgroup.service.reconciliation;

import com.datahub.calgroup.model.dto.SyncSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Optional;

/**
 * Picks the CalGroups group a hub syncs into.
 *
 * Without an explicit group name the hub's namespace (first label of its host,
 * e.g. {@code datahub} or {@code data100}) decides: {@code datahub} maps to
 * {@code <base>datahub-users}, any other namespace {@code ns} to
 * {@code <base>datahub-ns-users}. Staging hubs are never synced.
 */
@Slf4j
@Component
public class GroupNameResolver {

    private static final String MAIN_NAMESPACE = "datahub";

    public Optional<String> resolve(SyncSettings settings) {
        if (settings.groupName() != null) {
            return Optional.of(settings.groupName());
        }
        String namespace = namespaceOf(settings.hub().url());
        if (namespace.contains("staging")) {
            log.info("Hub namespace {} is a staging hub, not syncing", namespace);
            return Optional.empty();
        }
        if (MAIN_NAMESPACE.equals(namespace)) {
            return Optional.of(settings.groupBase() + "datahub-users");
        }
        return Optional.of(settings.groupBase() + "datahub-" + namespace + "-users");
    }

    static String namespaceOf(String hubUrl) {
        String host = URI.create(hubUrl).getHost();
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Cannot derive a namespace from hub url " + hubUrl);
        }
        int dot = host.indexOf('.');
        return dot < 0 ? host : host.substring(0, dot);
    }
}
