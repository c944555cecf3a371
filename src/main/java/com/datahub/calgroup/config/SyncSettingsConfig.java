package com.datahub.calgroup.config;

import com.datahub.calgroup.model.dto.GrouperEndpoint;
import com.datahub.calgroup.model.dto.HubEndpoint;
import com.datahub.calgroup.model.dto.SyncSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Resolves hub and directory settings, credentials included, once at startup.
 * Everything below the scheduler receives them through {@link SyncSettings}.
 */
@Slf4j
@Configuration
public class SyncSettingsConfig {

    @Value("${calgroup.hub.url}")
    private String hubUrl;

    @Value("${calgroup.hub.api-token}")
    private String hubApiToken;

    @Value("${calgroup.hub.page-size:0}")
    private int pageSize;

    @Value("${calgroup.grouper.base-url}")
    private String grouperBaseUrl;

    @Value("${calgroup.grouper.username}")
    private String grouperUsername;

    @Value("${calgroup.grouper.password}")
    private String grouperPassword;

    @Value("${calgroup.group-name:}")
    private String groupName;

    @Value("${calgroup.group-base:edu:berkeley:app:datahub:}")
    private String groupBase;

    @Value("${calgroup.replace-existing:true}")
    private boolean replaceExisting;

    @Bean
    public SyncSettings syncSettings() {
        if (!StringUtils.hasText(hubUrl)) {
            throw new IllegalStateException("calgroup.hub.url (JUPYTERHUB_API_URL) must be set");
        }
        if (!StringUtils.hasText(grouperBaseUrl)) {
            throw new IllegalStateException("calgroup.grouper.base-url (CALGROUP_BASE_URL) must be set");
        }
        SyncSettings settings = new SyncSettings(
                new HubEndpoint(stripTrailingSlash(hubUrl), hubApiToken, pageSize),
                new GrouperEndpoint(stripTrailingSlash(grouperBaseUrl), grouperUsername, grouperPassword),
                StringUtils.hasText(groupName) ? groupName : null,
                groupBase,
                replaceExisting);
        log.info("Sync settings resolved: hub={}, grouper={}, group={}, replaceExisting={}",
                settings.hub(), settings.grouper(),
                settings.groupName() != null ? settings.groupName() : "<derived from hub url>",
                settings.replaceExisting());
        return settings;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
