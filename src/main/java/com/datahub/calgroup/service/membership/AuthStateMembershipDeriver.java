package com.datahub.calgroup.service.membership;

import com.datahub.calgroup.client.BoundedFetcher;
import com.datahub.calgroup.client.HubApiClient;
import com.datahub.calgroup.model.dto.HubEndpoint;
import com.datahub.calgroup.model.dto.HubUser;
import com.datahub.calgroup.model.dto.MemberIdentifier;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Uses the login id the hub's OAuth authenticator stored for each user
 * ({@code auth_state.oauthUser.loginId}).
 *
 * The user list does not carry auth state, so every non-admin user is looked up
 * individually. Lookups run concurrently through the same bounded fetcher as the
 * list pages; results are still taken in list order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "calgroup.membership.strategy", havingValue = "auth-state")
public class AuthStateMembershipDeriver implements MembershipDeriver {

    private final HubApiClient hubApiClient;

    @Override
    public List<MemberIdentifier> derive(Stream<HubUser> users, HubEndpoint hub) {
        List<HubUser> candidates = users
                .filter(user -> !user.admin())
                .filter(user -> {
                    if (user.name() == null || user.name().isBlank()) {
                        log.warn("Skipping hub user without a name");
                        return false;
                    }
                    return true;
                })
                .collect(Collectors.toList());

        List<CompletableFuture<HubUser>> lookups = candidates.stream()
                .map(user -> hubApiClient.getUser(hub, user.name()))
                .collect(Collectors.toList());

        List<MemberIdentifier> members = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            HubUser detail = BoundedFetcher.await(lookups.get(i));
            String loginId = loginId(detail);
            if (loginId == null) {
                log.warn("No auth_state.oauthUser.loginId for hub user {}, skipping", candidates.get(i).name());
                continue;
            }
            members.add(MemberIdentifier.classify(loginId));
        }
        log.info("Derived {} members from auth state of {} users", members.size(), candidates.size());
        return members;
    }

    static String loginId(HubUser user) {
        if (user == null || user.authState() == null) {
            return null;
        }
        JsonNode loginId = user.authState().path("oauthUser").path("loginId");
        if (loginId.isTextual() && !loginId.asText().isBlank()) {
            return loginId.asText();
        }
        if (loginId.isNumber()) {
            return loginId.asText();
        }
        return null;
    }
}
