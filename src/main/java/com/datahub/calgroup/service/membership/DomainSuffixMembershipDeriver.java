package com.datahub.calgroup.service.membership;

import com.datahub.calgroup.model.dto.HubEndpoint;
import com.datahub.calgroup.model.dto.HubUser;
import com.datahub.calgroup.model.dto.MemberIdentifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Uses the hub user name as the member, qualified with the campus domain.
 *
 * <ul>
 *   <li>{@code alice} becomes {@code alice@berkeley.edu}</li>
 *   <li>{@code alice@berkeley.edu} is kept as is</li>
 *   <li>{@code alice@gmail.com} is a foreign address and is skipped</li>
 * </ul>
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "calgroup.membership.strategy", havingValue = "domain-suffix", matchIfMissing = true)
public class DomainSuffixMembershipDeriver implements MembershipDeriver {

    private final String domain;

    public DomainSuffixMembershipDeriver(@Value("${calgroup.membership.domain:berkeley.edu}") String domain) {
        this.domain = domain;
    }

    @Override
    public List<MemberIdentifier> derive(Stream<HubUser> users, HubEndpoint hub) {
        List<MemberIdentifier> members = new ArrayList<>();
        AtomicInteger admins = new AtomicInteger(0);
        AtomicInteger skipped = new AtomicInteger(0);
        users.forEach(user -> {
            if (user.admin()) {
                admins.incrementAndGet();
                return;
            }
            Optional<String> identifier = qualify(user.name());
            if (identifier.isEmpty()) {
                skipped.incrementAndGet();
                return;
            }
            members.add(MemberIdentifier.classify(identifier.get()));
        });
        log.info("Derived {} members ({} admins dropped, {} users skipped)", members.size(), admins.get(), skipped.get());
        return members;
    }

    Optional<String> qualify(String name) {
        if (name == null || name.isBlank()) {
            log.warn("Skipping hub user without a name");
            return Optional.empty();
        }
        if (name.contains("@" + domain)) {
            return Optional.of(name);
        }
        if (name.contains("@")) {
            log.warn("Non-{} email, skipping: {}", domain, name);
            return Optional.empty();
        }
        return Optional.of(name + "@" + domain);
    }
}
