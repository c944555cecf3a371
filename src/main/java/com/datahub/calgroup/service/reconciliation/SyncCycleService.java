package com.datahub.calgroup.service.reconciliation;

import com.datahub.calgroup.client.GrouperApiClient;
import com.datahub.calgroup.client.HubApiClient;
import com.datahub.calgroup.model.domain.CycleStatus;
import com.datahub.calgroup.model.dto.CycleResult;
import com.datahub.calgroup.model.dto.HubUser;
import com.datahub.calgroup.model.dto.MemberIdentifier;
import com.datahub.calgroup.model.dto.ReconciliationJob;
import com.datahub.calgroup.model.dto.ReconciliationOutcome;
import com.datahub.calgroup.model.dto.SyncSettings;
import com.datahub.calgroup.service.membership.MembershipDeriver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * One full reconciliation: read every hub user, work out the members, and
 * replace the group's membership with them.
 *
 * Nothing is remembered between cycles; each one recomputes the whole set.
 * Transport and parse failures propagate as {@code SyncException}s and abort
 * the cycle before anything is written to the directory.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncCycleService {

    private final HubApiClient hubApiClient;
    private final MembershipDeriver membershipDeriver;
    private final GrouperApiClient grouperApiClient;
    private final GroupNameResolver groupNameResolver;

    public CycleResult runCycle(SyncSettings settings) {
        Instant startedAt = Instant.now();

        Optional<String> groupName = groupNameResolver.resolve(settings);
        if (groupName.isEmpty()) {
            return CycleResult.skipped(null, "No target group for hub " + settings.hub().url());
        }

        // 1. Fetch users and derive members
        log.info("📥 Fetching hub users from {}", settings.hub().url());
        AtomicInteger usersFetched = new AtomicInteger(0);
        List<MemberIdentifier> derived;
        try (Stream<HubUser> users = hubApiClient.listUsers(settings.hub())) {
            derived = membershipDeriver.derive(users.peek(user -> usersFetched.incrementAndGet()), settings.hub());
        }
        List<MemberIdentifier> members = deduplicate(derived);
        if (members.size() < derived.size()) {
            log.info("Dropped {} duplicate members", derived.size() - members.size());
        }
        log.info("Found {} members to add to {} from {} hub users", members.size(), groupName.get(), usersFetched.get());

        // 2. Replace the group's membership
        ReconciliationJob job = new ReconciliationJob(groupName.get(), members, settings.replaceExisting());
        ReconciliationOutcome outcome = grouperApiClient.replaceMembers(settings.grouper(), job);

        CycleStatus status = outcome.success() ? CycleStatus.SUCCEEDED : CycleStatus.DIRECTORY_PROBLEM;
        String message = outcome.success()
                ? "Membership replaced"
                : "Directory reported a problem: " + outcome.resultMetadata();
        return new CycleResult(status, groupName.get(), usersFetched.get(), members.size(),
                startedAt, Instant.now(), message);
    }

    /**
     * Keeps the first occurrence of every identifier value, in order.
     */
    static List<MemberIdentifier> deduplicate(List<MemberIdentifier> members) {
        Map<String, MemberIdentifier> unique = new LinkedHashMap<>();
        for (MemberIdentifier member : members) {
            unique.putIfAbsent(member.value(), member);
        }
        return new ArrayList<>(unique.values());
    }
}
