package com.datahub.calgroup.service.membership;

import com.datahub.calgroup.model.dto.HubEndpoint;
import com.datahub.calgroup.model.dto.HubUser;
import com.datahub.calgroup.model.dto.MemberIdentifier;

import java.util.List;
import java.util.stream.Stream;

/**
 * Turns the hub's users into the directory members the group should have.
 *
 * Implementations drop admins, skip records they cannot map (with a log line,
 * never an exception) and keep record order. Duplicates are left in.
 * The active strategy is chosen with {@code calgroup.membership.strategy}.
 */
public interface MembershipDeriver {

    List<MemberIdentifier> derive(Stream<HubUser> users, HubEndpoint hub);
}
