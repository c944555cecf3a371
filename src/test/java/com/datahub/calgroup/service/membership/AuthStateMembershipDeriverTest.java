package com.datahub.calgroup.service.membership;

import com.datahub.calgroup.client.HubApiClient;
import com.datahub.calgroup.exception.HubTransportException;
import com.datahub.calgroup.model.domain.SubjectKind;
import com.datahub.calgroup.model.dto.HubEndpoint;
import com.datahub.calgroup.model.dto.HubUser;
import com.datahub.calgroup.model.dto.MemberIdentifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthStateMembershipDeriver Tests")
class AuthStateMembershipDeriverTest {

    private static final HubEndpoint HUB = new HubEndpoint("https://datahub.berkeley.edu/hub/api", "token", 0);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private HubApiClient hubApiClient;

    @InjectMocks
    private AuthStateMembershipDeriver deriver;

    private static HubUser listed(String name, boolean admin) {
        return new HubUser(name, admin, null);
    }

    private static CompletableFuture<HubUser> detail(String name, String authStateJson) throws Exception {
        return CompletableFuture.completedFuture(
                new HubUser(name, false, authStateJson == null ? null : MAPPER.readTree(authStateJson)));
    }

    @Test
    @DisplayName("Should use the OAuth login id of each non-admin user")
    void shouldUseLoginIds() throws Exception {
        when(hubApiClient.getUser(HUB, "alice")).thenReturn(detail("alice", "{\"oauthUser\":{\"loginId\":\"123456\"}}"));
        when(hubApiClient.getUser(HUB, "carol")).thenReturn(detail("carol", "{\"oauthUser\":{\"loginId\":\"carol@berkeley.edu\"}}"));

        List<MemberIdentifier> members = deriver.derive(
                Stream.of(listed("alice", false), listed("bob", true), listed("carol", false)), HUB);

        assertThat(members).containsExactly(
                new MemberIdentifier("123456", SubjectKind.SUBJECT_ID),
                new MemberIdentifier("carol@berkeley.edu", SubjectKind.SUBJECT_IDENTIFIER));
        verify(hubApiClient, never()).getUser(eq(HUB), eq("bob"));
    }

    @Test
    @DisplayName("Should skip users whose auth state lacks a login id")
    void shouldSkipMissingLoginId() throws Exception {
        when(hubApiClient.getUser(HUB, "alice")).thenReturn(detail("alice", null));
        when(hubApiClient.getUser(HUB, "bob")).thenReturn(detail("bob", "{\"oauthUser\":{}}"));
        when(hubApiClient.getUser(HUB, "carol")).thenReturn(detail("carol", "{\"oauthUser\":\"not-an-object\"}"));
        when(hubApiClient.getUser(HUB, "dave")).thenReturn(detail("dave", "{\"oauthUser\":{\"loginId\":\"777\"}}"));

        List<MemberIdentifier> members = deriver.derive(Stream.of(
                listed("alice", false), listed("bob", false), listed("carol", false), listed("dave", false)), HUB);

        assertThat(members).extracting(MemberIdentifier::value).containsExactly("777");
    }

    @Test
    @DisplayName("Should not look up users without a name")
    void shouldSkipNamelessUsers() {
        List<MemberIdentifier> members = deriver.derive(Stream.of(listed(null, false)), HUB);

        assertThat(members).isEmpty();
        verify(hubApiClient, never()).getUser(eq(HUB), anyString());
    }

    @Test
    @DisplayName("Should abort when a lookup fails")
    void shouldPropagateLookupFailure() {
        when(hubApiClient.getUser(HUB, "alice"))
                .thenReturn(CompletableFuture.failedFuture(new HubTransportException("Hub returned 500")));

        assertThatThrownBy(() -> deriver.derive(Stream.of(listed("alice", false)), HUB))
                .isInstanceOf(HubTransportException.class)
                .hasMessageContaining("500");
    }
}
