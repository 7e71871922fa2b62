package com.worksuite.accessservice;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.worksuite.security.credential.TokenIssuer;
import com.worksuite.security.identity.Identity;
import com.worksuite.security.rbac.Action;
import com.worksuite.security.rbac.Module;
import com.worksuite.security.rbac.Role;
import com.worksuite.security.tenant.PlanType;
import com.worksuite.security.tenant.Workspace;
import com.worksuite.security.tenant.WorkspaceRole;
import com.worksuite.security.tenant.WorkspaceStatus;
import com.worksuite.security.testing.InMemoryIdentityStore;
import com.worksuite.security.testing.InMemoryRoleStore;
import com.worksuite.security.testing.InMemoryWorkspaceStore;
import com.worksuite.workgraph.testing.InMemoryTaskLinkStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end requests through the filters, controllers and engine, over the in-memory stores.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Access service")
class AccessServiceApplicationTest {

    private static final long USER_ID = 10L;
    private static final long OTHER_OWNER_ID = 99L;
    private static final long MANAGER_ROLE_ID = 3L;
    private static final long ACTIVE_WORKSPACE = 100L;
    private static final long EXPIRED_WORKSPACE = 200L;
    private static final long FOREIGN_WORKSPACE = 300L;

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private TokenIssuer tokenIssuer;
    @Autowired private InMemoryIdentityStore identities;
    @Autowired private InMemoryRoleStore roles;
    @Autowired private InMemoryWorkspaceStore workspaces;
    @Autowired private InMemoryTaskLinkStore links;

    @BeforeEach
    void seed() {
        identities.add(
                new Identity(
                        USER_ID, "mia", "mia@worksuite.test", "Mia", true, "manager", null, false, true, null));
        roles.addRole(new Role(MANAGER_ROLE_ID, "manager", "Manager", true))
                .grant(MANAGER_ROLE_ID, Module.PROJECTS, Action.VIEW)
                .grant(MANAGER_ROLE_ID, Module.PROJECTS, Action.EDIT);
        workspaces
                .add(workspace(ACTIVE_WORKSPACE, OTHER_OWNER_ID, "2100-01-01T00:00:00Z"))
                .add(workspace(EXPIRED_WORKSPACE, USER_ID, "2020-01-01T00:00:00Z"))
                .add(workspace(FOREIGN_WORKSPACE, OTHER_OWNER_ID, "2100-01-01T00:00:00Z"))
                .addMember(ACTIVE_WORKSPACE, USER_ID, WorkspaceRole.MEMBER, Instant.parse("2024-01-01T00:00:00Z"));
        for (long task = 1001; task <= 1010; task++) {
            links.addTask(task, ACTIVE_WORKSPACE);
        }
        links.addTask(2001, EXPIRED_WORKSPACE).addTask(2002, EXPIRED_WORKSPACE);
    }

    @Test
    @DisplayName("actuator health needs no credential")
    void healthIsPublic() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }

    @Nested
    @DisplayName("GET /api/v1/auth/me")
    class Me {

        @Test
        @DisplayName("without a credential is 401 with a problem body")
        void missingCredential() throws Exception {
            mockMvc.perform(get("/api/v1/auth/me"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(header().exists("X-Correlation-ID"))
                    .andExpect(jsonPath("$.code").value("missing_credential"))
                    .andExpect(jsonPath("$.correlationId").exists());
        }

        @Test
        @DisplayName("with a forged credential is 401 invalid_credential")
        void invalidCredential() throws Exception {
            mockMvc.perform(get("/api/v1/auth/me").header("Authorization", "Bearer not.a.token"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.code").value("invalid_credential"));
        }

        @Test
        @DisplayName("resolves the latest membership, the label's role and its permissions")
        void resolvedContext() throws Exception {
            mockMvc.perform(get("/api/v1/auth/me").header("Authorization", bearer(null)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.userId").value(USER_ID))
                    .andExpect(jsonPath("$.role").value("manager"))
                    .andExpect(jsonPath("$.workspaceId").value(ACTIVE_WORKSPACE))
                    .andExpect(jsonPath("$.workspaceRole").value("member"))
                    .andExpect(jsonPath("$.permissions", hasItem("projects.edit")))
                    .andExpect(jsonPath("$.subscription.active").value(true));
        }

        @Test
        @DisplayName("an owned workspace with a lapsed trial resolves but reports the trial state")
        void expiredTrialContext() throws Exception {
            mockMvc.perform(get("/api/v1/auth/me").header("Authorization", bearer(EXPIRED_WORKSPACE)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.workspaceId").value(EXPIRED_WORKSPACE))
                    .andExpect(jsonPath("$.subscription.active").value(false))
                    .andExpect(jsonPath("$.subscription.reason").value("trial_expired"))
                    .andExpect(jsonPath("$.subscription.trialEndsAt").value("2020-01-01T00:00:00Z"));
        }
    }

    @Nested
    @DisplayName("POST /api/v1/workspaces/{id}/token")
    class SwitchWorkspace {

        @Test
        @DisplayName("a member workspace yields a token scoped to it")
        void switchesIntoOwnedWorkspace() throws Exception {
            MvcResult result =
                    mockMvc.perform(
                                    post("/api/v1/workspaces/{id}/token", EXPIRED_WORKSPACE)
                                            .header("Authorization", bearer(null)))
                            .andExpect(status().isOk())
                            .andExpect(jsonPath("$.workspaceId").value(EXPIRED_WORKSPACE))
                            .andExpect(jsonPath("$.expiresIn").value(604800))
                            .andReturn();
            String token = objectMapper.readTree(result.getResponse().getContentAsString()).get("token").asText();

            mockMvc.perform(get("/api/v1/auth/me").header("Authorization", "Bearer " + token))
                    .andExpect(jsonPath("$.workspaceId").value(EXPIRED_WORKSPACE));
        }

        @Test
        @DisplayName("a foreign workspace is 403")
        void foreignWorkspace() throws Exception {
            mockMvc.perform(
                            post("/api/v1/workspaces/{id}/token", FOREIGN_WORKSPACE)
                                    .header("Authorization", bearer(null)))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.code").value("workspace_access_denied"));
        }

        @Test
        @DisplayName("an unknown workspace is 404")
        void unknownWorkspace() throws Exception {
            mockMvc.perform(post("/api/v1/workspaces/{id}/token", 404L).header("Authorization", bearer(null)))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("workspace_not_found"));
        }
    }

    @Nested
    @DisplayName("task links")
    class TaskLinks {

        @Test
        @DisplayName("a reverse blocking link is a 409 cycle")
        void rejectsCycle() throws Exception {
            createLink(ACTIVE_WORKSPACE, 1001, 1002, "blocks").andExpect(status().isCreated());

            createLink(ACTIVE_WORKSPACE, 1002, 1001, "blocks")
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("cyclic_dependency"))
                    .andExpect(jsonPath("$.detail").value("Cannot create circular dependency"));
        }

        @Test
        @DisplayName("a self link is 400")
        void rejectsSelfLink() throws Exception {
            createLink(ACTIVE_WORKSPACE, 1003, 1003, "relates_to")
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("invalid_link"));
        }

        @Test
        @DisplayName("an unknown link type is 400")
        void rejectsUnknownType() throws Exception {
            createLink(ACTIVE_WORKSPACE, 1006, 1007, "follows").andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("a work item of another workspace is 404")
        void rejectsForeignTask() throws Exception {
            createLink(ACTIVE_WORKSPACE, 2001, 1008, "relates_to")
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("task_not_found"));
        }

        @Test
        @DisplayName("a target of another workspace looks the same as a missing one")
        void rejectsForeignTarget() throws Exception {
            createLink(ACTIVE_WORKSPACE, 1008, 2001, "relates_to")
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("task_not_found"));
            createLink(ACTIVE_WORKSPACE, 1008, 9999, "relates_to")
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("task_not_found"));
            assertThat(links.findByTask(1008)).isEmpty();
        }

        @Test
        @DisplayName("a lapsed trial blocks changes with the trial end date")
        void trialExpired() throws Exception {
            mockMvc.perform(
                            post("/api/v1/workspaces/{id}/task-links", EXPIRED_WORKSPACE)
                                    .header("Authorization", bearer(EXPIRED_WORKSPACE))
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .content(linkBody(2001, 2002, "blocks")))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.code").value("trial_expired"))
                    .andExpect(jsonPath("$.trialEndsAt").value("2020-01-01T00:00:00Z"));
        }

        @Test
        @DisplayName("a link can be created, listed and deleted once")
        void lifecycle() throws Exception {
            MvcResult created =
                    createLink(ACTIVE_WORKSPACE, 1004, 1005, "relates_to")
                            .andExpect(status().isCreated())
                            .andExpect(jsonPath("$.linkType").value("relates_to"))
                            .andReturn();
            long linkId = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asLong();

            mockMvc.perform(
                            get("/api/v1/workspaces/{ws}/tasks/{task}/links", ACTIVE_WORKSPACE, 1005)
                                    .header("Authorization", bearer(null)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.incoming[0].id").value(linkId));

            mockMvc.perform(
                            delete("/api/v1/workspaces/{ws}/task-links/{id}", ACTIVE_WORKSPACE, linkId)
                                    .header("Authorization", bearer(null)))
                    .andExpect(status().isNoContent());
            mockMvc.perform(
                            delete("/api/v1/workspaces/{ws}/task-links/{id}", ACTIVE_WORKSPACE, linkId)
                                    .header("Authorization", bearer(null)))
                    .andExpect(status().isNotFound());
            assertThat(links.findById(linkId)).isEmpty();
        }

        private ResultActions createLink(
                long workspaceId, long source, long target, String type) throws Exception {
            return mockMvc.perform(
                    post("/api/v1/workspaces/{id}/task-links", workspaceId)
                            .header("Authorization", bearer(null))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(linkBody(source, target, type)));
        }
    }

    private String bearer(Long workspaceId) {
        return "Bearer " + tokenIssuer.generateToken(USER_ID, workspaceId);
    }

    private static String linkBody(long source, long target, String type) {
        return "{\"sourceTaskId\":" + source + ",\"targetTaskId\":" + target + ",\"linkType\":\"" + type + "\"}";
    }

    private static Workspace workspace(long id, long ownerId, String trialEndsAt) {
        return new Workspace(
                id,
                "Workspace " + id,
                ownerId,
                PlanType.FREE,
                WorkspaceStatus.ACTIVE,
                Instant.parse(trialEndsAt),
                null,
                true,
                id);
    }
}
