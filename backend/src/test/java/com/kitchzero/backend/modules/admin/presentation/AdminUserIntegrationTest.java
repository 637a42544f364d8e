package com.kitchzero.backend.modules.admin.presentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.kitchzero.backend.modules.auth.domain.AppUser;
import com.kitchzero.backend.modules.auth.infrastructure.persistence.AuthSessionRepository;
import com.kitchzero.backend.support.AbstractPostgresIntegrationTest;
import com.kitchzero.backend.support.AuthTestClient;
import com.kitchzero.backend.support.AuthTestClient.Session;
import com.kitchzero.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class AdminUserIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String ADMIN_PASSWORD = "root-pass-123";
    private static final String MANAGER_PASSWORD = "manager-pass-1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private AuthSessionRepository authSessionRepository;

    private AuthTestClient client;
    private AppUser manager;
    private Session admin;

    @BeforeEach
    void setUp() throws Exception {
        client = new AuthTestClient(mockMvc);
        testUserFactory.superAdmin("root", ADMIN_PASSWORD);
        manager = testUserFactory.branchAdmin("manager-b1", MANAGER_PASSWORD, "b1");
        admin = client.login("root", ADMIN_PASSWORD, "198.51.100.1");
    }

    @Test
    void createsBranchAdmin() throws Exception {
        mockMvc.perform(admin.authorize(post("/users"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username":"manager-b2","password":"new-pass-123","role":"BRANCH_ADMIN","branchId":"b2"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(header().exists("Location"))
                .andExpect(jsonPath("$.branchId").value("b2"));

        client.login("manager-b2", "new-pass-123", "198.51.100.2");
    }

    @Test
    void rejectsDuplicateUsernameAndInvalidBranchScope() throws Exception {
        mockMvc.perform(admin.authorize(post("/users"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username":"MANAGER-B1","password":"new-pass-123","role":"BRANCH_ADMIN","branchId":"b3"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("admin.username_taken"));

        mockMvc.perform(admin.authorize(post("/users"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username":"rooted","password":"new-pass-123","role":"SUPER_ADMIN","branchId":"b3"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("admin.invalid_branch_scope"));
    }

    @Test
    void passwordResetRevokesExistingSessions() throws Exception {
        Session managerSession = client.login("manager-b1", MANAGER_PASSWORD, "198.51.100.3");
        mockMvc.perform(managerSession.authorize(get("/profile/me"))).andExpect(status().isOk());

        mockMvc.perform(admin.authorize(put("/users/" + manager.getId()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"password\":\"rotated-pass-9\"}"))
                .andExpect(status().isOk());

        assertThat(authSessionRepository.countByUserId(manager.getId())).isZero();
        mockMvc.perform(managerSession.authorize(get("/profile/me")))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(managerSession.refresh())
                .andExpect(status().isUnauthorized());
        client.login("manager-b1", "rotated-pass-9", "198.51.100.4");
    }

    @Test
    void forceLogoutReportsRevokedSessions() throws Exception {
        client.login("manager-b1", MANAGER_PASSWORD, "198.51.100.5");
        client.login("manager-b1", MANAGER_PASSWORD, "198.51.100.6");

        mockMvc.perform(admin.authorize(delete("/users/" + manager.getId() + "/sessions")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invalidatedSessions").value(2));
    }

    @Test
    void resetRestoresLoginBudgetForAddress() throws Exception {
        String csrf = client.fetchCsrfToken();
        for (int i = 0; i < 5; i++) {
            mockMvc.perform(client.loginRequest("nobody-" + i, "nope-nope", csrf, "203.0.113.77"));
        }
        mockMvc.perform(client.loginRequest("manager-b1", MANAGER_PASSWORD, csrf, "203.0.113.77"))
                .andExpect(status().isTooManyRequests());

        mockMvc.perform(admin.authorize(delete("/admin/rate-limits/LOGIN"))
                        .param("identity", "ip:203.0.113.77"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removedCounters").value(1));

        mockMvc.perform(client.loginRequest("manager-b1", MANAGER_PASSWORD, csrf, "203.0.113.78"))
                .andExpect(status().isOk());
        mockMvc.perform(client.loginRequest("nobody-6", "nope-nope", csrf, "203.0.113.77"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void branchAdminCannotManageUsers() throws Exception {
        Session managerSession = client.login("manager-b1", MANAGER_PASSWORD, "198.51.100.7");

        mockMvc.perform(managerSession.authorize(delete("/users/" + manager.getId() + "/sessions")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("REQUEST_DENIED"));
    }
}
