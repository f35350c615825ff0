package com.studio45.backend.support;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/**
 * Small MockMvc helpers shared by the HTTP-level integration tests.
 */
public final class IntegrationTestClient {

    private final MockMvc mockMvc;
    private final ObjectMapper objectMapper;

    public IntegrationTestClient(MockMvc mockMvc, ObjectMapper objectMapper) {
        this.mockMvc = mockMvc;
        this.objectMapper = objectMapper;
    }

    public String login(String email, String password) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"%s","password":"%s"}
                                """.formatted(email, password)))
                .andExpect(status().isOk())
                .andReturn();
        return read(result).path("token").asText();
    }

    public JsonNode register(String email, String password, String name) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"%s","password":"%s","name":"%s"}
                                """.formatted(email, password, name)))
                .andExpect(status().isCreated())
                .andReturn();
        return read(result);
    }

    public JsonNode getJson(String token, String path, Object... uriVariables) throws Exception {
        MvcResult result = mockMvc.perform(get(path, uriVariables)
                        .header("Authorization", bearer(token)))
                .andExpect(status().isOk())
                .andReturn();
        return read(result);
    }

    public UUID roleId(String adminToken, String roleName) throws Exception {
        for (JsonNode role : getJson(adminToken, "/api/v1/admin/roles").path("roles")) {
            if (roleName.equals(role.path("name").asText())) {
                return UUID.fromString(role.path("id").asText());
            }
        }
        throw new IllegalStateException("Role not seeded: " + roleName);
    }

    public UUID permissionId(String adminToken, String permissionName) throws Exception {
        for (JsonNode permission : getJson(adminToken, "/api/v1/admin/permissions").path("permissions")) {
            if (permissionName.equals(permission.path("name").asText())) {
                return UUID.fromString(permission.path("id").asText());
            }
        }
        throw new IllegalStateException("Permission not seeded: " + permissionName);
    }

    public JsonNode read(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    public static String bearer(String token) {
        return "Bearer " + token;
    }
}
