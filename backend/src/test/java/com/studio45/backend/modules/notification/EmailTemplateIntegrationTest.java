package com.studio45.backend.modules.notification;

import static com.studio45.backend.support.IntegrationTestClient.bearer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.studio45.backend.modules.notification.application.MailSender;
import com.studio45.backend.modules.notification.domain.OutgoingEmail;
import com.studio45.backend.support.AbstractPostgresIntegrationTest;
import com.studio45.backend.support.IntegrationTestClient;
import com.studio45.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class EmailTemplateIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String ADMIN_EMAIL = "admin@studio45.test";
    private static final String ADMIN_PASSWORD = "admin-pass-1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @MockBean
    private MailSender mailSender;

    private String adminToken;

    @BeforeEach
    void setUp() throws Exception {
        IntegrationTestClient client = new IntegrationTestClient(mockMvc, objectMapper);
        testUserFactory.ensureAdmin(ADMIN_EMAIL, ADMIN_PASSWORD);
        adminToken = client.login(ADMIN_EMAIL, ADMIN_PASSWORD);
    }

    @Test
    void seededTemplateIsListed() throws Exception {
        mockMvc.perform(get("/api/v1/admin/email-templates")
                        .header("Authorization", bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.templates[0].name").value("password_reset"))
                .andExpect(jsonPath("$.templates[0].active").value(true));
    }

    @Test
    void createPreviewAndInspectVariables() throws Exception {
        UUID templateId = createWelcomeTemplate();

        mockMvc.perform(post("/api/v1/admin/email-templates/{id}/preview", templateId)
                        .header("Authorization", bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"variables":{"Name":"<b>Ann</b>"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subject").value("Welcome <b>Ann</b>"))
                .andExpect(jsonPath("$.htmlContent").value("<p>Hello &lt;b&gt;Ann&lt;/b&gt;</p>"))
                .andExpect(jsonPath("$.textContent").value("Hello <b>Ann</b>"));

        mockMvc.perform(get("/api/v1/admin/email-templates/{id}/variables", templateId)
                        .header("Authorization", bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.variables[0].name").value("Name"));
    }

    @Test
    void invalidTemplateSyntaxIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/admin/email-templates")
                        .header("Authorization", bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"broken","subject":"Hi","htmlTemplate":"<p>{{#open}}</p>","textTemplate":"x"}
                                """))
                .andExpect(status().isBadRequest());

        UUID templateId = createWelcomeTemplate();
        mockMvc.perform(put("/api/v1/admin/email-templates/{id}", templateId)
                        .header("Authorization", bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"textTemplate":"{{/closed}}"}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void duplicateNameIsConflict() throws Exception {
        createWelcomeTemplate();

        mockMvc.perform(post("/api/v1/admin/email-templates")
                        .header("Authorization", bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"welcome","subject":"Again","htmlTemplate":"<p>x</p>","textTemplate":"x"}
                                """))
                .andExpect(status().isConflict());
    }

    @Test
    void testEmailIsRenderedAndSent() throws Exception {
        UUID templateId = createWelcomeTemplate();

        mockMvc.perform(post("/api/v1/admin/email-templates/{id}/test", templateId)
                        .header("Authorization", bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"qa@example.com","variables":{"Name":"QA"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Test email sent"))
                .andExpect(jsonPath("$.preview.subject").value("Welcome QA"));

        ArgumentCaptor<OutgoingEmail> captor = ArgumentCaptor.forClass(OutgoingEmail.class);
        verify(mailSender).send(captor.capture());
        assertThat(captor.getValue().to()).isEqualTo("qa@example.com");
        assertThat(captor.getValue().content().textContent()).isEqualTo("Hello QA");
    }

    @Test
    void passwordResetFallsBackToBuiltInTemplateWhenDatabaseTemplateIsGone() throws Exception {
        testUserFactory.ensureMember("reset@example.com", "secret1", "Reset Me");
        JsonNode list = objectMapper.readTree(mockMvc.perform(get("/api/v1/admin/email-templates")
                        .header("Authorization", bearer(adminToken)))
                .andReturn().getResponse().getContentAsString());
        UUID resetTemplateId = UUID.fromString(list.path("templates").get(0).path("id").asText());

        mockMvc.perform(delete("/api/v1/admin/email-templates/{id}", resetTemplateId)
                        .header("Authorization", bearer(adminToken)))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/v1/admin/email-templates/{id}", resetTemplateId)
                        .header("Authorization", bearer(adminToken)))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/v1/auth/forgot-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"reset@example.com"}
                                """))
                .andExpect(status().isOk());

        ArgumentCaptor<OutgoingEmail> captor = ArgumentCaptor.forClass(OutgoingEmail.class);
        verify(mailSender).send(captor.capture());
        assertThat(captor.getValue().content().subject()).isEqualTo("Reset Your Password");
        assertThat(captor.getValue().content().textContent())
                .startsWith("Click the link below to reset your password:")
                .contains("/reset-password?token=")
                .endsWith("This link expires in 15 minutes.");
    }

    private UUID createWelcomeTemplate() throws Exception {
        String body = mockMvc.perform(post("/api/v1/admin/email-templates")
                        .header("Authorization", bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"welcome","subject":"Welcome {{Name}}","htmlTemplate":"<p>Hello {{Name}}</p>",
                                 "textTemplate":"Hello {{Name}}","variables":[{"name":"Name","description":"Recipient name"}]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.active").value(true))
                .andReturn().getResponse().getContentAsString();
        return UUID.fromString(objectMapper.readTree(body).path("id").asText());
    }
}
