package com.gradeledger.api.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gradeledger.core.repository.DomainEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Same HTTP flows as the in-memory tests, on PostgreSQL.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
public class JdbcStoreApiTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("gradeledger_test")
        .withUsername("test")
        .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("gradeledger.store.type", () -> "jdbc");
        registry.add("gradeledger.store.jdbc.url", postgres::getJdbcUrl);
        registry.add("gradeledger.store.jdbc.username", postgres::getUsername);
        registry.add("gradeledger.store.jdbc.password", postgres::getPassword);
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private DomainEventRepository eventRepository;

    private String courseId;

    @BeforeEach
    void setUp() {
        courseId = "course_" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Test
    @DisplayName("Grades and gradebook totals survive in PostgreSQL")
    void gradeFlow() throws Exception {
        publishAssignment("hw1");
        submit("hw1");

        mockMvc.perform(as(put("/api/v1/courses/{c}/grades", courseId), "u_instructor", "instructor")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sourceType\":\"assignment\",\"sourceId\":\"hw1\",\"studentId\":\"u_student_a\","
                    + "\"score\":8,\"pointsPossible\":10}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.grade.gradeRevision").value(1));

        mockMvc.perform(get("/api/v1/courses/{c}/gradebook/{s}", courseId, "u_student_a"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.gradebook.totalScore").value(8.0))
            .andExpect(jsonPath("$.gradebook.totalPossible").value(10.0))
            .andExpect(jsonPath("$.grades[0].sourceId").value("hw1"));

        mockMvc.perform(get("/api/v1/courses/{c}/events", courseId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(3))
            .andExpect(jsonPath("$[*].type", hasItem("grade.mutated")));
    }

    @Test
    @DisplayName("Resubmitting at the same version does not duplicate ledger events")
    void duplicateSubmissionIsIdempotent() throws Exception {
        publishAssignment("hw1");
        JsonNode first = submit("hw1");
        JsonNode second = submit("hw1");

        assertThat(second.get("eventIds")).isEqualTo(first.get("eventIds"));
        String eventId = first.get("eventIds").get(0).asText();
        assertThat(eventRepository.findById(eventId)).isPresent();

        mockMvc.perform(get("/api/v1/courses/{c}/events", courseId))
            .andExpect(jsonPath("$.length()").value(2));
        mockMvc.perform(get("/api/v1/events/{id}", eventId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.type").value("submission.submitted"));
    }

    @Test
    @DisplayName("Health reports the jdbc store")
    void health() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.components.ledger.details.store").value("jdbc"));
    }

    private void publishAssignment(String assignmentId) throws Exception {
        Instant dueAt = Instant.now().plus(7, ChronoUnit.DAYS);
        mockMvc.perform(as(post("/api/v1/courses/{c}/assignments", courseId), "u_instructor", "instructor")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"assignmentId\":\"" + assignmentId + "\",\"title\":\"Homework\",\"pointsPossible\":10,"
                    + "\"dueAt\":\"" + dueAt + "\"}"))
            .andExpect(status().isCreated());
    }

    private JsonNode submit(String assignmentId) throws Exception {
        String body = mockMvc.perform(as(post("/api/v1/courses/{c}/assignments/{a}/submissions", courseId, assignmentId),
                "u_student_a", "student"))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body);
    }

    private static MockHttpServletRequestBuilder as(MockHttpServletRequestBuilder request, String uid, String role) {
        return request.header("X-Actor-Uid", uid).header("X-Actor-Role", role);
    }
}
