package com.delta.scraper.scrape.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ScrapeApiSmokeTest {
    private static final String TEMPLATE = """
        {
          "name": "smoke-products",
          "fields": [
            {"name": "title", "selector": "h1", "fallbackSelectors": ["title"], "required": true},
            {"name": "price", "selector": ".price", "kind": "TEXT",
             "postProcessing": [{"type": "NUMBER"}]}
          ],
          "pagination": {"strategy": "NEXT_LINK", "nextSelector": "a[rel=next]", "maxPages": 2},
          "fetchProfile": {"stealthLevel": "NONE", "minDelayMs": 0, "maxDelayMs": 0}
        }
        """;

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void templateThenQueuedJobLifecycle() throws Exception {
        mockMvc.perform(post("/api/templates").contentType(MediaType.APPLICATION_JSON).content(TEMPLATE))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.name").value("smoke-products"));

        mockMvc.perform(get("/api/templates"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].name", hasItem("smoke-products")));

        String body = mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"template\":\"smoke-products\",\"targetUrl\":\"https://shop.example/list\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("QUEUED"))
            .andReturn()
            .getResponse()
            .getContentAsString();
        JsonNode job = objectMapper.readTree(body);
        String jobId = job.get("id").asText();

        mockMvc.perform(get("/api/jobs/" + jobId + "/progress"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pagesDone").value(0));

        mockMvc.perform(get("/api/jobs").param("status", "queued"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].id", hasItem(jobId)));

        mockMvc.perform(post("/api/jobs/" + jobId + "/cancel"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CANCELLED"));

        mockMvc.perform(post("/api/jobs/" + jobId + "/cancel"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CANCELLED"));

        mockMvc.perform(post("/api/jobs/" + jobId + "/resume"))
            .andExpect(status().isConflict());

        mockMvc.perform(delete("/api/jobs/" + jobId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.purged").value(true));

        mockMvc.perform(get("/api/jobs/" + jobId))
            .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/jobs/" + jobId + "/results"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());
    }

    @Test
    void invalidJobIsRejectedWithProblems() throws Exception {
        mockMvc.perform(post("/api/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"template\":\"nope\",\"targetUrl\":\"ftp://files.example/x\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_job"))
            .andExpect(jsonPath("$.problems.length()").value(2));

        mockMvc.perform(get("/api/jobs").param("status", "sleeping"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void invalidTemplateIsRejected() throws Exception {
        mockMvc.perform(post("/api/templates")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"broken\",\"fields\":[]}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void proxyPoolCanBeManaged() throws Exception {
        mockMvc.perform(post("/api/proxies")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"endpoint\":\"10.1.1.1:3128\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.entries[*].endpoint", hasItem("10.1.1.1:3128")));

        mockMvc.perform(get("/api/proxies"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.active").isNumber());

        mockMvc.perform(delete("/api/proxies").param("endpoint", "10.1.1.1:3128"))
            .andExpect(status().isOk());

        mockMvc.perform(delete("/api/proxies").param("endpoint", "10.1.1.1:3128"))
            .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/proxies")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"endpoint\":\"bad proxy:80\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_proxy"));

        mockMvc.perform(post("/api/proxies/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"testUrl\":\"https://health.example/ip\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray())
            .andExpect(jsonPath("$.length()").value(0));

        mockMvc.perform(post("/api/proxies/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"testUrl\":\"ftp://health.example/\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        mockMvc.perform(get("/api/jobs/does-not-exist"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("unknown_job"));
    }
}
