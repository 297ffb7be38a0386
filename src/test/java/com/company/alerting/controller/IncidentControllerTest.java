package com.company.alerting.controller;

import com.company.alerting.config.ObjectMapperConfig;
import com.company.alerting.exception.GlobalExceptionHandler;
import com.company.alerting.service.IncidentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class IncidentControllerTest {

    private IncidentService incidentService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        incidentService = mock(IncidentService.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new IncidentController(incidentService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(ObjectMapperConfig.defaultObjectMapper()))
                .build();
    }

    @Test
    void oversized_actor_is_rejected_before_acknowledging() throws Exception {
        String body = "{\"actor\":\"" + "a".repeat(256) + "\"}";

        mockMvc.perform(post("/api/v1/incidents/5/acknowledge").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.actor").value("Actor must be at most 255 characters"));

        verifyNoInteractions(incidentService);
    }
}
