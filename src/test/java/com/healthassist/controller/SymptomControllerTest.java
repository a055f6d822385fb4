package com.healthassist.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("症状分析接口")
class SymptomControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void analyzeReturnsBundle() throws Exception {
        String body = """
                {"symptom": "Throbbing headache", "duration": "3 weeks", "severity": "severe",
                 "age": 45, "gender": "female"}
                """;

        mockMvc.perform(post("/api/analyze-symptom").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.red_flags[0]").value("Sudden severe headache ('worst headache of life')"))
                .andExpect(jsonPath("$.possible_causes", hasSize(5)))
                .andExpect(jsonPath("$.possible_causes[4].ai_confidence").value("Medium"))
                .andExpect(jsonPath("$.ai_insights", hasSize(3)))
                .andExpect(jsonPath("$.risk_assessment.immediate_risk").value("Medium"))
                .andExpect(jsonPath("$.risk_assessment.progression_risk").value("Medium"))
                .andExpect(jsonPath("$.diet_plan.supplements", hasSize(3)))
                .andExpect(jsonPath("$.medical_disclaimer", startsWith("IMPORTANT MEDICAL DISCLAIMER")))
                .andExpect(jsonPath("$.search_timestamp").isNotEmpty());
    }

    @Test
    void legacyRequestShapeStillWorks() throws Exception {
        mockMvc.perform(post("/api/analyze-symptom").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symptom\": \"dizzy\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.possible_causes[0].condition").value("Lifestyle Factors"))
                .andExpect(jsonPath("$.ai_insights", hasSize(2)));
    }

    @Test
    void blankSymptomIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/analyze-symptom").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symptom\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400))
                .andExpect(jsonPath("$.message").value("Please enter a symptom to analyze"))
                .andExpect(jsonPath("$.data").doesNotExist());
    }

    @Test
    void negativeAgeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/analyze-symptom").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symptom\": \"headache\", \"age\": -3}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Age must be a positive number"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/analyze-symptom").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symptom\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400));
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        mockMvc.perform(get("/favicon.ico"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    void wrongMethodIsNotAllowed() throws Exception {
        mockMvc.perform(get("/api/analyze-symptom"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.code").value(405))
                .andExpect(jsonPath("$.message").value("Method Not Allowed"));
    }

    @Test
    void healthProbeIsStatic() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.service").value("AI Health Assistant"));

        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("AI Health Assistant API is running"));
    }
}
