package com.signalsync.cloud.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalsync.shared.domain.AnalysisRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class SessionControllerTest {

    private static final double FS = 250.0;
    private static final int N = 2500;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void sessionLifecycle() throws Exception {
        String id = createSession();

        mockMvc.perform(get("/api/sessions/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.samplingRate").value(128.0))
            .andExpect(jsonPath("$.roiStart").doesNotExist());

        mockMvc.perform(put("/api/sessions/{id}/sampling-rate", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"samplingRate\": 250.0}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.samplingRate").value(250.0));

        mockMvc.perform(put("/api/sessions/{id}/roi", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"start\": 1.0, \"end\": 9.0}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.roiStart").value(1.0))
            .andExpect(jsonPath("$.roiEnd").value(9.0));

        mockMvc.perform(delete("/api/sessions/{id}/roi", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.roiStart").doesNotExist());

        mockMvc.perform(delete("/api/sessions/{id}", id))
            .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/sessions/{id}", id))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"));
    }

    @Test
    void invertedRoiIsABadRequest() throws Exception {
        String id = createSession();

        mockMvc.perform(put("/api/sessions/{id}/roi", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"start\": 5.0, \"end\": 5.0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_RANGE"));
    }

    @Test
    void nonPositiveSamplingRateIsABadRequest() throws Exception {
        String id = createSession();

        mockMvc.perform(put("/api/sessions/{id}/sampling-rate", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"samplingRate\": 0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void analyzeWithoutRoiIsAConflict() throws Exception {
        String id = createSession();

        mockMvc.perform(post("/api/sessions/{id}/analyze", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(syntheticRequest())))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("NO_ROI_CONFIGURED"));
    }

    @Test
    void analyzeReturnsSnakeCaseMetrics() throws Exception {
        String id = configuredSession();

        String body = mockMvc.perform(post("/api/sessions/{id}/analyze", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(syntheticRequest())))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.n_samples").value(2000))
            .andExpect(jsonPath("$.start_s").value(1.0))
            .andExpect(jsonPath("$.end_s").value(9.0))
            .andExpect(jsonPath("$.fs").value(250.0))
            .andExpect(jsonPath("$.sqi.saturation").exists())
            .andReturn().getResponse().getContentAsString();

        JsonNode json = objectMapper.readTree(body);
        assertThat(json.get("hr_bpm").asDouble()).isCloseTo(60.0, within(0.5));
        assertThat(json.get("ptt_mean_s").asDouble()).isCloseTo(0.25, within(0.02));
        assertThat(json.has("delay_xcorr_s")).isTrue();
    }

    @Test
    void absentMetricsAreOmitted() throws Exception {
        String id = configuredSession();
        double[] flat = new double[N];
        AnalysisRequest request = new AnalysisRequest(time(), flat, flat, true, "default");

        mockMvc.perform(post("/api/sessions/{id}/analyze", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hr_bpm").doesNotExist())
            .andExpect(jsonPath("$.ptt_mean_s").doesNotExist())
            .andExpect(jsonPath("$.sqi.flatness").value(1.0));
    }

    @Test
    void reportIsASingleStatusLine() throws Exception {
        String id = configuredSession();

        mockMvc.perform(post("/api/sessions/{id}/report", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(syntheticRequest())))
            .andExpect(status().isOk())
            .andExpect(content().string(startsWith("ROI 1.00~9.00s | N=2000 | fs=250.00Hz | HR = ")));
    }

    @Test
    void resampleAndHealth() throws Exception {
        mockMvc.perform(post("/api/signal/resample")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"samples\": [1, 2, 3, 4], \"origFs\": 100, \"targetFs\": 200}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.samplingRate").value(200.0))
            .andExpect(jsonPath("$.samples.length()").value(8));

        mockMvc.perform(post("/api/signal/resample")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"samples\": [1, 2], \"origFs\": -1, \"targetFs\": 200}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/signal/resample")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"samples\": [1, 2, 3, 4], \"origFs\": 1, \"targetFs\": 1e12}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));

        mockMvc.perform(get("/api/signal/health"))
            .andExpect(status().isOk())
            .andExpect(content().string("Signal Sync Service is Running"));
    }

    private String createSession() throws Exception {
        String body = mockMvc.perform(post("/api/sessions"))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).get("id").asText();
    }

    private String configuredSession() throws Exception {
        String id = createSession();
        mockMvc.perform(put("/api/sessions/{id}/sampling-rate", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"samplingRate\": 250.0}"))
            .andExpect(status().isOk());
        mockMvc.perform(put("/api/sessions/{id}/roi", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"start\": 1.0, \"end\": 9.0}"))
            .andExpect(status().isOk());
        return id;
    }

    private static AnalysisRequest syntheticRequest() {
        double[] ecg = new double[N];
        double[] ppg = new double[N];
        for (int i = 0; i < N; i++) {
            double t = i / FS;
            for (int k = 0; k < 10; k++) {
                double r = (t - (0.5 + k)) / 0.02;
                double p = (t - (0.75 + k)) / 0.1;
                ecg[i] += Math.exp(-0.5 * r * r);
                ppg[i] += Math.exp(-0.5 * p * p);
            }
            ecg[i] += 0.3 * Math.sin(2 * Math.PI * 0.1 * t);
            ppg[i] += 0.2 * i / N;
        }
        return new AnalysisRequest(time(), ppg, ecg, true, null);
    }

    private static double[] time() {
        double[] t = new double[N];
        for (int i = 0; i < N; i++) {
            t[i] = i / FS;
        }
        return t;
    }
}
