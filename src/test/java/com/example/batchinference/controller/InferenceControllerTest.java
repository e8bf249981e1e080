package com.example.batchinference.controller;

import com.example.batchinference.model.BatchResult;
import com.example.batchinference.model.InferenceOutcome;
import com.example.batchinference.model.InferenceParams;
import com.example.batchinference.model.InferenceRequest;
import com.example.batchinference.service.InferenceJobService;
import com.example.batchinference.service.inference.InferenceExecutor;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.matchesPattern;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = InferenceController.class, properties = "inference.inbound-token=secret-token")
class InferenceControllerTest {

    private static final String BEARER = "Bearer secret-token";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InferenceJobService jobService;

    @MockBean
    private InferenceExecutor inferenceExecutor;

    @Test
    void acceptsAsyncJobImmediately() throws Exception {
        mockMvc.perform(post("/infer")
                        .header(HttpHeaders.AUTHORIZATION, BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"request_id": "job-42",
                                 "urls": ["file:///a.jpg", "s3://bucket/b.png"],
                                 "callback_url": "http://receiver.test/hook",
                                 "conf": 0.4,
                                 "params": {"conf": 0.6, "imgsz": 320}}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.request_id").value("job-42"))
                .andExpect(jsonPath("$.status").value("accepted"));

        ArgumentCaptor<InferenceRequest> captor = ArgumentCaptor.forClass(InferenceRequest.class);
        verify(jobService).submit(captor.capture());
        InferenceRequest request = captor.getValue();
        assertThat(request.sources()).containsExactly("file:///a.jpg", "s3://bucket/b.png");
        assertThat(request.callbackUrl()).isEqualTo("http://receiver.test/hook");
        assertThat(request.params()).isEqualTo(new InferenceParams(320, 0.6, 0.45));
    }

    @Test
    void generatesRequestIdWhenAbsent() throws Exception {
        mockMvc.perform(post("/infer")
                        .header(HttpHeaders.AUTHORIZATION, BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"urls\": [\"file:///a.jpg\"], \"callback_url\": \"https://receiver.test/hook\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.request_id", matchesPattern("[0-9a-f-]{36}")));
    }

    @Test
    void rejectsMissingOrWrongToken() throws Exception {
        String body = "{\"urls\": [\"file:///a.jpg\"], \"callback_url\": \"http://receiver.test/hook\"}";

        mockMvc.perform(post("/infer").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"));
        mockMvc.perform(post("/infer")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer wrong")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isUnauthorized());

        verify(jobService, never()).submit(any());
    }

    @Test
    void checksTokenBeforeValidatingBody() throws Exception {
        mockMvc.perform(post("/infer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"urls\": [], \"conf\": 7}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value(401));
        mockMvc.perform(post("/infer_sync")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer wrong")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"urls\": []}"))
                .andExpect(status().isUnauthorized());

        verify(jobService, never()).submit(any());
        verify(jobService, never()).runSync(any());
    }

    @Test
    void rejectsMissingCallbackUrl() throws Exception {
        mockMvc.perform(post("/infer")
                        .header(HttpHeaders.AUTHORIZATION, BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"urls\": [\"file:///a.jpg\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("callback_url is required"));

        mockMvc.perform(post("/infer")
                        .header(HttpHeaders.AUTHORIZATION, BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"urls\": [\"file:///a.jpg\"], \"callback_url\": \"ftp://receiver.test\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void rejectsEmptyUrlList() throws Exception {
        mockMvc.perform(post("/infer")
                        .header(HttpHeaders.AUTHORIZATION, BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"urls\": [], \"callback_url\": \"http://receiver.test/hook\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void rejectsOutOfRangeThreshold() throws Exception {
        mockMvc.perform(post("/infer")
                        .header(HttpHeaders.AUTHORIZATION, BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"urls\": [\"a.jpg\"], \"callback_url\": \"http://r.test/h\", \"conf\": 1.5}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void runsSynchronousBatch() throws Exception {
        when(jobService.runSync(any())).thenReturn(new BatchResult("sync-1", List.of(
                new InferenceOutcome.Failure("http://bad", "Connection refused", "source_transport"))));

        mockMvc.perform(post("/infer_sync")
                        .header(HttpHeaders.AUTHORIZATION, BEARER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"request_id\": \"sync-1\", \"urls\": [\"http://bad\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.request_id").value("sync-1"))
                .andExpect(jsonPath("$.results[0].source").value("http://bad"))
                .andExpect(jsonPath("$.results[0].error").value("Connection refused"));
    }

    @Test
    void reportsHealthWithoutToken() throws Exception {
        when(inferenceExecutor.maxInflight()).thenReturn(2);
        when(inferenceExecutor.availablePermits()).thenReturn(1);

        mockMvc.perform(get("/healthz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.max_inflight").value(2))
                .andExpect(jsonPath("$.available_permits").value(1));
    }
}
