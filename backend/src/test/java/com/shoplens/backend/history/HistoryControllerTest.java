package com.shoplens.backend.history;

import com.shoplens.backend.job.JobNotFoundException;
import com.shoplens.backend.model.dto.JobStatusDTO;
import com.shoplens.backend.model.dto.ScoreTrendPointDTO;
import com.shoplens.backend.model.enums.JobKind;
import com.shoplens.backend.model.enums.JobStatus;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HistoryController.class)
class HistoryControllerTest {

    private static final String URL = "https://www.qoo10.jp/shop/sample-shop";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnalysisHistoryService historyService;

    @Test
    void shouldListHistoryFilteredByKind() throws Exception {
        when(historyService.list(null, JobKind.COLLECTION, 10, 0)).thenReturn(List.of(JobStatusDTO.builder()
                .jobId("job-1")
                .sourceRef(URL)
                .kind(JobKind.COLLECTION)
                .status(JobStatus.QUEUED)
                .build()));

        mockMvc.perform(get("/api/v1/history")
                        .param("kind", "collection")
                        .param("limit", "10")
                        .param("offset", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.history[0].jobId").value("job-1"))
                .andExpect(jsonPath("$.history[0].kind").value("collection"));
    }

    @Test
    void shouldRejectUnknownKind() throws Exception {
        mockMvc.perform(get("/api/v1/history").param("kind", "bundle"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(historyService);
    }

    @Test
    void shouldReturnTrendForSource() throws Exception {
        when(historyService.scoreTrend(URL, 7)).thenReturn(List.of(
                new ScoreTrendPointDTO(LocalDate.of(2026, 3, 1), 70.0, 80, 60, 2)));

        mockMvc.perform(get("/api/v1/history/trend").param("sourceRef", URL).param("days", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sourceRef").value(URL))
                .andExpect(jsonPath("$.trend[0].date").value("2026-03-01"))
                .andExpect(jsonPath("$.trend[0].avgScore").value(70.0))
                .andExpect(jsonPath("$.trend[0].count").value(2));
    }

    @Test
    void shouldReturnNotFoundForUnknownJob() throws Exception {
        when(historyService.get("missing")).thenThrow(new JobNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/history/missing"))
                .andExpect(status().isNotFound());
    }
}
