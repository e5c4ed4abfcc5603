package com.adlanda.citedsearch.controller;

import com.adlanda.citedsearch.exception.IngestionInProgressException;
import com.adlanda.citedsearch.model.IngestionReport;
import com.adlanda.citedsearch.model.IngestionReport.FailedBatch;
import com.adlanda.citedsearch.service.CorpusIngestionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(IngestionController.class)
class IngestionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CorpusIngestionService corpusIngestionService;

    @Test
    void ingest_returnsReport() throws Exception {
        when(corpusIngestionService.ingestConfiguredDirectory()).thenReturn(new IngestionReport(
                8, 2, 1, 1, List.of(new FailedBatch(3, List.of("c9"), "503 from index")), 2.5));

        mockMvc.perform(post("/api/v1/ingest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processed").value(8))
                .andExpect(jsonPath("$.skipped").value(2))
                .andExpect(jsonPath("$.failedBatches[0].chunkIds[0]").value("c9"))
                .andExpect(jsonPath("$.failedBatches[0].reason").value("503 from index"));
    }

    @Test
    void ingest_runAlreadyInProgress_returnsConflict() throws Exception {
        when(corpusIngestionService.ingestConfiguredDirectory())
                .thenThrow(new IngestionInProgressException("An ingestion run is already in progress"));

        mockMvc.perform(post("/api/v1/ingest"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Conflict"));
    }
}
