package com.adlanda.citedsearch.controller;

import com.adlanda.citedsearch.exception.IndexQueryException;
import com.adlanda.citedsearch.model.AnswerEvent;
import com.adlanda.citedsearch.model.AnswerRequest;
import com.adlanda.citedsearch.model.AnswerResponse;
import com.adlanda.citedsearch.model.Citation;
import com.adlanda.citedsearch.model.SearchResult;
import com.adlanda.citedsearch.service.AnswerService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import reactor.core.publisher.Flux;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnswerController.class)
class AnswerControllerTest {

    private static final List<SearchResult> SOURCES =
            List.of(new SearchResult("Set the inlet pressure to 50 mbar.", "manual.pdf", 3, 0.91));

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnswerService answerService;

    @Test
    void answer_validRequest_returnsAnswerWithCitations() throws Exception {
        when(answerService.answer(any(AnswerRequest.class))).thenReturn(new AnswerResponse(
                "Use 50 mbar [manual.pdf, Page 3].",
                List.of(new Citation("manual.pdf", 3)),
                List.of(),
                SOURCES,
                true,
                null,
                800));

        mockMvc.perform(post("/api/v1/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"question": "What inlet pressure?"}
                            """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Use 50 mbar [manual.pdf, Page 3]."))
                .andExpect(jsonPath("$.citations[0].filename").value("manual.pdf"))
                .andExpect(jsonPath("$.citations[0].page").value(3))
                .andExpect(jsonPath("$.sources[0].source").value("manual.pdf"))
                .andExpect(jsonPath("$.complete").value(true));
    }

    @Test
    void answer_missingQuestion_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void answer_searchFails_returnsBadGateway() throws Exception {
        when(answerService.answer(any(AnswerRequest.class))).thenThrow(new IndexQueryException("index unavailable"));

        mockMvc.perform(post("/api/v1/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"question": "What inlet pressure?"}
                            """))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("index unavailable"));
    }

    @Test
    void streamAnswer_writesNamedServerSentEvents() throws Exception {
        AnswerResponse done = new AnswerResponse("Use 50 mbar [manual.pdf, Page 3].",
                List.of(new Citation("manual.pdf", 3)), List.of(), SOURCES, true, null, 500);
        when(answerService.streamAnswer(any(AnswerRequest.class))).thenReturn(Flux.just(
                AnswerEvent.sources(SOURCES),
                AnswerEvent.delta("Use 50 mbar [manual.pdf, Page 3]."),
                AnswerEvent.done(done)));

        MvcResult result = mockMvc.perform(post("/api/v1/answer/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"question": "What inlet pressure?"}
                            """))
                .andExpect(request().asyncStarted())
                .andReturn();

        String body = result.getResponse().getContentAsString();
        assertThat(body)
                .contains("event:sources")
                .contains("event:delta")
                .contains("event:done")
                .contains("\"filename\":\"manual.pdf\"");
        assertThat(body.indexOf("event:sources")).isLessThan(body.indexOf("event:delta"));
        assertThat(body.indexOf("event:delta")).isLessThan(body.indexOf("event:done"));
    }

    @Test
    void streamAnswer_blankQuestion_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/answer/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"question": " "}
                            """))
                .andExpect(status().isBadRequest());
    }
}
