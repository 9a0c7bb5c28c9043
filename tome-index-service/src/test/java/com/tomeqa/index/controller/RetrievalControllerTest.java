package com.tomeqa.index.controller;

import com.tomeqa.index.exception.IndexServiceException;
import com.tomeqa.index.model.Chunk;
import com.tomeqa.index.model.HeadingContext;
import com.tomeqa.index.model.PageDetails;
import com.tomeqa.index.model.ScoredChunk;
import com.tomeqa.index.search.RetrievalService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RetrievalController.class)
class RetrievalControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RetrievalService retrievalService;

    @Nested
    @DisplayName("POST /api/index/search")
    class SearchTests {

        @Test
        @DisplayName("Should return fused hits with text, metadata and score")
        void shouldReturnHits() throws Exception {
            Map<String, Object> metadata = Map.of("source", "phb.pdf", "page", 241, "h2", "Fireball");
            Chunk chunk = new Chunk("A bright streak flashes", "phb.pdf", 241, 0, 1,
                    HeadingContext.fromMetadata(metadata), metadata);
            when(retrievalService.search(eq("fireball damage"), isNull(), eq(3), eq("semantic")))
                    .thenReturn(List.of(new ScoredChunk(chunk, 0.735)));

            mockMvc.perform(post("/api/index/search")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                {
                                    "query": "fireball damage",
                                    "limit": 3,
                                    "collection": "semantic"
                                }
                                """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.query").value("fireball damage"))
                    .andExpect(jsonPath("$.results.length()").value(1))
                    .andExpect(jsonPath("$.results[0].text").value("A bright streak flashes"))
                    .andExpect(jsonPath("$.results[0].metadata.page").value(241))
                    .andExpect(jsonPath("$.results[0].score").value(0.735));
        }

        @Test
        @DisplayName("Should use the default limit when none is given")
        void shouldDefaultLimit() throws Exception {
            when(retrievalService.search(eq("owlbear"), isNull(), eq(5), isNull())).thenReturn(List.of());

            mockMvc.perform(post("/api/index/search")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"query\": \"owlbear\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.results").isEmpty());
        }

        @Test
        @DisplayName("Should reject a blank query or an out-of-range limit")
        void shouldRejectInvalidRequest() throws Exception {
            mockMvc.perform(post("/api/index/search")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"query\": \"  \"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

            mockMvc.perform(post("/api/index/search")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"query\": \"owlbear\", \"limit\": 500}"))
                    .andExpect(status().isBadRequest());

            verify(retrievalService, never()).search(anyString(), any(), anyInt(), any());
        }

        @Test
        @DisplayName("Should reject an unreadable body")
        void shouldRejectMalformedJson() throws Exception {
            mockMvc.perform(post("/api/index/search")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"query\": "))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errorId").exists());
        }

        @Test
        @DisplayName("Should map index failures to 500")
        void shouldMapIndexFailure() throws Exception {
            when(retrievalService.search(anyString(), any(), anyInt(), any()))
                    .thenThrow(new IndexServiceException("collection missing", 404));

            mockMvc.perform(post("/api/index/search")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"query\": \"owlbear\"}"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.code").value("INDEX_ERROR"))
                    .andExpect(jsonPath("$.path").value("/api/index/search"));
        }
    }

    @Nested
    @DisplayName("GET /api/index/pages")
    class PageTests {

        @Test
        @DisplayName("Should return the joined page text")
        void shouldReturnPage() throws Exception {
            when(retrievalService.getBySourceAndPage("phb.pdf", 12, null)).thenReturn(Optional.of(
                    new PageDetails("Chapter text", Map.of("page", 12), "img/12.png", 320)));

            mockMvc.perform(get("/api/index/pages")
                            .param("source", "phb.pdf")
                            .param("page", "12"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.text").value("Chapter text"))
                    .andExpect(jsonPath("$.imageUrl").value("img/12.png"))
                    .andExpect(jsonPath("$.totalPages").value(320));
        }

        @Test
        @DisplayName("Should return 404 when the page is not indexed")
        void shouldReturnNotFound() throws Exception {
            when(retrievalService.getBySourceAndPage("phb.pdf", 999, "pages")).thenReturn(Optional.empty());

            mockMvc.perform(get("/api/index/pages")
                            .param("source", "phb.pdf")
                            .param("page", "999")
                            .param("collection", "pages"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Should reject missing or invalid parameters")
        void shouldRejectInvalidParameters() throws Exception {
            mockMvc.perform(get("/api/index/pages").param("page", "1"))
                    .andExpect(status().isBadRequest());
            mockMvc.perform(get("/api/index/pages").param("source", "phb.pdf").param("page", "zero"))
                    .andExpect(status().isBadRequest());
            mockMvc.perform(get("/api/index/pages").param("source", "phb.pdf").param("page", "0"))
                    .andExpect(status().isBadRequest());
        }
    }
}
