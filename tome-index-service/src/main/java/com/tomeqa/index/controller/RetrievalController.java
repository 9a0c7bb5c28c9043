package com.tomeqa.index.controller;

import com.tomeqa.index.dto.PageResponse;
import com.tomeqa.index.dto.SearchHit;
import com.tomeqa.index.dto.SearchRequest;
import com.tomeqa.index.dto.SearchResponse;
import com.tomeqa.index.search.RetrievalService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/index")
@CrossOrigin(origins = "*")
@Slf4j
public class RetrievalController {

    private final RetrievalService retrievalService;

    public RetrievalController(RetrievalService retrievalService) {
        this.retrievalService = retrievalService;
    }

    @PostMapping("/search")
    public ResponseEntity<SearchResponse> search(@RequestBody SearchRequest request) {
        request.validate();
        List<SearchHit> hits = retrievalService
                .search(request.query(), null, request.getLimitOrDefault(), request.collection())
                .stream()
                .map(SearchHit::from)
                .toList();
        log.debug("[API] search '{}' -> {} hits", request.query(), hits.size());
        return ResponseEntity.ok(new SearchResponse(request.query(), request.collection(), hits));
    }

    @GetMapping("/pages")
    public ResponseEntity<PageResponse> page(
            @RequestParam String source,
            @RequestParam int page,
            @RequestParam(required = false) String collection) {
        if (source.isBlank() || page < 1) {
            throw new IllegalArgumentException("source and a page >= 1 are required");
        }
        return retrievalService.getBySourceAndPage(source, page, collection)
                .map(details -> ResponseEntity.ok(PageResponse.from(source, page, details)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
