package com.naag.docsync.controller;

import com.naag.docsync.dto.SearchRequest;
import com.naag.docsync.search.RetrievalQueryEngine;
import com.naag.docsync.search.SearchOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
@Tag(name = "Search", description = "Hybrid retrieval over the indexed collections")
@CrossOrigin(origins = "*")
public class SearchController {

    private final RetrievalQueryEngine queryEngine;

    @Value("${naag.docsync.retrieval.default-limit:5}")
    private int defaultLimit;

    @PostMapping
    @Operation(summary = "Search one or more collections; insufficient evidence is flagged rather than hidden")
    public ResponseEntity<SearchOutcome> search(@Valid @RequestBody SearchRequest request) {
        int limit = request.getLimitOrDefault(defaultLimit);
        SearchOutcome outcome = request.isWiden()
                ? queryEngine.searchWithWidening(request.query(), request.collections(), limit)
                : queryEngine.search(request.query(), request.collections(), limit);
        return ResponseEntity.ok(outcome);
    }
}
