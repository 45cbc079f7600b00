package eu.virtualparadox.ragservice.api;

import eu.virtualparadox.ragservice.api.dto.QueryRequest;
import eu.virtualparadox.ragservice.api.dto.QueryResponse;
import eu.virtualparadox.ragservice.api.dto.ReloadResponse;
import eu.virtualparadox.ragservice.query.QueryEngine;
import eu.virtualparadox.ragservice.query.model.ScoredResult;
import eu.virtualparadox.ragservice.rag.index.lifecycle.CycleOutcome;
import eu.virtualparadox.ragservice.rag.index.lifecycle.IndexPoller;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Query and reload endpoints. Failures are mapped to status codes by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/rag")
@RequiredArgsConstructor
@Slf4j
public class RagController {

    private final QueryEngine queryEngine;
    private final IndexPoller indexPoller;

    @PostMapping("/query")
    public QueryResponse query(@Valid @RequestBody final QueryRequest request) {
        final long start = System.nanoTime();
        final List<ScoredResult> results = queryEngine.query(
                request.query(),
                request.topK(),
                request.topN(),
                request.similarityThreshold().floatValue());
        final double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;

        log.info("Query returned {} results in {} ms", results.size(), String.format("%.1f", elapsedMs));
        return QueryResponse.of(request, results, elapsedMs);
    }

    @PostMapping("/reload")
    public ResponseEntity<ReloadResponse> reload() {
        final CycleOutcome outcome = indexPoller.reload();
        if (outcome.published()) {
            return ResponseEntity.ok(new ReloadResponse("success", "Index reloaded", outcome.indexSize()));
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ReloadResponse("failure", outcome.message(), outcome.indexSize()));
    }
}
