package eu.virtualparadox.ragservice.api;

import eu.virtualparadox.ragservice.api.dto.ErrorResponse;
import eu.virtualparadox.ragservice.api.dto.HealthResponse;
import eu.virtualparadox.ragservice.api.dto.ReadyResponse;
import eu.virtualparadox.ragservice.rag.index.IndexGeneration;
import eu.virtualparadox.ragservice.rag.index.IndexState;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Liveness and readiness endpoints.
 * <p>
 * {@code /health} answers 200 even before the first index exists, so orchestrators do not restart a
 * service that is merely waiting for its producer. {@code /ready} is the one to gate traffic on.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    static final String NOT_LOADED = "Index not loaded";

    private final IndexState indexState;

    @GetMapping("/health")
    public HealthResponse health() {
        final Optional<IndexGeneration> generation = indexState.current();
        return generation
                .map(g -> HealthResponse.healthy(g.size()))
                .orElseGet(() -> HealthResponse.unhealthy(NOT_LOADED));
    }

    @GetMapping("/ready")
    public ResponseEntity<?> ready() {
        final Optional<IndexGeneration> generation = indexState.current();
        if (generation.isEmpty()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse(NOT_LOADED));
        }
        return ResponseEntity.ok(new ReadyResponse("ready", generation.get().size()));
    }
}
