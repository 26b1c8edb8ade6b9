package uk.gegc.fluency.features.sync.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.fluency.features.sync.application.ContentSyncRelay;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/content-sync")
@RequiredArgsConstructor
@Tag(name = "Content Sync Admin", description = "Inspect and drain the cache/search sync outbox")
public class ContentSyncAdminController {

    private final ContentSyncRelay relay;

    @Operation(summary = "Outbox status", description = "Counts pending tasks and tasks that ran out of attempts.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status returned")
    })
    @GetMapping("/status")
    public ResponseEntity<ContentSyncRelay.OutboxStatus> status() {
        return ResponseEntity.ok(relay.status());
    }

    @Operation(summary = "Drain the outbox now", description = "Runs one sweep without waiting for the scheduler.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Sweep finished")
    })
    @PostMapping("/drain")
    public ResponseEntity<Map<String, Integer>> drain() {
        return ResponseEntity.ok(Map.of("processed", relay.drainPending()));
    }
}
