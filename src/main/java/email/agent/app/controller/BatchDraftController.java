package email.agent.app.controller;

import email.agent.app.service.BatchDraftException;
import email.agent.app.service.BatchDraftService;
import email.agent.app.service.BatchJobNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/users/{userId}/drafts/batch")
public class BatchDraftController {
    private final BatchDraftService batchDraftService;

    public BatchDraftController(BatchDraftService batchDraftService) {
        this.batchDraftService = batchDraftService;
    }

    @PostMapping
    public ResponseEntity<?> startBatch(@PathVariable String userId, @RequestBody BatchDraftRequest request) {
        try {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(BatchJobResponse.from(batchDraftService.startBatch(userId, request.getEmailIds())));
        } catch (BatchDraftException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<?> getBatch(@PathVariable String userId, @PathVariable String jobId) {
        try {
            return ResponseEntity.ok(BatchJobResponse.from(batchDraftService.getJob(userId, jobId)));
        } catch (BatchJobNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }
}
