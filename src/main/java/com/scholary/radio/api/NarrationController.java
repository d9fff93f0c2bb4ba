package com.scholary.radio.api;

import com.scholary.radio.job.NarrationJobRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for narration jobs.
 *
 * <p>Read-only: narrations are triggered by the playout itself, every full batch of tracks.
 */
@RestController
@Tag(name = "Narrations", description = "Generated narration jobs")
public class NarrationController {

  private final NarrationJobRepository jobRepository;

  public NarrationController(NarrationJobRepository jobRepository) {
    this.jobRepository = jobRepository;
  }

  @GetMapping("/api/narrations")
  @Operation(summary = "List narrations", description = "Most recently triggered narrations first")
  public List<NarrationJobResponse> list(@RequestParam(defaultValue = "20") int limit) {
    return jobRepository.findRecent(Math.max(1, Math.min(limit, 100))).stream()
        .map(NarrationJobResponse::from)
        .collect(Collectors.toList());
  }

  @GetMapping("/api/narrations/{id}")
  @Operation(summary = "Get narration", description = "Check the status of a narration job")
  public ResponseEntity<NarrationJobResponse> get(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.ok(NarrationJobResponse.from(job)))
        .orElse(ResponseEntity.notFound().build());
  }
}
