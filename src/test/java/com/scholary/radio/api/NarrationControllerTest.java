package com.scholary.radio.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.radio.job.NarrationJob;
import com.scholary.radio.job.NarrationJobRepository;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class NarrationControllerTest {

  private NarrationJobRepository repository;
  private NarrationController controller;

  @BeforeEach
  void setUp() {
    repository = new NarrationJobRepository(500, 60);
    controller = new NarrationController(repository);
  }

  @Test
  void get_shouldReturnJob() {
    NarrationJob job = new NarrationJob("job-1", 1, List.of("A by X"), null);
    job.markFailed("Chat completion returned status 503");
    repository.save(job);

    ResponseEntity<NarrationJobResponse> response = controller.get("job-1");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody().status()).isEqualTo(NarrationJob.Status.FAILED);
    assertThat(response.getBody().error()).contains("503");
    assertThat(response.getBody().tracks()).containsExactly("A by X");
  }

  @Test
  void get_shouldReturnNotFoundForUnknownJob() {
    assertThat(controller.get("nope").getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void list_shouldClampLimit() {
    for (int i = 1; i <= 120; i++) {
      repository.save(new NarrationJob("job-" + i, i, List.of("A by X"), null));
    }

    assertThat(controller.list(0)).hasSize(1);
    assertThat(controller.list(1000)).hasSize(100);
    assertThat(controller.list(3))
        .extracting(NarrationJobResponse::jobId)
        .containsExactly("job-120", "job-119", "job-118");
  }
}
