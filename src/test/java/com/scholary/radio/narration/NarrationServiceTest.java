package com.scholary.radio.narration;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.radio.track.PlayoutRequest;
import com.scholary.radio.track.TrackMetadata;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class NarrationServiceTest {

  @Test
  void generateNarration_shouldBuildPromptFromBatchAndNextTrack() {
    List<String> prompts = new ArrayList<>();
    NarrationService service =
        prompt -> {
          prompts.add(prompt);
          return PlayoutRequest.narration(Path.of("/tmp/n.mp3"), NarrationClient.NARRATION_TITLE);
        };

    PlayoutRequest request =
        service.generateNarration(
            List.of(TrackMetadata.of("A", "X"), TrackMetadata.of("B", "Y")),
            TrackMetadata.of("C", "Z"));

    assertThat(request.kind()).isEqualTo(PlayoutRequest.Kind.NARRATION);
    assertThat(prompts).hasSize(1);
    assertThat(prompts.get(0)).contains("A by X, B by Y").contains("C by Z");
  }
}
