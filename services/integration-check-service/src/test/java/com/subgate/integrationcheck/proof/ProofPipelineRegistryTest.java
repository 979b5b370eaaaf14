package com.subgate.integrationcheck.proof;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.subgate.integrationcheck.config.ProofProperties;
import com.subgate.integrationcheck.invoice.InvoiceProofSink;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class ProofPipelineRegistryTest {

  private final ProofPipelineRegistry registry =
      new ProofPipelineRegistry(
          new RecordingProofStorage(),
          mock(InvoiceProofSink.class),
          Clock.systemUTC(),
          new ProofProperties(Duration.ofDays(365), Duration.ofMinutes(30)));

  @Test
  void samePipelinePerOwnerAndInvoice() {
    ProofSubmissionPipeline first = registry.pipeline("user-1", "inv-1");

    assertThat(registry.pipeline("user-1", "inv-1")).isSameAs(first);
    assertThat(registry.pipelineForSelection("user-1", "inv-1")).isSameAs(first);
    assertThat(registry.pipeline("user-1", "inv-2")).isNotSameAs(first);
    assertThat(registry.pipeline("user-2", "inv-1")).isNotSameAs(first);
  }

  @Test
  void pipelinesForDifferentInvoicesDoNotShareState() {
    registry.pipeline("user-1", "inv-1").select(new ProofFile("a.png", "image/png", new byte[4]));

    assertThat(registry.pipeline("user-1", "inv-2").snapshot().stage())
        .isEqualTo(ProofStage.EMPTY);
  }

  @Test
  void newSelectionAfterSubmissionStartsNewCycle() {
    ProofSubmissionPipeline submitted = registry.pipelineForSelection("user-1", "inv-1");
    submitted.select(new ProofFile("a.png", "image/png", new byte[4]));
    submitted.upload();
    submitted.confirm();

    assertThat(registry.pipeline("user-1", "inv-1")).isSameAs(submitted);
    ProofSubmissionPipeline next = registry.pipelineForSelection("user-1", "inv-1");

    assertThat(next).isNotSameAs(submitted);
    assertThat(next.snapshot().stage()).isEqualTo(ProofStage.EMPTY);
  }

  @Test
  void invalidIdentifiersAreRefused() {
    assertThatThrownBy(() -> registry.pipeline("user 1", "inv-1"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void idlePipelineExpires() {
    AtomicLong nanos = new AtomicLong();
    ProofPipelineRegistry expiring = registryWithTicker(new RecordingProofStorage(), nanos);
    ProofSubmissionPipeline first = expiring.pipeline("user-1", "inv-1");

    nanos.addAndGet(Duration.ofMinutes(31).toNanos());

    assertThat(expiring.pipeline("user-1", "inv-1")).isNotSameAs(first);
  }

  @Test
  void pipelineWithUploadInFlightOutlivesIdleTimeout() {
    AtomicLong nanos = new AtomicLong();
    ProofPipelineRegistry[] holder = new ProofPipelineRegistry[1];
    ProofSubmissionPipeline[] seenDuringUpload = new ProofSubmissionPipeline[2];
    RecordingProofStorage slowStorage =
        new RecordingProofStorage() {
          @Override
          public void put(String path, byte[] content, String contentType, boolean overwrite) {
            seenDuringUpload[0] = holder[0].pipeline("user-1", "inv-1");
            nanos.addAndGet(Duration.ofHours(2).toNanos());
            seenDuringUpload[1] = holder[0].pipelineForSelection("user-1", "inv-1");
            super.put(path, content, contentType, overwrite);
          }
        };
    holder[0] = registryWithTicker(slowStorage, nanos);

    ProofSubmissionPipeline uploading = holder[0].pipelineForSelection("user-1", "inv-1");
    uploading.select(new ProofFile("a.png", "image/png", new byte[4]));
    uploading.upload();

    assertThat(seenDuringUpload[0]).isSameAs(uploading);
    assertThat(seenDuringUpload[1]).isSameAs(uploading);
    assertThat(holder[0].pipeline("user-1", "inv-1").snapshot().stage())
        .isEqualTo(ProofStage.UPLOADED);
  }

  private static ProofPipelineRegistry registryWithTicker(
      RecordingProofStorage storage, AtomicLong nanos) {
    return new ProofPipelineRegistry(
        storage,
        mock(InvoiceProofSink.class),
        Clock.systemUTC(),
        new ProofProperties(Duration.ofDays(365), Duration.ofMinutes(30)),
        nanos::get);
  }
}
