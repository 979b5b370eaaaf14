package com.subgate.integrationcheck.proof;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.subgate.integrationcheck.config.ProofProperties;
import com.subgate.integrationcheck.invoice.InvoiceProofSink;
import com.subgate.integrationcheck.storage.ProofStorage;
import java.time.Clock;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Live pipelines, one per (owner, invoice). Idle pipelines expire; an expired pending upload is
 * left in storage like any other abandoned selection.
 *
 * <p>There is no size bound. A pipeline seen in {@code UPLOADING} or {@code CONFIRMING} is not
 * expired until it is accessed again in another stage, so a new selection never replaces a
 * pipeline whose storage or invoice call is still running.
 */
@Service
@Slf4j
public class ProofPipelineRegistry {

  private final Cache<PipelineKey, ProofSubmissionPipeline> pipelines;
  private final ProofStorage storage;
  private final InvoiceProofSink invoices;
  private final Clock clock;
  private final ProofProperties properties;

  @Autowired
  public ProofPipelineRegistry(
      ProofStorage storage, InvoiceProofSink invoices, Clock clock, ProofProperties properties) {
    this(storage, invoices, clock, properties, Ticker.systemTicker());
  }

  ProofPipelineRegistry(
      ProofStorage storage,
      InvoiceProofSink invoices,
      Clock clock,
      ProofProperties properties,
      Ticker ticker) {
    this.storage = storage;
    this.invoices = invoices;
    this.clock = clock;
    this.properties = properties;
    this.pipelines =
        Caffeine.newBuilder()
            .expireAfter(new IdleUnlessInFlight(properties.pipelineIdleTtl()))
            .ticker(ticker)
            .build();
  }

  /** Existing pipeline for the invoice, or a fresh one in {@code EMPTY}. */
  public ProofSubmissionPipeline pipeline(String ownerId, String invoiceId) {
    return pipelines.get(new PipelineKey(ownerId, invoiceId), this::create);
  }

  /**
   * Pipeline to start a new selection on. A submitted proof is final, so a further selection for
   * the same invoice begins a new cycle.
   */
  public ProofSubmissionPipeline pipelineForSelection(String ownerId, String invoiceId) {
    PipelineKey key = new PipelineKey(ownerId, invoiceId);
    return pipelines
        .asMap()
        .compute(
            key,
            (k, existing) -> {
              if (existing == null) {
                return create(k);
              }
              if (existing.state().stage() == ProofStage.CONFIRMED) {
                log.info("Invoice {}: starting a new proof cycle after submission", invoiceId);
                return create(k);
              }
              return existing;
            });
  }

  private ProofSubmissionPipeline create(PipelineKey key) {
    return new ProofSubmissionPipeline(
        key.ownerId(), key.invoiceId(), storage, invoices, clock, properties.signedUrlTtl());
  }

  private record PipelineKey(String ownerId, String invoiceId) {}

  private static final class IdleUnlessInFlight
      implements Expiry<PipelineKey, ProofSubmissionPipeline> {

    private final long idleNanos;

    IdleUnlessInFlight(Duration idleTtl) {
      this.idleNanos = idleTtl.toNanos();
    }

    @Override
    public long expireAfterCreate(
        PipelineKey key, ProofSubmissionPipeline pipeline, long currentTime) {
      return lifetime(pipeline);
    }

    @Override
    public long expireAfterUpdate(
        PipelineKey key, ProofSubmissionPipeline pipeline, long currentTime, long currentDuration) {
      return lifetime(pipeline);
    }

    @Override
    public long expireAfterRead(
        PipelineKey key, ProofSubmissionPipeline pipeline, long currentTime, long currentDuration) {
      return lifetime(pipeline);
    }

    private long lifetime(ProofSubmissionPipeline pipeline) {
      ProofStage stage = pipeline.state().stage();
      return stage == ProofStage.UPLOADING || stage == ProofStage.CONFIRMING
          ? Long.MAX_VALUE
          : idleNanos;
    }
  }
}
