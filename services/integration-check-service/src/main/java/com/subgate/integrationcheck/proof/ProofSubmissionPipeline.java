package com.subgate.integrationcheck.proof;

import com.subgate.integrationcheck.common.error.StorageFailureException;
import com.subgate.integrationcheck.invoice.InvoiceProofSink;
import com.subgate.integrationcheck.storage.ProofStorage;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Lifecycle of one payment-proof artifact for one invoice: {@code EMPTY -> PREVIEWING -> UPLOADING
 * -> UPLOADED -> CONFIRMING -> CONFIRMED}.
 *
 * <p>Cancellation is allowed from {@code PREVIEWING} and {@code UPLOADED} only; once confirmation
 * has started the submission cannot be discarded, and {@code CONFIRMED} is terminal.
 *
 * <p>Selecting a new file while an upload is pending drops the pending handle. The stored object
 * is not deleted and stays orphaned in storage, logged at WARN.
 *
 * <p>Storage and invoice calls run outside of any lock. While a call is in flight the pipeline sits
 * in {@code UPLOADING} or {@code CONFIRMING}, which no other operation may leave, so concurrent
 * callers are rejected instead of blocked.
 */
@Slf4j
public class ProofSubmissionPipeline {

  static final String NO_FILE_SELECTED = "No file selected";
  static final String NO_PENDING_UPLOAD = "No pending upload to confirm";
  static final String UPLOAD_FAILED = "Failed to upload payment proof";
  static final String ACKNOWLEDGEMENT_FAILED = "Failed to update invoice";

  private static final Pattern PATH_SEGMENT = Pattern.compile("[A-Za-z0-9_-]{1,128}");

  private final String ownerId;
  private final String invoiceId;
  private final ProofStorage storage;
  private final InvoiceProofSink invoices;
  private final Clock clock;
  private final Duration signedUrlTtl;
  private final AtomicReference<ProofState> state = new AtomicReference<>(ProofState.EMPTY);

  public ProofSubmissionPipeline(
      String ownerId,
      String invoiceId,
      ProofStorage storage,
      InvoiceProofSink invoices,
      Clock clock,
      Duration signedUrlTtl) {
    this.ownerId = requirePathSegment(ownerId, "owner id");
    this.invoiceId = requirePathSegment(invoiceId, "invoice id");
    this.storage = Objects.requireNonNull(storage, "storage");
    this.invoices = Objects.requireNonNull(invoices, "invoices");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.signedUrlTtl = Objects.requireNonNull(signedUrlTtl, "signedUrlTtl");
  }

  public ProofArtifact select(ProofFile file) {
    ProofState current = state.get();
    ProofStage stage = current.stage();
    if (stage == ProofStage.UPLOADING
        || stage == ProofStage.CONFIRMING
        || stage == ProofStage.CONFIRMED) {
      throw new InvalidTransitionException(stage, "Cannot select a file while " + describe(stage));
    }
    ProofFileConstraints.check(file);

    ProofState next = new ProofState.Previewing(file, preview(file));
    if (!state.compareAndSet(current, next)) {
      throw concurrentChange();
    }
    if (current instanceof ProofState.Uploaded uploaded) {
      log.warn(
          "Invoice {}: pending proof {} replaced by a new selection and left in storage",
          invoiceId,
          uploaded.proof().storagePath());
    }
    log.info("Invoice {}: selected {}", invoiceId, file);
    return snapshot();
  }

  public ProofArtifact upload() {
    ProofState current = state.get();
    if (!(current instanceof ProofState.Previewing previewing)) {
      ProofStage stage = current.stage();
      String message =
          stage == ProofStage.EMPTY ? NO_FILE_SELECTED : "Cannot upload while " + describe(stage);
      throw new InvalidTransitionException(stage, message);
    }
    ProofFile file = previewing.file();
    if (!state.compareAndSet(current, new ProofState.Uploading(file))) {
      throw concurrentChange();
    }

    String path = storagePath(file);
    try {
      storage.put(path, file.content(), file.contentType(), true);
      String retrievalUrl = storage.signedUrl(path, signedUrlTtl);
      state.set(
          new ProofState.Uploaded(
              new ProofState.StoredProof(file.fileName(), path, retrievalUrl)));
    } catch (RuntimeException e) {
      // the preview goes too, the user has to pick the file again
      state.set(ProofState.EMPTY);
      log.warn("Invoice {}: upload of {} failed: {}", invoiceId, path, e.getMessage());
      throw new StorageFailureException(UPLOAD_FAILED, e);
    }
    log.info("Invoice {}: proof uploaded to {}, awaiting confirmation", invoiceId, path);
    return snapshot();
  }

  public ProofArtifact confirm() {
    ProofState current = state.get();
    if (!(current instanceof ProofState.Uploaded uploaded)) {
      throw new InvalidTransitionException(current.stage(), NO_PENDING_UPLOAD);
    }
    ProofState.StoredProof proof = uploaded.proof();
    if (!state.compareAndSet(current, new ProofState.Confirming(proof))) {
      throw new InvalidTransitionException(state.get().stage(), NO_PENDING_UPLOAD);
    }

    try {
      invoices.onProofReady(ownerId, invoiceId, proof.retrievalUrl());
    } catch (RuntimeException e) {
      state.set(uploaded);
      log.warn("Invoice {}: proof not acknowledged: {}", invoiceId, e.getMessage());
      throw new ProofAcknowledgementException(ACKNOWLEDGEMENT_FAILED, e);
    }
    state.set(new ProofState.Confirmed(proof));
    log.info("Invoice {}: proof {} submitted", invoiceId, proof.storagePath());
    return snapshot();
  }

  /** Clears an unconfirmed selection. Already stored objects are left in storage. */
  public ProofArtifact cancel() {
    ProofState current = state.get();
    ProofStage stage = current.stage();
    if (stage == ProofStage.EMPTY) {
      return snapshot();
    }
    if (stage != ProofStage.PREVIEWING && stage != ProofStage.UPLOADED) {
      throw new InvalidTransitionException(stage, "Cannot cancel while " + describe(stage));
    }
    if (!state.compareAndSet(current, ProofState.EMPTY)) {
      throw concurrentChange();
    }
    log.info("Invoice {}: selection cleared", invoiceId);
    return snapshot();
  }

  public ProofArtifact snapshot() {
    ProofState current = state.get();
    ProofState.StoredProof stored = storedProof(current);
    String fileName = stored != null ? stored.fileName() : selectedFileName(current);
    return new ProofArtifact(
        invoiceId,
        current.stage(),
        fileName,
        stored == null ? null : stored.storagePath(),
        stored == null ? null : stored.retrievalUrl(),
        current.stage() == ProofStage.CONFIRMED);
  }

  public ProofState state() {
    return state.get();
  }

  public Optional<String> localPreview() {
    return state.get() instanceof ProofState.Previewing previewing
        ? Optional.of(previewing.preview())
        : Optional.empty();
  }

  public String ownerId() {
    return ownerId;
  }

  public String invoiceId() {
    return invoiceId;
  }

  private String storagePath(ProofFile file) {
    return "invoices/"
        + ownerId
        + "/invoice-"
        + invoiceId
        + "-"
        + clock.millis()
        + "."
        + ProofFileConstraints.extension(file);
  }

  private InvalidTransitionException concurrentChange() {
    ProofStage stage = state.get().stage();
    return new InvalidTransitionException(
        stage, "Proof for invoice " + invoiceId + " changed concurrently, now " + describe(stage));
  }

  private static ProofState.StoredProof storedProof(ProofState state) {
    if (state instanceof ProofState.Uploaded uploaded) {
      return uploaded.proof();
    }
    if (state instanceof ProofState.Confirming confirming) {
      return confirming.proof();
    }
    if (state instanceof ProofState.Confirmed confirmed) {
      return confirmed.proof();
    }
    return null;
  }

  private static String selectedFileName(ProofState state) {
    if (state instanceof ProofState.Previewing previewing) {
      return previewing.file().fileName();
    }
    if (state instanceof ProofState.Uploading uploading) {
      return uploading.file().fileName();
    }
    return null;
  }

  private static String preview(ProofFile file) {
    return "data:"
        + file.contentType()
        + ";base64,"
        + Base64.getEncoder().encodeToString(file.content());
  }

  private static String describe(ProofStage stage) {
    return stage.name().toLowerCase(Locale.ROOT);
  }

  private static String requirePathSegment(String value, String what) {
    if (value == null || !PATH_SEGMENT.matcher(value).matches()) {
      throw new IllegalArgumentException("Invalid " + what + ": " + value);
    }
    return value;
  }
}
