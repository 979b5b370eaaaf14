package com.subgate.integrationcheck.proof;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Read-only view of a pipeline. The local preview is never part of it. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProofArtifact(
    String invoiceId,
    ProofStage stage,
    String fileName,
    String storagePath,
    String retrievalUrl,
    boolean confirmed) {}
