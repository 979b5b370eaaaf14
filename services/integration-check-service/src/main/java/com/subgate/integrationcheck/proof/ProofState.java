package com.subgate.integrationcheck.proof;

/**
 * State of one proof pipeline. Each stage carries only the data that exists at that point: there
 * is no retrieval URL before an upload finished and no confirmation without one.
 */
public interface ProofState {

  Empty EMPTY = new Empty();

  ProofStage stage();

  record Empty() implements ProofState {
    @Override
    public ProofStage stage() {
      return ProofStage.EMPTY;
    }
  }

  /** {@code preview} is a {@code data:} URL of the file and never leaves this process. */
  record Previewing(ProofFile file, String preview) implements ProofState {
    @Override
    public ProofStage stage() {
      return ProofStage.PREVIEWING;
    }
  }

  record Uploading(ProofFile file) implements ProofState {
    @Override
    public ProofStage stage() {
      return ProofStage.UPLOADING;
    }
  }

  record Uploaded(StoredProof proof) implements ProofState {
    @Override
    public ProofStage stage() {
      return ProofStage.UPLOADED;
    }
  }

  record Confirming(StoredProof proof) implements ProofState {
    @Override
    public ProofStage stage() {
      return ProofStage.CONFIRMING;
    }
  }

  record Confirmed(StoredProof proof) implements ProofState {
    @Override
    public ProofStage stage() {
      return ProofStage.CONFIRMED;
    }
  }

  record StoredProof(String fileName, String storagePath, String retrievalUrl) {}
}
