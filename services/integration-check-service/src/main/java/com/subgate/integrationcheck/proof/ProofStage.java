package com.subgate.integrationcheck.proof;

public enum ProofStage {
  EMPTY,
  PREVIEWING,
  UPLOADING,
  UPLOADED,
  CONFIRMING,
  CONFIRMED
}
