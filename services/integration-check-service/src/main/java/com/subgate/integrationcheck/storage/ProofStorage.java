package com.subgate.integrationcheck.storage;

import java.time.Duration;

/**
 * Durable object storage for proof artifacts. Both operations throw {@link
 * com.subgate.integrationcheck.common.error.StorageFailureException} on any failure.
 */
public interface ProofStorage {

  void put(String path, byte[] content, String contentType, boolean overwrite);

  /** Returns an absolute URL that grants read access to {@code path} for {@code ttl}. */
  String signedUrl(String path, Duration ttl);
}
