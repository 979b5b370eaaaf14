package com.subgate.integrationcheck.invoice;

/**
 * Owner of the invoice records. The proof pipeline hands over the retrieval URL here and treats a
 * normal return as the acknowledgement; any exception means the invoice did not take the proof.
 *
 * <p>Implementations only touch an invoice that belongs to {@code ownerId}; an invoice that does
 * not exist for that owner is reported with {@link InvoiceNotFoundException}.
 */
public interface InvoiceProofSink {

  void onProofReady(String ownerId, String invoiceId, String retrievalUrl);
}
