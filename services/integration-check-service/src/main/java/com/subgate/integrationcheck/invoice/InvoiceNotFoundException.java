package com.subgate.integrationcheck.invoice;

/** No invoice with the given id belongs to the acting user. */
public class InvoiceNotFoundException extends RuntimeException {
  public InvoiceNotFoundException(String message) {
    super(message);
  }
}
