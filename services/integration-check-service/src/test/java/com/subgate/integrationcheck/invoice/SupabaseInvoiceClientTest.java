package com.subgate.integrationcheck.invoice;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.subgate.integrationcheck.config.SupabaseProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

class SupabaseInvoiceClientTest {

  private static final String USER_1_INV_1 =
      "https://proj.supabase.co/rest/v1/invoices?id=eq.inv-1&client_id=eq.user-1&select=id";

  private MockRestServiceServer server;
  private SupabaseInvoiceClient client;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    client =
        new SupabaseInvoiceClient(
            builder,
            new SupabaseProperties(
                "https://proj.supabase.co", "service-key", "invoice-proofs", "invoices"));
  }

  @Test
  void patchesProofUrlAndReviewNoteOnOwnersInvoice() {
    server
        .expect(requestTo(USER_1_INV_1))
        .andExpect(method(HttpMethod.PATCH))
        .andExpect(header("apikey", "service-key"))
        .andExpect(header("Prefer", "return=representation"))
        .andExpect(
            content()
                .json(
                    "{\"payment_proof_url\":\"https://signed/url\","
                        + "\"notes\":\"Payment proof uploaded, awaiting review\"}"))
        .andRespond(withSuccess("[{\"id\":\"inv-1\"}]", MediaType.APPLICATION_JSON));

    client.onProofReady("user-1", "inv-1", "https://signed/url");

    server.verify();
  }

  @Test
  void noMatchingRowIsNotAnAcknowledgement() {
    server
        .expect(requestTo(USER_1_INV_1))
        .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> client.onProofReady("user-1", "inv-1", "https://signed/url"))
        .isInstanceOf(InvoiceNotFoundException.class)
        .hasMessageContaining("inv-1");
  }

  @Test
  void invoiceOfAnotherClientIsNotTouched() {
    server
        .expect(
            requestTo(
                "https://proj.supabase.co/rest/v1/invoices"
                    + "?id=eq.inv-1&client_id=eq.user-2&select=id"))
        .andExpect(method(HttpMethod.PATCH))
        .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> client.onProofReady("user-2", "inv-1", "https://signed/url"))
        .isInstanceOf(InvoiceNotFoundException.class);
    server.verify();
  }

  @Test
  void failedPatchPropagates() {
    server.expect(requestTo(USER_1_INV_1)).andRespond(withServerError());

    assertThatThrownBy(() -> client.onProofReady("user-1", "inv-1", "https://signed/url"))
        .isInstanceOf(RestClientException.class);
  }
}
