package com.subgate.integrationcheck.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.subgate.integrationcheck.stripe.KeyCheckRequest;
import com.subgate.integrationcheck.stripe.KeyCheckVerdict;
import com.subgate.integrationcheck.stripe.PaymentGatewayKeyValidator;
import com.subgate.integrationcheck.telegram.CredentialValidator;
import com.subgate.integrationcheck.telegram.ValidationRequest;
import com.subgate.integrationcheck.telegram.ValidationVerdict;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(IntegrationValidationController.class)
@Import(LatestVerdicts.class)
class IntegrationValidationControllerTest {

  @Autowired MockMvc mvc;

  @MockBean CredentialValidator credentialValidator;

  @MockBean PaymentGatewayKeyValidator keyValidator;

  @Test
  void botVerdictIsReturnedAndRemembered() throws Exception {
    when(credentialValidator.validate(new ValidationRequest("123:abc", "-100123")))
        .thenReturn(
            ValidationVerdict.valid(new ValidationVerdict.Subject("subs_bot", "Premium")));

    mvc.perform(
            post("/api/integrations/telegram/validate")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"bot_token\":\"123:abc\",\"channel_id\":\"-100123\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.valid").value(true))
        .andExpect(jsonPath("$.subject.botUsername").value("subs_bot"))
        .andExpect(jsonPath("$.subject.channelTitle").value("Premium"))
        .andExpect(jsonPath("$.error").doesNotExist())
        .andExpect(jsonPath("$.step").doesNotExist());

    mvc.perform(get("/api/integrations/telegram/validate/latest").header("X-User-Id", "user-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.subject.botUsername").value("subs_bot"));
  }

  @Test
  void invalidVerdictIsStill200() throws Exception {
    when(credentialValidator.validate(any()))
        .thenReturn(ValidationVerdict.rejectedAt("permissions", "bot lacks required permission"));

    mvc.perform(
            post("/api/integrations/telegram/validate")
                .header("X-User-Id", "user-2")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"botToken\":\"bad\",\"channelId\":\"-100123\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.valid").value(false))
        .andExpect(jsonPath("$.error").value("bot lacks required permission"))
        .andExpect(jsonPath("$.step").value("permissions"))
        .andExpect(jsonPath("$.subject").doesNotExist());
  }

  @Test
  void noLatestVerdictBeforeAnyCheck() throws Exception {
    mvc.perform(get("/api/integrations/stripe/validate/latest").header("X-User-Id", "nobody"))
        .andExpect(status().isNotFound());
  }

  @Test
  void keyVerdictCarriesAccountFields() throws Exception {
    when(keyValidator.validate(new KeyCheckRequest("sk_test_abc")))
        .thenReturn(KeyCheckVerdict.valid("Acme", "acct_1", false));

    mvc.perform(
            post("/api/integrations/stripe/validate")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"secret_key\":\"sk_test_abc\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.valid").value(true))
        .andExpect(jsonPath("$.accountName").value("Acme"))
        .andExpect(jsonPath("$.accountId").value("acct_1"))
        .andExpect(jsonPath("$.liveMode").value(false));

    verify(keyValidator).validate(new KeyCheckRequest("sk_test_abc"));
  }

  @Test
  void userHeaderIsRequired() throws Exception {
    mvc.perform(
            post("/api/integrations/stripe/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"secretKey\":\"sk_test_abc\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("malformed-input"));
  }
}
