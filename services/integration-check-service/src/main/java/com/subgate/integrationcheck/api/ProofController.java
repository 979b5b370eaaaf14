package com.subgate.integrationcheck.api;

import com.subgate.integrationcheck.proof.ProofArtifact;
import com.subgate.integrationcheck.proof.ProofFile;
import com.subgate.integrationcheck.proof.ProofPipelineRegistry;
import java.io.IOException;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** Manual payment proof for an invoice: pick a file, upload it, then submit it explicitly. */
@RestController
@RequestMapping("/api/invoices/{invoiceId}/proof")
public class ProofController {

  private static final String USER_HEADER = IntegrationValidationController.USER_HEADER;

  private final ProofPipelineRegistry registry;

  public ProofController(ProofPipelineRegistry registry) {
    this.registry = registry;
  }

  @GetMapping
  public ProofArtifact get(
      @RequestHeader(USER_HEADER) String userId, @PathVariable String invoiceId) {
    return registry.pipeline(userId, invoiceId).snapshot();
  }

  @PostMapping(path = "/selection", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ProofArtifact select(
      @RequestHeader(USER_HEADER) String userId,
      @PathVariable String invoiceId,
      @RequestPart("file") MultipartFile file)
      throws IOException {
    ProofFile proofFile =
        new ProofFile(file.getOriginalFilename(), file.getContentType(), file.getBytes());
    return registry.pipelineForSelection(userId, invoiceId).select(proofFile);
  }

  @DeleteMapping("/selection")
  public ProofArtifact cancel(
      @RequestHeader(USER_HEADER) String userId, @PathVariable String invoiceId) {
    return registry.pipeline(userId, invoiceId).cancel();
  }

  @PostMapping("/upload")
  public ProofArtifact upload(
      @RequestHeader(USER_HEADER) String userId, @PathVariable String invoiceId) {
    return registry.pipeline(userId, invoiceId).upload();
  }

  @PostMapping("/confirm")
  public ProofArtifact confirm(
      @RequestHeader(USER_HEADER) String userId, @PathVariable String invoiceId) {
    return registry.pipeline(userId, invoiceId).confirm();
  }
}
