package com.subgate.integrationcheck.proof;

import java.util.List;
import java.util.Locale;

public final class ProofFileConstraints {

  public static final List<String> ALLOWED_TYPES =
      List.of("image/jpeg", "image/png", "image/webp", "image/gif");

  /** 5 MiB, inclusive. */
  public static final long MAX_BYTES = 5L * 1024 * 1024;

  static final String INVALID_TYPE_MESSAGE =
      "Invalid file type. Please upload JPG, PNG, WebP, or GIF.";
  static final String TOO_LARGE_MESSAGE = "File too large. Maximum size is 5MB.";

  private ProofFileConstraints() {}

  public static void check(ProofFile file) {
    if (file == null || file.content() == null) {
      throw new ProofConstraintException("No file provided");
    }
    String type = file.contentType() == null ? "" : file.contentType().toLowerCase(Locale.ROOT);
    if (!ALLOWED_TYPES.contains(type)) {
      throw new ProofConstraintException(INVALID_TYPE_MESSAGE);
    }
    if (file.size() > MAX_BYTES) {
      throw new ProofConstraintException(TOO_LARGE_MESSAGE);
    }
  }

  /** File extension for the storage path, taken from the name or, failing that, the type. */
  static String extension(ProofFile file) {
    String name = file.fileName() == null ? "" : file.fileName();
    int dot = name.lastIndexOf('.');
    if (dot >= 0 && dot < name.length() - 1) {
      String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
      if (ext.matches("[a-z0-9]{1,5}")) {
        return ext;
      }
    }
    String type = file.contentType().toLowerCase(Locale.ROOT);
    return "image/jpeg".equals(type) ? "jpg" : type.substring(type.indexOf('/') + 1);
  }
}
