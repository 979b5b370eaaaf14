package com.subgate.integrationcheck.proof;

/**
 * A file the user picked as payment proof, held in memory until it is uploaded. The bytes are
 * copied in and out, so the staged content cannot change between selection and upload.
 */
public record ProofFile(String fileName, String contentType, byte[] content) {

  public ProofFile {
    content = content == null ? null : content.clone();
  }

  @Override
  public byte[] content() {
    return content == null ? null : content.clone();
  }

  public long size() {
    return content == null ? 0 : content.length;
  }

  @Override
  public String toString() {
    return "ProofFile[fileName=" + fileName + ", contentType=" + contentType + ", size=" + size()
        + "]";
  }
}
