package com.subgate.integrationcheck.stripe;

import com.fasterxml.jackson.annotation.JsonAlias;

public record KeyCheckRequest(@JsonAlias("secret_key") String secretKey) {

  @Override
  public String toString() {
    return "KeyCheckRequest[secretKey=***]";
  }
}
