package com.gocardless.client.service;

final class ServiceArguments {

  private ServiceArguments() {
  }

  static String requireIdentity(String identity) {
    if (identity == null || identity.isBlank()) {
      throw new IllegalArgumentException("identity must not be blank");
    }
    return identity;
  }
}
