package com.example.enterprise.client;

import com.example.enterprise.client.dto.EnterpriseStateResponse;

/** The observed state does not match the expectation yet. */
public class StateNotConvergedException extends RuntimeException {

  private final transient EnterpriseStateResponse observed;

  public StateNotConvergedException(String message, EnterpriseStateResponse observed) {
    super(message);
    this.observed = observed;
  }

  public EnterpriseStateResponse observed() {
    return observed;
  }
}
