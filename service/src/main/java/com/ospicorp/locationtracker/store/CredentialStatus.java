package com.ospicorp.locationtracker.store;

public enum CredentialStatus {
  UNCONFIGURED,
  INVALID_PLACEHOLDER,
  CONFIGURED
}
