package com.ospicorp.locationtracker.store;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a credential pair is worth handing to a real DynamoDB client.
 */
public final class CredentialInspector {

  private static final List<String> PLACEHOLDER_PATTERNS = List.of(
      "akiadummykey",
      "dummysecretkey",
      "your-aws-",
      "your-secret-",
      "dummy",
      "placeholder",
      "example",
      "test_key");

  static final int MIN_ACCESS_KEY_LENGTH = 16;
  static final int MIN_SECRET_KEY_LENGTH = 30;

  private CredentialInspector() {
  }

  public static CredentialStatus inspect(String accessKeyId, String secretAccessKey) {
    if (isBlank(accessKeyId) || isBlank(secretAccessKey)) {
      return CredentialStatus.UNCONFIGURED;
    }
    String access = accessKeyId.toLowerCase(Locale.ROOT);
    String secret = secretAccessKey.toLowerCase(Locale.ROOT);
    for (String pattern : PLACEHOLDER_PATTERNS) {
      if (access.contains(pattern) || secret.contains(pattern)) {
        return CredentialStatus.INVALID_PLACEHOLDER;
      }
    }
    if (accessKeyId.length() < MIN_ACCESS_KEY_LENGTH
        || secretAccessKey.length() < MIN_SECRET_KEY_LENGTH) {
      return CredentialStatus.INVALID_PLACEHOLDER;
    }
    return CredentialStatus.CONFIGURED;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
