// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.cluster;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.yugabyte.dbaas.common.kubernetes.KubectlManager;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.MapUtils;

/** Generates cluster passwords and manages the secrets holding them. */
@Singleton
@Slf4j
public class ClusterSecretProvisioner {

  // Characters accepted by both operators in passwords.
  static final String PASSWORD_CHARACTERS =
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

  static final int PASSWORD_LENGTH = 24;

  static final String SECRET_TYPE_OPAQUE = "Opaque";

  private final SecureRandom random;

  @Inject
  public ClusterSecretProvisioner() {
    this(new SecureRandom());
  }

  @VisibleForTesting
  ClusterSecretProvisioner(SecureRandom random) {
    this.random = random;
  }

  public String generatePassword() {
    StringBuilder sb = new StringBuilder(PASSWORD_LENGTH);
    for (int i = 0; i < PASSWORD_LENGTH; i++) {
      sb.append(PASSWORD_CHARACTERS.charAt(random.nextInt(PASSWORD_CHARACTERS.length())));
    }
    return sb.toString();
  }

  /** Returns a new random password for every key, in the order of the keys. */
  public Map<String, String> generatePasswords(Collection<String> keys) {
    Map<String, String> passwords = new LinkedHashMap<>();
    for (String key : keys) {
      passwords.put(key, generatePassword());
    }
    return passwords;
  }

  /**
   * Creates the Opaque secret of a cluster. Keys of the template secret are kept unless
   * overwritten by the given values. A missing template secret is not an error.
   *
   * @param values plain text values, encoded here.
   */
  public void createSecret(
      KubectlManager kubectl,
      String secretName,
      String templateSecretName,
      Map<String, String> values) {
    Map<String, String> data = new LinkedHashMap<>();
    Optional<Secret> template = kubectl.getSecret(templateSecretName);
    if (template.isPresent()) {
      data.putAll(MapUtils.emptyIfNull(template.get().getData()));
    } else {
      log.debug("Template secret {} not found", templateSecretName);
    }
    values.forEach((key, value) -> data.put(key, encode(value)));

    Secret secret =
        new SecretBuilder()
            .withApiVersion("v1")
            .withKind("Secret")
            .withNewMetadata()
            .withName(secretName)
            .endMetadata()
            .withType(SECRET_TYPE_OPAQUE)
            .withData(data)
            .build();
    kubectl.apply(secret);
    log.info("Created secret {}", secretName);
  }

  /** Deletes the secrets one by one. Failures are logged and do not stop the remaining ones. */
  public void deleteSecrets(KubectlManager kubectl, List<String> secretNames) {
    for (String secretName : secretNames) {
      Secret secret =
          new SecretBuilder()
              .withApiVersion("v1")
              .withKind("Secret")
              .withNewMetadata()
              .withName(secretName)
              .endMetadata()
              .build();
      try {
        kubectl.delete(secret);
      } catch (RuntimeException e) {
        log.error("Cannot delete secret {}: {}", secretName, e.getMessage());
      }
    }
  }

  /** Decoded value of a key from the data section of a secret. */
  public static Optional<String> readSecretValue(Secret secret, String key) {
    if (secret.getData() == null || secret.getData().get(key) == null) {
      return Optional.empty();
    }
    byte[] decoded = Base64.getDecoder().decode(secret.getData().get(key));
    return Optional.of(new String(decoded, StandardCharsets.UTF_8));
  }

  static String encode(String value) {
    return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
  }
}
