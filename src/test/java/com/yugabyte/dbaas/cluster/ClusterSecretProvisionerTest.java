// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.cluster;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.yugabyte.dbaas.common.kubernetes.KubectlException;
import com.yugabyte.dbaas.common.kubernetes.KubectlManager;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import java.security.SecureRandom;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class ClusterSecretProvisionerTest {

  @Mock KubectlManager kubectl;

  @Captor ArgumentCaptor<Secret> secretCaptor;

  ClusterSecretProvisioner provisioner;

  @Before
  public void setUp() {
    provisioner = new ClusterSecretProvisioner(new SecureRandom());
  }

  @Test
  public void testGeneratePassword() {
    String password = provisioner.generatePassword();
    assertEquals(ClusterSecretProvisioner.PASSWORD_LENGTH, password.length());
    assertTrue(password.matches("[a-zA-Z0-9]+"));
    assertNotEquals(password, provisioner.generatePassword());
  }

  @Test
  public void testGeneratePasswords() {
    Map<String, String> passwords =
        provisioner.generatePasswords(ImmutableList.of("root", "xtrabackup", "monitor"));
    assertEquals(
        ImmutableList.of("root", "xtrabackup", "monitor"),
        ImmutableList.copyOf(passwords.keySet()));
    passwords.values().forEach(p -> assertEquals(24, p.length()));
  }

  @Test
  public void testCreateSecretMergesTemplate() {
    Secret template =
        new SecretBuilder()
            .withNewMetadata()
            .withName("my-cluster-secrets")
            .endMetadata()
            .withData(
                ImmutableMap.of(
                    "root", ClusterSecretProvisioner.encode("template-root"),
                    "operator", ClusterSecretProvisioner.encode("template-operator")))
            .build();
    when(kubectl.getSecret("my-cluster-secrets")).thenReturn(Optional.of(template));

    provisioner.createSecret(
        kubectl, "dbaas-test-pxc-secrets", "my-cluster-secrets", ImmutableMap.of("root", "s3cret"));

    verify(kubectl).apply(secretCaptor.capture());
    Secret secret = secretCaptor.getValue();
    assertEquals("dbaas-test-pxc-secrets", secret.getMetadata().getName());
    assertEquals("Opaque", secret.getType());
    assertEquals("Secret", secret.getKind());
    assertEquals(2, secret.getData().size());
    assertEquals(Optional.of("s3cret"), ClusterSecretProvisioner.readSecretValue(secret, "root"));
    assertEquals(
        Optional.of("template-operator"),
        ClusterSecretProvisioner.readSecretValue(secret, "operator"));
  }

  @Test
  public void testCreateSecretWithoutTemplate() {
    when(kubectl.getSecret("my-cluster-secrets")).thenReturn(Optional.empty());
    provisioner.createSecret(
        kubectl, "dbaas-test-pxc-secrets", "my-cluster-secrets", ImmutableMap.of("root", "pw"));
    verify(kubectl).apply(secretCaptor.capture());
    assertEquals(
        ImmutableMap.of("root", ClusterSecretProvisioner.encode("pw")),
        secretCaptor.getValue().getData());
  }

  @Test
  public void testDeleteSecretsContinuesOnFailure() {
    doThrow(new KubectlException("cmd", 1, "forbidden"))
        .doNothing()
        .when(kubectl)
        .delete(any());
    provisioner.deleteSecrets(kubectl, ImmutableList.of("dbaas-test-pxc-secrets", "internal-test"));
    verify(kubectl, times(2)).delete(secretCaptor.capture());
    List<Secret> deleted = secretCaptor.getAllValues();
    assertEquals("dbaas-test-pxc-secrets", deleted.get(0).getMetadata().getName());
    assertEquals("internal-test", deleted.get(1).getMetadata().getName());
  }

  @Test
  public void testReadSecretValue() {
    Secret secret = new SecretBuilder().withData(ImmutableMap.of("a", "dmFsdWU=")).build();
    assertEquals(Optional.of("value"), ClusterSecretProvisioner.readSecretValue(secret, "a"));
    assertFalse(ClusterSecretProvisioner.readSecretValue(secret, "b").isPresent());
    assertFalse(ClusterSecretProvisioner.readSecretValue(new Secret(), "a").isPresent());
  }
}
