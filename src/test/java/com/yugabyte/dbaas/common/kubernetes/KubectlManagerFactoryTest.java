// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.common.kubernetes;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.yugabyte.dbaas.common.ShellProcessHandler;
import com.yugabyte.dbaas.common.TestUtils;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class KubectlManagerFactoryTest {

  static final String TMP_PATH = "/tmp/dbaas_tests/KubectlManagerFactoryTest";

  @Mock ShellProcessHandler shellProcessHandler;

  private String kubectlPath;

  @Before
  public void setUp() throws IOException {
    new File(TMP_PATH).mkdirs();
    Path kubectl = Paths.get(TMP_PATH, "kubectl-1.16");
    Files.write(kubectl, "#!/bin/sh\n".getBytes(StandardCharsets.UTF_8));
    kubectl.toFile().setExecutable(true);
    kubectlPath = kubectl.toString();
  }

  @After
  public void tearDown() throws IOException {
    FileUtils.deleteDirectory(new File(TMP_PATH));
  }

  private KubectlManagerFactory factory(List<String> defaultPaths, String devCommand) {
    Config config =
        ConfigFactory.parseMap(
            ImmutableMap.<String, Object>builder()
                .put(KubectlManagerFactory.DEFAULT_PATHS, defaultPaths)
                .put(KubectlManagerFactory.DEV_COMMAND, devCommand)
                .put(KubectlManagerFactory.SELECT_VERSION, false)
                .put(KubectlManagerFactory.TIMEOUT_SECS, 30)
                .put(KubectlManagerFactory.SHELL_TMP_DIR, TMP_PATH)
                .build());
    return new KubectlManagerFactory(shellProcessHandler, config);
  }

  @Test
  public void testCreateWithoutKubeconfig() {
    KubectlManagerFactory factory =
        factory(ImmutableList.of("/nonexistent/kubectl", kubectlPath), "");
    try (KubectlManager kubectl = factory.create(null)) {
      assertEquals(ImmutableList.of(kubectlPath), kubectl.getKubectlCommand());
    }
  }

  @Test
  public void testCreateSavesKubeconfig() throws IOException {
    KubectlManagerFactory factory = factory(ImmutableList.of(kubectlPath), "");
    Path kubeconfigFile;
    try (KubectlManager kubectl = factory.create("{\"kind\": \"Config\"}")) {
      List<String> command = kubectl.getKubectlCommand();
      assertEquals(2, command.size());
      assertEquals(kubectlPath, command.get(0));
      assertTrue(command.get(1).startsWith("--kubeconfig="));
      kubeconfigFile = Paths.get(command.get(1).substring("--kubeconfig=".length()));
      assertEquals(
          "{\"kind\": \"Config\"}", new String(Files.readAllBytes(kubeconfigFile)));
    }
    assertFalse(Files.exists(kubeconfigFile));
  }

  @Test
  public void testDevCommandFallback() {
    KubectlManagerFactory factory =
        factory(ImmutableList.of("/nonexistent/kubectl"), kubectlPath + " kubectl --");
    assertEquals(
        ImmutableList.of(kubectlPath, "kubectl", "--"), factory.getDefaultKubectlCommand());
  }

  @Test
  public void testNoKubectlFound() {
    KubectlManagerFactory factory =
        factory(ImmutableList.of("/nonexistent/kubectl"), "dbaas-no-such-binary kubectl --");
    assertThrows(KubectlException.class, () -> factory.create(null));
  }

  @Test
  public void testSelectKubectlVersions() {
    assertEquals(
        ImmutableList.of("kubectl-1.19", "kubectl-1.18", "kubectl-1.17"),
        KubectlManagerFactory.selectKubectlVersions(
            TestUtils.readResource("fixtures/kubectl-version.json")));
  }

  @Test
  public void testSelectKubectlVersionsWithoutServer() {
    assertThrows(
        KubectlException.class,
        () -> KubectlManagerFactory.selectKubectlVersions("{\"clientVersion\": {}}"));
    assertThrows(
        KubectlException.class, () -> KubectlManagerFactory.selectKubectlVersions("not json"));
  }
}
