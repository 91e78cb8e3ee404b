// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.cluster;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableMap;
import com.fasterxml.jackson.databind.JsonNode;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.yugabyte.dbaas.common.ErrorCode;
import com.yugabyte.dbaas.common.Json;
import com.yugabyte.dbaas.common.PlatformServiceException;
import com.yugabyte.dbaas.common.TestUtils;
import com.yugabyte.dbaas.models.VolumeSpec;
import com.yugabyte.dbaas.models.pxc.PerconaXtraDBCluster;
import com.yugabyte.dbaas.models.pxc.PerconaXtraDBCluster.BackupStorage;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class CustomResourceTemplatesTest {

  static final String TMP_PATH = "/tmp/dbaas_tests/CustomResourceTemplatesTest";

  private Path pxcTemplate;

  @Before
  public void setUp() throws IOException {
    new File(TMP_PATH).mkdirs();
    pxcTemplate = Paths.get(TMP_PATH, "pxc.yaml");
    Files.write(
        pxcTemplate,
        TestUtils.readResource("fixtures/cr-template-pxc.yaml").getBytes(StandardCharsets.UTF_8));
  }

  @After
  public void tearDown() throws IOException {
    FileUtils.deleteDirectory(new File(TMP_PATH));
  }

  private static CustomResourceTemplates templates(String pxc, String psmdb) {
    Config config =
        ConfigFactory.parseMap(
            ImmutableMap.of(
                CustomResourceTemplates.PXC_TEMPLATE, pxc,
                CustomResourceTemplates.PSMDB_TEMPLATE, psmdb));
    return new CustomResourceTemplates(config);
  }

  @Test
  public void testLoadTemplate() {
    Optional<PerconaXtraDBCluster> template =
        templates(pxcTemplate.toString(), "").xtraDBTemplate();
    assertTrue(template.isPresent());
    PerconaXtraDBCluster cluster = template.get();
    assertEquals("pxc.percona.com/v1-6-0", cluster.getApiVersion());
    assertEquals("custom-secrets", cluster.getSpec().getSecretsName());
    assertEquals(Integer.valueOf(3), cluster.getSpec().getPxc().getSize());
    VolumeSpec volumeSpec = cluster.getSpec().getPxc().getVolumeSpec();
    assertEquals("fast-ssd", volumeSpec.getPersistentVolumeClaim().getStorageClassName());
    assertEquals(Boolean.TRUE, cluster.getSpec().getHaproxy().getEnabled());
  }

  @Test
  public void testTemplateKeepsUnmodelledFields() {
    PerconaXtraDBCluster cluster = templates(pxcTemplate.toString(), "").xtraDBTemplate().get();
    BackupStorage storage = cluster.getSpec().getBackup().getStorages().get("s3-us-west");
    assertEquals("s3", storage.getType());

    JsonNode written = Json.toJson(cluster);
    assertEquals("cert-issuer", written.at("/spec/tls/issuerConf/name").asText());
    assertEquals("[mysqld]\nwsrep_debug=ON\n", written.at("/spec/pxc/configuration").asText());
    assertEquals("ssd", written.at("/spec/pxc/nodeSelector/disktype").asText());
    assertEquals(
        "true",
        written
            .at("/spec/pxc/expose/annotations")
            .path("service.beta.kubernetes.io/aws-load-balancer-internal")
            .asText());
    assertEquals("backups", written.at("/spec/backup/storages/s3-us-west/s3/bucket").asText());
    JsonNode claim = written.at("/spec/pxc/volumeSpec/persistentVolumeClaim");
    assertEquals("6Gi", claim.at("/resources/requests/storage").asText());
  }

  @Test
  public void testNotConfigured() {
    CustomResourceTemplates templates = templates("", " ");
    assertFalse(templates.xtraDBTemplate().isPresent());
    assertFalse(templates.psmdbTemplate().isPresent());
  }

  @Test
  public void testMissingFile() {
    assertFalse(templates("", TMP_PATH + "/missing.yaml").psmdbTemplate().isPresent());
  }

  @Test
  public void testMalformedTemplate() throws IOException {
    Path broken = Paths.get(TMP_PATH, "broken.yaml");
    Files.write(broken, "spec: [unclosed".getBytes(StandardCharsets.UTF_8));
    PlatformServiceException e =
        assertThrows(
            PlatformServiceException.class,
            () -> CustomResourceTemplates.load(broken, PerconaXtraDBCluster.class));
    assertEquals(ErrorCode.INTERNAL, e.getCode());
  }
}
