// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.cluster;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.yugabyte.dbaas.common.kubernetes.KubectlManager;
import com.yugabyte.dbaas.forms.OperatorVersions;
import java.util.List;
import org.junit.Test;

public class OperatorVersionDetectorTest {

  static final List<String> API_VERSIONS =
      ImmutableList.of(
          "apps/v1",
          "pxc.percona.com/v1",
          "pxc.percona.com/v1-10-0",
          "pxc.percona.com/v1-7-0",
          "pxc.percona.com/v1-9-0",
          "pxc.percona.com/v1-x-0",
          "psmdb.percona.com/v1",
          "psmdb.percona.com/v1-6-0",
          "notpxc.percona.com/v1-99-0");

  @Test
  public void testLatestVersion() {
    assertEquals("1.10.0", OperatorVersionDetector.latestVersion(API_VERSIONS, "pxc.percona.com"));
    assertEquals("1.6.0", OperatorVersionDetector.latestVersion(API_VERSIONS, "psmdb.percona.com"));
  }

  @Test
  public void testNotInstalled() {
    assertNull(
        OperatorVersionDetector.latestVersion(
            ImmutableList.of("apps/v1", "pxc.percona.com/v1"), "pxc.percona.com"));
    assertNull(OperatorVersionDetector.latestVersion(ImmutableList.of(), "psmdb.percona.com"));
  }

  @Test
  public void testDetect() {
    KubectlManager kubectl = mock(KubectlManager.class);
    when(kubectl.getApiVersions()).thenReturn(API_VERSIONS);
    assertEquals(new OperatorVersions("1.10.0", "1.6.0"), OperatorVersionDetector.detect(kubectl));
  }
}
