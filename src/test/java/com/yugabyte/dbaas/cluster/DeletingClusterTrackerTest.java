// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.cluster;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.yugabyte.dbaas.common.TestUtils;
import com.yugabyte.dbaas.common.kubernetes.KubectlManager;
import com.yugabyte.dbaas.models.psmdb.PerconaServerMongoDB;
import com.yugabyte.dbaas.models.pxc.PerconaXtraDBCluster;
import io.fabric8.kubernetes.api.model.PodList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class DeletingClusterTrackerTest {

  @Mock KubectlManager kubectl;

  @Before
  public void setUp() {
    when(kubectl.getPods(null)).thenReturn(TestUtils.readFixture("pods.json", PodList.class));
  }

  @Test
  public void testFindDeleting() {
    Set<String> running = new HashSet<>(ImmutableList.of("first"));
    List<String> deleting =
        DeletingClusterTracker.findDeleting(kubectl, PerconaXtraDBCluster.OPERATOR_NAME, running);
    // Two pods of the same cluster are reported once.
    assertEquals(ImmutableList.of("gone"), deleting);
    assertTrue(running.contains("gone"));
  }

  @Test
  public void testOtherOperatorIgnored() {
    Set<String> running = new HashSet<>();
    List<String> deleting =
        DeletingClusterTracker.findDeleting(kubectl, PerconaServerMongoDB.OPERATOR_NAME, running);
    assertEquals(ImmutableList.of("old-mongo"), deleting);
  }

  @Test
  public void testNothingDeleting() {
    Set<String> running = new HashSet<>(ImmutableList.of("first", "gone"));
    assertTrue(
        DeletingClusterTracker.findDeleting(kubectl, PerconaXtraDBCluster.OPERATOR_NAME, running)
            .isEmpty());
  }
}
