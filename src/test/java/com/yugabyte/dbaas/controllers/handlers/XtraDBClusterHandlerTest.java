// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.controllers.handlers;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.yugabyte.dbaas.cluster.XtraDBClusterManager;
import com.yugabyte.dbaas.common.ErrorCode;
import com.yugabyte.dbaas.common.PlatformServiceException;
import com.yugabyte.dbaas.common.UnitConversionException;
import com.yugabyte.dbaas.common.kubernetes.KubectlException;
import com.yugabyte.dbaas.common.kubernetes.KubectlManager;
import com.yugabyte.dbaas.common.kubernetes.KubectlManagerFactory;
import com.yugabyte.dbaas.common.kubernetes.KubernetesResourceNotFoundException;
import com.yugabyte.dbaas.forms.XtraDBClusterParams;
import com.yugabyte.dbaas.forms.XtraDBClusterSummary;
import com.yugabyte.dbaas.forms.XtraDBCredentials;
import java.util.List;
import java.util.concurrent.CancellationException;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class XtraDBClusterHandlerTest {

  static final String KUBECONFIG = "{\"kind\": \"Config\"}";

  @Mock KubectlManagerFactory kubectlManagerFactory;

  @Mock KubectlManager kubectl;

  @Mock XtraDBClusterManager clusterManager;

  XtraDBClusterHandler handler;

  @Before
  public void setUp() {
    when(kubectlManagerFactory.create(KUBECONFIG)).thenReturn(kubectl);
    handler = new XtraDBClusterHandler(kubectlManagerFactory, clusterManager);
  }

  private static XtraDBClusterParams params() {
    XtraDBClusterParams params = new XtraDBClusterParams();
    params.name = "test";
    params.clusterSize = 3;
    return params;
  }

  @Test
  public void testListClusters() {
    XtraDBClusterSummary summary = new XtraDBClusterSummary();
    summary.setName("test");
    when(clusterManager.list(kubectl)).thenReturn(ImmutableList.of(summary));

    List<XtraDBClusterSummary> clusters = handler.listClusters(KUBECONFIG);

    assertEquals(ImmutableList.of(summary), clusters);
    verify(kubectl).close();
  }

  @Test
  public void testCreateCluster() {
    XtraDBClusterParams params = params();
    handler.createCluster(KUBECONFIG, params);
    verify(clusterManager).create(kubectl, params);
    verify(kubectl).close();
  }

  @Test
  public void testGetCredentials() {
    XtraDBCredentials credentials =
        XtraDBCredentials.builder().username("root").password("secret").port(3306).build();
    when(clusterManager.getCredentials(kubectl, "test")).thenReturn(credentials);
    assertSame(credentials, handler.getClusterCredentials(KUBECONFIG, "test"));
    verify(kubectl).close();
  }

  @Test
  public void testRequestErrorPassesThrough() {
    PlatformServiceException error =
        new PlatformServiceException(ErrorCode.ALREADY_EXISTS, "Cluster 'test' already exists");
    XtraDBClusterParams params = params();
    doThrow(error).when(clusterManager).create(kubectl, params);

    PlatformServiceException e =
        assertThrows(
            PlatformServiceException.class, () -> handler.createCluster(KUBECONFIG, params));

    assertSame(error, e);
    verify(kubectl).close();
  }

  @Test
  public void testNotFound() {
    doThrow(
            new KubernetesResourceNotFoundException(
                "kubectl delete", 1, "Error from server (NotFound): not found"))
        .when(clusterManager)
        .restart(kubectl, "test");

    PlatformServiceException e =
        assertThrows(
            PlatformServiceException.class, () -> handler.restartCluster(KUBECONFIG, "test"));

    assertEquals(ErrorCode.NOT_FOUND, e.getCode());
    assertThat(e.getMessage(), containsString("Failed to restart XtraDB cluster 'test'"));
  }

  @Test
  public void testKubectlFailure() {
    doThrow(new KubectlException("kubectl delete", 1, "connection refused"))
        .when(clusterManager)
        .delete(kubectl, "test");

    PlatformServiceException e =
        assertThrows(
            PlatformServiceException.class, () -> handler.deleteCluster(KUBECONFIG, "test"));

    assertEquals(ErrorCode.INTERNAL, e.getCode());
    assertThat(e.getMessage(), containsString("Failed to delete XtraDB cluster 'test'"));
    verify(kubectl).close();
  }

  @Test
  public void testInvalidUnits() {
    XtraDBClusterParams params = params();
    doThrow(new UnitConversionException("Unknown suffix 'X'"))
        .when(clusterManager)
        .update(kubectl, params);

    PlatformServiceException e =
        assertThrows(
            PlatformServiceException.class, () -> handler.updateCluster(KUBECONFIG, params));

    assertEquals(ErrorCode.INVALID_ARGUMENT, e.getCode());
    assertThat(e.getMessage(), containsString("Unknown suffix 'X'"));
  }

  @Test
  public void testCancellationPassesThrough() {
    when(clusterManager.list(kubectl)).thenThrow(new CancellationException("cancelled"));
    assertThrows(CancellationException.class, () -> handler.listClusters(KUBECONFIG));
    verify(kubectl).close();
  }
}
