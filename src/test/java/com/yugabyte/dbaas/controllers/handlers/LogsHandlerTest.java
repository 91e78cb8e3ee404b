// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.controllers.handlers;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.yugabyte.dbaas.common.ErrorCode;
import com.yugabyte.dbaas.common.PlatformServiceException;
import com.yugabyte.dbaas.common.kubernetes.KubectlManager;
import com.yugabyte.dbaas.common.kubernetes.KubectlManagerFactory;
import com.yugabyte.dbaas.forms.ClusterLogs;
import com.yugabyte.dbaas.logs.ClusterLogsCollector;
import com.yugabyte.dbaas.logs.LogSource;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class LogsHandlerTest {

  static final String KUBECONFIG = "{\"kind\": \"Config\"}";

  @Mock KubectlManagerFactory kubectlManagerFactory;

  @Mock KubectlManager kubectl;

  @Mock ClusterLogsCollector logsCollector;

  @Test
  public void testGetLogs() {
    List<ClusterLogs> logs =
        ImmutableList.of(new ClusterLogs("test-pxc-0", "pxc", ImmutableList.of("started")));
    when(kubectlManagerFactory.create(KUBECONFIG)).thenReturn(kubectl);
    when(logsCollector.collectAllLogs(kubectl, "test")).thenReturn(logs);
    LogsHandler handler = new LogsHandler(kubectlManagerFactory, logsCollector);

    assertEquals(logs, handler.getLogs(KUBECONFIG, "test"));
    verify(kubectl).close();
  }

  @Test
  public void testUnsupportedSource() {
    LogsHandler handler = new LogsHandler(kubectlManagerFactory, logsCollector);
    PlatformServiceException e =
        assertThrows(
            PlatformServiceException.class,
            () -> handler.getLogs(KUBECONFIG, "test", LogSource.FAILING_ONLY));
    assertEquals(ErrorCode.INVALID_ARGUMENT, e.getCode());
    verifyNoInteractions(kubectlManagerFactory, logsCollector);
  }
}
