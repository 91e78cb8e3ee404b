// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.controllers.handlers;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.yugabyte.dbaas.common.ErrorCode;
import com.yugabyte.dbaas.common.PlatformServiceException;
import com.yugabyte.dbaas.common.kubernetes.KubectlManagerFactory;
import com.yugabyte.dbaas.forms.ClusterLogs;
import com.yugabyte.dbaas.logs.ClusterLogsCollector;
import com.yugabyte.dbaas.logs.LogSource;
import java.util.List;

@Singleton
public class LogsHandler extends KubectlHandler {

  private final ClusterLogsCollector logsCollector;

  @Inject
  public LogsHandler(
      KubectlManagerFactory kubectlManagerFactory, ClusterLogsCollector logsCollector) {
    super(kubectlManagerFactory);
    this.logsCollector = logsCollector;
  }

  public List<ClusterLogs> getLogs(String kubeconfig, String clusterName) {
    return getLogs(kubeconfig, clusterName, LogSource.ALL_LOGS);
  }

  public List<ClusterLogs> getLogs(String kubeconfig, String clusterName, LogSource source) {
    switch (source) {
      case ALL_LOGS:
        return execute(
            kubeconfig,
            "get logs of cluster",
            clusterName,
            kubectl -> logsCollector.collectAllLogs(kubectl, clusterName));
      default:
        throw new PlatformServiceException(
            ErrorCode.INVALID_ARGUMENT, "Log source " + source + " not supported");
    }
  }
}
