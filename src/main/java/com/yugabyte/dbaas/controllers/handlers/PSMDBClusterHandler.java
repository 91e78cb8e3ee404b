// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.controllers.handlers;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.yugabyte.dbaas.cluster.PSMDBClusterManager;
import com.yugabyte.dbaas.common.kubernetes.KubectlManagerFactory;
import com.yugabyte.dbaas.forms.PSMDBClusterParams;
import com.yugabyte.dbaas.forms.PSMDBClusterSummary;
import com.yugabyte.dbaas.forms.PSMDBCredentials;

@Singleton
public class PSMDBClusterHandler
    extends ClusterHandler<PSMDBClusterParams, PSMDBClusterSummary, PSMDBCredentials> {

  @Inject
  public PSMDBClusterHandler(
      KubectlManagerFactory kubectlManagerFactory, PSMDBClusterManager clusterManager) {
    super(kubectlManagerFactory, clusterManager, "MongoDB");
  }
}
