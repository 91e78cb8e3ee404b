// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.controllers.handlers;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.yugabyte.dbaas.cluster.XtraDBClusterManager;
import com.yugabyte.dbaas.common.kubernetes.KubectlManagerFactory;
import com.yugabyte.dbaas.forms.XtraDBClusterParams;
import com.yugabyte.dbaas.forms.XtraDBClusterSummary;
import com.yugabyte.dbaas.forms.XtraDBCredentials;

@Singleton
public class XtraDBClusterHandler
    extends ClusterHandler<XtraDBClusterParams, XtraDBClusterSummary, XtraDBCredentials> {

  @Inject
  public XtraDBClusterHandler(
      KubectlManagerFactory kubectlManagerFactory, XtraDBClusterManager clusterManager) {
    super(kubectlManagerFactory, clusterManager, "XtraDB");
  }
}
