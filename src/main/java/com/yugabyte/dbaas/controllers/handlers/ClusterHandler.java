// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.controllers.handlers;

import com.yugabyte.dbaas.cluster.ClusterManager;
import com.yugabyte.dbaas.common.kubernetes.KubectlManagerFactory;
import com.yugabyte.dbaas.forms.ClusterParams;
import com.yugabyte.dbaas.forms.ClusterSummary;
import java.util.List;

/**
 * Request surface shared by both cluster kinds. Requests are validated before the kubectl client
 * is built, as building it may already contact the cluster.
 */
public abstract class ClusterHandler<P extends ClusterParams, S extends ClusterSummary, C>
    extends KubectlHandler {

  private final ClusterManager<P, S, C> clusterManager;

  private final String kindName;

  protected ClusterHandler(
      KubectlManagerFactory kubectlManagerFactory,
      ClusterManager<P, S, C> clusterManager,
      String kindName) {
    super(kubectlManagerFactory);
    this.clusterManager = clusterManager;
    this.kindName = kindName;
  }

  public List<S> listClusters(String kubeconfig) {
    return execute(kubeconfig, "list " + kindName + " clusters", null, clusterManager::list);
  }

  public void createCluster(String kubeconfig, P params) {
    clusterManager.validateCreateParams(params);
    executeVoid(
        kubeconfig,
        "create " + kindName + " cluster",
        params.name,
        kubectl -> clusterManager.create(kubectl, params));
  }

  public void updateCluster(String kubeconfig, P params) {
    clusterManager.validateUpdateParams(params);
    executeVoid(
        kubeconfig,
        "update " + kindName + " cluster",
        params.name,
        kubectl -> clusterManager.update(kubectl, params));
  }

  public void deleteCluster(String kubeconfig, String name) {
    executeVoid(
        kubeconfig,
        "delete " + kindName + " cluster",
        name,
        kubectl -> clusterManager.delete(kubectl, name));
  }

  public void restartCluster(String kubeconfig, String name) {
    executeVoid(
        kubeconfig,
        "restart " + kindName + " cluster",
        name,
        kubectl -> clusterManager.restart(kubectl, name));
  }

  public C getClusterCredentials(String kubeconfig, String name) {
    return execute(
        kubeconfig,
        "get credentials of " + kindName + " cluster",
        name,
        kubectl -> clusterManager.getCredentials(kubectl, name));
  }
}
