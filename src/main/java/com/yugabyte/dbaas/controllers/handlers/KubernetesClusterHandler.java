// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.controllers.handlers;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.yugabyte.dbaas.cluster.OperatorVersionDetector;
import com.yugabyte.dbaas.common.ErrorCode;
import com.yugabyte.dbaas.common.PlatformServiceException;
import com.yugabyte.dbaas.common.kubernetes.KubectlException;
import com.yugabyte.dbaas.common.kubernetes.KubectlManagerFactory;
import com.yugabyte.dbaas.common.kubernetes.KubernetesClusterType;
import com.yugabyte.dbaas.forms.OperatorVersions;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

@Singleton
@Slf4j
public class KubernetesClusterHandler extends KubectlHandler {

  private static final String CHECK_CONNECTION = "check Kubernetes cluster connection";

  @Inject
  public KubernetesClusterHandler(KubectlManagerFactory kubectlManagerFactory) {
    super(kubectlManagerFactory);
  }

  /**
   * Checks that the Kubernetes cluster answers and reports the installed operators.
   *
   * @return operator versions, a version is null when the operator is not installed.
   */
  public OperatorVersions checkClusterConnection(String kubeconfig) {
    return execute(
        kubeconfig,
        CHECK_CONNECTION,
        null,
        kubectl -> {
          try {
            kubectl.getVersion();
          } catch (KubectlException e) {
            throw connectionFailure(CHECK_CONNECTION, null, e);
          }
          return OperatorVersionDetector.detect(kubectl);
        });
  }

  @Override
  protected PlatformServiceException connectionFailure(
      String action, @Nullable String clusterName, KubectlException e) {
    log.warn("Unable to connect to Kubernetes cluster: {}", e.getMessage());
    return new PlatformServiceException(
        ErrorCode.FAILED_PRECONDITION, "Unable to connect to Kubernetes cluster", e);
  }

  public KubernetesClusterType getKubernetesClusterType(String kubeconfig) {
    return execute(
        kubeconfig,
        "get Kubernetes cluster type",
        null,
        kubectl -> KubernetesClusterType.fromStorageClasses(kubectl.getStorageClasses()));
  }
}
