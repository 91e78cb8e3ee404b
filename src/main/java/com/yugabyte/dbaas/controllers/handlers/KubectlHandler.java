// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.controllers.handlers;

import com.yugabyte.dbaas.common.ErrorCode;
import com.yugabyte.dbaas.common.PlatformServiceException;
import com.yugabyte.dbaas.common.UnitConversionException;
import com.yugabyte.dbaas.common.kubernetes.KubectlException;
import com.yugabyte.dbaas.common.kubernetes.KubectlManager;
import com.yugabyte.dbaas.common.kubernetes.KubectlManagerFactory;
import com.yugabyte.dbaas.common.kubernetes.KubernetesResourceNotFoundException;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import java.util.function.Function;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Base of request handlers working on a Kubernetes cluster given by its kubeconfig. Runs the
 * request with a kubectl client that lives for the duration of the request and turns failures into
 * {@link PlatformServiceException}.
 */
@Slf4j
public abstract class KubectlHandler {

  protected final KubectlManagerFactory kubectlManagerFactory;

  protected KubectlHandler(KubectlManagerFactory kubectlManagerFactory) {
    this.kubectlManagerFactory = kubectlManagerFactory;
  }

  protected <T> T execute(
      @Nullable String kubeconfig,
      String action,
      @Nullable String clusterName,
      Function<KubectlManager, T> request) {
    KubectlManager kubectl;
    try {
      kubectl = kubectlManagerFactory.create(kubeconfig);
    } catch (KubectlException e) {
      throw connectionFailure(action, clusterName, e);
    }
    try (KubectlManager client = kubectl) {
      return request.apply(client);
    } catch (PlatformServiceException | CancellationException e) {
      throw e;
    } catch (KubernetesResourceNotFoundException e) {
      throw new PlatformServiceException(ErrorCode.NOT_FOUND, describe(action, clusterName, e), e);
    } catch (UnitConversionException e) {
      throw new PlatformServiceException(
          ErrorCode.INVALID_ARGUMENT, describe(action, clusterName, e), e);
    } catch (RuntimeException e) {
      log.error("Failed to {} {}", action, clusterName == null ? "" : clusterName, e);
      throw new PlatformServiceException(ErrorCode.INTERNAL, describe(action, clusterName, e), e);
    }
  }

  protected void executeVoid(
      @Nullable String kubeconfig,
      String action,
      @Nullable String clusterName,
      Consumer<KubectlManager> request) {
    execute(
        kubeconfig,
        action,
        clusterName,
        kubectl -> {
          request.accept(kubectl);
          return null;
        });
  }

  /** Maps a failure to build the kubectl client, such as an unreachable API server. */
  protected PlatformServiceException connectionFailure(
      String action, @Nullable String clusterName, KubectlException e) {
    log.error("Failed to {} {}", action, clusterName == null ? "" : clusterName, e);
    return new PlatformServiceException(ErrorCode.INTERNAL, describe(action, clusterName, e), e);
  }

  private static String describe(String action, @Nullable String clusterName, Exception e) {
    String target = clusterName == null ? "" : " '" + clusterName + "'";
    return String.format("Failed to %s%s: %s", action, target, e.getMessage());
  }
}
