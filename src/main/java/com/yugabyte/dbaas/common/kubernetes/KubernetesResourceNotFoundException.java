// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.common.kubernetes;

/**
 * The requested object does not exist in the cluster. Raised by {@link KubectlManager} so callers
 * never need to look at kubectl output themselves.
 */
public class KubernetesResourceNotFoundException extends KubectlException {

  public KubernetesResourceNotFoundException(String command, int exitCode, String stderr) {
    super(command, exitCode, stderr);
  }
}
