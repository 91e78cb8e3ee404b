// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.common.kubernetes;

import io.fabric8.kubernetes.api.model.storage.StorageClass;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

/** Environment flavour guessed from the provisioners of the storage classes. */
public enum KubernetesClusterType {
  MINIKUBE,
  EKS,
  UNKNOWN;

  public static KubernetesClusterType fromStorageClasses(List<StorageClass> storageClasses) {
    if (storageClasses == null) {
      return UNKNOWN;
    }
    for (StorageClass storageClass : storageClasses) {
      String provisioner = StringUtils.defaultString(storageClass.getProvisioner());
      if (provisioner.contains("aws")) {
        return EKS;
      }
      if (provisioner.contains("minikube")
          || provisioner.contains("kubevirt.io/hostpath-provisioner")
          || provisioner.contains("standard")) {
        return MINIKUBE;
      }
    }
    return UNKNOWN;
  }
}
