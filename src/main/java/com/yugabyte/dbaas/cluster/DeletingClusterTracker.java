// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.cluster;

import com.yugabyte.dbaas.common.kubernetes.KubectlManager;
import io.fabric8.kubernetes.api.model.Pod;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Finds clusters whose custom resource is gone while their pods are still terminating. Such
 * clusters are reported in DELETING state until the last pod disappears.
 */
public final class DeletingClusterTracker {

  public static final String LABEL_INSTANCE = "app.kubernetes.io/instance";
  public static final String LABEL_MANAGED_BY = "app.kubernetes.io/managed-by";

  private DeletingClusterTracker() {}

  /**
   * Returns the names of clusters managed by the given operator that have pods but are not in
   * {@code runningClusters}. Each name found is added to {@code runningClusters}, so it is
   * reported once however many pods it has.
   */
  public static List<String> findDeleting(
      KubectlManager kubectl, String managedBy, Set<String> runningClusters) {
    List<String> deleting = new ArrayList<>();
    List<Pod> pods = kubectl.getPods(null).getItems();
    if (pods == null) {
      return deleting;
    }
    for (Pod pod : pods) {
      Map<String, String> labels =
          pod.getMetadata() == null ? null : pod.getMetadata().getLabels();
      if (labels == null) {
        continue;
      }
      String clusterName = labels.get(LABEL_INSTANCE);
      if (StringUtils.isEmpty(clusterName) || runningClusters.contains(clusterName)) {
        continue;
      }
      if (!managedBy.equals(labels.get(LABEL_MANAGED_BY))) {
        continue;
      }
      deleting.add(clusterName);
      runningClusters.add(clusterName);
    }
    return deleting;
  }
}
