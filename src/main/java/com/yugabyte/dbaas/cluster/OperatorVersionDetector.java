// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.cluster;

import com.google.common.annotations.VisibleForTesting;
import com.yugabyte.dbaas.common.kubernetes.KubectlManager;
import com.yugabyte.dbaas.forms.OperatorVersions;
import com.yugabyte.dbaas.models.psmdb.PerconaServerMongoDB;
import com.yugabyte.dbaas.models.pxc.PerconaXtraDBCluster;
import java.util.List;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Detects installed operators from the API versions they register. Operator 1.7.0 registers
 * {@code pxc.percona.com/v1-7-0} next to the versions of the releases it still supports.
 */
@Slf4j
public final class OperatorVersionDetector {

  private OperatorVersionDetector() {}

  public static OperatorVersions detect(KubectlManager kubectl) {
    List<String> apiVersions = kubectl.getApiVersions();
    return new OperatorVersions(
        latestVersion(apiVersions, PerconaXtraDBCluster.API_GROUP),
        latestVersion(apiVersions, PerconaServerMongoDB.API_GROUP));
  }

  /** Highest operator version registered for the API group, or null if there is none. */
  @Nullable
  @VisibleForTesting
  static String latestVersion(List<String> apiVersions, String apiGroup) {
    int[] latest = null;
    for (String apiVersion : apiVersions) {
      if (!apiVersion.startsWith(apiGroup + "/")) {
        continue;
      }
      int[] version = parseVersion(apiVersion.substring(apiGroup.length() + 1));
      if (version != null && (latest == null || compare(version, latest) > 0)) {
        latest = version;
      }
    }
    return latest == null ? null : latest[0] + "." + latest[1] + "." + latest[2];
  }

  // v1-7-0 -> [1, 7, 0]
  @Nullable
  private static int[] parseVersion(String version) {
    String[] parts = version.replaceFirst("^v", "").split("-");
    if (parts.length != 3) {
      return null;
    }
    int[] result = new int[3];
    try {
      for (int i = 0; i < 3; i++) {
        result[i] = Integer.parseInt(parts[i]);
      }
    } catch (NumberFormatException e) {
      log.warn("Can't parse operator version {}", version);
      return null;
    }
    return result;
  }

  private static int compare(int[] a, int[] b) {
    for (int i = 0; i < a.length; i++) {
      if (a[i] != b[i]) {
        return Integer.compare(a[i], b[i]);
      }
    }
    return 0;
  }
}
