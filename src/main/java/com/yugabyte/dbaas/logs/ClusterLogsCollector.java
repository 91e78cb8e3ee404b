// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.logs;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.typesafe.config.Config;
import com.yugabyte.dbaas.cluster.DeletingClusterTracker;
import com.yugabyte.dbaas.common.kubernetes.KubectlManager;
import com.yugabyte.dbaas.forms.ClusterLogs;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.Pod;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.lang3.StringUtils;

/** Collects container logs and pod events of all pods of a cluster. */
@Singleton
@Slf4j
public class ClusterLogsCollector {

  static final String OVERALL_LINES_LIMIT = "dbaas.logs.overall_lines_limit";

  static final String EVENTS_HEADER = "Events:";

  private final Config appConfig;

  @Inject
  public ClusterLogsCollector(Config appConfig) {
    this.appConfig = appConfig;
  }

  /**
   * Returns one entry per container with output, then one entry with the events of the pod, for
   * every pod of the cluster. The overall number of lines is capped, keeping the most recent
   * lines of every entry.
   */
  public List<ClusterLogs> collectAllLogs(KubectlManager kubectl, String clusterName) {
    List<Pod> pods =
        kubectl.getPods(DeletingClusterTracker.LABEL_INSTANCE + "=" + clusterName).getItems();
    List<ClusterLogs> result = new ArrayList<>();
    for (Pod pod : ListUtils.emptyIfNull(pods)) {
      String podName = pod.getMetadata().getName();
      if (pod.getSpec() != null) {
        List<ContainerStatus> statuses =
            pod.getStatus() == null ? null : pod.getStatus().getContainerStatuses();
        List<ContainerStatus> initStatuses =
            pod.getStatus() == null ? null : pod.getStatus().getInitContainerStatuses();
        addContainerLogs(kubectl, podName, pod.getSpec().getContainers(), statuses, result);
        addContainerLogs(kubectl, podName, pod.getSpec().getInitContainers(), initStatuses, result);
      }
      result.add(new ClusterLogs(podName, "", parseEvents(kubectl.describePod(podName))));
    }
    limitLines(result, appConfig.getInt(OVERALL_LINES_LIMIT));
    return result;
  }

  private void addContainerLogs(
      KubectlManager kubectl,
      String podName,
      List<Container> containers,
      List<ContainerStatus> statuses,
      List<ClusterLogs> result) {
    for (Container container : ListUtils.emptyIfNull(containers)) {
      if (isWaiting(statuses, container.getName())) {
        log.debug("Skipping logs of waiting container {}/{}", podName, container.getName());
        continue;
      }
      String output = kubectl.getContainerLogs(podName, container.getName());
      if (StringUtils.isEmpty(output)) {
        continue;
      }
      result.add(new ClusterLogs(podName, container.getName(), splitLines(output)));
    }
  }

  private static boolean isWaiting(List<ContainerStatus> statuses, String containerName) {
    return ListUtils.emptyIfNull(statuses).stream()
        .anyMatch(
            s ->
                containerName.equals(s.getName())
                    && s.getState() != null
                    && s.getState().getWaiting() != null);
  }

  private static List<String> splitLines(String output) {
    return new ArrayList<>(Arrays.asList(output.split("\n", -1)));
  }

  /** Lines following the events header of {@code kubectl describe pod} output. */
  @VisibleForTesting
  static List<String> parseEvents(String describeOutput) {
    List<String> lines = splitLines(StringUtils.defaultString(describeOutput));
    for (int i = 0; i < lines.size(); i++) {
      if (lines.get(i).startsWith(EVENTS_HEADER)) {
        return new ArrayList<>(lines.subList(i + 1, lines.size()));
      }
    }
    return Collections.emptyList();
  }

  /**
   * Trims the entries in place so that at most {@code limit} lines remain overall. Lines are
   * granted one per entry in turns, and every entry keeps its last granted lines.
   */
  @VisibleForTesting
  static void limitLines(List<ClusterLogs> logs, int limit) {
    int[] counts = new int[logs.size()];
    int total = 0;
    boolean granted = true;
    while (total < limit && granted) {
      granted = false;
      for (int i = 0; i < logs.size() && total < limit; i++) {
        if (counts[i] < logs.get(i).getLines().size()) {
          counts[i]++;
          total++;
          granted = true;
        }
      }
    }
    for (int i = 0; i < logs.size(); i++) {
      List<String> lines = logs.get(i).getLines();
      logs.get(i).setLines(new ArrayList<>(lines.subList(lines.size() - counts[i], lines.size())));
    }
  }
}
