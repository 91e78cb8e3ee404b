// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.cluster;

import com.google.common.collect.ImmutableMap;
import com.yugabyte.dbaas.common.kubernetes.KubectlManager;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/** Maps the state strings reported by the operators onto {@link ClusterState}. */
@Slf4j
public final class ClusterStateClassifier {

  static final String STATE_UNKNOWN = "unknown";
  static final String STATE_READY = "ready";
  static final String STATE_ERROR = "error";
  static final String STATE_PAUSED = "paused";

  private static final Map<String, ClusterState> OPERATOR_STATES =
      ImmutableMap.<String, ClusterState>builder()
          .put(STATE_UNKNOWN, ClusterState.INVALID)
          .put("initializing", ClusterState.CHANGING)
          .put("pending", ClusterState.CHANGING)
          .put("stopping", ClusterState.CHANGING)
          .put(STATE_READY, ClusterState.READY)
          .put(STATE_ERROR, ClusterState.FAILED)
          .put(STATE_PAUSED, ClusterState.PAUSED)
          .build();

  private ClusterStateClassifier() {}

  /** Translates a single operator state. Empty and unrecognised values are CHANGING. */
  public static ClusterState fromOperatorState(@Nullable String state) {
    if (StringUtils.isEmpty(state)) {
      return ClusterState.CHANGING;
    }
    ClusterState clusterState = OPERATOR_STATES.get(state.toLowerCase(Locale.ROOT));
    if (clusterState == null) {
      log.warn("Failed to recognize cluster state '{}', using {}", state, ClusterState.CHANGING);
      return ClusterState.CHANGING;
    }
    return clusterState;
  }

  /**
   * State of a cluster from its aggregate operator state and pause flag. A ready cluster with the
   * pause flag set is PAUSED, older operators never report the paused state themselves.
   */
  public static ClusterState classify(@Nullable String state, boolean pause) {
    if (STATE_UNKNOWN.equalsIgnoreCase(state)) {
      return ClusterState.INVALID;
    }
    if (STATE_PAUSED.equalsIgnoreCase(state) || (pause && STATE_READY.equalsIgnoreCase(state))) {
      return ClusterState.PAUSED;
    }
    return fromOperatorState(state);
  }

  /**
   * MongoDB variant of {@link #classify}. The operator reports error while a replica set has too
   * few members to form, so an aggregate error is replaced by the most severe replica set state.
   */
  public static ClusterState classify(
      @Nullable String state, boolean pause, @Nullable Collection<String> replsetStates) {
    if (!STATE_ERROR.equalsIgnoreCase(state)) {
      return classify(state, pause);
    }
    if (replsetStates == null || replsetStates.isEmpty()) {
      return ClusterState.INVALID;
    }
    return ClusterState.mostSevere(
        replsetStates.stream()
            .map(ClusterStateClassifier::fromOperatorState)
            .collect(Collectors.toList()));
  }

  /**
   * Turns CHANGING into UPGRADING when the database containers do not all run the image of the
   * custom resource. Other states are returned as is.
   *
   * @param podSelector label selector of the database pods.
   * @param containerNames containers running the database.
   */
  public static ClusterState detectUpgrade(
      ClusterState state,
      KubectlManager kubectl,
      String clusterName,
      String podSelector,
      Collection<String> containerNames,
      String crImage) {
    if (state != ClusterState.CHANGING) {
      return state;
    }
    List<Pod> pods;
    try {
      pods = kubectl.getPods(podSelector).getItems();
    } catch (RuntimeException e) {
      log.warn("Failed to check if cluster '{}' is upgrading", clusterName, e);
      return ClusterState.INVALID;
    }
    if (pods == null || pods.isEmpty()) {
      return ClusterState.CHANGING;
    }
    Set<String> images = new HashSet<>();
    for (Pod pod : pods) {
      if (pod.getSpec() == null) {
        continue;
      }
      for (Container container : pod.getSpec().getContainers()) {
        if (containerNames.contains(container.getName())
            && StringUtils.isNotEmpty(container.getImage())) {
          images.add(container.getImage());
        }
      }
    }
    if (images.size() == 1 && images.contains(crImage)) {
      return ClusterState.CHANGING;
    }
    return ClusterState.UPGRADING;
  }
}
