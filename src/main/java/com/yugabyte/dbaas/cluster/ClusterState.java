// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.cluster;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/** Lifecycle state of a database cluster, shared by both cluster kinds. */
public enum ClusterState {
  INVALID,
  CHANGING,
  READY,
  FAILED,
  DELETING,
  PAUSED,
  UPGRADING;

  /**
   * Order used to pick the least healthy replica set state, from most to least severe. Declaration
   * order of the enum is not used for this.
   */
  public static final List<ClusterState> SEVERITY_ORDER =
      ImmutableList.of(INVALID, CHANGING, FAILED, READY);

  // States outside SEVERITY_ORDER are transitional and rank as CHANGING.
  int severity() {
    int index = SEVERITY_ORDER.indexOf(this);
    return index >= 0 ? index : SEVERITY_ORDER.indexOf(CHANGING);
  }

  /** Returns the most severe of the states, or INVALID when there are none. */
  public static ClusterState mostSevere(Collection<ClusterState> states) {
    return states.stream().min(Comparator.comparingInt(ClusterState::severity)).orElse(INVALID);
  }
}
