// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.forms;

import com.yugabyte.dbaas.cluster.ClusterState;
import lombok.Data;

@Data
public abstract class ClusterSummary {
  private String name;

  private int size;

  private ClusterState state;

  private String message;

  // Null when no change is in progress.
  private ClusterOperation operation;

  private boolean exposed;

  private boolean paused;
}
