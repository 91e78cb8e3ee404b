// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.forms;

import lombok.Data;

/** Observed settings of one pod group. */
@Data
public class NodeSummary {
  // Null when the custom resource has no limits.
  private ComputeResources computeResources;

  private long diskSize;

  private String image;
}
