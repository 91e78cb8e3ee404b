// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.forms;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Progress of the ongoing cluster change, counted in ready pods. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClusterOperation {
  private int finishedSteps;
  private int totalSteps;
}
