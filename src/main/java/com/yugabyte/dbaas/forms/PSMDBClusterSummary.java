// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.forms;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class PSMDBClusterSummary extends ClusterSummary {
  private NodeSummary replicaset;
}
