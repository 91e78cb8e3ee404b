// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.forms;

import lombok.Data;

/** Requested settings of one pod group (data nodes, a proxy or a replica set). */
@Data
public class NodeParams {
  public ComputeResources computeResources;

  // Bytes. Only used on create.
  public Long diskSize;

  // Full image reference, e.g. percona/percona-xtradb-cluster:8.0.20-11.2.
  public String image;
}
