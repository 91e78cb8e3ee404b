// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.forms;

import lombok.Data;
import lombok.EqualsAndHashCode;

/** Create or update request of a MongoDB replica set cluster. */
@Data
@EqualsAndHashCode(callSuper = true)
public class PSMDBClusterParams extends ClusterParams {
  public NodeParams replicaset;
}
