// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.forms;

import lombok.Data;

/** Fields common to create and update requests of both cluster kinds. */
@Data
public abstract class ClusterParams {
  public String name;

  // Number of data nodes. Null keeps the current size on update.
  public Integer clusterSize;

  public boolean suspend;

  public boolean resume;

  public boolean expose;

  public PmmParams pmm;
}
