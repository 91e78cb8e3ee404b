// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.forms;

import lombok.Data;
import lombok.EqualsAndHashCode;

/** Create or update request of an XtraDB cluster. Exactly one proxy kind is set on create. */
@Data
@EqualsAndHashCode(callSuper = true)
public class XtraDBClusterParams extends ClusterParams {
  public NodeParams pxc;

  public NodeParams proxysql;

  public NodeParams haproxy;
}
