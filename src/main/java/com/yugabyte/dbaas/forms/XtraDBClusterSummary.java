// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.forms;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class XtraDBClusterSummary extends ClusterSummary {
  private NodeSummary pxc;

  // Only the proxy kind in use is set.
  private NodeSummary proxysql;

  private NodeSummary haproxy;
}
