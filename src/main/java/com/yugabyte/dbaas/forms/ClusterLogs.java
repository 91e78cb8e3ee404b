// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.forms;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Log lines of one container, or the events of a pod when container is empty. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClusterLogs {
  private String pod;
  private String container;
  private List<String> lines;
}
