// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.forms;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * CPU and memory limits of one pod. A null field is not specified: left unchanged on update and
 * omitted on create. Zero is a valid value on update.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ComputeResources {
  // Millicpus.
  public Long cpuM;

  public Long memoryBytes;
}
