// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.forms;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Installed operator versions such as 1.7.0, null when the operator is not installed. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OperatorVersions {
  private String xtradb;
  private String psmdb;
}
