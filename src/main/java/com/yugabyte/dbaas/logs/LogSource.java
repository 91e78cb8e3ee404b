// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.logs;

/** Which logs of a cluster are collected. */
public enum LogSource {
  // Logs of every container and init container plus pod events.
  ALL_LOGS,
  // Only containers that are failing. Not supported yet.
  FAILING_ONLY
}
