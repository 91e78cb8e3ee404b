// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.common.kubernetes;

import lombok.Getter;

/** A kubectl invocation that exited with a failure other than a missing object. */
public class KubectlException extends RuntimeException {
  @Getter private final String command;
  @Getter private final int exitCode;
  @Getter private final String stderr;

  public KubectlException(String command, int exitCode, String stderr) {
    super(
        String.format(
            "kubectl failed with code %d\ncmd: %s\nstderr: %s", exitCode, command, stderr));
    this.command = command;
    this.exitCode = exitCode;
    this.stderr = stderr;
  }

  public KubectlException(String message) {
    this(message, null);
  }

  public KubectlException(String message, Throwable cause) {
    super(message, cause);
    this.command = null;
    this.exitCode = -1;
    this.stderr = null;
  }
}
