// Copyright (c) YugaByte, Inc.
package com.yugabyte.dbaas.common;

import java.util.Map;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/** How a subprocess is run and logged. */
@Value
@Builder
public class ShellProcessContext {
  public static final ShellProcessContext DEFAULT = ShellProcessContext.builder().build();
  // Log stdout and stderr at debug level. Off for commands whose output carries secrets.
  boolean logCmdOutput;
  // Log the command line at trace instead of info level.
  boolean traceLogging;
  // Shown in logs instead of the full command line.
  String description;
  // The process is destroyed after this many seconds, 0 means no limit.
  long timeoutSecs;
  // Added to the environment of the controller.
  Map<String, String> extraEnvVars;
  // Written to the process stdin, then the stream is closed. Never logged.
  @ToString.Exclude String stdin;
}
