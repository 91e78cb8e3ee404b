// Copyright (c) YugaByte, Inc.
package com.yugabyte.dbaas.common;

import java.util.List;
import java.util.concurrent.CancellationException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/** Outcome of one subprocess run. */
@Data
@Slf4j
public class ShellResponse {
  public static final int ERROR_CODE_SUCCESS = 0;
  // The process could not be started or its output could not be read.
  public static final int ERROR_CODE_GENERIC_ERROR = -1;
  // The calling thread was interrupted and the process destroyed.
  public static final int ERROR_CODE_EXECUTION_CANCELLED = -2;

  static final int MAX_DESCRIPTION_LENGTH = 140;

  public int code = ERROR_CODE_SUCCESS;
  // stdout on success, stderr otherwise.
  public String message = null;
  public long durationMs = 0;
  public String description = null;

  public static ShellResponse create(int code, String message) {
    ShellResponse sr = new ShellResponse();
    sr.code = code;
    sr.message = message;
    return sr;
  }

  public void setDescription(List<String> command) {
    description =
        StringUtils.abbreviateMiddle(String.join(" ", command), " ... ", MAX_DESCRIPTION_LENGTH);
  }

  public boolean isSuccess() {
    return code == ERROR_CODE_SUCCESS;
  }

  public boolean isCancelled() {
    return code == ERROR_CODE_EXECUTION_CANCELLED;
  }

  /**
   * Returns this response when the run succeeded.
   *
   * @throws CancellationException if the run was cancelled.
   * @throws RuntimeException with the process output for any other failure.
   */
  public ShellResponse processErrors(String errorMessage) {
    if (isSuccess()) {
      return this;
    }
    String prefix = StringUtils.defaultIfBlank(errorMessage, "Command failed");
    log.error("{}: '{}' exited with {}", prefix, description, code);
    if (isCancelled()) {
      throw new CancellationException(prefix + ". Command is cancelled.");
    }
    throw new RuntimeException(String.format("%s. Output: %s", prefix, message));
  }
}
