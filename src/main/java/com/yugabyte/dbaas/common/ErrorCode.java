// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.common;

import lombok.Getter;

/** Error classes surfaced to callers of the cluster handlers. */
public enum ErrorCode {
  NOT_FOUND(404),
  ALREADY_EXISTS(409),
  // Cluster is not in a state that allows the operation. Retryable by the client.
  FAILED_PRECONDITION(412),
  INVALID_ARGUMENT(400),
  INTERNAL(500);

  @Getter private final int httpStatus;

  ErrorCode(int httpStatus) {
    this.httpStatus = httpStatus;
  }
}
