/*
 * Copyright 2021 YugaByte, Inc. and Contributors
 *
 * Licensed under the Polyform Free Trial License 1.0.0 (the "License"); you
 * may not use this file except in compliance with the License. You
 * may obtain a copy of the License at
 *
 * http://github.com/YugaByte/yugabyte-db/blob/master/licenses/POLYFORM-FREE-TRIAL-LICENSE-1.0.0.txt
 */

package com.yugabyte.dbaas.common;

import lombok.Getter;

public class PlatformServiceException extends RuntimeException {
  @Getter private final ErrorCode code;
  @Getter private final String userVisibleMessage;

  public PlatformServiceException(ErrorCode code, String userVisibleMessage) {
    super(userVisibleMessage);
    this.code = code;
    this.userVisibleMessage = userVisibleMessage;
  }

  public PlatformServiceException(ErrorCode code, String userVisibleMessage, Throwable cause) {
    super(userVisibleMessage, cause);
    this.code = code;
    this.userVisibleMessage = userVisibleMessage;
  }

  public int getHttpStatus() {
    return code.getHttpStatus();
  }
}
