// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.forms;

import lombok.Data;
import lombok.ToString;

@Data
public class PmmParams {
  // PMM server address. Monitoring is enabled only when set.
  public String publicAddress;

  public String login;

  @ToString.Exclude public String password;
}
