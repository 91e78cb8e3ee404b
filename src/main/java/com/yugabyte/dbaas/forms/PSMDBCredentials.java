// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.forms;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

@Value
@Builder
public class PSMDBCredentials {
  String username;
  @ToString.Exclude String password;
  String host;
  int port;
  String replicaset;
}
