// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@EqualsAndHashCode(callSuper = true)
public class ClusterCondition extends ResourceSection {
  private String status;
  private String type;
  private String reason;
  private String message;
  private String lastTransitionTime;
}
