// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import lombok.Data;
import lombok.EqualsAndHashCode;

/** Monitoring sidecar section shared by both operators. */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@EqualsAndHashCode(callSuper = true)
public class PmmSpec extends ResourceSection {
  private Boolean enabled;
  private String serverHost;
  private String serverUser;
  private String image;
  private String imagePullPolicy;
  private ResourceRequirements resources;
}
