// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@EqualsAndHashCode(callSuper = true)
public class PodAffinity extends ResourceSection {
  // Disables anti-affinity, needed on single node environments.
  public static final String TOPOLOGY_KEY_OFF = "none";
  public static final String TOPOLOGY_KEY_HOSTNAME = "kubernetes.io/hostname";

  private String antiAffinityTopologyKey;
}
