// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.models;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;

/**
 * Part of a custom resource. Fields without a typed counterpart are kept as read and written back
 * unchanged, so templates and live resources survive a read-modify-apply cycle.
 */
@EqualsAndHashCode
public abstract class ResourceSection {

  @JsonIgnore private final Map<String, Object> additionalProperties = new LinkedHashMap<>();

  @JsonAnyGetter
  public Map<String, Object> getAdditionalProperties() {
    return additionalProperties;
  }

  @JsonAnySetter
  public void setAdditionalProperty(String name, Object value) {
    additionalProperties.put(name, value);
  }
}
