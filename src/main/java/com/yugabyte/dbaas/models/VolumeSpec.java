// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.ResourceRequirementsBuilder;
import java.util.List;
import lombok.Data;
import lombok.EqualsAndHashCode;

/** Storage of a pod group. Only the persistent volume claim flavour is produced. */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@EqualsAndHashCode(callSuper = true)
public class VolumeSpec extends ResourceSection {
  private PersistentVolumeClaimSpec persistentVolumeClaim;

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class PersistentVolumeClaimSpec extends ResourceSection {
    private String storageClassName;
    private List<String> accessModes;
    private ResourceRequirements resources;
  }

  public static VolumeSpec ofStorage(String storage) {
    PersistentVolumeClaimSpec claim = new PersistentVolumeClaimSpec();
    claim.setResources(
        new ResourceRequirementsBuilder().addToRequests("storage", new Quantity(storage)).build());
    VolumeSpec volumeSpec = new VolumeSpec();
    volumeSpec.setPersistentVolumeClaim(claim);
    return volumeSpec;
  }
}
