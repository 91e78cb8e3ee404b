// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.cluster;

import com.typesafe.config.Config;
import com.yugabyte.dbaas.common.ErrorCode;
import com.yugabyte.dbaas.common.PlatformServiceException;
import com.yugabyte.dbaas.common.UnitConversionException;
import com.yugabyte.dbaas.common.UnitConverter;
import com.yugabyte.dbaas.common.kubernetes.KubectlException;
import com.yugabyte.dbaas.common.kubernetes.KubectlManager;
import com.yugabyte.dbaas.common.kubernetes.KubernetesClusterType;
import com.yugabyte.dbaas.forms.ClusterOperation;
import com.yugabyte.dbaas.forms.ClusterParams;
import com.yugabyte.dbaas.forms.ClusterSummary;
import com.yugabyte.dbaas.forms.ComputeResources;
import com.yugabyte.dbaas.forms.NodeParams;
import com.yugabyte.dbaas.forms.NodeSummary;
import com.yugabyte.dbaas.forms.OperatorVersions;
import com.yugabyte.dbaas.forms.PmmParams;
import com.yugabyte.dbaas.models.PmmSpec;
import com.yugabyte.dbaas.models.PodAffinity;
import com.yugabyte.dbaas.models.VolumeSpec;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import io.fabric8.kubernetes.api.model.ResourceRequirementsBuilder;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Translates cluster requests of one kind into custom resource changes and custom resources back
 * into cluster summaries.
 *
 * <p>All operations run against the cluster of the given {@link KubectlManager} and keep no state
 * between calls. Request errors are reported as {@link PlatformServiceException}, kubectl failures
 * propagate as {@link KubectlException}.
 *
 * @param <P> request parameters.
 * @param <S> cluster summary.
 * @param <C> cluster credentials.
 */
@Slf4j
public abstract class ClusterManager<P extends ClusterParams, S extends ClusterSummary, C> {

  static final String IMAGE_PULL_POLICY = "dbaas.image_pull_policy";
  static final String PMM_CLIENT_IMAGE = "dbaas.pmm.client_image";

  static final String UPDATE_STRATEGY_ROLLING = "RollingUpdate";

  public static final String SERVICE_TYPE_CLUSTER_IP = "ClusterIP";
  public static final String SERVICE_TYPE_NODE_PORT = "NodePort";
  public static final String SERVICE_TYPE_LOAD_BALANCER = "LoadBalancer";

  static final String RESOURCE_CPU = "cpu";
  static final String RESOURCE_MEMORY = "memory";
  static final String RESOURCE_STORAGE = "storage";

  protected final Config appConfig;

  protected final ClusterSecretProvisioner secretProvisioner;

  protected final CustomResourceTemplates templates;

  protected ClusterManager(
      Config appConfig,
      ClusterSecretProvisioner secretProvisioner,
      CustomResourceTemplates templates) {
    this.appConfig = appConfig;
    this.secretProvisioner = secretProvisioner;
    this.templates = templates;
  }

  /** Value of the managed-by label the operator puts on the pods of its clusters. */
  public abstract String getManagedBy();

  /** All clusters of this kind, including clusters still being deleted. */
  public abstract List<S> list(KubectlManager kubectl);

  /**
   * Checks a create request on its own, without looking at the cluster.
   *
   * @throws PlatformServiceException with INVALID_ARGUMENT.
   */
  public abstract void validateCreateParams(P params);

  /** Update counterpart of {@link #validateCreateParams}. */
  public abstract void validateUpdateParams(P params);

  public abstract void create(KubectlManager kubectl, P params);

  public abstract void update(KubectlManager kubectl, P params);

  public abstract void delete(KubectlManager kubectl, String name);

  /** Triggers a rolling restart of the pods. Does not wait for its completion. */
  public abstract void restart(KubectlManager kubectl, String name);

  public abstract C getCredentials(KubectlManager kubectl, String name);

  protected abstract S deletingSummary(String name);

  protected List<S> appendDeleting(KubectlManager kubectl, List<S> clusters) {
    Set<String> running =
        clusters.stream()
            .map(ClusterSummary::getName)
            .collect(Collectors.toCollection(HashSet::new));
    for (String name : DeletingClusterTracker.findDeleting(kubectl, getManagedBy(), running)) {
      S summary = deletingSummary(name);
      summary.setName(name);
      summary.setSize(0);
      summary.setState(ClusterState.DELETING);
      clusters.add(summary);
    }
    return clusters;
  }

  protected static void validateSuspendResume(ClusterParams params) {
    if (params.suspend && params.resume) {
      throw new PlatformServiceException(
          ErrorCode.INVALID_ARGUMENT, "Cannot suspend and resume a cluster at the same time");
    }
  }

  protected static void validateCreate(ClusterParams params) {
    if (StringUtils.isBlank(params.name)) {
      throw new PlatformServiceException(ErrorCode.INVALID_ARGUMENT, "Cluster name is required");
    }
    if (params.clusterSize == null || params.clusterSize < 1) {
      throw new PlatformServiceException(
          ErrorCode.INVALID_ARGUMENT, "Cluster size must be positive");
    }
    validateSuspendResume(params);
  }

  protected static void validateNode(@Nullable NodeParams node, String component, boolean create) {
    if (node == null) {
      return;
    }
    ComputeResources resources = node.computeResources;
    if (resources != null
        && ((resources.cpuM != null && resources.cpuM < 0)
            || (resources.memoryBytes != null && resources.memoryBytes < 0))) {
      throw new PlatformServiceException(
          ErrorCode.INVALID_ARGUMENT,
          "Compute resources of " + component + " must not be negative");
    }
    if (create && node.diskSize != null && node.diskSize < 0) {
      throw new PlatformServiceException(
          ErrorCode.INVALID_ARGUMENT, "Disk size of " + component + " must not be negative");
    }
  }

  protected static void checkNotExists(Optional<?> existing, String name) {
    if (existing.isPresent()) {
      throw new PlatformServiceException(
          ErrorCode.ALREADY_EXISTS, String.format("Cluster '%s' already exists", name));
    }
  }

  protected static <T> T checkFound(Optional<T> cluster, String name) {
    return cluster.orElseThrow(
        () ->
            new PlatformServiceException(
                ErrorCode.NOT_FOUND, String.format("Cluster '%s' not found", name)));
  }

  /**
   * Rejects changes to clusters that are not READY. Two updates racing on a ready cluster may
   * still both pass, the last apply wins.
   */
  protected static void checkReady(ClusterState state, String name) {
    if (state != ClusterState.READY) {
      throw new PlatformServiceException(
          ErrorCode.FAILED_PRECONDITION,
          String.format("Cluster '%s' is not ready, state is %s", name, state));
    }
  }

  /** Installed operator version, or the configured default when it cannot be detected. */
  protected String operatorVersion(
      KubectlManager kubectl, Function<OperatorVersions, String> selector, String defaultKey) {
    String version = null;
    try {
      version = selector.apply(OperatorVersionDetector.detect(kubectl));
    } catch (KubectlException e) {
      log.warn("Cannot detect operator version: {}", e.getMessage());
    }
    if (StringUtils.isEmpty(version)) {
      version = appConfig.getString(defaultKey);
      log.info("Operator version not detected, using {}", version);
    }
    return version;
  }

  protected KubernetesClusterType clusterType(KubectlManager kubectl) {
    try {
      return KubernetesClusterType.fromStorageClasses(kubectl.getStorageClasses());
    } catch (KubectlException e) {
      log.error("Failed to get Kubernetes cluster type", e);
      return KubernetesClusterType.UNKNOWN;
    }
  }

  protected static PodAffinity affinity(KubernetesClusterType clusterType) {
    return new PodAffinity(
        clusterType == KubernetesClusterType.MINIKUBE
            ? PodAffinity.TOPOLOGY_KEY_OFF
            : PodAffinity.TOPOLOGY_KEY_HOSTNAME);
  }

  protected PmmSpec pmmSpec(@Nullable PmmParams pmm) {
    PmmSpec spec = new PmmSpec();
    if (pmm == null || StringUtils.isEmpty(pmm.publicAddress)) {
      spec.setEnabled(false);
      return spec;
    }
    spec.setEnabled(true);
    spec.setServerHost(pmm.publicAddress);
    spec.setServerUser(pmm.login);
    spec.setImage(appConfig.getString(PMM_CLIENT_IMAGE));
    spec.setImagePullPolicy(appConfig.getString(IMAGE_PULL_POLICY));
    spec.setResources(
        new ResourceRequirementsBuilder()
            .addToRequests(RESOURCE_MEMORY, new Quantity("300M"))
            .addToRequests(RESOURCE_CPU, new Quantity("500m"))
            .build());
    return spec;
  }

  protected static boolean isPmmEnabled(@Nullable PmmParams pmm) {
    return pmm != null && StringUtils.isNotEmpty(pmm.publicAddress);
  }

  /** CR apiVersion for an operator release, e.g. pxc.percona.com/v1-7-0 for 1.7.0. */
  static String apiVersion(String apiGroup, String operatorVersion) {
    return apiGroup + "/v" + operatorVersion.replace('.', '-');
  }

  /** Limits for a new pod group. Absent and zero values are left out. */
  static ResourceRequirements toResourceRequirements(@Nullable ComputeResources resources) {
    ResourceRequirementsBuilder builder = new ResourceRequirementsBuilder();
    if (resources == null) {
      return builder.build();
    }
    if (resources.cpuM != null && resources.cpuM > 0) {
      builder.addToLimits(
          RESOURCE_CPU, new Quantity(UnitConverter.milliCpuToString(resources.cpuM)));
    }
    if (resources.memoryBytes != null && resources.memoryBytes > 0) {
      builder.addToLimits(
          RESOURCE_MEMORY, new Quantity(UnitConverter.bytesToString(resources.memoryBytes)));
    }
    return builder.build();
  }

  /** Overwrites the existing limits with the non-null fields of the request. */
  static ResourceRequirements updateResourceRequirements(
      @Nullable ComputeResources resources, @Nullable ResourceRequirements current) {
    ResourceRequirements result = current == null ? new ResourceRequirements() : current;
    if (resources == null) {
      return result;
    }
    Map<String, Quantity> limits = new LinkedHashMap<>();
    if (result.getLimits() != null) {
      limits.putAll(result.getLimits());
    }
    if (resources.cpuM != null) {
      limits.put(RESOURCE_CPU, new Quantity(UnitConverter.milliCpuToString(resources.cpuM)));
    }
    if (resources.memoryBytes != null) {
      limits.put(RESOURCE_MEMORY, new Quantity(UnitConverter.bytesToString(resources.memoryBytes)));
    }
    result.setLimits(limits);
    return result;
  }

  /** Limits of a pod group as reported by the CR, null when no limit is set. */
  @Nullable
  static ComputeResources toComputeResources(@Nullable ResourceRequirements requirements) {
    if (requirements == null || requirements.getLimits() == null) {
      return null;
    }
    Quantity cpu = requirements.getLimits().get(RESOURCE_CPU);
    Quantity memory = requirements.getLimits().get(RESOURCE_MEMORY);
    if (cpu == null && memory == null) {
      return null;
    }
    try {
      return new ComputeResources(
          cpu == null ? null : UnitConverter.milliCpuFromString(quantityString(cpu)),
          memory == null ? null : UnitConverter.bytesFromString(quantityString(memory)));
    } catch (UnitConversionException e) {
      throw new PlatformServiceException(
          ErrorCode.INTERNAL, "Invalid resource limits in custom resource: " + e.getMessage(), e);
    }
  }

  /** Requested storage of the volume in bytes, 0 when not set. */
  static long diskSize(@Nullable VolumeSpec volumeSpec) {
    if (volumeSpec == null
        || volumeSpec.getPersistentVolumeClaim() == null
        || volumeSpec.getPersistentVolumeClaim().getResources() == null
        || volumeSpec.getPersistentVolumeClaim().getResources().getRequests() == null) {
      return 0;
    }
    Quantity storage =
        volumeSpec.getPersistentVolumeClaim().getResources().getRequests().get(RESOURCE_STORAGE);
    if (storage == null) {
      return 0;
    }
    try {
      return UnitConverter.bytesFromString(quantityString(storage));
    } catch (UnitConversionException e) {
      throw new PlatformServiceException(
          ErrorCode.INTERNAL, "Invalid disk size in custom resource: " + e.getMessage(), e);
    }
  }

  /** Volume requesting the given number of bytes, null when no size is given. */
  @Nullable
  static VolumeSpec volumeSpec(@Nullable Long diskSize) {
    if (diskSize == null || diskSize <= 0) {
      return null;
    }
    return VolumeSpec.ofStorage(UnitConverter.bytesToString(diskSize));
  }

  static NodeSummary nodeSummary(
      @Nullable ResourceRequirements resources,
      @Nullable VolumeSpec volumeSpec,
      @Nullable String image) {
    NodeSummary summary = new NodeSummary();
    summary.setComputeResources(toComputeResources(resources));
    summary.setDiskSize(diskSize(volumeSpec));
    summary.setImage(image);
    return summary;
  }

  // Server managed fields are rejected by kubectl apply.
  static void stripServerFields(@Nullable ObjectMeta metadata) {
    if (metadata != null) {
      metadata.setManagedFields(null);
    }
  }

  static int count(@Nullable Integer value) {
    return value == null ? 0 : value;
  }

  static String quantityString(Quantity quantity) {
    return StringUtils.defaultString(quantity.getAmount())
        + StringUtils.defaultString(quantity.getFormat());
  }

  /**
   * Checks that an upgrade only changes the tag of the image, e.g. percona/percona-server-mongodb
   * from 4.2.8-8 to 4.4.2-4.
   */
  static void validateImage(String crImage, String newImage) {
    String[] newParts = newImage.split(":");
    if (newParts.length != 2) {
      throw new PlatformServiceException(
          ErrorCode.INVALID_ARGUMENT, "Image has to have version tag");
    }
    String[] currentParts = StringUtils.defaultString(crImage).split(":");
    if (!currentParts[0].equals(newParts[0])) {
      throw new PlatformServiceException(
          ErrorCode.INVALID_ARGUMENT,
          String.format("Expected image is '%s', '%s' was given", currentParts[0], newParts[0]));
    }
    if (currentParts.length > 1 && currentParts[1].equals(newParts[1])) {
      throw new PlatformServiceException(
          ErrorCode.INVALID_ARGUMENT,
          String.format(
              "Failed to change image: the database version '%s' is already in use", newParts[1]));
    }
  }

  /** Progress over (size, ready) pairs, null when there is nothing to report. */
  @Nullable
  static ClusterOperation operation(List<int[]> sizeAndReady) {
    if (sizeAndReady.isEmpty()) {
      return null;
    }
    int total = 0;
    int finished = 0;
    for (int[] pair : sizeAndReady) {
      total += pair[0];
      finished += pair[1];
    }
    return new ClusterOperation(finished, total);
  }
}
