// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.models.pxc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.yugabyte.dbaas.models.ClusterCondition;
import com.yugabyte.dbaas.models.PmmSpec;
import com.yugabyte.dbaas.models.PodAffinity;
import com.yugabyte.dbaas.models.PodDisruptionBudgetSpec;
import com.yugabyte.dbaas.models.ResourceSection;
import com.yugabyte.dbaas.models.VolumeSpec;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * PerconaXtraDBCluster custom resource. Field names follow the pxc.percona.com CRD and must not be
 * renamed.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@EqualsAndHashCode(callSuper = true)
public class PerconaXtraDBCluster extends ResourceSection {
  public static final String KIND = "PerconaXtraDBCluster";
  public static final String API_GROUP = "pxc.percona.com";
  public static final String API_VERSION = API_GROUP + "/v1";
  // Resource name used with kubectl get.
  public static final String RESOURCE = "perconaxtradbcluster";
  public static final String OPERATOR_NAME = "percona-xtradb-cluster-operator";

  private String apiVersion;
  private String kind;
  private ObjectMeta metadata;
  private Spec spec;
  private Status status;

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class Spec extends ResourceSection {
    private Boolean pause;
    private String secretsName;
    private String crVersion;
    private String updateStrategy;
    private Boolean allowUnsafeConfigurations;
    private PodSpec pxc;
    private PodSpec proxysql;
    private PodSpec haproxy;
    private PmmSpec pmm;
    private BackupSpec backup;
  }

  /** Pod group of the cluster: data nodes or one of the proxies. */
  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class PodSpec extends ResourceSection {
    private Boolean enabled;
    private Integer size;
    private String image;
    private ResourceRequirements resources;
    private VolumeSpec volumeSpec;
    private PodAffinity affinity;
    private String imagePullPolicy;
    private PodDisruptionBudgetSpec podDisruptionBudget;
    private String serviceType;
  }

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class BackupSpec extends ResourceSection {
    private String image;
    private List<BackupSchedule> schedule;
    private Map<String, BackupStorage> storages;
    private String serviceAccountName;
  }

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class BackupSchedule extends ResourceSection {
    private String name;
    private String schedule;
    private Integer keep;
    private String storageName;
  }

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class BackupStorage extends ResourceSection {
    public static final String TYPE_FILESYSTEM = "filesystem";

    private String type;
    private VolumeSpec volume;
  }

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class Status extends ResourceSection {
    private AppStatus pxc;
    private AppStatus proxysql;
    private AppStatus haproxy;
    private AppStatus pmm;
    private String host;

    @JsonProperty("message")
    private List<String> messages;

    private String state;
    private List<ClusterCondition> conditions;
  }

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class AppStatus extends ResourceSection {
    private Integer size;
    private Integer ready;
    private String status;
    private List<String> message;
  }

  @Data
  @EqualsAndHashCode(callSuper = true)
  public static class PerconaXtraDBClusterList extends ResourceSection {
    private List<PerconaXtraDBCluster> items;
  }
}
