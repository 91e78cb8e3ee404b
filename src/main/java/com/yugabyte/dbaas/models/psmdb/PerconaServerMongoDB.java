// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.models.psmdb;

import com.fasterxml.jackson.annotation.JsonInclude;
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
 * PerconaServerMongoDB custom resource. Field names follow the psmdb.percona.com CRD and must not
 * be renamed.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@EqualsAndHashCode(callSuper = true)
public class PerconaServerMongoDB extends ResourceSection {
  public static final String KIND = "PerconaServerMongoDB";
  public static final String API_GROUP = "psmdb.percona.com";
  public static final String API_VERSION = API_GROUP + "/v1";
  public static final String RESOURCE = "perconaservermongodb";
  public static final String OPERATOR_NAME = "percona-server-mongodb-operator";

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
    private Boolean allowUnsafeConfigurations;
    private String image;
    private String imagePullPolicy;
    private String crVersion;
    private String updateStrategy;
    private SecretsSpec secrets;
    private List<ReplsetSpec> replsets;
    private ShardingSpec sharding;
    private MongodSpec mongod;
    private PmmSpec pmm;
    private BackupSpec backup;
  }

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class SecretsSpec extends ResourceSection {
    private String users;
    private String ssl;
    private String sslInternal;
  }

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class ReplsetSpec extends ResourceSection {
    private String name;
    private Integer size;
    private ResourceRequirements resources;
    private VolumeSpec volumeSpec;
    private PodAffinity affinity;
    private ExposeSpec expose;
    private ArbiterSpec arbiter;
    private PodDisruptionBudgetSpec podDisruptionBudget;
  }

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class ExposeSpec extends ResourceSection {
    private Boolean enabled;
    private String exposeType;
  }

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class ArbiterSpec extends ResourceSection {
    private Boolean enabled;
    private Integer size;
    private PodAffinity affinity;
  }

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class ShardingSpec extends ResourceSection {
    private Boolean enabled;
    private ReplsetSpec configsvrReplSet;
    private MongosSpec mongos;
  }

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class MongosSpec extends ResourceSection {
    private Integer size;
    private PodAffinity affinity;
    private ExposeSpec expose;
    private ResourceRequirements resources;
  }

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class MongodSpec extends ResourceSection {
    private Net net;
    private OperationProfiling operationProfiling;
    private Security security;
    private Map<String, Object> setParameter;
    private Storage storage;

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @EqualsAndHashCode(callSuper = true)
    public static class Net extends ResourceSection {
      private Integer port;
      private Integer hostPort;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @EqualsAndHashCode(callSuper = true)
    public static class OperationProfiling extends ResourceSection {
      private String mode;
      private Integer slowOpThresholdMs;
      private Integer rateLimit;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @EqualsAndHashCode(callSuper = true)
    public static class Security extends ResourceSection {
      private Boolean redactClientLogData;
      private Boolean enableEncryption;
      private String encryptionKeySecret;
      private String encryptionCipherMode;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @EqualsAndHashCode(callSuper = true)
    public static class Storage extends ResourceSection {
      private String engine;
      private Map<String, Object> mmapv1;
      private WiredTiger wiredTiger;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @EqualsAndHashCode(callSuper = true)
    public static class WiredTiger extends ResourceSection {
      private Map<String, Object> engineConfig;
      private Map<String, Object> collectionConfig;
      private Map<String, Object> indexConfig;
    }
  }

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class BackupSpec extends ResourceSection {
    private Boolean enabled;
    private String image;
    private String serviceAccountName;
  }

  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class Status extends ResourceSection {
    private String state;
    private String message;
    private List<ClusterCondition> conditions;
    private ComponentStatus mongos;
    private Map<String, ComponentStatus> replsets;
    private String host;
  }

  /** Status of one replica set or of the mongos routers. */
  @Data
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @EqualsAndHashCode(callSuper = true)
  public static class ComponentStatus extends ResourceSection {
    private Integer size;
    private Integer ready;
    private String status;
    private Boolean initialized;
    private String message;
  }

  @Data
  @EqualsAndHashCode(callSuper = true)
  public static class PerconaServerMongoDBList extends ResourceSection {
    private List<PerconaServerMongoDB> items;
  }
}
