// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.cluster;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.typesafe.config.Config;
import com.yugabyte.dbaas.common.ErrorCode;
import com.yugabyte.dbaas.common.PlatformServiceException;
import com.yugabyte.dbaas.common.kubernetes.KubectlManager;
import com.yugabyte.dbaas.common.kubernetes.KubernetesClusterType;
import com.yugabyte.dbaas.common.kubernetes.KubernetesResourceNotFoundException;
import com.yugabyte.dbaas.forms.OperatorVersions;
import com.yugabyte.dbaas.forms.PSMDBClusterParams;
import com.yugabyte.dbaas.forms.PSMDBClusterSummary;
import com.yugabyte.dbaas.forms.PSMDBCredentials;
import com.yugabyte.dbaas.models.ClusterCondition;
import com.yugabyte.dbaas.models.PodAffinity;
import com.yugabyte.dbaas.models.PodDisruptionBudgetSpec;
import com.yugabyte.dbaas.models.psmdb.PerconaServerMongoDB;
import com.yugabyte.dbaas.models.psmdb.PerconaServerMongoDB.ArbiterSpec;
import com.yugabyte.dbaas.models.psmdb.PerconaServerMongoDB.BackupSpec;
import com.yugabyte.dbaas.models.psmdb.PerconaServerMongoDB.ComponentStatus;
import com.yugabyte.dbaas.models.psmdb.PerconaServerMongoDB.ExposeSpec;
import com.yugabyte.dbaas.models.psmdb.PerconaServerMongoDB.MongodSpec;
import com.yugabyte.dbaas.models.psmdb.PerconaServerMongoDB.MongosSpec;
import com.yugabyte.dbaas.models.psmdb.PerconaServerMongoDB.PerconaServerMongoDBList;
import com.yugabyte.dbaas.models.psmdb.PerconaServerMongoDB.ReplsetSpec;
import com.yugabyte.dbaas.models.psmdb.PerconaServerMongoDB.SecretsSpec;
import com.yugabyte.dbaas.models.psmdb.PerconaServerMongoDB.ShardingSpec;
import com.yugabyte.dbaas.models.psmdb.PerconaServerMongoDB.Spec;
import com.yugabyte.dbaas.models.psmdb.PerconaServerMongoDB.Status;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * MongoDB clusters: PerconaServerMongoDB resources with a single replica set named rs0. Clusters
 * of more than one node are sharded behind mongos routers.
 */
@Singleton
@Slf4j
public class PSMDBClusterManager
    extends ClusterManager<PSMDBClusterParams, PSMDBClusterSummary, PSMDBCredentials> {

  static final String DEFAULT_IMAGE = "dbaas.psmdb.default_image";
  static final String BACKUP_IMAGE_TEMPLATE = "dbaas.psmdb.backup_image_template";
  static final String DEFAULT_OPERATOR_VERSION = "dbaas.psmdb.default_operator_version";

  static final String SECRET_NAME_TEMPLATE = "dbaas-%s-psmdb-secrets";
  static final List<String> INTERNAL_SECRET_TEMPLATES =
      ImmutableList.of(
          "internal-%s-users",
          "%s-ssl",
          "%s-ssl-internal",
          "%s-mongodb-keyfile",
          "%s-mongodb-encryption-key");
  static final String TEMPLATE_SECRET_NAME = "my-cluster-name-secrets";

  // User name keys and their fixed values. Each has a generated _PASSWORD counterpart.
  static final Map<String, String> USERS =
      ImmutableMap.of(
          "MONGODB_BACKUP_USER", "backup",
          "MONGODB_CLUSTER_ADMIN_USER", "clusterAdmin",
          "MONGODB_CLUSTER_MONITOR_USER", "clusterMonitor",
          "MONGODB_USER_ADMIN_USER", "userAdmin");
  static final String USER_ADMIN_USER = "MONGODB_USER_ADMIN_USER";
  static final String USER_ADMIN_PASSWORD = "MONGODB_USER_ADMIN_PASSWORD";
  static final String PMM_USER_KEY = "PMM_SERVER_USER";
  static final String PMM_PASSWORD_KEY = "PMM_SERVER_PASSWORD";

  static final String FINALIZER = "delete-psmdb-pvc";
  static final String REPLSET_NAME = "rs0";
  static final int PORT = 27017;

  static final String ENCRYPTION_KEY_SECRET_TEMPLATE = "%s-mongodb-encryption-key";
  static final String ENCRYPTION_CIPHER_MODE = "AES256-CBC";
  static final String OPERATION_PROFILING_SLOW_OP = "slowOp";
  static final String STORAGE_ENGINE_WIRED_TIGER = "wiredTiger";
  static final String COMPRESSOR_SNAPPY = "snappy";

  static final String COMPONENT_REPLSET = "replicaset";
  static final List<String> DATABASE_CONTAINERS = ImmutableList.of("mongos", "mongod");

  @Inject
  public PSMDBClusterManager(
      Config appConfig,
      ClusterSecretProvisioner secretProvisioner,
      CustomResourceTemplates templates) {
    super(appConfig, secretProvisioner, templates);
  }

  @Override
  public String getManagedBy() {
    return PerconaServerMongoDB.OPERATOR_NAME;
  }

  @Override
  public List<PSMDBClusterSummary> list(KubectlManager kubectl) {
    List<PerconaServerMongoDB> clusters =
        kubectl
            .get(PerconaServerMongoDB.RESOURCE, null, PerconaServerMongoDBList.class)
            .getItems();
    List<PSMDBClusterSummary> result = new ArrayList<>();
    for (PerconaServerMongoDB cluster : ListUtils.emptyIfNull(clusters)) {
      result.add(toSummary(kubectl, cluster));
    }
    return appendDeleting(kubectl, result);
  }

  @Override
  public void validateCreateParams(PSMDBClusterParams params) {
    validateCreate(params);
    if (params.replicaset == null
        || params.replicaset.diskSize == null
        || params.replicaset.diskSize <= 0) {
      throw new PlatformServiceException(
          ErrorCode.INVALID_ARGUMENT, "Disk size of replica set nodes must be positive");
    }
    validateNode(params.replicaset, COMPONENT_REPLSET, true);
  }

  @Override
  public void create(KubectlManager kubectl, PSMDBClusterParams params) {
    validateCreateParams(params);
    checkNotExists(get(kubectl, params.name), params.name);

    String operatorVersion =
        operatorVersion(kubectl, OperatorVersions::getPsmdb, DEFAULT_OPERATOR_VERSION);
    KubernetesClusterType clusterType = clusterType(kubectl);
    ExposeSpec expose = new ExposeSpec();
    expose.setEnabled(params.expose);
    if (!params.expose) {
      expose.setExposeType(SERVICE_TYPE_CLUSTER_IP);
    } else if (clusterType == KubernetesClusterType.MINIKUBE) {
      expose.setExposeType(SERVICE_TYPE_NODE_PORT);
    } else {
      expose.setExposeType(SERVICE_TYPE_LOAD_BALANCER);
    }

    String secretName = String.format(SECRET_NAME_TEMPLATE, params.name);
    Optional<PerconaServerMongoDB> template = templates.psmdbTemplate();
    PerconaServerMongoDB cluster;
    if (template.isPresent()) {
      cluster = overrideTemplate(template.get(), params, operatorVersion, clusterType, expose);
      SecretsSpec secrets = cluster.getSpec().getSecrets();
      if (secrets == null) {
        secrets = new SecretsSpec();
        cluster.getSpec().setSecrets(secrets);
      }
      if (StringUtils.isNotEmpty(secrets.getUsers())) {
        secretName = secrets.getUsers();
      }
      secrets.setUsers(secretName);
    } else {
      cluster = buildCluster(params, operatorVersion, secretName, clusterType, expose);
    }

    secretProvisioner.createSecret(
        kubectl, secretName, TEMPLATE_SECRET_NAME, secretValues(params));

    log.info("Creating MongoDB cluster {} with operator version {}", params.name, operatorVersion);
    kubectl.apply(cluster);
  }

  @Override
  public void validateUpdateParams(PSMDBClusterParams params) {
    validateSuspendResume(params);
    validateNode(params.replicaset, COMPONENT_REPLSET, false);
  }

  @Override
  public void update(KubectlManager kubectl, PSMDBClusterParams params) {
    validateUpdateParams(params);
    PerconaServerMongoDB cluster = checkFound(get(kubectl, params.name), params.name);
    cluster.setKind(PerconaServerMongoDB.KIND);
    cluster.setApiVersion(PerconaServerMongoDB.API_VERSION);
    stripServerFields(cluster.getMetadata());
    Spec spec = cluster.getSpec();

    ClusterState state = classify(kubectl, cluster);
    if (params.resume && state == ClusterState.PAUSED) {
      log.info("Resuming MongoDB cluster {}", params.name);
      spec.setPause(false);
      kubectl.apply(cluster);
      return;
    }
    checkReady(state, params.name);
    if (CollectionUtils.isEmpty(spec.getReplsets())) {
      throw new PlatformServiceException(
          ErrorCode.INTERNAL, String.format("Cluster '%s' has no replica set", params.name));
    }

    ReplsetSpec replset = spec.getReplsets().get(0);
    if (params.clusterSize != null && params.clusterSize > 0) {
      replset.setSize(params.clusterSize);
      spec.setAllowUnsafeConfigurations(params.clusterSize == 1);
    }
    if (params.suspend) {
      log.info("Suspending MongoDB cluster {}", params.name);
      spec.setPause(true);
    }
    if (params.replicaset != null) {
      replset.setResources(
          updateResourceRequirements(params.replicaset.computeResources, replset.getResources()));
      String image = params.replicaset.image;
      if (StringUtils.isNotEmpty(image) && !image.equals(spec.getImage())) {
        validateImage(spec.getImage(), image);
        log.info("Upgrading MongoDB cluster {} to {}", params.name, image);
        spec.setImage(image);
      }
    }

    log.info("Updating MongoDB cluster {}", params.name);
    kubectl.apply(cluster);
  }

  @Override
  public void delete(KubectlManager kubectl, String name) {
    PerconaServerMongoDB cluster = new PerconaServerMongoDB();
    cluster.setApiVersion(PerconaServerMongoDB.API_VERSION);
    cluster.setKind(PerconaServerMongoDB.KIND);
    cluster.setMetadata(new ObjectMetaBuilder().withName(name).build());
    try {
      kubectl.delete(cluster);
    } catch (KubernetesResourceNotFoundException e) {
      throw new PlatformServiceException(
          ErrorCode.NOT_FOUND, String.format("Cluster '%s' not found", name), e);
    }
    log.info("Deleted MongoDB cluster {}", name);
    List<String> secrets = new ArrayList<>();
    secrets.add(String.format(SECRET_NAME_TEMPLATE, name));
    INTERNAL_SECRET_TEMPLATES.forEach(template -> secrets.add(String.format(template, name)));
    secretProvisioner.deleteSecrets(kubectl, secrets);
  }

  @Override
  public void restart(KubectlManager kubectl, String name) {
    String statefulSet = name + "-" + REPLSET_NAME;
    if (kubectl.statefulSetExists(statefulSet)) {
      log.info("Restarting MongoDB cluster {}", name);
      kubectl.restartStatefulSet(statefulSet);
    } else {
      log.warn("Statefulset {} not found, nothing to restart", statefulSet);
    }
  }

  @Override
  public PSMDBCredentials getCredentials(KubectlManager kubectl, String name) {
    PerconaServerMongoDB cluster = checkFound(get(kubectl, name), name);
    ClusterState state = classify(kubectl, cluster);
    if (state != ClusterState.READY) {
      throw new PlatformServiceException(
          ErrorCode.FAILED_PRECONDITION,
          String.format("Cannot get credentials of cluster '%s', state is %s", name, state));
    }
    SecretsSpec secrets = cluster.getSpec().getSecrets();
    String secretName =
        secrets != null && StringUtils.isNotEmpty(secrets.getUsers())
            ? secrets.getUsers()
            : String.format(SECRET_NAME_TEMPLATE, name);
    Secret secret =
        kubectl
            .getSecret(secretName)
            .orElseThrow(
                () ->
                    new PlatformServiceException(
                        ErrorCode.NOT_FOUND, String.format("Secret '%s' not found", secretName)));
    return PSMDBCredentials.builder()
        .username(ClusterSecretProvisioner.readSecretValue(secret, USER_ADMIN_USER).orElse(""))
        .password(
            ClusterSecretProvisioner.readSecretValue(secret, USER_ADMIN_PASSWORD).orElse(""))
        .host(cluster.getStatus() == null ? null : cluster.getStatus().getHost())
        .port(PORT)
        .replicaset(REPLSET_NAME)
        .build();
  }

  @Override
  protected PSMDBClusterSummary deletingSummary(String name) {
    return new PSMDBClusterSummary();
  }

  private Optional<PerconaServerMongoDB> get(KubectlManager kubectl, String name) {
    return kubectl.getOptional(PerconaServerMongoDB.RESOURCE, name, PerconaServerMongoDB.class);
  }

  ClusterState classify(KubectlManager kubectl, PerconaServerMongoDB cluster) {
    Spec spec = cluster.getSpec();
    Status status = cluster.getStatus();
    // The operator has not reported anything yet.
    if (spec == null || status == null || StringUtils.isEmpty(status.getState())) {
      return ClusterState.INVALID;
    }
    List<String> replsetStates =
        MapUtils.emptyIfNull(status.getReplsets()).values().stream()
            .map(ComponentStatus::getStatus)
            .collect(Collectors.toList());
    ClusterState state =
        ClusterStateClassifier.classify(
            status.getState(), Boolean.TRUE.equals(spec.getPause()), replsetStates);
    String name = cluster.getMetadata().getName();
    return ClusterStateClassifier.detectUpgrade(
        state,
        kubectl,
        name,
        DeletingClusterTracker.LABEL_INSTANCE
            + "="
            + name
            + ",app.kubernetes.io/part-of=percona-server-mongodb",
        DATABASE_CONTAINERS,
        spec.getImage());
  }

  private PSMDBClusterSummary toSummary(KubectlManager kubectl, PerconaServerMongoDB cluster) {
    PSMDBClusterSummary summary = new PSMDBClusterSummary();
    summary.setName(cluster.getMetadata().getName());
    summary.setState(classify(kubectl, cluster));
    Spec spec = cluster.getSpec();
    if (spec == null || CollectionUtils.isEmpty(spec.getReplsets())) {
      return summary;
    }
    ReplsetSpec replset = spec.getReplsets().get(0);
    int size = replset.getSize() == null ? 0 : replset.getSize();
    summary.setSize(size);
    summary.setPaused(Boolean.TRUE.equals(spec.getPause()));
    summary.setReplicaset(
        nodeSummary(replset.getResources(), replset.getVolumeSpec(), spec.getImage()));
    summary.setExposed(isExposed(spec));

    Status status = cluster.getStatus();
    if (status != null && CollectionUtils.isNotEmpty(status.getConditions())) {
      List<int[]> progress = new ArrayList<>();
      for (ComponentStatus rs : MapUtils.emptyIfNull(status.getReplsets()).values()) {
        progress.add(new int[] {count(rs.getSize()), count(rs.getReady())});
      }
      if (size != 1 && status.getMongos() != null) {
        progress.add(
            new int[] {count(status.getMongos().getSize()), count(status.getMongos().getReady())});
      }
      summary.setOperation(operation(progress));
      String message = status.getMessage();
      if (StringUtils.isEmpty(message)) {
        List<ClusterCondition> conditions = status.getConditions();
        message = conditions.get(conditions.size() - 1).getMessage();
      }
      summary.setMessage(message);
    }
    return summary;
  }

  private static boolean isExposed(Spec spec) {
    ShardingSpec sharding = spec.getSharding();
    if (sharding != null
        && Boolean.TRUE.equals(sharding.getEnabled())
        && sharding.getMongos() != null
        && sharding.getMongos().getExpose() != null) {
      String exposeType = sharding.getMongos().getExpose().getExposeType();
      return StringUtils.isNotEmpty(exposeType) && !SERVICE_TYPE_CLUSTER_IP.equals(exposeType);
    }
    ExposeSpec expose = spec.getReplsets().get(0).getExpose();
    return expose != null && Boolean.TRUE.equals(expose.getEnabled());
  }

  private Map<String, String> secretValues(PSMDBClusterParams params) {
    Map<String, String> values = new LinkedHashMap<>();
    USERS.forEach(
        (userKey, user) -> {
          values.put(userKey, user);
          values.put(
              userKey.replaceFirst("_USER$", "_PASSWORD"), secretProvisioner.generatePassword());
        });
    if (isPmmEnabled(params.pmm)) {
      values.put(PMM_USER_KEY, StringUtils.defaultString(params.pmm.login));
      values.put(PMM_PASSWORD_KEY, StringUtils.defaultString(params.pmm.password));
    }
    return values;
  }

  private PerconaServerMongoDB buildCluster(
      PSMDBClusterParams params,
      String operatorVersion,
      String secretName,
      KubernetesClusterType clusterType,
      ExposeSpec expose) {
    PodAffinity affinity = affinity(clusterType);
    int size = params.clusterSize;
    boolean singleNode = size == 1;

    PerconaServerMongoDB cluster = new PerconaServerMongoDB();
    cluster.setApiVersion(apiVersion(PerconaServerMongoDB.API_GROUP, operatorVersion));
    cluster.setKind(PerconaServerMongoDB.KIND);
    cluster.setMetadata(
        new ObjectMetaBuilder().withName(params.name).withFinalizers(FINALIZER).build());

    Spec spec = new Spec();
    spec.setUpdateStrategy(UPDATE_STRATEGY_ROLLING);
    spec.setCrVersion(operatorVersion);
    spec.setImage(
        StringUtils.defaultIfEmpty(params.replicaset.image, appConfig.getString(DEFAULT_IMAGE)));
    spec.setImagePullPolicy(appConfig.getString(IMAGE_PULL_POLICY));
    spec.setAllowUnsafeConfigurations(singleNode);
    SecretsSpec secrets = new SecretsSpec();
    secrets.setUsers(secretName);
    spec.setSecrets(secrets);

    // A single node cluster is a bare replica set, exposed directly.
    ShardingSpec sharding = new ShardingSpec();
    sharding.setEnabled(!singleNode);
    ReplsetSpec configsvr = new ReplsetSpec();
    configsvr.setSize(size);
    configsvr.setVolumeSpec(volumeSpec(params.replicaset.diskSize));
    configsvr.setArbiter(disabledArbiter(affinity));
    configsvr.setAffinity(affinity);
    sharding.setConfigsvrReplSet(configsvr);
    MongosSpec mongos = new MongosSpec();
    mongos.setSize(size);
    mongos.setAffinity(affinity);
    ExposeSpec mongosExpose = new ExposeSpec();
    mongosExpose.setExposeType(singleNode ? SERVICE_TYPE_CLUSTER_IP : expose.getExposeType());
    mongos.setExpose(mongosExpose);
    mongos.setResources(toResourceRequirements(params.replicaset.computeResources));
    sharding.setMongos(mongos);
    spec.setSharding(sharding);

    ReplsetSpec replset = new ReplsetSpec();
    replset.setName(REPLSET_NAME);
    replset.setSize(size);
    replset.setArbiter(disabledArbiter(affinity));
    replset.setVolumeSpec(volumeSpec(params.replicaset.diskSize));
    replset.setPodDisruptionBudget(new PodDisruptionBudgetSpec(new IntOrString(1)));
    replset.setAffinity(affinity);
    replset.setResources(toResourceRequirements(params.replicaset.computeResources));
    if (singleNode && params.expose) {
      replset.setExpose(expose);
    }
    spec.setReplsets(ImmutableList.of(replset));

    spec.setMongod(mongodSpec(params.name));
    spec.setPmm(pmmSpec(params.pmm));
    spec.getPmm().setServerUser(null);
    spec.setBackup(backupSpec(operatorVersion));
    cluster.setSpec(spec);
    return cluster;
  }

  /** Applies the request on top of a user provided custom resource. */
  private PerconaServerMongoDB overrideTemplate(
      PerconaServerMongoDB cluster,
      PSMDBClusterParams params,
      String operatorVersion,
      KubernetesClusterType clusterType,
      ExposeSpec expose) {
    if (StringUtils.isEmpty(cluster.getApiVersion())) {
      cluster.setApiVersion(apiVersion(PerconaServerMongoDB.API_GROUP, operatorVersion));
    }
    cluster.setKind(PerconaServerMongoDB.KIND);
    if (cluster.getMetadata() == null) {
      cluster.setMetadata(new ObjectMeta());
    }
    cluster.getMetadata().setName(params.name);
    if (cluster.getSpec() == null) {
      cluster.setSpec(new Spec());
    }
    Spec spec = cluster.getSpec();
    spec.setImage(
        StringUtils.defaultIfEmpty(params.replicaset.image, appConfig.getString(DEFAULT_IMAGE)));
    if (CollectionUtils.isEmpty(spec.getReplsets())) {
      ReplsetSpec replset = new ReplsetSpec();
      replset.setName(REPLSET_NAME);
      replset.setAffinity(affinity(clusterType));
      spec.setReplsets(new ArrayList<>(ImmutableList.of(replset)));
    }
    ReplsetSpec replset = spec.getReplsets().get(0);
    replset.setSize(params.clusterSize);
    replset.setResources(toResourceRequirements(params.replicaset.computeResources));
    replset.setVolumeSpec(volumeSpec(params.replicaset.diskSize));

    if (spec.getSharding() != null) {
      ShardingSpec sharding = spec.getSharding();
      if (sharding.getConfigsvrReplSet() != null) {
        sharding.getConfigsvrReplSet().setSize(params.clusterSize);
        sharding.getConfigsvrReplSet().setVolumeSpec(volumeSpec(params.replicaset.diskSize));
      }
      if (sharding.getMongos() != null) {
        sharding
            .getMongos()
            .setResources(toResourceRequirements(params.replicaset.computeResources));
        if (sharding.getMongos().getExpose() == null) {
          sharding.getMongos().setExpose(new ExposeSpec());
        }
        if (!params.expose) {
          sharding.getMongos().getExpose().setExposeType(SERVICE_TYPE_CLUSTER_IP);
        }
      }
    }
    if (params.clusterSize == 1) {
      spec.setAllowUnsafeConfigurations(true);
      if (params.expose) {
        replset.setExpose(expose);
        if (spec.getSharding() != null) {
          spec.getSharding().setEnabled(false);
        }
      }
    }
    if (spec.getBackup() == null || StringUtils.isEmpty(spec.getBackup().getImage())) {
      spec.setBackup(backupSpec(operatorVersion));
    }
    if (isPmmEnabled(params.pmm)) {
      spec.setPmm(pmmSpec(params.pmm));
      spec.getPmm().setServerUser(null);
    }
    return cluster;
  }

  private static ArbiterSpec disabledArbiter(PodAffinity affinity) {
    ArbiterSpec arbiter = new ArbiterSpec();
    arbiter.setEnabled(false);
    arbiter.setSize(1);
    arbiter.setAffinity(affinity);
    return arbiter;
  }

  private static MongodSpec mongodSpec(String clusterName) {
    MongodSpec mongod = new MongodSpec();
    MongodSpec.Net net = new MongodSpec.Net();
    net.setPort(PORT);
    mongod.setNet(net);

    MongodSpec.OperationProfiling profiling = new MongodSpec.OperationProfiling();
    profiling.setMode(OPERATION_PROFILING_SLOW_OP);
    profiling.setSlowOpThresholdMs(100);
    profiling.setRateLimit(100);
    mongod.setOperationProfiling(profiling);

    MongodSpec.Security security = new MongodSpec.Security();
    security.setRedactClientLogData(false);
    security.setEnableEncryption(true);
    security.setEncryptionKeySecret(String.format(ENCRYPTION_KEY_SECRET_TEMPLATE, clusterName));
    security.setEncryptionCipherMode(ENCRYPTION_CIPHER_MODE);
    mongod.setSecurity(security);

    mongod.setSetParameter(ImmutableMap.of("ttlMonitorSleepSecs", 60));

    MongodSpec.WiredTiger wiredTiger = new MongodSpec.WiredTiger();
    wiredTiger.setEngineConfig(
        ImmutableMap.of("directoryForIndexes", false, "journalCompressor", COMPRESSOR_SNAPPY));
    wiredTiger.setCollectionConfig(ImmutableMap.of("blockCompressor", COMPRESSOR_SNAPPY));
    wiredTiger.setIndexConfig(ImmutableMap.of("prefixCompression", true));
    MongodSpec.Storage storage = new MongodSpec.Storage();
    storage.setEngine(STORAGE_ENGINE_WIRED_TIGER);
    storage.setWiredTiger(wiredTiger);
    mongod.setStorage(storage);
    return mongod;
  }

  private BackupSpec backupSpec(String operatorVersion) {
    BackupSpec backup = new BackupSpec();
    backup.setEnabled(true);
    backup.setImage(String.format(appConfig.getString(BACKUP_IMAGE_TEMPLATE), operatorVersion));
    backup.setServiceAccountName(PerconaServerMongoDB.OPERATOR_NAME);
    return backup;
  }
}
