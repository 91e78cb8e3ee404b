// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.cluster;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.typesafe.config.Config;
import com.yugabyte.dbaas.common.ErrorCode;
import com.yugabyte.dbaas.common.PlatformServiceException;
import com.yugabyte.dbaas.common.kubernetes.KubectlManager;
import com.yugabyte.dbaas.common.kubernetes.KubernetesClusterType;
import com.yugabyte.dbaas.common.kubernetes.KubernetesResourceNotFoundException;
import com.yugabyte.dbaas.forms.NodeParams;
import com.yugabyte.dbaas.forms.OperatorVersions;
import com.yugabyte.dbaas.forms.XtraDBClusterParams;
import com.yugabyte.dbaas.forms.XtraDBClusterSummary;
import com.yugabyte.dbaas.forms.XtraDBCredentials;
import com.yugabyte.dbaas.models.PodDisruptionBudgetSpec;
import com.yugabyte.dbaas.models.pxc.PerconaXtraDBCluster;
import com.yugabyte.dbaas.models.pxc.PerconaXtraDBCluster.AppStatus;
import com.yugabyte.dbaas.models.pxc.PerconaXtraDBCluster.BackupSchedule;
import com.yugabyte.dbaas.models.pxc.PerconaXtraDBCluster.BackupSpec;
import com.yugabyte.dbaas.models.pxc.PerconaXtraDBCluster.BackupStorage;
import com.yugabyte.dbaas.models.pxc.PerconaXtraDBCluster.PerconaXtraDBClusterList;
import com.yugabyte.dbaas.models.pxc.PerconaXtraDBCluster.PodSpec;
import com.yugabyte.dbaas.models.pxc.PerconaXtraDBCluster.Spec;
import com.yugabyte.dbaas.models.pxc.PerconaXtraDBCluster.Status;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.collections4.ListUtils;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;

/** XtraDB clusters: PerconaXtraDBCluster resources with either ProxySQL or HAProxy in front. */
@Singleton
@Slf4j
public class XtraDBClusterManager
    extends ClusterManager<XtraDBClusterParams, XtraDBClusterSummary, XtraDBCredentials> {

  static final String DEFAULT_IMAGE = "dbaas.pxc.default_image";
  static final String BACKUP_IMAGE_TEMPLATE = "dbaas.pxc.backup_image_template";
  static final String PROXYSQL_IMAGE_TEMPLATE = "dbaas.pxc.proxysql_image_template";
  static final String HAPROXY_IMAGE_TEMPLATE = "dbaas.pxc.haproxy_image_template";
  static final String DEFAULT_OPERATOR_VERSION = "dbaas.pxc.default_operator_version";

  static final String SECRET_NAME_TEMPLATE = "dbaas-%s-pxc-secrets";
  static final String INTERNAL_SECRET_TEMPLATE = "internal-%s";
  // Secret shipped with the operator deployment, used as a base for new cluster secrets.
  static final String TEMPLATE_SECRET_NAME = "my-cluster-secrets";
  static final String BACKUP_STORAGE_TEMPLATE = "pxc-backup-storage-%s";

  static final List<String> PASSWORD_KEYS =
      ImmutableList.of(
          "root", "xtrabackup", "monitor", "clustercheck", "proxyadmin", "operator", "replication");
  static final String PMM_PASSWORD_KEY = "pmmserver";

  static final List<String> FINALIZERS = ImmutableList.of("delete-proxysql-pvc", "delete-pxc-pvc");

  static final String ROOT_USER = "root";
  static final int PORT = 3306;

  static final String COMPONENT_PXC = "pxc";
  static final String COMPONENT_PROXYSQL = "proxysql";
  static final String COMPONENT_HAPROXY = "haproxy";

  @Inject
  public XtraDBClusterManager(
      Config appConfig,
      ClusterSecretProvisioner secretProvisioner,
      CustomResourceTemplates templates) {
    super(appConfig, secretProvisioner, templates);
  }

  @Override
  public String getManagedBy() {
    return PerconaXtraDBCluster.OPERATOR_NAME;
  }

  @Override
  public List<XtraDBClusterSummary> list(KubectlManager kubectl) {
    List<PerconaXtraDBCluster> clusters =
        kubectl
            .get(PerconaXtraDBCluster.RESOURCE, null, PerconaXtraDBClusterList.class)
            .getItems();
    List<XtraDBClusterSummary> result = new ArrayList<>();
    for (PerconaXtraDBCluster cluster : ListUtils.emptyIfNull(clusters)) {
      result.add(toSummary(kubectl, cluster));
    }
    return appendDeleting(kubectl, result);
  }

  @Override
  public void validateCreateParams(XtraDBClusterParams params) {
    validateCreate(params);
    if ((params.proxysql != null) == (params.haproxy != null)) {
      throw new PlatformServiceException(
          ErrorCode.INVALID_ARGUMENT,
          "XtraDB cluster must have one and only one proxy type defined");
    }
    if (params.pxc == null || params.pxc.diskSize == null || params.pxc.diskSize <= 0) {
      throw new PlatformServiceException(
          ErrorCode.INVALID_ARGUMENT, "Disk size of pxc nodes must be positive");
    }
    validateNode(params.pxc, COMPONENT_PXC, true);
    validateNode(params.proxysql, COMPONENT_PROXYSQL, true);
    validateNode(params.haproxy, COMPONENT_HAPROXY, true);
  }

  @Override
  public void create(KubectlManager kubectl, XtraDBClusterParams params) {
    validateCreateParams(params);
    checkNotExists(get(kubectl, params.name), params.name);

    String operatorVersion =
        operatorVersion(kubectl, OperatorVersions::getXtradb, DEFAULT_OPERATOR_VERSION);
    KubernetesClusterType clusterType = clusterType(kubectl);
    String serviceType =
        params.expose && clusterType != KubernetesClusterType.MINIKUBE
            ? SERVICE_TYPE_LOAD_BALANCER
            : SERVICE_TYPE_NODE_PORT;

    String secretName = String.format(SECRET_NAME_TEMPLATE, params.name);
    Optional<PerconaXtraDBCluster> template = templates.xtraDBTemplate();
    PerconaXtraDBCluster cluster;
    if (template.isPresent()) {
      cluster = overrideTemplate(template.get(), params, operatorVersion);
      if (StringUtils.isNotEmpty(cluster.getSpec().getSecretsName())) {
        secretName = cluster.getSpec().getSecretsName();
      }
      cluster.getSpec().setSecretsName(secretName);
    } else {
      cluster = buildCluster(params, operatorVersion, secretName, clusterType, serviceType);
    }

    Map<String, String> passwords = secretProvisioner.generatePasswords(PASSWORD_KEYS);
    if (isPmmEnabled(params.pmm)) {
      passwords.put(PMM_PASSWORD_KEY, StringUtils.defaultString(params.pmm.password));
    }
    secretProvisioner.createSecret(kubectl, secretName, TEMPLATE_SECRET_NAME, passwords);

    log.info("Creating XtraDB cluster {} with operator version {}", params.name, operatorVersion);
    kubectl.apply(cluster);
  }

  @Override
  public void validateUpdateParams(XtraDBClusterParams params) {
    validateSuspendResume(params);
    if (params.proxysql != null && params.haproxy != null) {
      throw new PlatformServiceException(
          ErrorCode.INVALID_ARGUMENT, "Can't update both proxies, only one should be in use");
    }
    validateNode(params.pxc, COMPONENT_PXC, false);
    validateNode(params.proxysql, COMPONENT_PROXYSQL, false);
    validateNode(params.haproxy, COMPONENT_HAPROXY, false);
  }

  @Override
  public void update(KubectlManager kubectl, XtraDBClusterParams params) {
    validateUpdateParams(params);
    PerconaXtraDBCluster cluster = checkFound(get(kubectl, params.name), params.name);
    cluster.setKind(PerconaXtraDBCluster.KIND);
    cluster.setApiVersion(PerconaXtraDBCluster.API_VERSION);
    stripServerFields(cluster.getMetadata());
    Spec spec = cluster.getSpec();

    ClusterState state = classify(kubectl, cluster);
    if (params.resume && state == ClusterState.PAUSED) {
      log.info("Resuming XtraDB cluster {}", params.name);
      spec.setPause(false);
      kubectl.apply(cluster);
      return;
    }
    checkReady(state, params.name);

    if (params.suspend) {
      log.info("Suspending XtraDB cluster {}", params.name);
      spec.setPause(true);
    }
    if (params.clusterSize != null && params.clusterSize > 0) {
      spec.getPxc().setSize(params.clusterSize);
      PodSpec proxy = activeProxy(spec);
      if (proxy != null) {
        proxy.setSize(params.clusterSize);
      }
    }
    if (params.pxc != null) {
      spec.getPxc()
          .setResources(
              updateResourceRequirements(
                  params.pxc.computeResources, spec.getPxc().getResources()));
      String image = params.pxc.image;
      if (StringUtils.isNotEmpty(image) && !image.equals(spec.getPxc().getImage())) {
        validateImage(spec.getPxc().getImage(), image);
        log.info("Upgrading XtraDB cluster {} to {}", params.name, image);
        spec.getPxc().setImage(image);
      }
    }
    if (params.proxysql != null && spec.getProxysql() != null) {
      spec.getProxysql()
          .setResources(
              updateResourceRequirements(
                  params.proxysql.computeResources, spec.getProxysql().getResources()));
    }
    if (params.haproxy != null && spec.getHaproxy() != null) {
      spec.getHaproxy()
          .setResources(
              updateResourceRequirements(
                  params.haproxy.computeResources, spec.getHaproxy().getResources()));
    }

    log.info("Updating XtraDB cluster {}", params.name);
    kubectl.apply(cluster);
  }

  @Override
  public void delete(KubectlManager kubectl, String name) {
    PerconaXtraDBCluster cluster = new PerconaXtraDBCluster();
    cluster.setApiVersion(PerconaXtraDBCluster.API_VERSION);
    cluster.setKind(PerconaXtraDBCluster.KIND);
    cluster.setMetadata(new ObjectMetaBuilder().withName(name).build());
    try {
      kubectl.delete(cluster);
    } catch (KubernetesResourceNotFoundException e) {
      throw new PlatformServiceException(
          ErrorCode.NOT_FOUND, String.format("Cluster '%s' not found", name), e);
    }
    log.info("Deleted XtraDB cluster {}", name);
    secretProvisioner.deleteSecrets(
        kubectl,
        ImmutableList.of(
            String.format(SECRET_NAME_TEMPLATE, name),
            String.format(INTERNAL_SECRET_TEMPLATE, name)));
  }

  @Override
  public void restart(KubectlManager kubectl, String name) {
    log.info("Restarting XtraDB cluster {}", name);
    kubectl.restartStatefulSet(name + "-" + COMPONENT_PXC);
    for (String proxy : ImmutableList.of(COMPONENT_PROXYSQL, COMPONENT_HAPROXY)) {
      String statefulSet = name + "-" + proxy;
      if (kubectl.statefulSetExists(statefulSet)) {
        kubectl.restartStatefulSet(statefulSet);
        return;
      }
    }
  }

  @Override
  public XtraDBCredentials getCredentials(KubectlManager kubectl, String name) {
    PerconaXtraDBCluster cluster = checkFound(get(kubectl, name), name);
    ClusterState state = classify(kubectl, cluster);
    if (state != ClusterState.READY && state != ClusterState.CHANGING) {
      throw new PlatformServiceException(
          ErrorCode.FAILED_PRECONDITION,
          String.format(
              "Cannot get credentials of cluster '%s', state is %s, %s or %s is expected",
              name,
              state,
              ClusterState.READY,
              ClusterState.CHANGING));
    }
    String secretName =
        StringUtils.defaultIfEmpty(
            cluster.getSpec().getSecretsName(), String.format(SECRET_NAME_TEMPLATE, name));
    Secret secret =
        kubectl
            .getSecret(secretName)
            .orElseThrow(
                () ->
                    new PlatformServiceException(
                        ErrorCode.NOT_FOUND, String.format("Secret '%s' not found", secretName)));
    String password =
        ClusterSecretProvisioner.readSecretValue(secret, ROOT_USER)
            .orElseThrow(
                () ->
                    new PlatformServiceException(
                        ErrorCode.NOT_FOUND,
                        String.format("Secret '%s' has no %s password", secretName, ROOT_USER)));
    return XtraDBCredentials.builder()
        .username(ROOT_USER)
        .password(password)
        .host(cluster.getStatus() == null ? null : cluster.getStatus().getHost())
        .port(PORT)
        .build();
  }

  @Override
  protected XtraDBClusterSummary deletingSummary(String name) {
    return new XtraDBClusterSummary();
  }

  private Optional<PerconaXtraDBCluster> get(KubectlManager kubectl, String name) {
    return kubectl.getOptional(PerconaXtraDBCluster.RESOURCE, name, PerconaXtraDBCluster.class);
  }

  ClusterState classify(KubectlManager kubectl, PerconaXtraDBCluster cluster) {
    Spec spec = cluster.getSpec();
    if (spec == null || spec.getPxc() == null) {
      return ClusterState.INVALID;
    }
    String name = cluster.getMetadata().getName();
    Status status = cluster.getStatus();
    ClusterState state =
        ClusterStateClassifier.classify(
            status == null ? null : status.getState(), Boolean.TRUE.equals(spec.getPause()));
    return ClusterStateClassifier.detectUpgrade(
        state,
        kubectl,
        name,
        DeletingClusterTracker.LABEL_INSTANCE + "=" + name + ",app.kubernetes.io/component=pxc",
        Collections.singletonList(COMPONENT_PXC),
        spec.getPxc().getImage());
  }

  private XtraDBClusterSummary toSummary(KubectlManager kubectl, PerconaXtraDBCluster cluster) {
    XtraDBClusterSummary summary = new XtraDBClusterSummary();
    summary.setName(cluster.getMetadata().getName());
    summary.setState(classify(kubectl, cluster));
    Spec spec = cluster.getSpec();
    if (spec == null || spec.getPxc() == null) {
      return summary;
    }
    summary.setSize(spec.getPxc().getSize() == null ? 0 : spec.getPxc().getSize());
    summary.setPaused(Boolean.TRUE.equals(spec.getPause()));
    summary.setPxc(
        nodeSummary(
            spec.getPxc().getResources(), spec.getPxc().getVolumeSpec(), spec.getPxc().getImage()));

    Status status = cluster.getStatus();
    if (status != null && CollectionUtils.isNotEmpty(status.getConditions())) {
      List<int[]> progress = new ArrayList<>();
      for (AppStatus app :
          new AppStatus[] {status.getHaproxy(), status.getProxysql(), status.getPxc()}) {
        if (app != null) {
          progress.add(new int[] {count(app.getSize()), count(app.getReady())});
        }
      }
      summary.setOperation(operation(progress));
      summary.setMessage(String.join(";", ListUtils.emptyIfNull(status.getMessages())));
    }

    if (isEnabled(spec.getProxysql())) {
      PodSpec proxysql = spec.getProxysql();
      summary.setProxysql(
          nodeSummary(proxysql.getResources(), proxysql.getVolumeSpec(), proxysql.getImage()));
      summary.setExposed(isExposed(proxysql));
    } else if (isEnabled(spec.getHaproxy())) {
      PodSpec haproxy = spec.getHaproxy();
      summary.setHaproxy(nodeSummary(haproxy.getResources(), null, haproxy.getImage()));
      summary.setExposed(isExposed(haproxy));
    }
    return summary;
  }

  private PerconaXtraDBCluster buildCluster(
      XtraDBClusterParams params,
      String operatorVersion,
      String secretName,
      KubernetesClusterType clusterType,
      String serviceType) {
    PerconaXtraDBCluster cluster = new PerconaXtraDBCluster();
    cluster.setApiVersion(apiVersion(PerconaXtraDBCluster.API_GROUP, operatorVersion));
    cluster.setKind(PerconaXtraDBCluster.KIND);
    cluster.setMetadata(
        new ObjectMetaBuilder().withName(params.name).withFinalizers(FINALIZERS).build());

    Spec spec = new Spec();
    spec.setUpdateStrategy(UPDATE_STRATEGY_ROLLING);
    spec.setCrVersion(operatorVersion);
    spec.setAllowUnsafeConfigurations(true);
    spec.setSecretsName(secretName);

    PodSpec pxc = new PodSpec();
    pxc.setSize(params.clusterSize);
    pxc.setResources(toResourceRequirements(params.pxc.computeResources));
    pxc.setImage(
        StringUtils.defaultIfEmpty(params.pxc.image, appConfig.getString(DEFAULT_IMAGE)));
    pxc.setImagePullPolicy(appConfig.getString(IMAGE_PULL_POLICY));
    pxc.setVolumeSpec(volumeSpec(params.pxc.diskSize));
    pxc.setAffinity(affinity(clusterType));
    pxc.setPodDisruptionBudget(new PodDisruptionBudgetSpec(new IntOrString(1)));
    spec.setPxc(pxc);

    spec.setPmm(pmmSpec(params.pmm));
    spec.setBackup(backupSpec(params, operatorVersion));

    PodSpec proxy = new PodSpec();
    proxy.setEnabled(true);
    proxy.setSize(params.clusterSize);
    proxy.setImagePullPolicy(appConfig.getString(IMAGE_PULL_POLICY));
    proxy.setAffinity(affinity(clusterType));
    proxy.setServiceType(serviceType);
    if (params.proxysql != null) {
      proxy.setImage(proxyImage(params.proxysql, PROXYSQL_IMAGE_TEMPLATE, operatorVersion));
      proxy.setResources(toResourceRequirements(params.proxysql.computeResources));
      proxy.setVolumeSpec(volumeSpec(params.proxysql.diskSize));
      spec.setProxysql(proxy);
    } else {
      proxy.setImage(proxyImage(params.haproxy, HAPROXY_IMAGE_TEMPLATE, operatorVersion));
      proxy.setResources(toResourceRequirements(params.haproxy.computeResources));
      spec.setHaproxy(proxy);
    }
    cluster.setSpec(spec);
    return cluster;
  }

  /** Applies the request on top of a user provided custom resource. */
  private PerconaXtraDBCluster overrideTemplate(
      PerconaXtraDBCluster cluster, XtraDBClusterParams params, String operatorVersion) {
    if (StringUtils.isEmpty(cluster.getApiVersion())) {
      cluster.setApiVersion(apiVersion(PerconaXtraDBCluster.API_GROUP, operatorVersion));
    }
    cluster.setKind(PerconaXtraDBCluster.KIND);
    if (cluster.getMetadata() == null) {
      cluster.setMetadata(new ObjectMeta());
    }
    cluster.getMetadata().setName(params.name);
    if (cluster.getSpec() == null) {
      cluster.setSpec(new Spec());
    }
    Spec spec = cluster.getSpec();
    if (spec.getPxc() == null) {
      spec.setPxc(new PodSpec());
    }
    PodSpec pxc = spec.getPxc();
    if (StringUtils.isNotEmpty(params.pxc.image)) {
      pxc.setImage(params.pxc.image);
    } else if (StringUtils.isEmpty(pxc.getImage())) {
      pxc.setImage(appConfig.getString(DEFAULT_IMAGE));
    }
    pxc.setSize(params.clusterSize);
    pxc.setResources(toResourceRequirements(params.pxc.computeResources));
    if (pxc.getVolumeSpec() != null
        && pxc.getVolumeSpec().getPersistentVolumeClaim() != null
        && pxc.getVolumeSpec().getPersistentVolumeClaim().getStorageClassName() != null) {
      // Keep the storage class chosen by the template.
      pxc.getVolumeSpec()
          .getPersistentVolumeClaim()
          .setResources(
              volumeSpec(params.pxc.diskSize).getPersistentVolumeClaim().getResources());
    } else {
      pxc.setVolumeSpec(volumeSpec(params.pxc.diskSize));
    }

    if (spec.getBackup() == null) {
      spec.setBackup(backupSpec(params, operatorVersion));
    }
    if (StringUtils.isEmpty(spec.getBackup().getImage())) {
      spec.getBackup()
          .setImage(String.format(appConfig.getString(BACKUP_IMAGE_TEMPLATE), operatorVersion));
    }
    if (MapUtils.isEmpty(spec.getBackup().getStorages())) {
      spec.getBackup().setStorages(backupSpec(params, operatorVersion).getStorages());
    }

    if (params.proxysql != null && spec.getProxysql() != null) {
      spec.getProxysql().setResources(toResourceRequirements(params.proxysql.computeResources));
      spec.getProxysql().setVolumeSpec(volumeSpec(params.proxysql.diskSize));
      spec.getProxysql().setSize(params.clusterSize);
    }
    if (params.haproxy != null && spec.getHaproxy() != null) {
      spec.getHaproxy().setResources(toResourceRequirements(params.haproxy.computeResources));
      if (StringUtils.isNotEmpty(params.haproxy.image)) {
        spec.getHaproxy().setImage(params.haproxy.image);
      }
      spec.getHaproxy().setSize(params.clusterSize);
    }
    if (isPmmEnabled(params.pmm)) {
      spec.setPmm(pmmSpec(params.pmm));
    }
    return cluster;
  }

  private BackupSpec backupSpec(XtraDBClusterParams params, String operatorVersion) {
    String storageName = String.format(BACKUP_STORAGE_TEMPLATE, params.name);
    BackupSchedule schedule = new BackupSchedule();
    schedule.setName("test");
    schedule.setSchedule("*/30 * * * *");
    schedule.setKeep(3);
    schedule.setStorageName(storageName);

    BackupStorage storage = new BackupStorage();
    storage.setType(BackupStorage.TYPE_FILESYSTEM);
    storage.setVolume(volumeSpec(params.pxc.diskSize));

    BackupSpec backup = new BackupSpec();
    backup.setImage(String.format(appConfig.getString(BACKUP_IMAGE_TEMPLATE), operatorVersion));
    backup.setSchedule(ImmutableList.of(schedule));
    backup.setStorages(Collections.singletonMap(storageName, storage));
    backup.setServiceAccountName(PerconaXtraDBCluster.OPERATOR_NAME);
    return backup;
  }

  private String proxyImage(NodeParams proxy, String templateKey, String operatorVersion) {
    if (StringUtils.isNotEmpty(proxy.image)) {
      return proxy.image;
    }
    return String.format(appConfig.getString(templateKey), operatorVersion);
  }

  @Nullable
  private static PodSpec activeProxy(Spec spec) {
    if (isEnabled(spec.getProxysql())) {
      return spec.getProxysql();
    }
    if (isEnabled(spec.getHaproxy())) {
      return spec.getHaproxy();
    }
    return null;
  }

  private static boolean isEnabled(@Nullable PodSpec podSpec) {
    return podSpec != null && !Boolean.FALSE.equals(podSpec.getEnabled());
  }

  private static boolean isExposed(PodSpec proxy) {
    return StringUtils.isNotEmpty(proxy.getServiceType())
        && !SERVICE_TYPE_CLUSTER_IP.equals(proxy.getServiceType());
  }
}
