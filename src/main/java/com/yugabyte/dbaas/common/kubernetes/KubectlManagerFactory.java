// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.common.kubernetes;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.typesafe.config.Config;
import com.yugabyte.dbaas.common.Json;
import com.yugabyte.dbaas.common.ShellProcessContext;
import com.yugabyte.dbaas.common.ShellProcessHandler;
import com.yugabyte.dbaas.common.ShellResponse;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Builds a {@link KubectlManager} for a kubeconfig document. Picks the kubectl binary, and when
 * enabled, a binary matching the server version within the supported skew of one minor version.
 */
@Singleton
@Slf4j
public class KubectlManagerFactory {

  static final String KUBECONFIG_FILE_NAME = "kubeconfig.json";

  static final String DEFAULT_PATHS = "dbaas.kubectl.default_paths";
  static final String DEV_COMMAND = "dbaas.kubectl.dev_command";
  static final String SELECT_VERSION = "dbaas.kubectl.select_version";
  static final String TIMEOUT_SECS = "dbaas.kubectl.timeout_secs";
  static final String SHELL_TMP_DIR = "dbaas.shell.tmp_dir";

  private final ShellProcessHandler shellProcessHandler;

  private final Config appConfig;

  @Inject
  public KubectlManagerFactory(ShellProcessHandler shellProcessHandler, Config appConfig) {
    this.shellProcessHandler = shellProcessHandler;
    this.appConfig = appConfig;
  }

  /**
   * Creates a client for the cluster described by the kubeconfig. With an empty kubeconfig the
   * default context of the kubectl binary is used.
   */
  public KubectlManager create(@Nullable String kubeconfig) {
    List<String> defaultKubectl = getDefaultKubectlCommand();
    long timeoutSecs = appConfig.getLong(TIMEOUT_SECS);
    if (StringUtils.isEmpty(kubeconfig)) {
      return new KubectlManager(shellProcessHandler, defaultKubectl, null, timeoutSecs);
    }

    Path kubeconfigDir = saveKubeconfig(kubeconfig);
    try {
      String kubeconfigFlag = "--kubeconfig=" + kubeconfigDir.resolve(KUBECONFIG_FILE_NAME);
      List<String> kubectl = defaultKubectl;
      if (appConfig.getBoolean(SELECT_VERSION)) {
        kubectl = selectKubectlCommand(defaultKubectl, kubeconfigFlag, timeoutSecs);
      }
      log.info("Using '{}'", String.join(" ", kubectl));
      List<String> command = new ArrayList<>(kubectl);
      command.add(kubeconfigFlag);
      return new KubectlManager(shellProcessHandler, command, kubeconfigDir, timeoutSecs);
    } catch (RuntimeException e) {
      FileUtils.deleteQuietly(kubeconfigDir.toFile());
      throw e;
    }
  }

  @VisibleForTesting
  List<String> getDefaultKubectlCommand() {
    for (String path : appConfig.getStringList(DEFAULT_PATHS)) {
      Optional<String> found = lookPath(path);
      if (found.isPresent()) {
        return ImmutableList.of(found.get());
      }
    }
    // Assume it's local dev env.
    List<String> devCommand =
        new ArrayList<>(
            Splitter.on(' ').omitEmptyStrings().splitToList(appConfig.getString(DEV_COMMAND)));
    if (!devCommand.isEmpty()) {
      Optional<String> found = lookPath(devCommand.get(0));
      if (found.isPresent()) {
        devCommand.set(0, found.get());
        return ImmutableList.copyOf(devCommand);
      }
    }
    throw new KubectlException(
        String.format(
            "cannot find default kubectl: tried %s and '%s'",
            appConfig.getStringList(DEFAULT_PATHS), appConfig.getString(DEV_COMMAND)));
  }

  private List<String> selectKubectlCommand(
      List<String> defaultKubectl, String kubeconfigFlag, long timeoutSecs) {
    List<String> command = new ArrayList<>(defaultKubectl);
    command.add("version");
    command.add(kubeconfigFlag);
    command.add("-o");
    command.add("json");
    ShellResponse response =
        shellProcessHandler.run(
            command,
            ShellProcessContext.builder().logCmdOutput(true).timeoutSecs(timeoutSecs).build());
    if (!response.isSuccess() && !response.isCancelled()) {
      // Unreachable or unauthorized cluster.
      throw new KubectlException(String.join(" ", command), response.code, response.message);
    }
    response.processErrors("Unable to get Kubernetes server version");
    for (String name : selectKubectlVersions(response.message)) {
      Optional<String> found = lookPath(name);
      if (found.isPresent()) {
        return ImmutableList.of(found.get());
      }
    }
    return defaultKubectl;
  }

  /**
   * Names of kubectl binaries supported by the server in the given {@code kubectl version -o json}
   * output, newest first. kubectl is supported within one minor version of kube-apiserver.
   */
  @VisibleForTesting
  static List<String> selectKubectlVersions(String versionJson) {
    JsonNode serverVersion;
    try {
      serverVersion = Json.mapper().readTree(versionJson).path("serverVersion");
    } catch (IOException e) {
      throw new KubectlException("Unable to parse kubectl version output", e);
    }
    // Managed offerings report minor versions like "18+".
    String major = serverVersion.path("major").asText().replaceAll("\\D", "");
    String minor = serverVersion.path("minor").asText().replaceAll("\\D", "");
    if (major.isEmpty() || minor.isEmpty()) {
      throw new KubectlException("Unable to find server version in: " + versionJson);
    }
    int serverMajor = Integer.parseInt(major);
    int serverMinor = Integer.parseInt(minor);
    List<String> names = new ArrayList<>();
    for (int m = serverMinor + 1; m >= serverMinor - 1; m--) {
      names.add(String.format("kubectl-%d.%d", serverMajor, m));
    }
    return names;
  }

  @VisibleForTesting
  Optional<String> lookPath(String name) {
    if (name.contains(File.separator)) {
      return Files.isExecutable(Paths.get(name)) ? Optional.of(name) : Optional.empty();
    }
    String pathEnv = StringUtils.defaultString(System.getenv("PATH"));
    for (String dir : Splitter.on(File.pathSeparatorChar).omitEmptyStrings().split(pathEnv)) {
      Path candidate = Paths.get(dir, name);
      if (Files.isExecutable(candidate)) {
        return Optional.of(candidate.toString());
      }
    }
    return Optional.empty();
  }

  private Path saveKubeconfig(String kubeconfig) {
    try {
      Path dir =
          Files.createTempDirectory(
              Paths.get(appConfig.getString(SHELL_TMP_DIR)), "dbaas-controller-kubeconfigs-");
      File file = dir.resolve(KUBECONFIG_FILE_NAME).toFile();
      FileUtils.writeStringToFile(file, kubeconfig, StandardCharsets.UTF_8);
      // Owner only.
      file.setReadable(false, false);
      file.setReadable(true, true);
      file.setWritable(false, false);
      file.setWritable(true, true);
      log.info("kubectl config: {}", file.getAbsolutePath());
      return dir;
    } catch (IOException e) {
      throw new KubectlException("Unable to save kubeconfig", e);
    }
  }
}
