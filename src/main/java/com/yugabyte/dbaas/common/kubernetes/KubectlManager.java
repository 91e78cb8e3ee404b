// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.common.kubernetes;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.yugabyte.dbaas.common.Json;
import com.yugabyte.dbaas.common.ShellProcessContext;
import com.yugabyte.dbaas.common.ShellProcessHandler;
import com.yugabyte.dbaas.common.ShellResponse;
import io.fabric8.kubernetes.api.model.PodList;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.storage.StorageClass;
import io.fabric8.kubernetes.api.model.storage.StorageClassList;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * kubectl bound to one target cluster. Instances are created per request by {@link
 * KubectlManagerFactory} and must be closed to remove the saved kubeconfig.
 *
 * <p>Every call is a separate process. A missing object is reported as {@link
 * KubernetesResourceNotFoundException} (or an empty {@link Optional} from {@link #getOptional}),
 * any other failure as {@link KubectlException}. Interrupting the calling thread kills the running
 * kubectl process and surfaces as {@link CancellationException}. Nothing is retried.
 */
@Slf4j
public class KubectlManager implements AutoCloseable {

  // Reported by the API server only; client side errors like a missing context do not match.
  private static final String NOT_FOUND_MARKER = "Error from server (NotFound)";

  private final ShellProcessHandler shellProcessHandler;

  @Getter private final List<String> kubectlCommand;

  @Nullable private final Path kubeconfigDir;

  private final long timeoutSecs;

  KubectlManager(
      ShellProcessHandler shellProcessHandler,
      List<String> kubectlCommand,
      @Nullable Path kubeconfigDir,
      long timeoutSecs) {
    this.shellProcessHandler = shellProcessHandler;
    this.kubectlCommand = ImmutableList.copyOf(kubectlCommand);
    this.kubeconfigDir = kubeconfigDir;
    this.timeoutSecs = timeoutSecs;
  }

  /**
   * Runs {@code kubectl get -o=json <kind> [name]} and decodes the output.
   *
   * @param kind resource kind, e.g. {@code perconaxtradbcluster} or {@code pods}.
   * @param name object name, or null to list all objects of the kind.
   * @throws KubernetesResourceNotFoundException if the object does not exist.
   */
  public <T> T get(String kind, @Nullable String name, Class<T> type) {
    List<String> args = new ArrayList<>(Arrays.asList("get", "-o=json", kind));
    if (StringUtils.isNotEmpty(name)) {
      args.add(name);
    }
    return deserialize(run(args, null, false /*logCmdOutput*/), type);
  }

  /** Same as {@link #get} but returns empty when the object does not exist. */
  public <T> Optional<T> getOptional(String kind, String name, Class<T> type) {
    List<String> args = ImmutableList.of("get", "-o=json", kind, name);
    ShellResponse response = execute(args, null, false /*logCmdOutput*/);
    if (isNotFound(response)) {
      return Optional.empty();
    }
    return Optional.of(deserialize(checkResponse(args, response), type));
  }

  /** Creates or updates the object, sent as JSON on stdin. */
  public void apply(Object resource) {
    run(ImmutableList.of("apply", "-f", "-"), resource, true /*logCmdOutput*/);
  }

  /** Deletes the object identified by apiVersion, kind and metadata.name of the given resource. */
  public void delete(Object resource) {
    run(ImmutableList.of("delete", "-f", "-"), resource, true /*logCmdOutput*/);
  }

  /**
   * Runs kubectl with the given arguments.
   *
   * @param stdin object serialized as indented JSON into the process input, may be null.
   * @return stdout of the command.
   */
  public String run(List<String> args, @Nullable Object stdin) {
    return run(args, stdin, true /*logCmdOutput*/);
  }

  public List<StorageClass> getStorageClasses() {
    return get("storageclass", null, StorageClassList.class).getItems();
  }

  /** Lists pods in the default namespace of the kubeconfig, optionally by label selector. */
  public PodList getPods(@Nullable String labelSelector) {
    List<String> args = new ArrayList<>(Arrays.asList("get", "-o=json", "pods"));
    if (StringUtils.isNotEmpty(labelSelector)) {
      args.add("-l");
      args.add(labelSelector);
    }
    return deserialize(run(args, null, false /*logCmdOutput*/), PodList.class);
  }

  public Optional<Secret> getSecret(String name) {
    return getOptional("secret", name, Secret.class);
  }

  public boolean statefulSetExists(String name) {
    return getOptional("statefulset", name, JsonNode.class).isPresent();
  }

  public void restartStatefulSet(String name) {
    run(ImmutableList.of("rollout", "restart", "StatefulSet", name), null);
  }

  public String getContainerLogs(String pod, String container) {
    return run(ImmutableList.of("logs", pod, container), null, false /*logCmdOutput*/);
  }

  public String describePod(String pod) {
    return run(ImmutableList.of("describe", "pod", pod), null, false /*logCmdOutput*/);
  }

  public List<String> getApiVersions() {
    String output = run(ImmutableList.of("api-versions"), null, false /*logCmdOutput*/);
    return Arrays.stream(output.split("\n"))
        .map(String::trim)
        .filter(StringUtils::isNotEmpty)
        .collect(Collectors.toList());
  }

  /** Client and server versions, as reported by {@code kubectl version -o json}. */
  public JsonNode getVersion() {
    return deserialize(
        run(ImmutableList.of("version", "-o", "json"), null, true /*logCmdOutput*/),
        JsonNode.class);
  }

  @Override
  public void close() {
    if (kubeconfigDir != null) {
      FileUtils.deleteQuietly(kubeconfigDir.toFile());
    }
  }

  private String run(List<String> args, @Nullable Object stdin, boolean logCmdOutput) {
    return checkResponse(args, execute(args, stdin, logCmdOutput));
  }

  private ShellResponse execute(List<String> args, @Nullable Object stdin, boolean logCmdOutput) {
    List<String> command = new ArrayList<>(kubectlCommand);
    command.addAll(args);
    ShellProcessContext.ShellProcessContextBuilder context =
        ShellProcessContext.builder()
            .description(String.join(" ", command))
            .logCmdOutput(logCmdOutput)
            .timeoutSecs(timeoutSecs);
    if (stdin != null) {
      context.stdin(Json.toPrettyString(stdin));
    }
    return shellProcessHandler.run(command, context.build());
  }

  private String checkResponse(List<String> args, ShellResponse response) {
    if (response.isSuccess()) {
      return StringUtils.defaultString(response.message);
    }
    String cmd = String.join(" ", kubectlCommand) + " " + String.join(" ", args);
    if (response.isCancelled()) {
      throw new CancellationException(String.format("Command '%s' is cancelled.", cmd));
    }
    if (isNotFound(response)) {
      throw new KubernetesResourceNotFoundException(cmd, response.code, response.message);
    }
    throw new KubectlException(cmd, response.code, response.message);
  }

  @VisibleForTesting
  static boolean isNotFound(ShellResponse response) {
    if (response.isSuccess() || response.isCancelled() || response.message == null) {
      return false;
    }
    return response.message.contains(NOT_FOUND_MARKER);
  }

  private <T> T deserialize(String json, Class<T> type) {
    try {
      return Json.mapper().readValue(json, type);
    } catch (Exception e) {
      throw new KubectlException("Error deserializing response from kubectl command", e);
    }
  }
}
