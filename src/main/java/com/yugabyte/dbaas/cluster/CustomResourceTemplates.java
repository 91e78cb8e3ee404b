// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.cluster;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.typesafe.config.Config;
import com.yugabyte.dbaas.common.ErrorCode;
import com.yugabyte.dbaas.common.Json;
import com.yugabyte.dbaas.common.PlatformServiceException;
import com.yugabyte.dbaas.models.psmdb.PerconaServerMongoDB;
import com.yugabyte.dbaas.models.pxc.PerconaXtraDBCluster;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * Optional YAML custom resources used as the base document of new clusters instead of the
 * built-in defaults. Templates are read on every create so they can be edited without a restart.
 */
@Singleton
@Slf4j
public class CustomResourceTemplates {

  static final String PXC_TEMPLATE = "dbaas.pxc.cr_template";
  static final String PSMDB_TEMPLATE = "dbaas.psmdb.cr_template";

  private final Config appConfig;

  @Inject
  public CustomResourceTemplates(Config appConfig) {
    this.appConfig = appConfig;
  }

  public Optional<PerconaXtraDBCluster> xtraDBTemplate() {
    return loadConfigured(PXC_TEMPLATE, PerconaXtraDBCluster.class);
  }

  public Optional<PerconaServerMongoDB> psmdbTemplate() {
    return loadConfigured(PSMDB_TEMPLATE, PerconaServerMongoDB.class);
  }

  private <T> Optional<T> loadConfigured(String configKey, Class<T> type) {
    String location = appConfig.getString(configKey);
    if (StringUtils.isBlank(location)) {
      return Optional.empty();
    }
    Path path = Paths.get(location);
    if (!Files.isRegularFile(path)) {
      log.warn("Custom resource template {} not found, using defaults", path);
      return Optional.empty();
    }
    log.debug("Using custom resource template {}", path);
    return Optional.of(load(path, type));
  }

  @VisibleForTesting
  static <T> T load(Path path, Class<T> type) {
    try (InputStream is = Files.newInputStream(path)) {
      Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
      Object document = yaml.load(is);
      return Json.mapper().convertValue(document, type);
    } catch (IOException | RuntimeException e) {
      throw new PlatformServiceException(
          ErrorCode.INTERNAL, "Cannot load custom resource template " + path, e);
    }
  }
}
