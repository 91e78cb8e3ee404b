// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.modules;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Wiring of the controller. Everything else is bound just in time through {@code @Inject}
 * constructors.
 */
public class DbaasModule extends AbstractModule {

  private final Config config;

  public DbaasModule() {
    this(ConfigFactory.load());
  }

  public DbaasModule(Config config) {
    this.config = config;
  }

  @Provides
  @Singleton
  Config provideConfig() {
    return config;
  }
}
