// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.modules;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.yugabyte.dbaas.controllers.handlers.KubernetesClusterHandler;
import com.yugabyte.dbaas.controllers.handlers.LogsHandler;
import com.yugabyte.dbaas.controllers.handlers.PSMDBClusterHandler;
import com.yugabyte.dbaas.controllers.handlers.XtraDBClusterHandler;
import org.junit.Test;

public class DbaasModuleTest {

  @Test
  public void testHandlersAreInjected() {
    Injector injector = Guice.createInjector(new DbaasModule());
    assertNotNull(injector.getInstance(XtraDBClusterHandler.class));
    assertNotNull(injector.getInstance(PSMDBClusterHandler.class));
    assertNotNull(injector.getInstance(KubernetesClusterHandler.class));
    assertSame(
        injector.getInstance(LogsHandler.class), injector.getInstance(LogsHandler.class));
  }

  @Test
  public void testConfigOverride() {
    Config config =
        ConfigFactory.parseMap(ImmutableMap.of("dbaas.logs.overall_lines_limit", 10))
            .withFallback(ConfigFactory.load());
    Injector injector = Guice.createInjector(new DbaasModule(config));
    assertEquals(10, injector.getInstance(Config.class).getInt("dbaas.logs.overall_lines_limit"));
  }
}
