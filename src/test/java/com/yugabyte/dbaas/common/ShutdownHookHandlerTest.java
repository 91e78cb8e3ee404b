// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.Comparators;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.junit.Test;

public class ShutdownHookHandlerTest {

  @Test
  public void testOnApplicationShutdown() {
    ShutdownHookHandler handler = new ShutdownHookHandler(false);
    int[] weights = new int[] {1, 2, 1, 3, 1, 5, 2, 10, 7, 9, 5, 3};
    List<Integer> weightOrders = new ArrayList<>();
    List<Object> objects = new ArrayList<>();
    for (int weight : weights) {
      Object referent = new Object();
      objects.add(referent);
      handler.addShutdownHook(
          referent,
          (obj) -> {
            assertTrue(obj == referent);
            synchronized (weightOrders) {
              weightOrders.add(weight);
            }
          },
          weight);
    }
    handler.onApplicationShutdown();
    assertEquals(weights.length, weightOrders.size());
    assertTrue(
        "Received weights" + weightOrders,
        Comparators.isInOrder(weightOrders, Comparator.reverseOrder()));
    assertEquals(weights.length, objects.size());
  }

  @Test
  public void testFailingHookDoesNotStopOthers() {
    ShutdownHookHandler handler = new ShutdownHookHandler(false);
    List<String> called = new ArrayList<>();
    Object first = new Object();
    Object second = new Object();
    handler.addShutdownHook(
        first,
        obj -> {
          throw new IllegalStateException("boom");
        },
        2);
    handler.addShutdownHook(second, obj -> called.add("second"), 1);
    handler.onApplicationShutdown();
    assertEquals(1, called.size());
  }
}
