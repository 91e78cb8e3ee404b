// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.common;

import com.google.common.annotations.VisibleForTesting;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.WeakHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs registered callbacks when the JVM shuts down. Hooks with greater weights run first, hooks
 * of equal weight run concurrently. Used to terminate child processes that would otherwise
 * outlive the controller.
 */
@Slf4j
@Singleton
public class ShutdownHookHandler {

  private final ExecutorService shutdownExecutor;
  private final Map<Object, Hook<?>> hooks;
  private int lastTime = 0;

  @Getter
  private static class Hook<T> implements Comparable<Hook<?>>, Runnable {
    private final WeakReference<T> referentRef;
    private final Consumer<T> consumer;
    private final int weight;
    private final int time;

    Hook(T referent, Consumer<T> consumer, int weight, int time) {
      // Key in the map cannot be directly referred as it can create strong reference.
      this.referentRef = new WeakReference<>(referent);
      this.consumer = consumer;
      this.weight = weight;
      this.time = time;
    }

    @Override
    public int compareTo(Hook<?> o) {
      // Descending such that greater weights are submitted first.
      if (weight == o.weight) {
        // Later ones are submitted first.
        return o.time - time;
      }
      return o.weight - weight;
    }

    @Override
    public void run() {
      try {
        T referent = referentRef.get();
        if (referent != null) {
          consumer.accept(referent);
        }
      } catch (Exception e) {
        log.error("Error in running hook {}", this, e);
      }
    }
  }

  @Inject
  public ShutdownHookHandler() {
    this(true);
  }

  @VisibleForTesting
  ShutdownHookHandler(boolean registerRuntimeHook) {
    this.shutdownExecutor = Executors.newCachedThreadPool();
    this.hooks = new WeakHashMap<>();
    if (registerRuntimeHook) {
      Runtime.getRuntime()
          .addShutdownHook(new Thread(this::onApplicationShutdown, "dbaas-shutdown-hooks"));
    }
  }

  /**
   * Registers a callback to be invoked on shutdown. When the referent is garbage collected, the
   * hook is removed.
   *
   * @param referent the referent object to manage the removal.
   * @param consumer the callback.
   * @param weight the precedence for ordering. Higher the value, higher is the precedence.
   */
  public synchronized <T> void addShutdownHook(T referent, Consumer<T> consumer, int weight) {
    hooks.put(referent, new Hook<T>(referent, consumer, weight, lastTime++));
  }

  @VisibleForTesting
  void onApplicationShutdown() {
    List<Hook<?>> list;
    synchronized (this) {
      if (shutdownExecutor.isShutdown()) {
        return;
      }
      list = new ArrayList<>(hooks.values());
    }
    Collections.sort(list);
    int pos = 0;
    while (pos < list.size()) {
      Map<Hook<?>, Future<?>> futures = new HashMap<>();
      Hook<?> currHook = list.get(pos);
      futures.put(currHook, shutdownExecutor.submit(currHook));
      pos++;
      // Hooks with the same weights are executed concurrently.
      for (; pos < list.size(); pos++) {
        currHook = list.get(pos);
        if (list.get(pos - 1).getWeight() == currHook.getWeight()) {
          futures.put(currHook, shutdownExecutor.submit(currHook));
        } else {
          break;
        }
      }
      // Wait for completion of the previously submitted shutdown hooks.
      futures
          .entrySet()
          .forEach(
              entry -> {
                try {
                  entry.getValue().get();
                } catch (Exception e) {
                  log.warn("Failed to wait for shutdown of hook {}", entry.getKey(), e);
                }
              });
    }
    shutdownExecutor.shutdownNow();
  }
}
