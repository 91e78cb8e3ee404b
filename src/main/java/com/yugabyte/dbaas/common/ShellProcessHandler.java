/*
 * Copyright 2019 YugaByte, Inc. and Contributors
 *
 * Licensed under the Polyform Free Trial License 1.0.0 (the "License"); you
 * may not use this file except in compliance with the License. You
 * may obtain a copy of the License at
 *
 *     https://github.com/YugaByte/yugabyte-db/blob/master/licenses/POLYFORM-FREE-TRIAL-LICENSE-1.0.0.txt
 */

package com.yugabyte.dbaas.common;

import static com.yugabyte.dbaas.common.ShellResponse.ERROR_CODE_EXECUTION_CANCELLED;
import static com.yugabyte.dbaas.common.ShellResponse.ERROR_CODE_GENERIC_ERROR;
import static com.yugabyte.dbaas.common.ShellResponse.ERROR_CODE_SUCCESS;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import com.typesafe.config.Config;
import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.MapUtils;

/**
 * Runs external commands as single-shot child processes. Output is captured into temp files, the
 * run is bounded by an optional timeout, and interrupting the calling thread terminates the child.
 * Children still alive when the JVM exits are killed from a shutdown hook.
 */
@Singleton
@Slf4j
public class ShellProcessHandler {

  private static final Duration DESTROY_GRACE_TIMEOUT = Duration.ofSeconds(10);

  static final String SHELL_TMP_DIR = "dbaas.shell.tmp_dir";
  static final String DELETE_OUTPUT_FILES = "dbaas.shell.delete_output_files";
  static final String MAX_ERROR_SIZE = "dbaas.shell.max_error_size";

  private final Config appConfig;

  private final Set<Process> liveProcesses = ConcurrentHashMap.newKeySet();

  @Inject
  public ShellProcessHandler(Config appConfig, ShutdownHookHandler shutdownHookHandler) {
    this.appConfig = appConfig;
    // Runs before anything else so that no child outlives the controller.
    shutdownHookHandler.addShutdownHook(
        this, ShellProcessHandler::destroyLiveProcesses, Integer.MAX_VALUE);
  }

  public ShellResponse run(List<String> command, Map<String, String> extraEnvVars) {
    return run(
        command,
        ShellProcessContext.builder().extraEnvVars(extraEnvVars).logCmdOutput(true).build());
  }

  /**
   * Runs the command and waits for it to finish.
   *
   * @param command - command to run with list of args
   * @param context - command context
   * @return shell response, never null. Failures to start or wait for the process are reported
   *     through the response code.
   */
  public ShellResponse run(List<String> command, ShellProcessContext context) {
    ProcessBuilder pb = new ProcessBuilder(command);
    Map<String, String> extraEnvVars = context.getExtraEnvVars();
    if (MapUtils.isNotEmpty(extraEnvVars)) {
      pb.environment().putAll(extraEnvVars);
    }

    ShellResponse response = new ShellResponse();
    response.code = ERROR_CODE_GENERIC_ERROR;
    if (context.getDescription() == null) {
      response.setDescription(command);
    } else {
      response.description = context.getDescription();
    }

    File tempOutputFile = null;
    File tempErrorFile = null;
    long startMs = 0;
    Process process = null;
    try {
      File tmpDir = new File(appConfig.getString(SHELL_TMP_DIR));
      tempOutputFile = File.createTempFile("shell_process_out", "tmp", tmpDir);
      tempErrorFile = File.createTempFile("shell_process_err", "tmp", tmpDir);
      pb.redirectOutput(tempOutputFile);
      pb.redirectError(tempErrorFile);
      startMs = System.currentTimeMillis();
      logAtLevel(
          context,
          String.format(
              "Starting proc (full cmd) - '%s' - logging stdout=%s, stderr=%s",
              String.join("' '", command),
              tempOutputFile.getAbsolutePath(),
              tempErrorFile.getAbsolutePath()));

      long endTimeSecs = 0;
      if (context.getTimeoutSecs() > 0) {
        endTimeSecs = (System.currentTimeMillis() / 1000) + context.getTimeoutSecs();
      }
      process = pb.start();
      liveProcesses.add(process);
      IOException stdinError = null;
      try {
        writeStdin(process, context.getStdin());
      } catch (IOException e) {
        // The process closed stdin early, its exit code and stderr tell why.
        log.warn("Unable to write stdin of '{}': {}", response.description, e.getMessage());
        stdinError = e;
      }
      waitForProcessExit(process, response.description, endTimeSecs);

      boolean logCmdOutput = context.isLogCmdOutput();
      try (BufferedReader outputStream = getLastNReader(tempOutputFile, Long.MAX_VALUE);
          BufferedReader errorStream = getLastNReader(tempErrorFile, getMaxErrorSize())) {
        if (logCmdOutput) {
          log.debug("Proc stdout for '{}' :", response.description);
        }
        String processOutput = getOutputLines(outputStream, logCmdOutput);
        String processError = getOutputLines(errorStream, logCmdOutput);
        try {
          response.code = process.exitValue();
        } catch (IllegalThreadStateException itse) {
          response.code = ERROR_CODE_GENERIC_ERROR;
          log.warn(
              "Expected process to be shut down, marking this process as failed '{}'",
              response.description,
              itse);
        }
        response.message = (response.code == ERROR_CODE_SUCCESS) ? processOutput : processError;
        if (stdinError != null && response.code == ERROR_CODE_SUCCESS) {
          response.code = ERROR_CODE_GENERIC_ERROR;
          response.message = "Unable to write stdin: " + stdinError.getMessage();
        }
      }
    } catch (IOException | InterruptedException e) {
      response.code = ERROR_CODE_GENERIC_ERROR;
      if (e instanceof InterruptedException) {
        response.code = ERROR_CODE_EXECUTION_CANCELLED;
      }
      log.error("Exception running command '{}'", response.description, e);
      response.message = e.getMessage();
      // Send a kill signal to ensure process is cleaned up in case of any failure.
      if (process != null && process.isAlive()) {
        terminate(process, response.description);
      }
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
    } finally {
      if (process != null) {
        liveProcesses.remove(process);
      }
      if (startMs > 0) {
        response.durationMs = System.currentTimeMillis() - startMs;
      }
      String status =
          (ERROR_CODE_SUCCESS == response.code) ? "success" : ("failure code=" + response.code);
      logAtLevel(
          context,
          String.format(
              "Completed proc '%s' status=%s [ %d ms ]",
              response.description, status, response.durationMs));
      if (appConfig.getBoolean(DELETE_OUTPUT_FILES)) {
        if (tempOutputFile != null && tempOutputFile.exists()) {
          tempOutputFile.delete();
        }
        if (tempErrorFile != null && tempErrorFile.exists()) {
          tempErrorFile.delete();
        }
      }
    }

    return response;
  }

  @VisibleForTesting
  int getLiveProcessCount() {
    return liveProcesses.size();
  }

  private void destroyLiveProcesses() {
    for (Process process : liveProcesses) {
      log.warn("Killing process {} on shutdown", process.pid());
      process.destroyForcibly();
    }
  }

  private static void logAtLevel(ShellProcessContext context, String msg) {
    if (context.isTraceLogging()) {
      log.trace(msg);
    } else {
      log.info(msg);
    }
  }

  private static void writeStdin(Process process, String stdin) throws IOException {
    try (OutputStream os = process.getOutputStream()) {
      if (stdin != null) {
        os.write(stdin.getBytes(StandardCharsets.UTF_8));
      }
    }
  }

  private String getOutputLines(BufferedReader reader, boolean logOutput) {
    return reader
        .lines()
        .peek(
            line -> {
              if (logOutput) {
                log.debug(line);
              }
            })
        .collect(Collectors.joining("\n"))
        .trim();
  }

  private long getMaxErrorSize() {
    return appConfig.getBytes(MAX_ERROR_SIZE);
  }

  /** For a given file return a bufferred reader that reads only last N bytes. */
  private static BufferedReader getLastNReader(File file, long lastNBytes)
      throws FileNotFoundException {
    final BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8));
    long skip = file.length() - lastNBytes;
    if (skip > 0) {
      try {
        log.warn(
            "Skipped first {} bytes because max_error_size= {}", reader.skip(skip), lastNBytes);
      } catch (IOException e) {
        log.warn("Unexpected exception when skipping large file", e);
      }
    }
    return reader;
  }

  private static void waitForProcessExit(Process process, String description, long endTimeSecs)
      throws InterruptedException {
    while (!process.waitFor(1, TimeUnit.SECONDS)) {
      if (endTimeSecs > 0 && ((System.currentTimeMillis() / 1000) >= endTimeSecs)) {
        log.warn("Aborting command {} forcibly because it took too long", description);
        destroyForcibly(process, description);
        break;
      }
    }
  }

  private static void terminate(Process process, String description) {
    // Only destroy sends SIGTERM to the process.
    process.destroy();
    try {
      if (!process.waitFor(DESTROY_GRACE_TIMEOUT.getSeconds(), TimeUnit.SECONDS)) {
        log.error(
            "Process could not be destroyed gracefully within the specified time '{}'",
            description);
        destroyForcibly(process, description);
      }
    } catch (InterruptedException e) {
      destroyForcibly(process, description);
      Thread.currentThread().interrupt();
    }
  }

  private static void destroyForcibly(Process process, String description) {
    process.destroyForcibly();
    try {
      process.waitFor(DESTROY_GRACE_TIMEOUT.getSeconds(), TimeUnit.SECONDS);
      log.info("Process was succesfully forcibly terminated '{}'", description);
    } catch (InterruptedException ie) {
      log.warn("Ignoring problem with forcible process termination '{}'", description, ie);
      Thread.currentThread().interrupt();
    }
  }
}
