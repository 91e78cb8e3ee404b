// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.common;

import static org.hamcrest.CoreMatchers.allOf;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class ShellProcessHandlerTest {

  static final String TMP_STORAGE_PATH = "/tmp/dbaas_tests/ShellProcessHandlerTest";

  private ShellProcessHandler shellProcessHandler;

  @Before
  public void beforeTest() {
    new File(TMP_STORAGE_PATH).mkdirs();
    Config config =
        ConfigFactory.parseMap(
            ImmutableMap.of(
                ShellProcessHandler.SHELL_TMP_DIR, TMP_STORAGE_PATH,
                ShellProcessHandler.DELETE_OUTPUT_FILES, true,
                ShellProcessHandler.MAX_ERROR_SIZE, 2000L));
    shellProcessHandler = new ShellProcessHandler(config, new ShutdownHookHandler(false));
  }

  @After
  public void tearDown() throws IOException {
    FileUtils.deleteDirectory(new File(TMP_STORAGE_PATH));
  }

  @Test
  public void testRunWithValidCommand() {
    ShellResponse response =
        shellProcessHandler.run(ImmutableList.of("echo", "  hello "), new HashMap<>());
    assertEquals(0, response.code);
    assertEquals("hello", response.message);
    assertEquals(0, shellProcessHandler.getLiveProcessCount());
  }

  @Test
  public void testPartialLineOutput() throws IOException {
    List<String> command = new ArrayList<>();
    command.add(createTestShellScript("printf foo && sleep 1 && printf bar"));
    ShellResponse response = shellProcessHandler.run(command, new HashMap<>());
    assertEquals(0, response.code);
    assertEquals("foobar", response.message.trim());
  }

  @Test
  public void testRunWithInvalidCommand() throws IOException {
    String testCmd = ">&2 echo error; sleep 1; echo foobar; exit 255";
    List<String> command = ImmutableList.of(createTestShellScript(testCmd));
    ShellResponse response = shellProcessHandler.run(command, new HashMap<>());
    assertEquals(255, response.code);
    assertThat(response.message.trim(), allOf(notNullValue(), equalTo("error")));
  }

  @Test
  public void testRunMissingProgram() {
    ShellResponse response =
        shellProcessHandler.run(
            ImmutableList.of("/nonexistent/dbaas-test-binary"), ShellProcessContext.DEFAULT);
    assertEquals(ShellResponse.ERROR_CODE_GENERIC_ERROR, response.code);
    assertThat(response.message, containsString("/nonexistent/dbaas-test-binary"));
  }

  @Test
  public void testStdin() {
    ShellResponse response =
        shellProcessHandler.run(
            ImmutableList.of("cat"),
            ShellProcessContext.builder().stdin("{\"kind\": \"Secret\"}").build());
    assertEquals(0, response.code);
    assertEquals("{\"kind\": \"Secret\"}", response.message);
  }

  @Test
  public void testStdinClosedByFailingCommand() {
    // Larger than a pipe buffer, so the write fails once the process is gone.
    String stdin = StringUtils.repeat('x', 4 * 1024 * 1024);
    ShellResponse response =
        shellProcessHandler.run(
            ImmutableList.of("sh", "-c", "echo boom >&2; exit 3"),
            ShellProcessContext.builder().stdin(stdin).build());
    assertEquals(3, response.code);
    assertEquals("boom", response.message);
  }

  @Test
  public void testExtraEnvVars() {
    ShellResponse response =
        shellProcessHandler.run(
            ImmutableList.of("sh", "-c", "echo $DBAAS_TEST_VAR"),
            ImmutableMap.of("DBAAS_TEST_VAR", "value"));
    assertEquals(0, response.code);
    assertEquals("value", response.message);
  }

  @Test
  public void testLongCommand() throws IOException {
    String testCmd = "echo output; >&2 echo error; sleep 20";
    List<String> command = ImmutableList.of(createTestShellScript(testCmd));
    long startMs = System.currentTimeMillis();
    ShellResponse response =
        shellProcessHandler.run(
            command, ShellProcessContext.builder().logCmdOutput(true).timeoutSecs(3).build());
    long durationMs = System.currentTimeMillis() - startMs;
    assertTrue(durationMs < 15000);
    assertNotEquals(0, response.code);
    assertThat(response.message.trim(), allOf(notNullValue(), equalTo("error")));
  }

  @Test
  public void testInterruptCancelsCommand() {
    Thread.currentThread().interrupt();
    ShellResponse response =
        shellProcessHandler.run(ImmutableList.of("sleep", "30"), ShellProcessContext.DEFAULT);
    // The interrupt flag is restored for the caller.
    assertTrue(Thread.interrupted());
    assertEquals(ShellResponse.ERROR_CODE_EXECUTION_CANCELLED, response.code);
    assertTrue(response.isCancelled());
    assertEquals(0, shellProcessHandler.getLiveProcessCount());
  }

  private String createTestShellScript(String cmd) throws IOException {
    Path fileName = Files.createTempFile(Paths.get(TMP_STORAGE_PATH), "dbaas_test", ".sh");
    Files.write(fileName, ("#!/bin/sh\n" + cmd).getBytes());
    fileName.toFile().setExecutable(true);
    return fileName.toString();
  }
}
