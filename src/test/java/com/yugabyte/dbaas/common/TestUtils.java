// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.common;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.apache.commons.io.IOUtils;

public class TestUtils {

  public static String readResource(String path) {
    try {
      return IOUtils.toString(
          TestUtils.class.getClassLoader().getResourceAsStream(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new RuntimeException("Failed to read resource " + path, e);
    }
  }

  public static <T> T readFixture(String name, Class<T> type) {
    try {
      return Json.mapper().readValue(readResource("fixtures/" + name), type);
    } catch (IOException e) {
      throw new RuntimeException("Failed to parse fixture " + name, e);
    }
  }
}
