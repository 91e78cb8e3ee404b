// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.common;

/** Thrown when a memory or CPU quantity string cannot be interpreted. */
public class UnitConversionException extends RuntimeException {

  public UnitConversionException(String message) {
    super(message);
  }

  public UnitConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
