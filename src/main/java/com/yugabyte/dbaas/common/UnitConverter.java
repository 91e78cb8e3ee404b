// Copyright (c) YugaByte, Inc.

package com.yugabyte.dbaas.common;

import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Conversions between Kubernetes quantity strings and the plain numbers used in cluster
 * parameters: bytes for memory and disk, millicpu for CPU.
 *
 * <p>Suffix lookup is case sensitive since {@code m} (milli) and {@code M} (mega) differ.
 */
public final class UnitConverter {

  private static final BigDecimal KILO = BigDecimal.valueOf(1000L);
  private static final BigDecimal KIBI = BigDecimal.valueOf(1024L);
  private static final BigDecimal MAX = BigDecimal.valueOf(Long.MAX_VALUE);

  private static final Map<String, BigDecimal> BYTE_SUFFIXES =
      ImmutableMap.<String, BigDecimal>builder()
          .put("", BigDecimal.ONE)
          .put("m", new BigDecimal("0.001"))
          .put("K", KILO)
          .put("Ki", KIBI)
          .put("M", KILO.pow(2))
          .put("Mi", KIBI.pow(2))
          .put("G", KILO.pow(3))
          .put("Gi", KIBI.pow(3))
          .put("T", KILO.pow(4))
          .put("Ti", KIBI.pow(4))
          .build();

  private UnitConverter() {}

  /**
   * Parses a memory or storage quantity like {@code 1Gi}, {@code 500M} or {@code 1073741824}.
   * Fractional results are rounded up.
   */
  public static long bytesFromString(String value) {
    if (StringUtils.isEmpty(value)) {
      throw new UnitConversionException("can't convert an empty string to a number");
    }
    int i = value.length();
    while (i > 0 && !Character.isDigit(value.charAt(i - 1))) {
      i--;
    }
    String suffix = value.substring(i);
    BigDecimal coefficient = BYTE_SUFFIXES.get(suffix);
    if (coefficient == null) {
      throw new UnitConversionException(String.format("suffix '%s' not supported", suffix));
    }
    String number = value.substring(0, i);
    BigDecimal bytes = parseNonNegative(number).multiply(coefficient);
    return toLong(value, bytes, RoundingMode.CEILING);
  }

  /** Parses a CPU quantity: {@code 500m} is millicpu, {@code 1.5} is whole CPUs. */
  public static long milliCpuFromString(String value) {
    if (StringUtils.isEmpty(value)) {
      throw new UnitConversionException("can't convert an empty string to a number");
    }
    if (value.endsWith("m")) {
      String millis = value.substring(0, value.length() - 1);
      try {
        long result = Long.parseLong(millis);
        if (result < 0) {
          throw new UnitConversionException(
              String.format("given value '%s' must not be negative", value));
        }
        return result;
      } catch (NumberFormatException e) {
        throw new UnitConversionException(
            String.format("given value '%s' is not a number", millis), e);
      }
    }
    if (StringUtils.countMatches(value, '.') > 1) {
      throw new UnitConversionException(String.format("given value '%s' is not a number", value));
    }
    return toLong(value, parseNonNegative(value).multiply(KILO), RoundingMode.HALF_UP);
  }

  public static String bytesToString(long bytes) {
    return Long.toString(bytes);
  }

  public static String milliCpuToString(long milliCpu) {
    return milliCpu + "m";
  }

  private static BigDecimal parseNonNegative(String number) {
    BigDecimal parsed;
    try {
      parsed = new BigDecimal(number);
    } catch (NumberFormatException e) {
      throw new UnitConversionException(
          String.format("given value '%s' is not a number", number), e);
    }
    if (parsed.signum() < 0) {
      throw new UnitConversionException(
          String.format("given value '%s' must not be negative", number));
    }
    return parsed;
  }

  private static long toLong(String value, BigDecimal amount, RoundingMode rounding) {
    if (amount.compareTo(MAX) > 0) {
      throw new UnitConversionException(String.format("given value '%s' is too large", value));
    }
    return amount.setScale(0, rounding).longValueExact();
  }
}
