package com.crux.enclave.utils;

public final class MetricsUtil {
  public static final String ENCLAVE_METRICS_PREFIX = "crux.enclave";

  private MetricsUtil() { }
}
