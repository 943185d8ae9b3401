package com.crux.enclave.cli;

final class Constants {
  static final String STORE_INMEMORY = "MEMORY";
  static final String STORE_JDBC = "JDBC";

  private Constants() { }
}
