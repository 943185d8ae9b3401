package com.crux.enclave.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.crux.enclave.Enclave;
import com.crux.enclave.keys.KeyRing;
import com.crux.enclave.partyinfo.PartyDirectory;
import com.crux.enclave.persistence.ByteStore;

import picocli.CommandLine;

/**
 * Options shared by every command that runs against a node's enclave.
 */
class NodeOptions {
  static class StoreTypes extends ArrayList<String> {
    StoreTypes() {
      super(Arrays.asList(Constants.STORE_INMEMORY, Constants.STORE_JDBC));
    }
  }

  @CommandLine.Option(names = "--url", defaultValue = "${env:CRUX_URL}",
      description = "The url other nodes reach this node at.", required = true)
  String url;

  @CommandLine.Option(names = "--public-keys", defaultValue = "${env:CRUX_PUBLIC_KEYS}", split = ",",
      description = "Public key files, default identity first.", required = true)
  List<Path> publicKeyFiles;

  @CommandLine.Option(names = "--private-keys", defaultValue = "${env:CRUX_PRIVATE_KEYS}", split = ",",
      description = "Private key files, in the same order as --public-keys.", required = true)
  List<Path> privateKeyFiles;

  @CommandLine.Option(names = "--other-nodes", defaultValue = "${env:CRUX_OTHER_NODES}", split = ",",
      description = "Urls of peers known at startup.")
  List<String> otherNodes;

  @CommandLine.Option(names = "--store-type", defaultValue = "${env:CRUX_STORE_TYPE:-MEMORY}",
      completionCandidates = StoreTypes.class,
      description = "Type of byte store to use. Possible values: ${COMPLETION-CANDIDATES}")
  String storeType;

  @CommandLine.Option(names = "--jdbc-url", defaultValue = "${env:CRUX_JDBC_URL}",
      description = "JDBC URL to use for the JDBC byte store. Required for JDBC.")
  String jdbcUrl;

  @CommandLine.Option(names = "--table-name", defaultValue = "${env:CRUX_TABLE_NAME}",
      description = "Payload table name for the JDBC byte store.")
  String tableName;

  /**
   * Builds an enclave from the options.
   *
   * @param config The config helper.
   * @return The enclave, which owns the byte store from then on, or {@code null} if the options are invalid. The
   *     reason has already been logged.
   */
  Enclave buildEnclave(final EnclaveConfig config) {
    ByteStore byteStore = config.setupByteStore(storeType, jdbcUrl, tableName);
    if (byteStore == null) {
      return null;
    }

    KeyRing keyRing = config.setupKeyRing(publicKeyFiles, privateKeyFiles);
    if (keyRing == null) {
      byteStore.close();
      return null;
    }

    PartyDirectory partyDirectory = config.setupPartyDirectory(url, keyRing, otherNodes);
    if (partyDirectory == null) {
      keyRing.close();
      byteStore.close();
      return null;
    }

    return Enclave.newBuilder()
        .withKeyRing(keyRing)
        .withByteStore(byteStore)
        .withPartyDirectory(partyDirectory)
        .build();
  }
}
