package com.crux.enclave.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crux.enclave.exceptions.EnclaveException;
import com.crux.enclave.keys.KeyFiles;
import com.crux.enclave.keys.KeyRing;
import com.crux.enclave.keys.PublicKeys;
import com.crux.enclave.partyinfo.PartyDirectory;
import com.crux.enclave.persistence.ByteStore;
import com.crux.enclave.persistence.InMemoryByteStoreImpl;
import com.crux.enclave.persistence.JdbcByteStoreImpl;
import com.zaxxer.hikari.HikariDataSource;

class EnclaveConfig {
  private static final Logger logger = LoggerFactory.getLogger(EnclaveConfig.class);

  private final KeyFiles keyFiles;

  EnclaveConfig() {
    this(new KeyFiles());
  }

  EnclaveConfig(final KeyFiles keyFiles) {
    this.keyFiles = keyFiles;
  }

  ByteStore setupByteStore(final String storeType, final String jdbcUrl, final String tableName) {
    if (storeType == null) {
      logger.error("byte store type is required...");
      return null;
    }

    switch (storeType.toUpperCase()) {
      case Constants.STORE_JDBC:
        if (jdbcUrl == null) {
          logger.error("jdbc url is required for jdbc byte store...");
          break;
        }

        logger.info("using JDBC-based byte store...");
        // Hikari connects lazily, on first use
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setJdbcUrl(jdbcUrl);
        JdbcByteStoreImpl.Builder builder = JdbcByteStoreImpl.newBuilder(dataSource);
        if (tableName != null) {
          if (tableName.trim().isEmpty()) {
            logger.error("Table name cannot be empty.");
            dataSource.close();
            return null;
          }
          builder.withTableName(tableName);
        }
        return builder.build();

      case Constants.STORE_INMEMORY:
        logger.info("using in-memory byte store...");
        return new InMemoryByteStoreImpl();

      default:
        logger.error("unable to evaluate byte store config");
    }

    return null;
  }

  KeyRing setupKeyRing(final List<Path> publicKeyFiles, final List<Path> privateKeyFiles) {
    if (publicKeyFiles == null || privateKeyFiles == null) {
      logger.error("public and private key files are both required...");
      return null;
    }

    try {
      KeyRing keyRing = keyFiles.loadKeyRing(publicKeyFiles, privateKeyFiles);
      logger.info("loaded {} key pair(s)", publicKeyFiles.size());
      return keyRing;
    }
    catch (IOException | EnclaveException e) {
      logger.error("unable to load key files", e);
      return null;
    }
  }

  PartyDirectory setupPartyDirectory(final String url, final KeyRing keyRing, final List<String> otherNodes) {
    if (url == null || url.trim().isEmpty()) {
      logger.error("node url is required...");
      return null;
    }

    List<String> ownPublicKeys = new ArrayList<>();
    for (byte[] publicKey : keyRing.getPublicKeys()) {
      ownPublicKeys.add(PublicKeys.encode(publicKey));
    }

    List<String> peers = otherNodes == null ? new ArrayList<>() : otherNodes;
    logger.info("node url set to = {}", url);
    logger.info("other nodes set to = {}", peers);
    return new PartyDirectory(url, ownPublicKeys, peers);
  }
}
