package com.crux.enclave.cli;

import java.util.Base64;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crux.enclave.Enclave;
import com.crux.enclave.exceptions.EnclaveException;

import picocli.CommandLine;

@CommandLine.Command(name = "delete", description = "Deletes the payload stored under a digest.")
class DeleteCommand implements Callable<Integer> {
  private static final Logger logger = LoggerFactory.getLogger(DeleteCommand.class);

  @CommandLine.Mixin
  private NodeOptions nodeOptions;

  @CommandLine.Parameters(index = "0", paramLabel = "DIGEST", description = "Base64 digest returned by store.")
  private String digest;

  private final EnclaveConfig config;

  DeleteCommand() {
    this(new EnclaveConfig());
  }

  DeleteCommand(final EnclaveConfig config) {
    this.config = config;
  }

  @Override
  public Integer call() {
    byte[] digestBytes;
    try {
      digestBytes = Base64.getDecoder().decode(digest);
    }
    catch (IllegalArgumentException e) {
      logger.error("digest is not valid Base64: {}", digest);
      return 2;
    }

    try (Enclave enclave = nodeOptions.buildEnclave(config)) {
      if (enclave == null) {
        return 2;
      }

      enclave.delete(digestBytes);
      logger.info("deleted {}", digest);
      return 0;
    }
    catch (EnclaveException e) {
      logger.error("delete failed", e);
      return 1;
    }
  }
}
