package com.crux.enclave.cli;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Base64;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crux.enclave.Enclave;
import com.crux.enclave.exceptions.EnclaveException;

import picocli.CommandLine;

@CommandLine.Command(name = "retrieve", description = "Decrypts the payload stored under a digest to stdout.")
class RetrieveCommand implements Callable<Integer> {
  private static final Logger logger = LoggerFactory.getLogger(RetrieveCommand.class);

  @CommandLine.Mixin
  private NodeOptions nodeOptions;

  @CommandLine.Parameters(index = "0", paramLabel = "DIGEST", description = "Base64 digest returned by store.")
  private String digest;

  private final EnclaveConfig config;
  private final OutputStream out;

  RetrieveCommand() {
    this(new EnclaveConfig(), System.out);
  }

  RetrieveCommand(final EnclaveConfig config, final OutputStream out) {
    this.config = config;
    this.out = out;
  }

  @Override
  public Integer call() throws IOException {
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

      out.write(enclave.retrieve(digestBytes));
      out.flush();
      return 0;
    }
    catch (EnclaveException e) {
      logger.error("retrieve failed", e);
      return 1;
    }
  }
}
