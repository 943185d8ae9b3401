package com.crux.enclave.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crux.enclave.Enclave;
import com.crux.enclave.exceptions.EnclaveException;

import picocli.CommandLine;

@CommandLine.Command(name = "store",
    description = "Encrypts a message for the given recipients and prints the Base64 digest it was stored under.")
class StoreCommand implements Callable<Integer> {
  private static final Logger logger = LoggerFactory.getLogger(StoreCommand.class);

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  @CommandLine.Mixin
  private NodeOptions nodeOptions;

  @CommandLine.Option(names = "--sender", defaultValue = "",
      description = "Sender public key. Defaults to the first configured key.")
  private String sender;

  @CommandLine.Option(names = "--recipients", split = ",", description = "Recipient public keys.")
  private List<String> recipients;

  @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
  private Message message;

  static class Message {
    @CommandLine.Option(names = "--message", description = "The message text.")
    private String text;

    @CommandLine.Option(names = "--file", description = "File holding the message bytes.")
    private Path file;
  }

  private final EnclaveConfig config;

  StoreCommand() {
    this(new EnclaveConfig());
  }

  StoreCommand(final EnclaveConfig config) {
    this.config = config;
  }

  @Override
  public Integer call() throws IOException {
    byte[] payload = message.file != null
        ? Files.readAllBytes(message.file)
        : message.text.getBytes(StandardCharsets.UTF_8);

    try (Enclave enclave = nodeOptions.buildEnclave(config)) {
      if (enclave == null) {
        return 2;
      }

      byte[] digest = enclave.store(payload, sender, recipients == null ? Collections.<String>emptyList() : recipients);
      spec.commandLine().getOut().println(Base64.getEncoder().encodeToString(digest));
      spec.commandLine().getOut().flush();
      return 0;
    }
    catch (EnclaveException e) {
      logger.error("store failed", e);
      return 1;
    }
  }
}
