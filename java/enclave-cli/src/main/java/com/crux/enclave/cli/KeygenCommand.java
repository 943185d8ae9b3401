package com.crux.enclave.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crux.enclave.keys.KeyFiles;

import picocli.CommandLine;

@CommandLine.Command(name = "keygen", description = "Generates key pairs as <name>.pub and <name>.key files.")
class KeygenCommand implements Callable<Integer> {
  private static final Logger logger = LoggerFactory.getLogger(KeygenCommand.class);

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  @CommandLine.Parameters(arity = "1..*", paramLabel = "NAME",
      description = "Path prefix of each key pair to generate.")
  private List<Path> names;

  private final KeyFiles keyFiles;

  KeygenCommand() {
    this(new KeyFiles());
  }

  KeygenCommand(final KeyFiles keyFiles) {
    this.keyFiles = keyFiles;
  }

  @Override
  public Integer call() {
    for (Path name : names) {
      try {
        spec.commandLine().getOut().println(keyFiles.generate(name));
      }
      catch (IOException e) {
        logger.error("unable to write key pair {}", name, e);
        return 1;
      }
    }
    spec.commandLine().getOut().flush();
    return 0;
  }
}
