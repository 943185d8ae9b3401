package com.crux.enclave.cli;

import picocli.CommandLine;

@CommandLine.Command(name = "crux-enclave", mixinStandardHelpOptions = true,
    description = "Runs single operations against a node's enclave.",
    subcommands = {
        KeygenCommand.class,
        StoreCommand.class,
        RetrieveCommand.class,
        DeleteCommand.class
    })
public final class EnclaveApp implements Runnable {

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  @Override
  public void run() {
    throw new CommandLine.ParameterException(spec.commandLine(), "a command is required");
  }

  /**
   * Entry point.
   *
   * @param args command line arguments.
   */
  public static void main(final String[] args) {
    int exitCode = new CommandLine(new EnclaveApp()).execute(args);
    System.exit(exitCode);
  }
}
