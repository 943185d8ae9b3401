package com.crux.enclave.cli;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.crux.enclave.keys.KeyFiles;
import com.crux.enclave.persistence.InMemoryByteStoreImpl;

import picocli.CommandLine;

class EnclaveAppTest {
  @TempDir
  Path tempDir;

  private String nodePublicKey;
  private String peerPublicKey;
  private StringWriter out;

  @BeforeEach
  void setUp() throws IOException {
    KeyFiles keyFiles = new KeyFiles();
    nodePublicKey = keyFiles.generate(tempDir.resolve("node"));
    peerPublicKey = keyFiles.generate(tempDir.resolve("peer"));
    out = new StringWriter();
  }

  private String[] withNodeOptions(final String... args) {
    String[] nodeOptions = {
        "--url", "http://node-a",
        "--public-keys", tempDir.resolve("node.pub").toString(),
        "--private-keys", tempDir.resolve("node.key").toString()
    };
    String[] combined = new String[args.length + nodeOptions.length];
    System.arraycopy(args, 0, combined, 0, args.length);
    System.arraycopy(nodeOptions, 0, combined, args.length, nodeOptions.length);
    return combined;
  }

  private CommandLine newCommandLine(final Object command) {
    CommandLine commandLine = new CommandLine(command);
    commandLine.setOut(new PrintWriter(out));
    return commandLine;
  }

  @Test
  void testKeygen() throws IOException {
    int exitCode = newCommandLine(new EnclaveApp()).execute("keygen", tempDir.resolve("fresh").toString());

    assertEquals(0, exitCode);
    String publicKey = new String(Files.readAllBytes(tempDir.resolve("fresh.pub")), StandardCharsets.UTF_8);
    assertEquals(publicKey, out.toString().trim());
    assertTrue(Files.exists(tempDir.resolve("fresh.key")));
  }

  @Test
  void testKeygenExistingFileFails() {
    int exitCode = newCommandLine(new EnclaveApp()).execute("keygen", tempDir.resolve("node").toString());

    assertEquals(1, exitCode);
  }

  @Test
  void testStorePrintsDigest() {
    int exitCode = newCommandLine(new EnclaveApp()).execute(withNodeOptions("store", "--message", "hello",
        "--recipients", peerPublicKey));

    assertEquals(0, exitCode);
    assertEquals(64, Base64.getDecoder().decode(out.toString().trim()).length);
  }

  @Test
  void testStoreRequiresMessage() {
    int exitCode = newCommandLine(new EnclaveApp()).execute(withNodeOptions("store"));

    assertEquals(CommandLine.ExitCode.USAGE, exitCode);
  }

  @Test
  void testStoreWithUnknownSenderFails() {
    int exitCode = newCommandLine(new EnclaveApp()).execute(withNodeOptions("store", "--message", "hello",
        "--sender", peerPublicKey));

    assertEquals(1, exitCode);
  }

  @Test
  void testStoreWithMissingJdbcUrlFails() {
    int exitCode = newCommandLine(new EnclaveApp()).execute(withNodeOptions("store", "--message", "hello",
        "--store-type", "JDBC"));

    assertEquals(2, exitCode);
  }

  @Test
  void testStoreWithMissingKeyFileFails() {
    int exitCode = newCommandLine(new EnclaveApp()).execute("store", "--message", "hello",
        "--url", "http://node-a",
        "--public-keys", tempDir.resolve("absent.pub").toString(),
        "--private-keys", tempDir.resolve("absent.key").toString());

    assertEquals(2, exitCode);
  }

  @Test
  void testStoreThenRetrieveThenDelete() {
    InMemoryByteStoreImpl byteStore = new InMemoryByteStoreImpl();
    EnclaveConfig config = spy(new EnclaveConfig());
    doReturn(byteStore).when(config).setupByteStore(any(), any(), any());

    int exitCode = newCommandLine(new StoreCommand(config)).execute(withNodeOptions("--message", "hello",
        "--recipients", peerPublicKey, "--other-nodes", "http://node-b"));
    assertEquals(0, exitCode);
    String digest = out.toString().trim();

    ByteArrayOutputStream plainText = new ByteArrayOutputStream();
    exitCode = newCommandLine(new RetrieveCommand(config, plainText)).execute(withNodeOptions(digest));
    assertEquals(0, exitCode);
    assertEquals("hello", new String(plainText.toByteArray(), StandardCharsets.UTF_8));

    exitCode = newCommandLine(new DeleteCommand(config)).execute(withNodeOptions(digest));
    assertEquals(0, exitCode);
    assertEquals(0, byteStore.size());

    exitCode = newCommandLine(new DeleteCommand(config)).execute(withNodeOptions(digest));
    assertEquals(1, exitCode);
  }

  @Test
  void testStoreFromFile() throws IOException {
    Path message = tempDir.resolve("message.bin");
    Files.write(message, new byte[]{0, 1, 2, (byte) 0xff});

    int exitCode = newCommandLine(new EnclaveApp()).execute(withNodeOptions("store", "--file", message.toString()));

    assertEquals(0, exitCode);
  }

  @Test
  void testRetrieveWithInvalidDigestFails() {
    int exitCode = newCommandLine(new EnclaveApp()).execute(withNodeOptions("retrieve", "!!not base64!!"));

    assertEquals(2, exitCode);
  }

  @Test
  void testRetrieveUnknownDigestFails() {
    String digest = Base64.getEncoder().encodeToString(new byte[64]);

    int exitCode = newCommandLine(new EnclaveApp()).execute(withNodeOptions("retrieve", digest));

    assertEquals(1, exitCode);
  }

  @Test
  void testNoCommandIsUsageError() {
    int exitCode = newCommandLine(new EnclaveApp()).execute();

    assertEquals(CommandLine.ExitCode.USAGE, exitCode);
  }
}
