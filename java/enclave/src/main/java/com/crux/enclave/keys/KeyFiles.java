package com.crux.enclave.keys;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crux.crypto.bufferutils.ManagedBufferUtils;
import com.crux.crypto.engine.bouncycastle.BouncyCurve25519BoxCrypto;
import com.crux.crypto.keys.BoxKeyPair;
import com.crux.crypto.keys.CryptoKey;
import com.crux.crypto.keys.TransientCryptoKey;
import com.crux.enclave.exceptions.EnclaveException;
import com.crux.enclave.utils.Json;

/**
 * Reads and writes key pairs as file pairs. The public key file holds the Base64 public key on a single line. The
 * private key file is a json document:
 * <pre>
 * {
 *   "type": "unlocked",
 *   "data": {
 *     "bytes": Base64 private key
 *   }
 * }
 * </pre>
 */
public class KeyFiles {
  private static final Logger logger = LoggerFactory.getLogger(KeyFiles.class);

  static final String PUBLIC_KEY_EXTENSION = ".pub";
  static final String PRIVATE_KEY_EXTENSION = ".key";
  static final String TYPE = "type";
  static final String DATA = "data";
  static final String BYTES = "bytes";
  static final String UNLOCKED = "unlocked";

  private final BouncyCurve25519BoxCrypto boxCrypto;

  public KeyFiles() {
    this(new BouncyCurve25519BoxCrypto());
  }

  KeyFiles(final BouncyCurve25519BoxCrypto boxCrypto) {
    this.boxCrypto = boxCrypto;
  }

  /**
   * Loads a {@link KeyRing} from matching lists of public and private key files. The first pair becomes the default
   * identity.
   *
   * @param publicKeyFiles The public key files.
   * @param privateKeyFiles The private key files, in the same order.
   * @return The loaded key ring.
   * @throws IOException if a file cannot be read.
   * @throws EnclaveException if the lists differ in length or a pair does not match.
   */
  public KeyRing loadKeyRing(final List<Path> publicKeyFiles, final List<Path> privateKeyFiles) throws IOException {
    if (publicKeyFiles.size() != privateKeyFiles.size()) {
      throw new EnclaveException("found " + publicKeyFiles.size() + " public key file(s) but "
          + privateKeyFiles.size() + " private key file(s)");
    }
    if (publicKeyFiles.isEmpty()) {
      throw new EnclaveException("no key files configured");
    }

    List<BoxKeyPair> keyPairs = new ArrayList<>(publicKeyFiles.size());
    for (int i = 0; i < publicKeyFiles.size(); i++) {
      keyPairs.add(loadKeyPair(publicKeyFiles.get(i), privateKeyFiles.get(i)));
    }
    return new KeyRing(keyPairs);
  }

  /**
   * Loads one key pair and checks that the private key really belongs to the public key.
   *
   * @param publicKeyFile The public key file.
   * @param privateKeyFile The private key file.
   * @return The key pair.
   * @throws IOException if a file cannot be read.
   */
  public BoxKeyPair loadKeyPair(final Path publicKeyFile, final Path privateKeyFile) throws IOException {
    String publicKeyString = new String(Files.readAllBytes(publicKeyFile), StandardCharsets.UTF_8).trim();
    byte[] publicKey = PublicKeys.decode(publicKeyString);

    CryptoKey privateKey = readPrivateKey(privateKeyFile);
    byte[] derivedPublicKey = boxCrypto.derivePublicKey(privateKey);
    if (!Arrays.equals(publicKey, derivedPublicKey)) {
      privateKey.close();
      throw new EnclaveException("private key " + privateKeyFile + " does not match public key " + publicKeyFile);
    }

    logger.info("loaded key pair for public key {}", publicKeyString);
    return new BoxKeyPair(publicKey, privateKey);
  }

  /**
   * Generates a new key pair and writes it to {@code <base>.pub} and {@code <base>.key}.
   *
   * @param base The path prefix of the two files.
   * @return The public key identifier of the new pair.
   * @throws IOException if either file cannot be written, or already exists.
   */
  public String generate(final Path base) throws IOException {
    Path publicKeyFile = base.resolveSibling(base.getFileName() + PUBLIC_KEY_EXTENSION);
    Path privateKeyFile = base.resolveSibling(base.getFileName() + PRIVATE_KEY_EXTENSION);

    try (BoxKeyPair keyPair = boxCrypto.generateKeyPair()) {
      String publicKey = PublicKeys.encode(keyPair.getPublicKey());

      Json data = new Json();
      keyPair.getPrivateKey().withKey(keyBytes -> {
        data.put(BYTES, keyBytes);
      });
      Json privateKeyDocument = new Json();
      privateKeyDocument.put(TYPE, UNLOCKED);
      privateKeyDocument.put(DATA, data);

      Files.write(privateKeyFile, privateKeyDocument.toUtf8(), StandardOpenOption.CREATE_NEW);
      Files.write(publicKeyFile, publicKey.getBytes(StandardCharsets.UTF_8),
          StandardOpenOption.CREATE_NEW);

      logger.info("generated key pair {} in {} and {}", publicKey, publicKeyFile, privateKeyFile);
      return publicKey;
    }
  }

  CryptoKey readPrivateKey(final Path privateKeyFile) throws IOException {
    byte[] keyBytes = null;
    try {
      Json document = new Json(Files.readAllBytes(privateKeyFile));
      String type = document.getString(TYPE);
      if (!UNLOCKED.equals(type)) {
        throw new EnclaveException("unsupported private key type '" + type + "' in " + privateKeyFile);
      }

      keyBytes = document.getJson(DATA).getBytes(BYTES);
      if (keyBytes.length != BouncyCurve25519BoxCrypto.PrivateKeySize) {
        throw new EnclaveException("private key in " + privateKeyFile + " must be "
            + BouncyCurve25519BoxCrypto.PrivateKeySize + " bytes");
      }
      return new TransientCryptoKey(keyBytes);
    }
    catch (JSONException | IllegalArgumentException e) {
      throw new EnclaveException("malformed private key file " + privateKeyFile, e);
    }
    finally {
      ManagedBufferUtils.wipeByteArray(keyBytes);
    }
  }
}
