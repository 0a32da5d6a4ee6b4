package com.codeheadsystems.curvecrypt.cli;

import com.codeheadsystems.curvecrypt.common.HexBytes;
import com.codeheadsystems.curvecrypt.ecies.CipherObject;
import com.codeheadsystems.curvecrypt.ecies.DecryptedContent;
import com.codeheadsystems.curvecrypt.ecies.EciesManager;
import com.codeheadsystems.curvecrypt.exceptions.CurveCryptException;
import com.codeheadsystems.curvecrypt.exceptions.DecryptionException;
import com.codeheadsystems.curvecrypt.model.EncryptedPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line ECIES encryption and decryption over secp256k1.
 *
 * <pre>
 * Usage:
 *   EciesCli encrypt --public-key &lt;hex&gt; [--bytes] &lt;content&gt;
 *   EciesCli decrypt --private-key &lt;hex&gt; &lt;payload-json&gt;
 *
 * Commands:
 *   encrypt   Encrypt to the holder of the private key; prints the payload as JSON.
 *             With --bytes the content is hex and is encrypted as raw bytes.
 *   decrypt   Verify and decrypt a JSON payload; prints text, or hex if bytes were encrypted.
 *
 * Examples:
 *   EciesCli encrypt --public-key 02133361...0479 "hello world"
 *   EciesCli decrypt --private-key e4d4b9f5...0618 '{"iv":"...","ephemeralPK":"...",...}'
 * </pre>
 *
 * <p>Exit codes: 0 on success, 1 on bad usage or malformed input, 2 if decryption fails.
 */
public class EciesCli {

  private static final Logger log = LoggerFactory.getLogger(EciesCli.class);

  private final EciesManager eciesManager;
  private final ObjectMapper objectMapper;

  public EciesCli() {
    this(new EciesManager(), new ObjectMapper());
  }

  public EciesCli(final EciesManager eciesManager, final ObjectMapper objectMapper) {
    this.eciesManager = eciesManager;
    this.objectMapper = objectMapper;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    System.exit(new EciesCli().run(args, System.out, System.err));
  }

  /**
   * Runs one command.
   *
   * @param args command-line arguments
   * @param out  receives the result
   * @param err  receives usage and error messages
   * @return the process exit code
   */
  public int run(String[] args, PrintStream out, PrintStream err) {
    String publicKey = null;
    String privateKey = null;
    boolean bytes = false;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--public-key"  -> publicKey  = ++i < args.length ? args[i] : null;
        case "--private-key" -> privateKey = ++i < args.length ? args[i] : null;
        case "--bytes"       -> bytes = true;
        default              -> positional.add(args[i]);
      }
    }

    if (positional.size() != 2) {
      printUsage(err);
      return 1;
    }

    String command = positional.get(0);
    String argument = positional.get(1);
    try {
      switch (command) {
        case "encrypt" -> {
          if (publicKey == null) {
            printUsage(err);
            return 1;
          }
          out.println(encrypt(HexBytes.fromHex(publicKey), argument, bytes));
          return 0;
        }
        case "decrypt" -> {
          if (privateKey == null) {
            printUsage(err);
            return 1;
          }
          out.println(decrypt(HexBytes.fromHex(privateKey), argument));
          return 0;
        }
        default -> {
          err.println("Unknown command: " + command);
          printUsage(err);
          return 1;
        }
      }
    } catch (DecryptionException e) {
      log.debug("decrypt failed: {}", e.reason());
      err.println("Error: " + e.getMessage());
      return 2;
    } catch (JsonProcessingException e) {
      err.println("Error: payload is not valid JSON: " + e.getOriginalMessage());
      return 1;
    } catch (CurveCryptException | IllegalArgumentException e) {
      err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  private String encrypt(HexBytes publicKey, String content, boolean bytes) throws JsonProcessingException {
    CipherObject cipherObject = bytes
        ? eciesManager.encrypt(publicKey, HexBytes.fromHex(content).bytes())
        : eciesManager.encrypt(publicKey, content);
    return objectMapper.writeValueAsString(new EncryptedPayload(cipherObject));
  }

  private String decrypt(HexBytes privateKey, String payloadJson)
      throws JsonProcessingException, DecryptionException {
    EncryptedPayload payload = objectMapper.readValue(payloadJson, EncryptedPayload.class);
    DecryptedContent content = eciesManager.decrypt(privateKey, payload.cipherObject());
    return content.isString() ? content.text() : HexBytes.of(content.bytes()).toHex();
  }

  private static void printUsage(PrintStream err) {
    err.println("Usage: EciesCli encrypt --public-key <hex> [--bytes] <content>");
    err.println("       EciesCli decrypt --private-key <hex> <payload-json>");
    err.println();
    err.println("  --public-key <hex>    Recipient public key, compressed or uncompressed SEC1");
    err.println("  --private-key <hex>   Recipient private key, 32 bytes");
    err.println("  --bytes               Treat <content> as hex and encrypt the raw bytes");
  }
}
