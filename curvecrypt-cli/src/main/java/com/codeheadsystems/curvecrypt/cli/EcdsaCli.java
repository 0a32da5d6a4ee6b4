package com.codeheadsystems.curvecrypt.cli;

import com.codeheadsystems.curvecrypt.common.HexBytes;
import com.codeheadsystems.curvecrypt.ecdsa.EcdsaManager;
import com.codeheadsystems.curvecrypt.ecdsa.SignatureResult;
import com.codeheadsystems.curvecrypt.exceptions.CurveCryptException;
import com.codeheadsystems.curvecrypt.model.SignaturePayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line ECDSA signing and verification over secp256k1.
 *
 * <pre>
 * Usage:
 *   EcdsaCli sign --private-key &lt;hex&gt; &lt;content&gt;
 *   EcdsaCli verify --public-key &lt;hex&gt; --signature &lt;hex&gt; &lt;content&gt;
 * </pre>
 *
 * <p>{@code sign} prints the DER signature and the signer's public key as JSON.
 * {@code verify} prints {@code valid} and exits 0, or prints {@code invalid} and exits 2.
 */
public class EcdsaCli {

  private static final Logger log = LoggerFactory.getLogger(EcdsaCli.class);

  private final EcdsaManager ecdsaManager;
  private final ObjectMapper objectMapper;

  public EcdsaCli() {
    this(new EcdsaManager(), new ObjectMapper());
  }

  public EcdsaCli(final EcdsaManager ecdsaManager, final ObjectMapper objectMapper) {
    this.ecdsaManager = ecdsaManager;
    this.objectMapper = objectMapper;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    System.exit(new EcdsaCli().run(args, System.out, System.err));
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
    String signature = null;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--public-key"  -> publicKey  = ++i < args.length ? args[i] : null;
        case "--private-key" -> privateKey = ++i < args.length ? args[i] : null;
        case "--signature"   -> signature  = ++i < args.length ? args[i] : null;
        default              -> positional.add(args[i]);
      }
    }

    if (positional.size() != 2) {
      printUsage(err);
      return 1;
    }

    String command = positional.get(0);
    String content = positional.get(1);
    try {
      switch (command) {
        case "sign" -> {
          if (privateKey == null) {
            printUsage(err);
            return 1;
          }
          SignatureResult result = ecdsaManager.sign(HexBytes.fromHex(privateKey), content);
          out.println(objectMapper.writeValueAsString(new SignaturePayload(result)));
          return 0;
        }
        case "verify" -> {
          if (publicKey == null || signature == null) {
            printUsage(err);
            return 1;
          }
          boolean valid = ecdsaManager.verify(content, HexBytes.fromHex(publicKey), HexBytes.fromHex(signature));
          out.println(valid ? "valid" : "invalid");
          return valid ? 0 : 2;
        }
        default -> {
          err.println("Unknown command: " + command);
          printUsage(err);
          return 1;
        }
      }
    } catch (JsonProcessingException e) {
      err.println("Error: " + e.getOriginalMessage());
      return 1;
    } catch (CurveCryptException | IllegalArgumentException e) {
      log.debug("{} failed: {}", command, e.getClass().getSimpleName());
      err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  private static void printUsage(PrintStream err) {
    err.println("Usage: EcdsaCli sign --private-key <hex> <content>");
    err.println("       EcdsaCli verify --public-key <hex> --signature <hex> <content>");
    err.println();
    err.println("  --private-key <hex>   Signer private key, 32 bytes");
    err.println("  --public-key <hex>    Signer public key, compressed or uncompressed SEC1");
    err.println("  --signature <hex>     DER-encoded signature");
  }
}
