package com.codeheadsystems.curvecrypt.ecdsa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.curvecrypt.common.HexBytes;
import com.codeheadsystems.curvecrypt.common.RandomProvider;
import com.codeheadsystems.curvecrypt.config.CurveCryptConfig;
import com.codeheadsystems.curvecrypt.ellipticcurve.Curve;
import com.codeheadsystems.curvecrypt.ellipticcurve.CurveKeyPair;
import com.codeheadsystems.curvecrypt.ellipticcurve.PublicKeyDeriver;
import com.codeheadsystems.curvecrypt.exceptions.InvalidInputException;
import com.codeheadsystems.curvecrypt.exceptions.InvalidKeyMaterialException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EcdsaManagerTest {

  private static final HexBytes PRIVATE_KEY =
      HexBytes.fromHex("e4d4b9f5ba1d4cb3ad1f5c34a5b0b3a0a3d3b9e0c0e3d1f2a4b6c8d0e2f40618");
  private static final HexBytes PUBLIC_KEY =
      HexBytes.fromHex("02133361e5394f55009bc986ffcdd3dcc2d4e67ad1437b3c856257ac3536400479");
  private static final String HELLO_SIGNATURE = "3044022038ed9fa288a6ec1f43e8460bc6c37e732ff4e0f93db19e031d7021701b8946"
      + "7e022041248a704b00270bf5496bad1e3b914d4c51a4676f803f67ff169cee94b3593d";
  // s is above n/2 here; verification must not insist on low-S.
  private static final String SATOSHI_SIGNATURE = "30450220474965c2abb58638f8814b2aa1b0bad44a6a11862ce82654037db2eaf1479"
      + "1c7022100ebddccf944c93612278eb4d4c38f5fc3cf4be9c230bfee18cfccca8d19e68290";

  @Mock private PublicKeyDeriver publicKeyDeriver;

  private EcdsaManager manager;

  @BeforeEach
  void setUp() {
    manager = new EcdsaManager();
  }

  // ─── Deterministic vectors ─────────────────────────────────────────────────

  @Test
  void sign_matchesReferenceVector() {
    SignatureResult result = manager.sign(PRIVATE_KEY, "hello world");

    assertThat(result.signature().toHex()).isEqualTo(HELLO_SIGNATURE);
    assertThat(result.publicKey()).isEqualTo(PUBLIC_KEY);
  }

  @Test
  void sign_highSVectorIsNotNormalised() {
    SignatureResult result = manager.sign(PRIVATE_KEY, "Satoshi Nakamoto");

    assertThat(result.signature().toHex()).isEqualTo(SATOSHI_SIGNATURE);
    assertThat(manager.verify("Satoshi Nakamoto", PUBLIC_KEY, result.signature())).isTrue();
  }

  @Test
  void sign_isDeterministic() {
    assertThat(manager.sign(PRIVATE_KEY, "same").signature())
        .isEqualTo(manager.sign(PRIVATE_KEY, "same").signature());
    assertThat(manager.sign(PRIVATE_KEY, "same").signature())
        .isNotEqualTo(manager.sign(PRIVATE_KEY, "different").signature());
  }

  @Test
  void sign_stringAndUtf8BytesAgree() {
    String text = "ünïcödé";
    assertThat(manager.sign(PRIVATE_KEY, text))
        .isEqualTo(manager.sign(PRIVATE_KEY, text.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void verify_referenceVector() {
    assertThat(manager.verify("hello world", PUBLIC_KEY, HexBytes.fromHex(HELLO_SIGNATURE))).isTrue();
    assertThat(manager.verify("hello world!", PUBLIC_KEY, HexBytes.fromHex(HELLO_SIGNATURE))).isFalse();
  }

  // ─── Sign/verify ───────────────────────────────────────────────────────────

  @ParameterizedTest
  @ValueSource(strings = {"", "a", "a much longer message that spans several hash blocks of input, "
      + "which makes no difference to ECDSA since only the digest is signed"})
  void signThenVerify(String content) {
    CurveKeyPair keyPair = Curve.SECP256K1_CURVE.generateKeyPair(new RandomProvider());
    HexBytes privateKey = HexBytes.of(keyPair.privateKeyBytes());

    SignatureResult result = manager.sign(privateKey, content);

    assertThat(result.publicKey().bytes()).isEqualTo(keyPair.publicKeyBytes());
    assertThat(manager.verify(content, result.publicKey(), result.signature())).isTrue();
  }

  @Test
  void verify_bytesContent() {
    byte[] content = new RandomProvider().randomBytes(100);
    SignatureResult result = manager.sign(PRIVATE_KEY, content);

    assertThat(manager.verify(content, PUBLIC_KEY, result.signature())).isTrue();
    content[0] ^= 1;
    assertThat(manager.verify(content, PUBLIC_KEY, result.signature())).isFalse();
  }

  @Test
  void verify_otherKeyIsFalse() {
    SignatureResult result = manager.sign(PRIVATE_KEY, "content");
    HexBytes otherKey = HexBytes.of(Curve.SECP256K1_CURVE.generateKeyPair(new RandomProvider()).publicKeyBytes());

    assertThat(manager.verify("content", otherKey, result.signature())).isFalse();
  }

  @Test
  void verify_acceptsUncompressedPublicKey() {
    CurveKeyPair keyPair = CurveKeyPair.fromPrivateKey(Curve.SECP256K1_CURVE,
        new BigInteger(1, PRIVATE_KEY.bytes()));
    HexBytes uncompressed = HexBytes.of(keyPair.publicKey().getEncoded(false));

    assertThat(manager.verify("hello world", uncompressed, HexBytes.fromHex(HELLO_SIGNATURE))).isTrue();
  }

  // ─── Malformed input ───────────────────────────────────────────────────────

  @ParameterizedTest
  @ValueSource(strings = {
      "3006020100020101",
      "3006020101020100",
      "3026022100fffffffffffffffffffffffffffffffebaaedce6af48a03bbfd25e8cd0364141020101",
      "3026020101022100fffffffffffffffffffffffffffffffebaaedce6af48a03bbfd25e8cd0364141"})
  void verify_scalarOutsideGroupOrderIsFalse(String signatureHex) {
    assertThat(manager.verify("hello world", PUBLIC_KEY, HexBytes.fromHex(signatureHex))).isFalse();
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "deadbeef", "3045", "30440220", "3006020101020101ff"})
  void verify_malformedSignatureIsInvalidInput(String signatureHex) {
    assertThatThrownBy(() -> manager.verify("hello world", PUBLIC_KEY, HexBytes.fromHex(signatureHex)))
        .isInstanceOf(InvalidInputException.class)
        .hasMessage("Malformed DER signature");
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "02", "deadbeef", "020000000000000000000000000000000000000000000000000000000000000005"})
  void verify_malformedPublicKeyIsInvalidInput(String publicKeyHex) {
    assertThatThrownBy(() -> manager.verify("hello world", HexBytes.fromHex(publicKeyHex),
        HexBytes.fromHex(HELLO_SIGNATURE)))
        .isInstanceOf(InvalidInputException.class)
        .hasMessage("Malformed public key");
  }

  @Test
  void sign_malformedPrivateKeyIsInvalidKey() {
    assertThatThrownBy(() -> manager.sign(HexBytes.fromHex("00".repeat(32)), "content"))
        .isInstanceOf(InvalidKeyMaterialException.class);
    assertThatThrownBy(() -> manager.sign(HexBytes.fromHex("ff".repeat(32)), "content"))
        .isInstanceOf(InvalidKeyMaterialException.class);
    assertThatThrownBy(() -> manager.sign(HexBytes.fromHex("01"), "content"))
        .isInstanceOf(InvalidKeyMaterialException.class);
  }

  // ─── Collaborators ─────────────────────────────────────────────────────────

  @Test
  void sign_returnsPublicKeyFromDeriver() {
    HexBytes derived = HexBytes.fromHex("02" + "11".repeat(32));
    when(publicKeyDeriver.derivePublicKey(any())).thenReturn(derived);
    EcdsaManager withDeriver = new EcdsaManager(CurveCryptConfig.DEFAULT, publicKeyDeriver);

    SignatureResult result = withDeriver.sign(PRIVATE_KEY, "hello world");

    assertThat(result.publicKey()).isEqualTo(derived);
    assertThat(result.signature().toHex()).isEqualTo(HELLO_SIGNATURE);
    verify(publicKeyDeriver).derivePublicKey(PRIVATE_KEY);
  }
}
