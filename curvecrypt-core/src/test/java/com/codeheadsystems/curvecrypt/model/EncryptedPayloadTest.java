package com.codeheadsystems.curvecrypt.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.curvecrypt.ecies.CipherObject;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

class EncryptedPayloadTest {

  private static final String IV = "000102030405060708090a0b0c0d0e0f";
  private static final String EPHEMERAL_PK = "02096710e56e44dee214e63f62149550c8ac80ba1effd0969513d0f33b0f67197f";
  private static final String CIPHER_TEXT = "827914196c7cdfcdc485b4895f8dd388";
  private static final String MAC = "09c677ebdd143f72bf02b59b628e8f28b050fcf4f2755f4d06d5c5e3b74e67fa";

  private final ObjectMapper objectMapper = new ObjectMapper();

  private static CipherObject cipherObject() {
    return new CipherObject(Hex.decode(IV), Hex.decode(EPHEMERAL_PK), Hex.decode(CIPHER_TEXT), Hex.decode(MAC), true);
  }

  @Test
  void serialize_usesWireFieldNames() throws Exception {
    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(new EncryptedPayload(cipherObject())));

    assertThat(json.get("iv").asText()).isEqualTo(IV);
    assertThat(json.get("ephemeralPK").asText()).isEqualTo(EPHEMERAL_PK);
    assertThat(json.get("cipherText").asText()).isEqualTo(CIPHER_TEXT);
    assertThat(json.get("mac").asText()).isEqualTo(MAC);
    assertThat(json.get("wasString").asBoolean()).isTrue();
    assertThat(json.size()).isEqualTo(5);
  }

  @Test
  void deserialize_restoresCipherObject() throws Exception {
    String json = "{\"iv\":\"" + IV + "\",\"ephemeralPK\":\"" + EPHEMERAL_PK.toUpperCase()
        + "\",\"cipherText\":\"" + CIPHER_TEXT + "\",\"mac\":\"" + MAC + "\",\"wasString\":true}";

    EncryptedPayload payload = objectMapper.readValue(json, EncryptedPayload.class);

    assertThat(payload.cipherObject()).isEqualTo(cipherObject());
  }

  @Test
  void cipherObject_missingField() {
    EncryptedPayload payload = new EncryptedPayload(IV, null, CIPHER_TEXT, MAC, false);

    assertThatThrownBy(payload::cipherObject)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Missing required field: ephemeralPK");
  }

  @Test
  void cipherObject_invalidHex() {
    EncryptedPayload payload = new EncryptedPayload(IV, EPHEMERAL_PK, "zz", MAC, false);

    assertThatThrownBy(payload::cipherObject)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid hex in field: cipherText");
  }

  @Test
  void cipherObject_wrongLengths() {
    assertThatThrownBy(() -> new EncryptedPayload(IV + "00", EPHEMERAL_PK, CIPHER_TEXT, MAC, false).cipherObject())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Field iv must be 16 bytes, got 17");
    assertThatThrownBy(() -> new EncryptedPayload(IV, EPHEMERAL_PK, CIPHER_TEXT, MAC.substring(2), false).cipherObject())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Field mac must be 32 bytes, got 31");
  }

  @Test
  void cipherObject_emptyCipherTextIsAllowed() {
    assertThat(new EncryptedPayload(IV, EPHEMERAL_PK, "", MAC, false).cipherObject().cipherText()).isEmpty();
  }
}
