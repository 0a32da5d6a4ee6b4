package com.codeheadsystems.curvecrypt.ecdsa;

import com.codeheadsystems.curvecrypt.common.HexBytes;

/**
 * An ECDSA signature with the public key of the signer.
 *
 * @param signature DER-encoded signature
 * @param publicKey compressed public key derived from the signing key
 */
public record SignatureResult(HexBytes signature, HexBytes publicKey) {
}
