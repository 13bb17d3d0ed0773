// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.pbft_ledger.consensus;

import com.github.pbft_ledger.NodeId;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.SignatureException;
import java.util.Base64;
import java.util.logging.Level;

import static com.github.pbft_ledger.LedgerLogger.LOGGER;

/// Ed25519 signatures using the JDK provider. Peer keys come from the {@link ClusterMembership}.
public class Ed25519MessageAuthenticator implements MessageAuthenticator {
  static final String ALGORITHM = "Ed25519";

  private final PrivateKey privateKey;
  private final ClusterMembership membership;

  public Ed25519MessageAuthenticator(PrivateKey privateKey, ClusterMembership membership) {
    this.privateKey = privateKey;
    this.membership = membership;
  }

  @Override
  public String sign(byte[] content) {
    try {
      final var signature = Signature.getInstance(ALGORITHM);
      signature.initSign(privateKey);
      signature.update(content);
      return Base64.getEncoder().encodeToString(signature.sign());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Unable to sign with " + ALGORITHM, e);
    }
  }

  @Override
  public boolean verify(byte[] content, String signature, NodeId signer) {
    final var publicKey = membership.member(signer).map(Member::publicKey).orElse(null);
    if (publicKey == null) {
      LOGGER.fine(() -> "No registered public key for " + signer);
      return false;
    }
    try {
      final var verifier = Signature.getInstance(ALGORITHM);
      verifier.initVerify(publicKey);
      verifier.update(content);
      return verifier.verify(Base64.getDecoder().decode(signature));
    } catch (SignatureException | IllegalArgumentException e) {
      LOGGER.fine(() -> "Unreadable signature from " + signer + ": " + e.getMessage());
      return false;
    } catch (GeneralSecurityException e) {
      LOGGER.log(Level.WARNING, "Unable to verify signature from " + signer + ": " + e.getMessage(), e);
      return false;
    }
  }
}
