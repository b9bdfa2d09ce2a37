/*
 * どこで: Commerce サービス補助
 * 何を: Idempotency-Key から 64-bit advisory lock のキーを生成する
 * なぜ: 同じキーの注文作成だけを直列化し、別キー同士は並行させるため
 */
package com.ecommerce.commerce.service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class IdempotencyLockKeyGenerator {

  static final int LOCK_KEY_BYTES = 8;

  public long generate(String idempotencyKey) {
    // SHA-256 の先頭 8byte を Big Endian の long として使う。
    final byte[] hashed = sha256(idempotencyKey.getBytes(StandardCharsets.UTF_8));
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] sha256(byte[] input) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(input);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
