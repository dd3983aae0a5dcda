package com.manheim.aws.signer;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Hashing and encoding primitives shared by the V4 signing code.
 *
 * @author Eric Haynes
 */
public final class SigningUtils {
   public static final String PAYLOAD_HASHING_ALGORITHM = "SHA-256";
   public static final String SIGNATURE_HASHING_ALGORITHM = "HmacSHA256";
   public static final String EMPTY_PAYLOAD_SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

   private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();

   private SigningUtils() {
   }

   public static String toHexString(byte[] data) {
      char[] result = new char[data.length * 2];
      for (int i = 0; i < data.length; i++) {
         int v = data[i] & 0xFF;
         result[i * 2] = HEX_CHARS[v >>> 4];
         result[i * 2 + 1] = HEX_CHARS[v & 0x0F];
      }
      return new String(result);
   }

   public static byte[] sha256(byte[] data) {
      return sha256(data, 0, data.length);
   }

   public static byte[] sha256(byte[] data, int offset, int length) {
      try {
         MessageDigest messageDigest = MessageDigest.getInstance(PAYLOAD_HASHING_ALGORITHM);
         messageDigest.update(data, offset, length);
         return messageDigest.digest();
      } catch (NoSuchAlgorithmException e) {
         throw new IllegalStateException(e);
      }
   }

   public static String sha256Hex(byte[] data) {
      return toHexString(sha256(data));
   }

   public static byte[] hmacSHA256(String data, byte[] key) {
      return hmacSHA256(getBytes(data), key);
   }

   public static byte[] hmacSHA256(byte[] data, byte[] key) {
      try {
         Mac mac = Mac.getInstance(SIGNATURE_HASHING_ALGORITHM);
         mac.init(new SecretKeySpec(key, SIGNATURE_HASHING_ALGORITHM));
         return mac.doFinal(data);
      } catch (NoSuchAlgorithmException e) {
         throw new IllegalStateException(e);
      } catch (InvalidKeyException e) {
         throw new IllegalArgumentException(e);
      }
   }

   public static byte[] getBytes(String value) {
      return value.getBytes(StandardCharsets.UTF_8);
   }
}
