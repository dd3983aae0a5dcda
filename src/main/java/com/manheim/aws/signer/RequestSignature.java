package com.manheim.aws.signer;

/**
 * The string that was signed and the raw signature over it.
 */
public final class RequestSignature {
   private final byte[] stringToSign;
   private final byte[] signature;

   public RequestSignature(byte[] stringToSign, byte[] signature) {
      this.stringToSign = stringToSign.clone();
      this.signature = signature.clone();
   }

   public byte[] getStringToSign() {
      return stringToSign.clone();
   }

   public byte[] getSignature() {
      return signature.clone();
   }

   /**
    * The signature as it appears in headers and chunk extensions.
    */
   public String signatureHex() {
      return SigningUtils.toHexString(signature);
   }
}
