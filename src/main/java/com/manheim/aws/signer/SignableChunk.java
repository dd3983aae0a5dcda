package com.manheim.aws.signer;

import static com.manheim.aws.signer.SigningUtils.EMPTY_PAYLOAD_SHA256;
import static com.manheim.aws.signer.SigningUtils.toHexString;

/**
 * One chunk of a streaming upload, linked to the signature of the chunk before it.
 */
public final class SignableChunk {
   public static final String CHUNK_SIGN_STRING_ALGORITHM_NAME = "AWS4-HMAC-SHA256-PAYLOAD";

   private final String dateStamp;
   private final String timeStamp;
   private final String region;
   private final String service;
   private final String previousSignatureHex;
   private final byte[] chunkPayloadHash;

   public SignableChunk(String dateStamp, String timeStamp, String region, String service,
         String previousSignatureHex, byte[] chunkPayloadHash) {
      this.dateStamp = dateStamp;
      this.timeStamp = timeStamp;
      this.region = region;
      this.service = service;
      this.previousSignatureHex = previousSignatureHex;
      this.chunkPayloadHash = chunkPayloadHash.clone();
   }

   public String getPreviousSignatureHex() {
      return previousSignatureHex;
   }

   public byte[] getChunkPayloadHash() {
      return chunkPayloadHash.clone();
   }

   public String stringToSign() {
      return CHUNK_SIGN_STRING_ALGORITHM_NAME + '\n' +
            dateStamp + 'T' + timeStamp + '\n' +
            SignableRequest.credentialScope(dateStamp, region, service) + '\n' +
            previousSignatureHex + '\n' +
            EMPTY_PAYLOAD_SHA256 + '\n' +
            toHexString(chunkPayloadHash);
   }
}
