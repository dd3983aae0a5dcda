package com.manheim.aws.signer;

/**
 * Utility for signing HTTP requests made to AWS services.
 *
 * @author Eric Haynes
 */
public interface RequestSigner {

   /**
    * Builds the string to sign for the request and signs it with the given key. Signatures are only valid for the
    * exact canonical request and timestamp they were computed over; callers re-sign on every attempt.
    */
   RequestSignature sign(SignableRequest request, byte[] signingKey);

   /**
    * Formats the value of the 'Authorization' header. The specific format is determined by implementations of this
    * interface.
    *
    * @param signedHeaders the signed header names exactly as {@link CanonicalRequest#getSignedHeaders()} returns
    *                      them for the request that was signed
    */
   String formatAuthorizationHeader(String accessKeyId, String credentialScope, String signedHeaders,
         String signatureHex);
}
