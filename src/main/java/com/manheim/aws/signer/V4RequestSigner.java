package com.manheim.aws.signer;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import static com.manheim.aws.signer.SigningUtils.getBytes;
import static com.manheim.aws.signer.SigningUtils.hmacSHA256;
import static com.manheim.aws.signer.SigningUtils.sha256Hex;

/**
 * Signs requests using the (at this time current) V4 request signing scheme.
 *
 * @see <a href="http://docs.aws.amazon.com/general/latest/gr/sigv4_signing.html">Signature Version 4</a>
 *
 * @author Eric Haynes
 */
public class V4RequestSigner implements RequestSigner {
   public static final String SIGN_STRING_ALGORITHM_NAME = "AWS4-HMAC-SHA256";
   public static final String AUTH_HEADER_NAME = "Authorization";
   public static final String AUTH_HEADER_FORMAT =
         SIGN_STRING_ALGORITHM_NAME + " Credential=%s/%s, SignedHeaders=%s, Signature=%s";

   private static final Log LOG = LogFactory.getLog(V4RequestSigner.class);

   @Override
   public RequestSignature sign(SignableRequest request, byte[] signingKey) {
      byte[] stringToSign = getBytes(createStringToSign(request));
      return new RequestSignature(stringToSign, hmacSHA256(stringToSign, signingKey));
   }

   @Override
   public String formatAuthorizationHeader(String accessKeyId, String credentialScope, String signedHeaders,
         String signatureHex) {
      return String.format(AUTH_HEADER_FORMAT, accessKeyId, credentialScope, signedHeaders, signatureHex);
   }

   String createStringToSign(SignableRequest request) {
      String canonicalRequest = request.getCanonicalRequest().toCanonicalString();
      if (LOG.isDebugEnabled()) {
         LOG.debug("Canonical request:\n" + canonicalRequest);
      }
      return SIGN_STRING_ALGORITHM_NAME + '\n' +
            request.isoTimestamp() + '\n' +
            request.credentialScope() + '\n' +
            sha256Hex(getBytes(canonicalRequest));
   }
}
