package com.manheim.aws.signer;

import static com.manheim.aws.signer.SigningUtils.getBytes;
import static com.manheim.aws.signer.SigningUtils.hmacSHA256;

/**
 * Derives the per date, region and service signing key from a secret access key.
 *
 * @see <a href="http://docs.aws.amazon.com/general/latest/gr/sigv4-calculate-signature.html">Calculate the signature</a>
 */
public final class SigningKeyDeriver {
   public static final String TERMINATOR = "aws4_request";

   private SigningKeyDeriver() {
   }

   public static byte[] deriveKey(String secretKey, String dateStamp, String region, String service) {
      byte[] secret = getBytes("AWS4" + secretKey);
      byte[] date = hmacSHA256(dateStamp, secret);
      byte[] regionKey = hmacSHA256(region, date);
      byte[] serviceKey = hmacSHA256(service, regionKey);
      return hmacSHA256(TERMINATOR, serviceKey);
   }
}
