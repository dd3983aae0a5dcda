package com.manheim.aws.signer;

import com.manheim.aws.PreconditionViolationException;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

import static com.manheim.aws.signer.SigningUtils.getBytes;
import static com.manheim.aws.signer.SigningUtils.hmacSHA256;
import static com.manheim.aws.signer.SigningUtils.sha256;
import static com.manheim.aws.signer.SigningUtils.toHexString;

/**
 * Signs a streaming upload chunk by chunk. Every chunk signature covers the signature of the chunk before it, the
 * first one covers the seed signature of the request headers, so chunks can neither be dropped nor reordered.
 * Only the last signature is kept between chunks.
 *
 * <p>Not thread safe, and not reusable: a retried upload starts a new chain from a new seed signature.
 *
 * @see <a href="http://docs.aws.amazon.com/AmazonS3/latest/API/sigv4-streaming.html">Transferring payload in
 * multiple chunks</a>
 */
public final class ChunkSignatureChain {
   public static final int MIN_BLOCK_SIZE = 8 * 1024;
   public static final String CHUNK_SIGNATURE_EXTENSION = "chunk-signature=";

   private final SignableRequest seedRequest;
   private final byte[] signingKey;
   private String signature;

   ChunkSignatureChain(SignableRequest seedRequest, byte[] signingKey, String seedSignatureHex) {
      this.seedRequest = seedRequest;
      this.signingKey = signingKey.clone();
      this.signature = seedSignatureHex;
   }

   /**
    * Signs the request headers and starts a chain from that seed signature. The request must carry
    * {@link CanonicalRequestBuilder#STREAMING_PAYLOAD} as its payload hash.
    */
   public static ChunkSignatureChain start(RequestSigner signer, SignableRequest seedRequest, byte[] signingKey) {
      String payloadHash = seedRequest.getCanonicalRequest().getPayloadHash();
      if (!CanonicalRequestBuilder.STREAMING_PAYLOAD.equals(payloadHash)) {
         throw new PreconditionViolationException("Streaming uploads must be signed with payload hash "
               + CanonicalRequestBuilder.STREAMING_PAYLOAD + ", not " + payloadHash);
      }
      return new ChunkSignatureChain(seedRequest, signingKey, signer.sign(seedRequest, signingKey).signatureHex());
   }

   public static void checkBlockSize(int blockSize) {
      if (blockSize <= MIN_BLOCK_SIZE) {
         throw new PreconditionViolationException(
               "The block size for an upload has to be bigger than 8KB, was " + blockSize);
      }
   }

   /**
    * The signature of the last chunk signed, or the seed signature if none has been signed yet.
    */
   public String currentSignature() {
      return signature;
   }

   /**
    * Signs the next chunk and advances the chain.
    *
    * @return the new chunk signature, hex encoded
    */
   public String signChunk(byte[] data, int offset, int length) {
      SignableChunk chunk = new SignableChunk(seedRequest.getDateStamp(), seedRequest.getTimeStamp(),
            seedRequest.getRegion(), seedRequest.getService(), signature, sha256(data, offset, length));
      signature = toHexString(hmacSHA256(getBytes(chunk.stringToSign()), signingKey));
      return signature;
   }

   /**
    * Reads exactly {@code payloadSize} bytes from the payload in blocks of {@code blockSize}, handing each signed
    * block to the writer, followed by the terminating zero length chunk.
    */
   public void writeChunks(InputStream payload, long payloadSize, int blockSize, ChunkWriter writer)
         throws IOException {
      checkBlockSize(blockSize);
      byte[] buffer = new byte[blockSize];
      long bytesLeft = payloadSize;
      while (bytesLeft > 0) {
         int length = (int) Math.min(blockSize, bytesLeft);
         readFully(payload, buffer, length, payloadSize - bytesLeft, payloadSize);
         writer.writeChunk(buffer, 0, length, CHUNK_SIGNATURE_EXTENSION + signChunk(buffer, 0, length));
         bytesLeft -= length;
      }
      writer.writeChunk(buffer, 0, 0, CHUNK_SIGNATURE_EXTENSION + signChunk(buffer, 0, 0));
   }

   private static void readFully(InputStream payload, byte[] buffer, int length, long position, long payloadSize)
         throws IOException {
      int read = 0;
      while (read < length) {
         int count = payload.read(buffer, read, length - read);
         if (count < 0) {
            throw new EOFException("Payload ended after " + (position + read) + " of " + payloadSize + " bytes");
         }
         read += count;
      }
   }
}
