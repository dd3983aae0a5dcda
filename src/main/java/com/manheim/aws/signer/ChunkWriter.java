package com.manheim.aws.signer;

import java.io.IOException;

/**
 * Receives the signed chunks of a streaming upload, in order, as one framed unit each.
 */
public interface ChunkWriter {

   /**
    * @param extension the chunk extension, {@code chunk-signature=<hex>}
    */
   void writeChunk(byte[] data, int offset, int length, String extension) throws IOException;
}
