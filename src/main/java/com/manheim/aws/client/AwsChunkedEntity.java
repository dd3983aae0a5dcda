package com.manheim.aws.client;

import com.manheim.aws.signer.ChunkWriter;
import org.apache.http.entity.AbstractHttpEntity;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * An {@code aws-chunked} request body: every chunk is framed as {@code hex-size;extension CRLF data CRLF}. The
 * entity itself is sent with chunked transfer encoding, so its length is never known up front.
 */
class AwsChunkedEntity extends AbstractHttpEntity {
   private static final byte[] CRLF = {'\r', '\n'};

   private final ChunkedBody body;

   AwsChunkedEntity(ChunkedBody body) {
      this.body = body;
      setChunked(true);
   }

   @Override
   public boolean isRepeatable() {
      return false;
   }

   @Override
   public long getContentLength() {
      return -1;
   }

   @Override
   public InputStream getContent() {
      throw new UnsupportedOperationException("aws-chunked bodies can only be written");
   }

   @Override
   public void writeTo(OutputStream out) throws IOException {
      body.writeTo(new FramingWriter(out));
      out.flush();
   }

   @Override
   public boolean isStreaming() {
      return false;
   }

   static final class FramingWriter implements ChunkWriter {
      private final OutputStream out;

      FramingWriter(OutputStream out) {
         this.out = out;
      }

      @Override
      public void writeChunk(byte[] data, int offset, int length, String extension) throws IOException {
         out.write((Integer.toHexString(length) + ';' + extension).getBytes(StandardCharsets.US_ASCII));
         out.write(CRLF);
         out.write(data, offset, length);
         out.write(CRLF);
      }
   }
}
