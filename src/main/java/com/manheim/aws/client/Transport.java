package com.manheim.aws.client;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Sends signed requests. Implementations own connection handling and framing; they must send the given headers
 * as they are, apart from the ones that describe the framing itself ({@code Content-Length},
 * {@code Transfer-Encoding}).
 */
public interface Transport extends Closeable {

   TransportResponse send(String method, URI uri, Map<String, String> headers, byte[] body) throws IOException;

   /**
    * Sends a body of unknown framed length, calling the body back once per chunk.
    */
   TransportResponse sendChunked(String method, URI uri, Map<String, String> headers, ChunkedBody body)
         throws IOException;
}
