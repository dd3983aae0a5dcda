package com.manheim.aws.client;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * A response as received by a {@link Transport}. Closing it releases the connection.
 */
public interface TransportResponse extends Closeable {

   int getStatusCode();

   /**
    * Response headers; lookups are case insensitive.
    */
   Map<String, String> getHeaders();

   InputStream getBody() throws IOException;
}
