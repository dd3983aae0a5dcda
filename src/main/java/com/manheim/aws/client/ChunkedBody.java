package com.manheim.aws.client;

import com.manheim.aws.signer.ChunkWriter;

import java.io.IOException;

/**
 * A request body produced chunk by chunk while it is sent.
 */
public interface ChunkedBody {

   void writeTo(ChunkWriter writer) throws IOException;
}
