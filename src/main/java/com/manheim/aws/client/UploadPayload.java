package com.manheim.aws.client;

import java.io.IOException;
import java.io.InputStream;

/**
 * Opens the bytes of an upload from the start. Called once per attempt; the client closes every stream it opens.
 */
public interface UploadPayload {

   InputStream open() throws IOException;
}
