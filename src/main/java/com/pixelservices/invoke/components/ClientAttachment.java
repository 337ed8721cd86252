package com.pixelservices.invoke.components;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousSocketChannel;

/**
 * Per-connection read state.
 */
public class ClientAttachment {
    public final ByteBuffer buffer;
    public final ByteArrayOutputStream requestData = new ByteArrayOutputStream();
    public final AsynchronousSocketChannel channel;

    public ClientAttachment(ByteBuffer buffer, AsynchronousSocketChannel channel) {
        this.buffer = buffer;
        this.channel = channel;
    }
}
