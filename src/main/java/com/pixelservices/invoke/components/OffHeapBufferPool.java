package com.pixelservices.invoke.components;

import java.nio.ByteBuffer;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool of direct read buffers shared by the connections of one server. At most
 * {@code maxPooled} released buffers are retained; extra ones are left to the collector.
 */
public class OffHeapBufferPool {
    private final int bufferSize;
    private final int maxPooled;
    private final ConcurrentLinkedQueue<ByteBuffer> pool = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pooled = new AtomicInteger(0);
    private final AtomicInteger inUse = new AtomicInteger(0);

    public OffHeapBufferPool(int initialSize, int maxPooled, int bufferSize) {
        this.bufferSize = bufferSize;
        this.maxPooled = Math.max(initialSize, maxPooled);
        for (int i = 0; i < initialSize; i++) {
            pool.offer(ByteBuffer.allocateDirect(bufferSize));
            pooled.incrementAndGet();
        }
    }

    public ByteBuffer acquire() {
        ByteBuffer buffer = pool.poll();
        if (buffer == null) {
            buffer = ByteBuffer.allocateDirect(bufferSize);
        } else {
            pooled.decrementAndGet();
        }
        inUse.incrementAndGet();
        buffer.clear();
        return buffer;
    }

    public void release(ByteBuffer buffer) {
        if (buffer == null) {
            return;
        }
        inUse.decrementAndGet();
        if (pooled.incrementAndGet() <= maxPooled) {
            buffer.clear();
            pool.offer(buffer);
        } else {
            pooled.decrementAndGet();
        }
    }

    public int getBufferSize() {
        return bufferSize;
    }

    public int getInUse() {
        return inUse.get();
    }

    public int getAvailable() {
        return pooled.get();
    }
}
