package de.bsommerfeld.catalog.cache;

import de.bsommerfeld.catalog.cache.declcfg.Meta;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Temporary file holding the source catalog's objects during a build, split
 * into per-package sections. Appends are serialized; reads are positional
 * and may run concurrently once the walk is done.
 */
final class MetaSpool implements Closeable {

    private final Path file;
    private final FileChannel channel;
    private final Lock lock = new ReentrantLock();
    private final Map<String, List<Section>> sections = new TreeMap<>();
    private long size;

    private MetaSpool(Path file, FileChannel channel) {
        this.file = file;
        this.channel = channel;
    }

    static MetaSpool create() throws IOException {
        Path file = Files.createTempFile("catalog-cache-spool-", ".json");
        return new MetaSpool(file, FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE));
    }

    void append(Meta meta) throws IOException {
        lock.lock();
        try {
            long offset = size;
            ByteBuffer buffer = ByteBuffer.wrap(meta.blob());
            while (buffer.hasRemaining()) {
                size += channel.write(buffer, size);
            }
            sections.computeIfAbsent(meta.packageName(), k -> new ArrayList<>())
                    .add(new Section(meta.schema(), meta.name(), offset, meta.blob().length));
        } finally {
            lock.unlock();
        }
    }

    List<String> packages() {
        lock.lock();
        try {
            return new ArrayList<>(sections.keySet());
        } finally {
            lock.unlock();
        }
    }

    /** The objects of one package in the order they were appended. */
    List<Meta> read(String packageName) throws IOException {
        List<Section> owned;
        lock.lock();
        try {
            owned = List.copyOf(sections.getOrDefault(packageName, List.of()));
        } finally {
            lock.unlock();
        }
        List<Meta> metas = new ArrayList<>(owned.size());
        for (Section section : owned) {
            ByteBuffer buffer = ByteBuffer.allocate(section.length());
            long position = section.offset();
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    throw new IOException("spool " + file + " ended early");
                }
                position += read;
            }
            metas.add(new Meta(section.schema(), packageName, section.name(), buffer.array()));
        }
        return metas;
    }

    @Override
    public void close() throws IOException {
        try {
            channel.close();
        } finally {
            Files.deleteIfExists(file);
        }
    }

    private record Section(String schema, String name, long offset, int length) {
    }
}
