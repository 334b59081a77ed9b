package com.bko.gateway.agent.cli;

import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read position in one tailed file.
 * <p>
 * The byte offset is the only record of what has been consumed. It never exceeds the size observed by the last
 * read, and it goes back to zero whenever the file is truncated, deleted or replaced by a different file under
 * the same name. Only the first open may start at the end of the file; a file that shows up later is new
 * content and is read from its start. The open channel pins the old file, so a replacement never shares its key.
 */
@Slf4j
final class TailSession implements Closeable {

    private final Path file;
    private final ByteBuffer buffer;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private boolean skipExisting;
    private FileChannel channel;
    private Object fileKey;
    private long offset;

    TailSession(Path file, boolean fromEnd, int chunkSize) {
        this.file = file;
        this.skipExisting = fromEnd;
        this.buffer = ByteBuffer.allocate(Math.max(chunkSize, 1024));
    }

    long offset() {
        return offset;
    }

    boolean isOpen() {
        return channel != null;
    }

    /**
     * Opens the file if it exists and is not open yet.
     *
     * @return whether a file is open afterwards
     */
    boolean open() throws IOException {
        if (channel != null) {
            return true;
        }
        boolean fromEnd = skipExisting;
        skipExisting = false;
        try {
            channel = FileChannel.open(file, StandardOpenOption.READ);
        } catch (NoSuchFileException ex) {
            return false;
        }
        fileKey = Files.readAttributes(file, BasicFileAttributes.class).fileKey();
        offset = fromEnd ? channel.size() : 0;
        log.debug("Tailing {} from offset {}", file, offset);
        return true;
    }

    /**
     * Reads everything appended since the last call and returns the complete lines in it, trimmed, blanks dropped.
     * A trailing partial line is kept until its newline arrives.
     */
    List<String> readAppended() throws IOException {
        List<String> lines = new ArrayList<>();
        if (!open()) {
            return lines;
        }
        if (replacedOrGone()) {
            log.debug("{} was removed or replaced, reading it from the start", file);
            reset();
            if (!open()) {
                return lines;
            }
        }
        long size = channel.size();
        if (size < offset) {
            log.debug("{} shrank from {} to {} bytes, reading from the start", file, offset, size);
            offset = 0;
            pending.reset();
        }
        while (offset < size) {
            buffer.clear();
            int read = channel.read(buffer, offset);
            if (read <= 0) {
                break;
            }
            offset += read;
            collectLines(buffer.array(), read, lines);
        }
        return lines;
    }

    /**
     * Forgets the current file. The next read reopens it from offset zero.
     */
    void reset() {
        closeChannel();
        fileKey = null;
        offset = 0;
        pending.reset();
    }

    @Override
    public void close() {
        closeChannel();
    }

    private boolean replacedOrGone() throws IOException {
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (NoSuchFileException ex) {
            return true;
        }
        Object currentKey = attributes.fileKey();
        return fileKey != null && currentKey != null && !Objects.equals(fileKey, currentKey);
    }

    private void collectLines(byte[] bytes, int length, List<String> lines) {
        int start = 0;
        for (int i = 0; i < length; i++) {
            if (bytes[i] == '\n') {
                pending.write(bytes, start, i - start);
                addLine(lines);
                start = i + 1;
            }
        }
        pending.write(bytes, start, length - start);
    }

    private void addLine(List<String> lines) {
        String line = pending.toString(StandardCharsets.UTF_8).trim();
        pending.reset();
        if (!line.isEmpty()) {
            lines.add(line);
        }
    }

    private void closeChannel() {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException ex) {
            log.debug("Failed to close {}: {}", file, ex.getMessage());
        }
        channel = null;
    }
}
