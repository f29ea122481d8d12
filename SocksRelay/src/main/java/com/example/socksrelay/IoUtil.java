package com.example.socksrelay;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

final class IoUtil {
    private IoUtil() {
    }

    static int readUnsignedByte(InputStream in, String what) throws IOException {
        int b = in.read();
        if (b < 0) {
            throw new EOFException("EOF while reading " + what);
        }
        return b;
    }

    static byte[] readFully(InputStream in, int n, String what) throws IOException {
        byte[] bytes = in.readNBytes(n);
        if (bytes.length < n) {
            throw new EOFException("EOF while reading " + what + ": expected " + n + " bytes, got " + bytes.length);
        }
        return bytes;
    }

    static int readUnsignedShort(InputStream in, String what) throws IOException {
        int hi = in.read();
        int lo = in.read();
        if ((hi | lo) < 0) {
            throw new EOFException("EOF while reading " + what);
        }
        return (hi << 8) | lo;
    }

    static void writeShort(OutputStream out, int value) throws IOException {
        out.write((value >>> 8) & 0xFF);
        out.write(value & 0xFF);
    }

    static void closeQuietly(Closeable c) {
        if (c != null) {
            try {
                c.close();
            } catch (IOException ignored) {
            }
        }
    }
}
