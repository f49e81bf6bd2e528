package com.surge.reo.fn;

import com.surge.reo.api.Data;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * The built-in natives.
 *
 * Integer natives work on 8-byte big-endian two's complement values and
 * wrap on overflow. Comparisons return a one-byte boolean.
 */
public final class StandardNatives {

    private StandardNatives() {
    }

    static void registerAll(NativeRegistry.Builder b, PrintStream out) {
        // --- Integer arithmetic ---
        b.register("inc", true, 0, StandardNatives::inc);
        b.register("neg", true, 0, args -> Data.fromLong(-Data.toLong(args.get(0))));
        b.register("times", true, 1, args -> Data.fromLong(
                Data.toLong(args.get(0)) * Data.toLong(args.get(1))));
        b.register("plus", true, 1, args -> Data.fromLong(
                Data.toLong(args.get(0)) + Data.toLong(args.get(1))));
        b.register("minus", true, 1, args -> Data.fromLong(
                Data.toLong(args.get(0)) - Data.toLong(args.get(1))));

        // --- Comparisons ---
        b.register("eq", true, 1, args -> Data.fromBool(
                Arrays.equals(args.get(0), args.get(1))));
        b.register("lt", true, 1, args -> Data.fromBool(
                Data.toLong(args.get(0)) < Data.toLong(args.get(1))));
        b.register("gt", true, 1, args -> Data.fromBool(
                Data.toLong(args.get(0)) > Data.toLong(args.get(1))));

        // --- Bytes and output ---
        b.register("concat", true, 1, StandardNatives::concat);
        b.register("stdout", false, 1, args -> stdout(out, args.get(0)));
    }

    static byte[] inc(List<byte[]> args) {
        return Data.fromLong(Data.toLong(args.get(0)) + 1);
    }

    static byte[] concat(List<byte[]> args) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        for (byte[] a : args)
            buf.writeBytes(a);
        return buf.toByteArray();
    }

    static byte[] stdout(PrintStream out, byte[] bytes) {
        out.write(bytes, 0, bytes.length);
        out.flush();
        return bytes;
    }
}
