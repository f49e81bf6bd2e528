package com.surge.reo.fn;

import java.util.List;

/**
 * A built-in operation over byte arrays.
 *
 * Arguments arrive already dataized, in order. Implementations throw
 * {@link IllegalArgumentException} when an argument has a length or encoding
 * they don't accept.
 */
@FunctionalInterface
public interface NativeFunction {
    byte[] apply(List<byte[]> args);
}
