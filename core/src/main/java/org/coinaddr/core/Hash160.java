/*
 * Copyright by the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.coinaddr.core;

import com.google.common.primitives.UnsignedBytes;
import net.jcip.annotations.Immutable;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A 160-bit identity hash, normally RIPEMD-160 over SHA-256 of a public key. This is the value an {@link Address}
 * carries after its version byte.
 */
@Immutable
public final class Hash160 implements Comparable<Hash160> {
    public static final int LENGTH = 20; // bytes

    private final byte[] bytes;

    private Hash160(byte[] bytes) {
        checkArgument(bytes.length == LENGTH, "Expected %s bytes, got %s", LENGTH, bytes.length);
        this.bytes = bytes;
    }

    /** Creates a new instance that wraps a copy of the given 20 bytes. */
    public static Hash160 wrap(byte[] rawHashBytes) {
        return new Hash160(checkNotNull(rawHashBytes).clone());
    }

    /** Creates a new instance from a 40 character hex string. */
    public static Hash160 wrap(String hexString) {
        return new Hash160(Utils.HEX.decode(hexString));
    }

    /** Returns a copy of the hash bytes. */
    public byte[] getBytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((Hash160) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return Utils.HEX.encode(bytes);
    }

    @Override
    public int compareTo(Hash160 other) {
        return UnsignedBytes.lexicographicalComparator().compare(bytes, other.bytes);
    }
}
