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

import com.google.common.primitives.Ints;
import net.jcip.annotations.Immutable;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A Sha256Hash just wraps a byte[] so that equals and hashcode work correctly, allowing it to be used as keys in a
 * map. It also checks that the length is correct and provides a bit more type safety.
 */
@Immutable
public class Sha256Hash implements Comparable<Sha256Hash> {
    public static final int LENGTH = 32; // bytes

    private final byte[] bytes;

    private Sha256Hash(byte[] rawHashBytes) {
        checkArgument(rawHashBytes.length == LENGTH, "Expected %s bytes, got %s", LENGTH, rawHashBytes.length);
        this.bytes = rawHashBytes;
    }

    /** Creates a new instance that wraps a copy of the given hash value. */
    public static Sha256Hash wrap(byte[] rawHashBytes) {
        return new Sha256Hash(checkNotNull(rawHashBytes).clone());
    }

    /** Creates a new instance from the given hex string, which must be 64 characters long. */
    public static Sha256Hash wrap(String hexString) {
        return new Sha256Hash(Utils.HEX.decode(hexString));
    }

    /** Creates a new instance containing the calculated (one-time) hash of the given bytes. */
    public static Sha256Hash of(byte[] contents) {
        return new Sha256Hash(hash(contents));
    }

    /** Creates a new instance containing the hash of the calculated hash of the given bytes. */
    public static Sha256Hash twiceOf(byte[] contents) {
        return new Sha256Hash(hashTwice(contents));
    }

    /**
     * Returns a new SHA-256 MessageDigest instance.
     *
     * This is a convenience method which wraps the checked
     * exception that can never occur with a RuntimeException.
     */
    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);  // Can't happen.
        }
    }

    /** Calculates the SHA-256 hash of the given bytes. */
    public static byte[] hash(byte[] input) {
        return newDigest().digest(checkNotNull(input));
    }

    /** Calculates the SHA-256 hash of the given bytes, and then hashes the resulting hash again. */
    public static byte[] hashTwice(byte[] input) {
        MessageDigest digest = newDigest();
        digest.update(checkNotNull(input));
        return digest.digest(digest.digest());
    }

    /** Returns a copy of the internal byte array. */
    public byte[] getBytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((Sha256Hash) o).bytes);
    }

    /** Uses the last four bytes of the hash, which are already uniformly distributed. */
    @Override
    public int hashCode() {
        return Ints.fromBytes(bytes[LENGTH - 4], bytes[LENGTH - 3], bytes[LENGTH - 2], bytes[LENGTH - 1]);
    }

    @Override
    public String toString() {
        return Utils.HEX.encode(bytes);
    }

    @Override
    public int compareTo(final Sha256Hash other) {
        for (int i = LENGTH - 1; i >= 0; i--) {
            final int thisByte = this.bytes[i] & 0xff;
            final int otherByte = other.bytes[i] & 0xff;
            if (thisByte > otherByte)
                return 1;
            if (thisByte < otherByte)
                return -1;
        }
        return 0;
    }
}
