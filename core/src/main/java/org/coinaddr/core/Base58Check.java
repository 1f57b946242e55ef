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

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Base58 with a four byte integrity check: the first four bytes of the double SHA-256 of the payload are appended
 * before encoding and verified after decoding. This catches transcription errors, it does not authenticate anything.
 */
public class Base58Check {
    /** Number of checksum bytes appended to the payload. */
    public static final int CHECKSUM_LENGTH = 4;

    private Base58Check() {
    }

    /**
     * Encodes the given payload followed by its checksum.
     *
     * @param payload the bytes to encode, may be empty
     * @return the base58-encoded string
     */
    public static String encode(byte[] payload) {
        checkNotNull(payload);
        byte[] checksum = checksum(payload);
        byte[] withChecksum = Arrays.copyOf(payload, payload.length + CHECKSUM_LENGTH);
        System.arraycopy(checksum, 0, withChecksum, payload.length, CHECKSUM_LENGTH);
        return Base58.encode(withChecksum);
    }

    /**
     * Encodes the given version byte and payload, followed by a checksum over both.
     *
     * @param version the version byte, 0 to 255
     * @param payload the bytes to encode after the version byte
     * @return the base58-encoded string
     */
    public static String encode(int version, byte[] payload) {
        checkArgument(version >= 0 && version < 256, "Version must be 0 to 255: %s", version);
        checkNotNull(payload);
        byte[] versioned = new byte[1 + payload.length];
        versioned[0] = (byte) version;
        System.arraycopy(payload, 0, versioned, 1, payload.length);
        return encode(versioned);
    }

    /**
     * Decodes the given string and verifies its checksum.
     *
     * @param input the base58-encoded string to decode (which should include the checksum)
     * @return the payload, without the checksum
     * @throws AddressFormatException.InvalidCharacter if the input is not base58
     * @throws AddressFormatException.TooShort if the decoded data is shorter than a checksum
     * @throws AddressFormatException.InvalidChecksum if the checksum does not validate
     */
    public static byte[] decode(String input) throws AddressFormatException {
        byte[] decoded = Base58.decode(input);
        if (decoded.length < CHECKSUM_LENGTH)
            throw new AddressFormatException.TooShort(decoded.length);
        byte[] data = Arrays.copyOfRange(decoded, 0, decoded.length - CHECKSUM_LENGTH);
        byte[] checksum = Arrays.copyOfRange(decoded, decoded.length - CHECKSUM_LENGTH, decoded.length);
        if (!Arrays.equals(checksum, checksum(data)))
            throw new AddressFormatException.InvalidChecksum();
        return data;
    }

    private static byte[] checksum(byte[] payload) {
        return Arrays.copyOf(Sha256Hash.hashTwice(payload), CHECKSUM_LENGTH);
    }
}
