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

/**
 * Thrown when a Base58 string, a Base58Check string or an address cannot be decoded. Each way decoding can fail has
 * its own subclass, so callers that care can tell a typo from a checksum failure or an address meant for another
 * network.
 */
public class AddressFormatException extends IllegalArgumentException {
    public AddressFormatException() {
        super();
    }

    public AddressFormatException(String message) {
        super(message);
    }

    /**
     * This exception is thrown by {@link Base58} when a character that is neither part of the alphabet nor trailing
     * whitespace is encountered.
     */
    public static class InvalidCharacter extends AddressFormatException {
        public final char character;
        public final int position;

        public InvalidCharacter(char character, int position) {
            super("Invalid character '" + Character.toString(character) + "' at position " + position);
            this.character = character;
            this.position = position;
        }
    }

    /**
     * This exception is thrown by {@link Base58Check} when the decoded data is too short to carry a checksum.
     */
    public static class TooShort extends AddressFormatException {
        public TooShort() {
            super("Input too short to contain a checksum");
        }

        public TooShort(int length) {
            super("Input too short to contain a checksum: " + length + " bytes");
        }
    }

    /**
     * This exception is thrown by {@link Base58Check} when the trailing checksum does not match the one computed over
     * the payload.
     */
    public static class InvalidChecksum extends AddressFormatException {
        public InvalidChecksum() {
            super("Checksum does not validate");
        }
    }

    /**
     * This exception is thrown by {@link VersionedChecksummedBytes} when the checksummed payload carries no bytes at
     * all, not even a version byte.
     */
    public static class EmptyPayload extends AddressFormatException {
        public EmptyPayload() {
            super("Empty payload, no version byte");
        }
    }

    /**
     * This exception is thrown by {@link Address} when the payload is not exactly one version byte followed by a
     * {@link Hash160}.
     */
    public static class InvalidDataLength extends AddressFormatException {
        public InvalidDataLength() {
            super();
        }

        public InvalidDataLength(String message) {
            super(message);
        }
    }

    /**
     * This exception is thrown by {@link Address} when the version byte is above the highest version accepted.
     */
    public static class InvalidVersion extends AddressFormatException {
        public final int version;
        public final int maxVersion;

        public InvalidVersion(int version, int maxVersion) {
            super("Version " + version + " above accepted maximum " + maxVersion);
            this.version = version;
            this.maxVersion = maxVersion;
        }
    }
}
