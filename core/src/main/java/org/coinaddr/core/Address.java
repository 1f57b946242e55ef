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

import net.jcip.annotations.Immutable;
import org.coinaddr.crypto.KeyHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>A standard address is built by taking the RIPEMD-160 hash of the public key bytes, with a version prefix and a
 * checksum suffix, then encoding it textually as base58. The version prefix is used to both denote the network for
 * which the address is valid (see {@link NetworkParameters}), and also to indicate how the bytes inside the address
 * should be interpreted.</p>
 *
 * <p>Decoding accepts every version from zero up to a maximum rather than a single expected version, so a network
 * with a non-zero header also accepts the addresses of networks with a lower one.</p>
 */
@Immutable
public class Address extends VersionedChecksummedBytes {
    private static final Logger log = LoggerFactory.getLogger(Address.class);

    /**
     * An address is a RIPEMD160 hash of a public key, therefore is always 160 bits or 20 bytes.
     */
    public static final int LENGTH = Hash160.LENGTH;

    private Address(int version, Hash160 hash160) {
        super(version, hash160.getBytes());
    }

    private Address(String address, int maxVersion) throws AddressFormatException {
        super(address);
        if (bytes.length != LENGTH)
            throw new AddressFormatException.InvalidDataLength(
                    "Wrong number of bytes, excluding version byte: " + bytes.length);
        if (version > maxVersion)
            throw new AddressFormatException.InvalidVersion(version, maxVersion);
    }

    /**
     * Construct an address from a version byte and the hash it wraps.
     *
     * @param version the version byte, 0 to 255
     * @param hash160 the hash the address identifies
     */
    public static Address fromHash160(int version, Hash160 hash160) {
        checkArgument(version >= 0 && version < 256, "Version must be 0 to 255: %s", version);
        return new Address(version, checkNotNull(hash160));
    }

    /** Construct an address for the given network from the hash it wraps. */
    public static Address fromHash160(NetworkParameters params, Hash160 hash160) {
        return fromHash160(params.getAddressHeader(), hash160);
    }

    /** Construct an address by hashing a public key with the given hasher. */
    public static Address fromPubKey(int version, byte[] pubKey, KeyHasher hasher) {
        return fromHash160(version, hasher.hash160(checkNotNull(pubKey)));
    }

    /** Construct an address for the given network by hashing a public key with the network's key hasher. */
    public static Address fromPubKey(NetworkParameters params, byte[] pubKey) {
        return fromPubKey(params.getAddressHeader(), pubKey, params.getKeyHasher());
    }

    /**
     * Construct an address from its Base58 representation.
     *
     * @param base58 the textual form of the address, such as "17kzeh4N8g49GFvdDzSf8PjaPfyoD1MndL"
     * @param maxVersion the highest version byte to accept
     * @throws AddressFormatException if the given base58 doesn't parse, the checksum is invalid, the payload is not a
     *         version byte plus a hash, or the version is above {@code maxVersion}
     */
    public static Address fromBase58(String base58, int maxVersion) throws AddressFormatException {
        checkArgument(maxVersion >= 0 && maxVersion < 256, "Maximum version must be 0 to 255: %s", maxVersion);
        return new Address(checkNotNull(base58), maxVersion);
    }

    /**
     * Construct an address from its Base58 representation, accepting the versions the given network accepts.
     *
     * @throws AddressFormatException if the given base58 doesn't parse or is not valid on the network
     */
    public static Address fromBase58(NetworkParameters params, String base58) throws AddressFormatException {
        return fromBase58(base58, params.getMaxAddressVersion());
    }

    /**
     * Returns true if the given string decodes to an address with a version no higher than {@code maxVersion}. The
     * reason a string is rejected is not reported; use {@link #fromBase58(String, int)} for that.
     */
    public static boolean isValid(String base58, int maxVersion) {
        try {
            fromBase58(base58, maxVersion);
            return true;
        } catch (AddressFormatException x) {
            log.debug("Rejected address {}: {}", base58, x.getMessage());
            return false;
        }
    }

    /** Returns true if the given string is an address the given network accepts. */
    public static boolean isValid(NetworkParameters params, String base58) {
        return isValid(base58, params.getMaxAddressVersion());
    }

    /** The (big endian) 20 byte hash that is the core of an address. */
    public Hash160 getHash160() {
        return Hash160.wrap(bytes);
    }
}
