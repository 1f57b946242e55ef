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

package org.coinaddr.crypto;

import org.bouncycastle.crypto.digests.RIPEMD160Digest;
import org.coinaddr.core.Hash160;
import org.coinaddr.core.Sha256Hash;

import java.util.Arrays;

/**
 * The built in ways of hashing a public key into an address hash.
 */
public enum KeyHashers implements KeyHasher {
    /** RIPEMD-160 over SHA-256, the hash real Bitcoin addresses carry. */
    SHA256_RIPEMD160 {
        @Override
        public Hash160 hash160(byte[] pubKey) {
            byte[] sha256 = Sha256Hash.hash(pubKey);
            RIPEMD160Digest digest = new RIPEMD160Digest();
            digest.update(sha256, 0, sha256.length);
            byte[] out = new byte[Hash160.LENGTH];
            digest.doFinal(out, 0);
            return Hash160.wrap(out);
        }
    },

    /**
     * The first 20 bytes of SHA-256. Produces different addresses than {@link #SHA256_RIPEMD160}; only useful for
     * reproducing data made by systems that used it as a stand in.
     */
    TRUNCATED_SHA256 {
        @Override
        public Hash160 hash160(byte[] pubKey) {
            return Hash160.wrap(Arrays.copyOf(Sha256Hash.hash(pubKey), Hash160.LENGTH));
        }
    }
}
