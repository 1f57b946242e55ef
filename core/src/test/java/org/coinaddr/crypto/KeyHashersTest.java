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

import org.coinaddr.core.Hash160;
import org.junit.Test;

import static org.coinaddr.core.Utils.HEX;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class KeyHashersTest {
    private static final byte[] PUBKEY = HEX.decode("04678afdb0fe5548271967f1a67130b7105cd6a828e03909a67962e0ea1f61de"
            + "b649f6bc3f4cef38c4f35504e51ec112de5c384df7ba0b8d578a4c702b6bf11d5f");

    @Test
    public void ripemd160OfSha256() {
        assertEquals(Hash160.wrap("62e907b15cbf27d5425399ebf6f0fb50ebb88f18"),
                KeyHashers.SHA256_RIPEMD160.hash160(PUBKEY));
    }

    @Test
    public void truncatedSha256() {
        assertEquals(Hash160.wrap("261c1eb21fc4708c6acbe1cfc6d4565652e9e768"),
                KeyHashers.TRUNCATED_SHA256.hash160(PUBKEY));
    }

    @Test
    public void hashersDisagree() {
        assertNotEquals(KeyHashers.SHA256_RIPEMD160.hash160(new byte[0]), KeyHashers.TRUNCATED_SHA256.hash160(new byte[0]));
    }
}
