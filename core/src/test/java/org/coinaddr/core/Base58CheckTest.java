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

import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class Base58CheckTest {

    @Test
    public void testDecode() {
        Base58Check.decode("4stwEBjT6FYyVV");

        // Now check we can correctly decode the case where the high bit of the first byte is not zero, so BigInteger
        // sign extends. Fix for a bug that stopped us parsing keys exported using sipas patch.
        Base58Check.decode("93VYUMzRG9DdbRP72uQXjaWibbQwygnvaCu9DumcqDjGybD864T");
    }

    @Test(expected = AddressFormatException.InvalidChecksum.class)
    public void testDecodeBadChecksum() {
        Base58Check.decode("4stwEBjT6FYyVW");
    }

    @Test(expected = AddressFormatException.TooShort.class)
    public void testDecodeTooShort() {
        Base58Check.decode("4s");
    }

    @Test(expected = AddressFormatException.TooShort.class)
    public void testDecodeEmpty() {
        Base58Check.decode("");
    }

    @Test(expected = AddressFormatException.InvalidCharacter.class)
    public void testDecodeInvalidCharacter() {
        Base58Check.decode("4stwEBjT6FYy0V");
    }

    @Test
    public void testEncodeEmptyPayload() {
        String encoded = Base58Check.encode(new byte[0]);
        assertEquals("3QJmnh", encoded);
        assertEquals(0, Base58Check.decode(encoded).length);
    }

    @Test
    public void testRoundTrip() {
        byte[] payload = "Hello, Bitcoin!".getBytes(StandardCharsets.US_ASCII);
        String encoded = Base58Check.encode(payload);
        assertEquals("EFiFWuRxVtH7xm4n2ZadEY73qw", encoded);
        assertArrayEquals(payload, Base58Check.decode(encoded));
        assertArrayEquals(payload, Base58Check.decode(" " + encoded + "\n"));
    }

    @Test
    public void testEncodeWithVersion() {
        byte[] hash = Utils.HEX.decode("62e907b15cbf27d5425399ebf6f0fb50ebb88f18");
        assertEquals("1A1zP1eP5QGefi2DMPTfTL5SLmv7DivfNa", Base58Check.encode(0, hash));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEncodeVersionOutOfRange() {
        Base58Check.encode(256, new byte[20]);
    }

    @Test
    public void testEveryBitFlipIsRejected() {
        byte[] payload = "Hello, Bitcoin!".getBytes(StandardCharsets.US_ASCII);
        byte[] checksummed = Base58.decode(Base58Check.encode(payload));
        for (int bit = 0; bit < payload.length * 8; bit++) {
            byte[] corrupted = checksummed.clone();
            corrupted[bit / 8] ^= (byte) (1 << (bit % 8));
            try {
                Base58Check.decode(Base58.encode(corrupted));
                fail("bit " + bit);
            } catch (AddressFormatException.InvalidChecksum x) {
                // expected
            }
        }
    }

    @Test
    public void testCorruptedLastCharacter() {
        String valid = "1A1zP1eP5QGefi2DMPTfTL5SLmv7DivfNa";
        String prefix = valid.substring(0, valid.length() - 1);
        for (char c : Base58.ALPHABET) {
            if (c == valid.charAt(valid.length() - 1))
                continue;
            try {
                Base58Check.decode(prefix + c);
                fail(String.valueOf(c));
            } catch (AddressFormatException.InvalidChecksum x) {
                // expected
            }
        }
        for (char c : new char[] { '0', 'O', 'I', 'l', '-' }) {
            try {
                Base58Check.decode(prefix + c);
                fail(String.valueOf(c));
            } catch (AddressFormatException.InvalidCharacter x) {
                // expected
            }
        }
    }

    @Test
    public void testEncodeDoesNotModifyInput() {
        byte[] payload = { 0, 1, 2, 3 };
        byte[] copy = Arrays.copyOf(payload, payload.length);
        Base58Check.encode(payload);
        assertArrayEquals(copy, payload);
    }
}
