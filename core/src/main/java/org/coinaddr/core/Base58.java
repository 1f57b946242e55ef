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

import com.google.common.base.CharMatcher;

import java.math.BigInteger;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Base58 is a way to encode addresses (or arbitrary data) as alphanumeric strings.
 * <p>
 * Note that this is not the same base58 as used by Flickr, which you may find referenced around the Internet.
 * <p>
 * You may want to consider working with {@link Base58Check} or {@link Address} instead, which add a checksum and a
 * version byte on top of the plain encoding.
 * <p>
 * Satoshi explains: why base-58 instead of standard base-64 encoding?
 * <ul>
 * <li>Don't want 0OIl characters that look the same in some fonts and
 *     could be used to create visually identical looking account numbers.</li>
 * <li>A string with non-alphanumeric characters is not as easily accepted as an account number.</li>
 * <li>E-mail usually won't line-break if there's no punctuation to break at.</li>
 * <li>Doubleclicking selects the whole number as one word if it's all alphanumeric.</li>
 * </ul>
 * <p>
 * However, note that the encoding/decoding runs in O(n&sup2;) time, so it is not useful for large data.
 * <p>
 * The basic idea of the encoding is to treat the data bytes as a large number represented using
 * base-256 digits, convert the number to be represented using base-58 digits, preserve the exact
 * number of leading zeros (which are otherwise lost during the mathematical operations on the
 * numbers), and finally represent the resulting base-58 digits as alphanumeric ASCII characters.
 * <p>
 * When decoding, whitespace before the first character and after the last one is ignored.
 */
public class Base58 {
    public static final char[] ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz".toCharArray();
    private static final char ENCODED_ZERO = ALPHABET[0];
    private static final int[] INDEXES = new int[128];
    static {
        Arrays.fill(INDEXES, -1);
        for (int i = 0; i < ALPHABET.length; i++) {
            INDEXES[ALPHABET[i]] = i;
        }
    }

    // The characters C's isspace() accepts.
    private static final CharMatcher WHITESPACE = CharMatcher.anyOf(" \t\n\r\f\u000B");

    private Base58() {
    }

    /**
     * Encodes the given bytes as a base58 string (no checksum is appended).
     *
     * @param input the bytes to encode
     * @return the base58-encoded string
     */
    public static String encode(byte[] input) {
        if (checkNotNull(input).length == 0) {
            return "";
        }
        int[] digits = RadixConverter.bytesToDigits(input);
        int zeros = Utils.countLeadingZeros(input);
        char[] encoded = new char[zeros + digits.length];
        Arrays.fill(encoded, 0, zeros, ENCODED_ZERO);
        // Digits come least significant first, text is most significant first.
        for (int i = 0; i < digits.length; i++) {
            encoded[encoded.length - 1 - i] = ALPHABET[digits[i]];
        }
        return new String(encoded);
    }

    /**
     * Decodes the given base58 string into the original data bytes.
     *
     * @param input the base58-encoded string to decode
     * @return the decoded data bytes, empty if the input is empty or only whitespace
     * @throws AddressFormatException.InvalidCharacter if a character other than trailing whitespace is not part of
     *         the alphabet
     */
    public static byte[] decode(String input) throws AddressFormatException {
        int[] digits = toDigits(input);
        // Count leading zeros.
        int zeros = 0;
        while (zeros < digits.length && digits[zeros] == 0) {
            ++zeros;
        }
        byte[] magnitude = RadixConverter.digitsToBytes(digits);
        byte[] decoded = new byte[zeros + magnitude.length];
        System.arraycopy(magnitude, 0, decoded, zeros, magnitude.length);
        return decoded;
    }

    /**
     * Decodes the given base58 string into the number it represents, ignoring leading zeros.
     */
    public static BigInteger decodeToBigInteger(String input) throws AddressFormatException {
        return new BigInteger(1, decode(input));
    }

    /** Returns true if the given character is part of the base58 alphabet. */
    public static boolean isBase58Char(char c) {
        return c < 128 && INDEXES[c] >= 0;
    }

    /**
     * Maps the characters of the input to digit values, most significant first, after skipping leading whitespace.
     * Scanning stops at the first character outside the alphabet, which must begin a run of whitespace that lasts to
     * the end of the input.
     */
    private static int[] toDigits(String input) {
        checkNotNull(input);
        int start = WHITESPACE.negate().indexIn(input);
        if (start < 0) {
            return new int[0];
        }
        int[] digits = new int[input.length() - start];
        int count = 0;
        for (int i = start; i < input.length(); ++i) {
            char c = input.charAt(i);
            if (!isBase58Char(c)) {
                if (WHITESPACE.negate().indexIn(input, i) >= 0) {
                    throw new AddressFormatException.InvalidCharacter(c, i);
                }
                break;
            }
            digits[count++] = INDEXES[c];
        }
        return Arrays.copyOf(digits, count);
    }
}
