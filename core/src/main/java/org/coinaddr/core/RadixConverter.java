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

import java.math.BigInteger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Converts between big-endian byte arrays and base-58 digit values. Digits are plain values in {@code [0, 57]}, not
 * alphabet characters, and leading zero bytes are not represented: they carry no magnitude, so {@link Base58}
 * accounts for them itself.
 */
public final class RadixConverter {
    /** The radix of the digits produced and consumed here. */
    public static final int RADIX = 58;

    private static final BigInteger BIG_RADIX = BigInteger.valueOf(RADIX);
    private static final int[] NO_DIGITS = new int[0];
    private static final byte[] NO_BYTES = new byte[0];

    private RadixConverter() {
    }

    /**
     * Interprets the input as an unsigned big-endian magnitude and returns its base-58 digits, least significant
     * digit first. A zero magnitude, including the empty array, yields no digits.
     */
    public static int[] bytesToDigits(byte[] buf) {
        BigInteger magnitude = new BigInteger(1, checkNotNull(buf));
        if (magnitude.signum() == 0)
            return NO_DIGITS;
        // 256 = 58^1.37 so each input byte produces at most 1.37 digits.
        int[] digits = new int[buf.length * 138 / 100 + 1];
        int count = 0;
        while (magnitude.signum() > 0) {
            BigInteger[] quotientAndRemainder = magnitude.divideAndRemainder(BIG_RADIX);
            digits[count++] = quotientAndRemainder[1].intValue();
            magnitude = quotientAndRemainder[0];
        }
        int[] result = new int[count];
        System.arraycopy(digits, 0, result, 0, count);
        return result;
    }

    /**
     * Accumulates base-58 digits, most significant first, into a magnitude and returns its minimal big-endian
     * encoding. A zero magnitude yields an empty array.
     *
     * @throws IllegalArgumentException if a digit is outside {@code [0, 57]}
     */
    public static byte[] digitsToBytes(int[] digits) {
        BigInteger magnitude = BigInteger.ZERO;
        for (int digit : checkNotNull(digits)) {
            checkArgument(digit >= 0 && digit < RADIX, "Digit out of range: %s", digit);
            magnitude = magnitude.multiply(BIG_RADIX).add(BigInteger.valueOf(digit));
        }
        return toUnsignedBytes(magnitude);
    }

    static byte[] toUnsignedBytes(BigInteger magnitude) {
        if (magnitude.signum() == 0)
            return NO_BYTES;
        byte[] bytes = magnitude.toByteArray();
        // Strip the sign byte BigInteger adds when the top bit is set.
        if (bytes[0] == 0) {
            byte[] stripped = new byte[bytes.length - 1];
            System.arraycopy(bytes, 1, stripped, 0, stripped.length);
            return stripped;
        }
        return bytes;
    }
}
