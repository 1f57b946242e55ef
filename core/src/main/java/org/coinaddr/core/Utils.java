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

import com.google.common.io.BaseEncoding;

/**
 * A collection of various utility methods that are helpful for working with encoded data.
 */
public class Utils {

    /** Hex encoding used throughout the library for printing and parsing hashes. */
    public static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    private Utils() {
    }

    /** Returns the number of zero bytes at the start of the given array. */
    public static int countLeadingZeros(byte[] bytes) {
        int zeros = 0;
        while (zeros < bytes.length && bytes[zeros] == 0)
            ++zeros;
        return zeros;
    }
}
