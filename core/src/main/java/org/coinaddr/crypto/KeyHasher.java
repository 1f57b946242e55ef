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

/**
 * Reduces a public key of any encoding to the 160-bit hash an {@link org.coinaddr.core.Address} carries.
 * Implementations must be deterministic and safe to call from any thread.
 */
public interface KeyHasher {
    /** Returns the 160-bit hash of the given public key bytes. */
    Hash160 hash160(byte[] pubKey);
}
