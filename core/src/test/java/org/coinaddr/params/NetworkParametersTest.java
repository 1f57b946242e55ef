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

package org.coinaddr.params;

import org.coinaddr.core.NetworkParameters;
import org.coinaddr.crypto.KeyHashers;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

public class NetworkParametersTest {

    @Test
    public void fromID() {
        assertSame(MainNetParams.get(), NetworkParameters.fromID(NetworkParameters.ID_MAINNET));
        assertSame(TestNet3Params.get(), NetworkParameters.fromID(NetworkParameters.ID_TESTNET));
        assertNull(NetworkParameters.fromID("org.example.unknown"));
    }

    @Test
    public void mainNet() {
        MainNetParams params = MainNetParams.get();
        assertEquals(0, params.getAddressHeader());
        assertEquals(0, params.getMaxAddressVersion());
        assertEquals(KeyHashers.SHA256_RIPEMD160, params.getKeyHasher());
    }

    @Test
    public void testNet() {
        TestNet3Params params = TestNet3Params.get();
        assertEquals(111, params.getAddressHeader());
        assertEquals(111, params.getMaxAddressVersion());
    }

    @Test
    public void equality() {
        assertEquals(new MainNetParams(), MainNetParams.get());
        assertNotEquals(MainNetParams.get(), TestNet3Params.get());
    }
}
