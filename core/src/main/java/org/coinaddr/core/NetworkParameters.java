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

import com.google.common.base.Objects;
import org.coinaddr.crypto.KeyHasher;
import org.coinaddr.params.MainNetParams;
import org.coinaddr.params.TestNet3Params;

import javax.annotation.Nullable;

/**
 * <p>NetworkParameters contains the data needed for encoding and validating the addresses of one network.</p>
 *
 * <p>This is an abstract class, concrete instantiations can be found in the params package: one for the main
 * network ({@link MainNetParams}) and one for the public test network ({@link TestNet3Params}).</p>
 */
public abstract class NetworkParameters {
    /** The string returned by getId() for the main, production network where people trade things. */
    public static final String ID_MAINNET = "org.bitcoin.production";
    /** The string returned by getId() for the testnet. */
    public static final String ID_TESTNET = "org.bitcoin.test";

    protected String id;
    protected int addressHeader;
    protected int maxAddressVersion;
    protected KeyHasher keyHasher;

    protected NetworkParameters() {
    }

    /** Returns the network parameters for the given string ID or NULL if not recognized. */
    @Nullable
    public static NetworkParameters fromID(String id) {
        if (id.equals(ID_MAINNET)) {
            return MainNetParams.get();
        } else if (id.equals(ID_TESTNET)) {
            return TestNet3Params.get();
        } else {
            return null;
        }
    }

    /**
     * A Java package style string acting as unique ID for these parameters
     */
    public String getId() {
        return id;
    }

    /**
     * First byte of a base58 encoded address. This is the version byte written when an address is created for
     * this network.
     */
    public int getAddressHeader() {
        return addressHeader;
    }

    /**
     * Highest version byte accepted when decoding an address for this network. Any version from zero up to and
     * including this value is accepted.
     */
    public int getMaxAddressVersion() {
        return maxAddressVersion;
    }

    /** The function reducing a public key to the hash an address carries. */
    public KeyHasher getKeyHasher() {
        return keyHasher;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return getId().equals(((NetworkParameters) o).getId());
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(getId());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
