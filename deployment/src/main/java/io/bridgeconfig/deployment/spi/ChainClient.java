package io.bridgeconfig.deployment.spi;

import io.bridgeconfig.deployment.model.ContractInfo;

/**
 * SPI over an external chain client library. Implementations report which chain the client
 * is connected to and turn a {@link ContractInfo} into an executable contract handle of that
 * library.
 *
 * <p>
 * This module never talks to a chain itself; it only selects the manifest entries for the
 * client's chain and hands them to {@link #bind}.
 *
 * @param <C> the client library's contract handle type
 */
public interface ChainClient<C> {

    /** Chain id of the chain the client is connected to. */
    long chainId();

    /**
     * Creates a contract handle.
     *
     * @param name contract name from the manifest
     * @param info address, deployment block and ABI of the contract on this chain
     */
    C bind(String name, ContractInfo info);
}
