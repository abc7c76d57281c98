package com.nosota.landmarket.service;

/**
 * How a feature is being acquired.
 */
public enum AcquisitionPath {
    /**
     * Rationed campaign purchase, optionally paid at stability value to the owner.
     */
    LIMITED,

    /**
     * Purchase from the platform account, paid at stability value in the color resource.
     */
    PLATFORM_OWNED,

    /**
     * Immediate purchase of a listed peer-owned feature at its asking price.
     */
    PEER_IMMEDIATE,

    /**
     * Accepted buy request on a peer-owned feature, paid from escrow.
     */
    PEER_NEGOTIATED
}
