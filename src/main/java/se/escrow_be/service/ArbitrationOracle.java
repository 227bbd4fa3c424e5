package se.escrow_be.service;

import se.escrow_be.dto.oracle.ArbitrationRequest;
import se.escrow_be.dto.oracle.OracleVerdict;
import se.escrow_be.exception.ExternalOracleException;

/**
 * External arbiter of disputes. Implementations may block; callers never hold a room lock.
 */
public interface ArbitrationOracle {

    /**
     * @throws ExternalOracleException when no usable verdict could be obtained
     */
    OracleVerdict arbitrate(ArbitrationRequest request);
}
