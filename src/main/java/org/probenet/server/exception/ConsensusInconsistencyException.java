package org.probenet.server.exception;

/**
 * Signals a broken voting invariant. Candidate details are only written to the error log.
 */
@SuppressWarnings("serial")
public class ConsensusInconsistencyException extends GeoIpException {

    public ConsensusInconsistencyException() {
        super("Internal error while resolving geo location");
    }
}
