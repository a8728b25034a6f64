package com.mwor.oracle;

import java.time.LocalDate;

/**
 * External verifiable randomness source.
 */
public interface VrfOracleClient {

    /**
     * Returns fulfilled randomness for the given purpose and UTC day. Implementations may block on
     * network I/O; callers bound the wait.
     */
    VrfOracleResult requestRandomness(String purpose, LocalDate day);

    String describe();
}
