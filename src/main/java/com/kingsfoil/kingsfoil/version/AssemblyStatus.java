package com.kingsfoil.kingsfoil.version;

import java.util.List;

/**
 * Progress of a multi-part version: which part indexes have arrived out of how many.
 */
public record AssemblyStatus(int partsReceived, int partsExpected, List<Integer> receivedPartIndexes, boolean complete) {

    public AssemblyStatus {
        receivedPartIndexes = receivedPartIndexes == null ? List.of() : List.copyOf(receivedPartIndexes);
    }
}
