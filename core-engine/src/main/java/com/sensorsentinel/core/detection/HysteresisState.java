package com.sensorsentinel.core.detection;

import java.io.Serializable;

/**
 * Consecutive-breach counter of one monitor.
 */
public class HysteresisState implements Serializable {

    private static final long serialVersionUID = 1L;

    private int consecutiveBreaches;

    /**
     * @param breach whether the latest score reached the threshold
     * @return the breach count after this observation
     */
    int record(boolean breach) {
        consecutiveBreaches = breach ? consecutiveBreaches + 1 : 0;
        return consecutiveBreaches;
    }

    public int getConsecutiveBreaches() {
        return consecutiveBreaches;
    }

    @Override
    public String toString() {
        return "HysteresisState{consecutiveBreaches=" + consecutiveBreaches + '}';
    }
}
