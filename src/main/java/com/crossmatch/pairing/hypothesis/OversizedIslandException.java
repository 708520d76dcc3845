package com.crossmatch.pairing.hypothesis;

/**
 * Thrown when an island holds more sources than hypothesis enumeration allows.
 */
public class OversizedIslandException extends RuntimeException {

    private final int islandIndex;
    private final int aCount;
    private final int bCount;
    private final int maxIslandSize;

    public OversizedIslandException(int islandIndex, int aCount, int bCount, int maxIslandSize) {
        super("Island " + islandIndex + " holds " + aCount + " catalogue a and " + bCount
                + " catalogue b sources, exceeding the enumeration bound of " + maxIslandSize);
        this.islandIndex = islandIndex;
        this.aCount = aCount;
        this.bCount = bCount;
        this.maxIslandSize = maxIslandSize;
    }

    public int getIslandIndex() {
        return islandIndex;
    }

    public int getACount() {
        return aCount;
    }

    public int getBCount() {
        return bCount;
    }

    public int getMaxIslandSize() {
        return maxIslandSize;
    }
}
