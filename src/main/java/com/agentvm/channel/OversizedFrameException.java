package com.agentvm.channel;

/**
 * A frame header declared a payload longer than the receiver accepts.
 * The payload is never read, so the stream position is lost and the channel must be closed.
 */
public class OversizedFrameException extends ProtocolException {

    private final int declaredLength;
    private final int maxLength;

    public OversizedFrameException(int declaredLength, int maxLength) {
        super("Declared payload length " + declaredLength + " exceeds maximum " + maxLength);
        this.declaredLength = declaredLength;
        this.maxLength = maxLength;
    }

    public int getDeclaredLength() { return declaredLength; }
    public int getMaxLength() { return maxLength; }
}
