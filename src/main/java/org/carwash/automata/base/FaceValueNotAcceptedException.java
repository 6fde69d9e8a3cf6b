package org.carwash.automata.base;

/**
 * 投入的硬币面值不在自动机字母表中时抛出。
 */
public class FaceValueNotAcceptedException extends IllegalArgumentException {

    private final int faceValue;

    public FaceValueNotAcceptedException(int faceValue) {
        super("Automaton doesn't accept face value of " + faceValue);
        this.faceValue = faceValue;
    }

    public int getFaceValue() {
        return faceValue;
    }
}
