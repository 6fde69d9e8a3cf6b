package org.carwash.automata.base;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 洗车机自动机的输入字母表：可接受的硬币面值。
 * 所有外部输入都必须经过 {@link #of(int)} 才能进入自动机。
 */
public enum Coin {

    ONE(1),
    TWO(2),
    FIVE(5);

    private static final Logger logger = LoggerFactory.getLogger(Coin.class);

    private final int faceValue;

    Coin(int faceValue) {
        this.faceValue = faceValue;
    }

    public int getFaceValue() {
        return faceValue;
    }

    /**
     * 根据面值获取硬币。
     * @param faceValue 面值。
     * @return 对应的 Coin。
     * @throws FaceValueNotAcceptedException 如果字母表中没有该面值。
     */
    public static Coin of(int faceValue) {
        return switch (faceValue) {
            case 1 -> ONE;
            case 2 -> TWO;
            case 5 -> FIVE;
            default -> {
                logger.debug("拒绝了不被接受的面值: {}", faceValue);
                throw new FaceValueNotAcceptedException(faceValue);
            }
        };
    }

    @Override
    public String toString() {
        return Integer.toString(faceValue);
    }
}
