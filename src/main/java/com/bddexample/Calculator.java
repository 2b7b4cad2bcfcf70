package com.bddexample;

/**
 * 累加器计算器 - 持有一个整数值，加减运算直接修改该值
 *
 * 溢出按 int 补码回绕处理，不抛异常
 */
public class Calculator {

    private int value;

    public int getValue() {
        return value;
    }

    /**
     * 设置累加器的初始值
     *
     * @param value 新的累加器值
     */
    public void setValue(int value) {
        this.value = value;
    }

    /**
     * 加法运算
     *
     * @param n 加数
     * @return 相加后的累加器值
     */
    public int add(int n) {
        value += n;
        return value;
    }

    /**
     * 减法运算
     *
     * @param n 减数
     * @return 相减后的累加器值
     */
    public int subtract(int n) {
        value -= n;
        return value;
    }
}
