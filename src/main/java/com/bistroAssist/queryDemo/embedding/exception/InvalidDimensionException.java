package com.bistroAssist.queryDemo.embedding.exception;

public class InvalidDimensionException extends RuntimeException {

    public InvalidDimensionException(int expected, int actual) {
        super("Vector dimension mismatch: expected " + expected + ", got " + actual);
    }
}
