package com.imageanalysis.query;

public class ResultNotFoundException extends RuntimeException {

    public ResultNotFoundException(String id) {
        super("Result not found: " + id);
    }
}
