package com.deployguard.baseline;

public class BaselineNotFoundException extends RuntimeException {
    public BaselineNotFoundException(String name, Integer version) {
        super(version == null
                ? "No baseline named '" + name + "'"
                : "No version " + version + " of baseline '" + name + "'");
    }
}
