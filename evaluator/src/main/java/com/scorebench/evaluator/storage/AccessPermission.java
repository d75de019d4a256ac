package com.scorebench.evaluator.storage;

/**
 * What a signed URL lets its holder do with one storage object.
 */
public enum AccessPermission {
    READ("GET"),
    WRITE("PUT");

    private final String httpMethod;

    AccessPermission(String httpMethod) {
        this.httpMethod = httpMethod;
    }

    public String httpMethod() {
        return httpMethod;
    }
}
