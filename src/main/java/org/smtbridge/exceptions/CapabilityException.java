package org.smtbridge.exceptions;

import lombok.Getter;

/**
 * 问题需要的特性不被所选求解器支持。在发送任何查询之前抛出。
 */
@Getter
public class CapabilityException extends SmtBridgeException {

    private final String feature;
    private final String solver;

    public CapabilityException(String feature, String solver) {
        super("Given problem needs " + feature + "\n"
                + "*** Which is not supported for the chosen solver: " + solver);
        this.feature = feature;
        this.solver = solver;
    }
}
