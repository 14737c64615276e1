package com.deepansh.kitchen.exception;

/**
 * The dependency table is malformed (e.g. cyclic). A deployment defect:
 * user input can never trigger it.
 */
public class PlannerConfigurationException extends KitchenAssistantException {

    public PlannerConfigurationException(String message) {
        super(message);
    }
}
