package com.tradearena.backend.exception;

import lombok.Getter;

@Getter
public class ExternalDependencyException extends SettlementException {

    private final String dependency;

    public ExternalDependencyException(String dependency, String message) {
        super(message);
        this.dependency = dependency;
    }

    public ExternalDependencyException(String dependency, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
    }
}
