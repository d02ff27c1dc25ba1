package org.pragmatica.gingerbread.ast.validation;

public enum ValidationErrorKind {
    INT_LITERAL_TOO_BIG("integer literal too large");

    private final String message;

    ValidationErrorKind(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
